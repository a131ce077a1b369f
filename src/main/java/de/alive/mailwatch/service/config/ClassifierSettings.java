package de.alive.mailwatch.service.config;

public record ClassifierSettings(String endpoint, String model, String token) {

    public ClassifierSettings {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Classifier endpoint cannot be null or empty");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Classifier model cannot be null or empty");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("Classifier token cannot be null or empty");
        }
        endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
    }
}
