package de.alive.mailwatch.service.config;

import java.util.List;

public record OAuthSettings(
        boolean enabled,
        String clientId,
        String clientSecret,
        String authorizationUrl,
        String tokenUrl,
        List<String> scopes,
        int callbackPort,
        boolean interactive
) {

    public static OAuthSettings disabled() {
        return new OAuthSettings(false, "", "", "", "", List.of(), 8080, false);
    }

    public OAuthSettings {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        if (enabled) {
            if (isBlank(clientId) || isBlank(clientSecret)) {
                throw new IllegalArgumentException("OAuth client id and secret must be set when OAuth is enabled");
            }
            if (isBlank(authorizationUrl) || isBlank(tokenUrl)) {
                throw new IllegalArgumentException("OAuth authorization and token URLs must be set when OAuth is enabled");
            }
            if (scopes.isEmpty()) {
                throw new IllegalArgumentException("OAuth scope must be set when OAuth is enabled");
            }
            if (callbackPort <= 0 || callbackPort > 65535) {
                throw new IllegalArgumentException("OAuth callback port out of range: " + callbackPort);
            }
        }
    }

    public String redirectUri() {
        return "http://localhost:" + callbackPort + "/callback";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
