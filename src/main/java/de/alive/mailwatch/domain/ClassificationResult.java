package de.alive.mailwatch.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassificationResult(
        @JsonProperty("classification") String classification,
        @JsonProperty("reason") String reason,
        @JsonProperty("advice") String advice
) {

    public static final String PHISHING = "phishing";
    public static final String LEGITIMATE = "legitimate";

    public ClassificationResult {
        classification = classification == null ? "" : classification.trim().toLowerCase(Locale.ROOT);
        reason = reason == null ? "" : reason;
        advice = advice == null ? "" : advice;
    }

    public boolean isPhishing() {
        return PHISHING.equals(classification);
    }
}
