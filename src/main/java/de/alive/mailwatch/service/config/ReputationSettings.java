package de.alive.mailwatch.service.config;

import java.util.List;

/**
 * Raw dangerous and safe sender entries: exact addresses or {@code @domain} wildcards.
 */
public record ReputationSettings(List<String> dangerousSenders, List<String> safeSenders) {

    public static ReputationSettings empty() {
        return new ReputationSettings(List.of(), List.of());
    }

    public ReputationSettings {
        dangerousSenders = dangerousSenders == null ? List.of() : List.copyOf(dangerousSenders);
        safeSenders = safeSenders == null ? List.of() : List.copyOf(safeSenders);
    }
}
