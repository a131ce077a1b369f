package de.alive.mailwatch.service.config;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Builder(toBuilder = true)
public class ProcessingConfiguration {

    // Long-poll and keepalive
    private final Duration idleTimeout;
    private final Duration keepaliveInterval;

    // Reconnect backoff
    private final Duration initialBackoff;
    private final Duration maxBackoff;

    // Outbound HTTP (token endpoint, classifier, notifier)
    private final Duration httpTimeout;
    private final Duration notificationTimeout;
    private final Duration authorizationTimeout;

    // Socket timeouts for the IMAP connection
    private final Duration connectionTimeout;

    // Ledger and token files live here
    private final Path dataDirectory;

    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofSeconds(120);
    public static final Duration DEFAULT_KEEPALIVE_INTERVAL = Duration.ofSeconds(600);
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(5);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(300);
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_NOTIFICATION_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_AUTHORIZATION_TIMEOUT = Duration.ofMinutes(5);
    public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
    public static final Path DEFAULT_DATA_DIRECTORY = Path.of(".data");

    public static ProcessingConfiguration forProduction() {
        return ProcessingConfiguration.builder()
                .idleTimeout(DEFAULT_IDLE_TIMEOUT)
                .keepaliveInterval(DEFAULT_KEEPALIVE_INTERVAL)
                .initialBackoff(DEFAULT_INITIAL_BACKOFF)
                .maxBackoff(DEFAULT_MAX_BACKOFF)
                .httpTimeout(DEFAULT_HTTP_TIMEOUT)
                .notificationTimeout(DEFAULT_NOTIFICATION_TIMEOUT)
                .authorizationTimeout(DEFAULT_AUTHORIZATION_TIMEOUT)
                .connectionTimeout(DEFAULT_CONNECTION_TIMEOUT)
                .dataDirectory(DEFAULT_DATA_DIRECTORY)
                .build();
    }

    public static ProcessingConfiguration forTesting(Path dataDirectory) {
        return forProduction().toBuilder()
                .httpTimeout(Duration.ofSeconds(5))
                .authorizationTimeout(Duration.ofSeconds(10))
                .dataDirectory(dataDirectory)
                .build();
    }

    public void validate() {
        requirePositive(idleTimeout, "Idle timeout");
        requirePositive(keepaliveInterval, "Keepalive interval");
        requirePositive(initialBackoff, "Initial backoff");
        requirePositive(maxBackoff, "Max backoff");
        requirePositive(httpTimeout, "HTTP timeout");
        requirePositive(notificationTimeout, "Notification timeout");
        requirePositive(authorizationTimeout, "Authorization timeout");
        requirePositive(connectionTimeout, "Connection timeout");
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff must not be shorter than initial backoff");
        }
        if (dataDirectory == null) {
            throw new IllegalArgumentException("Data directory cannot be null");
        }
    }

    public String getConfigurationSummary() {
        return String.format(
                "Idle: %ds, Keepalive: %ds, Backoff: %ds..%ds, HTTP: %ds, Data: %s",
                idleTimeout.toSeconds(), keepaliveInterval.toSeconds(),
                initialBackoff.toSeconds(), maxBackoff.toSeconds(),
                httpTimeout.toSeconds(), dataDirectory
        );
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
