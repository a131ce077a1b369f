package de.alive.mailwatch.service;

import de.alive.mailwatch.Configuration;
import de.alive.mailwatch.exception.ConfigurationException;
import de.alive.mailwatch.reputation.ReputationEntry;
import de.alive.mailwatch.reputation.ReputationTag;
import de.alive.mailwatch.service.config.ClassifierSettings;
import de.alive.mailwatch.service.config.EncryptionMethod;
import de.alive.mailwatch.service.config.ImapSettings;
import de.alive.mailwatch.service.config.NotificationSettings;
import de.alive.mailwatch.service.config.OAuthSettings;
import de.alive.mailwatch.service.config.ProcessingConfiguration;
import de.alive.mailwatch.service.config.ReputationSettings;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the environment-style key/value surface into an immutable {@link Configuration}.
 */
@Slf4j
public class ConfigurationService {

    static final String LOG_LEVEL_ENV = "LOG_LEVEL";

    static final String IMAP_HOST_ENV = "IMAP_HOST";
    static final String IMAP_PORT_ENV = "IMAP_PORT";
    static final String IMAP_ENCRYPTION_ENV = "IMAP_ENCRYPTION_METHOD";
    static final String IMAP_USER_ENV = "IMAP_USER";
    static final String IMAP_PASS_ENV = "IMAP_PASS";
    static final String MAILBOX_ENV = "IMAP_MAILBOX";
    static final String MOVE_TO_FOLDER_ENV = "MOVE_TO_FOLDER";

    static final String USE_OAUTH_ENV = "USE_OAUTH";
    static final String OAUTH_CLIENT_ID_ENV = "OAUTH_CLIENT_ID";
    static final String OAUTH_CLIENT_SECRET_ENV = "OAUTH_CLIENT_SECRET";
    static final String OAUTH_AUTH_URL_ENV = "OAUTH_AUTH_URL";
    static final String OAUTH_TOKEN_URL_ENV = "OAUTH_TOKEN_URL";
    static final String OAUTH_SCOPE_ENV = "OAUTH_SCOPE";
    static final String OAUTH_CALLBACK_PORT_ENV = "OAUTH_CALLBACK_PORT";
    static final String OAUTH_INTERACTIVE_ENV = "OAUTH_INTERACTIVE";

    static final String DANGEROUS_SENDERS_ENV = "DANGEROUS_SENDERS";
    static final String SAFE_SENDERS_ENV = "SAFE_SENDERS";

    static final String AI_ENDPOINT_ENV = "AI_ENDPOINT";
    static final String AI_MODEL_ENV = "AI_MODEL";
    static final String AI_TOKEN_ENV = "AI_TOKEN";
    static final String GITHUB_TOKEN_ENV = "GITHUB_TOKEN";

    static final String NTFY_URL_ENV = "NTFY_URL";
    static final String NTFY_TOPIC_ENV = "NTFY_TOPIC";
    static final String NTFY_TITLE_ENV = "NTFY_TITLE";
    static final String NOTIFY_ON_ENV = "NOTIFY_ON";

    static final String DATA_DIR_ENV = "DATA_DIR";
    static final String IDLE_TIMEOUT_ENV = "IDLE_TIMEOUT_SECONDS";
    static final String KEEPALIVE_INTERVAL_ENV = "KEEPALIVE_INTERVAL_SECONDS";
    static final String INITIAL_BACKOFF_ENV = "INITIAL_BACKOFF_SECONDS";
    static final String MAX_BACKOFF_ENV = "MAX_BACKOFF_SECONDS";
    static final String HTTP_TIMEOUT_ENV = "HTTP_TIMEOUT_SECONDS";

    private static final String DEFAULT_IMAP_PORT = "993";
    private static final String DEFAULT_MAILBOX = "INBOX";
    private static final String DEFAULT_AI_ENDPOINT = "https://models.github.ai/inference";
    private static final String DEFAULT_AI_MODEL = "openai/gpt-4.1";
    private static final String DEFAULT_CALLBACK_PORT = "8080";
    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

    private final Map<String, String> environment;

    public ConfigurationService() {
        this(System.getenv());
    }

    public ConfigurationService(Map<String, String> environment) {
        this.environment = Map.copyOf(environment);
    }

    public Configuration loadConfiguration() {
        log.info("{} Loading configuration...", LogUtils.PROCESS_EMOJI);

        validateLogLevel();

        ImapSettings imap = buildSettings(IMAP_HOST_ENV, () -> new ImapSettings(
                getRequiredEnvironmentVariable(IMAP_HOST_ENV),
                getInt(IMAP_PORT_ENV, DEFAULT_IMAP_PORT),
                getEncryptionMethod(),
                getRequiredEnvironmentVariable(IMAP_USER_ENV),
                getEnvironmentVariable(IMAP_PASS_ENV).orElse(null),
                getEnvironmentVariable(MAILBOX_ENV).orElse(DEFAULT_MAILBOX),
                getEnvironmentVariable(MOVE_TO_FOLDER_ENV).orElse(null)
        ));

        OAuthSettings oauth = buildSettings(USE_OAUTH_ENV, () -> new OAuthSettings(
                getBoolean(USE_OAUTH_ENV, false),
                getEnvironmentVariable(OAUTH_CLIENT_ID_ENV).orElse(""),
                getEnvironmentVariable(OAUTH_CLIENT_SECRET_ENV).orElse(""),
                getEnvironmentVariable(OAUTH_AUTH_URL_ENV).orElse(""),
                getEnvironmentVariable(OAUTH_TOKEN_URL_ENV).orElse(""),
                getList(OAUTH_SCOPE_ENV),
                getInt(OAUTH_CALLBACK_PORT_ENV, DEFAULT_CALLBACK_PORT),
                getBoolean(OAUTH_INTERACTIVE_ENV, true)
        ));

        ReputationSettings reputation = new ReputationSettings(
                getSenderList(DANGEROUS_SENDERS_ENV, ReputationTag.DANGEROUS),
                getSenderList(SAFE_SENDERS_ENV, ReputationTag.SAFE)
        );

        ClassifierSettings classifier = buildSettings(AI_TOKEN_ENV, () -> new ClassifierSettings(
                getEnvironmentVariable(AI_ENDPOINT_ENV).orElse(DEFAULT_AI_ENDPOINT),
                getEnvironmentVariable(AI_MODEL_ENV).orElse(DEFAULT_AI_MODEL),
                getEnvironmentVariable(AI_TOKEN_ENV)
                        .or(() -> getEnvironmentVariable(GITHUB_TOKEN_ENV))
                        .orElseThrow(() -> missing(AI_TOKEN_ENV))
        ));

        NotificationSettings notification = new NotificationSettings(
                getEnvironmentVariable(NTFY_URL_ENV).orElse(null),
                getEnvironmentVariable(NTFY_TOPIC_ENV).orElse(""),
                getEnvironmentVariable(NTFY_TITLE_ENV).orElse(null),
                new LinkedHashSet<>(getList(NOTIFY_ON_ENV).isEmpty()
                        ? List.of("phishing")
                        : getList(NOTIFY_ON_ENV).stream()
                                .map(value -> value.toLowerCase(Locale.ROOT))
                                .collect(Collectors.toList()))
        );

        ProcessingConfiguration processing = ProcessingConfiguration.forProduction().toBuilder()
                .dataDirectory(getEnvironmentVariable(DATA_DIR_ENV)
                        .map(Path::of)
                        .orElse(ProcessingConfiguration.DEFAULT_DATA_DIRECTORY))
                .idleTimeout(getSeconds(IDLE_TIMEOUT_ENV, ProcessingConfiguration.DEFAULT_IDLE_TIMEOUT))
                .keepaliveInterval(getSeconds(KEEPALIVE_INTERVAL_ENV, ProcessingConfiguration.DEFAULT_KEEPALIVE_INTERVAL))
                .initialBackoff(getSeconds(INITIAL_BACKOFF_ENV, ProcessingConfiguration.DEFAULT_INITIAL_BACKOFF))
                .maxBackoff(getSeconds(MAX_BACKOFF_ENV, ProcessingConfiguration.DEFAULT_MAX_BACKOFF))
                .httpTimeout(getSeconds(HTTP_TIMEOUT_ENV, ProcessingConfiguration.DEFAULT_HTTP_TIMEOUT))
                .build();

        Configuration configuration = buildSettings("CONFIGURATION", () -> new Configuration(
                imap, oauth, reputation, classifier, notification, processing));

        warnAboutDisabledFeatures(configuration);

        log.info("{} Configuration loaded for {} on {}:{} ({}), folder '{}'",
                LogUtils.SUCCESS_EMOJI,
                LogUtils.maskEmail(imap.username()),
                imap.host(), imap.port(), imap.encryption(), imap.mailbox());
        log.debug("Processing configuration: {}", processing.getConfigurationSummary());

        return configuration;
    }

    private void warnAboutDisabledFeatures(Configuration configuration) {
        if (!configuration.notification().isEnabled()) {
            log.warn("{} {} is not set, notifications will not be sent",
                    LogUtils.WARNING_EMOJI, NTFY_TOPIC_ENV);
        }
        if (configuration.imap().moveDestination().isEmpty()) {
            log.warn("{} {} is not set, emails will not be moved after processing",
                    LogUtils.WARNING_EMOJI, MOVE_TO_FOLDER_ENV);
        }
    }

    private void validateLogLevel() {
        String level = getEnvironmentVariable(LOG_LEVEL_ENV).orElse("INFO").toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(level)) {
            throw new ConfigurationException(
                    String.format("Invalid %s: %s. Must be one of %s", LOG_LEVEL_ENV, level, LOG_LEVELS),
                    LOG_LEVEL_ENV,
                    ConfigurationException.ConfigurationType.INVALID_VALUE
            );
        }
    }

    private <T> T buildSettings(String key, SettingsFactory<T> factory) {
        try {
            return factory.create();
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE, e);
        }
    }

    private EncryptionMethod getEncryptionMethod() {
        String value = getEnvironmentVariable(IMAP_ENCRYPTION_ENV).orElse(EncryptionMethod.SSL.name());
        try {
            return EncryptionMethod.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    String.format("Invalid %s: %s. Must be one of %s",
                            IMAP_ENCRYPTION_ENV, value, Arrays.toString(EncryptionMethod.values())),
                    IMAP_ENCRYPTION_ENV,
                    ConfigurationException.ConfigurationType.CONNECTION_SETTINGS,
                    e
            );
        }
    }

    private int getInt(String key, String defaultValue) {
        String value = getEnvironmentVariable(key).orElse(defaultValue);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                    String.format("Environment variable '%s' is not a number: %s", key, value),
                    key,
                    ConfigurationException.ConfigurationType.INVALID_VALUE,
                    e
            );
        }
    }

    private Duration getSeconds(String key, Duration defaultValue) {
        return getEnvironmentVariable(key)
                .map(value -> Duration.ofSeconds(getInt(key, value)))
                .orElse(defaultValue);
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        return getEnvironmentVariable(key)
                .map(value -> value.trim().equalsIgnoreCase("true"))
                .orElse(defaultValue);
    }

    private List<String> getList(String key) {
        return getEnvironmentVariable(key)
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(entry -> !entry.isEmpty())
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }

    private List<String> getSenderList(String key, ReputationTag tag) {
        List<String> entries = getList(key);
        return buildSettings(key, () -> {
            entries.forEach(entry -> ReputationEntry.parse(entry, tag));
            return entries;
        });
    }

    private String getRequiredEnvironmentVariable(String key) {
        return getEnvironmentVariable(key).orElseThrow(() -> missing(key));
    }

    private ConfigurationException missing(String key) {
        return new ConfigurationException(
                String.format("Required environment variable '%s' is not set", key),
                key,
                ConfigurationException.ConfigurationType.MISSING_ENVIRONMENT_VARIABLE
        );
    }

    private Optional<String> getEnvironmentVariable(String key) {
        String value = environment.get(key);
        return Optional.ofNullable(value)
                .filter(v -> !v.trim().isEmpty());
    }

    @FunctionalInterface
    private interface SettingsFactory<T> {
        T create();
    }
}
