package de.alive.mailwatch;

import de.alive.mailwatch.service.config.ClassifierSettings;
import de.alive.mailwatch.service.config.ImapSettings;
import de.alive.mailwatch.service.config.NotificationSettings;
import de.alive.mailwatch.service.config.OAuthSettings;
import de.alive.mailwatch.service.config.ProcessingConfiguration;
import de.alive.mailwatch.service.config.ReputationSettings;

/**
 * Main configuration record, read once at startup and handed to constructors.
 */
public record Configuration(
        ImapSettings imap,
        OAuthSettings oauth,
        ReputationSettings reputation,
        ClassifierSettings classifier,
        NotificationSettings notification,
        ProcessingConfiguration processingConfig
) {

    public Configuration {
        if (imap == null) {
            throw new IllegalArgumentException("IMAP settings cannot be null");
        }
        if (oauth == null) {
            oauth = OAuthSettings.disabled();
        }
        if (reputation == null) {
            reputation = ReputationSettings.empty();
        }
        if (classifier == null) {
            throw new IllegalArgumentException("Classifier settings cannot be null");
        }
        if (notification == null) {
            throw new IllegalArgumentException("Notification settings cannot be null");
        }
        if (processingConfig == null) {
            throw new IllegalArgumentException("Processing configuration cannot be null");
        }
        if (!oauth.enabled() && (imap.password() == null || imap.password().isEmpty())) {
            throw new IllegalArgumentException("IMAP password must be set when OAuth is disabled");
        }
        processingConfig.validate();
    }
}
