package de.alive.mailwatch;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.alive.mailwatch.auth.AuthorizationCallbackServer;
import de.alive.mailwatch.auth.CredentialProvider;
import de.alive.mailwatch.auth.OAuthCredentialProvider;
import de.alive.mailwatch.auth.PasswordCredentialProvider;
import de.alive.mailwatch.auth.TokenEndpointClient;
import de.alive.mailwatch.auth.TokenManager;
import de.alive.mailwatch.auth.TokenStore;
import de.alive.mailwatch.infrastructure.EmailContentExtractor;
import de.alive.mailwatch.infrastructure.ImapConnectionManager;
import de.alive.mailwatch.infrastructure.WebClientFactory;
import de.alive.mailwatch.ledger.JsonFileLedger;
import de.alive.mailwatch.ledger.ProcessedMessageLedger;
import de.alive.mailwatch.reputation.SenderReputationFilter;
import de.alive.mailwatch.service.ChatCompletionClassifier;
import de.alive.mailwatch.service.NtfyNotifier;
import de.alive.mailwatch.service.config.ImapSettings;
import de.alive.mailwatch.service.config.OAuthSettings;
import de.alive.mailwatch.service.config.ProcessingConfiguration;
import de.alive.mailwatch.session.MessageProcessor;
import de.alive.mailwatch.session.SessionManager;
import de.alive.mailwatch.util.JsonMapperFactory;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the object graph from a {@link Configuration} and runs the session loop.
 */
@Slf4j
public class MailWatchApplication {

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final SessionManager sessionManager;

    public MailWatchApplication(Configuration configuration) {
        ImapSettings imap = configuration.imap();
        ProcessingConfiguration processing = configuration.processingConfig();
        ObjectMapper objectMapper = JsonMapperFactory.create();
        WebClient webClient = WebClientFactory.create(processing.getHttpTimeout());

        ProcessedMessageLedger ledger = new JsonFileLedger(processing.getDataDirectory(), objectMapper);
        EmailContentExtractor parser = new EmailContentExtractor();
        MessageProcessor processor = new MessageProcessor(
                parser,
                new SenderReputationFilter(configuration.reputation()),
                new ChatCompletionClassifier(configuration.classifier(), webClient, objectMapper, processing.getHttpTimeout()),
                new NtfyNotifier(configuration.notification(), webClient, processing.getNotificationTimeout()),
                ledger,
                imap.mailbox(),
                imap.moveToFolder()
        );

        this.sessionManager = new SessionManager(
                new ImapConnectionManager(imap, processing),
                createCredentialProvider(configuration, objectMapper, webClient),
                ledger,
                processor,
                imap.mailbox(),
                processing
        );
    }

    public void run() {
        Thread loopThread = Thread.currentThread();
        Thread shutdownHook = new Thread(() -> {
            log.info("{} Shutdown requested", LogUtils.STOP_EMOJI);
            sessionManager.stop();
            try {
                if (!sessionManager.awaitTermination(SHUTDOWN_GRACE)) {
                    log.warn("{} Session loop did not stop within {}", LogUtils.WARNING_EMOJI,
                            LogUtils.formatDuration(SHUTDOWN_GRACE));
                    loopThread.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "mailwatch-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        sessionManager.run();
    }

    private static CredentialProvider createCredentialProvider(Configuration configuration,
                                                               ObjectMapper objectMapper,
                                                               WebClient webClient) {
        ImapSettings imap = configuration.imap();
        OAuthSettings oauth = configuration.oauth();
        if (!oauth.enabled()) {
            return new PasswordCredentialProvider(imap.username(), imap.password());
        }

        ProcessingConfiguration processing = configuration.processingConfig();
        TokenManager tokenManager = new TokenManager(
                new TokenStore(processing.getDataDirectory(), objectMapper),
                new TokenEndpointClient(oauth, webClient, processing.getHttpTimeout()),
                new AuthorizationCallbackServer(),
                oauth.callbackPort(),
                processing.getAuthorizationTimeout(),
                Clock.systemUTC()
        );
        log.info("{} Using OAuth2 (XOAUTH2) for {}", LogUtils.KEY_EMOJI, LogUtils.maskEmail(imap.username()));
        return new OAuthCredentialProvider(imap.username(), tokenManager, oauth.interactive());
    }
}
