package de.alive.mailwatch.infrastructure;

import de.alive.mailwatch.service.config.ImapSettings;
import de.alive.mailwatch.service.config.ProcessingConfiguration;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class ImapConnectionManager implements ConnectionManager {

    // Read timeout while idling = idle timeout + this grace period
    static final Duration READ_TIMEOUT_GRACE = Duration.ofSeconds(60);

    private final ImapSettings settings;
    private final String protocol;
    private final Properties imapProperties;
    private final AtomicInteger connectionIdGenerator = new AtomicInteger(0);

    public ImapConnectionManager(@NotNull ImapSettings settings, @NotNull ProcessingConfiguration config) {
        this.settings = settings;
        this.protocol = settings.encryption().isImplicitTls() ? "imaps" : "imap";
        this.imapProperties = createImapProperties(config);
    }

    @NotNull
    @Override
    public MailTransport createTransport() {
        int connectionId = connectionIdGenerator.incrementAndGet();
        log.debug("{} Creating IMAP transport #{} for {}:{}",
                LogUtils.PROCESS_EMOJI, connectionId, settings.host(), settings.port());
        return new ImapMailTransport(connectionId, settings, protocol, imapProperties);
    }

    Properties getImapProperties() {
        return imapProperties;
    }

    private Properties createImapProperties(ProcessingConfiguration config) {
        String prefix = "mail." + protocol + ".";
        String connectTimeout = String.valueOf(config.getConnectionTimeout().toMillis());
        String readTimeout = String.valueOf(config.getIdleTimeout().plus(READ_TIMEOUT_GRACE).toMillis());

        Properties props = new Properties();
        props.setProperty("mail.store.protocol", protocol);
        props.setProperty(prefix + "host", settings.host());
        props.setProperty(prefix + "port", String.valueOf(settings.port()));

        switch (settings.encryption()) {
            case SSL, TLS -> {
                props.setProperty(prefix + "ssl.enable", "true");
                props.setProperty(prefix + "ssl.checkserveridentity", "true");
            }
            case STARTTLS -> {
                props.setProperty(prefix + "starttls.enable", "true");
                props.setProperty(prefix + "starttls.required", "true");
                props.setProperty(prefix + "ssl.checkserveridentity", "true");
            }
            case NONE -> log.warn("{} IMAP connection to {} is not encrypted",
                    LogUtils.WARNING_EMOJI, settings.host());
        }

        // One connection, no pool
        props.setProperty(prefix + "connectionpoolsize", "1");

        // Read timeout must outlast an IDLE round
        props.setProperty(prefix + "connectiontimeout", connectTimeout);
        props.setProperty(prefix + "timeout", readTimeout);
        props.setProperty(prefix + "writetimeout", connectTimeout);

        // Fetch with BODY.PEEK so unseen messages stay unseen
        props.setProperty(prefix + "peek", "true");
        props.setProperty(prefix + "fetchsize", "16384");
        props.setProperty(prefix + "partialfetch", "false");

        props.setProperty(prefix + "finalizecleanclose", "false");

        return props;
    }
}
