package de.alive.mailwatch.session;

import de.alive.mailwatch.auth.CredentialProvider;
import de.alive.mailwatch.domain.IdleOutcome;
import de.alive.mailwatch.exception.FatalSessionException;
import de.alive.mailwatch.exception.MailConnectionException;
import de.alive.mailwatch.infrastructure.ConnectionManager;
import de.alive.mailwatch.infrastructure.MailCredentials;
import de.alive.mailwatch.infrastructure.MailTransport;
import de.alive.mailwatch.ledger.ProcessedMessageLedger;
import de.alive.mailwatch.service.config.ProcessingConfiguration;
import de.alive.mailwatch.util.LogUtils;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The monitoring loop: connect, select, drain unseen messages, IDLE, repeat; reconnect with
 * exponential backoff on transient failures and stop with an exit status on fatal ones.
 * A rejected login is fatal only before the first session reached the watching state.
 * <p>
 * Single-threaded. Only {@link #stop()} may be called from another thread.
 */
@Slf4j
public class SessionManager {

    private final ConnectionManager connectionManager;
    private final CredentialProvider credentialProvider;
    private final ProcessedMessageLedger ledger;
    private final MessageProcessor messageProcessor;
    private final String folder;
    private final Duration idleTimeout;
    private final Duration keepaliveInterval;
    private final Backoff backoff;
    private final Clock clock;
    private final Sleeper sleeper;

    private final AtomicInteger sessionCounter = new AtomicInteger(0);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile Session currentSession;
    private boolean foldersListed;
    // Credentials are only fatal until one session has reached WATCHING
    private boolean watchedOnce;
    private Instant lastKeepalive;

    public SessionManager(@NotNull ConnectionManager connectionManager,
                          @NotNull CredentialProvider credentialProvider,
                          @NotNull ProcessedMessageLedger ledger,
                          @NotNull MessageProcessor messageProcessor,
                          @NotNull String folder,
                          @NotNull ProcessingConfiguration config) {
        this(connectionManager, credentialProvider, ledger, messageProcessor, folder, config,
                Clock.systemUTC(), null);
    }

    SessionManager(@NotNull ConnectionManager connectionManager,
                   @NotNull CredentialProvider credentialProvider,
                   @NotNull ProcessedMessageLedger ledger,
                   @NotNull MessageProcessor messageProcessor,
                   @NotNull String folder,
                   @NotNull ProcessingConfiguration config,
                   @NotNull Clock clock,
                   Sleeper sleeper) {
        this.connectionManager = connectionManager;
        this.credentialProvider = credentialProvider;
        this.ledger = ledger;
        this.messageProcessor = messageProcessor;
        this.folder = folder;
        this.idleTimeout = config.getIdleTimeout();
        this.keepaliveInterval = config.getKeepaliveInterval();
        this.backoff = new Backoff(config.getInitialBackoff(), config.getMaxBackoff());
        this.clock = clock;
        this.sleeper = sleeper != null ? sleeper : this::awaitStop;
    }

    /**
     * Blocks until {@link #stop()} is called.
     *
     * @throws FatalSessionException on bad credentials or an unusable folder
     */
    public void run() {
        log.info("{} Watching folder '{}' (IDLE timeout {}, keepalive every {})", LogUtils.ROCKET_EMOJI,
                folder, LogUtils.formatDuration(idleTimeout), LogUtils.formatDuration(keepaliveInterval));
        try {
            while (running) {
                Session session = new Session(sessionCounter.incrementAndGet(), connectionManager.createTransport());
                currentSession = session;
                if (!running) {
                    session.close();
                    break;
                }

                Exception failure = null;
                try {
                    runSession(session);
                } catch (Exception e) {
                    failure = e;
                    if (session.getState().canTransitionTo(SessionState.ERROR)) {
                        session.transitionTo(SessionState.ERROR);
                    }
                } finally {
                    session.close();
                    currentSession = null;
                }

                if (failure != null && running) {
                    recover(failure);
                }
            }
        } finally {
            terminated.countDown();
            log.info("{} Session loop stopped", LogUtils.STOP_EMOJI);
        }
    }

    /**
     * Requests the loop to end at the next safe point and interrupts an ongoing IDLE or backoff wait.
     */
    public void stop() {
        running = false;
        stopSignal.countDown();
        Session session = currentSession;
        if (session != null) {
            session.getTransport().abortIdle();
        }
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    Duration currentBackoff() {
        return backoff.current();
    }

    private void runSession(Session session) throws Exception {
        MailTransport transport = session.getTransport();

        session.transitionTo(SessionState.CONNECTING);
        connect(session);
        session.transitionTo(SessionState.AUTHENTICATED);

        listFoldersOnce(transport);
        long uidValidity = transport.selectFolder(folder);
        ledger.bindTo(folder, uidValidity);
        lastKeepalive = clock.instant();

        session.transitionTo(SessionState.WATCHING);
        watchedOnce = true;
        drain(session);
        backoff.reset();

        while (running) {
            keepaliveIfDue(transport);

            session.transitionTo(SessionState.IDLING);
            log.debug("{} Session {} entering IDLE", LogUtils.IDLE_EMOJI, session.getId());
            IdleOutcome outcome = transport.idle(idleWindow());
            session.transitionTo(SessionState.WATCHING);

            if (outcome == IdleOutcome.ABORTED || !running) {
                return;
            }
            log.debug("IDLE on session {} ended with {}", session.getId(), outcome);
            drain(session);
        }
    }

    private void connect(Session session) throws Exception {
        MailTransport transport = session.getTransport();
        MailCredentials credentials = credentialProvider.obtain();
        try {
            transport.connect(credentials);
        } catch (MailConnectionException e) {
            if (e.getStage() != MailConnectionException.ConnectionStage.AUTHENTICATION
                    || !credentials.oauth()
                    || !credentialProvider.invalidate()) {
                throw e;
            }
            log.warn("{} Server rejected the access token, retrying once with a fresh one", LogUtils.KEY_EMOJI);
            transport.connect(credentialProvider.obtain());
        }
    }

    private void listFoldersOnce(MailTransport transport) {
        if (foldersListed) {
            return;
        }
        try {
            List<String> folders = transport.listFolders();
            log.info("{} Available folders: {}", LogUtils.FOLDER_EMOJI, String.join(", ", folders));
            foldersListed = true;
        } catch (MailConnectionException e) {
            log.warn("{} Could not list folders: {}", LogUtils.WARNING_EMOJI, e.getMessage());
        }
    }

    private void drain(Session session) throws MailConnectionException {
        MailTransport transport = session.getTransport();
        Set<Long> unseen = transport.searchUnseen();

        int pruned = ledger.prune(unseen);
        if (pruned > 0) {
            log.debug("Pruned {} ledger entries no longer unseen", pruned);
        }

        int processed = 0;
        for (long uid : unseen) {
            if (!running) {
                break;
            }
            if (ledger.isProcessed(uid)) {
                continue;
            }
            messageProcessor.process(transport, uid);
            processed++;
        }

        if (processed > 0) {
            log.info("{} Processed {} new message(s) in '{}'", LogUtils.SUCCESS_EMOJI, processed, folder);
        } else {
            log.debug("{} No new messages in '{}' ({} unseen)", LogUtils.SEARCH_EMOJI, folder, unseen.size());
        }
    }

    private void keepaliveIfDue(MailTransport transport) throws MailConnectionException {
        Instant now = clock.instant();
        if (Duration.between(lastKeepalive, now).compareTo(keepaliveInterval) >= 0) {
            transport.noop();
            lastKeepalive = now;
            log.debug("{} Keepalive NOOP sent", LogUtils.HEARTBEAT_EMOJI);
        }
    }

    private Duration idleWindow() {
        return idleTimeout.compareTo(keepaliveInterval) < 0 ? idleTimeout : keepaliveInterval;
    }

    private void recover(Exception failure) {
        FailureKind kind = FailureKind.of(failure);
        if (kind == FailureKind.FATAL_AUTH && watchedOnce) {
            log.warn("{} Login rejected after the session had been working, treating it as transient",
                    LogUtils.KEY_EMOJI);
            kind = FailureKind.TRANSIENT_NETWORK;
        }
        RetryPolicy.Decision decision = RetryPolicy.decide(kind);

        if (!decision.shouldReconnect()) {
            log.error("{} Fatal {} error: {}", LogUtils.ERROR_EMOJI, kind, failure.getMessage());
            throw new FatalSessionException(failure.getMessage(), decision.exitStatus(), failure);
        }

        Duration delay = backoff.current();
        if (kind == FailureKind.PROGRAMMER_ERROR) {
            log.error("{} Unexpected error, reconnecting in {}", LogUtils.ERROR_EMOJI,
                    LogUtils.formatDuration(delay), failure);
        } else {
            log.warn("{} Connection problem: {} - reconnecting in {}", LogUtils.RECONNECT_EMOJI,
                    failure.getMessage(), LogUtils.formatDuration(delay));
        }

        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
            return;
        }
        backoff.escalate();
    }

    private void awaitStop(Duration duration) throws InterruptedException {
        if (stopSignal.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
            log.debug("Backoff wait cut short by stop request");
        }
    }
}
