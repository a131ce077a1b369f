package de.alive.mailwatch.infrastructure;

import com.sun.mail.iap.ConnectionException;
import com.sun.mail.imap.IMAPFolder;
import com.sun.mail.imap.IMAPStore;
import com.sun.mail.util.MailConnectException;
import de.alive.mailwatch.domain.IdleOutcome;
import de.alive.mailwatch.exception.MailConnectionException;
import de.alive.mailwatch.exception.MailConnectionException.ConnectionStage;
import de.alive.mailwatch.service.config.ImapSettings;
import de.alive.mailwatch.util.LogUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import javax.mail.AuthenticationFailedException;
import javax.mail.FetchProfile;
import javax.mail.Flags;
import javax.mail.Folder;
import javax.mail.FolderClosedException;
import javax.mail.Message;
import javax.mail.MessageRemovedException;
import javax.mail.MessagingException;
import javax.mail.Session;
import javax.mail.StoreClosedException;
import javax.mail.UIDFolder;
import javax.mail.search.FlagTerm;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JavaMail-backed IMAP connection with IDLE support.
 * <p>
 * IMAPFolder.idle has no timeout of its own. A timer thread ends the wait by issuing a NOOP
 * through the folder, which makes JavaMail send DONE first; that is also how an abort works.
 */
@Slf4j
public class ImapMailTransport implements MailTransport {

    private static final Duration ABORT_RETRY_INTERVAL = Duration.ofSeconds(1);

    private static final IMAPFolder.ProtocolCommand NOOP = protocol -> {
        protocol.noop();
        return null;
    };

    @Getter
    private final int id;
    private final ImapSettings settings;
    private final String protocol;
    private final Properties baseProperties;
    private final ScheduledExecutorService idleBreaker;
    private final AtomicBoolean idling = new AtomicBoolean(false);
    private final AtomicBoolean aborted = new AtomicBoolean(false);
    private final CountDownLatch abortSignal = new CountDownLatch(1);

    private IMAPStore store;
    private IMAPFolder folder;
    private boolean idleSupported;

    ImapMailTransport(int id, ImapSettings settings, String protocol, Properties baseProperties) {
        this.id = id;
        this.settings = settings;
        this.protocol = protocol;
        this.baseProperties = baseProperties;
        this.idleBreaker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "imap-idle-timer-" + id);
            thread.setDaemon(true);
            return thread;
        });
    }

    void attach(IMAPFolder selectedFolder, boolean supportsIdle) {
        this.folder = selectedFolder;
        this.idleSupported = supportsIdle;
    }

    @Override
    public void connect(@NotNull MailCredentials credentials) throws MailConnectionException {
        Properties props = new Properties();
        props.putAll(baseProperties);
        if (credentials.oauth()) {
            props.setProperty("mail." + protocol + ".auth.mechanisms", "XOAUTH2");
        }

        try {
            Session session = Session.getInstance(props);
            store = (IMAPStore) session.getStore(protocol);
            store.connect(settings.host(), settings.port(), credentials.username(), credentials.secret());
            idleSupported = store.hasCapability("IDLE");
            log.info("{} IMAP connection {} established to {}:{} ({}{})",
                    LogUtils.SUCCESS_EMOJI, id, settings.host(), settings.port(), settings.encryption(),
                    credentials.oauth() ? ", XOAUTH2" : "");
            if (!idleSupported) {
                log.warn("{} Server does not advertise IDLE - falling back to polling every wait interval",
                        LogUtils.WARNING_EMOJI);
            }
        } catch (AuthenticationFailedException e) {
            throw new MailConnectionException("IMAP login rejected: " + e.getMessage(),
                    ConnectionStage.AUTHENTICATION, e);
        } catch (MailConnectException e) {
            throw new MailConnectionException("Cannot reach IMAP server: " + e.getMessage(),
                    ConnectionStage.NETWORK_ERROR, e);
        } catch (MessagingException e) {
            throw new MailConnectionException("IMAP connection failed: " + e.getMessage(),
                    ConnectionStage.CONNECTION_ESTABLISHMENT, e);
        }
    }

    @Override
    public long selectFolder(@NotNull String name) throws MailConnectionException {
        try {
            Folder candidate = store.getFolder(name);
            if (!candidate.exists()) {
                throw new MailConnectionException("Folder '" + name + "' does not exist",
                        ConnectionStage.FOLDER_SELECTION);
            }
            candidate.open(Folder.READ_WRITE);
            folder = (IMAPFolder) candidate;
            long uidValidity = folder.getUIDValidity();
            log.info("{} Selected folder '{}' ({} messages, UIDVALIDITY {})",
                    LogUtils.FOLDER_EMOJI, name, folder.getMessageCount(), uidValidity);
            return uidValidity;
        } catch (MessagingException e) {
            if (isConnectionProblem(e)) {
                throw translate("select folder '" + name + "'", e);
            }
            throw new MailConnectionException("Cannot select folder '" + name + "': " + e.getMessage(),
                    ConnectionStage.FOLDER_SELECTION, e);
        }
    }

    @NotNull
    @Override
    public List<String> listFolders() throws MailConnectionException {
        try {
            List<String> names = new ArrayList<>();
            for (Folder candidate : store.getDefaultFolder().list("*")) {
                names.add(candidate.getFullName());
            }
            return names;
        } catch (MessagingException e) {
            throw translate("list folders", e);
        }
    }

    @NotNull
    @Override
    public Set<Long> searchUnseen() throws MailConnectionException {
        try {
            Message[] messages = folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false));
            FetchProfile profile = new FetchProfile();
            profile.add(UIDFolder.FetchProfileItem.UID);
            folder.fetch(messages, profile);

            Set<Long> uids = new TreeSet<>();
            for (Message message : messages) {
                uids.add(folder.getUID(message));
            }
            return uids;
        } catch (MessagingException e) {
            throw translate("search unseen messages", e);
        }
    }

    @NotNull
    @Override
    public Optional<byte[]> fetchRaw(long uid) throws MailConnectionException {
        try {
            Message message = folder.getMessageByUID(uid);
            if (message == null) {
                log.warn("{} UID {} no longer exists", LogUtils.WARNING_EMOJI, uid);
                return Optional.empty();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            message.writeTo(out);
            byte[] raw = out.toByteArray();
            return raw.length == 0 ? Optional.empty() : Optional.of(raw);
        } catch (MessageRemovedException e) {
            log.warn("{} UID {} was expunged while fetching", LogUtils.WARNING_EMOJI, uid);
            return Optional.empty();
        } catch (MessagingException | IOException e) {
            if (isConnectionProblem(e)) {
                throw translate("fetch UID " + uid, e);
            }
            log.warn("{} UID {} could not be fetched: {}", LogUtils.WARNING_EMOJI, uid, e.getMessage());
            return Optional.empty();
        }
    }

    @NotNull
    @Override
    public IdleOutcome idle(@NotNull Duration timeout) throws MailConnectionException {
        if (!idleSupported) {
            return aborted.get() ? IdleOutcome.ABORTED : pollWait(timeout);
        }

        // Publish idling before checking aborted; abortIdle does the reverse, so one of them sees the other
        idling.set(true);
        AtomicBoolean timedOut = new AtomicBoolean(false);
        ScheduledFuture<?> breaker = null;
        try {
            if (aborted.get()) {
                return IdleOutcome.ABORTED;
            }
            breaker = idleBreaker.schedule(() -> {
                timedOut.set(true);
                interruptIdle();
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            folder.idle(true);
        } catch (MessagingException e) {
            throw translate("IDLE", e);
        } finally {
            idling.set(false);
            if (breaker != null) {
                breaker.cancel(false);
            }
        }

        if (aborted.get()) {
            return IdleOutcome.ABORTED;
        }
        return timedOut.get() ? IdleOutcome.TIMEOUT : IdleOutcome.PUSH;
    }

    @Override
    public void abortIdle() {
        if (aborted.compareAndSet(false, true)) {
            abortSignal.countDown();
            if (idling.get() && !idleBreaker.isShutdown()) {
                // Repeat until IDLE has returned, a NOOP sent just before IDLE starts would not end it
                try {
                    idleBreaker.scheduleWithFixedDelay(() -> {
                        if (idling.get()) {
                            interruptIdle();
                        }
                    }, 0, ABORT_RETRY_INTERVAL.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException e) {
                    log.debug("Connection {} closed before IDLE could be interrupted", id);
                }
            }
        }
    }

    @Override
    public void noop() throws MailConnectionException {
        try {
            folder.doCommand(NOOP);
        } catch (MessagingException e) {
            throw new MailConnectionException("NOOP keepalive failed: " + e.getMessage(),
                    ConnectionStage.KEEPALIVE, e);
        }
    }

    @Override
    public void move(long uid, @NotNull String destinationFolder) throws MailConnectionException {
        try {
            Message message = folder.getMessageByUID(uid);
            if (message == null) {
                log.warn("{} UID {} no longer exists, nothing to move", LogUtils.WARNING_EMOJI, uid);
                return;
            }
            Folder destination = store.getFolder(destinationFolder);
            if (!destination.exists()) {
                throw new MailConnectionException("Destination folder '" + destinationFolder + "' does not exist",
                        ConnectionStage.CONFIGURATION_ERROR);
            }

            Message[] messages = {message};
            if (store.hasCapability("MOVE")) {
                folder.moveMessages(messages, destination);
            } else {
                folder.copyMessages(messages, destination);
                message.setFlag(Flags.Flag.DELETED, true);
                if (store.hasCapability("UIDPLUS")) {
                    folder.expunge(messages);
                }
            }
        } catch (MessagingException e) {
            throw translate("move UID " + uid + " to '" + destinationFolder + "'", e);
        }
    }

    @Override
    public void close() {
        idleBreaker.shutdownNow();
        if (folder != null && folder.isOpen()) {
            try {
                folder.close(false);
            } catch (MessagingException e) {
                log.debug("{} Error closing folder: {}", LogUtils.WARNING_EMOJI, e.getMessage());
            }
        }
        if (store != null) {
            try {
                store.close();
                log.debug("{} IMAP connection {} closed", LogUtils.SUCCESS_EMOJI, id);
            } catch (MessagingException e) {
                log.debug("{} Error closing IMAP connection {}: {}", LogUtils.WARNING_EMOJI, id, e.getMessage());
            }
        }
    }

    private IdleOutcome pollWait(Duration timeout) {
        try {
            boolean abortedDuringWait = abortSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return abortedDuringWait ? IdleOutcome.ABORTED : IdleOutcome.TIMEOUT;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return IdleOutcome.ABORTED;
        }
    }

    private void interruptIdle() {
        try {
            folder.doCommand(NOOP);
        } catch (MessagingException e) {
            log.debug("NOOP to end IDLE on connection {} failed: {}", id, e.getMessage());
        }
    }

    private MailConnectionException translate(String action, Exception e) {
        ConnectionStage stage;
        if (hasCause(e, SocketTimeoutException.class)) {
            stage = ConnectionStage.TIMEOUT;
        } else if (e instanceof FolderClosedException || e instanceof StoreClosedException
                || hasCause(e, ConnectionException.class)) {
            stage = ConnectionStage.CONNECTION_LOST;
        } else {
            stage = ConnectionStage.NETWORK_ERROR;
        }
        return new MailConnectionException("Failed to " + action + ": " + e.getMessage(), stage, e);
    }

    private static boolean isConnectionProblem(Exception e) {
        return e instanceof FolderClosedException
                || e instanceof StoreClosedException
                || hasCause(e, ConnectionException.class)
                || hasCause(e, SocketException.class)
                || hasCause(e, SocketTimeoutException.class);
    }

    private static boolean hasCause(Throwable throwable, Class<? extends Throwable> type) {
        Throwable current = throwable;
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            Throwable next = current instanceof MessagingException
                    ? ((MessagingException) current).getNextException()
                    : current.getCause();
            current = next == current ? null : next;
        }
        return false;
    }
}
