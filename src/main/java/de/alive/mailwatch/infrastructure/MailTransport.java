package de.alive.mailwatch.infrastructure;

import de.alive.mailwatch.domain.IdleOutcome;
import de.alive.mailwatch.exception.MailConnectionException;
import org.jetbrains.annotations.NotNull;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * One connection to the mail server. Not safe for concurrent use: callers issue one command at a time.
 * The only method that may be called from another thread is {@link #abortIdle()}.
 */
public interface MailTransport extends AutoCloseable {

    /**
     * Opens the socket, negotiates TLS per the configured encryption method and logs in.
     */
    void connect(@NotNull MailCredentials credentials) throws MailConnectionException;

    /**
     * Opens {@code folder} read-write.
     *
     * @return the folder's UIDVALIDITY
     */
    long selectFolder(@NotNull String folder) throws MailConnectionException;

    @NotNull List<String> listFolders() throws MailConnectionException;

    /**
     * @return UIDs of all messages without the {@code \Seen} flag, ascending
     */
    @NotNull Set<Long> searchUnseen() throws MailConnectionException;

    /**
     * Fetches the full message without setting {@code \Seen}.
     *
     * @return the raw RFC 822 bytes, or empty if the message is gone or its content is unusable
     * @throws MailConnectionException if the connection was lost while fetching
     */
    @NotNull Optional<byte[]> fetchRaw(long uid) throws MailConnectionException;

    /**
     * Waits for a server push, at most {@code timeout}. No other command may be issued meanwhile.
     */
    @NotNull IdleOutcome idle(@NotNull Duration timeout) throws MailConnectionException;

    /**
     * Ends an ongoing {@link #idle} early with {@link IdleOutcome#ABORTED}. Safe to call from any thread.
     */
    void abortIdle();

    void noop() throws MailConnectionException;

    void move(long uid, @NotNull String destinationFolder) throws MailConnectionException;

    /**
     * Best-effort logout; never throws.
     */
    @Override
    void close();
}
