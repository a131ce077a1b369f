package de.alive.mailwatch.infrastructure;

import com.sun.mail.imap.IMAPFolder;
import de.alive.mailwatch.domain.IdleOutcome;
import de.alive.mailwatch.service.config.EncryptionMethod;
import de.alive.mailwatch.service.config.ImapSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImapMailTransportTest {

    @Mock
    private IMAPFolder folder;

    private final ImapMailTransport transport = new ImapMailTransport(1,
            new ImapSettings("imap.example.com", 993, EncryptionMethod.SSL, "me@example.com", "secret", "INBOX", null),
            "imaps", new Properties());

    @AfterEach
    void tearDown() {
        transport.close();
    }

    @Test
    @DisplayName("Abort before IDLE returns at once without issuing IDLE")
    void testAbortBeforeIdle() throws Exception {
        transport.attach(folder, true);
        transport.abortIdle();

        assertThat(transport.idle(Duration.ofMinutes(2))).isEqualTo(IdleOutcome.ABORTED);
        verify(folder, never()).idle(anyBoolean());
    }

    @Test
    @DisplayName("Abort keeps interrupting until IDLE has actually returned")
    void testAbortDuringIdle() throws Exception {
        CountDownLatch idleEntered = new CountDownLatch(1);
        CountDownLatch released = new CountDownLatch(1);
        AtomicInteger noops = new AtomicInteger();
        doAnswer(invocation -> {
            idleEntered.countDown();
            released.await(10, TimeUnit.SECONDS);
            return null;
        }).when(folder).idle(true);
        // The first NOOP is lost, as when it reaches the server before IDLE was sent
        when(folder.doCommand(any())).thenAnswer(invocation -> {
            if (noops.incrementAndGet() > 1) {
                released.countDown();
            }
            return null;
        });
        transport.attach(folder, true);

        CompletableFuture<IdleOutcome> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                return transport.idle(Duration.ofMinutes(2));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        assertThat(idleEntered.await(5, TimeUnit.SECONDS)).isTrue();
        transport.abortIdle();

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isEqualTo(IdleOutcome.ABORTED);
        assertThat(noops.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    @DisplayName("Without IDLE support the wait ends on abort")
    void testPollWaitAbort() throws Exception {
        transport.attach(folder, false);

        CompletableFuture<IdleOutcome> outcome = CompletableFuture.supplyAsync(() -> {
            try {
                return transport.idle(Duration.ofMinutes(2));
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        });
        transport.abortIdle();

        assertThat(outcome.get(5, TimeUnit.SECONDS)).isEqualTo(IdleOutcome.ABORTED);
        verify(folder, never()).idle(anyBoolean());
    }
}
