package de.alive.mailwatch.session;

import de.alive.mailwatch.infrastructure.MailTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

/**
 * One connection attempt and everything that happens on it until it is torn down.
 * A new instance is created for every reconnect.
 */
@Slf4j
@Getter
public class Session {

    private final int id;
    private final MailTransport transport;
    private volatile SessionState state = SessionState.DISCONNECTED;

    public Session(int id, @NotNull MailTransport transport) {
        this.id = id;
        this.transport = transport;
    }

    public void transitionTo(@NotNull SessionState target) {
        if (!state.canTransitionTo(target)) {
            throw new IllegalStateException("Session " + id + ": illegal transition " + state + " -> " + target);
        }
        log.trace("Session {}: {} -> {}", id, state, target);
        state = target;
    }

    /**
     * Best-effort logout and move to {@link SessionState#DISCONNECTED}.
     */
    public void close() {
        transport.close();
        if (state != SessionState.DISCONNECTED) {
            state = SessionState.DISCONNECTED;
        }
    }
}
