package de.alive.mailwatch.session;

/**
 * Lifecycle of one mail server session. {@link #canTransitionTo} is the single source of truth
 * for which moves are legal.
 */
public enum SessionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATED,
    WATCHING,
    IDLING,
    ERROR;

    public boolean canTransitionTo(SessionState target) {
        if (target == ERROR) {
            return this != DISCONNECTED;
        }
        if (target == DISCONNECTED) {
            return this != DISCONNECTED;
        }
        return switch (this) {
            case DISCONNECTED -> target == CONNECTING;
            case CONNECTING -> target == AUTHENTICATED;
            case AUTHENTICATED, IDLING -> target == WATCHING;
            case WATCHING -> target == IDLING;
            case ERROR -> false;
        };
    }
}
