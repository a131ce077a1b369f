package de.alive.mailwatch.session;

/**
 * Maps a failure kind to what the session loop does next. Pure; no state.
 */
public final class RetryPolicy {

    public enum Action {
        RECONNECT,
        EXIT
    }

    public record Decision(Action action, int exitStatus) {

        static final Decision RECONNECT = new Decision(Action.RECONNECT, 0);

        public boolean shouldReconnect() {
            return action == Action.RECONNECT;
        }
    }

    private RetryPolicy() {
    }

    public static Decision decide(FailureKind kind) {
        return switch (kind) {
            case FATAL_AUTH, FATAL_CONFIG -> new Decision(Action.EXIT, kind.exitStatus());
            case TRANSIENT_NETWORK, PROGRAMMER_ERROR -> Decision.RECONNECT;
        };
    }
}
