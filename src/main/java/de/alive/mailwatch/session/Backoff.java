package de.alive.mailwatch.session;

import java.time.Duration;

/**
 * Exponential reconnect delay: starts at the initial value, doubles on each failure, capped at the maximum.
 */
public class Backoff {

    private final Duration initial;
    private final Duration max;
    private Duration current;

    public Backoff(Duration initial, Duration max) {
        if (max.compareTo(initial) < 0) {
            throw new IllegalArgumentException("Max backoff must not be shorter than initial backoff");
        }
        this.initial = initial;
        this.max = max;
        this.current = initial;
    }

    public Duration current() {
        return current;
    }

    public Duration escalate() {
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(max) > 0 ? max : doubled;
        return current;
    }

    public void reset() {
        current = initial;
    }
}
