package de.alive.mailwatch.domain;

/**
 * How a long-poll wait ended.
 */
public enum IdleOutcome {
    /** The server pushed an untagged response (new or changed messages). */
    PUSH,
    /** The wait ran into its timeout without server activity. */
    TIMEOUT,
    /** The wait was cut short by a shutdown request. */
    ABORTED
}
