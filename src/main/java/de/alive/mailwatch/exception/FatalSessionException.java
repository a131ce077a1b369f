package de.alive.mailwatch.exception;

/**
 * Ends the monitoring loop. Carries the process exit status.
 */
public class FatalSessionException extends RuntimeException {

    private final int exitStatus;

    public FatalSessionException(String message, int exitStatus, Throwable cause) {
        super(message, cause);
        this.exitStatus = exitStatus;
    }

    public int getExitStatus() {
        return exitStatus;
    }
}
