package de.alive.mailwatch.exception;

/**
 * Raised when OAuth2 credentials cannot be obtained from the authorization server.
 */
public class AuthenticationException extends Exception {

    private final boolean networkFailure;

    public AuthenticationException(String message, boolean networkFailure) {
        super(message);
        this.networkFailure = networkFailure;
    }

    public AuthenticationException(String message, boolean networkFailure, Throwable cause) {
        super(message, cause);
        this.networkFailure = networkFailure;
    }

    /**
     * @return true if the token endpoint could not be reached, false if it answered and refused
     */
    public boolean isNetworkFailure() {
        return networkFailure;
    }
}
