package de.alive.mailwatch.session;

import de.alive.mailwatch.exception.AuthenticationException;
import de.alive.mailwatch.exception.ConfigurationException;
import de.alive.mailwatch.exception.MailConnectionException;

import java.io.IOException;

public enum FailureKind {
    TRANSIENT_NETWORK(0),
    FATAL_AUTH(2),
    FATAL_CONFIG(3),
    PROGRAMMER_ERROR(0);

    private final int exitStatus;

    FailureKind(int exitStatus) {
        this.exitStatus = exitStatus;
    }

    public int exitStatus() {
        return exitStatus;
    }

    public static FailureKind of(Throwable failure) {
        if (failure instanceof MailConnectionException) {
            return switch (((MailConnectionException) failure).getStage()) {
                case AUTHENTICATION -> FATAL_AUTH;
                case FOLDER_SELECTION, CONFIGURATION_ERROR -> FATAL_CONFIG;
                default -> TRANSIENT_NETWORK;
            };
        }
        if (failure instanceof AuthenticationException) {
            return ((AuthenticationException) failure).isNetworkFailure() ? TRANSIENT_NETWORK : FATAL_AUTH;
        }
        if (failure instanceof ConfigurationException) {
            return FATAL_CONFIG;
        }
        if (failure instanceof IOException) {
            return TRANSIENT_NETWORK;
        }
        return PROGRAMMER_ERROR;
    }
}
