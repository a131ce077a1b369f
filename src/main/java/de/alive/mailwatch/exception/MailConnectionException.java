package de.alive.mailwatch.exception;

public class MailConnectionException extends Exception {

    private final ConnectionStage stage;

    public enum ConnectionStage {
        CONNECTION_ESTABLISHMENT,
        AUTHENTICATION,
        FOLDER_SELECTION,
        NETWORK_ERROR,
        TIMEOUT,
        CONNECTION_LOST,
        KEEPALIVE,
        CONFIGURATION_ERROR
    }

    public MailConnectionException(String message, ConnectionStage stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public MailConnectionException(String message, ConnectionStage stage) {
        super(message);
        this.stage = stage;
    }

    public ConnectionStage getStage() {
        return stage;
    }

    @Override
    public String toString() {
        return String.format("MailConnectionException{stage=%s, message='%s'}",
                stage, getMessage());
    }
}
