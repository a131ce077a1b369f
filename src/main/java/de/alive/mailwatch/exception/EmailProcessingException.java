package de.alive.mailwatch.exception;

public class EmailProcessingException extends Exception {

    private final long uid;
    private final ProcessingStage stage;

    public enum ProcessingStage {
        CLASSIFICATION,
        MESSAGE_MOVE
    }

    public EmailProcessingException(String message, long uid, ProcessingStage stage, Throwable cause) {
        super(message, cause);
        this.uid = uid;
        this.stage = stage;
    }

    public long getUid() {
        return uid;
    }

    public ProcessingStage getStage() {
        return stage;
    }
}
