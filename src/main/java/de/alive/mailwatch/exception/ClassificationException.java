package de.alive.mailwatch.exception;

public class ClassificationException extends Exception {

    public ClassificationException(String message) {
        super(message);
    }

    public ClassificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
