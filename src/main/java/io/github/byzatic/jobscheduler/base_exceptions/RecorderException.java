package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * The execution history could not be written.
 */
public class RecorderException extends Exception {
    public RecorderException(String message) {
        super(message);
    }

    public RecorderException(Throwable cause) {
        super(cause);
    }

    public RecorderException(String message, Throwable cause) {
        super(message, cause);
    }

    public RecorderException(Throwable cause, String message) {
        super(message, cause);
    }
}
