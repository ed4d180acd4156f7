package io.github.byzatic.jobscheduler.base_exceptions;

/**
 * A task body failed. The message is what gets recorded after {@code "Job failed: "}.
 */
public class JobExecutionException extends Exception {
    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(Throwable cause) {
        super(cause);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public JobExecutionException(Throwable cause, String message) {
        super(message, cause);
    }
}
