package io.pgcom;

/**
 * Unchecked exception thrown by {@link CommandExecutor} when a command fails.
 *
 * <p>The message carries the failing command text and the driver error. When the rollback
 * attempted after the failure also failed, the message says so and the rollback error is
 * attached as a suppressed exception. The original error is always the cause.
 */
public final class QueryExecutionException extends RuntimeException {
    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
