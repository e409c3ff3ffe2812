package io.pgcom;

/**
 * Unchecked exception thrown when a bulk {@code COPY ... FROM STDIN} load fails.
 *
 * <p>Follows the same reporting rules as {@link QueryExecutionException}: the copy error is the
 * cause and a failed rollback is reported in the message and as a suppressed exception.
 */
public final class CopyException extends RuntimeException {
    public CopyException(String message, Throwable cause) {
        super(message, cause);
    }
}
