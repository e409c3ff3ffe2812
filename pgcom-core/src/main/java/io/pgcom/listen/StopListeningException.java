package io.pgcom.listen;

/**
 * Thrown from a listener callback to end the poll loop gracefully.
 *
 * <p>The loop unlistens, then invokes {@code onClose}. Notifications still pending from the
 * same drain are dropped.
 */
public class StopListeningException extends RuntimeException {

    public StopListeningException() {
        super("Listening stopped by callback");
    }

    public StopListeningException(String message) {
        super(message);
    }
}
