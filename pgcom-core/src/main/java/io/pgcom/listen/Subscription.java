package io.pgcom.listen;

import java.time.Duration;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handle to a poll loop running on its own thread, returned by {@link Listener#start}.
 *
 * <p>{@link #close()} interrupts the thread and waits for the loop to finish, so by the time
 * it returns the channel has been unlistened and {@code onClose} has run.
 */
public final class Subscription implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(Subscription.class.getName());

    private final Thread thread;
    private final Duration joinTimeout;

    Subscription(Thread thread, Duration joinTimeout) {
        this.thread = thread;
        this.joinTimeout = joinTimeout;
    }

    /** Whether the poll loop is still running. */
    public boolean isActive() {
        return thread.isAlive();
    }

    @Override
    public void close() {
        thread.interrupt();
        try {
            thread.join(joinTimeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        if (thread.isAlive()) {
            logger.log(Level.WARNING, "Listener thread {0} did not stop within {1}",
                    new Object[]{thread.getName(), joinTimeout});
        }
    }
}
