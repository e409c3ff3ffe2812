package io.pgcom.pool;

/**
 * Pauses the calling thread. Replaced in tests to observe backoff without waiting.
 */
@FunctionalInterface
public interface Sleeper {

    /** Sleeps with {@link Thread#sleep(long)}. */
    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
