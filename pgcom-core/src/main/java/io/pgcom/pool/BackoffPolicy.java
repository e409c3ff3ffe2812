package io.pgcom.pool;

/**
 * Strategy for computing the pause before rebuilding the pool after a failed liveness check.
 *
 * @see ExponentialBackoffPolicy
 */
public interface BackoffPolicy {

    /**
     * Computes the delay in milliseconds before the next rebuild.
     *
     * @param retry zero-based index of the backoff; the first sleep uses {@code 0}
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int retry);
}
