package io.pgcom.pool;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff using exponential growth plus additive jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^retry + U[0, jitter)}, capped at {@code maxDelay}.
 * With the defaults (one second base, one second jitter) retry {@code k} sleeps between
 * {@code 2^k} and {@code 2^k + 1} seconds.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
    public static final long DEFAULT_BASE_DELAY_MS = 1000L;
    public static final long DEFAULT_JITTER_MS = 1000L;
    public static final long DEFAULT_MAX_DELAY_MS = 60_000L;

    private final long baseDelayMs;
    private final long jitterMs;
    private final long maxDelayMs;

    public ExponentialBackoffPolicy() {
        this(DEFAULT_BASE_DELAY_MS, DEFAULT_JITTER_MS, DEFAULT_MAX_DELAY_MS);
    }

    /**
     * @param baseDelayMs delay of the first backoff before jitter (milliseconds)
     * @param jitterMs    upper bound (exclusive) of the random extra delay; {@code 0} disables it
     * @param maxDelayMs  maximum delay cap (milliseconds)
     */
    public ExponentialBackoffPolicy(long baseDelayMs, long jitterMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (jitterMs < 0) {
            throw new IllegalArgumentException("jitterMs must be >= 0, got: " + jitterMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterMs = jitterMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int retry) {
        if (retry < 0) {
            throw new IllegalArgumentException("retry must be >= 0, got: " + retry);
        }
        long expDelay;
        if (retry >= 62) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << retry;
            // overflow guard
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long jitter = jitterMs == 0 ? 0L : ThreadLocalRandom.current().nextLong(jitterMs);
        long capped = Math.min(maxDelayMs, expDelay);
        return Math.min(maxDelayMs, capped + jitter);
    }
}
