package io.pgcom.spi;

/**
 * Observability hook for exporting connector, executor and listener counters to a metrics
 * backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of liveness pings that found a dead connection.
     */
    void incrementPingFailures();

    /**
     * Increments the count of full pool rebuilds.
     */
    void incrementPoolRestarts();

    /**
     * Increments the count of commands that failed and were rolled back.
     */
    void incrementExecutionFailures();

    /**
     * Increments the count of failed commands whose rollback failed too.
     */
    void incrementRollbackFailures();

    /**
     * Increments the count of notifications handed to a listener callback.
     */
    void incrementNotificationsReceived();

    /**
     * Increments the count of listener waits that expired with no notification.
     */
    default void incrementListenerTimeouts() {
    }

    /**
     * Increments the count of listener callbacks that threw.
     */
    void incrementCallbackFailures();

    /**
     * Records the wall-clock time of one {@code execute} call, including connection checkout.
     *
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordExecutionDurationMs(long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPingFailures() {
        }

        @Override
        public void incrementPoolRestarts() {
        }

        @Override
        public void incrementExecutionFailures() {
        }

        @Override
        public void incrementRollbackFailures() {
        }

        @Override
        public void incrementNotificationsReceived() {
        }

        @Override
        public void incrementCallbackFailures() {
        }
    }
}
