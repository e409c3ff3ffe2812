package io.pgcom.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.pgcom.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code pgcom.pool.restart}: full pool rebuilds</li>
 *   <li>{@code pgcom.pool.ping.failure}: liveness checks that found a dead connection</li>
 *   <li>{@code pgcom.execute.failure}: failed commands</li>
 *   <li>{@code pgcom.execute.rollback.failure}: failed commands whose rollback failed too</li>
 *   <li>{@code pgcom.listen.notify}: notifications dispatched to listeners</li>
 *   <li>{@code pgcom.listen.timeout}: listener waits that expired empty</li>
 *   <li>{@code pgcom.listen.callback.failure}: listener callbacks that threw</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code pgcom.execute.duration}: wall-clock time per command in milliseconds</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter poolRestarts;
    private final Counter pingFailures;
    private final Counter executionFailures;
    private final Counter rollbackFailures;
    private final Counter notifications;
    private final Counter listenerTimeouts;
    private final Counter callbackFailures;
    private final DistributionSummary executionDuration;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "pgcom"}.
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "pgcom");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for several databases in one process.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "reporting.pgcom"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.poolRestarts = Counter.builder(namePrefix + ".pool.restart")
                .description("Connection pool rebuilds")
                .register(registry);
        this.pingFailures = Counter.builder(namePrefix + ".pool.ping.failure")
                .description("Liveness checks that found a dead connection")
                .register(registry);
        this.executionFailures = Counter.builder(namePrefix + ".execute.failure")
                .description("Failed commands")
                .register(registry);
        this.rollbackFailures = Counter.builder(namePrefix + ".execute.rollback.failure")
                .description("Failed commands whose rollback also failed")
                .register(registry);
        this.notifications = Counter.builder(namePrefix + ".listen.notify")
                .description("Notifications dispatched to listener callbacks")
                .register(registry);
        this.listenerTimeouts = Counter.builder(namePrefix + ".listen.timeout")
                .description("Listener waits that expired without notifications")
                .register(registry);
        this.callbackFailures = Counter.builder(namePrefix + ".listen.callback.failure")
                .description("Listener callbacks that threw")
                .register(registry);
        this.executionDuration = DistributionSummary.builder(namePrefix + ".execute.duration")
                .description("Command execution time including connection checkout")
                .baseUnit("milliseconds")
                .register(registry);
    }

    @Override
    public void incrementPingFailures() {
        if (closed) return;
        pingFailures.increment();
    }

    @Override
    public void incrementPoolRestarts() {
        if (closed) return;
        poolRestarts.increment();
    }

    @Override
    public void incrementExecutionFailures() {
        if (closed) return;
        executionFailures.increment();
    }

    @Override
    public void incrementRollbackFailures() {
        if (closed) return;
        rollbackFailures.increment();
    }

    @Override
    public void incrementNotificationsReceived() {
        if (closed) return;
        notifications.increment();
    }

    @Override
    public void incrementListenerTimeouts() {
        if (closed) return;
        listenerTimeouts.increment();
    }

    @Override
    public void incrementCallbackFailures() {
        if (closed) return;
        callbackFailures.increment();
    }

    @Override
    public void recordExecutionDurationMs(long durationMs) {
        if (closed) return;
        executionDuration.record(durationMs);
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(poolRestarts, pingFailures, executionFailures, rollbackFailures,
                notifications, listenerTimeouts, callbackFailures, executionDuration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
