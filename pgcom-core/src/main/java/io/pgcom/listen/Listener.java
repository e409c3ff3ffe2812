package io.pgcom.listen;

import io.pgcom.CommandExecutor;
import io.pgcom.Connector;
import io.pgcom.QualifiedName;
import io.pgcom.ScopedConnection;
import io.pgcom.Sql;
import io.pgcom.spi.MetricsExporter;
import io.pgcom.spi.NotificationSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Subscribes to a PostgreSQL notification channel and dispatches payloads to callbacks.
 *
 * <p>{@link #poll} runs a blocking loop on the calling thread: it takes a connection from the
 * {@link Connector}, issues {@code LISTEN}, then waits for notifications. Each payload goes to
 * {@code onNotify} in arrival order; a wait that expires empty triggers {@code onTimeout}.
 * Exceptions thrown by these two callbacks are logged and the loop continues.
 *
 * <p>The loop ends when a callback throws {@link StopListeningException}, when the thread is
 * interrupted, or when the driver fails. The channel is always unlistened first; then
 * {@code onClose} runs for a graceful stop and {@code onError} for a failure. The connection
 * is discarded afterwards and never returns to the pool.
 *
 * <p>A listener runs one session. After it stops, further {@code poll} calls throw
 * {@link IllegalStateException}.
 *
 * <pre>{@code
 * Listener listener = Listener.builder()
 *     .connector(connector)
 *     .notificationSource(new PgNotificationSource())
 *     .build();
 * listener.createNotifyFunction("notify_people", "people_changes");
 * listener.createTrigger("notify_people", "people");
 * Subscription sub = listener.start("people_changes",
 *     ListenerCallbacks.builder().onNotify(System.out::println).build(),
 *     Duration.ofSeconds(5));
 * }</pre>
 */
public final class Listener {
    private static final Logger logger = Logger.getLogger(Listener.class.getName());

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    /** Session lifecycle. {@code STOPPED} is terminal. */
    public enum State {
        IDLE,
        LISTENING,
        STOPPED
    }

    private final Connector connector;
    private final CommandExecutor executor;
    private final NotificationSource notificationSource;
    private final MetricsExporter metrics;
    private final String schema;
    private final Duration timeout;
    private final AtomicReference<State> state = new AtomicReference<>(State.IDLE);

    private Listener(Builder builder) {
        this.connector = Objects.requireNonNull(builder.connector, "connector");
        this.notificationSource = Objects.requireNonNull(builder.notificationSource, "notificationSource");
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.executor = builder.executor != null ? builder.executor : new CommandExecutor(connector, metrics);
        this.schema = builder.schema;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        requirePositive(timeout);
    }

    public static Builder builder() {
        return new Builder();
    }

    public State state() {
        return state.get();
    }

    public boolean isListening() {
        return state.get() == State.LISTENING;
    }

    /**
     * Polls {@code channel} with the configured timeout.
     *
     * @see #poll(String, ListenerCallbacks, Duration)
     */
    public void poll(String channel, ListenerCallbacks callbacks) {
        poll(channel, callbacks, timeout);
    }

    /**
     * Listens on {@code channel} and dispatches notifications until stopped. Blocks the calling
     * thread for the whole session.
     *
     * @param channel   channel name, quoted as an identifier
     * @param callbacks session callbacks
     * @param timeout   how long one wait may block before {@code onTimeout} runs
     * @throws IllegalStateException if the listener is already polling or has stopped
     */
    public void poll(String channel, ListenerCallbacks callbacks, Duration timeout) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(callbacks, "callbacks");
        requirePositive(timeout);
        begin();
        runSession(channel, callbacks, timeout);
    }

    /**
     * Runs {@link #poll(String, ListenerCallbacks, Duration)} on a new daemon thread named
     * {@code pgcom-listener-<channel>}.
     *
     * @return handle whose {@code close()} stops the loop and waits for it
     * @throws IllegalStateException if the listener is already polling or has stopped
     */
    public Subscription start(String channel, ListenerCallbacks callbacks, Duration timeout) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(callbacks, "callbacks");
        requirePositive(timeout);
        begin();
        Thread thread = new Thread(() -> runSession(channel, callbacks, timeout), "pgcom-listener-" + channel);
        thread.setDaemon(true);
        thread.start();
        return new Subscription(thread, timeout.multipliedBy(2).plusSeconds(5));
    }

    /**
     * Creates or replaces a trigger function that publishes {@code NEW} as JSON on
     * {@code channel}.
     *
     * @param functionName function name, optionally schema qualified
     */
    public void createNotifyFunction(String functionName, String channel) {
        Objects.requireNonNull(channel, "channel");
        QualifiedName function = QualifiedName.resolve(functionName, schema);
        executor.execute(NotifyTriggers.createFunction(function, channel));
        logger.log(Level.INFO, "Created notify function {0} for channel {1}", new Object[]{function, channel});
    }

    /**
     * Replaces the {@code <table>_notify} trigger on {@code tableName} with one that calls the
     * given function after every insert or update.
     *
     * @param functionName function name, optionally schema qualified
     * @param tableName    table name, optionally schema qualified
     */
    public void createTrigger(String functionName, String tableName) {
        QualifiedName function = QualifiedName.resolve(functionName, schema);
        QualifiedName table = QualifiedName.resolve(tableName, schema);
        executor.execute(NotifyTriggers.dropTrigger(table));
        executor.execute(NotifyTriggers.createTrigger(function, table));
        logger.log(Level.INFO, "Created trigger {0} on {1}", new Object[]{NotifyTriggers.triggerName(table), table});
    }

    private void begin() {
        if (!state.compareAndSet(State.IDLE, State.LISTENING)) {
            throw new IllegalStateException(state.get() == State.STOPPED
                    ? "Listener has stopped and cannot poll again"
                    : "Listener is already polling");
        }
    }

    private void runSession(String channel, ListenerCallbacks callbacks, Duration timeout) {
        try {
            ScopedConnection scoped;
            try {
                scoped = connector.openConnection();
            } catch (SQLException | RuntimeException e) {
                logger.log(Level.WARNING, "Failed to open listening connection for channel " + channel, e);
                callbacks.error(e);
                return;
            }
            scoped.discardOnClose();
            try {
                listen(scoped.connection(), channel, callbacks, timeout);
            } finally {
                release(scoped);
            }
        } finally {
            state.set(State.STOPPED);
        }
    }

    private void listen(Connection conn, String channel, ListenerCallbacks callbacks, Duration timeout) {
        Exception failure = null;
        try {
            conn.setAutoCommit(true);
            run(conn, "LISTEN " + Sql.identifier(channel));
            logger.log(Level.INFO, "Listening on channel {0}", channel);
            loop(conn, channel, callbacks, timeout);
        } catch (SQLException | RuntimeException e) {
            failure = e;
        } finally {
            unlisten(conn, channel, failure);
        }
        if (failure == null) {
            logger.log(Level.INFO, "Stopped listening on channel {0}", channel);
            callbacks.close();
        } else {
            logger.log(Level.WARNING, "Listening on channel " + channel + " failed", failure);
            callbacks.error(failure);
        }
    }

    private void loop(Connection conn, String channel, ListenerCallbacks callbacks, Duration timeout)
            throws SQLException {
        while (!Thread.currentThread().isInterrupted()) {
            List<Notification> pending = notificationSource.await(conn, timeout);
            if (pending.isEmpty()) {
                metrics.incrementListenerTimeouts();
                if (!dispatch(channel, "onTimeout", callbacks::timeout)) {
                    return;
                }
                continue;
            }
            for (Notification notification : pending) {
                metrics.incrementNotificationsReceived();
                if (!dispatch(channel, "onNotify", () -> callbacks.notify(notification.payload()))) {
                    return;
                }
            }
        }
        logger.log(Level.FINE, "Listener thread interrupted, stopping channel {0}", channel);
    }

    // false when the callback asked to stop
    private boolean dispatch(String channel, String callback, Runnable invocation) {
        try {
            invocation.run();
            return true;
        } catch (StopListeningException e) {
            logger.log(Level.FINE, "{0} requested stop on channel {1}", new Object[]{callback, channel});
            return false;
        } catch (RuntimeException e) {
            metrics.incrementCallbackFailures();
            logger.log(Level.WARNING, callback + " callback failed on channel " + channel, e);
            return true;
        }
    }

    private static void unlisten(Connection conn, String channel, Exception failure) {
        try {
            run(conn, "UNLISTEN " + Sql.identifier(channel));
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.WARNING, "UNLISTEN failed on channel " + channel, e);
            if (failure != null) {
                failure.addSuppressed(e);
            }
        }
    }

    private static void release(ScopedConnection scoped) {
        try {
            scoped.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to discard listening connection", e);
        }
    }

    private static void run(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }

    private static void requirePositive(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Builder for {@link Listener}.
     */
    public static final class Builder {
        private Connector connector;
        private CommandExecutor executor;
        private NotificationSource notificationSource;
        private MetricsExporter metrics;
        private String schema;
        private Duration timeout;

        private Builder() {
        }

        /** Source of the listening connection. <b>Required.</b> */
        public Builder connector(Connector connector) {
            this.connector = connector;
            return this;
        }

        /** Driver access to pending notifications. <b>Required.</b> */
        public Builder notificationSource(NotificationSource notificationSource) {
            this.notificationSource = notificationSource;
            return this;
        }

        /** Executor for the DDL helpers. Optional; defaults to one over the connector. */
        public Builder executor(CommandExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Schema for unqualified function and table names; {@code public} when unset. */
        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        /** Default wait timeout. Optional, defaults to 5 seconds. */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Listener build() {
            return new Listener(this);
        }
    }
}
