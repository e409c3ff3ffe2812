package io.pgcom.pool;

import io.pgcom.ConnectionSettings;
import io.pgcom.Connector;
import io.pgcom.ScopedConnection;
import io.pgcom.spi.ConnectionPool;
import io.pgcom.spi.ConnectionPoolFactory;
import io.pgcom.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Connector} backed by a rebuildable {@link ConnectionPool}.
 *
 * <p>When pre-ping is enabled every checkout is verified with a liveness check. A dead
 * connection is discarded, the whole pool is rebuilt and a fresh connection is drawn, up to
 * {@link ConnectionSettings#maxReconnects()} times. The first rebuild happens immediately;
 * every further one is preceded by a {@linkplain BackoffPolicy backoff} sleep. When the
 * attempts are used up the last drawn connection is handed out as is, and the caller sees the
 * failure on first use.
 *
 * <p>Usage:
 * <pre>{@code
 * Connector connector = PooledConnector.builder()
 *     .settings(settings)
 *     .poolFactory(HikariConnectionPool.factory())
 *     .build();
 * }</pre>
 *
 * <p>This class is thread-safe. Pool rebuilds are serialized; a caller holding a connection
 * from a pool that has since been rebuilt still releases it correctly.
 */
public final class PooledConnector implements Connector {
    private static final Logger logger = Logger.getLogger(PooledConnector.class.getName());

    private final ConnectionSettings settings;
    private final ConnectionPoolFactory poolFactory;
    private final BackoffPolicy backoffPolicy;
    private final Sleeper sleeper;
    private final LivenessCheck livenessCheck;
    private final MetricsExporter metrics;
    private final Object restartLock = new Object();
    private volatile ConnectionPool pool;
    private volatile boolean closed;

    private PooledConnector(Builder builder) {
        this.settings = Objects.requireNonNull(builder.settings, "settings");
        this.poolFactory = Objects.requireNonNull(builder.poolFactory, "poolFactory");
        this.backoffPolicy = builder.backoffPolicy != null ? builder.backoffPolicy : new ExponentialBackoffPolicy();
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.THREAD;
        this.livenessCheck = builder.livenessCheck != null ? builder.livenessCheck : PooledConnector::ping;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.pool = poolFactory.create(settings);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ConnectionSettings settings() {
        return settings;
    }

    @Override
    public ScopedConnection openConnection() throws SQLException {
        if (closed) {
            throw new SQLException("Connector is closed");
        }
        ConnectionPool current = pool;
        Connection conn = current.acquire();
        if (settings.prePing()) {
            for (int n = 0; n < settings.maxReconnects(); n++) {
                if (isAlive(conn)) {
                    break;
                }
                metrics.incrementPingFailures();
                logger.log(Level.WARNING, "Connection to {0} failed liveness check (attempt {1})",
                        new Object[]{settings, n + 1});
                if (n > 0) {
                    backoff(current, conn, n - 1);
                }
                current.discard(conn);
                current = restartPool(current);
                conn = current.acquire();
            }
        }
        return new ScopedConnection(conn, current);
    }

    /**
     * Replaces the current pool with a fresh one built from the same settings, then closes the
     * old one. If the fresh pool cannot be created the current pool stays in place.
     *
     * @throws SQLException if the connector is closed or the new pool cannot be created
     */
    public void restartPool() throws SQLException {
        restartPool(pool);
    }

    // rebuilds only if no other thread has replaced the failed pool already
    private ConnectionPool restartPool(ConnectionPool failed) throws SQLException {
        synchronized (restartLock) {
            if (closed) {
                throw new SQLException("Connector is closed");
            }
            ConnectionPool current = pool;
            if (current != failed) {
                return current;
            }
            ConnectionPool fresh;
            try {
                fresh = poolFactory.create(settings);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Unable to rebuild connection pool for " + settings, e);
                throw new SQLException("Unable to rebuild connection pool: " + e.getMessage(), e);
            }
            pool = fresh;
            current.closeAll();
            metrics.incrementPoolRestarts();
            logger.log(Level.INFO, "Connection pool for {0} restarted", settings);
            return fresh;
        }
    }

    private void backoff(ConnectionPool current, Connection conn, int retry) throws SQLException {
        long delayMs = backoffPolicy.computeDelayMs(retry);
        logger.log(Level.FINE, "Backing off {0} ms before reconnecting", delayMs);
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            current.discard(conn);
            throw new SQLException("Interrupted while waiting to reconnect", e);
        }
    }

    private boolean isAlive(Connection conn) {
        try {
            return livenessCheck.isAlive(conn);
        } catch (SQLException | RuntimeException e) {
            logger.log(Level.FINE, "Liveness check raised", e);
            return false;
        }
    }

    /**
     * Default liveness check: runs {@code SELECT 1} and expects the value {@code 1} back.
     */
    public static boolean ping(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT 1")) {
            return rs.next() && rs.getInt(1) == 1;
        }
    }

    @Override
    public void closeAll() {
        synchronized (restartLock) {
            closed = true;
            pool.closeAll();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Builder for {@link PooledConnector}.
     */
    public static final class Builder {
        private ConnectionSettings settings;
        private ConnectionPoolFactory poolFactory;
        private BackoffPolicy backoffPolicy;
        private Sleeper sleeper;
        private LivenessCheck livenessCheck;
        private MetricsExporter metrics;

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder settings(ConnectionSettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Sets the factory used to create the pool and to rebuild it after a failed liveness
         * check. <b>Required.</b>
         */
        public Builder poolFactory(ConnectionPoolFactory poolFactory) {
            this.poolFactory = poolFactory;
            return this;
        }

        /** Optional. Defaults to {@link ExponentialBackoffPolicy#ExponentialBackoffPolicy()}. */
        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        /** Optional. Defaults to {@link Sleeper#THREAD}. */
        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        /** Optional. Defaults to {@link PooledConnector#ping(Connection)}. */
        public Builder livenessCheck(LivenessCheck livenessCheck) {
            this.livenessCheck = livenessCheck;
            return this;
        }

        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the connector and creates its initial pool.
         *
         * @throws NullPointerException if settings or pool factory are missing
         */
        public PooledConnector build() {
            return new PooledConnector(this);
        }
    }
}
