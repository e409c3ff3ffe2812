package io.pgcom.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.pgcom.ConnectionSettings;
import io.pgcom.spi.ConnectionPool;
import io.pgcom.spi.ConnectionPoolFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionPool} backed by a HikariCP {@link HikariDataSource}.
 *
 * <p>The pool keeps at least one idle connection and at most
 * {@link ConnectionSettings#poolSize()} connections. Driver properties, including the derived
 * search path, are passed to the driver as data source properties.
 */
public final class HikariConnectionPool implements ConnectionPool {
    private static final Logger logger = Logger.getLogger(HikariConnectionPool.class.getName());
    private static final AtomicInteger POOL_IDS = new AtomicInteger();

    private final HikariDataSource dataSource;

    public HikariConnectionPool(ConnectionSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(settings.jdbcUrl());
        if (settings.user() != null) {
            config.setUsername(settings.user());
        }
        if (settings.password() != null) {
            config.setPassword(settings.password());
        }
        config.setMaximumPoolSize(settings.poolSize());
        config.setMinimumIdle(1);
        config.setPoolName("pgcom-pool-" + POOL_IDS.incrementAndGet());
        settings.driverProperties().forEach((key, value) -> config.addDataSourceProperty((String) key, value));
        this.dataSource = new HikariDataSource(config);
        logger.log(Level.FINE, "Created pool {0} for {1}", new Object[]{config.getPoolName(), settings});
    }

    /** Factory creating a new Hikari pool per call, for use with {@code PooledConnector}. */
    public static ConnectionPoolFactory factory() {
        return HikariConnectionPool::new;
    }

    @Override
    public Connection acquire() throws SQLException {
        return dataSource.getConnection();
    }

    @Override
    public void release(Connection connection) throws SQLException {
        connection.close();
    }

    @Override
    public void discard(Connection connection) {
        if (!dataSource.isClosed()) {
            dataSource.evictConnection(connection);
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            logger.log(Level.FINE, "Closing connection of a closed pool failed", e);
        }
    }

    @Override
    public void closeAll() {
        dataSource.close();
    }

    @Override
    public boolean isClosed() {
        return dataSource.isClosed();
    }

    /** Connections currently checked out, or {@code 0} once the pool is closed. */
    public int activeConnections() {
        HikariPoolMXBean mxBean = dataSource.getHikariPoolMXBean();
        return mxBean == null || dataSource.isClosed() ? 0 : mxBean.getActiveConnections();
    }

    public String poolName() {
        return dataSource.getPoolName();
    }
}
