package io.pgcom.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Fixed-capacity pool of live database connections.
 *
 * <p>Implementations wrap an existing pooling primitive; they own every connection they hand
 * out and guarantee that a checked-out connection is used by one caller at a time. The number
 * of connections checked out concurrently never exceeds the configured maximum size.
 *
 * <p>Each connection returned by {@link #acquire()} must be passed to exactly one of
 * {@link #release(Connection)} or {@link #discard(Connection)}.
 *
 * @see ConnectionPoolFactory
 * @see io.pgcom.Connector
 */
public interface ConnectionPool {

    /**
     * Checks out a connection, blocking until one is available.
     *
     * @return a connection bound to the configured parameters
     * @throws SQLException if the pool is closed or no connection can be obtained
     */
    Connection acquire() throws SQLException;

    /**
     * Returns a connection to the free set.
     *
     * @param connection a connection previously obtained from {@link #acquire()}
     * @throws SQLException if the connection cannot be returned
     */
    void release(Connection connection) throws SQLException;

    /**
     * Removes a connection from the pool and closes it instead of returning it to the free set.
     *
     * @param connection a connection previously obtained from {@link #acquire()}
     */
    void discard(Connection connection);

    /**
     * Closes every connection the pool tracks and marks the pool closed. No-op if already closed.
     */
    void closeAll();

    /**
     * @return {@code true} once {@link #closeAll()} has been called
     */
    boolean isClosed();
}
