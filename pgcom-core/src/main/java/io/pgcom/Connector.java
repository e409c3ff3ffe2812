package io.pgcom;

import java.sql.SQLException;

/**
 * Hands out scoped database connections for one database target.
 *
 * <p>Every connection obtained through {@link #openConnection()} is released when the returned
 * {@link ScopedConnection} is closed, so callers use it with try-with-resources:
 * <pre>{@code
 * try (ScopedConnection scoped = connector.openConnection()) {
 *     Connection conn = scoped.connection();
 *     ...
 * }
 * }</pre>
 *
 * <p>One connector is created per database target and shared explicitly by the components
 * talking to that target. Closing it closes all of its connections.
 *
 * @see io.pgcom.pool.PooledConnector
 */
public interface Connector extends AutoCloseable {

    /**
     * Draws a connection for exclusive, temporary use by the caller.
     *
     * @return the scoped connection; the caller must close it
     * @throws SQLException if no connection can be obtained
     */
    ScopedConnection openConnection() throws SQLException;

    /**
     * Closes every connection handled by this connector. Safe to call more than once.
     */
    void closeAll();

    /**
     * Same as {@link #closeAll()}.
     */
    @Override
    default void close() {
        closeAll();
    }
}
