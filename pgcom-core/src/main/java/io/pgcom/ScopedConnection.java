package io.pgcom;

import io.pgcom.spi.ConnectionPool;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * A connection borrowed from a {@link ConnectionPool} for the duration of a
 * try-with-resources block.
 *
 * <p>{@link #close()} hands the connection back exactly once: to the pool it was drawn from,
 * or, if that pool has been closed in the meantime or the connection was marked with
 * {@link #discardOnClose()}, it is discarded instead. Further calls to {@code close()} are no-ops.
 *
 * <p>Instances are confined to the borrowing thread and must not be retained after close.
 */
public final class ScopedConnection implements AutoCloseable {
    private final Connection connection;
    private final ConnectionPool pool;
    private boolean discard;
    private boolean closed;

    public ScopedConnection(Connection connection, ConnectionPool pool) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    /**
     * @return the borrowed connection
     * @throws IllegalStateException if this scope has been closed
     */
    public Connection connection() {
        if (closed) {
            throw new IllegalStateException("Connection has already been released");
        }
        return connection;
    }

    /**
     * Marks the connection as unfit for reuse; {@link #close()} will discard it instead of
     * returning it to the pool.
     */
    public void discardOnClose() {
        this.discard = true;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() throws SQLException {
        if (closed) {
            return;
        }
        closed = true;
        if (discard || pool.isClosed()) {
            pool.discard(connection);
        } else {
            pool.release(connection);
        }
    }
}
