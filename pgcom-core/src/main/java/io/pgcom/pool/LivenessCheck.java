package io.pgcom.pool;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Decides whether a freshly checked-out connection can still reach the server.
 *
 * <p>An exception thrown by the check counts as a dead connection.
 *
 * @see PooledConnector#ping(Connection)
 */
@FunctionalInterface
public interface LivenessCheck {

    boolean isAlive(Connection connection) throws SQLException;
}
