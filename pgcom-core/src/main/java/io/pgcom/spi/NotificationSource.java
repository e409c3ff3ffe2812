package io.pgcom.spi;

import io.pgcom.listen.Notification;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.List;

/**
 * Driver-specific access to asynchronous notifications delivered on a connection that has
 * issued {@code LISTEN}.
 */
public interface NotificationSource {

    /**
     * Blocks until notifications are available on the connection or the timeout expires, then
     * drains the driver's pending queue.
     *
     * @param connection the listening connection
     * @param timeout    maximum time to wait; must be positive
     * @return pending notifications in arrival order; empty if the wait timed out
     * @throws SQLException if the connection fails while waiting
     */
    List<Notification> await(Connection connection, Duration timeout) throws SQLException;
}
