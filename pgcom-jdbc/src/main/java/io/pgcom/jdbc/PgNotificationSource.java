package io.pgcom.jdbc;

import io.pgcom.listen.Notification;
import io.pgcom.spi.NotificationSource;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * {@link NotificationSource} using pgJDBC's blocking {@link PGConnection#getNotifications(int)}.
 *
 * <p>Works through pool proxies: the connection is unwrapped to {@link PGConnection}.
 */
public final class PgNotificationSource implements NotificationSource {

    @Override
    public List<Notification> await(Connection connection, Duration timeout) throws SQLException {
        PGConnection pg = connection.unwrap(PGConnection.class);
        // 0 would block forever
        int millis = (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
        PGNotification[] pending = pg.getNotifications(millis);
        if (pending == null || pending.length == 0) {
            return List.of();
        }
        return Arrays.stream(pending)
                .map(n -> new Notification(n.getName(), n.getParameter(), n.getPID()))
                .toList();
    }
}
