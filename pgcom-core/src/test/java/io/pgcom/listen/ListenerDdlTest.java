package io.pgcom.listen;

import io.pgcom.ConnectionSettings;
import io.pgcom.FakeJdbc;
import io.pgcom.StubConnectionPool;
import io.pgcom.pool.PooledConnector;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListenerDdlTest {

    private final List<String> executed = new ArrayList<>();

    private Listener listener(String schema) {
        StubConnectionPool pool = new StubConnectionPool(() -> FakeJdbc.recordingConnection(executed));
        return Listener.builder()
                .connector(PooledConnector.builder()
                        .settings(ConnectionSettings.builder().jdbcUrl("jdbc:fake").build())
                        .poolFactory(s -> pool)
                        .build())
                .notificationSource(new StubNotificationSource(new ArrayList<>()))
                .schema(schema)
                .build();
    }

    @Test
    void unqualifiedNamesUseConfiguredSchema() {
        Listener l = listener("model");
        l.createNotifyFunction("notify_people", "people_changes");
        l.createTrigger("notify_people", "people");

        assertEquals(3, executed.size());
        assertTrue(executed.get(0).startsWith("CREATE OR REPLACE FUNCTION \"model\".\"notify_people\"()"));
        assertEquals("DROP TRIGGER IF EXISTS \"people_notify\" ON \"model\".\"people\"", executed.get(1));
        assertTrue(executed.get(2).endsWith("EXECUTE FUNCTION \"model\".\"notify_people\"()"));
    }

    @Test
    void qualifiedNamesOverrideSchemaAndPublicIsDefault() {
        Listener l = listener(null);
        l.createTrigger("audit.notify_people", "people");

        assertEquals("DROP TRIGGER IF EXISTS \"people_notify\" ON \"public\".\"people\"", executed.get(0));
        assertTrue(executed.get(1).endsWith("EXECUTE FUNCTION \"audit\".\"notify_people\"()"));
    }
}
