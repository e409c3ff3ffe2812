package io.pgcom.jdbc;

import io.pgcom.ScopedConnection;
import io.pgcom.listen.Listener;
import io.pgcom.listen.ListenerCallbacks;
import io.pgcom.listen.Notification;
import io.pgcom.listen.Subscription;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class ListenerPostgresIntegrationTest {

    @Container
    static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
            .withDatabaseName("pgcom_listen");

    private static Commuter commuter;

    @BeforeAll
    static void connect() {
        commuter = Commuter.create(io.pgcom.ConnectionSettings.builder()
                .jdbcUrl(postgres.getJdbcUrl())
                .user(postgres.getUsername())
                .password(postgres.getPassword())
                .poolSize(4)
                .build());
    }

    @AfterAll
    static void disconnect() {
        if (commuter != null) {
            commuter.close();
        }
    }

    @Test
    void notificationsInOneTransactionArriveInOrder() throws Exception {
        PgNotificationSource source = new PgNotificationSource();
        try (ScopedConnection scoped = commuter.connector().openConnection()) {
            scoped.discardOnClose();
            Connection conn = scoped.connection();
            try (Statement st = conn.createStatement()) {
                st.execute("LISTEN \"direct\"");
            }
            commuter.execute("NOTIFY \"direct\", 'one'; NOTIFY \"direct\", 'two'");

            List<Notification> received = new ArrayList<>();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (received.size() < 2 && System.nanoTime() < deadline) {
                received.addAll(source.await(conn, Duration.ofMillis(500)));
            }

            assertEquals(List.of("one", "two"), received.stream().map(Notification::payload).toList());
            assertEquals("direct", received.get(0).channel());
        }
    }

    @Test
    void awaitTimesOutEmpty() throws Exception {
        try (ScopedConnection scoped = commuter.connector().openConnection()) {
            scoped.discardOnClose();
            assertTrue(new PgNotificationSource().await(scoped.connection(), Duration.ofMillis(100)).isEmpty());
        }
    }

    @Test
    void triggerPublishesInsertedRows() throws Exception {
        commuter.execute("DROP TABLE IF EXISTS people");
        commuter.execute("CREATE TABLE people (id serial PRIMARY KEY, name text)");
        Listener listener = commuter.listener();
        listener.createNotifyFunction("notify_people", "people_changes");
        listener.createTrigger("notify_people", "people");

        BlockingQueue<String> payloads = new LinkedBlockingQueue<>();
        CountDownLatch listening = new CountDownLatch(1);
        CountDownLatch closed = new CountDownLatch(1);
        Subscription sub = listener.start("people_changes", ListenerCallbacks.builder()
                .onNotify(payloads::add)
                .onTimeout(listening::countDown)
                .onClose(closed::countDown)
                .build(), Duration.ofMillis(200));
        try {
            assertTrue(listening.await(10, TimeUnit.SECONDS));
            commuter.execute("INSERT INTO people (name) VALUES ('alice'); INSERT INTO people (name) VALUES ('bob')");

            String first = payloads.poll(10, TimeUnit.SECONDS);
            String second = payloads.poll(10, TimeUnit.SECONDS);
            assertNotNull(first);
            assertNotNull(second);
            assertTrue(first.contains("\"name\":\"alice\""), first);
            assertTrue(second.contains("\"name\":\"bob\""), second);
        } finally {
            sub.close();
        }
        assertTrue(closed.await(1, TimeUnit.SECONDS));
        assertFalse(listener.isListening());
    }
}
