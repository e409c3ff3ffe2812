package io.pgcom.pool;

import io.pgcom.CommandExecutor;
import io.pgcom.ConnectionSettings;
import io.pgcom.QueryExecutionException;
import io.pgcom.QueryResult;
import io.pgcom.ScopedConnection;
import io.pgcom.StubConnectionPool;
import io.pgcom.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class PooledConnectorTest {

    private final List<StubConnectionPool> pools = new ArrayList<>();
    private final List<Long> sleeps = new ArrayList<>();
    private final CountingMetrics metrics = new CountingMetrics();
    private final AtomicInteger failingRebuilds = new AtomicInteger();

    private PooledConnector connector(boolean prePing, int maxReconnects, LivenessCheck check) {
        ConnectionSettings settings = ConnectionSettings.builder()
                .jdbcUrl(StubConnectionPool.h2Url("connector"))
                .prePing(prePing)
                .maxReconnects(maxReconnects)
                .build();
        return PooledConnector.builder()
                .settings(settings)
                .poolFactory(s -> {
                    if (!pools.isEmpty() && failingRebuilds.getAndDecrement() > 0) {
                        throw new IllegalStateException("Connection refused");
                    }
                    StubConnectionPool pool = StubConnectionPool.h2("connector");
                    pools.add(pool);
                    return pool;
                })
                .backoffPolicy(retry -> 1000L * (1L << retry))
                .sleeper(sleeps::add)
                .livenessCheck(check)
                .metrics(metrics)
                .build();
    }

    /** Reports the first {@code deadCount} connections as dead. */
    private static LivenessCheck deadFor(int deadCount) {
        AtomicInteger calls = new AtomicInteger();
        return conn -> calls.incrementAndGet() > deadCount;
    }

    @Test
    void withoutPrePingNoCheckIsMade() throws SQLException {
        PooledConnector connector = connector(false, 3, conn -> fail("should not ping"));
        try (ScopedConnection scoped = connector.openConnection()) {
            assertTrue(PooledConnector.ping(scoped.connection()));
        }
        assertEquals(1, pools.size());
        assertEquals(1, pools.get(0).released.size());
    }

    @Test
    void aliveConnectionIsHandedOutWithoutRestart() throws SQLException {
        PooledConnector connector = connector(true, 3, PooledConnector::ping);
        try (ScopedConnection scoped = connector.openConnection()) {
            assertFalse(scoped.connection().isClosed());
        }
        assertEquals(1, pools.size());
        assertTrue(sleeps.isEmpty());
        assertEquals(0, metrics.restarts.get());
    }

    @Test
    void firstDeadConnectionRebuildsWithoutSleeping() throws SQLException {
        PooledConnector connector = connector(true, 3, deadFor(1));
        Connection handedOut;
        try (ScopedConnection scoped = connector.openConnection()) {
            handedOut = scoped.connection();
        }
        assertEquals(2, pools.size());
        assertTrue(pools.get(0).isClosed());
        assertEquals(1, pools.get(0).discarded.size());
        assertNotSame(pools.get(0).discarded.get(0), handedOut);
        assertEquals(List.of(handedOut), pools.get(1).released);
        assertTrue(sleeps.isEmpty());
        assertEquals(1, metrics.restarts.get());
        assertEquals(1, metrics.pingFailures.get());
    }

    @Test
    void laterFailuresSleepWithGrowingBackoff() throws SQLException {
        PooledConnector connector = connector(true, 5, deadFor(3));
        try (ScopedConnection ignored = connector.openConnection()) {
            assertEquals(4, pools.size());
        }
        assertEquals(List.of(1000L, 2000L), sleeps);
        assertEquals(3, metrics.restarts.get());
    }

    @Test
    void exhaustedBudgetHandsOutLastConnectionAnyway() throws SQLException {
        PooledConnector connector = connector(true, 3, conn -> false);
        try (ScopedConnection scoped = connector.openConnection()) {
            assertNotNull(scoped.connection());
        }
        assertEquals(4, pools.size());
        assertEquals(List.of(1000L, 2000L), sleeps);
        assertEquals(3, metrics.pingFailures.get());
        assertEquals(1, pools.get(3).released.size());
    }

    @Test
    void failingCheckCountsAsDead() throws SQLException {
        AtomicInteger calls = new AtomicInteger();
        PooledConnector connector = connector(true, 3, conn -> {
            if (calls.getAndIncrement() == 0) {
                throw new SQLException("broken pipe");
            }
            return true;
        });
        try (ScopedConnection ignored = connector.openConnection()) {
            assertEquals(2, pools.size());
        }
    }

    @Test
    void connectionFromReplacedPoolIsDiscardedOnClose() throws SQLException {
        PooledConnector connector = connector(false, 3, PooledConnector::ping);
        ScopedConnection held = connector.openConnection();
        connector.restartPool();
        held.close();
        held.close();
        assertEquals(1, pools.get(0).discarded.size());
        assertTrue(pools.get(0).released.isEmpty());
        assertEquals(1, pools.get(0).handedBack());
    }

    @Test
    void connectionMarkedForDiscardIsNotReleased() throws SQLException {
        PooledConnector connector = connector(false, 3, PooledConnector::ping);
        try (ScopedConnection scoped = connector.openConnection()) {
            scoped.discardOnClose();
        }
        assertEquals(1, pools.get(0).discarded.size());
        assertTrue(pools.get(0).released.isEmpty());
    }

    @Test
    void interruptedBackoffDiscardsConnectionAndFails() {
        ConnectionSettings settings = ConnectionSettings.builder()
                .jdbcUrl(StubConnectionPool.h2Url("connector")).prePing(true).build();
        PooledConnector connector = PooledConnector.builder()
                .settings(settings)
                .poolFactory(s -> {
                    StubConnectionPool pool = StubConnectionPool.h2("connector");
                    pools.add(pool);
                    return pool;
                })
                .livenessCheck(conn -> false)
                .sleeper(millis -> {
                    throw new InterruptedException();
                })
                .build();
        SQLException ex = assertThrows(SQLException.class, connector::openConnection);
        assertInstanceOf(InterruptedException.class, ex.getCause());
        assertTrue(Thread.interrupted());
        assertEquals(1, pools.get(1).discarded.size());
    }

    @Test
    void closeAllClosesCurrentPool() {
        PooledConnector connector = connector(false, 3, PooledConnector::ping);
        connector.close();
        assertTrue(connector.isClosed());
        assertTrue(pools.get(0).isClosed());
        assertThrows(SQLException.class, connector::openConnection);
    }

    @Test
    void failedRebuildKeepsCurrentPool() throws SQLException {
        failingRebuilds.set(1);
        PooledConnector connector = connector(true, 3, deadFor(1));

        SQLException ex = assertThrows(SQLException.class, connector::openConnection);
        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals(1, pools.size());
        assertFalse(pools.get(0).isClosed());
        assertFalse(connector.isClosed());
        assertEquals(0, metrics.restarts.get());

        try (ScopedConnection scoped = connector.openConnection()) {
            assertTrue(PooledConnector.ping(scoped.connection()));
        }
        connector.restartPool();
        assertEquals(2, pools.size());
        assertTrue(pools.get(0).isClosed());
        assertFalse(pools.get(1).isClosed());
    }

    @Test
    void failedRebuildSurfacesAsQueryExecutionException() {
        failingRebuilds.set(1);
        PooledConnector connector = connector(true, 3, deadFor(1));
        CommandExecutor executor = new CommandExecutor(connector);

        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> executor.execute("SELECT 1"));
        assertInstanceOf(SQLException.class, ex.getCause());

        QueryResult result = executor.execute("SELECT 1");
        assertEquals(1, ((Number) result.firstValue()).intValue());
    }

    @Test
    void closeAllDuringRecoveryPreventsRebuild() {
        AtomicReference<PooledConnector> holder = new AtomicReference<>();
        PooledConnector connector = connector(true, 3, conn -> {
            holder.get().closeAll();
            return false;
        });
        holder.set(connector);

        SQLException ex = assertThrows(SQLException.class, connector::openConnection);
        assertEquals("Connector is closed", ex.getMessage());
        assertEquals(1, pools.size());
        assertTrue(pools.get(0).isClosed());
        assertTrue(connector.isClosed());
        assertThrows(SQLException.class, connector::restartPool);
    }

    static final class CountingMetrics implements MetricsExporter {
        final AtomicInteger pingFailures = new AtomicInteger();
        final AtomicInteger restarts = new AtomicInteger();

        @Override
        public void incrementPingFailures() {
            pingFailures.incrementAndGet();
        }

        @Override
        public void incrementPoolRestarts() {
            restarts.incrementAndGet();
        }

        @Override
        public void incrementExecutionFailures() {
        }

        @Override
        public void incrementRollbackFailures() {
        }

        @Override
        public void incrementNotificationsReceived() {
        }

        @Override
        public void incrementCallbackFailures() {
        }
    }
}
