package io.pgcom.spring.boot;

import io.pgcom.CommandExecutor;
import io.pgcom.ConnectionSettings;
import io.pgcom.Connector;
import io.pgcom.QueryExecutionException;
import io.pgcom.QueryResult;
import io.pgcom.jdbc.HikariConnectionPool;
import io.pgcom.jdbc.Commuter;
import io.pgcom.listen.Listener;
import io.pgcom.pool.PooledConnector;
import io.pgcom.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PgcomAutoConfigurationTest {

    private static final String H2_URL =
            "jdbc:h2:mem:pgcom_autoconfig;MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1";

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PgcomAutoConfiguration.class));

    @Test
    void inactiveWithoutConnectionTarget() {
        runner.run(ctx -> {
            assertFalse(ctx.containsBean("pgcomConnector"));
            assertFalse(ctx.containsBean("pgcomCommuter"));
        });
    }

    @Test
    void createsBeansForJdbcUrl() {
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL, "pgcom.pool-size=2").run(ctx -> {
            assertTrue(ctx.containsBean("pgcomConnectionSettings"));
            assertInstanceOf(PooledConnector.class, ctx.getBean(Connector.class));
            assertTrue(ctx.containsBean("pgcomCommandExecutor"));
            assertTrue(ctx.containsBean("pgcomCommuter"));
            assertEquals(2, ctx.getBean(ConnectionSettings.class).poolSize());
        });
    }

    @Test
    void commuterRunsAgainstConfiguredDatabase() {
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL).run(ctx -> {
            Commuter commuter = ctx.getBean(Commuter.class);
            commuter.execute("CREATE TABLE IF NOT EXISTS autoconfig_probe (id INT)");
            commuter.execute("DELETE FROM autoconfig_probe");
            commuter.execute("INSERT INTO autoconfig_probe (id) VALUES (7)");

            QueryResult rows = commuter.select("SELECT id FROM autoconfig_probe");
            assertEquals(1, rows.size());
            assertEquals(7, ((Number) rows.firstValue()).intValue());
        });
    }

    @Test
    void sharesConnectorAcrossComponents() {
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL).run(ctx -> {
            Connector connector = ctx.getBean(Connector.class);
            Commuter commuter = ctx.getBean(Commuter.class);
            assertSame(connector, commuter.connector());
            assertSame(ctx.getBean(CommandExecutor.class), commuter.executor());
        });
    }

    @Test
    void listenerBeansArePrototypes() {
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL, "pgcom.listener.timeout=1s").run(ctx -> {
            Listener first = ctx.getBean(Listener.class);
            Listener second = ctx.getBean(Listener.class);
            assertNotSame(first, second);
            assertEquals(Listener.State.IDLE, first.state());
        });
    }

    @Test
    void usesMetricsExporterBean() {
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL)
                .withUserConfiguration(CountingExporterConfig.class)
                .run(ctx -> {
                    CountingExporter exporter = ctx.getBean(CountingExporter.class);
                    Commuter commuter = ctx.getBean(Commuter.class);
                    assertThrows(QueryExecutionException.class,
                            () -> commuter.execute("SELECT * FROM missing_table"));
                    assertEquals(1, exporter.failures);
                });
    }

    @Test
    void backsOffWhenConnectorPresent() {
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL)
                .withUserConfiguration(CustomConnectorConfig.class)
                .run(ctx -> {
                    assertFalse(ctx.containsBean("pgcomConnector"));
                    assertSame(ctx.getBean("customConnector"), ctx.getBean(Commuter.class).connector());
                });
    }

    @Test
    void connectorClosedWithContext() {
        PooledConnector[] holder = new PooledConnector[1];
        runner.withPropertyValues("pgcom.jdbc-url=" + H2_URL).run(ctx ->
                holder[0] = (PooledConnector) ctx.getBean(Connector.class));
        assertTrue(holder[0].isClosed());
    }

    @Configuration
    static class CountingExporterConfig {
        @Bean
        CountingExporter countingExporter() {
            return new CountingExporter();
        }
    }

    @Configuration
    static class CustomConnectorConfig {
        @Bean
        Connector customConnector() {
            return PooledConnector.builder()
                    .settings(ConnectionSettings.builder().jdbcUrl(H2_URL).poolSize(1).build())
                    .poolFactory(HikariConnectionPool.factory())
                    .build();
        }
    }

    static final class CountingExporter implements MetricsExporter {
        int failures;

        @Override
        public void incrementPingFailures() {
        }

        @Override
        public void incrementPoolRestarts() {
        }

        @Override
        public void incrementExecutionFailures() {
            failures++;
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
