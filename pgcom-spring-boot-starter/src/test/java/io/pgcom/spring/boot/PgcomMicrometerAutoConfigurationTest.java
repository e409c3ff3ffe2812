package io.pgcom.spring.boot;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pgcom.QueryExecutionException;
import io.pgcom.jdbc.Commuter;
import io.pgcom.micrometer.MicrometerMetricsExporter;
import io.pgcom.spi.MetricsExporter;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PgcomMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PgcomMicrometerAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
            assertNotNull(ctx.getBean(MeterRegistry.class).find("pgcom.execute.failure").counter());
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("pgcom.metrics.name-prefix=reports.pgcom").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("reports.pgcom.pool.restart").counter());
            assertNull(registry.find("pgcom.pool.restart").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("pgcom.metrics.enabled=false").run(ctx ->
                assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void skippedWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(PgcomMicrometerAutoConfiguration.class))
                .run(ctx -> assertFalse(ctx.containsBean("micrometerMetricsExporter")));
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void executorFailuresReachTheRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        PgcomMicrometerAutoConfiguration.class, PgcomAutoConfiguration.class))
                .withUserConfiguration(MeterRegistryConfig.class)
                .withPropertyValues("pgcom.jdbc-url=jdbc:h2:mem:pgcom_metrics;MODE=PostgreSQL;DB_CLOSE_DELAY=-1")
                .run(ctx -> {
                    Commuter commuter = ctx.getBean(Commuter.class);
                    assertThrows(QueryExecutionException.class,
                            () -> commuter.execute("SELECT * FROM no_such_table"));
                    var registry = ctx.getBean(MeterRegistry.class);
                    assertTrue(registry.get("pgcom.execute.failure").counter().count() >= 1.0);
                    assertTrue(registry.get("pgcom.execute.duration").summary().count() >= 1);
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
