package io.pgcom.spring.boot;

import io.pgcom.CommandExecutor;
import io.pgcom.ConnectionSettings;
import io.pgcom.Connector;
import io.pgcom.jdbc.Commuter;
import io.pgcom.jdbc.HikariConnectionPool;
import io.pgcom.jdbc.PgNotificationSource;
import io.pgcom.listen.Listener;
import io.pgcom.pool.PooledConnector;
import io.pgcom.spi.MetricsExporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.AnyNestedCondition;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Scope;

/**
 * Auto-configuration for pgcom.
 *
 * <p>Active when {@code pgcom.host} or {@code pgcom.jdbc-url} is set. Registers one
 * {@link Connector} for the configured database plus the {@link CommandExecutor} and
 * {@link Commuter} sharing it. {@link Listener} beans are prototypes, since a listener runs a
 * single session.
 *
 * @see PgcomProperties
 * @see PgcomMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Commuter.class)
@Conditional(PgcomAutoConfiguration.OnConnectionTarget.class)
@EnableConfigurationProperties(PgcomProperties.class)
public class PgcomAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ConnectionSettings pgcomConnectionSettings(PgcomProperties props) {
        return props.toSettings();
    }

    @Bean(destroyMethod = "closeAll")
    @ConditionalOnMissingBean
    public Connector pgcomConnector(ConnectionSettings settings, ObjectProvider<MetricsExporter> metricsProvider) {
        return PooledConnector.builder()
                .settings(settings)
                .poolFactory(HikariConnectionPool.factory())
                .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandExecutor pgcomCommandExecutor(Connector connector, ObjectProvider<MetricsExporter> metricsProvider) {
        return new CommandExecutor(connector, metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    // the connector bean owns the pool lifecycle
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public Commuter pgcomCommuter(Connector connector, CommandExecutor executor, ConnectionSettings settings,
                                  ObjectProvider<MetricsExporter> metricsProvider) {
        return new Commuter(connector, executor, settings.schema(),
                metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
    }

    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    @ConditionalOnMissingBean
    public Listener pgcomListener(Connector connector, CommandExecutor executor, ConnectionSettings settings,
                                  PgcomProperties props, ObjectProvider<MetricsExporter> metricsProvider) {
        return Listener.builder()
                .connector(connector)
                .executor(executor)
                .notificationSource(new PgNotificationSource())
                .schema(settings.schema())
                .timeout(props.getListener().getTimeout())
                .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
                .build();
    }

    static class OnConnectionTarget extends AnyNestedCondition {

        OnConnectionTarget() {
            super(ConfigurationPhase.REGISTER_BEAN);
        }

        @ConditionalOnProperty(prefix = "pgcom", name = "host")
        static class HostConfigured {
        }

        @ConditionalOnProperty(prefix = "pgcom", name = "jdbc-url")
        static class JdbcUrlConfigured {
        }
    }
}
