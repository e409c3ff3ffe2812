package io.pgcom.spring.boot;

import io.pgcom.ConnectionSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for pgcom.
 *
 * @see PgcomAutoConfiguration
 */
@ConfigurationProperties(prefix = "pgcom")
public class PgcomProperties {

    /**
     * Database host address.
     */
    private String host;

    private int port = ConnectionSettings.DEFAULT_PORT;

    private String user;

    private String password;

    /**
     * Database name.
     */
    private String dbName;

    /**
     * Explicit JDBC URL; overrides host, port and database name.
     */
    private String jdbcUrl;

    /**
     * Maximum number of pooled connections.
     */
    private int poolSize = ConnectionSettings.DEFAULT_POOL_SIZE;

    /**
     * Ping every connection before handing it out.
     */
    private boolean prePing;

    /**
     * Liveness attempts before a possibly dead connection is handed out anyway.
     */
    private int maxReconnects = ConnectionSettings.DEFAULT_MAX_RECONNECTS;

    /**
     * Default schema, used as the connection search path.
     */
    private String schema;

    /**
     * Driver properties passed through verbatim.
     */
    private Map<String, String> options = new LinkedHashMap<>();

    private final Listener listener = new Listener();
    private final Metrics metrics = new Metrics();

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getDbName() {
        return dbName;
    }

    public void setDbName(String dbName) {
        this.dbName = dbName;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public void setJdbcUrl(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public boolean isPrePing() {
        return prePing;
    }

    public void setPrePing(boolean prePing) {
        this.prePing = prePing;
    }

    public int getMaxReconnects() {
        return maxReconnects;
    }

    public void setMaxReconnects(int maxReconnects) {
        this.maxReconnects = maxReconnects;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public Map<String, String> getOptions() {
        return options;
    }

    public void setOptions(Map<String, String> options) {
        this.options = options;
    }

    public Listener getListener() {
        return listener;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Builds immutable connection settings from these properties.
     */
    public ConnectionSettings toSettings() {
        return ConnectionSettings.builder()
                .host(host)
                .port(port)
                .user(user)
                .password(password)
                .dbName(dbName)
                .jdbcUrl(jdbcUrl)
                .poolSize(poolSize)
                .prePing(prePing)
                .maxReconnects(maxReconnects)
                .schema(schema)
                .options(options)
                .build();
    }

    public static class Listener {
        /**
         * How long one wait for notifications may block before the timeout callback runs.
         */
        private Duration timeout = Duration.ofSeconds(5);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "pgcom";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
