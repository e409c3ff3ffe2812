package io.pgcom;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable connection parameters for one database target.
 *
 * <p>Besides the basic parameters, any driver-specific property can be passed through
 * {@link Builder#option(String, String)}; such options reach the driver verbatim. When a
 * default {@linkplain Builder#schema(String) schema} is set it is injected into the
 * driver's {@code options} property as {@code --search_path=<schema>}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see ConnectionSettings.Builder
 */
public final class ConnectionSettings {
    public static final int DEFAULT_PORT = 5432;
    public static final int DEFAULT_POOL_SIZE = 20;
    public static final int DEFAULT_MAX_RECONNECTS = 3;

    static final String OPTIONS_PROPERTY = "options";

    private final String host;
    private final int port;
    private final String user;
    private final String password;
    private final String dbName;
    private final String jdbcUrl;
    private final int poolSize;
    private final boolean prePing;
    private final int maxReconnects;
    private final String schema;
    private final Map<String, String> options;

    private ConnectionSettings(Builder builder) {
        if (builder.jdbcUrl == null) {
            Objects.requireNonNull(builder.host, "host");
            Objects.requireNonNull(builder.dbName, "dbName");
        }
        if (builder.port <= 0) {
            throw new IllegalArgumentException("port must be > 0");
        }
        if (builder.poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be > 0");
        }
        if (builder.maxReconnects < 0) {
            throw new IllegalArgumentException("maxReconnects must be >= 0");
        }
        if (builder.schema != null && builder.schema.isBlank()) {
            throw new IllegalArgumentException("schema must not be blank");
        }
        this.host = builder.host;
        this.port = builder.port;
        this.user = builder.user;
        this.password = builder.password;
        this.dbName = builder.dbName;
        this.jdbcUrl = builder.jdbcUrl;
        this.poolSize = builder.poolSize;
        this.prePing = builder.prePing;
        this.maxReconnects = builder.maxReconnects;
        this.schema = builder.schema;
        this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String user() {
        return user;
    }

    public String password() {
        return password;
    }

    public String dbName() {
        return dbName;
    }

    /** Maximum number of connections the pool holds. */
    public int poolSize() {
        return poolSize;
    }

    /** Whether connections are pinged before they are handed out. */
    public boolean prePing() {
        return prePing;
    }

    /** Liveness attempts before a possibly dead connection is handed out anyway. */
    public int maxReconnects() {
        return maxReconnects;
    }

    /** Default schema, or {@code null} if none is configured. */
    public String schema() {
        return schema;
    }

    /** Driver options exactly as configured, without the derived search path. */
    public Map<String, String> options() {
        return options;
    }

    /**
     * Returns the JDBC URL: the explicit one when configured, otherwise
     * {@code jdbc:postgresql://host:port/dbName}.
     */
    public String jdbcUrl() {
        if (jdbcUrl != null) {
            return jdbcUrl;
        }
        return "jdbc:postgresql://" + host + ":" + port + "/" + dbName;
    }

    /**
     * Returns the driver properties: configured options merged with the derived
     * {@code options=--search_path=<schema>} entry. Credentials are not included.
     */
    public Properties driverProperties() {
        Properties props = new Properties();
        options.forEach(props::setProperty);
        if (schema != null) {
            String searchPath = "--search_path=" + schema;
            String existing = props.getProperty(OPTIONS_PROPERTY);
            props.setProperty(OPTIONS_PROPERTY,
                    existing == null || existing.isBlank() ? searchPath : existing + " " + searchPath);
        }
        return props;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        if (jdbcUrl != null) {
            sb.append("url=").append(jdbcUrl).append(' ');
        }
        if (host != null) {
            sb.append("host=").append(host).append(' ');
        }
        if (user != null) {
            sb.append("user=").append(user).append(' ');
        }
        if (dbName != null) {
            sb.append("dbname=").append(dbName).append(' ');
        }
        return sb.append(')').toString();
    }

    /**
     * Builder for {@link ConnectionSettings}.
     */
    public static final class Builder {
        private String host;
        private int port = DEFAULT_PORT;
        private String user;
        private String password;
        private String dbName;
        private String jdbcUrl;
        private int poolSize = DEFAULT_POOL_SIZE;
        private boolean prePing;
        private int maxReconnects = DEFAULT_MAX_RECONNECTS;
        private String schema;
        private final Map<String, String> options = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Sets the database host address.
         *
         * <p><b>Required</b> unless {@link #jdbcUrl(String)} is set.
         */
        public Builder host(String host) {
            this.host = host;
            return this;
        }

        /**
         * Sets the connection port. Optional, defaults to {@code 5432}.
         */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        /**
         * Sets the database name.
         *
         * <p><b>Required</b> unless {@link #jdbcUrl(String)} is set.
         */
        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        /**
         * Sets an explicit JDBC URL, overriding host, port and database name.
         *
         * @param jdbcUrl full JDBC URL
         * @return this builder
         */
        public Builder jdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        /**
         * Sets the maximum number of pooled connections.
         *
         * <p>Optional. Defaults to {@code 20}. Must be &gt; 0.
         */
        public Builder poolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        /**
         * Enables the liveness ping on every connection checkout.
         *
         * <p>Optional. Defaults to {@code false}.
         */
        public Builder prePing(boolean prePing) {
            this.prePing = prePing;
            return this;
        }

        /**
         * Sets the number of liveness attempts made before giving up.
         *
         * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
         */
        public Builder maxReconnects(int maxReconnects) {
            this.maxReconnects = maxReconnects;
            return this;
        }

        /**
         * Sets the default schema. Connections are opened with this schema as their
         * search path and unqualified table names resolve to it.
         */
        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        /**
         * Adds a driver-specific connection property (for example {@code sslmode}).
         */
        public Builder option(String key, String value) {
            options.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
            return this;
        }

        /**
         * Adds all given driver-specific connection properties.
         */
        public Builder options(Map<String, String> options) {
            Objects.requireNonNull(options, "options").forEach(this::option);
            return this;
        }

        /**
         * Builds the settings.
         *
         * @return new immutable settings
         * @throws NullPointerException     if neither a JDBC URL nor host and database name are set
         * @throws IllegalArgumentException if a numeric setting is out of range or the schema is blank
         */
        public ConnectionSettings build() {
            return new ConnectionSettings(this);
        }
    }
}
