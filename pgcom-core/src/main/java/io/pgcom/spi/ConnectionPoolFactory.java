package io.pgcom.spi;

import io.pgcom.ConnectionSettings;

/**
 * Creates {@link ConnectionPool} instances. Called once when a connector is built and again
 * every time the connector rebuilds its pool.
 */
@FunctionalInterface
public interface ConnectionPoolFactory {

    /**
     * Creates a new, open pool for the given settings.
     *
     * @param settings connection parameters and pool size
     * @return a new pool
     * @throws RuntimeException if the parameters are invalid or the pool cannot be initialized
     */
    ConnectionPool create(ConnectionSettings settings);
}
