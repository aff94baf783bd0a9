package com.connection.pool.driver;

/**
 * Creates unconnected {@link DriverConnection} handles.
 */
@FunctionalInterface
public interface DriverConnectionFactory {

    /**
     * Creates a new handle for the given endpoint. The handle is not connected yet.
     *
     * @param settings endpoint and credentials
     * @return a new, unconnected handle
     */
    DriverConnection create(ConnectionSettings settings);
}
