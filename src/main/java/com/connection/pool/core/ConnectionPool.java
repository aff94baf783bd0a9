package com.connection.pool.core;

import com.connection.pool.driver.DriverException;

import java.io.IOException;
import java.time.Duration;

/**
 * A bounded pool of {@link PooledConnection}s.
 * Provides lease/release semantics for exclusive use of a connection by one caller.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Leases a connection. Reuses an idle one after verifying it, opens a new one while
     * below capacity, or waits up to the connect timeout for one to come back.
     *
     * @return a connection owned by the caller until released or destroyed
     * @throws PoolExhaustedException if no connection became available in time
     * @throws IllegalStateException  if the pool is closed
     * @throws DriverException        if opening a new connection failed
     * @throws IOException            if opening a new connection failed
     */
    PooledConnection lease() throws DriverException, IOException;

    /**
     * Returns a leased connection. Depending on configuration and its health the
     * connection goes back to the idle queue or is destroyed.
     *
     * @param connection the connection to release
     * @throws ConnectionNotInPoolException if the connection was destroyed or is not from this pool
     */
    void release(PooledConnection connection);

    /**
     * @return the number of open connections and how many of them are idle
     */
    PoolSize size();

    /**
     * Leases a connection, runs a trivial query on it and releases it.
     *
     * @return the round-trip time of the query
     */
    Duration ping() throws DriverException, IOException;

    /**
     * @return the configured capacity
     */
    int getMaxConnections();

    /**
     * Closes the pool and all idle connections.
     */
    @Override
    void close();
}
