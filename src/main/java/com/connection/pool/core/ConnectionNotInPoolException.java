package com.connection.pool.core;

/**
 * Thrown when a connection that was destroyed, or never belonged to the pool,
 * is released or used.
 */
public class ConnectionNotInPoolException extends PoolException {

    public ConnectionNotInPoolException() {
        super("Connection not associated with a pool");
    }
}
