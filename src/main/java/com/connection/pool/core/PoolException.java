package com.connection.pool.core;

/**
 * Base class for errors raised by the pool itself, as opposed to errors
 * reported by the driver.
 */
public class PoolException extends RuntimeException {

    public PoolException(String message) {
        super(message);
    }

    public PoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
