package com.connection.pool.core;

import java.time.Duration;

/**
 * Thrown when an operation exceeds the request timeout. The connection it ran on
 * has been destroyed; lease a new one before retrying.
 */
public class RequestTimeoutException extends PoolException {

    private final Duration timeout;

    public RequestTimeoutException(Duration timeout) {
        super("Query took too long to execute (timeout=" + timeout.toMillis() + "ms)");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
