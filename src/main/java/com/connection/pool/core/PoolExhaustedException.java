package com.connection.pool.core;

/**
 * Thrown when no connection became available within the connect timeout.
 * The caller may retry.
 */
public class PoolExhaustedException extends PoolException {

    private final int total;
    private final int available;
    private final int maxConnections;

    public PoolExhaustedException(int total, int available, int maxConnections) {
        super("Timeout reached while waiting for SQL connection (total: " + total
                + ", avail: " + available + ", max: " + maxConnections + ")");
        this.total = total;
        this.available = available;
        this.maxConnections = maxConnections;
    }

    public int getTotal() {
        return total;
    }

    public int getAvailable() {
        return available;
    }

    public int getMaxConnections() {
        return maxConnections;
    }
}
