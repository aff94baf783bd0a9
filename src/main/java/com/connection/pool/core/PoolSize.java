package com.connection.pool.core;

/**
 * Snapshot of a {@link ConnectionPool}'s size.
 *
 * @param total     open connections, leased and idle
 * @param available idle connections ready to be leased
 */
public record PoolSize(int total, int available) {

    /**
     * @return connections currently leased
     */
    public int leased() {
        return total - available;
    }
}
