package com.connection.pool.health;

import com.connection.pool.core.ConnectionPool;
import com.connection.pool.core.PoolExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Health check that pings the database through the pool.
 * DEGRADED when no connection could be leased in time, DOWN when the ping fails.
 * Runs only when {@link #check()} is called.
 */
public class ConnectionPoolHealthCheck {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolHealthCheck.class);

    private final ConnectionPool pool;

    public ConnectionPoolHealthCheck(ConnectionPool pool) {
        this.pool = pool;
    }

    /**
     * Pings the pool. Failures are reported in the returned status, never thrown.
     */
    public HealthStatus check() {
        try {
            Duration latency = pool.ping();
            return HealthStatus.up(latency, pool.size(), pool.getMaxConnections());
        } catch (PoolExhaustedException e) {
            return HealthStatus.degraded("Connection pool exhausted: " + e.getMessage(),
                    pool.size(), pool.getMaxConnections());
        } catch (Exception e) {
            log.warn("Connection pool health check failed: {}", e.getMessage());
            return HealthStatus.down("Ping failed: " + e.getMessage(), pool.size(), pool.getMaxConnections());
        }
    }
}
