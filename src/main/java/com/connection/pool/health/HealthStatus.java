package com.connection.pool.health;

import com.connection.pool.core.PoolSize;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a {@link ConnectionPoolHealthCheck}: the status, the pool size seen
 * right after the check and, when the ping succeeded, its round-trip time.
 *
 * @param latency ping round-trip time, null unless the status is UP
 */
public record HealthStatus(Status status, String message, PoolSize poolSize, int maxConnections,
                           Duration latency) {

    public enum Status { UP, DEGRADED, DOWN }

    static HealthStatus up(Duration latency, PoolSize poolSize, int maxConnections) {
        return new HealthStatus(Status.UP, "Ping succeeded", poolSize, maxConnections, latency);
    }

    static HealthStatus degraded(String reason, PoolSize poolSize, int maxConnections) {
        return new HealthStatus(Status.DEGRADED, reason, poolSize, maxConnections, null);
    }

    static HealthStatus down(String reason, PoolSize poolSize, int maxConnections) {
        return new HealthStatus(Status.DOWN, reason, poolSize, maxConnections, null);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    /**
     * Flattened view for reporting endpoints and logs.
     */
    public Map<String, Object> details() {
        Map<String, Object> details = new LinkedHashMap<>();
        if (latency != null) {
            details.put("latencyMs", latency.toMillis());
        }
        details.put("totalConnections", poolSize.total());
        details.put("availableConnections", poolSize.available());
        details.put("maxConnections", maxConnections);
        return Collections.unmodifiableMap(details);
    }
}
