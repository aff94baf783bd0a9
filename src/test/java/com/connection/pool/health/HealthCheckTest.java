package com.connection.pool.health;

import com.connection.pool.core.BoundedConnectionPool;
import com.connection.pool.core.ConnectionPool;
import com.connection.pool.core.PoolConfig;
import com.connection.pool.core.PoolExhaustedException;
import com.connection.pool.core.PoolSize;
import com.connection.pool.driver.DriverException;
import com.connection.pool.driver.MockDriverConnectionFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("up() should report latency and pool size in order")
        void upDetails() {
            HealthStatus status = HealthStatus.up(Duration.ofMillis(12), new PoolSize(3, 1), 10);

            assertTrue(status.isUp());
            assertEquals(HealthStatus.Status.UP, status.status());
            assertEquals(List.of("latencyMs", "totalConnections", "availableConnections", "maxConnections"),
                    List.copyOf(status.details().keySet()));
            assertEquals(12L, status.details().get("latencyMs"));
        }

        @Test
        @DisplayName("degraded() and down() should carry their reason and no latency")
        void degradedAndDown() {
            HealthStatus degraded = HealthStatus.degraded("Pool exhausted", new PoolSize(10, 0), 10);
            HealthStatus down = HealthStatus.down("Database unreachable", new PoolSize(0, 0), 10);

            assertEquals(HealthStatus.Status.DEGRADED, degraded.status());
            assertEquals("Pool exhausted", degraded.message());
            assertNull(degraded.latency());
            assertEquals(HealthStatus.Status.DOWN, down.status());
            assertEquals("Database unreachable", down.message());
            assertFalse(down.details().containsKey("latencyMs"));
        }

        @Test
        @DisplayName("details should be immutable")
        void detailsImmutable() {
            HealthStatus status = HealthStatus.up(Duration.ZERO, new PoolSize(1, 1), 2);
            assertThrows(UnsupportedOperationException.class,
                    () -> status.details().put("another", "value"));
        }
    }

    @Nested
    @DisplayName("ConnectionPoolHealthCheck")
    @ExtendWith(MockitoExtension.class)
    class PoolCheckTests {

        @Mock
        private ConnectionPool pool;

        @Test
        @DisplayName("Should report UP with latency when ping succeeds")
        void up() throws Exception {
            when(pool.ping()).thenReturn(Duration.ofMillis(3));
            when(pool.size()).thenReturn(new PoolSize(4, 2));
            when(pool.getMaxConnections()).thenReturn(10);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isUp());
            assertEquals(Duration.ofMillis(3), status.latency());
            assertEquals(new PoolSize(4, 2), status.poolSize());
            assertEquals(4, status.details().get("totalConnections"));
            assertEquals(2, status.details().get("availableConnections"));
            assertEquals(10, status.details().get("maxConnections"));
        }

        @Test
        @DisplayName("Should report DEGRADED when the pool is exhausted")
        void degraded() throws Exception {
            when(pool.ping()).thenThrow(new PoolExhaustedException(10, 0, 10));
            when(pool.size()).thenReturn(new PoolSize(10, 0));
            when(pool.getMaxConnections()).thenReturn(10);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertTrue(status.message().contains("total: 10"));
            assertEquals(new PoolSize(10, 0), status.poolSize());
        }

        @Test
        @DisplayName("Should report DOWN when ping fails")
        void down() throws Exception {
            when(pool.ping()).thenThrow(new DriverException(2003, "HY000", "Can't connect to MySQL server"));
            when(pool.size()).thenReturn(new PoolSize(0, 0));
            when(pool.getMaxConnections()).thenReturn(10);

            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertTrue(status.message().contains("#2003"));
            assertNull(status.latency());
        }
    }

    @Test
    @DisplayName("Should report UP against a live pool")
    void livePool() {
        try (BoundedConnectionPool pool = new BoundedConnectionPool(
                PoolConfig.builder().maxConnections(2).build(), new MockDriverConnectionFactory())) {
            HealthStatus status = new ConnectionPoolHealthCheck(pool).check();

            assertTrue(status.isUp(), status.message());
            assertEquals(new PoolSize(1, 1), status.poolSize());
            assertEquals(2, status.maxConnections());
        }
    }
}
