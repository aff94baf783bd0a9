package com.connection.pool.core;

import com.connection.pool.driver.DriverConnection;
import com.connection.pool.driver.DriverConnectionFactory;
import com.connection.pool.driver.DriverException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe connection pool using a {@link ReentrantLock} for membership
 * and an {@link ArrayBlockingQueue} for idle connection hand-off.
 *
 * <p>No connection is opened up front. {@link #lease()} reuses a verified idle
 * connection, opens a new one while below {@code maxConnections}, or waits up to
 * the connect timeout. When a connection is destroyed while callers are waiting,
 * a replacement is opened and queued for them.</p>
 *
 * <p>New connections are opened while holding the lock, so the capacity check and
 * registration are atomic; other pool operations wait for the handshake.</p>
 */
public class BoundedConnectionPool implements ConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(BoundedConnectionPool.class);

    static final String PING_QUERY = "SELECT 1";

    private final PoolConfig config;
    private final DriverConnectionFactory driverFactory;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Set<PooledConnection> openConnections = new HashSet<>();
    private final BlockingQueue<PooledConnection> idleConnections;
    private final ExecutorService requestExecutor;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private int pending;

    public BoundedConnectionPool(PoolConfig config, DriverConnectionFactory driverFactory) {
        this(config, driverFactory, Clock.systemUTC());
    }

    BoundedConnectionPool(PoolConfig config, DriverConnectionFactory driverFactory, Clock clock) {
        this.config = config;
        this.driverFactory = driverFactory;
        this.clock = clock;
        this.idleConnections = new ArrayBlockingQueue<>(config.getMaxConnections());
        this.requestExecutor = Executors.newCachedThreadPool(new RequestThreadFactory());

        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public PooledConnection lease() throws DriverException, IOException {
        while (true) {
            if (closed.get()) {
                throw new IllegalStateException("Pool is closed");
            }

            PooledConnection conn = idleConnections.poll();
            if (conn != null) {
                if (conn.verify()) {
                    log.debug("Connection leased from idle queue ({})", size());
                    return conn;
                }
                continue;
            }

            lock.lock();
            try {
                if (openConnections.size() < config.getMaxConnections()) {
                    PooledConnection created = createConnection();
                    log.debug("Connection leased after opening (total={}, max={})",
                            openConnections.size(), config.getMaxConnections());
                    return created;
                }
                pending++;
            } finally {
                lock.unlock();
            }

            try {
                conn = idleConnections.poll(config.getConnectTimeout().toNanos(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PoolException("Interrupted while waiting for connection", e);
            } finally {
                lock.lock();
                try {
                    pending--;
                } finally {
                    lock.unlock();
                }
            }

            if (conn == null) {
                if (closed.get()) {
                    throw new IllegalStateException("Pool is closed");
                }
                PoolSize size = size();
                log.debug("Timed out waiting for connection ({})", size);
                throw new PoolExhaustedException(size.total(), size.available(), config.getMaxConnections());
            }
            if (conn.verify()) {
                log.debug("Connection leased after waiting ({})", size());
                return conn;
            }
        }
    }

    @Override
    public void release(PooledConnection connection) {
        if (connection == null || connection.getPool() != this) {
            throw new ConnectionNotInPoolException();
        }

        if (config.isKeepConnectionsAlive() && !closed.get() && connection.verify()) {
            lock.lock();
            try {
                // close() drains under the same lock, so nothing is queued after the drain
                if (!closed.get() && idleConnections.offer(connection)) {
                    log.debug("Connection released ({})", size());
                    return;
                }
            } finally {
                lock.unlock();
            }
            log.debug("Pool closed or idle queue full, destroying released connection");
        }
        connection.destroy();
    }

    @Override
    public PoolSize size() {
        lock.lock();
        try {
            return new PoolSize(openConnections.size(), idleConnections.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Duration ping() throws DriverException, IOException {
        try (PooledConnection conn = lease()) {
            long start = System.nanoTime();
            conn.query(PING_QUERY);
            return Duration.ofNanos(System.nanoTime() - start);
        }
    }

    @Override
    public int getMaxConnections() {
        return config.getMaxConnections();
    }

    public PoolConfig getConfig() {
        return config;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        List<PooledConnection> drained = new ArrayList<>();
        lock.lock();
        try {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            idleConnections.drainTo(drained);
        } finally {
            lock.unlock();
        }

        log.info("Closing connection pool, destroying {} idle connection(s)", drained.size());
        drained.forEach(PooledConnection::destroy);
        requestExecutor.shutdown();
        log.info("Connection pool closed ({})", size());
    }

    ExecutorService getRequestExecutor() {
        return requestExecutor;
    }

    int getPending() {
        lock.lock();
        try {
            return pending;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Unregisters a destroyed connection. If callers are waiting, opens a
     * replacement and queues it for them.
     */
    void remove(PooledConnection connection) {
        lock.lock();
        try {
            if (!connection.detach(this)) {
                return;
            }
            boolean wasOpen = openConnections.remove(connection);
            log.debug("Connection destroyed (total={}, available={})",
                    openConnections.size(), idleConnections.size());

            if (wasOpen && pending > 0 && !closed.get()) {
                backfill();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens, connects and registers a new connection. Must be called with the lock held.
     */
    private PooledConnection createConnection() throws DriverException, IOException {
        DriverConnection driver = driverFactory.create(config.toConnectionSettings());
        driver.setTimeout(config.getConnectTimeout());

        Duration maxAge = config.getMaxConnectionAge();
        Instant expiresAt = maxAge.isZero() ? null : clock.instant().plus(maxAge);
        PooledConnection connection = new PooledConnection(driver, this, clock, expiresAt);

        try {
            connection.connect();
        } catch (DriverException | IOException | RuntimeException e) {
            log.debug("Failed to open connection to {}: {}", config.getAddress(), e.getMessage());
            connection.destroy();
            throw e;
        }

        openConnections.add(connection);
        log.debug("Connection opened (total={}, max={})", openConnections.size(), config.getMaxConnections());
        return connection;
    }

    private void backfill() {
        try {
            PooledConnection replacement = createConnection();
            if (!idleConnections.offer(replacement)) {
                // unregister first so destroying it does not trigger another backfill
                openConnections.remove(replacement);
                replacement.destroy();
                return;
            }
            log.debug("Replacement connection queued for {} waiting caller(s)", pending);
        } catch (DriverException | IOException | RuntimeException e) {
            log.warn("Failed to create replacement connection: {}", e.getMessage());
        }
    }

    private static final class RequestThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int poolId = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threadSequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task,
                    "sql-pool-" + poolId + "-request-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
