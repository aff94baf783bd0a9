package com.connection.pool.core;

import com.connection.pool.driver.DriverConnection;
import com.connection.pool.driver.DriverException;
import com.connection.pool.driver.DriverResult;
import com.connection.pool.driver.DriverStatement;
import com.connection.pool.driver.DriverTransaction;
import com.connection.pool.driver.ResultRow;
import com.connection.pool.driver.ResultRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A {@link DriverConnection} that belongs to a {@link BoundedConnectionPool}.
 *
 * <p>Every network operation is bounded by the pool's request timeout, and every
 * error is classified by {@link FatalErrors}: a fatal error destroys the connection
 * before the error reaches the caller. Prepared statements are cached per SQL text.</p>
 *
 * <p>A leased connection belongs to exactly one caller and must not be shared
 * between threads. Closing it releases it to the pool:</p>
 * <pre>
 * try (PooledConnection conn = pool.lease()) {
 *     ResultRows rows = conn.query("SELECT id, name FROM users WHERE id = ?", 42);
 * }
 * </pre>
 */
public class PooledConnection implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PooledConnection.class);

    private final DriverConnection driver;
    private final Clock clock;
    private final Instant expiresAt;
    private final Map<String, PooledStatement> statements = new ConcurrentHashMap<>();
    private volatile BoundedConnectionPool pool;

    PooledConnection(DriverConnection driver, BoundedConnectionPool pool, Clock clock, Instant expiresAt) {
        this.driver = driver;
        this.pool = pool;
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    /**
     * Opens the connection and applies the configured charset and collation.
     *
     * @throws CollationWithoutCharsetException if a collation is configured without a charset
     */
    public void connect() throws DriverException, IOException {
        driver.connect();
        prepareSession();
    }

    /**
     * Closes and reopens the connection. Cached statements are dropped since the
     * server forgets them with the old session.
     */
    public void reconnect() throws DriverException, IOException {
        driver.reconnect();
        statements.clear();
        prepareSession();
    }

    /**
     * Returns this connection to its pool.
     *
     * @throws ConnectionNotInPoolException if the connection was destroyed
     */
    public void release() {
        BoundedConnectionPool owner = pool;
        if (owner == null) {
            throw new ConnectionNotInPoolException();
        }
        owner.release(this);
    }

    /**
     * Releases the connection if it still belongs to a pool. Does nothing after
     * the connection was destroyed.
     */
    @Override
    public void close() {
        BoundedConnectionPool owner = pool;
        if (owner != null) {
            owner.release(this);
        }
    }

    /**
     * Closes the network connection and removes this connection from its pool.
     * A destroyed connection must not be used again.
     */
    public void destroy() {
        if (driver.isConnected()) {
            try {
                driver.close();
            } catch (DriverException | IOException | RuntimeException e) {
                log.warn("Error closing connection: {}", e.getMessage());
            }
        }

        BoundedConnectionPool owner = pool;
        if (owner != null) {
            owner.remove(this);
        }
    }

    public boolean isDestroyed() {
        return pool == null;
    }

    /**
     * @return when the connection stops being reused, or null if it never expires
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public ResultRows query(String sql, Object... params) throws DriverException, IOException {
        ResultRows rows = execute(() -> driver.query(sql, params));
        return new ResultRows(rows.rows(), wrap(rows.result()));
    }

    public ResultRow queryFirst(String sql, Object... params) throws DriverException, IOException {
        ResultRow row = execute(() -> driver.queryFirst(sql, params));
        return new ResultRow(row.row(), wrap(row.result()));
    }

    public ResultRow queryLast(String sql, Object... params) throws DriverException, IOException {
        ResultRow row = execute(() -> driver.queryLast(sql, params));
        return new ResultRow(row.row(), wrap(row.result()));
    }

    /**
     * Starts a query whose rows are streamed through the returned result.
     */
    public PooledResult start(String sql, Object... params) throws DriverException, IOException {
        return wrap(execute(() -> driver.start(sql, params)));
    }

    /**
     * Returns a prepared statement for the given SQL. A statement is only prepared
     * the first time its SQL is used on this connection.
     */
    public PooledStatement prepare(String sql) throws DriverException, IOException {
        PooledStatement cached = statements.get(sql);
        if (cached != null) {
            return cached;
        }

        DriverStatement prepared = execute(() -> driver.prepare(sql));
        PooledStatement statement = new PooledStatement(prepared, this, sql);
        statements.put(sql, statement);
        return statement;
    }

    public PooledTransaction begin() throws DriverException, IOException {
        DriverTransaction transaction = execute(driver::begin);
        return new PooledTransaction(transaction, this);
    }

    public void use(String database) throws DriverException, IOException {
        execute(() -> {
            driver.use(database);
            return null;
        });
    }

    /**
     * Checks that the connection is open, answers a ping and has not expired.
     * A connection that fails any check is destroyed.
     */
    boolean verify() {
        if (!driver.isConnected()) {
            log.debug("Connection is closed, discarding");
            destroy();
            return false;
        }

        try {
            withTimeout(() -> {
                driver.ping();
                return null;
            });
        } catch (DriverException | IOException | RuntimeException e) {
            log.debug("Connection failed ping, discarding: {}", e.getMessage());
            destroy();
            return false;
        }

        if (expiresAt != null && clock.instant().isAfter(expiresAt)) {
            log.debug("Connection expired at {}, discarding", expiresAt);
            destroy();
            return false;
        }
        return true;
    }

    /**
     * Runs the call on the pool's request executor and waits up to the request timeout.
     * On timeout the connection is destroyed, which closes the socket and aborts the
     * remote operation. The call itself is abandoned and its outcome discarded.
     */
    <T> T withTimeout(DriverCall<T> call) throws DriverException, IOException {
        BoundedConnectionPool owner = requirePool();
        Duration timeout = owner.getConfig().getRequestTimeout();
        if (timeout.isZero()) {
            return call.call();
        }

        Callable<T> task = call::call;
        Future<T> future;
        try {
            future = owner.getRequestExecutor().submit(task);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Pool is closed", e);
        }

        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Request exceeded {}ms, closing connection", timeout.toMillis());
            destroy();
            throw new RequestTimeoutException(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy();
            throw new InterruptedIOException("Interrupted while waiting for request to complete");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DriverException driverError) throw driverError;
            if (cause instanceof IOException ioError) throw ioError;
            if (cause instanceof RuntimeException runtimeError) throw runtimeError;
            if (cause instanceof Error error) throw error;
            throw new IllegalStateException("Unexpected failure in driver call", cause);
        }
    }

    /**
     * Runs the call and destroys the connection if it fails with a fatal error.
     * The error is rethrown unchanged either way.
     */
    <T> T destroyOnError(DriverCall<T> call) throws DriverException, IOException {
        try {
            return call.call();
        } catch (DriverException | IOException | RuntimeException e) {
            if (FatalErrors.isFatal(e)) {
                log.debug("Destroying connection after fatal error: {}", e.getMessage());
                destroy();
            }
            throw e;
        }
    }

    /**
     * Classification wraps the deadline so that it always runs on the calling thread.
     */
    <T> T execute(DriverCall<T> call) throws DriverException, IOException {
        return destroyOnError(() -> withTimeout(call));
    }

    /**
     * Clears the pool reference. Called by the pool with its lock held.
     *
     * @return false if the connection was already detached from this pool
     */
    boolean detach(BoundedConnectionPool owner) {
        if (pool != owner) {
            return false;
        }
        statements.clear();
        pool = null;
        return true;
    }

    BoundedConnectionPool getPool() {
        return pool;
    }

    void forgetStatement(String sql, PooledStatement statement) {
        statements.remove(sql, statement);
    }

    int cachedStatementCount() {
        return statements.size();
    }

    private PooledResult wrap(DriverResult result) {
        return result != null ? new PooledResult(result, this) : null;
    }

    private BoundedConnectionPool requirePool() {
        BoundedConnectionPool owner = pool;
        if (owner == null) {
            throw new ConnectionNotInPoolException();
        }
        return owner;
    }

    private void prepareSession() throws DriverException, IOException {
        PoolConfig config = requirePool().getConfig();
        String charset = config.getCharset();
        String collation = config.getCollation();

        if (!collation.isEmpty() && charset.isEmpty()) {
            throw new CollationWithoutCharsetException();
        }
        if (charset.isEmpty()) {
            return;
        }

        String sql = "SET NAMES '" + charset + "'";
        if (!collation.isEmpty()) {
            sql += " COLLATE '" + collation + "'";
        }
        query(sql);
    }
}
