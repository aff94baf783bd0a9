package com.connection.pool.driver;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link DriverConnection} for tests. Every query returns the configured
 * rows; failures can be scripted per operation kind.
 */
public class MockDriverConnection implements DriverConnection {

    private final AtomicBoolean connected = new AtomicBoolean(false);
    private final AtomicInteger connectCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();
    private final AtomicInteger pingCount = new AtomicInteger();
    private final AtomicInteger prepareCount = new AtomicInteger();
    private final List<String> executedSql = new CopyOnWriteArrayList<>();
    private volatile List<Row> rows = List.of(Row.of(1L));
    private volatile Exception connectFailure;
    private volatile Exception pingFailure;
    private volatile Exception queryFailure;
    private volatile Duration timeout = Duration.ZERO;
    private volatile String database;

    // ========== Scripting ==========

    public MockDriverConnection withRows(List<Row> rows) {
        this.rows = List.copyOf(rows);
        return this;
    }

    public void failConnectWith(Exception failure) {
        this.connectFailure = failure;
    }

    public void failPingWith(Exception failure) {
        this.pingFailure = failure;
    }

    /**
     * Makes every query, prepare, begin, use and statement execution throw the given error.
     */
    public void failQueriesWith(Exception failure) {
        this.queryFailure = failure;
    }

    /**
     * Closes the connection from the "server" side.
     */
    public void drop() {
        connected.set(false);
    }

    // ========== Inspection ==========

    public int getConnectCount() { return connectCount.get(); }
    public int getCloseCount() { return closeCount.get(); }
    public int getPingCount() { return pingCount.get(); }
    public int getPrepareCount() { return prepareCount.get(); }
    public List<String> getExecutedSql() { return List.copyOf(executedSql); }
    public Duration getTimeout() { return timeout; }
    public String getDatabase() { return database; }

    List<Row> currentRows() {
        return rows;
    }

    void checkQuery(String sql) throws DriverException, IOException {
        if (!connected.get()) {
            throw new DriverException(2006, "HY000", "MySQL server has gone away");
        }
        executedSql.add(sql);
        rethrow(queryFailure);
    }

    // ========== DriverConnection ==========

    @Override
    public void connect() throws DriverException, IOException {
        rethrow(connectFailure);
        connectCount.incrementAndGet();
        connected.set(true);
    }

    @Override
    public void reconnect() throws DriverException, IOException {
        close();
        connect();
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
        connected.set(false);
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    @Override
    public void ping() throws DriverException, IOException {
        pingCount.incrementAndGet();
        rethrow(pingFailure);
        if (!connected.get()) {
            throw new DriverException(2006, "HY000", "MySQL server has gone away");
        }
    }

    @Override
    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    @Override
    public ResultRows query(String sql, Object... params) throws DriverException, IOException {
        checkQuery(sql);
        MockDriverResult result = new MockDriverResult(List.of());
        return new ResultRows(new ArrayList<>(rows), result);
    }

    @Override
    public ResultRow queryFirst(String sql, Object... params) throws DriverException, IOException {
        checkQuery(sql);
        List<Row> current = rows;
        return new ResultRow(current.isEmpty() ? null : current.get(0), new MockDriverResult(List.of()));
    }

    @Override
    public ResultRow queryLast(String sql, Object... params) throws DriverException, IOException {
        checkQuery(sql);
        List<Row> current = rows;
        return new ResultRow(current.isEmpty() ? null : current.get(current.size() - 1),
                new MockDriverResult(List.of()));
    }

    @Override
    public DriverResult start(String sql, Object... params) throws DriverException, IOException {
        checkQuery(sql);
        return new MockDriverResult(rows);
    }

    @Override
    public DriverStatement prepare(String sql) throws DriverException, IOException {
        checkQuery(sql);
        prepareCount.incrementAndGet();
        return new MockDriverStatement(this, sql);
    }

    @Override
    public DriverTransaction begin() throws DriverException, IOException {
        checkQuery("BEGIN");
        return new MockDriverTransaction(this);
    }

    @Override
    public void use(String database) throws DriverException, IOException {
        checkQuery("USE " + database);
        this.database = database;
    }

    static void rethrow(Exception failure) throws DriverException, IOException {
        if (failure == null) {
            return;
        }
        if (failure instanceof DriverException driverError) throw driverError;
        if (failure instanceof IOException ioError) throw ioError;
        if (failure instanceof RuntimeException runtimeError) throw runtimeError;
        throw new IllegalStateException(failure);
    }
}
