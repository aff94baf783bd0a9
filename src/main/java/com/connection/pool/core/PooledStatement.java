package com.connection.pool.core;

import com.connection.pool.driver.DriverException;
import com.connection.pool.driver.DriverStatement;
import com.connection.pool.driver.ResultRow;
import com.connection.pool.driver.ResultRows;

import java.io.IOException;

/**
 * A prepared statement cached on a {@link PooledConnection}.
 * Executions are bounded by the pool's request timeout.
 */
public class PooledStatement implements DriverStatement {

    private final DriverStatement delegate;
    private final PooledConnection connection;
    private final String sql;

    PooledStatement(DriverStatement delegate, PooledConnection connection, String sql) {
        this.delegate = delegate;
        this.connection = connection;
        this.sql = sql;
    }

    @Override
    public int getParamCount() {
        return delegate.getParamCount();
    }

    @Override
    public ResultRows exec(Object... params) throws DriverException, IOException {
        ResultRows rows = connection.execute(() -> delegate.exec(params));
        return new ResultRows(rows.rows(), wrap(rows));
    }

    @Override
    public ResultRow execFirst(Object... params) throws DriverException, IOException {
        ResultRow row = connection.execute(() -> delegate.execFirst(params));
        return new ResultRow(row.row(), wrap(row));
    }

    @Override
    public ResultRow execLast(Object... params) throws DriverException, IOException {
        ResultRow row = connection.execute(() -> delegate.execLast(params));
        return new ResultRow(row.row(), wrap(row));
    }

    /**
     * Deallocates the statement and drops it from the connection's cache.
     */
    @Override
    public void delete() throws DriverException, IOException {
        connection.destroyOnError(() -> {
            delegate.delete();
            return null;
        });
        connection.forgetStatement(sql, this);
    }

    public String getSql() {
        return sql;
    }

    public PooledConnection getConnection() {
        return connection;
    }

    DriverStatement getDelegate() {
        return delegate;
    }

    private PooledResult wrap(ResultRows rows) {
        return rows.result() != null ? new PooledResult(rows.result(), connection) : null;
    }

    private PooledResult wrap(ResultRow row) {
        return row.result() != null ? new PooledResult(row.result(), connection) : null;
    }

    @Override
    public String toString() {
        return sql;
    }
}
