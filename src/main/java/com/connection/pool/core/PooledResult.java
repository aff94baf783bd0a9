package com.connection.pool.core;

import com.connection.pool.driver.DriverException;
import com.connection.pool.driver.DriverResult;
import com.connection.pool.driver.Row;

import java.io.IOException;
import java.util.List;

/**
 * Result of a query run on a {@link PooledConnection}.
 * Errors raised while reading rows destroy the connection when they are fatal.
 */
public class PooledResult implements DriverResult {

    private final DriverResult delegate;
    private final PooledConnection connection;

    PooledResult(DriverResult delegate, PooledConnection connection) {
        this.delegate = delegate;
        this.connection = connection;
    }

    public PooledConnection getConnection() {
        return connection;
    }

    @Override
    public List<String> getColumnNames() {
        return delegate.getColumnNames();
    }

    @Override
    public boolean isStatusOnly() {
        return delegate.isStatusOnly();
    }

    @Override
    public long getAffectedRows() {
        return delegate.getAffectedRows();
    }

    @Override
    public long getInsertId() {
        return delegate.getInsertId();
    }

    @Override
    public boolean hasMoreResults() {
        return delegate.hasMoreResults();
    }

    @Override
    public Row getRow() throws DriverException, IOException {
        return connection.destroyOnError(delegate::getRow);
    }

    @Override
    public List<Row> getRows() throws DriverException, IOException {
        return connection.destroyOnError(delegate::getRows);
    }

    @Override
    public Row getFirstRow() throws DriverException, IOException {
        return connection.destroyOnError(delegate::getFirstRow);
    }

    @Override
    public Row getLastRow() throws DriverException, IOException {
        return connection.destroyOnError(delegate::getLastRow);
    }

    /**
     * Returns the next result of a multi-statement query or stored procedure,
     * bound to the same connection.
     */
    @Override
    public PooledResult nextResult() throws DriverException, IOException {
        DriverResult next = connection.destroyOnError(delegate::nextResult);
        return next != null ? new PooledResult(next, connection) : null;
    }

    @Override
    public void end() throws DriverException, IOException {
        connection.destroyOnError(() -> {
            delegate.end();
            return null;
        });
    }

    @Override
    public void scanRow(Row row) throws DriverException, IOException {
        connection.destroyOnError(() -> {
            delegate.scanRow(row);
            return null;
        });
    }
}
