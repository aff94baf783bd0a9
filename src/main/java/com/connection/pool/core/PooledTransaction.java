package com.connection.pool.core;

import com.connection.pool.driver.DriverException;
import com.connection.pool.driver.DriverStatement;
import com.connection.pool.driver.DriverTransaction;

import java.io.IOException;

/**
 * A transaction opened on a {@link PooledConnection}. Statements inside the
 * transaction run on {@link #getConnection()}.
 */
public class PooledTransaction implements DriverTransaction {

    private final DriverTransaction delegate;
    private final PooledConnection connection;

    PooledTransaction(DriverTransaction delegate, PooledConnection connection) {
        this.delegate = delegate;
        this.connection = connection;
    }

    public PooledConnection getConnection() {
        return connection;
    }

    @Override
    public void commit() throws DriverException, IOException {
        connection.execute(() -> {
            delegate.commit();
            return null;
        });
    }

    @Override
    public void rollback() throws DriverException, IOException {
        connection.execute(() -> {
            delegate.rollback();
            return null;
        });
    }

    /**
     * Binds a statement to this transaction. The returned statement is not cached.
     */
    @Override
    public PooledStatement bind(DriverStatement statement) {
        if (statement instanceof PooledStatement pooled) {
            return new PooledStatement(delegate.bind(pooled.getDelegate()), connection, pooled.getSql());
        }
        return new PooledStatement(delegate.bind(statement), connection, statement.toString());
    }

    @Override
    public boolean isValid() {
        return delegate.isValid();
    }
}
