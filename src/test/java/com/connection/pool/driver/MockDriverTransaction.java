package com.connection.pool.driver;

import java.io.IOException;

public class MockDriverTransaction implements DriverTransaction {

    private final MockDriverConnection connection;
    private volatile boolean committed;
    private volatile boolean rolledBack;

    MockDriverTransaction(MockDriverConnection connection) {
        this.connection = connection;
    }

    public boolean isCommitted() {
        return committed;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    @Override
    public void commit() throws DriverException, IOException {
        connection.checkQuery("COMMIT");
        committed = true;
    }

    @Override
    public void rollback() throws DriverException, IOException {
        connection.checkQuery("ROLLBACK");
        rolledBack = true;
    }

    @Override
    public DriverStatement bind(DriverStatement statement) {
        return ((MockDriverStatement) statement).boundTo(this);
    }

    @Override
    public boolean isValid() {
        return !committed && !rolledBack && connection.isConnected();
    }
}
