package com.connection.pool.driver;

import java.io.IOException;

/**
 * An open transaction on a {@link DriverConnection}.
 */
public interface DriverTransaction {

    void commit() throws DriverException, IOException;

    void rollback() throws DriverException, IOException;

    /**
     * Binds a prepared statement to this transaction.
     *
     * @param statement a statement prepared on the same connection
     * @return a statement whose executions run inside this transaction
     */
    DriverStatement bind(DriverStatement statement);

    /**
     * @return true while the transaction is attached to an open connection
     */
    boolean isValid();
}
