package com.connection.pool.driver;

import java.io.IOException;

/**
 * A server-side prepared statement.
 */
public interface DriverStatement {

    int getParamCount();

    ResultRows exec(Object... params) throws DriverException, IOException;

    ResultRow execFirst(Object... params) throws DriverException, IOException;

    ResultRow execLast(Object... params) throws DriverException, IOException;

    /**
     * Deallocates the statement on the server.
     */
    void delete() throws DriverException, IOException;
}
