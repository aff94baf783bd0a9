package com.connection.pool.driver;

import java.io.IOException;
import java.time.Duration;

/**
 * A single physical connection to a SQL server.
 * Abstracts the wire protocol, handshake and result decoding of the underlying driver.
 *
 * <p>Implementations are not thread-safe and run at most one operation at a time.
 * {@link #close()} may be called from another thread to abort an operation in flight.</p>
 */
public interface DriverConnection {

    /**
     * Opens the network connection and performs the authentication handshake.
     */
    void connect() throws DriverException, IOException;

    /**
     * Closes and reopens the network connection.
     */
    void reconnect() throws DriverException, IOException;

    /**
     * Closes the network connection. Any operation in flight fails.
     */
    void close() throws DriverException, IOException;

    /**
     * Checks whether the network connection is open.
     * Does not contact the server.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Sends a round-trip ping to the server.
     */
    void ping() throws DriverException, IOException;

    /**
     * Sets the network timeout used when connecting.
     *
     * @param timeout the timeout; zero leaves the driver default
     */
    void setTimeout(Duration timeout);

    /**
     * Executes a query and reads every row of the first result set.
     *
     * @param sql    the SQL text
     * @param params positional parameters
     * @return the rows and the result they came from
     */
    ResultRows query(String sql, Object... params) throws DriverException, IOException;

    /**
     * Executes a query and keeps only the first row of the first result set.
     */
    ResultRow queryFirst(String sql, Object... params) throws DriverException, IOException;

    /**
     * Executes a query and keeps only the last row of the first result set.
     */
    ResultRow queryLast(String sql, Object... params) throws DriverException, IOException;

    /**
     * Starts a query without reading its rows. Rows are streamed through the returned result.
     *
     * @param sql    the SQL text
     * @param params positional parameters
     * @return the open result
     */
    DriverResult start(String sql, Object... params) throws DriverException, IOException;

    /**
     * Prepares a statement on the server.
     *
     * @param sql the SQL text
     * @return the prepared statement
     */
    DriverStatement prepare(String sql) throws DriverException, IOException;

    /**
     * Begins a transaction.
     *
     * @return the open transaction
     */
    DriverTransaction begin() throws DriverException, IOException;

    /**
     * Selects the database subsequent statements run against.
     *
     * @param database the database name
     */
    void use(String database) throws DriverException, IOException;
}
