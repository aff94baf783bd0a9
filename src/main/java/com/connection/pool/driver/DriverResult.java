package com.connection.pool.driver;

import java.io.IOException;
import java.util.List;

/**
 * Result of a statement. Either status-only (affected rows, insert id) or a
 * result set whose rows are read from the connection as they are requested.
 */
public interface DriverResult {

    /**
     * @return column names of the result set, empty for status-only results
     */
    List<String> getColumnNames();

    /**
     * @return true if the statement produced no result set
     */
    boolean isStatusOnly();

    long getAffectedRows();

    long getInsertId();

    /**
     * @return true if a multi-statement query or stored procedure has further results
     */
    boolean hasMoreResults();

    /**
     * Reads the next row.
     *
     * @return the row, or null once the result set is exhausted
     */
    Row getRow() throws DriverException, IOException;

    /**
     * Reads all remaining rows.
     */
    List<Row> getRows() throws DriverException, IOException;

    /**
     * Reads the first remaining row and discards the rest.
     *
     * @return the row, or null if the result set is empty
     */
    Row getFirstRow() throws DriverException, IOException;

    /**
     * Reads all remaining rows and returns the last one.
     *
     * @return the row, or null if the result set is empty
     */
    Row getLastRow() throws DriverException, IOException;

    /**
     * Moves to the next result of a multi-statement query or stored procedure.
     *
     * @return the next result, or null if there is none
     */
    DriverResult nextResult() throws DriverException, IOException;

    /**
     * Discards all unread rows.
     */
    void end() throws DriverException, IOException;

    /**
     * Reads the next row into the given row, replacing its values.
     *
     * @param row the row to fill
     * @throws java.io.EOFException once the result set is exhausted
     */
    void scanRow(Row row) throws DriverException, IOException;
}
