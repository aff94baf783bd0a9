package com.connection.pool.driver;

/**
 * A single row kept from a query or statement execution.
 *
 * @param row    the row, or null if the result set was empty
 * @param result the result it was read from
 */
public record ResultRow(Row row, DriverResult result) {
}
