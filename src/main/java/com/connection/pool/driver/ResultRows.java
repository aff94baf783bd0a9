package com.connection.pool.driver;

import java.util.List;

/**
 * Rows read eagerly from a query or statement execution.
 *
 * @param rows   the rows of the first result set
 * @param result the result they were read from, for metadata and further results
 */
public record ResultRows(List<Row> rows, DriverResult result) {

    public ResultRows {
        rows = rows != null ? List.copyOf(rows) : List.of();
    }
}
