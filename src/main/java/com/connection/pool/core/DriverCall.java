package com.connection.pool.core;

import com.connection.pool.driver.DriverException;

import java.io.IOException;

/**
 * A unit of work against the driver.
 */
@FunctionalInterface
interface DriverCall<T> {

    T call() throws DriverException, IOException;
}
