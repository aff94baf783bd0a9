package com.connection.pool.core;

/**
 * Thrown at connect time when a collation is configured without a charset.
 */
public class CollationWithoutCharsetException extends PoolException {

    public CollationWithoutCharsetException() {
        super("Can't set collation without setting charset");
    }
}
