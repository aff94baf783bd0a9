package com.connection.pool.driver;

/**
 * Error reported by the server or by the driver's client library.
 * Codes below 2000 come from the server, codes from 2000 up are client-side
 * and transport errors.
 */
public class DriverException extends Exception {

    private final int code;
    private final String sqlState;

    public DriverException(int code, String message) {
        this(code, null, message, null);
    }

    public DriverException(int code, String sqlState, String message) {
        this(code, sqlState, message, null);
    }

    public DriverException(int code, String sqlState, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.sqlState = sqlState;
    }

    public int getCode() {
        return code;
    }

    /**
     * @return the five-character SQL state, or null if the driver did not report one
     */
    public String getSqlState() {
        return sqlState;
    }

    @Override
    public String getMessage() {
        return "Received #" + code + (sqlState != null ? " (" + sqlState + ")" : "") + " error: " + super.getMessage();
    }
}
