package com.connection.pool.core;

import com.connection.pool.driver.DriverException;

import java.io.EOFException;
import java.util.Set;

/**
 * Decides whether an error means the connection it happened on can no longer be used.
 */
public final class FatalErrors {

    /**
     * Codes from 2000 up are client-side and transport errors.
     */
    static final int FIRST_CLIENT_ERROR_CODE = 2000;

    /**
     * Server errors that indicate resource exhaustion, shutdown, corruption,
     * protocol desync or replication failure.
     */
    static final Set<Integer> FATAL_SERVER_CODES = Set.of(
            1021, // Disk is full
            1037, // Server is out of memory and needs to be restarted
            1041, // Server is out of memory
            1042, // Can't get hostname
            1043, // Bad handshake
            1044, // Access denied to database
            1045, // Access denied
            1053, // Server shutdown in progress
            1077, // Normal shutdown
            1078, // Aborting because of signal
            1079, // Shutdown complete
            1080, // Forcing thread to close
            1081, // Can't create IP socket
            1114, // Table is full
            1119, // Thread stack overrun
            1152, // Aborting connection
            1153, // Network packet too large
            1154, // Read error from pipe
            1155, // Error from fcntl()
            1156, // Network packets out of order
            1157, // Couldn't decompress packet
            1158, // Error reading network packets
            1159, // Timeout when reading packets
            1160, // Error writing network packets
            1161, // Timeout when writing packets
            1188, // Error from master
            1189, // Network error reading from master
            1190, // Network error writing to master
            1194, // Table has crashed and requires repair
            1195, // Table has crashed and repair failed
            1197, // Transaction cache is full
            1203, // User has too many connections
            1218, // Error connecting to master
            1219, // Error running query on master
            1436, // Thread stack overrun
            1459, // Table upgrade required
            1534, // Writing to binlog failed
            1535, // Table definitions on master and slave don't match
            1547, // Column count wrong; table is probably corrupted
            1548, // Table is probably corrupted
            1610, // Corrupted replication statement
            1705  // Statement cache is full
    );

    private FatalErrors() {
    }

    /**
     * An error is fatal if it is:
     * <ul>
     *   <li>a driver error with a client-side code (2000 and up)</li>
     *   <li>a driver error with one of the {@link #FATAL_SERVER_CODES}</li>
     *   <li>any other exception except {@link EOFException}, which marks the end of a result set</li>
     * </ul>
     *
     * @param error the error, may be null
     * @return true if the connection should be destroyed
     */
    public static boolean isFatal(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof DriverException driverError) {
            return isFatalCode(driverError.getCode());
        }
        return !(error instanceof EOFException);
    }

    public static boolean isFatalCode(int code) {
        return code >= FIRST_CLIENT_ERROR_CODE || FATAL_SERVER_CODES.contains(code);
    }
}
