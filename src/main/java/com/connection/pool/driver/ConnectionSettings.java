package com.connection.pool.driver;

/**
 * Endpoint and credentials handed to a {@link DriverConnectionFactory}.
 *
 * @param protocol network protocol, e.g. {@code tcp} or {@code unix}
 * @param address  host:port or socket path
 * @param username login user
 * @param password login password
 * @param database default database, may be empty
 */
public record ConnectionSettings(
        String protocol,
        String address,
        String username,
        String password,
        String database
) {

    @Override
    public String toString() {
        return "ConnectionSettings{" +
                "protocol='" + protocol + '\'' +
                ", address='" + address + '\'' +
                ", username='" + username + '\'' +
                ", password='****'" +
                ", database='" + database + '\'' +
                '}';
    }
}
