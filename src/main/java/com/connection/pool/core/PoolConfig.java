package com.connection.pool.core;

import com.connection.pool.driver.ConnectionSettings;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link BoundedConnectionPool}.
 */
public class PoolConfig {

    private final String address;
    private final String protocol;
    private final String username;
    private final String password;
    private final String database;
    private final int maxConnections;
    private final Duration maxConnectionAge;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final boolean keepConnectionsAlive;
    private final String charset;
    private final String collation;

    private PoolConfig(Builder builder) {
        this.address = builder.address;
        this.protocol = builder.protocol;
        this.username = builder.username;
        this.password = builder.password;
        this.database = builder.database;
        this.maxConnections = builder.maxConnections;
        this.maxConnectionAge = builder.maxConnectionAge;
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.keepConnectionsAlive = builder.keepConnectionsAlive;
        this.charset = builder.charset;
        this.collation = builder.collation;
    }

    public String getAddress() { return address; }
    public String getProtocol() { return protocol; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getDatabase() { return database; }
    public int getMaxConnections() { return maxConnections; }
    public Duration getMaxConnectionAge() { return maxConnectionAge; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getRequestTimeout() { return requestTimeout; }
    public boolean isKeepConnectionsAlive() { return keepConnectionsAlive; }
    public String getCharset() { return charset; }
    public String getCollation() { return collation; }

    /**
     * @return the endpoint and credentials handed to the driver factory
     */
    public ConnectionSettings toConnectionSettings() {
        return new ConnectionSettings(protocol, address, username, password, database);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String address = "127.0.0.1:3306";
        private String protocol = "tcp";
        private String username = "";
        private String password = "";
        private String database = "";
        private int maxConnections = 10;
        private Duration maxConnectionAge = Duration.ZERO;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private boolean keepConnectionsAlive = true;
        private String charset = "";
        private String collation = "";

        public Builder address(String address) {
            this.address = Objects.requireNonNull(address, "address");
            return this;
        }

        public Builder protocol(String protocol) {
            this.protocol = Objects.requireNonNull(protocol, "protocol");
            return this;
        }

        public Builder username(String username) {
            this.username = Objects.requireNonNull(username, "username");
            return this;
        }

        public Builder password(String password) {
            this.password = Objects.requireNonNull(password, "password");
            return this;
        }

        public Builder database(String database) {
            this.database = Objects.requireNonNull(database, "database");
            return this;
        }

        public Builder maxConnections(int maxConnections) {
            if (maxConnections <= 0) throw new IllegalArgumentException("maxConnections must be > 0");
            this.maxConnections = maxConnections;
            return this;
        }

        /**
         * Connections older than this are discarded instead of reused. Zero disables expiry.
         */
        public Builder maxConnectionAge(Duration maxConnectionAge) {
            this.maxConnectionAge = requireNotNegative(maxConnectionAge, "maxConnectionAge");
            return this;
        }

        /**
         * Bounds both the driver handshake and the wait for an idle connection.
         * Zero means a full pool fails immediately.
         */
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requireNotNegative(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Bounds every network operation on a leased connection. Zero disables the deadline.
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requireNotNegative(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder keepConnectionsAlive(boolean keepConnectionsAlive) {
            this.keepConnectionsAlive = keepConnectionsAlive;
            return this;
        }

        public Builder charset(String charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder collation(String collation) {
            this.collation = Objects.requireNonNull(collation, "collation");
            return this;
        }

        public PoolConfig build() {
            return new PoolConfig(this);
        }

        private static Duration requireNotNegative(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative()) {
                throw new IllegalArgumentException(name + " must be >= 0");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "address='" + address + '\'' +
                ", protocol='" + protocol + '\'' +
                ", username='" + username + '\'' +
                ", database='" + database + '\'' +
                ", maxConnections=" + maxConnections +
                ", maxConnectionAge=" + maxConnectionAge +
                ", connectTimeout=" + connectTimeout +
                ", requestTimeout=" + requestTimeout +
                ", keepConnectionsAlive=" + keepConnectionsAlive +
                ", charset='" + charset + '\'' +
                ", collation='" + collation + '\'' +
                '}';
    }
}
