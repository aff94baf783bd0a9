package com.connection.pool.driver;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Factory that records every handle it creates. An optional decorator wraps
 * each {@link MockDriverConnection}, e.g. to inject latency.
 */
public class MockDriverConnectionFactory implements DriverConnectionFactory {

    private final List<MockDriverConnection> created = new CopyOnWriteArrayList<>();
    private final List<ConnectionSettings> settings = new CopyOnWriteArrayList<>();
    private final Function<MockDriverConnection, DriverConnection> decorator;
    private volatile Exception connectFailure;

    public MockDriverConnectionFactory() {
        this(conn -> conn);
    }

    public MockDriverConnectionFactory(Function<MockDriverConnection, DriverConnection> decorator) {
        this.decorator = decorator;
    }

    /**
     * Makes every connection created from now on fail to connect. Null restores normal behavior.
     */
    public void failConnectsWith(Exception failure) {
        this.connectFailure = failure;
    }

    @Override
    public DriverConnection create(ConnectionSettings connectionSettings) {
        MockDriverConnection conn = new MockDriverConnection();
        conn.failConnectWith(connectFailure);
        created.add(conn);
        settings.add(connectionSettings);
        return decorator.apply(conn);
    }

    public List<MockDriverConnection> getCreated() {
        return List.copyOf(created);
    }

    public MockDriverConnection last() {
        return created.get(created.size() - 1);
    }

    public List<ConnectionSettings> getSettings() {
        return List.copyOf(settings);
    }
}
