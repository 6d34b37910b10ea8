package io.socketstate.core.connection;

import io.socketstate.core.exception.StoreConfigurationException;

/**
 * Locator URL used when connecting through Redis Sentinel:
 * {@code redis://[user[:pass]@]service[:port][/db]}.
 * The host segment names the monitored master, not a network host.
 */
public final class SentinelLocator {
    
    public static final String DEFAULT_SERVICE = "mymaster";
    
    private final String username;
    private final String password;
    private final String service;
    private final int port;
    private final int database;
    
    public SentinelLocator(String username, String password, String service, int port, int database) {
        this.username = username;
        this.password = password;
        this.service = service;
        this.port = port;
        this.database = database;
    }
    
    public static SentinelLocator parse(String url) {
        RedisUrl parsed = RedisUrl.parse(url);
        if (!RedisUrl.SCHEME_REDIS.equals(parsed.getScheme())) {
            throw new StoreConfigurationException("Invalid Redis URL scheme. Must be 'redis'.");
        }
        return new SentinelLocator(
            parsed.getUsername(),
            parsed.getPassword(),
            parsed.getHost() != null ? parsed.getHost() : DEFAULT_SERVICE,
            parsed.getPort() > 0 ? parsed.getPort() : RedisUrl.DEFAULT_PORT,
            parsed.getDatabase());
    }
    
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public String getService() { return service; }
    public int getPort() { return port; }
    public int getDatabase() { return database; }
    
    @Override
    public String toString() {
        return "SentinelLocator{service=" + service + ", port=" + port + ", database=" + database
            + ", username=" + username + "}";
    }
}
