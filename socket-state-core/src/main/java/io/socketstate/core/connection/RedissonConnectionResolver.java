package io.socketstate.core.connection;

import io.socketstate.core.exception.StoreConfigurationException;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.client.codec.StringCodec;
import org.redisson.config.Config;
import org.redisson.config.ReadMode;
import org.redisson.config.SentinelServersConfig;
import org.redisson.config.SingleServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds a {@link RedissonClient} either in single-server mode from a direct URL or in
 * Sentinel mode from a locator URL plus Sentinel endpoints. Connection failures from
 * {@code Redisson.create} are not caught here.
 */
public class RedissonConnectionResolver implements ConnectionResolver {

    private static final Logger log = LoggerFactory.getLogger(RedissonConnectionResolver.class);

    private static final String DEFAULT_HOST = "localhost";

    private final ConnectionOptions options;
    private final Function<Config, RedissonClient> clientFactory;

    public RedissonConnectionResolver() {
        this(ConnectionOptions.defaults());
    }

    public RedissonConnectionResolver(ConnectionOptions options) {
        this(options, Redisson::create);
    }

    public RedissonConnectionResolver(ConnectionOptions options, Function<Config, RedissonClient> clientFactory) {
        if (clientFactory == null) {
            throw new IllegalArgumentException("Client factory cannot be null");
        }
        this.options = options == null ? ConnectionOptions.defaults() : options;
        this.clientFactory = clientFactory;
    }

    @Override
    public StoreHandle resolve(String address, List<DiscoveryEndpoint> discoveryEndpoints, boolean decodeText) {
        Config config = new Config();
        config.setCodec(decodeText ? StringCodec.INSTANCE : ByteArrayCodec.INSTANCE);

        if (discoveryEndpoints == null || discoveryEndpoints.isEmpty()) {
            RedisUrl url = RedisUrl.parse(address);
            configureSingle(config.useSingleServer(), url);

            String description = RedisUrl.mask(address);
            RedissonClient client = clientFactory.apply(config);
            log.info("✓ Redis client created (single: {})", description);
            return new StoreHandle(client, decodeText, StoreHandle.Mode.SINGLE, description);
        }

        SentinelLocator locator = SentinelLocator.parse(address);
        configureSentinel(config.useSentinelServers(), locator, discoveryEndpoints);

        String description = locator.getService() + "/" + locator.getDatabase() + " via "
            + discoveryEndpoints.stream().map(DiscoveryEndpoint::toString).collect(Collectors.joining(","));
        RedissonClient client = clientFactory.apply(config);
        log.info("✓ Redis client created (sentinel: {})", description);
        return new StoreHandle(client, decodeText, StoreHandle.Mode.SENTINEL, description);
    }

    void configureSingle(SingleServerConfig server, RedisUrl url) {
        if (!RedisUrl.SCHEME_REDIS.equals(url.getScheme()) && !RedisUrl.SCHEME_REDIS_TLS.equals(url.getScheme())) {
            throw new StoreConfigurationException("Unsupported Redis URL scheme '" + url.getScheme()
                + "'. Must be 'redis' or 'rediss'.");
        }

        server.setAddress(url.toAddress(DEFAULT_HOST, RedisUrl.DEFAULT_PORT))
                .setDatabase(url.getDatabase())
                .setConnectionPoolSize(options.getPoolSize())
                .setConnectionMinimumIdleSize(options.getMinIdle())
                .setUsername(url.getUsername())
                .setPassword(url.getPassword())
                .setTimeout(options.getTimeout())
                .setConnectTimeout(options.getConnectTimeout())
                .setRetryAttempts(options.getRetryAttempts())
                .setRetryInterval(options.getRetryInterval());
    }

    void configureSentinel(SentinelServersConfig sentinel, SentinelLocator locator,
                           List<DiscoveryEndpoint> discoveryEndpoints) {
        for (DiscoveryEndpoint endpoint : discoveryEndpoints) {
            sentinel.addSentinelAddress(endpoint.toAddress(locator.getPort()));
        }

        // all reads go to the primary, replicas may lag behind a lock write
        sentinel.setMasterName(locator.getService())
                .setDatabase(locator.getDatabase())
                .setReadMode(ReadMode.MASTER)
                .setCheckSentinelsList(options.isCheckSentinelsList())
                .setMasterConnectionPoolSize(options.getPoolSize())
                .setMasterConnectionMinimumIdleSize(options.getMinIdle())
                .setUsername(locator.getUsername())
                .setPassword(locator.getPassword())
                .setTimeout(options.getTimeout())
                .setConnectTimeout(options.getConnectTimeout())
                .setRetryAttempts(options.getRetryAttempts())
                .setRetryInterval(options.getRetryInterval());
    }
}
