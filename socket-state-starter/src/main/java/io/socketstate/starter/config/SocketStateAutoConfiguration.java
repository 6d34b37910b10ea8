package io.socketstate.starter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.socketstate.core.connection.ConnectionOptions;
import io.socketstate.core.connection.ConnectionResolver;
import io.socketstate.core.connection.DiscoveryEndpoint;
import io.socketstate.core.connection.RedisUrl;
import io.socketstate.core.connection.RedissonConnectionResolver;
import io.socketstate.core.connection.StoreHandle;
import io.socketstate.core.metrics.StoreMetrics;
import io.socketstate.starter.health.RedisStoreHealthIndicator;
import io.socketstate.starter.metrics.SocketStateMicrometerMetrics;
import io.socketstate.starter.service.SocketStateService;
import io.socketstate.starter.service.impl.SocketStateServiceImpl;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.stream.Collectors;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(SocketStateProperties.class)
@ConditionalOnProperty(prefix = "socket-state", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SocketStateAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SocketStateAutoConfiguration.class);

    // ═══════════════════════════════════════════════════════════════════════════
    // CONNECTION
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    @ConditionalOnMissingBean(ConnectionResolver.class)
    public ConnectionResolver socketStateConnectionResolver(SocketStateProperties properties) {
        SocketStateProperties.Redis redis = properties.getRedis();
        ConnectionOptions options = ConnectionOptions.defaults()
                .setTimeout(redis.getTimeout())
                .setConnectTimeout(redis.getConnectTimeout())
                .setPoolSize(redis.getPool().getSize())
                .setMinIdle(redis.getPool().getMinIdle())
                .setRetryAttempts(redis.getRetryAttempts())
                .setRetryInterval(redis.getRetryInterval())
                .setCheckSentinelsList(redis.isCheckSentinelsList());
        return new RedissonConnectionResolver(options);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(StoreHandle.class)
    public StoreHandle socketStateStoreHandle(ConnectionResolver resolver, SocketStateProperties properties) {
        List<DiscoveryEndpoint> sentinels = properties.getRedis().getSentinels().stream()
                .map(DiscoveryEndpoint::parse)
                .collect(Collectors.toList());

        log.info("Connecting to Redis: {} (sentinels: {})",
                RedisUrl.mask(properties.getRedis().getUrl()), sentinels.isEmpty() ? "none" : sentinels);
        return resolver.resolve(properties.getRedis().getUrl(), sentinels, true);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // LOCK / DICT
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean("socketStateObjectMapper")
    @ConditionalOnMissingBean(name = "socketStateObjectMapper")
    public ObjectMapper socketStateObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(StoreMetrics.class)
    public StoreMetrics socketStateStoreMetrics() {
        return new StoreMetrics();
    }

    @Bean
    @ConditionalOnMissingBean(SocketStateService.class)
    public SocketStateService socketStateService(
            StoreHandle handle,
            @Qualifier("socketStateObjectMapper") ObjectMapper socketStateObjectMapper,
            StoreMetrics metrics,
            SocketStateProperties properties) {
        log.info("✓ SocketStateService created (consistency: {}, default lock ttl: {}s)",
                properties.getConsistency(), properties.getLock().getDefaultTtlSeconds());
        return new SocketStateServiceImpl(handle, socketStateObjectMapper, metrics, properties);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // OBSERVABILITY
    // ═══════════════════════════════════════════════════════════════════════════

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(RedisStoreHealthIndicator.class)
        @ConditionalOnProperty(prefix = "socket-state.health", name = "enabled", havingValue = "true", matchIfMissing = true)
        public RedisStoreHealthIndicator redisStoreHealthIndicator(StoreHandle handle) {
            log.info("✓ RedisStoreHealthIndicator created");
            return new RedisStoreHealthIndicator(handle);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(SocketStateMicrometerMetrics.class)
        public SocketStateMicrometerMetrics socketStateMicrometerMetrics(StoreMetrics metrics) {
            return new SocketStateMicrometerMetrics(metrics);
        }
    }
}
