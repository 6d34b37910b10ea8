package io.socketstate.starter.health;

import io.socketstate.core.connection.StoreHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports whether every Redis node behind the store handle answers PING.
 * In Sentinel mode this covers the discovered primary.
 */
public class RedisStoreHealthIndicator implements HealthIndicator {
    
    private static final Logger log = LoggerFactory.getLogger(RedisStoreHealthIndicator.class);
    
    private final StoreHandle handle;
    
    public RedisStoreHealthIndicator(StoreHandle handle) {
        this.handle = handle;
    }
    
    @Override
    public Health health() {
        if (handle.isClosed()) {
            return Health.down()
                .withDetail("mode", handle.getMode().name())
                .withDetail("target", handle.getDescription())
                .withDetail("message", "Redis client is shut down")
                .build();
        }
        
        try {
            boolean pingResult = handle.getClient().getNodesGroup().pingAll();
            Health.Builder builder = pingResult ? Health.up() : Health.down();
            return builder
                .withDetail("redis", pingResult ? "PONG" : "FAILED")
                .withDetail("mode", handle.getMode().name())
                .withDetail("target", handle.getDescription())
                .build();
                
        } catch (Exception e) {
            log.error("❌ Redis health check failed: {}", e.getMessage());
            return Health.down()
                .withDetail("redis", "DOWN")
                .withDetail("mode", handle.getMode().name())
                .withDetail("target", handle.getDescription())
                .withDetail("error", e.getMessage())
                .build();
        }
    }
}
