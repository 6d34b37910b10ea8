package io.socketstate.starter.config;

import io.socketstate.core.ConsistencyMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "socket-state")
public class SocketStateProperties {
    
    private boolean enabled = true;
    private ConsistencyMode consistency = ConsistencyMode.RELAXED;
    private Redis redis = new Redis();
    private Lock lock = new Lock();
    private Health health = new Health();
    
    public static class Redis {
        /**
         * Direct Redis URL, or the Sentinel locator URL when sentinels are set.
         */
        private String url = "redis://localhost:6379/0";
        /**
         * Sentinel nodes as host:port. Empty means connect directly.
         */
        private List<String> sentinels = new ArrayList<>();
        private int timeout = 3000;
        private int connectTimeout = 5000;
        private int retryAttempts = 3;
        private int retryInterval = 1500;
        private boolean checkSentinelsList = true;
        private Pool pool = new Pool();
        
        public static class Pool {
            private int size = 64;
            private int minIdle = 10;
            
            public int getSize() { return size; }
            public void setSize(int size) { this.size = size; }
            public int getMinIdle() { return minIdle; }
            public void setMinIdle(int minIdle) { this.minIdle = minIdle; }
        }
        
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public List<String> getSentinels() { return sentinels; }
        public void setSentinels(List<String> sentinels) { this.sentinels = sentinels; }
        public int getTimeout() { return timeout; }
        public void setTimeout(int timeout) { this.timeout = timeout; }
        public int getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(int connectTimeout) { this.connectTimeout = connectTimeout; }
        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }
        public int getRetryInterval() { return retryInterval; }
        public void setRetryInterval(int retryInterval) { this.retryInterval = retryInterval; }
        public boolean isCheckSentinelsList() { return checkSentinelsList; }
        public void setCheckSentinelsList(boolean checkSentinelsList) { this.checkSentinelsList = checkSentinelsList; }
        public Pool getPool() { return pool; }
        public void setPool(Pool pool) { this.pool = pool; }
    }
    
    public static class Lock {
        private long defaultTtlSeconds = 30;
        
        public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }
    }
    
    public static class Health {
        private boolean enabled = true;
        
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
    
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public ConsistencyMode getConsistency() { return consistency; }
    public void setConsistency(ConsistencyMode consistency) { this.consistency = consistency; }
    public Redis getRedis() { return redis; }
    public void setRedis(Redis redis) { this.redis = redis; }
    public Lock getLock() { return lock; }
    public void setLock(Lock lock) { this.lock = lock; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
}
