package io.socketstate.core.connection;

/**
 * Client-side tuning passed to Redisson. Timeouts are the only cancellation
 * mechanism; nothing above the client adds its own.
 */
public class ConnectionOptions {
    
    private int timeout = 3000;
    private int connectTimeout = 5000;
    private int poolSize = 64;
    private int minIdle = 10;
    private int retryAttempts = 3;
    private int retryInterval = 1500;
    private boolean checkSentinelsList = true;
    
    public static ConnectionOptions defaults() {
        return new ConnectionOptions();
    }
    
    public int getTimeout() { return timeout; }
    public ConnectionOptions setTimeout(int timeout) { this.timeout = timeout; return this; }
    public int getConnectTimeout() { return connectTimeout; }
    public ConnectionOptions setConnectTimeout(int connectTimeout) { this.connectTimeout = connectTimeout; return this; }
    public int getPoolSize() { return poolSize; }
    public ConnectionOptions setPoolSize(int poolSize) { this.poolSize = poolSize; return this; }
    public int getMinIdle() { return minIdle; }
    public ConnectionOptions setMinIdle(int minIdle) { this.minIdle = minIdle; return this; }
    public int getRetryAttempts() { return retryAttempts; }
    public ConnectionOptions setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; return this; }
    public int getRetryInterval() { return retryInterval; }
    public ConnectionOptions setRetryInterval(int retryInterval) { this.retryInterval = retryInterval; return this; }
    public boolean isCheckSentinelsList() { return checkSentinelsList; }
    public ConnectionOptions setCheckSentinelsList(boolean checkSentinelsList) { 
        this.checkSentinelsList = checkSentinelsList; 
        return this; 
    }
}
