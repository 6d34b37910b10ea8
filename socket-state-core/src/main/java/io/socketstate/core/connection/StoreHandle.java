package io.socketstate.core.connection;

import org.redisson.api.RBucket;
import org.redisson.api.RMap;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A connected client bound to one logical Redis store. The client's codec is fixed
 * when the handle is built, so every bucket and map obtained here decodes the same way.
 */
public class StoreHandle implements AutoCloseable {
    
    private static final Logger log = LoggerFactory.getLogger(StoreHandle.class);
    
    public enum Mode {
        SINGLE,
        SENTINEL
    }
    
    private final RedissonClient client;
    private final boolean decodeText;
    private final Mode mode;
    private final String description;
    
    public StoreHandle(RedissonClient client, boolean decodeText, Mode mode, String description) {
        if (client == null) {
            throw new IllegalArgumentException("RedissonClient cannot be null");
        }
        this.client = client;
        this.decodeText = decodeText;
        this.mode = mode == null ? Mode.SINGLE : mode;
        this.description = description;
    }
    
    public <V> RBucket<V> getBucket(String name) {
        return client.getBucket(name);
    }
    
    public <K, V> RMap<K, V> getMap(String name) {
        return client.getMap(name);
    }
    
    /**
     * Lua scripts always exchange arguments and results as text.
     */
    public RScript getScript() {
        return client.getScript(StringCodec.INSTANCE);
    }
    
    public RedissonClient getClient() {
        return client;
    }
    
    public boolean isDecodeText() {
        return decodeText;
    }
    
    public Mode getMode() {
        return mode;
    }
    
    /**
     * Connection target with credentials masked.
     */
    public String getDescription() {
        return description;
    }
    
    public boolean isClosed() {
        return client.isShutdown() || client.isShuttingDown();
    }
    
    @Override
    public void close() {
        if (!isClosed()) {
            client.shutdown();
            log.info("Redis client closed: {}", description);
        }
    }
    
    @Override
    public String toString() {
        return "StoreHandle{" + mode + " " + description + ", decodeText=" + decodeText + "}";
    }
}
