package io.socketstate.core.lock;

import io.socketstate.core.ConsistencyMode;
import io.socketstate.core.connection.StoreHandle;
import io.socketstate.core.metrics.StoreMetrics;
import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.UUID;

/**
 * {@link DistributedLock} stored as a plain Redis string: key = lock name,
 * value = a random token owned by this instance, expiring after the TTL.
 *
 * <p>Acquire is {@code SET NX EX}. Renew is a Lua compare-and-extend, so an instance
 * whose lock expired and was taken over cannot extend the new holder's lease.
 * Release reads the token and deletes on match; in {@link ConsistencyMode#RELAXED}
 * these are two commands, in {@link ConsistencyMode#STRICT} one Lua script.
 */
public class RedissonDistributedLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(RedissonDistributedLock.class);

    static final String RENEW_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then "
            + "return redis.call('expire', KEYS[1], ARGV[2]) "
            + "else return 0 end";

    static final String RELEASE_SCRIPT =
        "if redis.call('get', KEYS[1]) == ARGV[1] then "
            + "return redis.call('del', KEYS[1]) "
            + "else return 0 end";

    private final StoreHandle handle;
    private final String name;
    private final String token;
    private final long ttlSeconds;
    private final ConsistencyMode consistency;
    private final StoreMetrics metrics;

    private volatile boolean held;

    public RedissonDistributedLock(StoreHandle handle, String name, long ttlSeconds) {
        this(handle, name, ttlSeconds, ConsistencyMode.RELAXED, new StoreMetrics());
    }

    public RedissonDistributedLock(StoreHandle handle, String name, long ttlSeconds,
                                   ConsistencyMode consistency, StoreMetrics metrics) {
        if (handle == null) {
            throw new IllegalArgumentException("StoreHandle cannot be null");
        }
        if (!handle.isDecodeText()) {
            throw new IllegalArgumentException("Lock tokens are compared as text; handle must decode text");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Lock name cannot be empty");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("Lock TTL must be positive: " + ttlSeconds);
        }
        this.handle = handle;
        this.name = name;
        this.token = UUID.randomUUID().toString();
        this.ttlSeconds = ttlSeconds;
        this.consistency = consistency == null ? ConsistencyMode.RELAXED : consistency;
        this.metrics = metrics == null ? new StoreMetrics() : metrics;
    }

    @Override
    public boolean acquire() {
        RBucket<String> bucket = handle.getBucket(name);
        boolean acquired = bucket.setIfAbsent(token, Duration.ofSeconds(ttlSeconds));
        held = acquired;
        metrics.recordAcquire(acquired);

        if (acquired) {
            log.debug("Lock acquired: {} (ttl: {}s)", name, ttlSeconds);
        } else {
            log.debug("Lock busy: {}", name);
        }
        return acquired;
    }

    @Override
    public boolean renew() {
        Boolean renewed = handle.getScript().eval(
            RScript.Mode.READ_WRITE,
            RENEW_SCRIPT,
            RScript.ReturnType.BOOLEAN,
            Collections.<Object>singletonList(name),
            token, String.valueOf(ttlSeconds));

        boolean ok = Boolean.TRUE.equals(renewed);
        metrics.recordRenew(ok);
        if (ok) {
            held = true;
            log.debug("Lock renewed: {} (ttl: {}s)", name, ttlSeconds);
        } else {
            held = false;
            log.warn("Lock renewal rejected, lease lost: {}", name);
        }
        return ok;
    }

    @Override
    public void release() {
        boolean deleted = consistency == ConsistencyMode.STRICT ? releaseAtomically() : releaseIfOwner();
        held = false;
        metrics.recordRelease(deleted);

        if (deleted) {
            log.debug("Lock released: {}", name);
        } else {
            log.debug("Lock not owned at release, left untouched: {}", name);
        }
    }

    // GET then DEL; another holder can slip in between the two commands
    private boolean releaseIfOwner() {
        RBucket<String> bucket = handle.getBucket(name);
        String current = bucket.get();
        if (current != null && current.equals(token)) {
            return bucket.delete();
        }
        return false;
    }

    private boolean releaseAtomically() {
        Boolean deleted = handle.getScript().eval(
            RScript.Mode.READ_WRITE,
            RELEASE_SCRIPT,
            RScript.ReturnType.BOOLEAN,
            Collections.<Object>singletonList(name),
            token);
        return Boolean.TRUE.equals(deleted);
    }

    @Override
    public boolean isHeld() {
        return held;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getToken() {
        return token;
    }

    @Override
    public long getTtlSeconds() {
        return ttlSeconds;
    }

    public ConsistencyMode getConsistency() {
        return consistency;
    }

    @Override
    public String toString() {
        return "RedissonDistributedLock{name=" + name + ", ttl=" + ttlSeconds + "s, held=" + held + "}";
    }
}
