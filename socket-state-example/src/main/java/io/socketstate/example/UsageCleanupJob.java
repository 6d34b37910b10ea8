package io.socketstate.example;

import com.fasterxml.jackson.core.type.TypeReference;
import io.socketstate.core.dict.SharedDict;
import io.socketstate.core.exception.KeyNotFoundException;
import io.socketstate.core.lock.DistributedLock;
import io.socketstate.starter.service.SocketStateService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Tracks which sockets are using which model and drops entries that stopped
 * reporting. Every instance runs the schedule, but only the one holding the
 * {@code usage_cleanup} lock does the sweep; it renews the lock on every run.
 */
@Component
public class UsageCleanupJob {

    private static final Logger log = LoggerFactory.getLogger(UsageCleanupJob.class);

    static final String LOCK_NAME = "usage_cleanup";

    private final SharedDict<Map<String, Long>> usagePool;
    private final DistributedLock lock;
    private final Clock clock;
    private final long usageTimeoutSeconds;

    public UsageCleanupJob(SocketStateService socketState,
                           Clock clock,
                           @Value("${example.usage.lock-ttl-seconds:10}") long lockTtlSeconds,
                           @Value("${example.usage.timeout-seconds:60}") long usageTimeoutSeconds) {
        this.usagePool = socketState.dict("usage_pool", new TypeReference<Map<String, Long>>() { });
        this.lock = socketState.lock(LOCK_NAME, lockTtlSeconds);
        this.clock = clock;
        this.usageTimeoutSeconds = usageTimeoutSeconds;
    }

    public void recordUsage(String modelId, String sid) {
        Map<String, Long> sids = new HashMap<>(usagePool.get(modelId, new HashMap<>()));
        sids.put(sid, clock.instant().getEpochSecond());
        usagePool.set(modelId, sids);
    }

    public Map<String, Long> getUsage(String modelId) {
        return usagePool.get(modelId, new HashMap<>());
    }

    @Scheduled(fixedDelayString = "${example.usage.cleanup-interval-ms:3000}")
    public void run() {
        if (!lock.isHeld()) {
            if (!lock.acquire()) {
                log.debug("Usage cleanup handled by another instance");
                return;
            }
            log.info("✓ Acquired {} lock", LOCK_NAME);
        } else if (!lock.renew()) {
            log.warn("❌ Lost {} lock, another instance took over", LOCK_NAME);
            return;
        }

        try {
            int removed = cleanup();
            if (removed > 0) {
                log.info("Usage cleanup removed {} stale entries", removed);
            }
        } catch (RuntimeException e) {
            log.error("❌ Usage cleanup failed, releasing {} lock: {}", LOCK_NAME, e.getMessage());
            lock.release();
            throw e;
        }
    }

    int cleanup() {
        long now = clock.instant().getEpochSecond();
        int removed = 0;

        for (String modelId : usagePool.keys()) {
            Map<String, Long> sids = usagePool.get(modelId, null);
            if (sids == null) {
                continue;
            }
            Map<String, Long> live = new HashMap<>();
            for (Map.Entry<String, Long> entry : sids.entrySet()) {
                if (entry.getValue() != null && now - entry.getValue() <= usageTimeoutSeconds) {
                    live.put(entry.getKey(), entry.getValue());
                }
            }
            removed += sids.size() - live.size();

            if (live.isEmpty()) {
                try {
                    usagePool.delete(modelId);
                } catch (KeyNotFoundException e) {
                    log.debug("Usage entry already gone: {}", modelId);
                }
            } else if (live.size() != sids.size()) {
                usagePool.set(modelId, live);
            }
        }
        return removed;
    }

    @PreDestroy
    public void shutdown() {
        if (lock.isHeld()) {
            lock.release();
            log.info("Released {} lock on shutdown", LOCK_NAME);
        }
    }
}
