package io.socketstate.starter.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.socketstate.core.metrics.StoreMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Micrometer bridge for {@link StoreMetrics}.
 * 
 * Metrics exposed:
 * - socket_state_lock_total{result}      - acquire attempts (acquired / contended)
 * - socket_state_lock_renew_total{result} - renewals (renewed / rejected)
 * - socket_state_lock_release_total{result} - releases (released / skipped)
 * - socket_state_dict_ops_total{op}      - dictionary reads / writes / misses
 * - socket_state_dict_decode_failures_total
 * - socket_state_lock_contention_rate
 */
public class SocketStateMicrometerMetrics implements MeterBinder {
    
    private static final Logger log = LoggerFactory.getLogger(SocketStateMicrometerMetrics.class);
    
    private final StoreMetrics metrics;
    
    public SocketStateMicrometerMetrics(StoreMetrics metrics) {
        this.metrics = metrics;
    }
    
    @Override
    public void bindTo(MeterRegistry registry) {
        // Lock
        FunctionCounter.builder("socket_state_lock_total", metrics, StoreMetrics::getLocksAcquired)
            .description("Lock acquire attempts")
            .tag("result", "acquired")
            .register(registry);
        
        FunctionCounter.builder("socket_state_lock_total", metrics, StoreMetrics::getLocksContended)
            .description("Lock acquire attempts")
            .tag("result", "contended")
            .register(registry);
        
        FunctionCounter.builder("socket_state_lock_renew_total", metrics, StoreMetrics::getLocksRenewed)
            .description("Lock renewals")
            .tag("result", "renewed")
            .register(registry);
        
        FunctionCounter.builder("socket_state_lock_renew_total", metrics, StoreMetrics::getRenewalsRejected)
            .description("Lock renewals")
            .tag("result", "rejected")
            .register(registry);
        
        FunctionCounter.builder("socket_state_lock_release_total", metrics, StoreMetrics::getLocksReleased)
            .description("Lock releases")
            .tag("result", "released")
            .register(registry);
        
        FunctionCounter.builder("socket_state_lock_release_total", metrics, StoreMetrics::getReleasesSkipped)
            .description("Lock releases")
            .tag("result", "skipped")
            .register(registry);
        
        Gauge.builder("socket_state_lock_contention_rate", metrics, StoreMetrics::getContentionRate)
            .description("Share of acquire attempts that found the lock taken")
            .register(registry);
        
        // Dict
        FunctionCounter.builder("socket_state_dict_ops_total", metrics, StoreMetrics::getDictReads)
            .description("Shared dictionary operations")
            .tag("op", "read")
            .register(registry);
        
        FunctionCounter.builder("socket_state_dict_ops_total", metrics, StoreMetrics::getDictWrites)
            .description("Shared dictionary operations")
            .tag("op", "write")
            .register(registry);
        
        FunctionCounter.builder("socket_state_dict_ops_total", metrics, StoreMetrics::getDictMisses)
            .description("Shared dictionary operations")
            .tag("op", "miss")
            .register(registry);
        
        FunctionCounter.builder("socket_state_dict_decode_failures_total", metrics, StoreMetrics::getDecodeFailures)
            .description("Stored values that were not valid JSON")
            .register(registry);
        
        log.info("✓ Socket state metrics registered");
    }
}
