package io.socketstate.core.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for lock and dictionary traffic. Kept free of any metrics library so the
 * core module can be used on its own; the starter bridges these to Micrometer.
 */
public class StoreMetrics {
    
    private final AtomicLong locksAcquired = new AtomicLong(0);
    private final AtomicLong locksContended = new AtomicLong(0);
    private final AtomicLong locksRenewed = new AtomicLong(0);
    private final AtomicLong renewalsRejected = new AtomicLong(0);
    private final AtomicLong locksReleased = new AtomicLong(0);
    private final AtomicLong releasesSkipped = new AtomicLong(0);
    
    private final AtomicLong dictReads = new AtomicLong(0);
    private final AtomicLong dictWrites = new AtomicLong(0);
    private final AtomicLong dictMisses = new AtomicLong(0);
    private final AtomicLong decodeFailures = new AtomicLong(0);
    
    public void recordAcquire(boolean acquired) {
        if (acquired) {
            locksAcquired.incrementAndGet();
        } else {
            locksContended.incrementAndGet();
        }
    }
    
    public void recordRenew(boolean renewed) {
        if (renewed) {
            locksRenewed.incrementAndGet();
        } else {
            renewalsRejected.incrementAndGet();
        }
    }
    
    public void recordRelease(boolean deleted) {
        if (deleted) {
            locksReleased.incrementAndGet();
        } else {
            releasesSkipped.incrementAndGet();
        }
    }
    
    public void recordRead() {
        dictReads.incrementAndGet();
    }
    
    public void recordWrite() {
        dictWrites.incrementAndGet();
    }
    
    public void recordMiss() {
        dictMisses.incrementAndGet();
    }
    
    public void recordDecodeFailure() {
        decodeFailures.incrementAndGet();
    }
    
    // Getters
    
    public long getLocksAcquired() { return locksAcquired.get(); }
    public long getLocksContended() { return locksContended.get(); }
    public long getLocksRenewed() { return locksRenewed.get(); }
    public long getRenewalsRejected() { return renewalsRejected.get(); }
    public long getLocksReleased() { return locksReleased.get(); }
    public long getReleasesSkipped() { return releasesSkipped.get(); }
    public long getDictReads() { return dictReads.get(); }
    public long getDictWrites() { return dictWrites.get(); }
    public long getDictMisses() { return dictMisses.get(); }
    public long getDecodeFailures() { return decodeFailures.get(); }
    
    public double getContentionRate() {
        long attempts = locksAcquired.get() + locksContended.get();
        if (attempts == 0) {
            return 0.0;
        }
        return (double) locksContended.get() / attempts;
    }
    
    public void reset() {
        locksAcquired.set(0);
        locksContended.set(0);
        locksRenewed.set(0);
        renewalsRejected.set(0);
        locksReleased.set(0);
        releasesSkipped.set(0);
        dictReads.set(0);
        dictWrites.set(0);
        dictMisses.set(0);
        decodeFailures.set(0);
    }
    
    @Override
    public String toString() {
        return String.format(
            "StoreMetrics{acquired=%d, contended=%d, renewed=%d, renewRejected=%d, released=%d, "
                + "releaseSkipped=%d, reads=%d, writes=%d, misses=%d, decodeFailures=%d}",
            locksAcquired.get(), locksContended.get(), locksRenewed.get(), renewalsRejected.get(),
            locksReleased.get(), releasesSkipped.get(), dictReads.get(), dictWrites.get(),
            dictMisses.get(), decodeFailures.get());
    }
}
