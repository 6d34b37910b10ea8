package io.socketstate.core.lock;

/**
 * Single-owner lock with a time-to-live, shared by every process that uses the same
 * store and lock name. Acquisition never blocks; callers that want to wait poll
 * {@link #acquire()} themselves.
 */
public interface DistributedLock {
    
    /**
     * Creates the lock record only if no live record exists.
     *
     * @return {@code true} if this instance now holds the lock
     */
    boolean acquire();
    
    /**
     * Extends the TTL, but only while the record still carries this instance's token.
     *
     * @return {@code false} if the lock expired or was taken over
     */
    boolean renew();
    
    /**
     * Deletes the record if this instance still owns it. A lock that already expired or
     * belongs to someone else is left untouched and no error is raised.
     */
    void release();
    
    /**
     * Local view of the last acquire/renew/release outcome. Does not contact the store.
     */
    boolean isHeld();
    
    String getName();
    
    String getToken();
    
    long getTtlSeconds();
}
