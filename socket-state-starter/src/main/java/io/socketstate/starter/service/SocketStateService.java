package io.socketstate.starter.service;

import com.fasterxml.jackson.core.type.TypeReference;
import io.socketstate.core.dict.SharedDict;
import io.socketstate.core.lock.DistributedLock;

/**
 * Hands out locks and shared dictionaries bound to the application's Redis store.
 * Each call returns a new instance; a lock's token is generated when it is created here.
 */
public interface SocketStateService {
    
    /**
     * Lock with the configured default TTL
     */
    DistributedLock lock(String name);
    
    DistributedLock lock(String name, long ttlSeconds);
    
    /**
     * Dictionary of plain JSON values
     */
    SharedDict<Object> dict(String name);
    
    <V> SharedDict<V> dict(String name, Class<V> valueType);
    
    <V> SharedDict<V> dict(String name, TypeReference<V> valueType);
}
