package io.socketstate.starter.service.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.socketstate.core.connection.StoreHandle;
import io.socketstate.core.dict.RedissonSharedDict;
import io.socketstate.core.dict.SharedDict;
import io.socketstate.core.lock.DistributedLock;
import io.socketstate.core.lock.RedissonDistributedLock;
import io.socketstate.core.metrics.StoreMetrics;
import io.socketstate.starter.config.SocketStateProperties;
import io.socketstate.starter.service.SocketStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SocketStateServiceImpl implements SocketStateService {
    
    private static final Logger log = LoggerFactory.getLogger(SocketStateServiceImpl.class);
    
    private final StoreHandle handle;
    private final ObjectMapper objectMapper;
    private final StoreMetrics metrics;
    private final SocketStateProperties properties;
    
    public SocketStateServiceImpl(StoreHandle handle,
                                  ObjectMapper objectMapper,
                                  StoreMetrics metrics,
                                  SocketStateProperties properties) {
        this.handle = handle;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.properties = properties;
    }
    
    @Override
    public DistributedLock lock(String name) {
        return lock(name, properties.getLock().getDefaultTtlSeconds());
    }
    
    @Override
    public DistributedLock lock(String name, long ttlSeconds) {
        log.debug("Creating lock: {} (ttl: {}s, consistency: {})", name, ttlSeconds, properties.getConsistency());
        return new RedissonDistributedLock(handle, name, ttlSeconds, properties.getConsistency(), metrics);
    }
    
    @Override
    public SharedDict<Object> dict(String name) {
        return dict(name, Object.class);
    }
    
    @Override
    public <V> SharedDict<V> dict(String name, Class<V> valueType) {
        return create(name, objectMapper.getTypeFactory().constructType(valueType));
    }
    
    @Override
    public <V> SharedDict<V> dict(String name, TypeReference<V> valueType) {
        return create(name, objectMapper.getTypeFactory().constructType(valueType));
    }
    
    private <V> SharedDict<V> create(String name, JavaType valueType) {
        log.debug("Creating shared dict: {} ({})", name, valueType);
        return new RedissonSharedDict<>(handle, name, objectMapper, valueType, properties.getConsistency(), metrics);
    }
}
