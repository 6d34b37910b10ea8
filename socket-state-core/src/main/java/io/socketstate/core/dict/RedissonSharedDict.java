package io.socketstate.core.dict;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.socketstate.core.ConsistencyMode;
import io.socketstate.core.connection.StoreHandle;
import io.socketstate.core.exception.KeyNotFoundException;
import io.socketstate.core.exception.StoreDecodeException;
import io.socketstate.core.metrics.StoreMetrics;
import org.redisson.api.RMap;
import org.redisson.api.RScript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link SharedDict} stored in one Redis hash named after the dictionary. Each field
 * holds the Jackson JSON encoding of its value.
 */
public class RedissonSharedDict<V> implements SharedDict<V> {

    private static final Logger log = LoggerFactory.getLogger(RedissonSharedDict.class);

    static final String SET_DEFAULT_SCRIPT =
        "redis.call('hsetnx', KEYS[1], ARGV[1], ARGV[2]); "
            + "return redis.call('hget', KEYS[1], ARGV[1])";

    private final StoreHandle handle;
    private final String name;
    private final ObjectMapper objectMapper;
    private final JavaType valueType;
    private final ObjectReader reader;
    private final ConsistencyMode consistency;
    private final StoreMetrics metrics;

    public RedissonSharedDict(StoreHandle handle, String name, ObjectMapper objectMapper, Class<V> valueType) {
        this(handle, name, objectMapper, objectMapper.getTypeFactory().constructType(valueType),
            ConsistencyMode.RELAXED, new StoreMetrics());
    }

    public RedissonSharedDict(StoreHandle handle, String name, ObjectMapper objectMapper, TypeReference<V> valueType) {
        this(handle, name, objectMapper, objectMapper.getTypeFactory().constructType(valueType),
            ConsistencyMode.RELAXED, new StoreMetrics());
    }

    public RedissonSharedDict(StoreHandle handle, String name, ObjectMapper objectMapper, JavaType valueType,
                              ConsistencyMode consistency, StoreMetrics metrics) {
        if (handle == null) {
            throw new IllegalArgumentException("StoreHandle cannot be null");
        }
        if (!handle.isDecodeText()) {
            throw new IllegalArgumentException("JSON values are stored as text; handle must decode text");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Dictionary name cannot be empty");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("ObjectMapper cannot be null");
        }
        if (valueType == null) {
            throw new IllegalArgumentException("Value type cannot be null");
        }
        this.handle = handle;
        this.name = name;
        this.objectMapper = objectMapper;
        this.valueType = valueType;
        this.reader = objectMapper.readerFor(valueType).with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.consistency = consistency == null ? ConsistencyMode.RELAXED : consistency;
        this.metrics = metrics == null ? new StoreMetrics() : metrics;
    }

    /**
     * Dictionary whose values decode to plain JSON shapes: {@code Map}, {@code List},
     * {@code String}, {@code Number}, {@code Boolean} or {@code null}.
     */
    public static RedissonSharedDict<Object> untyped(StoreHandle handle, String name, ObjectMapper objectMapper) {
        return new RedissonSharedDict<>(handle, name, objectMapper, Object.class);
    }

    private RMap<String, String> map() {
        return handle.getMap(name);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void set(String key, V value) {
        requireKey(key);
        map().fastPut(key, encode(key, value));
        metrics.recordWrite();
        log.debug("Dict {} set: {}", name, key);
    }

    @Override
    public V get(String key) {
        requireKey(key);
        String json = map().get(key);
        metrics.recordRead();
        if (json == null) {
            metrics.recordMiss();
            throw new KeyNotFoundException(key);
        }
        return decode(key, json);
    }

    @Override
    public V get(String key, V defaultValue) {
        requireKey(key);
        String json = map().get(key);
        metrics.recordRead();
        if (json == null) {
            metrics.recordMiss();
            return defaultValue;
        }
        return decode(key, json);
    }

    @Override
    public void delete(String key) {
        requireKey(key);
        long removed = map().fastRemove(key);
        if (removed == 0) {
            metrics.recordMiss();
            throw new KeyNotFoundException(key);
        }
        metrics.recordWrite();
        log.debug("Dict {} deleted: {}", name, key);
    }

    @Override
    public boolean contains(String key) {
        requireKey(key);
        return map().containsKey(key);
    }

    @Override
    public int size() {
        return map().size();
    }

    @Override
    public List<String> keys() {
        return new ArrayList<>(map().readAllKeySet());
    }

    @Override
    public List<V> values() {
        Collection<String> raw = map().readAllValues();
        metrics.recordRead();
        List<V> result = new ArrayList<>(raw.size());
        for (String json : raw) {
            result.add(decode(null, json));
        }
        return result;
    }

    @Override
    public List<Map.Entry<String, V>> items() {
        Set<Map.Entry<String, String>> raw = map().readAllEntrySet();
        metrics.recordRead();
        List<Map.Entry<String, V>> result = new ArrayList<>(raw.size());
        for (Map.Entry<String, String> entry : raw) {
            result.add(new AbstractMap.SimpleImmutableEntry<>(entry.getKey(), decode(entry.getKey(), entry.getValue())));
        }
        return result;
    }

    @Override
    public V setDefault(String key, V defaultValue) {
        requireKey(key);
        if (consistency == ConsistencyMode.STRICT) {
            String json = handle.getScript().eval(
                RScript.Mode.READ_WRITE,
                SET_DEFAULT_SCRIPT,
                RScript.ReturnType.VALUE,
                Collections.<Object>singletonList(name),
                key, encode(key, defaultValue));
            metrics.recordRead();
            return decode(key, json);
        }

        // exists check and write are separate commands; a concurrent writer can win in between
        if (!contains(key)) {
            set(key, defaultValue);
        }
        return get(key);
    }

    @Override
    public void update(Map<String, ? extends V> source) {
        if (source == null) {
            return;
        }
        update(source.entrySet());
    }

    @Override
    public void update(Iterable<? extends Map.Entry<String, ? extends V>> source) {
        if (source == null) {
            return;
        }
        for (Map.Entry<String, ? extends V> entry : source) {
            set(entry.getKey(), entry.getValue());
        }
    }

    @Override
    public void clear() {
        boolean deleted = map().delete();
        if (deleted) {
            log.debug("Dict cleared: {}", name);
        }
    }

    private String encode(String key, V value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value for key '" + key + "' is not JSON-serializable", e);
        }
    }

    private V decode(String key, String json) {
        try {
            return reader.readValue(json);
        } catch (JsonProcessingException e) {
            metrics.recordDecodeFailure();
            log.error("Malformed JSON in dict {} (key: {})", name, key);
            throw new StoreDecodeException("Stored value in '" + name + "' is not valid JSON", key, e);
        }
    }

    private static void requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
    }

    public ConsistencyMode getConsistency() {
        return consistency;
    }

    @Override
    public String toString() {
        return "RedissonSharedDict{name=" + name + ", valueType=" + valueType + "}";
    }
}
