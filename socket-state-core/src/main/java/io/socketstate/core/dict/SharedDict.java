package io.socketstate.core.dict;

import java.util.List;
import java.util.Map;

/**
 * String-keyed dictionary living in the shared store. There is no local cache: every
 * call is at least one round trip, and concurrent writers from other processes are
 * visible immediately.
 *
 * @param <V> value type, stored as JSON
 */
public interface SharedDict<V> {
    
    String getName();
    
    /**
     * Stores {@code value}, replacing any previous value for {@code key}.
     */
    void set(String key, V value);
    
    /**
     * @throws io.socketstate.core.exception.KeyNotFoundException if {@code key} is absent
     */
    V get(String key);
    
    V get(String key, V defaultValue);
    
    /**
     * @throws io.socketstate.core.exception.KeyNotFoundException if {@code key} was absent
     */
    void delete(String key);
    
    boolean contains(String key);
    
    int size();
    
    default boolean isEmpty() {
        return size() == 0;
    }
    
    /**
     * Keys in whatever order the store returns them.
     */
    List<String> keys();
    
    List<V> values();
    
    List<Map.Entry<String, V>> items();
    
    /**
     * Returns the current value for {@code key}, first storing {@code defaultValue}
     * if the key is absent.
     */
    V setDefault(String key, V defaultValue);
    
    /**
     * Calls {@link #set} once per entry. Entries written before a failure stay written.
     */
    void update(Map<String, ? extends V> source);
    
    void update(Iterable<? extends Map.Entry<String, ? extends V>> source);
    
    /**
     * Removes the whole dictionary from the store.
     */
    void clear();
}
