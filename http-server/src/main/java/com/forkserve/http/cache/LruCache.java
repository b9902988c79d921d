package com.forkserve.http.cache;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used map, safe to share between reactor threads.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class LruCache<K, V> {

    private final int capacity;
    private final Map<K, V> entries;

    public LruCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.entries = Collections.synchronizedMap(new LinkedHashMap<K, V>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > LruCache.this.capacity;
            }
        });
    }

    public Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Store a value, evicting the least recently used entry when full.
     * A zero-capacity cache stores nothing.
     */
    public void put(K key, V value) {
        if (capacity == 0) {
            return;
        }
        entries.put(key, value);
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        entries.clear();
    }
}
