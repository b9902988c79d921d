package com.forkserve.http.cache;

import java.util.Optional;

/**
 * Serialized bodies of the most recent 200 responses, keyed by
 * {@code method:url} as observed on the wire.
 *
 * The request path only writes here; nothing serves from it. Entries are
 * bounded by LRU eviction.
 */
public final class ResponseCache {

    private final LruCache<String, byte[]> entries;

    public ResponseCache(int capacity) {
        this.entries = new LruCache<>(capacity);
    }

    public void store(String key, byte[] body) {
        entries.put(key, body);
    }

    /**
     * Copy of the cached body for {@code key}, if present.
     */
    public Optional<byte[]> lookup(String key) {
        return entries.get(key).map(byte[]::clone);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return entries.capacity();
    }
}
