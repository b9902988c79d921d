package com.forkserve.http.cache;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LruCacheTest {

    @Test
    void evictsLeastRecentlyUsed() {
        LruCache<String, Integer> cache = new LruCache<>(2);
        cache.put("a", 1);
        cache.put("b", 2);
        cache.get("a");
        cache.put("c", 3);

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.containsKey("a")).isTrue();
        assertThat(cache.containsKey("b")).isFalse();
        assertThat(cache.get("c")).contains(3);
    }

    @Test
    void zeroCapacityStoresNothing() {
        LruCache<String, Integer> cache = new LruCache<>(0);
        cache.put("a", 1);
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void responseCacheStaysBoundedAndReturnsCopies() {
        ResponseCache cache = new ResponseCache(3);
        for (int i = 0; i < 10; i++) {
            cache.store("GET:/item?id=" + i, new byte[]{(byte) i});
        }
        assertThat(cache.size()).isEqualTo(3);
        assertThat(cache.lookup("GET:/item?id=0")).isEmpty();

        byte[] copy = cache.lookup("GET:/item?id=9").orElseThrow();
        copy[0] = 42;
        assertThat(cache.lookup("GET:/item?id=9").orElseThrow()).containsExactly((byte) 9);
    }
}
