package com.fedivotes.infrastructure.cache;

import com.github.benmanes.caffeine.cache.Cache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Process-local memo with expire-after-write TTL and bounded size.
 *
 * <p>A miss runs the supplier outside any cache lock, so concurrent misses on the same key
 * may each compute; the last write wins. Nothing is stored when the supplier throws.
 */
public final class TtlCache<K, V> {

    private static final Logger log = LoggerFactory.getLogger(TtlCache.class);

    private final String name;
    private final Cache<K, V> cache;

    TtlCache(String name, Cache<K, V> cache) {
        this.name = name;
        this.cache = cache;
    }

    public V getOrCompute(K key, Supplier<V> compute) {
        V cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit: cache={}, key={}", name, key);
            return cached;
        }
        log.debug("Cache miss: cache={}, key={}", name, key);
        V value = Objects.requireNonNull(compute.get(), () -> "Cache " + name + " cannot store null for " + key);
        cache.put(key, value);
        return value;
    }

    public void invalidate(K key) {
        cache.invalidate(key);
    }

    /**
     * Number of live entries after pending expirations and evictions have been applied.
     */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public String name() {
        return name;
    }
}
