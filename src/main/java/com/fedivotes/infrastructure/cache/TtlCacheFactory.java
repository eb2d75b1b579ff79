package com.fedivotes.infrastructure.cache;

import com.fedivotes.infrastructure.config.AppProperties.CacheSpec;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the Caffeine-backed caches of the lookup pipeline and registers their statistics.
 */
@Component
public class TtlCacheFactory {

    private static final Logger log = LoggerFactory.getLogger(TtlCacheFactory.class);

    private final Ticker ticker;
    private final MeterRegistry registry;

    public TtlCacheFactory(Ticker ticker, MeterRegistry registry) {
        this.ticker = ticker;
        this.registry = registry;
    }

    public <K, V> TtlCache<K, V> create(String name, CacheSpec spec) {
        Cache<K, V> cache = Caffeine.newBuilder()
            .ticker(ticker)
            .expireAfterWrite(spec.getTtl())
            .maximumSize(spec.getMaxSize())
            .recordStats()
            .build();
        CaffeineCacheMetrics.monitor(registry, cache, name);
        log.info("Created cache {}: ttl={}, maxSize={}", name, spec.getTtl(), spec.getMaxSize());
        return new TtlCache<>(name, cache);
    }
}
