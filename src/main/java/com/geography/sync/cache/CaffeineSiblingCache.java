package com.geography.sync.cache;

import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.metrics.MetricsService;
import com.geography.sync.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Supplier;

/**
 * Caffeine-backed {@link SiblingCache}. Entries are invalidated by the registry
 * through {@link RegistryListener} and otherwise expire after the configured TTL.
 *
 * <p>Loads run inside Caffeine's per-key compute, so an invalidation issued while a
 * scope is loading waits for the load and then removes it; a list read before a
 * concurrent insert never outlives that insert's invalidation.</p>
 */
public class CaffeineSiblingCache implements SiblingCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineSiblingCache.class);

    private final Cache<ScopeKey, List<CanonicalUnit>> cache;
    private final MetricsService metrics;

    public CaffeineSiblingCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public CaffeineSiblingCache(CacheConfig config, MetricsService metrics) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxScopes())
                .expireAfterWrite(config.scopeTtl())
                .recordStats()
                .build();
        this.metrics = metrics;
        log.info("cache.initialized maxScopes={} scopeTtl={}", config.maxScopes(), config.scopeTtl());
    }

    @Override
    public List<CanonicalUnit> get(int level, String parentId, Supplier<List<CanonicalUnit>> loader) {
        boolean[] loaded = new boolean[1];
        List<CanonicalUnit> units = cache.get(new ScopeKey(level, parentId), key -> {
            loaded[0] = true;
            return loader.get().stream().map(CanonicalUnit::copy).toList();
        });
        if (loaded[0]) {
            metrics.recordCacheMiss();
        } else {
            metrics.recordCacheHit();
        }
        return units;
    }

    @Override
    public void invalidate(int level, String parentId) {
        cache.invalidate(new ScopeKey(level, parentId));
        log.debug("cache.invalidated level={} parentId={}", level, parentId);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }

    @Override
    public CacheStats getStats() {
        var stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }

    record ScopeKey(int level, String parentId) {}
}
