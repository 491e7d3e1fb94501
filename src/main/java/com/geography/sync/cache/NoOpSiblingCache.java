package com.geography.sync.cache;

import com.geography.sync.core.model.CanonicalUnit;

import java.util.List;
import java.util.function.Supplier;

/**
 * Cache that stores nothing; every lookup goes to the repository.
 */
public class NoOpSiblingCache implements SiblingCache {

    @Override
    public List<CanonicalUnit> get(int level, String parentId, Supplier<List<CanonicalUnit>> loader) {
        return loader.get();
    }

    @Override
    public void invalidate(int level, String parentId) {
        // nothing cached
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
