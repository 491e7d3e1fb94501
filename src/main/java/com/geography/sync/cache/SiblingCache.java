package com.geography.sync.cache;

import com.geography.sync.core.model.CanonicalUnit;

import java.util.List;
import java.util.function.Supplier;

/**
 * Cache of ACTIVE canonical units per sibling scope, used as the matcher's
 * candidate set. A null parent id is the root scope.
 *
 * <p>Cached lists are read-only views; callers must not mutate their units.</p>
 */
public interface SiblingCache extends RegistryListener {

    /**
     * Returns the cached scope, loading it with {@code loader} on a miss. An
     * invalidation that races a load discards the loaded list.
     */
    List<CanonicalUnit> get(int level, String parentId, Supplier<List<CanonicalUnit>> loader);

    void invalidate(int level, String parentId);

    void invalidateAll();

    CacheStats getStats();

    @Override
    default void onScopeChanged(int level, String parentId) {
        invalidate(level, parentId);
    }
}
