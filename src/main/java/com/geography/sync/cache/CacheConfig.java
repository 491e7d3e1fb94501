package com.geography.sync.cache;

import java.time.Duration;

/**
 * Sizing of the sibling candidate cache. One entry holds the ACTIVE canonical
 * units of one (level, canonical parent) scope.
 *
 * @param maxScopes maximum number of cached sibling scopes
 * @param scopeTtl  how long a loaded scope is trusted without an invalidation
 * @param enabled   false wires the matcher straight to the repository
 */
public record CacheConfig(int maxScopes, Duration scopeTtl, boolean enabled) {

    public CacheConfig {
        if (maxScopes <= 0) {
            throw new IllegalArgumentException("maxScopes must be > 0");
        }
        if (scopeTtl == null || scopeTtl.isZero() || scopeTtl.isNegative()) {
            throw new IllegalArgumentException("scopeTtl must be positive");
        }
    }

    /**
     * 10,000 scopes for five minutes each.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, Duration.ofMinutes(5), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
