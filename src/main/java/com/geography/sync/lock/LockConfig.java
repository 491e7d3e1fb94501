package com.geography.sync.lock;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of scope and conflict-case locks.
 *
 * @param scopeWait       how long an in-process caller waits for a held scope
 * @param graphAttempts   acquisition attempts against the shared {@code :ScopeLock} node
 * @param graphRetryDelay pause between graph attempts
 * @param graphLeaseTtl   how long a graph lock survives a crashed owner
 */
public record LockConfig(Duration scopeWait, int graphAttempts, Duration graphRetryDelay, Duration graphLeaseTtl) {

    public LockConfig {
        requirePositive(scopeWait, "scopeWait");
        requirePositive(graphRetryDelay, "graphRetryDelay");
        requirePositive(graphLeaseTtl, "graphLeaseTtl");
        if (graphAttempts < 1) {
            throw new IllegalArgumentException("graphAttempts must be >= 1");
        }
    }

    /**
     * 5s scope wait, 4 graph attempts 100ms apart, 30s lease.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofSeconds(5), 4, Duration.ofMillis(100), Duration.ofSeconds(30));
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
