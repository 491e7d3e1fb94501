package com.geography.sync.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-JVM scope lock. Each scope key gets a {@link ReentrantLock} while
 * some thread holds or waits for it; the entry is dropped once the last
 * holder leaves, since every (level, parent) pair ever ingested is a scope.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ScopeEntry> scopes = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        ScopeEntry entry = scopes.compute(key, (k, existing) -> {
            ScopeEntry e = existing != null ? existing : new ScopeEntry();
            e.users++;
            return e;
        });
        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(config.scopeWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(key);
            throw new LockAcquisitionException("Interrupted while waiting for scope '" + key + "'", e);
        }
        if (!acquired) {
            release(key);
            throw new LockAcquisitionException(
                    "Scope '" + key + "' still held after " + config.scopeWait().toMillis() + "ms");
        }
        log.debug("lock.acquired key={} holdCount={}", key, entry.lock.getHoldCount());
        return true;
    }

    @Override
    public void unlock(String key) {
        ScopeEntry entry = scopes.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            return;
        }
        entry.lock.unlock();
        release(key);
        log.debug("lock.released key={}", key);
    }

    /**
     * Number of scopes currently held or awaited.
     */
    int activeScopes() {
        return scopes.size();
    }

    private void release(String key) {
        scopes.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
    }

    private static final class ScopeEntry {
        private final ReentrantLock lock = new ReentrantLock();
        // guarded by the map's per-key compute
        private int users;
    }
}
