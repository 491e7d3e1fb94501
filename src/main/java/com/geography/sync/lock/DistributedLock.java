package com.geography.sync.lock;

/**
 * Mutual exclusion over a named scope. The registry uses it to serialize
 * canonical creation within one sibling scope ({@code geo:<level>:<parentId|root>})
 * and to serialize resolution of one conflict case.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on the given key, waiting up to the configured timeout.
     *
     * @param key the lock key
     * @return true once the lock is held
     * @throws LockAcquisitionException if the lock could not be acquired
     */
    boolean tryLock(String key);

    /**
     * Releases a lock held by the caller. Releasing a lock the caller does not hold is a no-op.
     */
    void unlock(String key);

    /**
     * Lock key for the sibling scope of a level under a parent.
     */
    static String scopeKey(int level, String parentId) {
        return "geo:" + level + ":" + (parentId == null ? "root" : parentId);
    }

    /**
     * Lock key serializing resolution of one conflict case.
     */
    static String conflictKey(String caseId) {
        return "conflict:" + caseId;
    }
}
