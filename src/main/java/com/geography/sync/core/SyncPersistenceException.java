package com.geography.sync.core;

/**
 * A repository write or ledger append failed. The mutation it belonged to has
 * been rolled back, so the caller may safely retry.
 */
public class SyncPersistenceException extends GeographySyncException {

    public SyncPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
