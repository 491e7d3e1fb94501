package com.geography.sync.lock;

import com.geography.sync.core.GeographySyncException;

/**
 * Thrown when a scope lock cannot be acquired within the configured timeout.
 * Callers may retry the operation.
 */
public class LockAcquisitionException extends GeographySyncException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
