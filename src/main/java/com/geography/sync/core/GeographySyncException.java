package com.geography.sync.core;

/**
 * Base class for all runtime failures raised by the geography sync library.
 */
public class GeographySyncException extends RuntimeException {

    public GeographySyncException(String message) {
        super(message);
    }

    public GeographySyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether the failed operation can be safely retried by the caller.
     */
    public boolean isRetryable() {
        return false;
    }
}
