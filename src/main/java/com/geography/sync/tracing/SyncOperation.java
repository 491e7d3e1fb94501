package com.geography.sync.tracing;

/**
 * The traced sync operations and their span names.
 */
public enum SyncOperation {

    INGEST("geo.ingest"),
    RESOLVE_CONFLICT("geo.conflict.resolve"),
    MERGE("geo.merge");

    private final String spanName;

    SyncOperation(String spanName) {
        this.spanName = spanName;
    }

    public String spanName() {
        return spanName;
    }
}
