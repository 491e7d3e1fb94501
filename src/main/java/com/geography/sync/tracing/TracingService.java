package com.geography.sync.tracing;

import java.util.Map;

/**
 * Starts one span per ingest, merge or conflict resolution.
 * {@link NoOpTracingService} is the default.
 */
public interface TracingService {

    /**
     * @param attributes identifiers of the unit or case being worked on, set before the span starts
     */
    Span start(SyncOperation operation, Map<String, String> attributes);
}
