package com.geography.sync.bulk;

/**
 * Receives progress of a bulk import.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records processed so far
     * @param total     total records, or -1 while unknown
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
