package com.geography.sync.bulk;

import java.util.List;

/**
 * Counters of a bulk import, one per ingest outcome.
 *
 * @param duplicates records that matched a unit the tenant had already submitted
 * @param errors     records that could not be ingested, with their line numbers
 */
public record ImportResult(
        long totalRecords,
        long created,
        long linked,
        long conflicts,
        long deferred,
        long duplicates,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return created + linked + conflicts + deferred + duplicates;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param lineNumber 1-based line of the failing record, 0 for a read failure
     * @param ref        the record's {@code ref}, empty when it could not be parsed
     */
    public record ImportError(long lineNumber, String ref, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", created=" + created +
                ", linked=" + linked +
                ", conflicts=" + conflicts +
                ", deferred=" + deferred +
                ", duplicates=" + duplicates +
                ", errors=" + errors.size() + '}';
    }
}
