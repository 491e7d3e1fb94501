package com.geography.sync.metrics;

import java.time.Duration;

/**
 * Records geography sync metrics. {@link NoOpMetricsService} is the default so
 * the library runs without a metrics backend.
 */
public interface MetricsService {

    /**
     * @param outcome the decision taken, or {@code DUPLICATE} for an idempotent resubmission
     */
    void recordIngestDuration(int level, String outcome, Duration duration);

    void incrementCanonicalCreated(int level);

    void incrementCanonicalLinked(int level);

    void incrementCanonicalMerged(int level);

    void incrementConflictOpened(int level);

    void incrementConflictResolved(String action);

    /**
     * A concurrent creator won the unique key and this caller linked to its unit instead.
     */
    void incrementCreateRaceRecovered();

    void recordSimilarityScore(double score);

    void recordCacheHit();

    void recordCacheMiss();
}
