package com.geography.sync.metrics;

import java.time.Duration;

public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordIngestDuration(int level, String outcome, Duration duration) {
    }

    @Override
    public void incrementCanonicalCreated(int level) {
    }

    @Override
    public void incrementCanonicalLinked(int level) {
    }

    @Override
    public void incrementCanonicalMerged(int level) {
    }

    @Override
    public void incrementConflictOpened(int level) {
    }

    @Override
    public void incrementConflictResolved(String action) {
    }

    @Override
    public void incrementCreateRaceRecovered() {
    }

    @Override
    public void recordSimilarityScore(double score) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
