package com.geography.sync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <ul>
 *   <li>{@code geo.ingest.duration}: timer, tags level and outcome</li>
 *   <li>{@code geo.canonical.created}, {@code geo.canonical.linked}, {@code geo.canonical.merged}: counters, tag level</li>
 *   <li>{@code geo.conflict.opened}: counter, tag level</li>
 *   <li>{@code geo.conflict.resolved}: counter, tag action</li>
 *   <li>{@code geo.create.race.recovered}: counter</li>
 *   <li>{@code geo.similarity.score}: distribution summary</li>
 *   <li>{@code geo.cache.hit}, {@code geo.cache.miss}: counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timers = new ConcurrentHashMap<>();
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final DistributionSummary similarityScores;
    private final Counter raceRecovered;
    private final Counter cacheHits;
    private final Counter cacheMisses;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.similarityScores = DistributionSummary.builder("geo.similarity.score")
                .description("Best candidate score per match")
                .register(registry);
        this.raceRecovered = Counter.builder("geo.create.race.recovered")
                .description("Creations that lost the unique key race and linked instead")
                .register(registry);
        this.cacheHits = Counter.builder("geo.cache.hit")
                .description("Sibling cache hits")
                .register(registry);
        this.cacheMisses = Counter.builder("geo.cache.miss")
                .description("Sibling cache misses")
                .register(registry);
    }

    @Override
    public void recordIngestDuration(int level, String outcome, Duration duration) {
        timers.computeIfAbsent(level + ":" + outcome, k ->
                Timer.builder("geo.ingest.duration")
                        .description("Duration of tenant unit ingestion")
                        .tag("level", String.valueOf(level))
                        .tag("outcome", outcome)
                        .register(registry))
                .record(duration);
    }

    @Override
    public void incrementCanonicalCreated(int level) {
        levelCounter("geo.canonical.created", "Canonical units created", level).increment();
    }

    @Override
    public void incrementCanonicalLinked(int level) {
        levelCounter("geo.canonical.linked", "Tenant units linked to an existing canonical unit", level).increment();
    }

    @Override
    public void incrementCanonicalMerged(int level) {
        levelCounter("geo.canonical.merged", "Canonical units folded into another", level).increment();
    }

    @Override
    public void incrementConflictOpened(int level) {
        levelCounter("geo.conflict.opened", "Conflict cases opened", level).increment();
    }

    @Override
    public void incrementConflictResolved(String action) {
        counters.computeIfAbsent("geo.conflict.resolved:" + action, k ->
                Counter.builder("geo.conflict.resolved")
                        .description("Conflict cases resolved")
                        .tag("action", action)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementCreateRaceRecovered() {
        raceRecovered.increment();
    }

    @Override
    public void recordSimilarityScore(double score) {
        similarityScores.record(score);
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    private Counter levelCounter(String name, String description, int level) {
        return counters.computeIfAbsent(name + ":" + level, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("level", String.valueOf(level))
                        .register(registry));
    }
}
