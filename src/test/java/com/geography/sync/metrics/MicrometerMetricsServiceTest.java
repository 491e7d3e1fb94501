package com.geography.sync.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private MicrometerMetricsService metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new MicrometerMetricsService(registry);
    }

    @Test
    @DisplayName("canonical counters are tagged by level")
    void levelCounters() {
        metrics.incrementCanonicalCreated(0);
        metrics.incrementCanonicalCreated(0);
        metrics.incrementCanonicalCreated(4);
        metrics.incrementCanonicalLinked(1);
        metrics.incrementCanonicalMerged(2);
        metrics.incrementConflictOpened(2);

        assertEquals(2.0, registry.get("geo.canonical.created").tag("level", "0").counter().count());
        assertEquals(1.0, registry.get("geo.canonical.created").tag("level", "4").counter().count());
        assertEquals(1.0, registry.get("geo.canonical.linked").tag("level", "1").counter().count());
        assertEquals(1.0, registry.get("geo.canonical.merged").tag("level", "2").counter().count());
        assertEquals(1.0, registry.get("geo.conflict.opened").tag("level", "2").counter().count());
    }

    @Test
    @DisplayName("resolutions are tagged by action")
    void resolutionCounter() {
        metrics.incrementConflictResolved("LINK");
        metrics.incrementConflictResolved("REJECT");
        metrics.incrementConflictResolved("LINK");

        assertEquals(2.0, registry.get("geo.conflict.resolved").tag("action", "LINK").counter().count());
        assertEquals(1.0, registry.get("geo.conflict.resolved").tag("action", "REJECT").counter().count());
    }

    @Test
    @DisplayName("ingest durations are timed per level and outcome")
    void ingestTimer() {
        metrics.recordIngestDuration(1, "LINK_EXISTING", Duration.ofMillis(12));
        metrics.recordIngestDuration(1, "LINK_EXISTING", Duration.ofMillis(8));

        var timer = registry.get("geo.ingest.duration").tag("level", "1").tag("outcome", "LINK_EXISTING").timer();
        assertEquals(2, timer.count());
        assertEquals(20.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
    }

    @Test
    @DisplayName("scores, races and cache lookups are recorded")
    void singletonMeters() {
        metrics.recordSimilarityScore(0.84);
        metrics.recordSimilarityScore(0.60);
        metrics.incrementCreateRaceRecovered();
        metrics.recordCacheHit();
        metrics.recordCacheMiss();
        metrics.recordCacheMiss();

        var scores = registry.get("geo.similarity.score").summary();
        assertEquals(2, scores.count());
        assertEquals(0.84, scores.max(), 1e-9);
        assertEquals(1.0, registry.get("geo.create.race.recovered").counter().count());
        assertEquals(1.0, registry.get("geo.cache.hit").counter().count());
        assertEquals(2.0, registry.get("geo.cache.miss").counter().count());
    }
}
