package com.geography.sync.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SyncOptionsTest {

    @Test
    @DisplayName("defaults match the documented thresholds")
    void defaults() {
        SyncOptions options = SyncOptions.defaults();

        assertEquals(0.80, options.getAcceptThreshold());
        assertEquals(0.05, options.getTieMargin());
        assertEquals(0.50, options.getCandidateFloor());
        assertEquals(8, options.getMaxLevels());
        assertEquals("SYSTEM", options.getActor());
        assertNotNull(options.getSimilarityWeights());
    }

    @Test
    @DisplayName("conservative options are stricter")
    void conservative() {
        SyncOptions options = SyncOptions.conservative();

        assertTrue(options.getAcceptThreshold() > SyncOptions.defaults().getAcceptThreshold());
        assertTrue(options.getTieMargin() > SyncOptions.defaults().getTieMargin());
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01})
    @DisplayName("thresholds outside [0, 1] are refused")
    void thresholdRange(double value) {
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().acceptThreshold(value));
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().candidateFloor(value));
    }

    @Test
    @DisplayName("the floor may not exceed the accept threshold")
    void floorBelowAccept() {
        assertThrows(IllegalArgumentException.class,
                () -> SyncOptions.builder().acceptThreshold(0.6).candidateFloor(0.7).build());
        assertDoesNotThrow(() -> SyncOptions.builder().acceptThreshold(0.7).candidateFloor(0.7).build());
    }

    @Test
    @DisplayName("tie margin, levels and actor are validated")
    void otherValidation() {
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().tieMargin(1.0));
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().maxLevels(0));
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().maxLevels(17));
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().actor(" ").build());
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().similarityWeights(null).build());
    }
}
