package com.geography.sync.api;

import com.geography.sync.similarity.SimilarityWeights;

/**
 * Matching thresholds and hierarchy limits for geography sync.
 */
public class SyncOptions {

    private static final double DEFAULT_ACCEPT_THRESHOLD = 0.80;
    private static final double DEFAULT_TIE_MARGIN = 0.05;
    private static final double DEFAULT_CANDIDATE_FLOOR = 0.50;
    private static final int DEFAULT_MAX_LEVELS = 8;
    private static final int MAX_LEVELS_LIMIT = 16;

    private final double acceptThreshold;
    private final double tieMargin;
    private final double candidateFloor;
    private final int maxLevels;
    private final SimilarityWeights similarityWeights;
    private final String actor;

    private SyncOptions(Builder builder) {
        this.acceptThreshold = builder.acceptThreshold;
        this.tieMargin = builder.tieMargin;
        this.candidateFloor = builder.candidateFloor;
        this.maxLevels = builder.maxLevels;
        this.similarityWeights = builder.similarityWeights;
        this.actor = builder.actor;
    }

    /**
     * Minimum score (inclusive) for a candidate to be linked without review.
     */
    public double getAcceptThreshold() {
        return acceptThreshold;
    }

    /**
     * How far ahead of every other candidate the best one must be to auto-link.
     */
    public double getTieMargin() {
        return tieMargin;
    }

    /**
     * Candidates scoring below this are not considered at all.
     */
    public double getCandidateFloor() {
        return candidateFloor;
    }

    /**
     * Number of hierarchy levels; valid levels are {@code 0..maxLevels-1}.
     */
    public int getMaxLevels() {
        return maxLevels;
    }

    public SimilarityWeights getSimilarityWeights() {
        return similarityWeights;
    }

    /**
     * Actor recorded on ledger entries written by automatic decisions.
     */
    public String getActor() {
        return actor;
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    /**
     * Stricter options that send more submissions to review.
     */
    public static SyncOptions conservative() {
        return builder()
                .acceptThreshold(0.90)
                .tieMargin(0.10)
                .candidateFloor(0.60)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double acceptThreshold = DEFAULT_ACCEPT_THRESHOLD;
        private double tieMargin = DEFAULT_TIE_MARGIN;
        private double candidateFloor = DEFAULT_CANDIDATE_FLOOR;
        private int maxLevels = DEFAULT_MAX_LEVELS;
        private SimilarityWeights similarityWeights = SimilarityWeights.defaultWeights();
        private String actor = "SYSTEM";

        public Builder acceptThreshold(double acceptThreshold) {
            validateThreshold(acceptThreshold, "acceptThreshold");
            this.acceptThreshold = acceptThreshold;
            return this;
        }

        public Builder tieMargin(double tieMargin) {
            if (tieMargin < 0.0 || tieMargin >= 1.0) {
                throw new IllegalArgumentException("tieMargin must be in [0.0, 1.0)");
            }
            this.tieMargin = tieMargin;
            return this;
        }

        public Builder candidateFloor(double candidateFloor) {
            validateThreshold(candidateFloor, "candidateFloor");
            this.candidateFloor = candidateFloor;
            return this;
        }

        public Builder maxLevels(int maxLevels) {
            if (maxLevels < 1 || maxLevels > MAX_LEVELS_LIMIT) {
                throw new IllegalArgumentException("maxLevels must be between 1 and " + MAX_LEVELS_LIMIT);
            }
            this.maxLevels = maxLevels;
            return this;
        }

        public Builder similarityWeights(SimilarityWeights similarityWeights) {
            this.similarityWeights = similarityWeights;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public SyncOptions build() {
            if (candidateFloor > acceptThreshold) {
                throw new IllegalArgumentException("candidateFloor must be <= acceptThreshold");
            }
            if (similarityWeights == null) {
                throw new IllegalArgumentException("similarityWeights is required");
            }
            if (actor == null || actor.isBlank()) {
                throw new IllegalArgumentException("actor is required");
            }
            return new SyncOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }
}
