package com.geography.sync.similarity;

/**
 * Weights of the three algorithms in {@link CompositeSimilarityScorer}. Must sum to 1.0.
 */
public record SimilarityWeights(
        double levenshteinWeight,
        double jaroWinklerWeight,
        double jaccardWeight
) {
    public SimilarityWeights {
        if (levenshteinWeight < 0 || jaroWinklerWeight < 0 || jaccardWeight < 0) {
            throw new IllegalArgumentException("Weights must be non-negative");
        }
        double sum = levenshteinWeight + jaroWinklerWeight + jaccardWeight;
        if (Math.abs(sum - 1.0) > 0.001) {
            throw new IllegalArgumentException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Roughly equal weighting.
     */
    public static SimilarityWeights defaultWeights() {
        return new SimilarityWeights(0.33, 0.34, 0.33);
    }
}
