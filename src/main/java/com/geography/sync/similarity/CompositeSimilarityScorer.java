package com.geography.sync.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted blend of Levenshtein, Jaro-Winkler and bigram Jaccard.
 * Results are clamped to [0.0, 1.0].
 */
public class CompositeSimilarityScorer implements SimilarityAlgorithm {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);

    private final LevenshteinSimilarity levenshtein = new LevenshteinSimilarity();
    private final JaroWinklerSimilarity jaroWinkler = new JaroWinklerSimilarity();
    private final JaccardSimilarity jaccard = new JaccardSimilarity(JaccardSimilarity.Mode.BIGRAM);
    private final SimilarityWeights weights;

    public CompositeSimilarityScorer() {
        this(SimilarityWeights.defaultWeights());
    }

    public CompositeSimilarityScorer(SimilarityWeights weights) {
        this.weights = weights;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        SimilarityBreakdown breakdown = computeWithBreakdown(s1, s2);
        log.debug("similarity.scored left='{}' right='{}' {}", s1, s2, breakdown);
        return breakdown.compositeScore();
    }

    @Override
    public String getName() {
        return "Composite";
    }

    /**
     * Computes each component score alongside the blended result.
     */
    public SimilarityBreakdown computeWithBreakdown(String s1, String s2) {
        double lev = levenshtein.compute(s1, s2);
        double jw = jaroWinkler.compute(s1, s2);
        double jac = jaccard.compute(s1, s2);
        double blended = weights.levenshteinWeight() * lev
                + weights.jaroWinklerWeight() * jw
                + weights.jaccardWeight() * jac;
        return new SimilarityBreakdown(lev, jw, jac, clamp(blended), weights);
    }

    public SimilarityWeights getWeights() {
        return weights;
    }

    static double clamp(double score) {
        if (score > 1.0) {
            return 1.0;
        }
        return score < 0.0 ? 0.0 : score;
    }

    /**
     * Per-algorithm scores behind one composite result.
     */
    public record SimilarityBreakdown(
            double levenshteinScore,
            double jaroWinklerScore,
            double jaccardScore,
            double compositeScore,
            SimilarityWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(
                    "levenshtein=%.4f jaroWinkler=%.4f jaccard=%.4f composite=%.4f",
                    levenshteinScore, jaroWinklerScore, jaccardScore, compositeScore);
        }
    }
}
