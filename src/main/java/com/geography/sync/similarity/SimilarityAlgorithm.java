package com.geography.sync.similarity;

/**
 * Scores how alike two normalized unit names are.
 * Implementations return a value in [0.0, 1.0] where 1.0 means identical.
 */
public interface SimilarityAlgorithm {

    /**
     * Computes the similarity between two names.
     *
     * @param s1 first name
     * @param s2 second name
     * @return similarity score between 0.0 and 1.0
     */
    double compute(String s1, String s2);

    /**
     * Returns the name of this algorithm.
     */
    String getName();
}
