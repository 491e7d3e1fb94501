package com.geography.sync.similarity;

/**
 * Edit-distance similarity: {@code 1 - distance / longerLength}.
 * Good at catching single-letter transliteration slips ("Katmandu").
 */
public class LevenshteinSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        int longer = Math.max(s1.length(), s2.length());
        return 1.0 - ((double) distance(s1, s2) / longer);
    }

    @Override
    public String getName() {
        return "Levenshtein";
    }

    /**
     * Wagner-Fischer with two rolling rows sized by the shorter input.
     */
    int distance(String a, String b) {
        String shorter = a.length() <= b.length() ? a : b;
        String longer = shorter == a ? b : a;

        int[] prev = new int[shorter.length() + 1];
        int[] curr = new int[shorter.length() + 1];
        for (int i = 0; i < prev.length; i++) {
            prev[i] = i;
        }

        for (int row = 1; row <= longer.length(); row++) {
            curr[0] = row;
            char c = longer.charAt(row - 1);
            for (int col = 1; col <= shorter.length(); col++) {
                int substitution = prev[col - 1] + (shorter.charAt(col - 1) == c ? 0 : 1);
                int insertion = curr[col - 1] + 1;
                int deletion = prev[col] + 1;
                curr[col] = Math.min(substitution, Math.min(insertion, deletion));
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[shorter.length()];
    }
}
