package com.geography.sync.similarity;

/**
 * Jaro-Winkler similarity. Rewards names sharing a common prefix,
 * which suits place names whose spellings drift toward the end.
 */
public class JaroWinklerSimilarity implements SimilarityAlgorithm {

    private static final double DEFAULT_PREFIX_SCALE = 0.1;
    private static final int PREFIX_CAP = 4;

    private final double prefixScale;

    public JaroWinklerSimilarity() {
        this(DEFAULT_PREFIX_SCALE);
    }

    public JaroWinklerSimilarity(double prefixScale) {
        if (prefixScale < 0 || prefixScale > 0.25) {
            throw new IllegalArgumentException("Prefix scale must be between 0 and 0.25");
        }
        this.prefixScale = prefixScale;
    }

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

        double jaro = jaro(s1, s2);
        int prefix = commonPrefix(s1, s2);
        return jaro + prefix * prefixScale * (1.0 - jaro);
    }

    @Override
    public String getName() {
        return "Jaro-Winkler";
    }

    private static int commonPrefix(String s1, String s2) {
        int limit = Math.min(PREFIX_CAP, Math.min(s1.length(), s2.length()));
        int n = 0;
        while (n < limit && s1.charAt(n) == s2.charAt(n)) {
            n++;
        }
        return n;
    }

    private static double jaro(String s1, String s2) {
        int window = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] matched1 = new boolean[s1.length()];
        boolean[] matched2 = new boolean[s2.length()];

        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            int from = Math.max(0, i - window);
            int to = Math.min(s2.length(), i + window + 1);
            for (int j = from; j < to; j++) {
                if (!matched2[j] && s1.charAt(i) == s2.charAt(j)) {
                    matched1[i] = true;
                    matched2[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int halfTranspositions = 0;
        int j = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (matched1[i]) {
                while (!matched2[j]) {
                    j++;
                }
                if (s1.charAt(i) != s2.charAt(j)) {
                    halfTranspositions++;
                }
                j++;
            }
        }

        double m = matches;
        double t = halfTranspositions / 2.0;
        return (m / s1.length() + m / s2.length() + (m - t) / m) / 3.0;
    }
}
