package com.geography.sync.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity, {@code |A ∩ B| / |A ∪ B|}, over either whole words or
 * character bigrams.
 *
 * <p>Place names are mostly single words, so word overlap is all-or-nothing
 * for them. {@link Mode#BIGRAM} splits each word into adjacent character pairs
 * instead; a word shorter than two characters is kept whole.</p>
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    public enum Mode {
        WORD,
        BIGRAM
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Mode mode;

    public JaccardSimilarity() {
        this(Mode.BIGRAM);
    }

    public JaccardSimilarity(Mode mode) {
        this.mode = mode;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }

        Set<String> a = shingles(s1);
        Set<String> b = shingles(s2);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }

        int shared = 0;
        for (String s : a) {
            if (b.contains(s)) {
                shared++;
            }
        }
        int union = a.size() + b.size() - shared;
        return (double) shared / union;
    }

    @Override
    public String getName() {
        return mode == Mode.BIGRAM ? "Jaccard-Bigram" : "Jaccard";
    }

    Set<String> shingles(String s) {
        Set<String> out = new HashSet<>();
        for (String word : WHITESPACE.split(s.toLowerCase(Locale.ROOT).trim())) {
            if (word.isEmpty()) {
                continue;
            }
            if (mode == Mode.WORD || word.length() < 2) {
                out.add(word);
            } else {
                for (int i = 0; i + 1 < word.length(); i++) {
                    out.add(word.substring(i, i + 2));
                }
            }
        }
        return out;
    }
}
