package com.geography.sync.core.model;

import java.util.Objects;

/**
 * A canonical unit proposed for a tenant unit, with the similarity score it reached.
 *
 * @param canonicalId the candidate canonical unit id
 * @param name        the candidate's primary name
 * @param score       similarity score between 0.0 and 1.0
 */
public record MatchCandidate(String canonicalId, String name, double score) {

    public MatchCandidate {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be between 0.0 and 1.0, got " + score);
        }
    }
}
