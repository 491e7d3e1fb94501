package com.geography.sync.matching;

import com.geography.sync.core.model.MatchCandidate;

import java.util.List;
import java.util.Objects;

/**
 * Result of matching one tenant unit against its canonical siblings.
 *
 * @param candidates candidates at or above the floor, best first
 * @param best       the top candidate, null when there are none
 */
public record MatchOutcome(MatchDecision decision, List<MatchCandidate> candidates, MatchCandidate best) {

    public MatchOutcome {
        Objects.requireNonNull(decision, "decision is required");
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        if (decision == MatchDecision.AUTO_LINK && best == null) {
            throw new IllegalArgumentException("AUTO_LINK requires a best candidate");
        }
    }

    public static MatchOutcome noMatch() {
        return new MatchOutcome(MatchDecision.NO_MATCH, List.of(), null);
    }

    public double bestScore() {
        return best != null ? best.score() : 0.0;
    }
}
