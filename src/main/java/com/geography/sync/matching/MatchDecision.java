package com.geography.sync.matching;

/**
 * What the matcher recommends for a tenant unit.
 */
public enum MatchDecision {
    /**
     * One candidate clears the accept threshold with no close rival.
     */
    AUTO_LINK,
    /**
     * Candidates exist but none is conclusive; a human decides.
     */
    CONFLICT,
    /**
     * No candidate reaches the floor; the unit is a new place.
     */
    NO_MATCH
}
