package com.geography.sync.core.model;

/**
 * Administrative verification state of a canonical unit.
 */
public enum VerificationState {
    UNVERIFIED,
    VERIFIED,

    /**
     * At least one open conflict case lists this unit as a candidate.
     */
    DISPUTED
}
