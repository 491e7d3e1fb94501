package com.geography.sync.conflict;

import java.time.Instant;
import java.util.Objects;

/**
 * How a conflict case was closed.
 *
 * @param canonicalId the unit the tenant unit was linked to, null for REJECT and REASSIGN_PARENT
 */
public record ConflictResolution(ResolutionAction action, String canonicalId, String resolvedBy,
                                 String notes, Instant resolvedAt) {

    public ConflictResolution {
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(resolvedBy, "resolvedBy is required");
        Objects.requireNonNull(resolvedAt, "resolvedAt is required");
    }
}
