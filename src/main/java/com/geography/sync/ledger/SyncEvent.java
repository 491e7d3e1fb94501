package com.geography.sync.ledger;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.core.model.VerificationState;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A registry decision as recorded in the ledger. The set of variants is closed;
 * each carries what {@link LedgerReplayer} needs to re-apply it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SyncEvent.UnitCreated.class, name = "UnitCreated"),
        @JsonSubTypes.Type(value = SyncEvent.UnitMatched.class, name = "UnitMatched"),
        @JsonSubTypes.Type(value = SyncEvent.UnitDeferred.class, name = "UnitDeferred"),
        @JsonSubTypes.Type(value = SyncEvent.ConflictOpened.class, name = "ConflictOpened"),
        @JsonSubTypes.Type(value = SyncEvent.UnitsMerged.class, name = "UnitsMerged"),
        @JsonSubTypes.Type(value = SyncEvent.ConflictResolved.class, name = "ConflictResolved"),
        @JsonSubTypes.Type(value = SyncEvent.VerificationChanged.class, name = "VerificationChanged")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public interface SyncEvent {

    LedgerOutcome outcome();

    /**
     * Canonical unit ids this event touches.
     */
    Set<String> canonicalIds();

    private static Set<String> ids(List<MatchCandidate> candidates, String... extra) {
        Set<String> ids = new LinkedHashSet<>();
        for (String id : extra) {
            if (id != null) {
                ids.add(id);
            }
        }
        if (candidates != null) {
            candidates.forEach(c -> ids.add(c.canonicalId()));
        }
        return ids;
    }

    /**
     * A new canonical unit was created from a tenant's first sighting.
     */
    record UnitCreated(String canonicalId, String tenantId, int level, String parentCanonicalId,
                       String primaryName, String normalizedName, List<String> alternateNames,
                       String governmentCode, List<MatchCandidate> candidates) implements SyncEvent {
        public UnitCreated {
            alternateNames = alternateNames != null ? List.copyOf(alternateNames) : List.of();
            candidates = candidates != null ? List.copyOf(candidates) : List.of();
        }

        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.CREATE_NEW;
        }

        @Override
        public Set<String> canonicalIds() {
            return ids(candidates, canonicalId, parentCanonicalId);
        }
    }

    /**
     * A tenant unit was linked to an existing canonical unit.
     *
     * @param addedNames names that were new to the canonical unit's alternates
     */
    record UnitMatched(String canonicalId, String tenantId, String declaredName, List<String> addedNames,
                       double score, List<MatchCandidate> candidates) implements SyncEvent {
        public UnitMatched {
            addedNames = addedNames != null ? List.copyOf(addedNames) : List.of();
            candidates = candidates != null ? List.copyOf(candidates) : List.of();
        }

        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.LINK_EXISTING;
        }

        @Override
        public Set<String> canonicalIds() {
            return ids(candidates, canonicalId);
        }
    }

    /**
     * No match was found but the parent has no canonical link yet, so nothing was created.
     */
    record UnitDeferred(String tenantId, String reason, List<MatchCandidate> candidates) implements SyncEvent {
        public UnitDeferred {
            candidates = candidates != null ? List.copyOf(candidates) : List.of();
        }

        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.DEFERRED;
        }

        @Override
        public Set<String> canonicalIds() {
            return ids(candidates);
        }
    }

    record ConflictOpened(String caseId, String tenantId, List<MatchCandidate> candidates) implements SyncEvent {
        public ConflictOpened {
            candidates = candidates != null ? List.copyOf(candidates) : List.of();
        }

        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.FLAGGED_CONFLICT;
        }

        @Override
        public Set<String> canonicalIds() {
            return ids(candidates);
        }
    }

    record UnitsMerged(String primaryId, String secondaryId, List<String> repointedTenantUnitIds,
                       List<String> reparentedChildIds) implements SyncEvent {
        public UnitsMerged {
            repointedTenantUnitIds = repointedTenantUnitIds != null ? List.copyOf(repointedTenantUnitIds) : List.of();
            reparentedChildIds = reparentedChildIds != null ? List.copyOf(reparentedChildIds) : List.of();
        }

        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.MERGE;
        }

        @Override
        public Set<String> canonicalIds() {
            Set<String> ids = ids(null, primaryId, secondaryId);
            ids.addAll(reparentedChildIds);
            return ids;
        }
    }

    /**
     * @param action          the resolution action name
     * @param canonicalId     the unit the tenant unit ended up linked to, null for REJECT and REASSIGN_PARENT
     * @param clearedDisputeIds candidates returned from DISPUTED to UNVERIFIED
     */
    record ConflictResolved(String caseId, String action, String canonicalId,
                            List<String> clearedDisputeIds) implements SyncEvent {
        public ConflictResolved {
            clearedDisputeIds = clearedDisputeIds != null ? List.copyOf(clearedDisputeIds) : List.of();
        }

        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.CONFLICT_RESOLVED;
        }

        @Override
        public Set<String> canonicalIds() {
            Set<String> ids = ids(null, canonicalId);
            ids.addAll(clearedDisputeIds);
            return ids;
        }
    }

    record VerificationChanged(String canonicalId, VerificationState state) implements SyncEvent {
        @Override
        public LedgerOutcome outcome() {
            return LedgerOutcome.VERIFICATION_CHANGED;
        }

        @Override
        public Set<String> canonicalIds() {
            return Set.of(canonicalId);
        }
    }
}
