package com.geography.sync.ingest;

import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.ledger.LedgerOutcome;

/**
 * What happened to a submission.
 *
 * @param canonicalUnitId     set once the unit is linked
 * @param conflictCaseId      set while the unit waits for review
 * @param outcome             the decision taken by this call; null for a duplicate submission
 *                            or a unit that was not pending
 * @param duplicateSubmission true when an existing unit was returned instead of creating one
 */
public record IngestAcknowledgement(String tenantUnitId, SyncState syncState, String canonicalUnitId,
                                    String conflictCaseId, LedgerOutcome outcome, boolean duplicateSubmission) {

    static IngestAcknowledgement of(TenantGeoUnit unit, String conflictCaseId, LedgerOutcome outcome) {
        return new IngestAcknowledgement(unit.getId(), unit.getSyncState(), unit.getCanonicalUnitId(),
                conflictCaseId, outcome, false);
    }

    static IngestAcknowledgement duplicate(TenantGeoUnit unit, String conflictCaseId) {
        return new IngestAcknowledgement(unit.getId(), unit.getSyncState(), unit.getCanonicalUnitId(),
                conflictCaseId, null, true);
    }

    public boolean isLinked() {
        return canonicalUnitId != null;
    }

    public boolean isConflict() {
        return syncState == SyncState.CONFLICT_OPEN;
    }
}
