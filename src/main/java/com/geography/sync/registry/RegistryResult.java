package com.geography.sync.registry;

import com.geography.sync.ledger.LedgerOutcome;
import com.geography.sync.matching.MatchOutcome;

/**
 * What the registry did with a tenant unit.
 *
 * @param outcome     CREATE_NEW or LINK_EXISTING when committed; FLAGGED_CONFLICT when
 *                    the re-check under the scope lock turned up competing candidates
 * @param canonicalId the unit the tenant unit is now linked to, null for FLAGGED_CONFLICT
 * @param recheck     the fresh match behind a FLAGGED_CONFLICT, null otherwise
 */
public record RegistryResult(LedgerOutcome outcome, String tenantUnitId, String canonicalId, MatchOutcome recheck) {

    static RegistryResult created(String tenantUnitId, String canonicalId) {
        return new RegistryResult(LedgerOutcome.CREATE_NEW, tenantUnitId, canonicalId, null);
    }

    static RegistryResult linked(String tenantUnitId, String canonicalId) {
        return new RegistryResult(LedgerOutcome.LINK_EXISTING, tenantUnitId, canonicalId, null);
    }

    static RegistryResult conflict(String tenantUnitId, MatchOutcome recheck) {
        return new RegistryResult(LedgerOutcome.FLAGGED_CONFLICT, tenantUnitId, null, recheck);
    }

    public boolean isLinked() {
        return canonicalId != null;
    }
}
