package com.geography.sync.ledger;

import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.VerificationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Re-applies ledger entries in sequence order onto a copy of a registry snapshot.
 * Events that reference a canonical unit missing from the snapshot are skipped
 * rather than fabricating the unit.
 */
public class LedgerReplayer {
    private static final Logger log = LoggerFactory.getLogger(LedgerReplayer.class);

    public ReplayResult replay(List<SyncLedgerEntry> entries, Map<String, CanonicalUnit> base) {
        Map<String, CanonicalUnit> units = new HashMap<>();
        base.forEach((id, unit) -> units.put(id, unit.copy()));

        int applied = 0;
        int skipped = 0;
        for (SyncLedgerEntry entry : entries) {
            if (apply(entry.event(), units)) {
                applied++;
            } else {
                skipped++;
                log.debug("ledger.replay.skipped sequence={} outcome={}", entry.sequence(), entry.outcome());
            }
        }
        log.info("ledger.replay.completed entries={} applied={} skipped={}", entries.size(), applied, skipped);
        return new ReplayResult(units, applied, skipped);
    }

    private boolean apply(SyncEvent event, Map<String, CanonicalUnit> units) {
        if (event instanceof SyncEvent.UnitCreated created) {
            if (units.containsKey(created.canonicalId())) {
                return false;
            }
            CanonicalUnit unit = CanonicalUnit.builder()
                    .id(created.canonicalId())
                    .level(created.level())
                    .parentId(created.parentCanonicalId())
                    .primaryName(created.primaryName())
                    .normalizedName(created.normalizedName())
                    .governmentCode(created.governmentCode())
                    .tenantId(created.tenantId())
                    .build();
            created.alternateNames().forEach(unit::addAlternateName);
            units.put(unit.getId(), unit);
            return true;
        }
        if (event instanceof SyncEvent.UnitMatched matched) {
            CanonicalUnit unit = units.get(matched.canonicalId());
            if (unit == null) {
                return false;
            }
            matched.addedNames().forEach(unit::addAlternateName);
            unit.addTenant(matched.tenantId());
            return true;
        }
        if (event instanceof SyncEvent.ConflictOpened opened) {
            boolean any = false;
            for (var candidate : opened.candidates()) {
                CanonicalUnit unit = units.get(candidate.canonicalId());
                if (unit != null && unit.getVerificationState() != VerificationState.VERIFIED) {
                    unit.setVerificationState(VerificationState.DISPUTED);
                    any = true;
                }
            }
            return any || opened.candidates().isEmpty();
        }
        if (event instanceof SyncEvent.UnitsMerged merged) {
            CanonicalUnit primary = units.get(merged.primaryId());
            CanonicalUnit secondary = units.get(merged.secondaryId());
            if (primary == null || secondary == null) {
                return false;
            }
            secondary.getAllNames().forEach(primary::addAlternateName);
            secondary.getTenantIds().forEach(primary::addTenant);
            if (primary.getGovernmentCode() == null && secondary.getGovernmentCode() != null) {
                primary.setGovernmentCode(secondary.getGovernmentCode());
            }
            for (String childId : merged.reparentedChildIds()) {
                CanonicalUnit child = units.get(childId);
                if (child != null) {
                    child.setParentId(primary.getId());
                }
            }
            secondary.retireInto(primary.getId());
            return true;
        }
        if (event instanceof SyncEvent.ConflictResolved resolved) {
            for (String id : resolved.clearedDisputeIds()) {
                CanonicalUnit unit = units.get(id);
                if (unit != null && unit.getVerificationState() == VerificationState.DISPUTED) {
                    unit.setVerificationState(VerificationState.UNVERIFIED);
                }
            }
            return true;
        }
        if (event instanceof SyncEvent.VerificationChanged changed) {
            CanonicalUnit unit = units.get(changed.canonicalId());
            if (unit == null) {
                return false;
            }
            unit.setVerificationState(changed.state());
            return true;
        }
        // UnitDeferred touches no canonical unit
        return event instanceof SyncEvent.UnitDeferred;
    }
}
