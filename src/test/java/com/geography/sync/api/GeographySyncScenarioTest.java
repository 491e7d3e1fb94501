package com.geography.sync.api;

import com.geography.sync.conflict.ConflictCase;
import com.geography.sync.conflict.ResolutionCommand;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.UnitStatus;
import com.geography.sync.core.model.VerificationState;
import com.geography.sync.ingest.IngestAcknowledgement;
import com.geography.sync.ingest.IngestRequest;
import com.geography.sync.ledger.LedgerOutcome;
import com.geography.sync.ledger.ReplayResult;
import com.geography.sync.ledger.SyncLedgerEntry;
import com.geography.sync.registry.MergeResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two municipalities entering the same streets, end to end on the in-memory stack.
 */
class GeographySyncScenarioTest {

    private GeographySync sync;

    @BeforeEach
    void setUp() {
        sync = GeographySync.builder().build();
    }

    @AfterEach
    void tearDown() {
        sync.close();
    }

    @Test
    @DisplayName("wards, spelling variants and a street conflict reconcile into one registry")
    void fullReconciliation() {
        IngestAcknowledgement nepalA = sync.ingest(IngestRequest.of("tenant-a", 0, null, "Nepal"));
        IngestAcknowledgement kathmandu = sync.ingest(IngestRequest.of("tenant-a", 1, nepalA.tenantUnitId(), "Kathmandu"));
        IngestAcknowledgement ward = sync.ingest(IngestRequest.of("tenant-a", 2, kathmandu.tenantUnitId(), "Ward 32"));
        assertEquals(LedgerOutcome.CREATE_NEW, ward.outcome());
        CanonicalUnit wardUnit = sync.findCanonical(ward.canonicalUnitId()).orElseThrow();
        assertEquals("32", wardUnit.getNormalizedName());
        assertEquals(kathmandu.canonicalUnitId(), wardUnit.getParentId());

        IngestAcknowledgement nepalB = sync.ingest(IngestRequest.of("tenant-b", 0, null, "Nepal"));
        IngestAcknowledgement katmandu = sync.ingest(IngestRequest.of("tenant-b", 1, nepalB.tenantUnitId(), "Katmandu"));
        IngestAcknowledgement wardB = sync.ingest(IngestRequest.of("tenant-b", 2, katmandu.tenantUnitId(), "Ward No. 32"));
        assertEquals(nepalA.canonicalUnitId(), nepalB.canonicalUnitId());
        assertEquals(LedgerOutcome.LINK_EXISTING, katmandu.outcome());
        assertEquals(kathmandu.canonicalUnitId(), katmandu.canonicalUnitId());
        assertEquals(ward.canonicalUnitId(), wardB.canonicalUnitId());
        CanonicalUnit kathmanduUnit = sync.findCanonical(kathmandu.canonicalUnitId()).orElseThrow();
        assertEquals("Kathmandu", kathmanduUnit.getPrimaryName());
        assertTrue(kathmanduUnit.getAlternateNames().contains("Katmandu"));
        assertEquals(Set.of("tenant-a", "tenant-b"), kathmanduUnit.getTenantIds());

        IngestAcknowledgement newRoad = sync.ingest(IngestRequest.of("tenant-a", 2, kathmandu.tenantUnitId(), "New Road"));
        IngestAcknowledgement nayaSadak = sync.ingest(IngestRequest.of("tenant-a", 2, kathmandu.tenantUnitId(), "Naya Sadak"));
        assertEquals(LedgerOutcome.CREATE_NEW, newRoad.outcome());
        assertEquals(LedgerOutcome.CREATE_NEW, nayaSadak.outcome());

        IngestAcknowledgement nayaRoad = sync.ingest(IngestRequest.of("tenant-b", 2, katmandu.tenantUnitId(), "Naya Road"));
        assertTrue(nayaRoad.isConflict());
        assertFalse(nayaRoad.isLinked());
        ConflictCase conflictCase = sync.findConflict(nayaRoad.conflictCaseId()).orElseThrow();
        assertEquals(Set.of(newRoad.canonicalUnitId(), nayaSadak.canonicalUnitId()),
                Set.copyOf(conflictCase.getCandidateIds()));
        assertEquals(1, sync.openConflicts(PageRequest.first(10)).totalElements());
        assertEquals(VerificationState.DISPUTED,
                sync.findCanonical(newRoad.canonicalUnitId()).orElseThrow().getVerificationState());

        sync.resolveConflict(ResolutionCommand.link(conflictCase.getId(), newRoad.canonicalUnitId(), "steward"));
        assertEquals(SyncState.SYNCED, sync.findTenantUnit(nayaRoad.tenantUnitId()).orElseThrow().getSyncState());
        assertEquals(0, sync.openConflicts(PageRequest.first(10)).totalElements());
        assertEquals(VerificationState.UNVERIFIED,
                sync.findCanonical(nayaSadak.canonicalUnitId()).orElseThrow().getVerificationState());

        MergeResult merge = sync.merge(newRoad.canonicalUnitId(), nayaSadak.canonicalUnitId(), "steward");
        assertEquals(List.of(nayaSadak.tenantUnitId()), merge.repointedTenantUnitIds());
        assertEquals(newRoad.canonicalUnitId(), sync.resolveCanonical(nayaSadak.canonicalUnitId()).getId());
        assertEquals(newRoad.canonicalUnitId(),
                sync.findTenantUnit(nayaSadak.tenantUnitId()).orElseThrow().getCanonicalUnitId());
        CanonicalUnit street = sync.findCanonical(newRoad.canonicalUnitId()).orElseThrow();
        assertTrue(street.getAlternateNames().containsAll(List.of("Naya Road", "Naya Sadak")));

        sync.verify(kathmandu.canonicalUnitId(), VerificationState.VERIFIED, "steward");

        assertReplayMatchesRegistry();
    }

    @Test
    @DisplayName("the ledger records one decision per submission")
    void ledgerOutcomes() {
        IngestAcknowledgement nepalA = sync.ingest(IngestRequest.of("tenant-a", 0, null, "Nepal"));
        sync.ingest(IngestRequest.of("tenant-b", 0, null, "Nepal"));
        sync.ingest(IngestRequest.of("tenant-a", 0, null, "Nepal"));
        sync.ingest(IngestRequest.of("tenant-a", 1, nepalA.tenantUnitId(), "Pokhara"));

        List<LedgerOutcome> outcomes = sync.ledger().entries().stream()
                .map(SyncLedgerEntry::outcome)
                .toList();

        assertEquals(List.of(LedgerOutcome.CREATE_NEW, LedgerOutcome.LINK_EXISTING, LedgerOutcome.CREATE_NEW),
                outcomes);
        // Pokhara's creation names Nepal as its parent
        assertEquals(3, sync.ledger().entriesForCanonical(nepalA.canonicalUnitId()).size());
    }

    @Test
    @DisplayName("sibling scopes keep same-named units apart")
    void sameNameDifferentParents() {
        IngestAcknowledgement nepal = sync.ingest(IngestRequest.of("tenant-a", 0, null, "Nepal"));
        IngestAcknowledgement kathmandu = sync.ingest(IngestRequest.of("tenant-a", 1, nepal.tenantUnitId(), "Kathmandu"));
        IngestAcknowledgement pokhara = sync.ingest(IngestRequest.of("tenant-a", 1, nepal.tenantUnitId(), "Pokhara"));

        IngestAcknowledgement wardKtm = sync.ingest(IngestRequest.of("tenant-a", 2, kathmandu.tenantUnitId(), "Ward 1"));
        IngestAcknowledgement wardPkr = sync.ingest(IngestRequest.of("tenant-a", 2, pokhara.tenantUnitId(), "Ward 1"));

        assertNotEquals(wardKtm.canonicalUnitId(), wardPkr.canonicalUnitId());
        assertEquals(1, sync.canonicalChildren(kathmandu.canonicalUnitId()).size());
        assertEquals(1, sync.canonicalChildren(pokhara.canonicalUnitId()).size());
    }

    private void assertReplayMatchesRegistry() {
        ReplayResult replay = sync.replay();
        List<CanonicalUnit> live = sync.canonicalUnits();

        assertEquals(live.stream().map(CanonicalUnit::getId).collect(Collectors.toSet()), replay.units().keySet());
        assertEquals(0, replay.skipped());
        for (CanonicalUnit unit : live) {
            CanonicalUnit rebuilt = replay.unit(unit.getId());
            assertEquals(unit.getPrimaryName(), rebuilt.getPrimaryName(), unit.getId());
            assertEquals(unit.getNormalizedName(), rebuilt.getNormalizedName(), unit.getId());
            assertEquals(unit.getParentId(), rebuilt.getParentId(), unit.getId());
            assertEquals(unit.getAlternateNames(), rebuilt.getAlternateNames(), unit.getId());
            assertEquals(unit.getTenantIds(), rebuilt.getTenantIds(), unit.getId());
            assertEquals(unit.getStatus(), rebuilt.getStatus(), unit.getId());
            assertEquals(unit.getMergedInto(), rebuilt.getMergedInto(), unit.getId());
            assertEquals(unit.getVerificationState(), rebuilt.getVerificationState(), unit.getId());
        }
        assertEquals(UnitStatus.RETIRED, live.stream()
                .filter(u -> u.getMergedInto() != null).findFirst().orElseThrow().getStatus());
    }
}
