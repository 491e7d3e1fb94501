package com.geography.sync.conflict;

import com.geography.sync.api.GeographySync;
import com.geography.sync.api.PageRequest;
import com.geography.sync.core.UnknownUnitException;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.core.model.UnitStatus;
import com.geography.sync.core.model.VerificationState;
import com.geography.sync.ingest.IngestAcknowledgement;
import com.geography.sync.ingest.IngestRequest;
import com.geography.sync.ledger.LedgerOutcome;
import com.geography.sync.tenant.InvalidHierarchyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Two tenants describe the same city. Tenant A registers "New Road" and "Naya Sadak"
 * as separate streets; tenant B's "Naya Road" is close to both.
 */
class ConflictDetectorTest {

    private GeographySync sync;
    private ConflictDetector detector;

    private String newRoadId;
    private String nayaSadakId;
    private String nayaSadakTenantUnitId;
    private String kathmanduB;
    private IngestAcknowledgement nayaRoad;

    @BeforeEach
    void setUp() {
        sync = GeographySync.builder().build();
        detector = sync.getConflictDetector();

        String nepalA = sync.ingest(IngestRequest.of("tenant-a", 0, null, "Nepal")).tenantUnitId();
        String kathmanduA = sync.ingest(IngestRequest.of("tenant-a", 1, nepalA, "Kathmandu")).tenantUnitId();
        newRoadId = sync.ingest(IngestRequest.of("tenant-a", 2, kathmanduA, "New Road")).canonicalUnitId();
        IngestAcknowledgement nayaSadak = sync.ingest(IngestRequest.of("tenant-a", 2, kathmanduA, "Naya Sadak"));
        nayaSadakId = nayaSadak.canonicalUnitId();
        nayaSadakTenantUnitId = nayaSadak.tenantUnitId();

        String nepalB = sync.ingest(IngestRequest.of("tenant-b", 0, null, "Nepal")).tenantUnitId();
        kathmanduB = sync.ingest(IngestRequest.of("tenant-b", 1, nepalB, "Kathmandu")).tenantUnitId();
        nayaRoad = sync.ingest(IngestRequest.of("tenant-b", 2, kathmanduB, "Naya Road"));
    }

    @AfterEach
    void tearDown() {
        sync.close();
    }

    private ConflictCase openCase() {
        return detector.find(nayaRoad.conflictCaseId()).orElseThrow();
    }

    private CanonicalUnit canonical(String id) {
        return sync.findCanonical(id).orElseThrow();
    }

    private TenantGeoUnit nayaRoadUnit() {
        return sync.findTenantUnit(nayaRoad.tenantUnitId()).orElseThrow();
    }

    @Nested
    @DisplayName("Opening")
    class OpenTests {

        @Test
        void ambiguousSubmissionOpensCase() {
            assertEquals(LedgerOutcome.FLAGGED_CONFLICT, nayaRoad.outcome());
            assertTrue(nayaRoad.isConflict());
            assertFalse(nayaRoad.isLinked());

            ConflictCase conflictCase = openCase();
            assertTrue(conflictCase.isOpen());
            assertEquals(Set.of(newRoadId, nayaSadakId), Set.copyOf(conflictCase.getCandidateIds()));
            assertEquals(nayaSadakId, conflictCase.getCandidateIds().get(0));
            assertEquals("Naya Road", conflictCase.getDeclaredName());
        }

        @Test
        void candidatesAreDisputed() {
            assertEquals(VerificationState.DISPUTED, canonical(newRoadId).getVerificationState());
            assertEquals(VerificationState.DISPUTED, canonical(nayaSadakId).getVerificationState());
            assertEquals(Set.of(newRoadId, nayaSadakId), detector.disputedUnitIds());
        }

        @Test
        void listedForReview() {
            assertEquals(1, detector.countOpen());
            assertEquals(1, sync.openConflicts(PageRequest.first(10)).totalElements());
            assertEquals(1, sync.openConflicts("tenant-b", PageRequest.first(10)).totalElements());
            assertEquals(0, sync.openConflicts("tenant-a", PageRequest.first(10)).totalElements());
        }

        @Test
        void resubmissionReturnsTheOpenCase() {
            IngestAcknowledgement again = sync.ingest(IngestRequest.of("tenant-b", 2, kathmanduB, "Naya Road"));

            assertTrue(again.duplicateSubmission());
            assertEquals(nayaRoad.tenantUnitId(), again.tenantUnitId());
            assertEquals(nayaRoad.conflictCaseId(), again.conflictCaseId());
            assertEquals(1, detector.countOpen());
        }
    }

    @Nested
    @DisplayName("Resolution")
    class ResolveTests {

        @Test
        void link() {
            ConflictCase resolved = sync.resolveConflict(
                    ResolutionCommand.link(nayaRoad.conflictCaseId(), newRoadId, "admin"));

            assertEquals(ConflictStatus.RESOLVED, resolved.getStatus());
            assertEquals(newRoadId, resolved.getResolution().canonicalId());
            TenantGeoUnit unit = nayaRoadUnit();
            assertEquals(SyncState.SYNCED, unit.getSyncState());
            assertEquals(newRoadId, unit.getCanonicalUnitId());
            assertTrue(canonical(newRoadId).getAlternateNames().contains("Naya Road"));
            assertEquals(VerificationState.UNVERIFIED, canonical(newRoadId).getVerificationState());
            assertEquals(VerificationState.UNVERIFIED, canonical(nayaSadakId).getVerificationState());
            assertEquals(0, detector.countOpen());
            assertEquals(LedgerOutcome.CONFLICT_RESOLVED,
                    sync.ledger().entriesFor(unit.getId()).get(sync.ledger().entriesFor(unit.getId()).size() - 1).outcome());
        }

        @Test
        void resolvingTwiceFails() {
            sync.resolveConflict(ResolutionCommand.link(nayaRoad.conflictCaseId(), newRoadId, "admin"));

            assertThrows(IllegalStateException.class, () -> sync.resolveConflict(
                    ResolutionCommand.reject(nayaRoad.conflictCaseId(), "admin")));
        }

        @Test
        void unknownCase() {
            assertThrows(UnknownUnitException.class,
                    () -> sync.resolveConflict(ResolutionCommand.reject("missing", "admin")));
        }

        @Test
        void mergeFoldsCandidates() {
            sync.resolveConflict(ResolutionCommand.merge(nayaRoad.conflictCaseId(), newRoadId, "admin"));

            CanonicalUnit retired = canonical(nayaSadakId);
            assertEquals(UnitStatus.RETIRED, retired.getStatus());
            assertEquals(newRoadId, retired.getMergedInto());

            CanonicalUnit survivor = canonical(newRoadId);
            assertTrue(survivor.getAllNames().containsAll(List.of("New Road", "Naya Sadak", "Naya Road")));
            assertEquals(Set.of("tenant-a", "tenant-b"), survivor.getTenantIds());
            assertEquals(VerificationState.UNVERIFIED, survivor.getVerificationState());

            assertEquals(newRoadId, nayaRoadUnit().getCanonicalUnitId());
            assertEquals(newRoadId, sync.findTenantUnit(nayaSadakTenantUnitId).orElseThrow().getCanonicalUnitId());
        }

        @Test
        @DisplayName("LINK refuses a unit under a different canonical parent")
        void linkTargetMustShareTheCanonicalParent() {
            String nepalA = sync.ingest(IngestRequest.of("tenant-a", 0, null, "Nepal")).tenantUnitId();
            String pokhara = sync.ingest(IngestRequest.of("tenant-a", 1, nepalA, "Pokhara")).tenantUnitId();
            String lakesideId = sync.ingest(IngestRequest.of("tenant-a", 2, pokhara, "Lakeside")).canonicalUnitId();

            assertThrows(IllegalArgumentException.class, () -> sync.resolveConflict(
                    ResolutionCommand.link(nayaRoad.conflictCaseId(), lakesideId, "admin")));

            assertTrue(openCase().isOpen());
            assertEquals(SyncState.CONFLICT_OPEN, nayaRoadUnit().getSyncState());
            assertNull(nayaRoadUnit().getCanonicalUnitId());
            assertFalse(canonical(lakesideId).getTenantIds().contains("tenant-b"));
        }

        @Test
        void mergeTargetMustBeACandidate() {
            assertThrows(IllegalArgumentException.class, () -> sync.resolveConflict(
                    ResolutionCommand.merge(nayaRoad.conflictCaseId(), "elsewhere", "admin")));
            assertTrue(openCase().isOpen());
        }

        @Test
        void renameCreatesDistinctPlace() {
            ConflictCase resolved = sync.resolveConflict(
                    ResolutionCommand.rename(nayaRoad.conflictCaseId(), "Naya Road Bazaar", "admin"));

            CanonicalUnit created = canonical(resolved.getResolution().canonicalId());
            assertEquals("Naya Road Bazaar", created.getPrimaryName());
            assertEquals(Set.of("Naya Road"), created.getAlternateNames());
            assertEquals(canonical(newRoadId).getParentId(), created.getParentId());
            assertEquals(created.getId(), nayaRoadUnit().getCanonicalUnitId());
            assertEquals(VerificationState.UNVERIFIED, canonical(nayaSadakId).getVerificationState());
        }

        @Test
        void rejectKeepsUnitLocal() {
            sync.resolveConflict(ResolutionCommand.reject(nayaRoad.conflictCaseId(), "admin"));

            TenantGeoUnit unit = nayaRoadUnit();
            assertEquals(SyncState.REJECTED, unit.getSyncState());
            assertFalse(unit.isLinked());
            assertEquals(Set.of("tenant-a"), canonical(newRoadId).getTenantIds());
            assertEquals(VerificationState.UNVERIFIED, canonical(newRoadId).getVerificationState());
        }

        @Test
        void rejectedUnitCanBeResubmitted() {
            sync.resolveConflict(ResolutionCommand.reject(nayaRoad.conflictCaseId(), "admin"));

            IngestAcknowledgement again = sync.ingest(IngestRequest.of("tenant-b", 2, kathmanduB, "Naya Road"));

            assertFalse(again.duplicateSubmission());
            assertEquals(nayaRoad.tenantUnitId(), again.tenantUnitId());
            assertEquals(LedgerOutcome.FLAGGED_CONFLICT, again.outcome());
            assertNotEquals(nayaRoad.conflictCaseId(), again.conflictCaseId());
        }

        @Test
        void reassignParentSyncsAgain() {
            String nepalB = sync.findTenantUnit(kathmanduB).orElseThrow().getParentId();
            IngestAcknowledgement lalitpur = sync.ingest(IngestRequest.of("tenant-b", 1, nepalB, "Lalitpur"));

            sync.resolveConflict(ResolutionCommand.reassignParent(
                    nayaRoad.conflictCaseId(), lalitpur.tenantUnitId(), "admin"));

            TenantGeoUnit unit = nayaRoadUnit();
            assertEquals(lalitpur.tenantUnitId(), unit.getParentId());
            assertEquals(SyncState.SYNCED, unit.getSyncState());
            CanonicalUnit created = canonical(unit.getCanonicalUnitId());
            assertEquals(lalitpur.canonicalUnitId(), created.getParentId());
            assertEquals("Naya Road", created.getPrimaryName());
        }

        @Test
        void reassignParentValidatesPlacement() {
            assertThrows(InvalidHierarchyException.class, () -> sync.resolveConflict(
                    ResolutionCommand.reassignParent(nayaRoad.conflictCaseId(), nayaSadakTenantUnitId, "admin")));

            assertTrue(openCase().isOpen());
            assertEquals(SyncState.CONFLICT_OPEN, nayaRoadUnit().getSyncState());
            assertEquals(VerificationState.DISPUTED, canonical(newRoadId).getVerificationState());
        }
    }

    @Test
    @DisplayName("A child waiting on a conflicted parent syncs once the case is resolved")
    void deferredChildResyncedAfterResolution() {
        IngestAcknowledgement ward = sync.ingest(IngestRequest.of("tenant-b", 3, nayaRoad.tenantUnitId(), "Ward 1"));
        assertEquals(LedgerOutcome.DEFERRED, ward.outcome());
        assertEquals(SyncState.PENDING_SYNC, ward.syncState());

        sync.resolveConflict(ResolutionCommand.link(nayaRoad.conflictCaseId(), newRoadId, "admin"));

        TenantGeoUnit child = sync.findTenantUnit(ward.tenantUnitId()).orElseThrow();
        assertEquals(SyncState.SYNCED, child.getSyncState());
        assertEquals(newRoadId, canonical(child.getCanonicalUnitId()).getParentId());
    }

    @Test
    @DisplayName("A candidate listed on another open case stays disputed")
    void sharedCandidateStaysDisputed() {
        String nepalC = sync.ingest(IngestRequest.of("tenant-c", 0, null, "Nepal")).tenantUnitId();
        String kathmanduC = sync.ingest(IngestRequest.of("tenant-c", 1, nepalC, "Kathmandu")).tenantUnitId();
        IngestAcknowledgement other = sync.ingest(IngestRequest.of("tenant-c", 2, kathmanduC, "Naya Road"));
        assertNotNull(other.conflictCaseId());

        sync.resolveConflict(ResolutionCommand.link(nayaRoad.conflictCaseId(), newRoadId, "admin"));

        // tenant C's case still lists Naya Sadak
        assertEquals(VerificationState.DISPUTED, canonical(nayaSadakId).getVerificationState());
        assertEquals(1, detector.countOpen());
    }
}
