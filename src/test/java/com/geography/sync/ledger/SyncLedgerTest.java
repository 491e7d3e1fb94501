package com.geography.sync.ledger;

import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.core.model.VerificationState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SyncLedgerTest {

    private SyncLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new SyncLedger();
    }

    @Test
    @DisplayName("sequence numbers follow append order")
    void sequencesIncrease() {
        SyncLedgerEntry first = ledger.append("tu-1", "tenant-a", created("c1"));
        SyncLedgerEntry second = ledger.append("tu-2", "tenant-b",
                new SyncEvent.UnitMatched("c1", "tenant-b", "Katmandu", List.of("Katmandu"), 0.84, List.of()));

        assertEquals(1, first.sequence());
        assertEquals(2, second.sequence());
        assertEquals(LedgerOutcome.LINK_EXISTING, second.outcome());
        assertEquals(2, ledger.size());
    }

    @Test
    @DisplayName("entries can be listed per tenant unit and per canonical unit")
    void lookups() {
        ledger.append("tu-1", "tenant-a", created("c1"));
        ledger.append("tu-2", "tenant-b", new SyncEvent.ConflictOpened("case-1", "tenant-b",
                List.of(new MatchCandidate("c1", "New Road", 0.59), new MatchCandidate("c2", "Naya Sadak", 0.65))));
        ledger.append(null, "steward", new SyncEvent.VerificationChanged("c2", VerificationState.VERIFIED));

        assertEquals(1, ledger.entriesFor("tu-2").size());
        assertEquals(2, ledger.entriesForCanonical("c1").size());
        assertEquals(2, ledger.entriesForCanonical("c2").size());
        assertTrue(ledger.entriesForCanonical("c3").isEmpty());
    }

    @Test
    @DisplayName("entriesSince excludes earlier entries")
    void entriesSince() throws InterruptedException {
        ledger.append("tu-1", "tenant-a", created("c1"));
        Thread.sleep(5);
        Instant cut = Instant.now();
        ledger.append("tu-2", "tenant-a", created("c2"));

        List<SyncLedgerEntry> since = ledger.entriesSince(cut);

        assertEquals(1, since.size());
        assertEquals(2, since.get(0).sequence());
    }

    @Test
    @DisplayName("storage failures surface as retryable persistence errors")
    void storageFailureWrapped() {
        SyncLedgerRepository repository = mock(SyncLedgerRepository.class);
        doThrow(new IllegalStateException("disk full")).when(repository).append(any());
        SyncLedger failing = new SyncLedger(repository);

        SyncPersistenceException ex = assertThrows(SyncPersistenceException.class,
                () -> failing.append("tu-1", "tenant-a", created("c1")));
        assertTrue(ex.isRetryable());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("entries require an actor and a positive sequence")
    void entryValidation() {
        assertThrows(NullPointerException.class, () -> SyncLedgerEntry.builder()
                .sequence(1).event(created("c1")).build());
        assertThrows(IllegalArgumentException.class, () -> SyncLedgerEntry.builder()
                .sequence(0).actor("tenant-a").event(created("c1")).build());
    }

    @Test
    @DisplayName("the in-memory store numbers drafts itself, ignoring a preset sequence")
    void storeAssignsSequence() {
        InMemorySyncLedgerRepository repository = new InMemorySyncLedgerRepository();

        SyncLedgerEntry first = repository.append(SyncLedgerEntry.builder()
                .sequence(7).actor("tenant-a").event(created("c1")));
        SyncLedgerEntry second = repository.append(SyncLedgerEntry.builder()
                .actor("tenant-a").event(created("c2")));

        assertEquals(1, first.sequence());
        assertEquals(2, second.sequence());
        assertEquals(List.of(first, second), repository.findAll());
    }

    @Test
    @DisplayName("concurrent appends receive distinct consecutive sequences")
    void concurrentAppends() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<SyncLedgerEntry>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String id = "c" + i;
                futures.add(executor.submit(() -> ledger.append(null, "tenant-a", created(id))));
            }
            Set<Long> sequences = new HashSet<>();
            for (Future<SyncLedgerEntry> future : futures) {
                sequences.add(future.get(5, TimeUnit.SECONDS).sequence());
            }
            assertEquals(200, sequences.size());
            assertEquals(LongStream.rangeClosed(1, 200).boxed().collect(Collectors.toSet()), sequences);
        } finally {
            executor.shutdownNow();
        }
    }

    private static SyncEvent created(String id) {
        return new SyncEvent.UnitCreated(id, "tenant-a", 0, null, "Nepal", "nepal", List.of(), null, List.of());
    }
}
