package com.geography.sync.ledger;

import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.model.CanonicalUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of every registry decision. Sequence numbers are allocated by
 * the repository in the same step that stores the entry.
 */
public class SyncLedger {
    private static final Logger log = LoggerFactory.getLogger(SyncLedger.class);

    private final SyncLedgerRepository repository;
    private final LedgerReplayer replayer;

    public SyncLedger() {
        this(new InMemorySyncLedgerRepository());
    }

    public SyncLedger(SyncLedgerRepository repository) {
        this.repository = repository;
        this.replayer = new LedgerReplayer();
    }

    /**
     * Appends a decision.
     *
     * @return the stored entry with its sequence number
     * @throws SyncPersistenceException if the entry could not be stored
     */
    public SyncLedgerEntry append(String tenantUnitId, String actor, SyncEvent event) {
        try {
            SyncLedgerEntry entry = repository.append(SyncLedgerEntry.builder()
                    .actor(actor)
                    .tenantUnitId(tenantUnitId)
                    .event(event));
            log.debug("ledger.appended sequence={} outcome={} tenantUnitId={}",
                    entry.sequence(), entry.outcome(), tenantUnitId);
            return entry;
        } catch (SyncPersistenceException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("ledger.append.failed outcome={} tenantUnitId={} error={}",
                    event.outcome(), tenantUnitId, e.getMessage());
            throw new SyncPersistenceException("Ledger append failed for " + event.outcome(), e);
        }
    }

    public List<SyncLedgerEntry> entries() {
        return repository.findAll();
    }

    public List<SyncLedgerEntry> entriesFor(String tenantUnitId) {
        return repository.findByTenantUnitId(tenantUnitId);
    }

    public List<SyncLedgerEntry> entriesForCanonical(String canonicalId) {
        return repository.findAll().stream()
                .filter(e -> e.event().canonicalIds().contains(canonicalId))
                .toList();
    }

    public List<SyncLedgerEntry> entriesSince(Instant since) {
        return repository.findSince(since);
    }

    public long size() {
        return repository.count();
    }

    /**
     * Rebuilds canonical units from an empty registry using entries at or after {@code from}.
     */
    public ReplayResult replayFrom(Instant from) {
        return replayFrom(from, Map.of());
    }

    /**
     * Applies entries at or after {@code from} on top of {@code base}. The base map is not modified.
     */
    public ReplayResult replayFrom(Instant from, Map<String, CanonicalUnit> base) {
        return replayer.replay(repository.findSince(from), base);
    }
}
