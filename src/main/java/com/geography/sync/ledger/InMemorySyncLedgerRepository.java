package com.geography.sync.ledger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger storage in a list guarded by the instance monitor.
 */
public class InMemorySyncLedgerRepository implements SyncLedgerRepository {

    private final List<SyncLedgerEntry> entries = new ArrayList<>();

    @Override
    public synchronized SyncLedgerEntry append(SyncLedgerEntry.Builder draft) {
        SyncLedgerEntry entry = draft.sequence(entries.size() + 1L).build();
        entries.add(entry);
        return entry;
    }

    @Override
    public synchronized List<SyncLedgerEntry> findAll() {
        return List.copyOf(entries);
    }

    @Override
    public synchronized List<SyncLedgerEntry> findByTenantUnitId(String tenantUnitId) {
        List<SyncLedgerEntry> result = new ArrayList<>();
        for (SyncLedgerEntry entry : entries) {
            if (tenantUnitId.equals(entry.tenantUnitId())) {
                result.add(entry);
            }
        }
        return result;
    }

    @Override
    public synchronized List<SyncLedgerEntry> findSince(Instant since) {
        return entries.stream().filter(e -> !e.timestamp().isBefore(since)).toList();
    }

    @Override
    public synchronized long count() {
        return entries.size();
    }
}
