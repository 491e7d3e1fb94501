package com.geography.sync.ledger;

import java.time.Instant;
import java.util.List;

/**
 * Storage for ledger entries. Append-only: entries are never updated or removed.
 * All list results are in ascending sequence order.
 */
public interface SyncLedgerRepository {

    /**
     * Persists an entry under the next free sequence number. Allocation and write are one
     * atomic step, so writers sharing the store never receive the same number.
     *
     * @param draft the entry without its sequence; any sequence already set is replaced
     * @return the entry as stored
     */
    SyncLedgerEntry append(SyncLedgerEntry.Builder draft);

    List<SyncLedgerEntry> findAll();

    List<SyncLedgerEntry> findByTenantUnitId(String tenantUnitId);

    /**
     * Entries whose timestamp is at or after {@code since}.
     */
    List<SyncLedgerEntry> findSince(Instant since);

    long count();
}
