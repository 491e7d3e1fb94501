package com.geography.sync.ledger;

import com.geography.sync.core.model.CanonicalUnit;

import java.util.Map;

/**
 * Registry snapshot rebuilt from the ledger.
 *
 * @param units   canonical units by id, retired ones included
 * @param applied entries that changed the snapshot
 * @param skipped entries that referenced a unit the snapshot did not know
 */
public record ReplayResult(Map<String, CanonicalUnit> units, int applied, int skipped) {

    public ReplayResult {
        units = Map.copyOf(units);
    }

    public CanonicalUnit unit(String id) {
        return units.get(id);
    }
}
