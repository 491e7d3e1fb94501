package com.geography.sync.core.model;

/**
 * Lifecycle status of a canonical unit. Units are never physically deleted.
 */
public enum UnitStatus {
    ACTIVE,

    /**
     * Folded into another unit by a merge. Kept so ledger references stay valid.
     */
    RETIRED
}
