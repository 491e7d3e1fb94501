package com.geography.sync.ledger;

/**
 * Decision recorded by a ledger entry.
 */
public enum LedgerOutcome {
    CREATE_NEW,
    LINK_EXISTING,
    FLAGGED_CONFLICT,
    DEFERRED,
    MERGE,
    CONFLICT_RESOLVED,
    VERIFICATION_CHANGED
}
