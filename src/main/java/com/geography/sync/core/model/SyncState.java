package com.geography.sync.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reconciliation state of a tenant geography unit.
 *
 * <pre>
 * DRAFT -&gt; PENDING_SYNC -&gt; {MATCHED | CONFLICT_OPEN} -&gt; {SYNCED | REJECTED}
 * </pre>
 * SYNCED and REJECTED are terminal for one submission; a re-ingest moves the
 * unit back to PENDING_SYNC.
 */
public enum SyncState {
    /**
     * Persisted from tenant data entry, not yet handed to matching.
     */
    DRAFT,

    /**
     * Waiting for matching, or deferred until the parent unit is reconciled.
     */
    PENDING_SYNC,

    /**
     * A canonical match was accepted and the link is being committed.
     */
    MATCHED,

    /**
     * Matching was ambiguous; a conflict case awaits an administrator.
     */
    CONFLICT_OPEN,

    /**
     * Linked to a canonical unit.
     */
    SYNCED,

    /**
     * An administrator kept the unit local-only.
     */
    REJECTED;

    /**
     * Checks whether moving from this state to {@code target} is allowed.
     */
    public boolean canTransitionTo(SyncState target) {
        return allowedTargets().contains(target);
    }

    private Set<SyncState> allowedTargets() {
        return switch (this) {
            case DRAFT -> EnumSet.of(PENDING_SYNC);
            case PENDING_SYNC -> EnumSet.of(PENDING_SYNC, MATCHED, CONFLICT_OPEN);
            case MATCHED -> EnumSet.of(SYNCED);
            case CONFLICT_OPEN -> EnumSet.of(MATCHED, REJECTED, PENDING_SYNC);
            case SYNCED, REJECTED -> EnumSet.of(PENDING_SYNC);
        };
    }
}
