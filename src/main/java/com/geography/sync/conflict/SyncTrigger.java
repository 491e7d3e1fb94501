package com.geography.sync.conflict;

/**
 * Re-runs matching for tenant units after an administrator decision changed their situation.
 */
public interface SyncTrigger {

    /**
     * Matches a PENDING_SYNC tenant unit again.
     */
    void sync(String tenantUnitId);

    /**
     * Matches every PENDING_SYNC child of a tenant unit that just gained a canonical link.
     */
    void resyncChildren(String parentTenantUnitId);
}
