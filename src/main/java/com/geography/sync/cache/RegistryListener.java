package com.geography.sync.cache;

/**
 * Notified after the canonical registry commits a change to the units of one sibling scope.
 */
public interface RegistryListener {

    /**
     * @param level    level of the changed units
     * @param parentId canonical parent of the changed scope, null at the root
     */
    void onScopeChanged(int level, String parentId);
}
