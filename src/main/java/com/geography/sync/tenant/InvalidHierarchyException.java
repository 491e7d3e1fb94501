package com.geography.sync.tenant;

import com.geography.sync.core.GeographySyncException;

/**
 * A submission breaks the tenant's tree: bad level, missing or foreign parent,
 * or unusable names. Nothing is persisted and retrying the same input fails again.
 */
public class InvalidHierarchyException extends GeographySyncException {

    public InvalidHierarchyException(String message) {
        super(message);
    }
}
