package com.geography.sync.registry;

import com.geography.sync.core.GeographySyncException;

/**
 * An ACTIVE canonical unit with the same normalized name already exists in the
 * target sibling scope. The registry recovers by linking to that unit.
 */
public class DuplicateCanonicalUnitException extends GeographySyncException {

    private final int level;
    private final String parentId;
    private final String normalizedName;

    public DuplicateCanonicalUnitException(int level, String parentId, String normalizedName) {
        super("Canonical unit '" + normalizedName + "' already exists at level " + level
                + " under " + (parentId == null ? "root" : parentId));
        this.level = level;
        this.parentId = parentId;
        this.normalizedName = normalizedName;
    }

    public int getLevel() {
        return level;
    }

    public String getParentId() {
        return parentId;
    }

    public String getNormalizedName() {
        return normalizedName;
    }
}
