package com.geography.sync.core;

/**
 * Thrown when a tenant unit, canonical unit or conflict case id does not exist.
 */
public class UnknownUnitException extends GeographySyncException {

    private final String unitId;

    public UnknownUnitException(String kind, String unitId) {
        super(kind + " not found: " + unitId);
        this.unitId = unitId;
    }

    public String getUnitId() {
        return unitId;
    }
}
