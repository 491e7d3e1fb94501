package com.geography.sync.tenant;

import com.geography.sync.core.model.TenantGeoUnit;

/**
 * Checks that a unit fits into its tenant's tree one level below its parent.
 */
public class HierarchyValidator {

    private final TenantGeoUnitRepository tenantUnits;
    private final int maxLevels;

    public HierarchyValidator(TenantGeoUnitRepository tenantUnits, int maxLevels) {
        this.tenantUnits = tenantUnits;
        this.maxLevels = maxLevels;
    }

    /**
     * Validates the level and parent of a prospective unit.
     *
     * @return the parent unit, or null at level 0
     * @throws InvalidHierarchyException if the placement is not allowed
     */
    public TenantGeoUnit validatePlacement(String tenantId, int level, String parentId) {
        if (level < 0 || level >= maxLevels) {
            throw new InvalidHierarchyException("Level " + level + " outside 0.." + (maxLevels - 1));
        }
        if (level == 0) {
            if (parentId != null) {
                throw new InvalidHierarchyException("A level 0 unit cannot have a parent");
            }
            return null;
        }
        if (parentId == null || parentId.isBlank()) {
            throw new InvalidHierarchyException("A level " + level + " unit needs a parent");
        }
        TenantGeoUnit parent = tenantUnits.findById(parentId)
                .orElseThrow(() -> new InvalidHierarchyException("Parent " + parentId + " does not exist"));
        if (!parent.getTenantId().equals(tenantId)) {
            throw new InvalidHierarchyException("Parent " + parentId + " belongs to another tenant");
        }
        if (parent.isRetired()) {
            throw new InvalidHierarchyException("Parent " + parentId + " is retired");
        }
        if (parent.getLevel() != level - 1) {
            throw new InvalidHierarchyException("Level " + level + " unit cannot sit under level "
                    + parent.getLevel() + " parent " + parentId);
        }
        return parent;
    }
}
