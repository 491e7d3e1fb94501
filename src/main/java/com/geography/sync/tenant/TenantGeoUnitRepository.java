package com.geography.sync.tenant;

import com.geography.sync.core.model.TenantGeoUnit;

import java.util.List;
import java.util.Optional;

/**
 * Storage for tenant geography units. Units are never deleted.
 * Returned units are copies; {@link #save} persists a changed copy.
 */
public interface TenantGeoUnitRepository {

    /**
     * Inserts the unit or replaces the stored unit with the same id.
     */
    void save(TenantGeoUnit unit);

    Optional<TenantGeoUnit> findById(String id);

    List<TenantGeoUnit> findByTenant(String tenantId);

    /**
     * Units of one tenant at {@code level} under {@code parentId} (null for level 0), retired ones included.
     */
    List<TenantGeoUnit> findSiblings(String tenantId, int level, String parentId);

    List<TenantGeoUnit> findChildren(String parentId);

    List<TenantGeoUnit> findByCanonicalUnitId(String canonicalUnitId);

    long count();
}
