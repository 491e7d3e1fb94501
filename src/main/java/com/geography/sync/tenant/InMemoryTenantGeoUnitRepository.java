package com.geography.sync.tenant;

import com.geography.sync.core.model.TenantGeoUnit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

public class InMemoryTenantGeoUnitRepository implements TenantGeoUnitRepository {

    private final ConcurrentHashMap<String, TenantGeoUnit> units = new ConcurrentHashMap<>();

    @Override
    public void save(TenantGeoUnit unit) {
        units.put(unit.getId(), copy(unit));
    }

    @Override
    public Optional<TenantGeoUnit> findById(String id) {
        return Optional.ofNullable(units.get(id)).map(InMemoryTenantGeoUnitRepository::copy);
    }

    @Override
    public List<TenantGeoUnit> findByTenant(String tenantId) {
        return select(u -> u.getTenantId().equals(tenantId));
    }

    @Override
    public List<TenantGeoUnit> findSiblings(String tenantId, int level, String parentId) {
        return select(u -> u.getTenantId().equals(tenantId)
                && u.getLevel() == level
                && Objects.equals(u.getParentId(), parentId));
    }

    @Override
    public List<TenantGeoUnit> findChildren(String parentId) {
        return select(u -> parentId.equals(u.getParentId()));
    }

    @Override
    public List<TenantGeoUnit> findByCanonicalUnitId(String canonicalUnitId) {
        return select(u -> canonicalUnitId.equals(u.getCanonicalUnitId()));
    }

    @Override
    public long count() {
        return units.size();
    }

    private List<TenantGeoUnit> select(Predicate<TenantGeoUnit> filter) {
        return units.values().stream()
                .filter(filter)
                .sorted((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()))
                .map(InMemoryTenantGeoUnitRepository::copy)
                .toList();
    }

    private static TenantGeoUnit copy(TenantGeoUnit unit) {
        return TenantGeoUnit.builder(unit).build();
    }
}
