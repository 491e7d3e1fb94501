package com.geography.sync.registry;

import com.geography.sync.core.UnknownUnitException;
import com.geography.sync.core.model.CanonicalUnit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Canonical units in memory with a synchronized unique index.
 */
public class InMemoryCanonicalUnitRepository implements CanonicalUnitRepository {

    private final Map<String, CanonicalUnit> units = new LinkedHashMap<>();
    private final Map<UniqueKey, String> activeIndex = new LinkedHashMap<>();

    @Override
    public synchronized CanonicalUnit insert(CanonicalUnit unit) {
        if (unit.isActive()) {
            UniqueKey key = UniqueKey.of(unit);
            if (activeIndex.containsKey(key)) {
                throw new DuplicateCanonicalUnitException(unit.getLevel(), unit.getParentId(), unit.getNormalizedName());
            }
            activeIndex.put(key, unit.getId());
        }
        units.put(unit.getId(), unit.copy());
        return unit.copy();
    }

    @Override
    public synchronized void update(CanonicalUnit unit) {
        CanonicalUnit previous = units.get(unit.getId());
        if (previous == null) {
            throw new UnknownUnitException("Canonical unit", unit.getId());
        }
        UniqueKey key = UniqueKey.of(unit);
        if (unit.isActive()) {
            String holder = activeIndex.get(key);
            if (holder != null && !holder.equals(unit.getId())) {
                throw new DuplicateCanonicalUnitException(unit.getLevel(), unit.getParentId(), unit.getNormalizedName());
            }
        }
        if (previous.isActive()) {
            activeIndex.remove(UniqueKey.of(previous));
        }
        if (unit.isActive()) {
            activeIndex.put(key, unit.getId());
        }
        units.put(unit.getId(), unit.copy());
    }

    @Override
    public synchronized void delete(String id) {
        CanonicalUnit removed = units.remove(id);
        if (removed != null && removed.isActive()) {
            activeIndex.remove(UniqueKey.of(removed));
        }
    }

    @Override
    public synchronized Optional<CanonicalUnit> findById(String id) {
        CanonicalUnit unit = units.get(id);
        return Optional.ofNullable(unit).map(CanonicalUnit::copy);
    }

    @Override
    public List<CanonicalUnit> findActive(int level, String parentId) {
        return select(u -> u.isActive() && u.getLevel() == level && Objects.equals(u.getParentId(), parentId));
    }

    @Override
    public synchronized Optional<CanonicalUnit> findActiveByKey(int level, String parentId, String normalizedName) {
        String id = activeIndex.get(new UniqueKey(level, parentId, normalizedName));
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public List<CanonicalUnit> findChildren(String parentId) {
        return select(u -> u.isActive() && parentId.equals(u.getParentId()));
    }

    @Override
    public List<CanonicalUnit> findAll() {
        return select(u -> true);
    }

    @Override
    public synchronized long count() {
        return units.size();
    }

    private synchronized List<CanonicalUnit> select(Predicate<CanonicalUnit> filter) {
        List<CanonicalUnit> result = new ArrayList<>();
        for (CanonicalUnit unit : units.values()) {
            if (filter.test(unit)) {
                result.add(unit.copy());
            }
        }
        result.sort(Comparator.comparing(CanonicalUnit::getCreatedAt).thenComparing(CanonicalUnit::getId));
        return result;
    }

    private record UniqueKey(int level, String parentId, String normalizedName) {
        static UniqueKey of(CanonicalUnit unit) {
            return new UniqueKey(unit.getLevel(), unit.getParentId(), unit.getNormalizedName());
        }
    }
}
