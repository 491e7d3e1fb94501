package com.geography.sync.registry;

import com.geography.sync.core.model.CanonicalUnit;

import java.util.List;
import java.util.Optional;

/**
 * Storage for canonical units.
 *
 * <p>Implementations enforce a unique key on (level, parentId, normalizedName)
 * across ACTIVE units and hand out copies: changing a returned unit has no
 * effect until it is passed back to {@link #update}.</p>
 */
public interface CanonicalUnitRepository {

    /**
     * Stores a new unit.
     *
     * @throws DuplicateCanonicalUnitException if an ACTIVE unit already holds the unique key
     */
    CanonicalUnit insert(CanonicalUnit unit);

    /**
     * Replaces a stored unit with the given state.
     *
     * @throws DuplicateCanonicalUnitException if the new state collides with another ACTIVE unit
     * @throws com.geography.sync.core.UnknownUnitException if the unit was never inserted
     */
    void update(CanonicalUnit unit);

    /**
     * Removes a unit. Only used to undo an insert whose ledger append failed.
     */
    void delete(String id);

    Optional<CanonicalUnit> findById(String id);

    /**
     * ACTIVE units at {@code level} whose parent is {@code parentId} (null for the root scope).
     */
    List<CanonicalUnit> findActive(int level, String parentId);

    Optional<CanonicalUnit> findActiveByKey(int level, String parentId, String normalizedName);

    /**
     * ACTIVE units whose parent is {@code parentId}.
     */
    List<CanonicalUnit> findChildren(String parentId);

    List<CanonicalUnit> findAll();

    long count();
}
