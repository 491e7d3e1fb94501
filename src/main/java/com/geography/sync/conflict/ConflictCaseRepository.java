package com.geography.sync.conflict;

import com.geography.sync.api.Page;
import com.geography.sync.api.PageRequest;

import java.util.List;
import java.util.Optional;

/**
 * Storage for conflict cases. Open listings are ordered oldest first.
 */
public interface ConflictCaseRepository {

    void save(ConflictCase conflictCase);

    /**
     * Removes a case. Only used to undo a save whose ledger append failed.
     */
    void delete(String caseId);

    Optional<ConflictCase> findById(String caseId);

    Page<ConflictCase> findOpen(PageRequest request);

    Page<ConflictCase> findOpenByTenant(String tenantId, PageRequest request);

    Optional<ConflictCase> findOpenByTenantUnit(String tenantUnitId);

    /**
     * Open cases listing the given canonical unit as a candidate.
     */
    List<ConflictCase> findOpenByCandidate(String canonicalId);

    long countOpen();
}
