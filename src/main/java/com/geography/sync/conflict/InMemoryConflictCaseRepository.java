package com.geography.sync.conflict;

import com.geography.sync.api.Page;
import com.geography.sync.api.PageRequest;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

public class InMemoryConflictCaseRepository implements ConflictCaseRepository {

    private final ConcurrentHashMap<String, ConflictCase> cases = new ConcurrentHashMap<>();

    @Override
    public void save(ConflictCase conflictCase) {
        cases.put(conflictCase.getId(), conflictCase.copy());
    }

    @Override
    public void delete(String caseId) {
        cases.remove(caseId);
    }

    @Override
    public Optional<ConflictCase> findById(String caseId) {
        return Optional.ofNullable(cases.get(caseId)).map(ConflictCase::copy);
    }

    @Override
    public Page<ConflictCase> findOpen(PageRequest request) {
        return Page.slice(open(c -> true), request);
    }

    @Override
    public Page<ConflictCase> findOpenByTenant(String tenantId, PageRequest request) {
        return Page.slice(open(c -> c.getTenantId().equals(tenantId)), request);
    }

    @Override
    public Optional<ConflictCase> findOpenByTenantUnit(String tenantUnitId) {
        return open(c -> c.getTenantUnitId().equals(tenantUnitId)).stream().findFirst();
    }

    @Override
    public List<ConflictCase> findOpenByCandidate(String canonicalId) {
        return open(c -> c.getCandidateIds().contains(canonicalId));
    }

    @Override
    public long countOpen() {
        return cases.values().stream().filter(ConflictCase::isOpen).count();
    }

    private List<ConflictCase> open(Predicate<ConflictCase> filter) {
        return cases.values().stream()
                .filter(ConflictCase::isOpen)
                .filter(filter)
                .sorted(Comparator.comparing(ConflictCase::getOpenedAt).thenComparing(ConflictCase::getId))
                .map(ConflictCase::copy)
                .toList();
    }
}
