package com.geography.sync.conflict;

import com.geography.sync.api.Page;
import com.geography.sync.api.PageRequest;
import com.geography.sync.api.SyncOptions;
import com.geography.sync.core.GeographySyncException;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.UnknownUnitException;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.ledger.SyncEvent;
import com.geography.sync.ledger.SyncLedger;
import com.geography.sync.lock.DistributedLock;
import com.geography.sync.logging.LogContext;
import com.geography.sync.matching.MatchOutcome;
import com.geography.sync.metrics.MetricsService;
import com.geography.sync.registry.CanonicalRegistry;
import com.geography.sync.registry.RegistryResult;
import com.geography.sync.tenant.HierarchyValidator;
import com.geography.sync.tenant.TenantGeoUnitRepository;
import com.geography.sync.tracing.Span;
import com.geography.sync.tracing.SyncOperation;
import com.geography.sync.tracing.TracingService;
import com.geography.sync.transaction.SyncTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Opens conflict cases for inconclusive matches and applies administrator resolutions.
 *
 * <p>While a case is open its candidates are DISPUTED. Resolving a case returns each
 * candidate to UNVERIFIED unless another open case still lists it. Resolution of one
 * case is serialized by the {@code conflict:<caseId>} lock.</p>
 */
public class ConflictDetector {
    private static final Logger log = LoggerFactory.getLogger(ConflictDetector.class);

    private final ConflictCaseRepository cases;
    private final TenantGeoUnitRepository tenantUnits;
    private final CanonicalRegistry registry;
    private final SyncLedger ledger;
    private final HierarchyValidator hierarchy;
    private final DistributedLock lock;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final SyncOptions options;
    private volatile SyncTrigger syncTrigger;

    public ConflictDetector(ConflictCaseRepository cases, TenantGeoUnitRepository tenantUnits,
                            CanonicalRegistry registry, SyncLedger ledger, HierarchyValidator hierarchy,
                            DistributedLock lock, MetricsService metrics, TracingService tracing,
                            SyncOptions options) {
        this.cases = cases;
        this.tenantUnits = tenantUnits;
        this.registry = registry;
        this.ledger = ledger;
        this.hierarchy = hierarchy;
        this.lock = lock;
        this.metrics = metrics;
        this.tracing = tracing;
        this.options = options;
    }

    public void setSyncTrigger(SyncTrigger syncTrigger) {
        this.syncTrigger = syncTrigger;
    }

    /**
     * Opens a case for a PENDING_SYNC tenant unit. If the unit already has an open case,
     * that case is returned unchanged.
     */
    public ConflictCase open(TenantGeoUnit unit, MatchOutcome outcome) {
        Optional<ConflictCase> existing = cases.findOpenByTenantUnit(unit.getId());
        if (existing.isPresent()) {
            return existing.get();
        }

        ConflictCase conflictCase = ConflictCase.builder()
                .tenantUnitId(unit.getId())
                .tenantId(unit.getTenantId())
                .level(unit.getLevel())
                .declaredName(unit.getDeclaredName())
                .candidates(outcome.candidates())
                .build();
        List<String> candidateIds = conflictCase.getCandidateIds();

        registry.locked(registry.scopesOf(candidateIds), () -> {
            TenantGeoUnit before = tenantUnits.findById(unit.getId())
                    .orElseThrow(() -> new UnknownUnitException("Tenant unit", unit.getId()));
            TenantGeoUnit after = TenantGeoUnit.builder(before).build();
            after.transitionTo(SyncState.CONFLICT_OPEN);

            try (SyncTransaction tx = new SyncTransaction("conflict-open")) {
                tx.execute("save case " + conflictCase.getId(),
                        () -> cases.save(conflictCase), () -> cases.delete(conflictCase.getId()));
                tx.execute("flag tenant unit " + unit.getId(),
                        () -> tenantUnits.save(after), () -> tenantUnits.save(before));
                registry.markDisputed(candidateIds, tx);
                tx.executeNoCompensation("append ledger", () -> ledger.append(unit.getId(), options.getActor(),
                        new SyncEvent.ConflictOpened(conflictCase.getId(), unit.getTenantId(), outcome.candidates())));
                tx.markSuccess();
            } catch (GeographySyncException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SyncPersistenceException("Failed to open conflict case for " + unit.getId(), e);
            }
            return conflictCase;
        });

        registry.notifyUnits(candidateIds);
        metrics.incrementConflictOpened(unit.getLevel());
        log.info("conflict.opened caseId={} tenantUnitId={} tenantId={} name='{}' candidates={}",
                conflictCase.getId(), unit.getId(), unit.getTenantId(), unit.getDeclaredName(), candidateIds.size());
        return conflictCase;
    }

    /**
     * Applies an administrator decision to an open case.
     *
     * @throws IllegalStateException if the case is no longer open
     * @throws UnknownUnitException  if the case does not exist
     */
    public ConflictCase resolve(ResolutionCommand command) {
        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forConflict(correlationId, command.caseId())
                .with("action", command.action().name());
             Span span = tracing.start(SyncOperation.RESOLVE_CONFLICT,
                     Map.of("caseId", command.caseId(), "action", command.action().name()))) {
            String key = DistributedLock.conflictKey(command.caseId());
            lock.tryLock(key);
            ConflictCase resolved;
            try {
                resolved = resolveLocked(command);
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            } finally {
                lock.unlock(key);
            }
            span.succeeded();
            afterResolution(resolved);
            return resolved;
        }
    }

    private ConflictCase resolveLocked(ResolutionCommand command) {
        ConflictCase before = cases.findById(command.caseId())
                .orElseThrow(() -> new UnknownUnitException("Conflict case", command.caseId()));
        if (!before.isOpen()) {
            throw new IllegalStateException("Conflict case " + before.getId() + " is already " + before.getStatus());
        }
        TenantGeoUnit unit = tenantUnits.findById(before.getTenantUnitId())
                .orElseThrow(() -> new UnknownUnitException("Tenant unit", before.getTenantUnitId()));

        String canonicalId = switch (command.action()) {
            case LINK -> link(before, unit, command.canonicalId(), command.resolvedBy());
            case MERGE -> merge(before, unit, command.canonicalId(), command.resolvedBy());
            case RENAME -> rename(unit, command.newName(), command.resolvedBy());
            case REJECT, REASSIGN_PARENT -> null;
        };

        ConflictCase after = before.copy();
        after.resolve(new ConflictResolution(command.action(), canonicalId, command.resolvedBy(),
                command.notes(), Instant.now()));

        List<String> remaining = new ArrayList<>();
        for (String id : before.getCandidateIds()) {
            boolean stillDisputed = cases.findOpenByCandidate(id).stream()
                    .anyMatch(other -> !other.getId().equals(before.getId()));
            if (!stillDisputed) {
                remaining.add(id);
            }
        }

        registry.locked(registry.scopesOf(remaining), () -> {
            try (SyncTransaction tx = new SyncTransaction("conflict-resolve")) {
                if (command.action() == ResolutionAction.REJECT || command.action() == ResolutionAction.REASSIGN_PARENT) {
                    TenantGeoUnit unitBefore = tenantUnits.findById(unit.getId()).orElseThrow();
                    TenantGeoUnit unitAfter = TenantGeoUnit.builder(unitBefore).build();
                    if (command.action() == ResolutionAction.REJECT) {
                        unitAfter.transitionTo(SyncState.REJECTED);
                    } else {
                        hierarchy.validatePlacement(unit.getTenantId(), unit.getLevel(), command.newParentTenantUnitId());
                        unitAfter.moveUnder(command.newParentTenantUnitId());
                        unitAfter.transitionTo(SyncState.PENDING_SYNC);
                    }
                    tx.execute("update tenant unit " + unit.getId(),
                            () -> tenantUnits.save(unitAfter), () -> tenantUnits.save(unitBefore));
                }
                List<String> cleared = registry.clearDisputes(remaining, tx);
                tx.execute("close case " + before.getId(), () -> cases.save(after), () -> cases.save(before));
                tx.executeNoCompensation("append ledger", () -> ledger.append(unit.getId(), command.resolvedBy(),
                        new SyncEvent.ConflictResolved(before.getId(), command.action().name(), canonicalId, cleared)));
                tx.markSuccess();
            } catch (GeographySyncException | IllegalStateException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new SyncPersistenceException("Failed to resolve conflict case " + before.getId(), e);
            }
            return null;
        });

        registry.notifyUnits(remaining);
        metrics.incrementConflictResolved(command.action().name());
        log.info("conflict.resolved caseId={} action={} canonicalId={} resolvedBy={}",
                before.getId(), command.action(), canonicalId, command.resolvedBy());
        return after;
    }

    private String link(ConflictCase conflictCase, TenantGeoUnit unit, String chosenId, String actor) {
        CanonicalUnit chosen = registry.resolveCanonical(chosenId);
        if (chosen.getId().equals(unit.getCanonicalUnitId())) {
            // linked by an earlier attempt whose case update failed
            return chosen.getId();
        }
        requireSameCanonicalParent(unit, chosen);
        RegistryResult result = registry.linkTenantUnit(unit, chosen.getId(), scoreOf(conflictCase, chosenId),
                conflictCase.getCandidates(), actor);
        return result.canonicalId();
    }

    private String merge(ConflictCase conflictCase, TenantGeoUnit unit, String chosenId, String actor) {
        if (!conflictCase.getCandidateIds().contains(chosenId)) {
            throw new IllegalArgumentException("MERGE target " + chosenId + " is not a candidate of case "
                    + conflictCase.getId());
        }
        requireSameCanonicalParent(unit, registry.resolveCanonical(chosenId));
        for (String candidateId : conflictCase.getCandidateIds()) {
            if (candidateId.equals(chosenId)) {
                continue;
            }
            CanonicalUnit candidate = registry.resolveCanonical(candidateId);
            String survivor = registry.resolveCanonical(chosenId).getId();
            if (candidate.isActive() && !candidate.getId().equals(survivor)) {
                registry.mergeUnits(survivor, candidate.getId(), actor);
            }
        }
        return link(conflictCase, unit, chosenId, actor);
    }

    /**
     * The chosen unit must sit under the canonical unit the tenant parent is linked to.
     * A tenant parent without a link imposes nothing yet.
     */
    private void requireSameCanonicalParent(TenantGeoUnit unit, CanonicalUnit chosen) {
        if (unit.getLevel() == 0 || unit.getParentId() == null) {
            return;
        }
        TenantGeoUnit parent = tenantUnits.findById(unit.getParentId())
                .orElseThrow(() -> new UnknownUnitException("Tenant unit", unit.getParentId()));
        if (parent.getCanonicalUnitId() == null) {
            return;
        }
        String expected = registry.resolveCanonical(parent.getCanonicalUnitId()).getId();
        String actual = chosen.getParentId() == null ? null : registry.resolveCanonical(chosen.getParentId()).getId();
        if (!expected.equals(actual)) {
            throw new IllegalArgumentException("Canonical unit " + chosen.getId() + " is under " + actual
                    + " but tenant parent " + parent.getId() + " is linked to " + expected);
        }
    }

    private String rename(TenantGeoUnit unit, String newName, String actor) {
        String canonicalParentId = null;
        if (unit.getLevel() > 0) {
            TenantGeoUnit parent = tenantUnits.findById(unit.getParentId())
                    .orElseThrow(() -> new UnknownUnitException("Tenant unit", unit.getParentId()));
            if (!parent.isLinked()) {
                throw new IllegalStateException("Parent " + parent.getId()
                        + " has no canonical unit yet; resolve the parent first");
            }
            canonicalParentId = registry.resolveCanonical(parent.getCanonicalUnitId()).getId();
        }
        return registry.createRenamed(unit, canonicalParentId, newName, actor).canonicalId();
    }

    private static double scoreOf(ConflictCase conflictCase, String canonicalId) {
        return conflictCase.getCandidates().stream()
                .filter(c -> c.canonicalId().equals(canonicalId))
                .mapToDouble(MatchCandidate::score)
                .findFirst()
                .orElse(1.0);
    }

    private void afterResolution(ConflictCase resolved) {
        SyncTrigger trigger = syncTrigger;
        if (trigger == null) {
            return;
        }
        ResolutionAction action = resolved.getResolution().action();
        if (action == ResolutionAction.REASSIGN_PARENT) {
            trigger.sync(resolved.getTenantUnitId());
        } else if (action != ResolutionAction.REJECT) {
            trigger.resyncChildren(resolved.getTenantUnitId());
        }
    }

    public Page<ConflictCase> openCases(PageRequest request) {
        return cases.findOpen(request);
    }

    public Page<ConflictCase> openCasesForTenant(String tenantId, PageRequest request) {
        return cases.findOpenByTenant(tenantId, request);
    }

    public Optional<ConflictCase> find(String caseId) {
        return cases.findById(caseId);
    }

    public Optional<ConflictCase> findOpenForTenantUnit(String tenantUnitId) {
        return cases.findOpenByTenantUnit(tenantUnitId);
    }

    public long countOpen() {
        return cases.countOpen();
    }

    /**
     * Ids of every canonical unit listed on an open case.
     */
    public Set<String> disputedUnitIds() {
        Set<String> ids = new TreeSet<>();
        long open = cases.countOpen();
        if (open == 0) {
            return ids;
        }
        for (ConflictCase c : cases.findOpen(new PageRequest(0, (int) Math.min(open, 10_000))).content()) {
            ids.addAll(c.getCandidateIds());
        }
        return ids;
    }
}
