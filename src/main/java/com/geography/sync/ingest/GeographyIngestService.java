package com.geography.sync.ingest;

import com.geography.sync.api.SyncOptions;
import com.geography.sync.conflict.ConflictCase;
import com.geography.sync.conflict.ConflictDetector;
import com.geography.sync.conflict.SyncTrigger;
import com.geography.sync.core.GeographySyncException;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.UnknownUnitException;
import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.ledger.LedgerOutcome;
import com.geography.sync.ledger.SyncEvent;
import com.geography.sync.ledger.SyncLedger;
import com.geography.sync.lock.DistributedLock;
import com.geography.sync.logging.LogContext;
import com.geography.sync.matching.CanonicalMatcher;
import com.geography.sync.matching.MatchDecision;
import com.geography.sync.matching.MatchOutcome;
import com.geography.sync.metrics.MetricsService;
import com.geography.sync.registry.CanonicalRegistry;
import com.geography.sync.registry.RegistryResult;
import com.geography.sync.tenant.HierarchyValidator;
import com.geography.sync.tenant.InputSanitizer;
import com.geography.sync.tenant.InvalidHierarchyException;
import com.geography.sync.tenant.TenantGeoUnitRepository;
import com.geography.sync.tracing.Span;
import com.geography.sync.tracing.SyncOperation;
import com.geography.sync.tracing.TracingService;
import com.geography.sync.transaction.SyncTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Entry point for tenant submissions.
 *
 * <p>A submission is validated, persisted in DRAFT, moved to PENDING_SYNC and synced:
 * the matcher proposes candidates under the canonical parent and the unit is linked,
 * a new canonical unit is created, or a conflict case is opened. A child whose parent
 * has no canonical link yet is not matched at all; it stays PENDING_SYNC until
 * {@link #resyncChildren} runs for the parent.</p>
 */
public class GeographyIngestService implements SyncTrigger {
    private static final Logger log = LoggerFactory.getLogger(GeographyIngestService.class);

    private static final String DUPLICATE = "DUPLICATE";
    private static final String NOT_PENDING = "NOT_PENDING";

    private final TenantGeoUnitRepository tenantUnits;
    private final CanonicalMatcher matcher;
    private final CanonicalRegistry registry;
    private final ConflictDetector conflicts;
    private final SyncLedger ledger;
    private final HierarchyValidator hierarchy;
    private final DistributedLock lock;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final SyncOptions options;
    private final Executor executor;

    public GeographyIngestService(TenantGeoUnitRepository tenantUnits, CanonicalMatcher matcher,
                                  CanonicalRegistry registry, ConflictDetector conflicts, SyncLedger ledger,
                                  HierarchyValidator hierarchy, DistributedLock lock, MetricsService metrics,
                                  TracingService tracing, SyncOptions options, Executor executor) {
        this.tenantUnits = tenantUnits;
        this.matcher = matcher;
        this.registry = registry;
        this.conflicts = conflicts;
        this.ledger = ledger;
        this.hierarchy = hierarchy;
        this.lock = lock;
        this.metrics = metrics;
        this.tracing = tracing;
        this.options = options;
        this.executor = executor;
    }

    /**
     * Validates, persists and syncs a submission.
     *
     * @throws InvalidHierarchyException if the submission is malformed; nothing is persisted
     */
    public IngestAcknowledgement ingest(IngestRequest request) {
        Instant start = Instant.now();
        TenantGeoUnit candidate = validate(request);

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forIngest(correlationId, candidate.getTenantId(), candidate.getLevel());
             Span span = tracing.start(SyncOperation.INGEST, Map.of(
                     "tenantId", candidate.getTenantId(), "level", String.valueOf(candidate.getLevel())))) {
            try {
                IngestAcknowledgement ack = admit(candidate);
                if (!ack.duplicateSubmission()) {
                    ack = syncUnit(ack.tenantUnitId());
                }
                String outcome = ack.duplicateSubmission() ? DUPLICATE
                        : ack.outcome() != null ? ack.outcome().name() : NOT_PENDING;
                metrics.recordIngestDuration(candidate.getLevel(), outcome, Duration.between(start, Instant.now()));
                span.setAttribute("outcome", outcome);
                span.succeeded();
                log.info("ingest.completed tenantUnitId={} name='{}' state={} outcome={} canonicalId={}",
                        ack.tenantUnitId(), candidate.getDeclaredName(), ack.syncState(), outcome,
                        ack.canonicalUnitId());
                return ack;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }

    /**
     * Runs {@link #ingest} on the configured executor.
     */
    public CompletableFuture<IngestAcknowledgement> ingestAsync(IngestRequest request) {
        return CompletableFuture.supplyAsync(() -> ingest(request), executor);
    }

    private TenantGeoUnit validate(IngestRequest request) {
        if (request.tenantId() == null || request.tenantId().isBlank()) {
            throw new InvalidHierarchyException("tenantId is required");
        }
        if (request.names().isEmpty()) {
            throw new InvalidHierarchyException("At least one name is required");
        }
        Map<String, String> names = new LinkedHashMap<>();
        request.names().forEach((language, name) ->
                names.put(InputSanitizer.sanitizeLanguage(language), InputSanitizer.sanitizeName(name)));
        String primaryLanguage = request.primaryLanguage();
        if (primaryLanguage != null && !names.containsKey(primaryLanguage)) {
            throw new InvalidHierarchyException("Primary language " + primaryLanguage + " has no name");
        }
        String parentId = request.parentId() == null || request.parentId().isBlank() ? null : request.parentId();

        hierarchy.validatePlacement(request.tenantId(), request.level(), parentId);

        String code = request.governmentCode();
        return TenantGeoUnit.builder()
                .tenantId(request.tenantId().trim())
                .level(request.level())
                .parentId(parentId)
                .names(names)
                .primaryLanguage(primaryLanguage)
                .governmentCode(code == null || code.isBlank() ? null : code.trim())
                .build();
    }

    /**
     * Persists the unit, or finds the tenant's existing unit with the same name in the same place.
     * Serialized per tenant scope so concurrent resubmissions see each other.
     */
    private IngestAcknowledgement admit(TenantGeoUnit unit) {
        String key = "tenant:" + unit.getTenantId() + ":" + unit.getLevel() + ":"
                + (unit.getParentId() == null ? "root" : unit.getParentId());
        return withLock(key, () -> {
            Optional<TenantGeoUnit> existing = findExisting(unit);
            if (existing.isEmpty()) {
                TenantGeoUnit draft = TenantGeoUnit.builder(unit).build();
                tenantUnits.save(draft);
                TenantGeoUnit pending = TenantGeoUnit.builder(draft).build();
                pending.transitionTo(SyncState.PENDING_SYNC);
                tenantUnits.save(pending);
                log.debug("ingest.accepted tenantUnitId={} name='{}'", pending.getId(), pending.getDeclaredName());
                return IngestAcknowledgement.of(pending, null, null);
            }

            TenantGeoUnit found = existing.get();
            if (found.getSyncState() == SyncState.REJECTED) {
                found.transitionTo(SyncState.PENDING_SYNC);
                tenantUnits.save(found);
                log.info("ingest.resubmitted tenantUnitId={} name='{}'", found.getId(), found.getDeclaredName());
                return IngestAcknowledgement.of(found, null, null);
            }
            log.info("ingest.duplicate tenantUnitId={} state={}", found.getId(), found.getSyncState());
            return IngestAcknowledgement.duplicate(found, openCaseId(found));
        });
    }

    private Optional<TenantGeoUnit> findExisting(TenantGeoUnit unit) {
        String normalized = matcher.normalize(unit.getDeclaredName(), unit.getLevel());
        return tenantUnits.findSiblings(unit.getTenantId(), unit.getLevel(), unit.getParentId()).stream()
                .filter(u -> !u.isRetired())
                .filter(u -> matcher.normalize(u.getDeclaredName(), u.getLevel()).equals(normalized))
                .findFirst();
    }

    @Override
    public void sync(String tenantUnitId) {
        syncUnit(tenantUnitId);
    }

    /**
     * Matches a PENDING_SYNC unit and acts on the decision. A unit in any other state is
     * returned as it stands with a null outcome.
     */
    public IngestAcknowledgement syncUnit(String tenantUnitId) {
        return withLock("sync:" + tenantUnitId, () -> {
            TenantGeoUnit unit = load(tenantUnitId);
            if (unit.isRetired() || unit.getSyncState() != SyncState.PENDING_SYNC) {
                log.debug("sync.skipped tenantUnitId={} state={} retired={}",
                        unit.getId(), unit.getSyncState(), unit.isRetired());
                return IngestAcknowledgement.of(unit, openCaseId(unit), null);
            }

            String canonicalParentId = canonicalParentOf(unit);
            if (unit.getLevel() > 0 && canonicalParentId == null) {
                return defer(unit);
            }
            MatchOutcome outcome = matcher.match(unit, canonicalParentId);

            return switch (outcome.decision()) {
                case AUTO_LINK -> autoLink(unit, canonicalParentId, outcome);
                case CONFLICT -> openConflict(unit, outcome);
                case NO_MATCH -> create(unit, canonicalParentId, outcome);
            };
        });
    }

    private IngestAcknowledgement autoLink(TenantGeoUnit unit, String canonicalParentId, MatchOutcome outcome) {
        RegistryResult result = registry.autoLinkTenantUnit(unit, canonicalParentId, outcome);
        if (result.isLinked()) {
            return acknowledgeLinked(unit.getId(), result.outcome());
        }
        if (result.recheck().decision() == MatchDecision.NO_MATCH) {
            return create(unit, canonicalParentId, result.recheck());
        }
        return openConflict(unit, result.recheck());
    }

    private IngestAcknowledgement create(TenantGeoUnit unit, String canonicalParentId, MatchOutcome outcome) {
        RegistryResult result = registry.createFromTenantUnit(unit, canonicalParentId, outcome.candidates());
        if (result.outcome() == LedgerOutcome.FLAGGED_CONFLICT) {
            return openConflict(unit, result.recheck());
        }
        return acknowledgeLinked(unit.getId(), result.outcome());
    }

    private IngestAcknowledgement openConflict(TenantGeoUnit unit, MatchOutcome outcome) {
        ConflictCase conflictCase = conflicts.open(unit, outcome);
        return IngestAcknowledgement.of(load(unit.getId()), conflictCase.getId(), LedgerOutcome.FLAGGED_CONFLICT);
    }

    private IngestAcknowledgement acknowledgeLinked(String tenantUnitId, LedgerOutcome outcome) {
        resyncChildren(tenantUnitId);
        return IngestAcknowledgement.of(load(tenantUnitId), null, outcome);
    }

    /**
     * Keeps the unit PENDING_SYNC and records why. A child is only matched among the
     * canonical children of its parent's canonical unit, so nothing is proposed until
     * the parent is linked and {@link #resyncChildren} runs.
     */
    private IngestAcknowledgement defer(TenantGeoUnit unit) {
        TenantGeoUnit before = load(unit.getId());
        TenantGeoUnit after = TenantGeoUnit.builder(before).build();
        after.transitionTo(SyncState.PENDING_SYNC);
        String reason = "Parent " + unit.getParentId() + " has no canonical unit yet";

        try (SyncTransaction tx = new SyncTransaction("defer")) {
            tx.execute("touch tenant unit " + unit.getId(),
                    () -> tenantUnits.save(after), () -> tenantUnits.save(before));
            tx.executeNoCompensation("append ledger", () -> ledger.append(unit.getId(), options.getActor(),
                    new SyncEvent.UnitDeferred(unit.getTenantId(), reason, List.of())));
            tx.markSuccess();
        } catch (GeographySyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SyncPersistenceException("Failed to defer tenant unit " + unit.getId(), e);
        }
        log.info("sync.deferred tenantUnitId={} parentId={}", unit.getId(), unit.getParentId());
        return IngestAcknowledgement.of(after, null, LedgerOutcome.DEFERRED);
    }

    /**
     * Canonical unit of the tenant parent, following merges; null at level 0 or when the
     * parent is not linked yet.
     */
    private String canonicalParentOf(TenantGeoUnit unit) {
        if (unit.getLevel() == 0 || unit.getParentId() == null) {
            return null;
        }
        TenantGeoUnit parent = load(unit.getParentId());
        if (parent.getCanonicalUnitId() == null) {
            return null;
        }
        return registry.resolveCanonical(parent.getCanonicalUnitId()).getId();
    }

    @Override
    public void resyncChildren(String parentTenantUnitId) {
        for (TenantGeoUnit child : tenantUnits.findChildren(parentTenantUnitId)) {
            if (child.isRetired() || child.getSyncState() != SyncState.PENDING_SYNC) {
                continue;
            }
            try {
                IngestAcknowledgement ack = syncUnit(child.getId());
                log.info("sync.child_resynced tenantUnitId={} parentId={} outcome={}",
                        child.getId(), parentTenantUnitId, ack.outcome());
            } catch (GeographySyncException e) {
                // the child stays PENDING_SYNC and is picked up by the next resync of its parent
                log.warn("sync.child_failed tenantUnitId={} parentId={} retryable={} error={}",
                        child.getId(), parentTenantUnitId, e.isRetryable(), e.getMessage());
            }
        }
    }

    /**
     * Soft-retires a tenant unit. Canonical data is untouched.
     */
    public TenantGeoUnit retire(String tenantUnitId) {
        return withLock("sync:" + tenantUnitId, () -> {
            TenantGeoUnit unit = load(tenantUnitId);
            if (!unit.isRetired()) {
                unit.retire();
                tenantUnits.save(unit);
                log.info("ingest.retired tenantUnitId={} tenantId={}", unit.getId(), unit.getTenantId());
            }
            return unit;
        });
    }

    public Optional<TenantGeoUnit> find(String tenantUnitId) {
        return tenantUnits.findById(tenantUnitId);
    }

    private String openCaseId(TenantGeoUnit unit) {
        if (unit.getSyncState() != SyncState.CONFLICT_OPEN) {
            return null;
        }
        return conflicts.findOpenForTenantUnit(unit.getId()).map(ConflictCase::getId).orElse(null);
    }

    private TenantGeoUnit load(String tenantUnitId) {
        return tenantUnits.findById(tenantUnitId)
                .orElseThrow(() -> new UnknownUnitException("Tenant unit", tenantUnitId));
    }

    private <T> T withLock(String key, Supplier<T> work) {
        lock.tryLock(key);
        try {
            return work.get();
        } finally {
            lock.unlock(key);
        }
    }
}
