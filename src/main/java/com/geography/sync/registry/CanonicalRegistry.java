package com.geography.sync.registry;

import com.geography.sync.api.SyncOptions;
import com.geography.sync.cache.RegistryListener;
import com.geography.sync.core.GeographySyncException;
import com.geography.sync.core.SyncPersistenceException;
import com.geography.sync.core.UnknownUnitException;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.core.model.SyncState;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.core.model.VerificationState;
import com.geography.sync.ledger.SyncEvent;
import com.geography.sync.ledger.SyncLedger;
import com.geography.sync.lock.DistributedLock;
import com.geography.sync.logging.LogContext;
import com.geography.sync.matching.CanonicalMatcher;
import com.geography.sync.matching.MatchDecision;
import com.geography.sync.matching.MatchOutcome;
import com.geography.sync.metrics.MetricsService;
import com.geography.sync.tenant.TenantGeoUnitRepository;
import com.geography.sync.tracing.Span;
import com.geography.sync.tracing.SyncOperation;
import com.geography.sync.tracing.TracingService;
import com.geography.sync.transaction.SyncTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * The only writer of canonical units.
 *
 * <p>Every mutation holds the lock of each sibling scope it touches and runs in a
 * {@link SyncTransaction}: repository writes are registered with a snapshot-restoring
 * compensation, the ledger entry is appended last, and a failed append undoes the
 * writes before surfacing {@link SyncPersistenceException}. Listeners hear about a
 * scope only after its change is committed.</p>
 */
public class CanonicalRegistry {
    private static final Logger log = LoggerFactory.getLogger(CanonicalRegistry.class);
    private static final int MAX_MERGE_CHAIN = 64;

    private final CanonicalUnitRepository units;
    private final TenantGeoUnitRepository tenantUnits;
    private final SyncLedger ledger;
    private final CanonicalMatcher matcher;
    private final DistributedLock lock;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final SyncOptions options;
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    public CanonicalRegistry(CanonicalUnitRepository units,
                             TenantGeoUnitRepository tenantUnits,
                             SyncLedger ledger, CanonicalMatcher matcher, DistributedLock lock,
                             MetricsService metrics, TracingService tracing, SyncOptions options) {
        this.units = units;
        this.tenantUnits = tenantUnits;
        this.ledger = ledger;
        this.matcher = matcher;
        this.lock = lock;
        this.metrics = metrics;
        this.tracing = tracing;
        this.options = options;
    }

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    // ------------------------------------------------------------------ create

    /**
     * Creates a canonical unit from a tenant's first sighting of a place.
     *
     * <p>The sibling scope is matched again under its lock. If a unit appeared since the
     * caller's match, the tenant unit is linked to it (or a conflict is reported) instead.
     * A unique key collision from a concurrent creator is resolved the same way.</p>
     *
     * @param canonicalParentId the canonical parent, null only at level 0
     */
    public RegistryResult createFromTenantUnit(TenantGeoUnit unit, String canonicalParentId,
                                               List<MatchCandidate> candidates) {
        List<String> alternates = new ArrayList<>(unit.getNames().values());
        alternates.remove(unit.getDeclaredName());
        return create(unit, canonicalParentId, unit.getDeclaredName(), alternates, candidates,
                options.getActor(), true);
    }

    /**
     * Creates a canonical unit under an administrator-chosen name; the tenant's declared
     * names become alternates. No re-match happens: the administrator has ruled the
     * submission to be a distinct place.
     */
    public RegistryResult createRenamed(TenantGeoUnit unit, String canonicalParentId,
                                        String primaryName, String actor) {
        if (primaryName == null || primaryName.isBlank()) {
            throw new IllegalArgumentException("primaryName is required");
        }
        return create(unit, canonicalParentId, primaryName.trim(), new ArrayList<>(unit.getNames().values()),
                List.of(), actor, false);
    }

    private RegistryResult create(TenantGeoUnit unit, String requestedParentId, String primaryName,
                                  List<String> alternates, List<MatchCandidate> candidates,
                                  String actor, boolean rematch) {
        if (unit.getLevel() > 0 && requestedParentId == null) {
            throw new IllegalArgumentException("A canonical unit below level 0 needs a canonical parent");
        }
        String parentId = requestedParentId == null ? null : resolveCanonical(requestedParentId).getId();
        String scope = DistributedLock.scopeKey(unit.getLevel(), parentId);

        RegistryResult result = locked(List.of(scope), () -> {
            if (rematch) {
                MatchOutcome fresh = matcher.matchFresh(unit, parentId);
                if (fresh.decision() == MatchDecision.AUTO_LINK) {
                    log.info("canonical.create.superseded tenantUnitId={} canonicalId={}",
                            unit.getId(), fresh.best().canonicalId());
                    return doLink(unit.getId(), fresh.best().canonicalId(), fresh.bestScore(),
                            fresh.candidates(), actor);
                }
                if (fresh.decision() == MatchDecision.CONFLICT) {
                    return RegistryResult.conflict(unit.getId(), fresh);
                }
            }

            String normalized = matcher.normalize(primaryName, unit.getLevel());
            CanonicalUnit.Builder builder = CanonicalUnit.builder()
                    .level(unit.getLevel())
                    .parentId(parentId)
                    .primaryName(primaryName)
                    .normalizedName(normalized)
                    .governmentCode(blankToNull(unit.getGovernmentCode()))
                    .tenantId(unit.getTenantId());
            CanonicalUnit canonical = builder.build();
            alternates.forEach(canonical::addAlternateName);

            try {
                units.findActiveByKey(unit.getLevel(), parentId, normalized).ifPresent(existing -> {
                    throw new DuplicateCanonicalUnitException(unit.getLevel(), parentId, normalized);
                });
                return doCreate(unit.getId(), canonical, candidates, actor);
            } catch (DuplicateCanonicalUnitException e) {
                CanonicalUnit winner = units.findActiveByKey(unit.getLevel(), parentId, normalized)
                        .orElseThrow(() -> new SyncPersistenceException(
                                "Unique key reported taken but no holder found", e));
                metrics.incrementCreateRaceRecovered();
                log.info("canonical.create.race_recovered tenantUnitId={} winnerId={}", unit.getId(), winner.getId());
                return doLink(unit.getId(), winner.getId(), 1.0, candidates, actor);
            }
        });

        if (result.isLinked()) {
            notifyScope(unit.getLevel(), parentId);
        }
        return result;
    }

    private RegistryResult doCreate(String tenantUnitId, CanonicalUnit canonical,
                                    List<MatchCandidate> candidates, String actor) {
        TenantGeoUnit before = loadTenantUnit(tenantUnitId);
        TenantGeoUnit after = linkedCopy(before, canonical.getId());

        try (SyncTransaction tx = new SyncTransaction("create")) {
            tx.execute("insert canonical " + canonical.getId(),
                    () -> units.insert(canonical), () -> units.delete(canonical.getId()));
            tx.execute("link tenant unit " + tenantUnitId,
                    () -> tenantUnits.save(after), () -> tenantUnits.save(before));
            tx.executeNoCompensation("append ledger", () -> ledger.append(tenantUnitId, actor,
                    new SyncEvent.UnitCreated(canonical.getId(), before.getTenantId(), canonical.getLevel(),
                            canonical.getParentId(), canonical.getPrimaryName(), canonical.getNormalizedName(),
                            List.copyOf(canonical.getAlternateNames()), canonical.getGovernmentCode(), candidates)));
            tx.markSuccess();
        } catch (GeographySyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw persistenceFailure("create canonical unit", e);
        }

        metrics.incrementCanonicalCreated(canonical.getLevel());
        log.info("canonical.created canonicalId={} level={} parentId={} name='{}' tenantUnitId={}",
                canonical.getId(), canonical.getLevel(), canonical.getParentId(),
                canonical.getPrimaryName(), tenantUnitId);
        return RegistryResult.created(tenantUnitId, canonical.getId());
    }

    // ------------------------------------------------------------------ link

    /**
     * Links a tenant unit to an existing canonical unit, following merges to the survivor.
     * Declared names the canonical unit does not know become alternates and the tenant
     * is added to its tenant set.
     */
    public RegistryResult linkTenantUnit(TenantGeoUnit unit, String canonicalId, double score,
                                         List<MatchCandidate> candidates) {
        return linkTenantUnit(unit, canonicalId, score, candidates, options.getActor());
    }

    /**
     * Commits a matcher AUTO_LINK. The scope is matched again under its lock, so a
     * sibling created since the caller's (possibly cached) match is taken into account:
     * the link goes to the fresh best unit, or a FLAGGED_CONFLICT result carries the
     * fresh outcome back. A fresh NO_MATCH is reported the same way and the caller creates.
     *
     * @param canonicalParentId the canonical parent the match ran under, null only at level 0
     */
    public RegistryResult autoLinkTenantUnit(TenantGeoUnit unit, String canonicalParentId, MatchOutcome outcome) {
        if (unit.getLevel() > 0 && canonicalParentId == null) {
            throw new IllegalArgumentException("A level " + unit.getLevel() + " link needs a canonical parent");
        }
        String parentId = canonicalParentId == null ? null : resolveCanonical(canonicalParentId).getId();

        RegistryResult result = locked(List.of(DistributedLock.scopeKey(unit.getLevel(), parentId)), () -> {
            MatchOutcome fresh = matcher.matchFresh(unit, parentId);
            if (fresh.decision() != MatchDecision.AUTO_LINK) {
                log.info("canonical.link.superseded tenantUnitId={} proposed={} decision={}",
                        unit.getId(), outcome.best().canonicalId(), fresh.decision());
                return RegistryResult.conflict(unit.getId(), fresh);
            }
            return doLink(unit.getId(), fresh.best().canonicalId(), fresh.bestScore(),
                    fresh.candidates(), options.getActor());
        });

        if (result.isLinked()) {
            notifyScope(unit.getLevel(), parentId);
        }
        return result;
    }

    public RegistryResult linkTenantUnit(TenantGeoUnit unit, String canonicalId, double score,
                                         List<MatchCandidate> candidates, String actor) {
        CanonicalUnit target = resolveCanonical(canonicalId);
        if (target.getLevel() != unit.getLevel()) {
            throw new IllegalArgumentException("Cannot link a level " + unit.getLevel()
                    + " unit to level " + target.getLevel() + " canonical unit " + target.getId());
        }
        RegistryResult result = locked(List.of(scopeOf(target)),
                () -> doLink(unit.getId(), target.getId(), score, candidates, actor));
        notifyScope(target.getLevel(), target.getParentId());
        return result;
    }

    private RegistryResult doLink(String tenantUnitId, String canonicalId, double score,
                                  List<MatchCandidate> candidates, String actor) {
        CanonicalUnit before = units.findById(canonicalId)
                .orElseThrow(() -> new UnknownUnitException("Canonical unit", canonicalId));
        if (!before.isActive()) {
            throw new IllegalStateException("Canonical unit " + canonicalId + " is retired");
        }
        TenantGeoUnit tenantBefore = loadTenantUnit(tenantUnitId);

        CanonicalUnit after = before.copy();
        List<String> added = new ArrayList<>();
        for (String name : tenantBefore.getNames().values()) {
            if (after.addAlternateName(name)) {
                added.add(name);
            }
        }
        after.addTenant(tenantBefore.getTenantId());
        TenantGeoUnit tenantAfter = linkedCopy(tenantBefore, canonicalId);

        try (SyncTransaction tx = new SyncTransaction("link")) {
            tx.execute("update canonical " + canonicalId, () -> units.update(after), () -> units.update(before));
            tx.execute("link tenant unit " + tenantUnitId,
                    () -> tenantUnits.save(tenantAfter), () -> tenantUnits.save(tenantBefore));
            tx.executeNoCompensation("append ledger", () -> ledger.append(tenantUnitId, actor,
                    new SyncEvent.UnitMatched(canonicalId, tenantBefore.getTenantId(), tenantBefore.getDeclaredName(),
                            added, score, candidates)));
            tx.markSuccess();
        } catch (GeographySyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw persistenceFailure("link tenant unit", e);
        }

        metrics.incrementCanonicalLinked(after.getLevel());
        log.info("canonical.linked canonicalId={} tenantUnitId={} tenantId={} score={} tenants={}",
                canonicalId, tenantUnitId, tenantBefore.getTenantId(), score, after.getTenantReferenceCount());
        return RegistryResult.linked(tenantUnitId, canonicalId);
    }

    private static TenantGeoUnit linkedCopy(TenantGeoUnit unit, String canonicalId) {
        TenantGeoUnit copy = TenantGeoUnit.builder(unit).build();
        copy.transitionTo(SyncState.MATCHED);
        copy.linkTo(canonicalId);
        copy.transitionTo(SyncState.SYNCED);
        return copy;
    }

    // ------------------------------------------------------------------ merge

    /**
     * Folds {@code secondaryId} into {@code primaryId}. The primary keeps its name and
     * government code and gains the secondary's names and tenants. Tenant units linked to
     * the secondary and the secondary's canonical children move to the primary; a child
     * whose name already exists under the primary is merged into that sibling first.
     * The secondary is retired with {@code mergedInto = primaryId}.
     */
    public MergeResult mergeUnits(String primaryId, String secondaryId, String actor) {
        if (primaryId.equals(secondaryId)) {
            throw new IllegalArgumentException("Cannot merge a unit into itself: " + primaryId);
        }
        CanonicalUnit primary = requireActive(primaryId);
        CanonicalUnit secondary = requireActive(secondaryId);
        if (primary.getLevel() != secondary.getLevel()) {
            throw new IllegalArgumentException("Cannot merge units of different levels: "
                    + primary.getLevel() + " and " + secondary.getLevel());
        }

        String correlationId = LogContext.generateCorrelationId();
        try (LogContext ignored = LogContext.forMerge(correlationId, primaryId, secondaryId);
             Span span = tracing.start(SyncOperation.MERGE, Map.of("primaryId", primaryId, "secondaryId", secondaryId))) {
            try {
                int nested = mergeCollidingChildren(primaryId, secondaryId, actor);

                List<String> scopes = List.of(
                        scopeOf(primary), scopeOf(secondary),
                        DistributedLock.scopeKey(primary.getLevel() + 1, primaryId),
                        DistributedLock.scopeKey(primary.getLevel() + 1, secondaryId));
                MergeResult result = locked(scopes, () -> doMerge(primaryId, secondaryId, actor, nested));

                notifyScope(primary.getLevel(), primary.getParentId());
                notifyScope(secondary.getLevel(), secondary.getParentId());
                notifyScope(primary.getLevel() + 1, primaryId);
                notifyScope(primary.getLevel() + 1, secondaryId);
                metrics.incrementCanonicalMerged(primary.getLevel());
                span.setAttribute("repointedTenantUnits", result.repointedTenantUnitIds().size());
                span.succeeded();
                return result;
            } catch (RuntimeException e) {
                span.failed(e);
                throw e;
            }
        }
    }

    private int mergeCollidingChildren(String primaryId, String secondaryId, String actor) {
        int merged = 0;
        for (CanonicalUnit child : units.findChildren(secondaryId)) {
            Optional<CanonicalUnit> twin = units.findActiveByKey(child.getLevel(), primaryId, child.getNormalizedName());
            if (twin.isPresent()) {
                mergeUnits(twin.get().getId(), child.getId(), actor);
                merged++;
            }
        }
        return merged;
    }

    private MergeResult doMerge(String primaryId, String secondaryId, String actor, int nestedMerges) {
        CanonicalUnit primaryBefore = requireActive(primaryId);
        CanonicalUnit secondaryBefore = requireActive(secondaryId);

        CanonicalUnit primaryAfter = primaryBefore.copy();
        secondaryBefore.getAllNames().forEach(primaryAfter::addAlternateName);
        secondaryBefore.getTenantIds().forEach(primaryAfter::addTenant);
        if (primaryAfter.getGovernmentCode() == null && secondaryBefore.getGovernmentCode() != null) {
            primaryAfter.setGovernmentCode(secondaryBefore.getGovernmentCode());
        }
        CanonicalUnit secondaryAfter = secondaryBefore.copy();
        secondaryAfter.retireInto(primaryId);

        List<TenantGeoUnit> linked = tenantUnits.findByCanonicalUnitId(secondaryId);
        List<CanonicalUnit> children = units.findChildren(secondaryId);
        List<String> repointed = new ArrayList<>();
        List<String> reparented = new ArrayList<>();

        try (SyncTransaction tx = new SyncTransaction("merge")) {
            tx.execute("retire " + secondaryId,
                    () -> units.update(secondaryAfter), () -> units.update(secondaryBefore));
            tx.execute("absorb into " + primaryId,
                    () -> units.update(primaryAfter), () -> units.update(primaryBefore));
            for (TenantGeoUnit tenantUnit : linked) {
                TenantGeoUnit moved = TenantGeoUnit.builder(tenantUnit).build();
                moved.linkTo(primaryId);
                tx.execute("repoint tenant unit " + tenantUnit.getId(),
                        () -> tenantUnits.save(moved), () -> tenantUnits.save(tenantUnit));
                repointed.add(tenantUnit.getId());
            }
            for (CanonicalUnit child : children) {
                CanonicalUnit moved = child.copy();
                moved.setParentId(primaryId);
                tx.execute("reparent child " + child.getId(),
                        () -> units.update(moved), () -> units.update(child));
                reparented.add(child.getId());
            }
            tx.executeNoCompensation("append ledger", () -> ledger.append(null, actor,
                    new SyncEvent.UnitsMerged(primaryId, secondaryId, repointed, reparented)));
            tx.markSuccess();
        } catch (GeographySyncException e) {
            throw e;
        } catch (RuntimeException e) {
            throw persistenceFailure("merge canonical units", e);
        }

        log.info("canonical.merged primaryId={} secondaryId={} repointed={} reparented={} nestedMerges={}",
                primaryId, secondaryId, repointed.size(), reparented.size(), nestedMerges);
        return new MergeResult(primaryId, secondaryId, repointed, reparented, nestedMerges);
    }

    // ------------------------------------------------------------------ verification

    /**
     * Sets the verification state of a unit, for example after checking it against an official source.
     */
    public CanonicalUnit verify(String canonicalId, VerificationState state, String actor) {
        CanonicalUnit target = requireActive(canonicalId);
        CanonicalUnit updated = locked(List.of(scopeOf(target)), () -> {
            CanonicalUnit before = requireActive(canonicalId);
            CanonicalUnit after = before.copy();
            after.setVerificationState(state);
            try (SyncTransaction tx = new SyncTransaction("verify")) {
                tx.execute("set verification " + canonicalId, () -> units.update(after), () -> units.update(before));
                tx.executeNoCompensation("append ledger",
                        () -> ledger.append(null, actor, new SyncEvent.VerificationChanged(canonicalId, state)));
                tx.markSuccess();
            } catch (GeographySyncException e) {
                throw e;
            } catch (RuntimeException e) {
                throw persistenceFailure("verify canonical unit", e);
            }
            return after;
        });
        log.info("canonical.verification_changed canonicalId={} state={} actor={}", canonicalId, state, actor);
        notifyScope(updated.getLevel(), updated.getParentId());
        return updated;
    }

    /**
     * Marks the given units DISPUTED as a step of {@code tx}. VERIFIED units keep their state.
     * The caller holds the scope locks of the units ({@link #scopesOf}).
     *
     * @return ids of the units that changed
     */
    public List<String> markDisputed(Collection<String> canonicalIds, SyncTransaction tx) {
        return changeVerification(canonicalIds, VerificationState.UNVERIFIED, VerificationState.DISPUTED, tx);
    }

    /**
     * Returns DISPUTED units to UNVERIFIED as a step of {@code tx}.
     *
     * @return ids of the units that changed
     */
    public List<String> clearDisputes(Collection<String> canonicalIds, SyncTransaction tx) {
        return changeVerification(canonicalIds, VerificationState.DISPUTED, VerificationState.UNVERIFIED, tx);
    }

    private List<String> changeVerification(Collection<String> ids, VerificationState from,
                                            VerificationState to, SyncTransaction tx) {
        List<String> changed = new ArrayList<>();
        for (String id : ids) {
            Optional<CanonicalUnit> found = units.findById(id);
            if (found.isEmpty() || !found.get().isActive() || found.get().getVerificationState() != from) {
                continue;
            }
            CanonicalUnit before = found.get();
            CanonicalUnit after = before.copy();
            after.setVerificationState(to);
            tx.execute(to + " " + id, () -> units.update(after), () -> units.update(before));
            changed.add(id);
        }
        return changed;
    }

    // ------------------------------------------------------------------ locking

    /**
     * Lock keys of the sibling scopes holding the given units.
     */
    public Set<String> scopesOf(Collection<String> canonicalIds) {
        Set<String> scopes = new TreeSet<>();
        for (String id : canonicalIds) {
            units.findById(id).ifPresent(u -> scopes.add(scopeOf(u)));
        }
        return scopes;
    }

    /**
     * Runs {@code work} holding every lock in {@code keys}, acquired in lexical order.
     */
    public <T> T locked(Collection<String> keys, Supplier<T> work) {
        List<String> ordered = new ArrayList<>(new TreeSet<>(keys));
        List<String> held = new ArrayList<>();
        try {
            for (String key : ordered) {
                lock.tryLock(key);
                held.add(key);
            }
            return work.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                lock.unlock(held.get(i));
            }
        }
    }

    /**
     * Tells listeners that the units in a sibling scope changed.
     */
    public void notifyScope(int level, String parentId) {
        for (RegistryListener listener : listeners) {
            listener.onScopeChanged(level, parentId);
        }
    }

    /**
     * Invalidates the scopes of the given units.
     */
    public void notifyUnits(Collection<String> canonicalIds) {
        Set<String> seen = new HashSet<>();
        for (String id : canonicalIds) {
            units.findById(id).ifPresent(u -> {
                if (seen.add(scopeOf(u))) {
                    notifyScope(u.getLevel(), u.getParentId());
                }
            });
        }
    }

    private static String scopeOf(CanonicalUnit unit) {
        return DistributedLock.scopeKey(unit.getLevel(), unit.getParentId());
    }

    // ------------------------------------------------------------------ queries

    public Optional<CanonicalUnit> find(String canonicalId) {
        return units.findById(canonicalId);
    }

    /**
     * Follows {@code mergedInto} from the given unit to the surviving ACTIVE unit.
     *
     * @throws UnknownUnitException if any unit along the chain does not exist
     */
    public CanonicalUnit resolveCanonical(String canonicalId) {
        String id = canonicalId;
        for (int hop = 0; hop < MAX_MERGE_CHAIN; hop++) {
            String current = id;
            CanonicalUnit unit = units.findById(current)
                    .orElseThrow(() -> new UnknownUnitException("Canonical unit", current));
            if (unit.isActive() || unit.getMergedInto() == null) {
                return unit;
            }
            id = unit.getMergedInto();
        }
        throw new IllegalStateException("Merge chain from " + canonicalId + " exceeds " + MAX_MERGE_CHAIN + " hops");
    }

    public List<CanonicalUnit> findChildren(String parentId) {
        return units.findChildren(parentId);
    }

    public List<CanonicalUnit> findActive(int level, String parentId) {
        return units.findActive(level, parentId);
    }

    public List<CanonicalUnit> findAll() {
        return units.findAll();
    }

    private CanonicalUnit requireActive(String canonicalId) {
        CanonicalUnit unit = units.findById(canonicalId)
                .orElseThrow(() -> new UnknownUnitException("Canonical unit", canonicalId));
        if (!unit.isActive()) {
            throw new IllegalStateException("Canonical unit " + canonicalId + " is retired");
        }
        return unit;
    }

    private TenantGeoUnit loadTenantUnit(String tenantUnitId) {
        return tenantUnits.findById(tenantUnitId)
                .orElseThrow(() -> new UnknownUnitException("Tenant unit", tenantUnitId));
    }

    private static SyncPersistenceException persistenceFailure(String operation, RuntimeException e) {
        log.error("registry.write_failed operation='{}' error={}", operation, e.getMessage());
        return new SyncPersistenceException("Failed to " + operation, e);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
