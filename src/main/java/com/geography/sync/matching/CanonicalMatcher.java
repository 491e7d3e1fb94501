package com.geography.sync.matching;

import com.geography.sync.api.SyncOptions;
import com.geography.sync.cache.NoOpSiblingCache;
import com.geography.sync.cache.SiblingCache;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.MatchCandidate;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.metrics.MetricsService;
import com.geography.sync.metrics.NoOpMetricsService;
import com.geography.sync.registry.CanonicalUnitRepository;
import com.geography.sync.rules.NormalizationEngine;
import com.geography.sync.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Proposes canonical units for a tenant unit and decides between linking,
 * review and creation. Never writes; safe to call from any number of threads.
 *
 * <p>A candidate's score is the best similarity between any normalized declared
 * name of the tenant unit and any normalized name of the candidate. Matching
 * non-blank government codes score 1.0.</p>
 */
public class CanonicalMatcher {
    private static final Logger log = LoggerFactory.getLogger(CanonicalMatcher.class);

    private static final Comparator<MatchCandidate> RANKING =
            Comparator.comparingDouble(MatchCandidate::score).reversed()
                    .thenComparing(MatchCandidate::canonicalId);

    private final CanonicalUnitRepository repository;
    private final NormalizationEngine normalizer;
    private final SimilarityAlgorithm similarity;
    private final SiblingCache cache;
    private final SyncOptions options;
    private final MetricsService metrics;

    public CanonicalMatcher(CanonicalUnitRepository repository, NormalizationEngine normalizer,
                            SimilarityAlgorithm similarity, SyncOptions options) {
        this(repository, normalizer, similarity, new NoOpSiblingCache(), options, new NoOpMetricsService());
    }

    public CanonicalMatcher(CanonicalUnitRepository repository, NormalizationEngine normalizer,
                            SimilarityAlgorithm similarity, SiblingCache cache,
                            SyncOptions options, MetricsService metrics) {
        this.repository = repository;
        this.normalizer = normalizer;
        this.similarity = similarity;
        this.cache = cache;
        this.options = options;
        this.metrics = metrics;
    }

    /**
     * Matches against the cached sibling scope.
     *
     * @param canonicalParentId canonical parent of the scope; null only at level 0
     */
    public MatchOutcome match(TenantGeoUnit unit, String canonicalParentId) {
        return decide(score(unit, candidates(unit.getLevel(), canonicalParentId, true)));
    }

    /**
     * Matches against the repository directly. Used under the scope lock, where a
     * stale cached scope could hide a unit created a moment ago.
     */
    public MatchOutcome matchFresh(TenantGeoUnit unit, String canonicalParentId) {
        return decide(score(unit, candidates(unit.getLevel(), canonicalParentId, false)));
    }

    /**
     * Normalized form of a name at the given level.
     */
    public String normalize(String name, int level) {
        return normalizer.normalize(name, level);
    }

    /**
     * Applies the decision rule to candidates already ranked best first.
     */
    public MatchOutcome decide(List<MatchCandidate> ranked) {
        if (ranked.isEmpty()) {
            return MatchOutcome.noMatch();
        }
        MatchCandidate best = ranked.get(0);
        metrics.recordSimilarityScore(best.score());

        boolean accepted = best.score() >= options.getAcceptThreshold();
        boolean clearLead = ranked.stream().skip(1)
                .allMatch(c -> c.score() < best.score() - options.getTieMargin()
                        && c.score() < options.getAcceptThreshold());
        MatchDecision decision = accepted && clearLead ? MatchDecision.AUTO_LINK : MatchDecision.CONFLICT;
        log.debug("match.decided decision={} best={} score={} candidates={}",
                decision, best.canonicalId(), best.score(), ranked.size());
        return new MatchOutcome(decision, ranked, best);
    }

    List<MatchCandidate> score(TenantGeoUnit unit, List<CanonicalUnit> siblings) {
        Set<String> declared = new LinkedHashSet<>();
        for (String name : unit.getNames().values()) {
            declared.add(normalize(name, unit.getLevel()));
        }

        List<MatchCandidate> candidates = new ArrayList<>();
        for (CanonicalUnit sibling : siblings) {
            double score = score(unit, declared, sibling);
            if (score >= options.getCandidateFloor()) {
                candidates.add(new MatchCandidate(sibling.getId(), sibling.getPrimaryName(), score));
            }
        }
        candidates.sort(RANKING);
        return candidates;
    }

    private double score(TenantGeoUnit unit, Set<String> declared, CanonicalUnit sibling) {
        String code = unit.getGovernmentCode();
        if (code != null && !code.isBlank() && code.equalsIgnoreCase(sibling.getGovernmentCode())) {
            return 1.0;
        }
        double best = 0.0;
        for (String candidateName : sibling.getAllNames()) {
            String normalized = candidateName.equals(sibling.getPrimaryName())
                    ? sibling.getNormalizedName()
                    : normalize(candidateName, sibling.getLevel());
            for (String name : declared) {
                best = Math.max(best, similarity.compute(name, normalized));
                if (best >= 1.0) {
                    return 1.0;
                }
            }
        }
        return Math.min(1.0, Math.max(0.0, best));
    }

    private List<CanonicalUnit> candidates(int level, String canonicalParentId, boolean useCache) {
        if (level > 0 && canonicalParentId == null) {
            throw new IllegalArgumentException("A level " + level + " match needs a canonical parent");
        }
        if (useCache) {
            return cache.get(level, canonicalParentId, () -> repository.findActive(level, canonicalParentId));
        }
        return repository.findActive(level, canonicalParentId);
    }
}
