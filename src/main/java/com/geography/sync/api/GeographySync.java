package com.geography.sync.api;

import com.geography.sync.cache.CacheConfig;
import com.geography.sync.cache.CaffeineSiblingCache;
import com.geography.sync.cache.NoOpSiblingCache;
import com.geography.sync.cache.SiblingCache;
import com.geography.sync.conflict.ConflictCase;
import com.geography.sync.conflict.ConflictCaseRepository;
import com.geography.sync.conflict.ConflictDetector;
import com.geography.sync.conflict.GraphConflictCaseRepository;
import com.geography.sync.conflict.InMemoryConflictCaseRepository;
import com.geography.sync.conflict.ResolutionCommand;
import com.geography.sync.core.model.CanonicalUnit;
import com.geography.sync.core.model.TenantGeoUnit;
import com.geography.sync.core.model.VerificationState;
import com.geography.sync.graph.FalkorDBConnection;
import com.geography.sync.graph.GraphConnection;
import com.geography.sync.ingest.GeographyIngestService;
import com.geography.sync.ingest.IngestAcknowledgement;
import com.geography.sync.ingest.IngestRequest;
import com.geography.sync.ledger.GraphSyncLedgerRepository;
import com.geography.sync.ledger.InMemorySyncLedgerRepository;
import com.geography.sync.ledger.ReplayResult;
import com.geography.sync.ledger.SyncLedger;
import com.geography.sync.ledger.SyncLedgerRepository;
import com.geography.sync.lock.DistributedLock;
import com.geography.sync.lock.GraphDistributedLock;
import com.geography.sync.lock.LocalDistributedLock;
import com.geography.sync.matching.CanonicalMatcher;
import com.geography.sync.metrics.MetricsService;
import com.geography.sync.metrics.NoOpMetricsService;
import com.geography.sync.registry.CanonicalRegistry;
import com.geography.sync.registry.CanonicalUnitRepository;
import com.geography.sync.registry.GraphCanonicalUnitRepository;
import com.geography.sync.registry.InMemoryCanonicalUnitRepository;
import com.geography.sync.registry.MergeResult;
import com.geography.sync.rules.DefaultNormalizationRules;
import com.geography.sync.rules.NormalizationEngine;
import com.geography.sync.similarity.CompositeSimilarityScorer;
import com.geography.sync.similarity.SimilarityAlgorithm;
import com.geography.sync.tenant.GraphTenantGeoUnitRepository;
import com.geography.sync.tenant.HierarchyValidator;
import com.geography.sync.tenant.InMemoryTenantGeoUnitRepository;
import com.geography.sync.tenant.TenantGeoUnitRepository;
import com.geography.sync.tracing.NoOpTracingService;
import com.geography.sync.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for geography sync.
 *
 * <p>Without a graph connection every store is in memory and locks are local to the JVM.
 * With {@link Builder#graphConnection} or {@link Builder#falkorDB} the repositories and
 * the scope lock live in FalkorDB, so several processes can share one registry.</p>
 *
 * <pre>
 * GeographySync sync = GeographySync.builder()
 *     .options(SyncOptions.defaults())
 *     .build();
 *
 * IngestAcknowledgement nepal = sync.ingest(IngestRequest.of("party-a", 0, null, "Nepal"));
 * IngestAcknowledgement ktm = sync.ingest(IngestRequest.of("party-a", 1, nepal.tenantUnitId(), "Kathmandu"));
 *
 * for (ConflictCase c : sync.openConflicts(PageRequest.first(20)).content()) {
 *     sync.resolveConflict(ResolutionCommand.link(c.getId(), c.getCandidateIds().get(0), "admin"));
 * }
 * </pre>
 */
public class GeographySync implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(GeographySync.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final ExecutorService ownedExecutor;
    private final SyncOptions options;
    private final SyncLedger ledger;
    private final SiblingCache cache;
    private final CanonicalRegistry registry;
    private final ConflictDetector conflicts;
    private final GeographyIngestService ingestService;
    private final TenantGeoUnitRepository tenantUnits;

    private GeographySync(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.options = builder.options;

        boolean graph = connection != null;
        CanonicalUnitRepository units = builder.canonicalUnitRepository != null ? builder.canonicalUnitRepository
                : graph ? new GraphCanonicalUnitRepository(connection) : new InMemoryCanonicalUnitRepository();
        this.tenantUnits = builder.tenantUnitRepository != null ? builder.tenantUnitRepository
                : graph ? new GraphTenantGeoUnitRepository(connection) : new InMemoryTenantGeoUnitRepository();
        SyncLedgerRepository ledgerRepository = builder.ledgerRepository != null ? builder.ledgerRepository
                : graph ? new GraphSyncLedgerRepository(connection) : new InMemorySyncLedgerRepository();
        ConflictCaseRepository caseRepository = builder.conflictCaseRepository != null ? builder.conflictCaseRepository
                : graph ? new GraphConflictCaseRepository(connection) : new InMemoryConflictCaseRepository();
        DistributedLock lock = builder.distributedLock != null ? builder.distributedLock
                : graph ? new GraphDistributedLock(connection) : new LocalDistributedLock();

        MetricsService metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        TracingService tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.cache = new CaffeineSiblingCache(builder.cacheConfig, metrics);
        } else {
            this.cache = new NoOpSiblingCache();
        }
        NormalizationEngine normalizer = builder.normalizationEngine != null
                ? builder.normalizationEngine : DefaultNormalizationRules.createDefaultEngine();
        SimilarityAlgorithm similarity = builder.similarity != null
                ? builder.similarity : new CompositeSimilarityScorer(options.getSimilarityWeights());

        if (builder.executor != null) {
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newFixedThreadPool(
                    Math.max(2, Runtime.getRuntime().availableProcessors()));
        }

        this.ledger = new SyncLedger(ledgerRepository);
        CanonicalMatcher matcher = new CanonicalMatcher(units, normalizer, similarity, cache, options, metrics);
        this.registry = new CanonicalRegistry(units, tenantUnits, ledger, matcher, lock, metrics, tracing, options);
        registry.addListener(cache);
        HierarchyValidator hierarchy = new HierarchyValidator(tenantUnits, options.getMaxLevels());
        this.conflicts = new ConflictDetector(caseRepository, tenantUnits, registry, ledger, hierarchy,
                lock, metrics, tracing, options);
        this.ingestService = new GeographyIngestService(tenantUnits, matcher, registry, conflicts, ledger,
                hierarchy, lock, metrics, tracing, options,
                builder.executor != null ? builder.executor : ownedExecutor);
        conflicts.setSyncTrigger(ingestService);

        if (graph && builder.createIndexes) {
            connection.createIndexes();
        }
        log.info("geography_sync.started graph={} acceptThreshold={} tieMargin={} candidateFloor={} maxLevels={}",
                graph ? connection.getGraphName() : "in-memory", options.getAcceptThreshold(),
                options.getTieMargin(), options.getCandidateFloor(), options.getMaxLevels());
    }

    // ------------------------------------------------------------------ ingest boundary

    public IngestAcknowledgement ingest(IngestRequest request) {
        return ingestService.ingest(request);
    }

    public CompletableFuture<IngestAcknowledgement> ingestAsync(IngestRequest request) {
        return ingestService.ingestAsync(request);
    }

    /**
     * Matches a PENDING_SYNC unit again, for example a deferred child whose parent was linked elsewhere.
     */
    public IngestAcknowledgement sync(String tenantUnitId) {
        return ingestService.syncUnit(tenantUnitId);
    }

    public TenantGeoUnit retire(String tenantUnitId) {
        return ingestService.retire(tenantUnitId);
    }

    public Optional<TenantGeoUnit> findTenantUnit(String tenantUnitId) {
        return tenantUnits.findById(tenantUnitId);
    }

    public List<TenantGeoUnit> tenantUnits(String tenantId) {
        return tenantUnits.findByTenant(tenantId);
    }

    // ------------------------------------------------------------------ resolution boundary

    public Page<ConflictCase> openConflicts(PageRequest request) {
        return conflicts.openCases(request);
    }

    public Page<ConflictCase> openConflicts(String tenantId, PageRequest request) {
        return conflicts.openCasesForTenant(tenantId, request);
    }

    public Optional<ConflictCase> findConflict(String caseId) {
        return conflicts.find(caseId);
    }

    public ConflictCase resolveConflict(ResolutionCommand command) {
        return conflicts.resolve(command);
    }

    // ------------------------------------------------------------------ registry

    public MergeResult merge(String primaryId, String secondaryId, String actor) {
        return registry.mergeUnits(primaryId, secondaryId, actor);
    }

    public CanonicalUnit verify(String canonicalId, VerificationState state, String actor) {
        return registry.verify(canonicalId, state, actor);
    }

    public Optional<CanonicalUnit> findCanonical(String canonicalId) {
        return registry.find(canonicalId);
    }

    /**
     * The surviving unit for an id, following merges.
     */
    public CanonicalUnit resolveCanonical(String canonicalId) {
        return registry.resolveCanonical(canonicalId);
    }

    public List<CanonicalUnit> canonicalChildren(String canonicalParentId) {
        return registry.findChildren(canonicalParentId);
    }

    public List<CanonicalUnit> canonicalUnits() {
        return registry.findAll();
    }

    // ------------------------------------------------------------------ ledger

    public SyncLedger ledger() {
        return ledger;
    }

    /**
     * Rebuilds the canonical units from every ledger entry.
     */
    public ReplayResult replay() {
        return ledger.replayFrom(Instant.EPOCH);
    }

    public CanonicalRegistry getRegistry() {
        return registry;
    }

    public ConflictDetector getConflictDetector() {
        return conflicts;
    }

    public GeographyIngestService getIngestService() {
        return ingestService;
    }

    public SiblingCache getCache() {
        return cache;
    }

    public SyncOptions getOptions() {
        return options;
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("Error closing connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private SyncOptions options = SyncOptions.defaults();
        private CanonicalUnitRepository canonicalUnitRepository;
        private TenantGeoUnitRepository tenantUnitRepository;
        private SyncLedgerRepository ledgerRepository;
        private ConflictCaseRepository conflictCaseRepository;
        private DistributedLock distributedLock;
        private SiblingCache cache;
        private CacheConfig cacheConfig;
        private MetricsService metricsService;
        private TracingService tracingService;
        private NormalizationEngine normalizationEngine;
        private SimilarityAlgorithm similarity;
        private ExecutorService executor;

        /**
         * Stores everything in the given graph. The caller keeps ownership of the connection.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection that is closed with this instance.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder options(SyncOptions options) {
            this.options = options;
            return this;
        }

        public Builder canonicalUnitRepository(CanonicalUnitRepository repository) {
            this.canonicalUnitRepository = repository;
            return this;
        }

        public Builder tenantUnitRepository(TenantGeoUnitRepository repository) {
            this.tenantUnitRepository = repository;
            return this;
        }

        public Builder ledgerRepository(SyncLedgerRepository repository) {
            this.ledgerRepository = repository;
            return this;
        }

        public Builder conflictCaseRepository(ConflictCaseRepository repository) {
            this.conflictCaseRepository = repository;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        /**
         * Uses a custom sibling cache. Takes precedence over {@link #cacheConfig}.
         */
        public Builder cache(SiblingCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Caches sibling scopes in Caffeine when the config is enabled.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder normalizationEngine(NormalizationEngine engine) {
            this.normalizationEngine = engine;
            return this;
        }

        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        /**
         * Executor for {@link GeographySync#ingestAsync}. Not shut down by {@link GeographySync#close()}.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public GeographySync build() {
            if (options == null) {
                throw new IllegalStateException("SyncOptions are required");
            }
            return new GeographySync(this);
        }
    }
}
