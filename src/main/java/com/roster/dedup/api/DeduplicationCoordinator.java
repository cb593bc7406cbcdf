package com.roster.dedup.api;

import com.roster.dedup.evidence.EvidenceIndex;
import com.roster.dedup.evidence.EvidenceScorer;
import com.roster.dedup.graph.FalkorDBConnection;
import com.roster.dedup.graph.GraphConnection;
import com.roster.dedup.graph.GraphPersonStore;
import com.roster.dedup.logging.LogContext;
import com.roster.dedup.merge.CascadeDeleter;
import com.roster.dedup.merge.ConnectionDeduplicator;
import com.roster.dedup.merge.CountRecalculator;
import com.roster.dedup.merge.MergeExecutor;
import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.metrics.NoOpMetricsService;
import com.roster.dedup.pass.DeduplicationPass;
import com.roster.dedup.pass.ExactNormalizedPass;
import com.roster.dedup.pass.JunkRemovalPass;
import com.roster.dedup.pass.KeyFigurePass;
import com.roster.dedup.pass.MiddleInitialPass;
import com.roster.dedup.pass.OcrNicknamePass;
import com.roster.dedup.pass.PassContext;
import com.roster.dedup.pass.PassResult;
import com.roster.dedup.pass.SingleWordCleanupPass;
import com.roster.dedup.pass.SingleWordEvidencePass;
import com.roster.dedup.plan.CancellationToken;
import com.roster.dedup.plan.DeduplicationPlan;
import com.roster.dedup.plan.ExecutionResult;
import com.roster.dedup.plan.JsonPlanStore;
import com.roster.dedup.plan.PlanExecutor;
import com.roster.dedup.plan.PlanStore;
import com.roster.dedup.rules.ProtectedNameLoader;
import com.roster.dedup.rules.ProtectedNames;
import com.roster.dedup.rules.VariantRuleLoader;
import com.roster.dedup.rules.VariantRuleSet;
import com.roster.dedup.store.PersonStore;
import com.roster.dedup.store.StoreSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Main entry point of the deduplication engine.
 *
 * <p>Usage:</p>
 * <pre>
 * try (DeduplicationCoordinator coordinator = DeduplicationCoordinator.builder()
 *         .falkorDB("localhost", 6379, "roster")
 *         .options(DeduplicationOptions.builder().protectedNamesPath(Path.of("data/persons-raw.json")).build())
 *         .build()) {
 *     DeduplicationReport report = coordinator.dryRun();
 *     ExecutionResult result = coordinator.executePlan(new CancellationToken());
 * }
 * </pre>
 *
 * <p>Runs are single-threaded and strictly sequential. Each dry-run or apply run loads the
 * protected names and a fresh store snapshot, then runs passes 0 to 6 in order.</p>
 */
public class DeduplicationCoordinator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationCoordinator.class);

    private final PersonStore store;
    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final DeduplicationOptions options;
    private final MetricsService metricsService;
    private final ProtectedNames fixedProtectedNames;
    private final VariantRuleSet keyFigures;
    private final VariantRuleSet ocrNicknames;
    private final PlanStore planStore;
    private final MergeExecutor mergeExecutor;
    private final CascadeDeleter cascadeDeleter;
    private final ConnectionDeduplicator connectionDeduplicator;

    private DeduplicationCoordinator(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        this.store = builder.store != null ? builder.store : new GraphPersonStore(connection);
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.fixedProtectedNames = builder.protectedNames;

        VariantRuleLoader ruleLoader = new VariantRuleLoader();
        if (builder.keyFigures != null) {
            this.keyFigures = builder.keyFigures;
        } else if (options.getKeyFiguresPath() != null) {
            this.keyFigures = ruleLoader.load(options.getKeyFiguresPath());
        } else {
            this.keyFigures = ruleLoader.loadKeyFigures();
        }
        if (builder.ocrNicknames != null) {
            this.ocrNicknames = builder.ocrNicknames;
        } else if (options.getOcrNicknamesPath() != null) {
            this.ocrNicknames = ruleLoader.load(options.getOcrNicknamesPath());
        } else {
            this.ocrNicknames = ruleLoader.loadOcrNicknames();
        }

        this.planStore = builder.planStore != null ? builder.planStore : new JsonPlanStore(options.getPlanPath());
        this.mergeExecutor = new MergeExecutor(store, options.getAliasCap(), metricsService);
        this.cascadeDeleter = new CascadeDeleter(store, options.getDeleteChunkSize(), metricsService);
        this.connectionDeduplicator = new ConnectionDeduplicator(store);

        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }
    }

    // ========== Modes ==========

    /**
     * Runs every pass without mutating the store and persists the proposed actions as a
     * pending plan.
     */
    public DeduplicationReport dryRun() {
        return run(DeduplicationMode.DRY_RUN);
    }

    /**
     * Runs every pass, mutating the store directly, then sweeps self-loop connections.
     */
    public DeduplicationReport apply() {
        return run(DeduplicationMode.APPLY);
    }

    /**
     * Executes the pending actions of the configured plan with the configured batch size.
     */
    public ExecutionResult executePlan(CancellationToken cancellation) {
        return executePlan(planStore, options.getBatchSize(), cancellation);
    }

    /**
     * Executes the pending actions of a plan.
     *
     * @param batchSize pause after every {@code batchSize} actions; 0 disables batching
     */
    public ExecutionResult executePlan(PlanStore plan, int batchSize, CancellationToken cancellation) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId, DeduplicationMode.EXECUTE_PLAN.command())) {
            PlanExecutor executor = new PlanExecutor(store, mergeExecutor, cascadeDeleter,
                    connectionDeduplicator, metricsService, options.getBatchPause(),
                    options.getDriftWarningThreshold());
            return executor.execute(plan, batchSize, cancellation);
        }
    }

    // ========== Maintenance ==========

    /**
     * Keeps one connection per unordered person pair and removes self-loops.
     *
     * @return number of connections removed
     */
    public int dedupConnections() {
        return connectionDeduplicator.dedupConnections();
    }

    /**
     * Recomputes every person's document and connection counts.
     *
     * @return number of persons updated
     */
    public int recount() {
        return new CountRecalculator(store).recount();
    }

    // ========== Pipeline ==========

    private DeduplicationReport run(DeduplicationMode mode) {
        String runId = LogContext.generateRunId();
        try (LogContext ctx = LogContext.forRun(runId, mode.command())) {
            boolean dryRun = mode == DeduplicationMode.DRY_RUN;
            ProtectedNames protectedNames = fixedProtectedNames != null
                    ? fixedProtectedNames
                    : new ProtectedNameLoader().load(options.getProtectedNamesPath());

            StoreSnapshot snapshot = StoreSnapshot.load(store);
            long personCountBefore = snapshot.personCount();
            log.info("dedup.run.started mode={} personCount={} protectedNames={}",
                    mode.command(), personCountBefore, protectedNames.size());

            PassContext context = PassContext.builder()
                    .snapshot(snapshot)
                    .evidence(EvidenceIndex.build(snapshot))
                    .protectedNames(protectedNames)
                    .mergeExecutor(mergeExecutor)
                    .cascadeDeleter(cascadeDeleter)
                    .metrics(metricsService)
                    .dryRun(dryRun)
                    .build();

            List<PassResult> results = new ArrayList<>();
            for (DeduplicationPass pass : passes()) {
                results.add(runPass(pass, context));
            }

            Optional<DeduplicationPlan> plan = Optional.empty();
            int selfLoops = 0;
            long personCountAfter;
            if (dryRun) {
                DeduplicationPlan created = DeduplicationPlan.create(personCountBefore, context.getActions());
                planStore.save(created);
                plan = Optional.of(created);
                personCountAfter = personCountBefore;
                log.info("dedup.plan.written location={} actions={}",
                        planStore.location(), created.getActions().size());
            } else {
                selfLoops = connectionDeduplicator.sweepSelfLoops();
                personCountAfter = store.countPersons();
            }

            DeduplicationReport report = new DeduplicationReport(runId, mode, personCountBefore, personCountAfter,
                    results, selfLoops, plan);
            for (PassResult result : results) {
                log.info("dedup.summary pass={} name='{}' changes={} persons={} ambiguous={} failures={}",
                        result.pass(), result.name(), result.changes(), result.persons(),
                        result.ambiguous(), result.failures());
            }
            log.info("dedup.run.completed mode={} personCount={}->{}",
                    mode.command(), personCountBefore, personCountAfter);
            return report;
        }
    }

    private PassResult runPass(DeduplicationPass pass, PassContext context) {
        try (LogContext ctx = LogContext.forPass(pass.number())) {
            long start = System.nanoTime();
            PassResult result = pass.run(context);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metricsService.recordPassDuration(pass.number(), elapsed);
            return result.withDuration(elapsed);
        }
    }

    /**
     * Passes in execution order.
     */
    List<DeduplicationPass> passes() {
        EvidenceScorer scorer = new EvidenceScorer(options.getDocumentWeight(), options.getConnectionWeight(),
                options.getClearWinnerRatio());
        return List.of(
                new JunkRemovalPass(),
                new ExactNormalizedPass(),
                new SingleWordEvidencePass(scorer),
                new SingleWordCleanupPass(),
                new KeyFigurePass(keyFigures),
                new MiddleInitialPass(),
                new OcrNicknamePass(ocrNicknames));
    }

    public PersonStore getStore() {
        return store;
    }

    public DeduplicationOptions getOptions() {
        return options;
    }

    public PlanStore getPlanStore() {
        return planStore;
    }

    @Override
    public void close() {
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (Exception e) {
                log.warn("Error closing connection", e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PersonStore store;
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private DeduplicationOptions options = DeduplicationOptions.defaults();
        private MetricsService metricsService;
        private ProtectedNames protectedNames;
        private VariantRuleSet keyFigures;
        private VariantRuleSet ocrNicknames;
        private PlanStore planStore;

        /**
         * Uses the given store directly, bypassing the graph connection.
         */
        public Builder store(PersonStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the graph connection to use.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Creates a FalkorDB connection with the given parameters. The coordinator closes it.
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

        public Builder options(DeduplicationOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Fixed protected roster; when unset the roster is loaded from
         * {@link DeduplicationOptions#getProtectedNamesPath()} at the start of each run.
         */
        public Builder protectedNames(ProtectedNames protectedNames) {
            this.protectedNames = protectedNames;
            return this;
        }

        public Builder keyFigures(VariantRuleSet keyFigures) {
            this.keyFigures = keyFigures;
            return this;
        }

        public Builder ocrNicknames(VariantRuleSet ocrNicknames) {
            this.ocrNicknames = ocrNicknames;
            return this;
        }

        public Builder planStore(PlanStore planStore) {
            this.planStore = planStore;
            return this;
        }

        public DeduplicationCoordinator build() {
            if (store == null && connection == null) {
                throw new IllegalStateException("A PersonStore or GraphConnection is required");
            }
            if (options == null) {
                throw new IllegalStateException("DeduplicationOptions are required");
            }
            return new DeduplicationCoordinator(this);
        }
    }
}
