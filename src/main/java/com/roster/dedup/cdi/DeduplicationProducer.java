package com.roster.dedup.cdi;

import com.roster.dedup.api.DeduplicationCoordinator;
import com.roster.dedup.api.DeduplicationOptions;
import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.metrics.MicrometerMetricsService;
import com.roster.dedup.metrics.NoOpMetricsService;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the deduplication engine from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * entity-dedup:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: roster
 *   plan-path: data/dedup-plan.json
 *   protected-names-path: data/persons-raw.json
 *   execute:
 *     batch-size: 100
 *     batch-pause-millis: 2000
 * </pre>
 *
 * <p>If a {@link MeterRegistry} bean is available, metrics are recorded through Micrometer.</p>
 */
@ApplicationScoped
public class DeduplicationProducer {

    private static final Logger log = LoggerFactory.getLogger(DeduplicationProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-dedup.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "entity-dedup.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "entity-dedup.falkordb.graph-name", defaultValue = "roster")
    String falkordbGraphName;

    // ── Files ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-dedup.plan-path", defaultValue = "data/dedup-plan.json")
    String planPath;

    @Inject
    @ConfigProperty(name = "entity-dedup.protected-names-path")
    Optional<String> protectedNamesPath;

    @Inject
    @ConfigProperty(name = "entity-dedup.rules.key-figures-path")
    Optional<String> keyFiguresPath;

    @Inject
    @ConfigProperty(name = "entity-dedup.rules.ocr-nicknames-path")
    Optional<String> ocrNicknamesPath;

    // ── Execute-plan ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-dedup.execute.batch-size", defaultValue = "0")
    int batchSize;

    @Inject
    @ConfigProperty(name = "entity-dedup.execute.batch-pause-millis", defaultValue = "2000")
    long batchPauseMillis;

    @Inject
    @ConfigProperty(name = "entity-dedup.execute.drift-warning-threshold", defaultValue = "50")
    long driftWarningThreshold;

    // ── Merge and delete ──────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-dedup.delete.chunk-size", defaultValue = "500")
    int deleteChunkSize;

    @Inject
    @ConfigProperty(name = "entity-dedup.merge.alias-cap", defaultValue = "20")
    int aliasCap;

    // ── Evidence ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "entity-dedup.evidence.clear-winner-ratio", defaultValue = "2.0")
    double clearWinnerRatio;

    @Inject
    @ConfigProperty(name = "entity-dedup.evidence.document-weight", defaultValue = "2")
    int documentWeight;

    @Inject
    @ConfigProperty(name = "entity-dedup.evidence.connection-weight", defaultValue = "1")
    int connectionWeight;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public DeduplicationOptions deduplicationOptions() {
        DeduplicationOptions.Builder builder = DeduplicationOptions.builder()
                .planPath(Path.of(planPath))
                .batchSize(batchSize)
                .batchPause(Duration.ofMillis(batchPauseMillis))
                .driftWarningThreshold(driftWarningThreshold)
                .deleteChunkSize(deleteChunkSize)
                .aliasCap(aliasCap)
                .clearWinnerRatio(clearWinnerRatio)
                .documentWeight(documentWeight)
                .connectionWeight(connectionWeight);
        protectedNamesPath.map(Path::of).ifPresent(builder::protectedNamesPath);
        keyFiguresPath.map(Path::of).ifPresent(builder::keyFiguresPath);
        ocrNicknamesPath.map(Path::of).ifPresent(builder::ocrNicknamesPath);
        return builder.build();
    }

    @Produces
    @ApplicationScoped
    public DeduplicationCoordinator deduplicationCoordinator(DeduplicationOptions options) {
        log.info("Producing DeduplicationCoordinator: falkordb={}:{}/{} planPath={}",
                falkordbHost, falkordbPort, falkordbGraphName, options.getPlanPath());
        return DeduplicationCoordinator.builder()
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .options(options)
                .metricsService(metricsService())
                .build();
    }

    public void closeCoordinator(@Disposes DeduplicationCoordinator coordinator) {
        log.info("Closing DeduplicationCoordinator");
        coordinator.close();
    }

    MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Micrometer metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }
}
