package com.roster.dedup.api;

import com.roster.dedup.evidence.EvidenceScorer;
import com.roster.dedup.merge.CascadeDeleter;
import com.roster.dedup.merge.MergeExecutor;
import com.roster.dedup.plan.JsonPlanStore;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Options for deduplication runs.
 * The evidence weights and clear-winner ratio are tuned heuristics; changing them changes
 * which persons get merged.
 */
public class DeduplicationOptions {

    private static final Duration DEFAULT_BATCH_PAUSE = Duration.ofSeconds(2);
    private static final long DEFAULT_DRIFT_WARNING_THRESHOLD = 50;

    private final Path planPath;
    private final Path protectedNamesPath;
    private final Path keyFiguresPath;
    private final Path ocrNicknamesPath;
    private final int batchSize;
    private final Duration batchPause;
    private final long driftWarningThreshold;
    private final int deleteChunkSize;
    private final int aliasCap;
    private final double clearWinnerRatio;
    private final int documentWeight;
    private final int connectionWeight;

    private DeduplicationOptions(Builder builder) {
        this.planPath = builder.planPath;
        this.protectedNamesPath = builder.protectedNamesPath;
        this.keyFiguresPath = builder.keyFiguresPath;
        this.ocrNicknamesPath = builder.ocrNicknamesPath;
        this.batchSize = builder.batchSize;
        this.batchPause = builder.batchPause;
        this.driftWarningThreshold = builder.driftWarningThreshold;
        this.deleteChunkSize = builder.deleteChunkSize;
        this.aliasCap = builder.aliasCap;
        this.clearWinnerRatio = builder.clearWinnerRatio;
        this.documentWeight = builder.documentWeight;
        this.connectionWeight = builder.connectionWeight;
    }

    public Path getPlanPath() {
        return planPath;
    }

    /**
     * Curated roster file; null means no protected names.
     */
    public Path getProtectedNamesPath() {
        return protectedNamesPath;
    }

    /**
     * Key-figure table file; null means the bundled table.
     */
    public Path getKeyFiguresPath() {
        return keyFiguresPath;
    }

    /**
     * OCR/nickname table file; null means the bundled table.
     */
    public Path getOcrNicknamesPath() {
        return ocrNicknamesPath;
    }

    /**
     * Actions per execute-plan batch; 0 disables batching.
     */
    public int getBatchSize() {
        return batchSize;
    }

    public Duration getBatchPause() {
        return batchPause;
    }

    public long getDriftWarningThreshold() {
        return driftWarningThreshold;
    }

    public int getDeleteChunkSize() {
        return deleteChunkSize;
    }

    public int getAliasCap() {
        return aliasCap;
    }

    public double getClearWinnerRatio() {
        return clearWinnerRatio;
    }

    public int getDocumentWeight() {
        return documentWeight;
    }

    public int getConnectionWeight() {
        return connectionWeight;
    }

    /**
     * Creates default options.
     */
    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Path planPath = JsonPlanStore.DEFAULT_PATH;
        private Path protectedNamesPath;
        private Path keyFiguresPath;
        private Path ocrNicknamesPath;
        private int batchSize = 0;
        private Duration batchPause = DEFAULT_BATCH_PAUSE;
        private long driftWarningThreshold = DEFAULT_DRIFT_WARNING_THRESHOLD;
        private int deleteChunkSize = CascadeDeleter.DEFAULT_CHUNK_SIZE;
        private int aliasCap = MergeExecutor.DEFAULT_ALIAS_CAP;
        private double clearWinnerRatio = EvidenceScorer.DEFAULT_CLEAR_WINNER_RATIO;
        private int documentWeight = EvidenceScorer.DEFAULT_DOCUMENT_WEIGHT;
        private int connectionWeight = EvidenceScorer.DEFAULT_CONNECTION_WEIGHT;

        public Builder planPath(Path planPath) {
            this.planPath = Objects.requireNonNull(planPath, "planPath is required");
            return this;
        }

        public Builder protectedNamesPath(Path protectedNamesPath) {
            this.protectedNamesPath = protectedNamesPath;
            return this;
        }

        public Builder keyFiguresPath(Path keyFiguresPath) {
            this.keyFiguresPath = keyFiguresPath;
            return this;
        }

        public Builder ocrNicknamesPath(Path ocrNicknamesPath) {
            this.ocrNicknamesPath = ocrNicknamesPath;
            return this;
        }

        public Builder batchSize(int batchSize) {
            if (batchSize < 0) {
                throw new IllegalArgumentException("batchSize must not be negative");
            }
            this.batchSize = batchSize;
            return this;
        }

        public Builder batchPause(Duration batchPause) {
            Objects.requireNonNull(batchPause, "batchPause is required");
            if (batchPause.isNegative()) {
                throw new IllegalArgumentException("batchPause must not be negative");
            }
            this.batchPause = batchPause;
            return this;
        }

        public Builder driftWarningThreshold(long driftWarningThreshold) {
            if (driftWarningThreshold < 0) {
                throw new IllegalArgumentException("driftWarningThreshold must not be negative");
            }
            this.driftWarningThreshold = driftWarningThreshold;
            return this;
        }

        public Builder deleteChunkSize(int deleteChunkSize) {
            if (deleteChunkSize <= 0) {
                throw new IllegalArgumentException("deleteChunkSize must be positive");
            }
            this.deleteChunkSize = deleteChunkSize;
            return this;
        }

        public Builder aliasCap(int aliasCap) {
            if (aliasCap < 0) {
                throw new IllegalArgumentException("aliasCap must not be negative");
            }
            this.aliasCap = aliasCap;
            return this;
        }

        public Builder clearWinnerRatio(double clearWinnerRatio) {
            if (clearWinnerRatio < 1.0) {
                throw new IllegalArgumentException("clearWinnerRatio must be at least 1.0");
            }
            this.clearWinnerRatio = clearWinnerRatio;
            return this;
        }

        public Builder documentWeight(int documentWeight) {
            if (documentWeight < 0) {
                throw new IllegalArgumentException("documentWeight must not be negative");
            }
            this.documentWeight = documentWeight;
            return this;
        }

        public Builder connectionWeight(int connectionWeight) {
            if (connectionWeight < 0) {
                throw new IllegalArgumentException("connectionWeight must not be negative");
            }
            this.connectionWeight = connectionWeight;
            return this;
        }

        public DeduplicationOptions build() {
            if (documentWeight == 0 && connectionWeight == 0) {
                throw new IllegalArgumentException("At least one evidence weight must be positive");
            }
            return new DeduplicationOptions(this);
        }
    }
}
