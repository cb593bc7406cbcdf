package com.roster.dedup.metrics;

import java.time.Duration;

/**
 * Interface for recording deduplication metrics.
 * The default {@link NoOpMetricsService} does nothing, so the engine runs without a registry.
 */
public interface MetricsService {

    void recordPassDuration(int pass, Duration duration);

    /**
     * @param type {@code delete} or {@code merge}
     */
    void incrementActionProposed(int pass, String type);

    void incrementPersonsMerged(int count);

    void incrementPersonsDeleted(int count);

    /**
     * Records the outcome of one execute-plan action.
     *
     * @param status {@code executed}, {@code skipped} or {@code failed}
     */
    void incrementPlanAction(String status);

    void incrementFailure(String operation);
}
