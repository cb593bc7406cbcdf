package com.roster.dedup.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPassDuration(int pass, Duration duration) {
    }

    @Override
    public void incrementActionProposed(int pass, String type) {
    }

    @Override
    public void incrementPersonsMerged(int count) {
    }

    @Override
    public void incrementPersonsDeleted(int count) {
    }

    @Override
    public void incrementPlanAction(String status) {
    }

    @Override
    public void incrementFailure(String operation) {
    }
}
