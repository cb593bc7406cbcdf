package com.roster.dedup.plan;

/**
 * Persists deduplication plans between a dry-run and later execute-plan runs.
 */
public interface PlanStore {

    /**
     * @throws PlanStoreException if the plan cannot be written
     */
    void save(DeduplicationPlan plan);

    /**
     * @throws PlanStoreException if the plan is missing or malformed
     */
    DeduplicationPlan load();

    boolean exists();

    /**
     * Where the plan lives, for log messages.
     */
    String location();
}
