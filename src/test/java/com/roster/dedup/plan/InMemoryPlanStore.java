package com.roster.dedup.plan;

/**
 * Keeps the plan object in memory and counts checkpoints.
 */
final class InMemoryPlanStore implements PlanStore {

    private DeduplicationPlan plan;
    private int saves;

    InMemoryPlanStore(DeduplicationPlan plan) {
        this.plan = plan;
    }

    @Override
    public void save(DeduplicationPlan plan) {
        this.plan = plan;
        saves++;
    }

    @Override
    public DeduplicationPlan load() {
        if (plan == null) {
            throw new PlanStoreException("no plan");
        }
        return plan;
    }

    @Override
    public boolean exists() {
        return plan != null;
    }

    @Override
    public String location() {
        return "memory";
    }

    DeduplicationPlan plan() {
        return plan;
    }

    int saves() {
        return saves;
    }
}
