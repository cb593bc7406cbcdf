package com.roster.dedup.api;

import com.roster.dedup.pass.PassResult;
import com.roster.dedup.plan.DeduplicationPlan;

import java.util.List;
import java.util.Optional;

/**
 * Per-pass counts of a dry-run or apply run.
 *
 * @param plan the persisted plan, present for a dry-run only
 */
public record DeduplicationReport(
        String runId,
        DeduplicationMode mode,
        long personCountBefore,
        long personCountAfter,
        List<PassResult> passes,
        int selfLoopsRemoved,
        Optional<DeduplicationPlan> plan
) {
    public DeduplicationReport {
        passes = List.copyOf(passes);
        plan = plan != null ? plan : Optional.empty();
    }

    public int totalChanges() {
        return passes.stream().mapToInt(PassResult::changes).sum();
    }

    public int totalFailures() {
        return passes.stream().mapToInt(PassResult::failures).sum();
    }

    public Optional<PassResult> pass(int number) {
        return passes.stream().filter(p -> p.pass() == number).findFirst();
    }
}
