package com.roster.dedup.plan;

import com.roster.dedup.core.model.Person;
import com.roster.dedup.core.model.PersonRef;
import com.roster.dedup.logging.LogContext;
import com.roster.dedup.merge.CascadeDeleter;
import com.roster.dedup.merge.ConnectionDeduplicator;
import com.roster.dedup.merge.MergeExecutor;
import com.roster.dedup.metrics.MetricsService;
import com.roster.dedup.store.PersonStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Applies the pending actions of a persisted plan, re-validating each one against the
 * current store.
 *
 * <p>Each attempted action ends as {@code executed} or {@code skipped}. An action that throws is
 * logged, counted as failed and marked {@code skipped}, so a rerun does not attempt it again.
 * Statuses are saved after every batch and once more when the run ends.</p>
 */
public class PlanExecutor {
    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    private final PersonStore store;
    private final MergeExecutor mergeExecutor;
    private final CascadeDeleter cascadeDeleter;
    private final ConnectionDeduplicator connectionDeduplicator;
    private final MetricsService metrics;
    private final Duration batchPause;
    private final long driftWarningThreshold;

    public PlanExecutor(PersonStore store,
                        MergeExecutor mergeExecutor,
                        CascadeDeleter cascadeDeleter,
                        ConnectionDeduplicator connectionDeduplicator,
                        MetricsService metrics,
                        Duration batchPause,
                        long driftWarningThreshold) {
        this.store = store;
        this.mergeExecutor = mergeExecutor;
        this.cascadeDeleter = cascadeDeleter;
        this.connectionDeduplicator = connectionDeduplicator;
        this.metrics = metrics;
        this.batchPause = batchPause;
        this.driftWarningThreshold = driftWarningThreshold;
    }

    /**
     * Executes the plan held by {@code planStore}.
     *
     * @param batchSize pause after every {@code batchSize} actions; 0 disables batching
     * @throws PlanStoreException if the plan cannot be loaded; nothing is mutated in that case
     */
    public ExecutionResult execute(PlanStore planStore, int batchSize, CancellationToken cancellation) {
        DeduplicationPlan plan = planStore.load();
        List<DeduplicationAction> pending = plan.getPendingActions();
        int alreadyDone = (int) (plan.countByStatus(ActionStatus.EXECUTED) + plan.countByStatus(ActionStatus.SKIPPED));

        if (pending.isEmpty()) {
            log.info("plan.nothingPending alreadyDone={}", alreadyDone);
            return ExecutionResult.nothingPending(alreadyDone, store.countPersons());
        }

        long currentCount = store.countPersons();
        long drift = Math.abs(currentCount - plan.getPersonCountBefore());
        if (drift > driftWarningThreshold) {
            log.warn("plan.drift expected={} actual={} diff={} - continuing, existence checks skip stale actions",
                    plan.getPersonCountBefore(), currentCount, drift);
        }
        log.info("plan.execution.starting pending={} alreadyDone={} batchSize={}",
                pending.size(), alreadyDone, batchSize);

        int executed = 0;
        int skipped = 0;
        int failed = 0;
        int attempted = 0;
        boolean cancelled = false;

        try {
            for (int i = 0; i < pending.size(); i++) {
                if (cancellation.isCancellationRequested()) {
                    cancelled = true;
                    log.info("plan.execution.cancelled attempted={} remaining={}", attempted, pending.size() - i);
                    break;
                }

                DeduplicationAction action = pending.get(i);
                attempted++;
                try (LogContext ctx = LogContext.forAction(action.getId(), action.getType().value())) {
                    ActionStatus outcome = apply(action);
                    if (outcome == ActionStatus.EXECUTED) {
                        action.markExecuted();
                        executed++;
                    } else {
                        action.markSkipped();
                        skipped++;
                    }
                    metrics.incrementPlanAction(outcome.value());
                } catch (RuntimeException e) {
                    if (action.getStatus() == ActionStatus.PENDING) {
                        action.markSkipped();
                    }
                    failed++;
                    metrics.incrementPlanAction("failed");
                    metrics.incrementFailure("plan-action");
                    log.warn("plan.action.failed actionId={} type={} error={}",
                            action.getId(), action.getType().value(), e.getMessage(), e);
                }

                if (batchSize > 0 && (i + 1) % batchSize == 0 && i + 1 < pending.size()) {
                    planStore.save(plan);
                    log.info("plan.batch.completed batch={} executed={} skipped={} failed={} remaining={}",
                            (i + 1) / batchSize, executed, skipped, failed, pending.size() - i - 1);
                    if (!pause()) {
                        cancelled = true;
                        break;
                    }
                }
            }
        } finally {
            planStore.save(plan);
            log.info("plan.saved location={}", planStore.location());
        }

        if (!cancelled) {
            connectionDeduplicator.sweepSelfLoops();
        }

        int remaining = cancelled ? pending.size() - attempted : 0;
        ExecutionResult result = new ExecutionResult(executed, skipped, failed, remaining, alreadyDone,
                cancelled, store.countPersons());
        log.info("plan.execution.completed executed={} skipped={} failed={} remaining={} personCount={}",
                result.executed(), result.skipped(), result.failed(), result.remaining(), result.personCountAfter());
        return result;
    }

    private ActionStatus apply(DeduplicationAction action) {
        return switch (action.getType()) {
            case DELETE -> applyDelete(action);
            case MERGE -> applyMerge(action);
        };
    }

    private ActionStatus applyDelete(DeduplicationAction action) {
        List<PersonRef> targets = action.getTargets() != null ? action.getTargets() : List.of();
        Set<Long> existing = targets.isEmpty() ? Set.of() : store.findExistingIds(ids(targets));
        if (existing.isEmpty()) {
            log.info("plan.action.skipped actionId={} reason=targets-gone", action.getId());
            return ActionStatus.SKIPPED;
        }
        List<Long> existingIds = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (PersonRef target : targets) {
            if (existing.contains(target.id())) {
                existingIds.add(target.id());
                names.add(target.name());
            }
        }
        cascadeDeleter.deletePersonsCascade(existingIds);
        log.info("plan.action.deleted actionId={} count={} names={}", action.getId(), existingIds.size(), names);
        return ActionStatus.EXECUTED;
    }

    private ActionStatus applyMerge(DeduplicationAction action) {
        PersonRef canonicalRef = action.getCanonical();
        if (canonicalRef == null) {
            log.info("plan.action.skipped actionId={} reason=no-canonical", action.getId());
            return ActionStatus.SKIPPED;
        }
        Optional<Person> canonical = store.findPersonById(canonicalRef.id());
        if (canonical.isEmpty()) {
            log.info("plan.action.skipped actionId={} reason=canonical-gone canonical='{}' canonicalId={}",
                    action.getId(), canonicalRef.name(), canonicalRef.id());
            return ActionStatus.SKIPPED;
        }

        List<PersonRef> duplicates = action.getDuplicates() != null ? action.getDuplicates() : List.of();
        Set<Long> existing = duplicates.isEmpty() ? Set.of() : store.findExistingIds(ids(duplicates));
        List<Long> existingIds = new ArrayList<>();
        List<String> names = new ArrayList<>();
        names.add(canonical.get().getName());
        for (PersonRef duplicate : duplicates) {
            if (existing.contains(duplicate.id()) && duplicate.id() != canonicalRef.id()) {
                existingIds.add(duplicate.id());
                names.add(duplicate.name());
            }
        }
        if (existingIds.isEmpty()) {
            log.info("plan.action.skipped actionId={} reason=duplicates-gone", action.getId());
            return ActionStatus.SKIPPED;
        }

        mergeExecutor.mergePersonGroup(canonicalRef.id(), existingIds, names);
        log.info("plan.action.merged actionId={} duplicates={} canonical='{}'",
                action.getId(), names.subList(1, names.size()), canonical.get().getName());
        return ActionStatus.EXECUTED;
    }

    /**
     * @return false if the thread was interrupted while pausing
     */
    private boolean pause() {
        if (batchPause.isZero() || batchPause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(batchPause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("plan.execution.interrupted");
            return false;
        }
    }

    private static List<Long> ids(List<PersonRef> refs) {
        return refs.stream().map(PersonRef::id).toList();
    }
}
