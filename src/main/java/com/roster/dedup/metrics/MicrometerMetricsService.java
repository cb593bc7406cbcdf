package com.roster.dedup.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dedup.pass.duration} - Timer (tag: pass)</li>
 *   <li>{@code dedup.actions.proposed} - Counter (tags: pass, type)</li>
 *   <li>{@code dedup.persons.merged} - Counter</li>
 *   <li>{@code dedup.persons.deleted} - Counter</li>
 *   <li>{@code dedup.plan.actions} - Counter (tag: status)</li>
 *   <li>{@code dedup.failures} - Counter (tag: operation)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter mergedCounter;
    private final Counter deletedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.mergedCounter = Counter.builder("dedup.persons.merged")
                .description("Number of persons absorbed into a canonical person")
                .register(registry);
        this.deletedCounter = Counter.builder("dedup.persons.deleted")
                .description("Number of persons removed by cascade delete")
                .register(registry);
    }

    @Override
    public void recordPassDuration(int pass, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(String.valueOf(pass), k ->
                Timer.builder("dedup.pass.duration")
                        .description("Duration of one deduplication pass")
                        .tag("pass", k)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementActionProposed(int pass, String type) {
        String key = "proposed:" + pass + ":" + type;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("dedup.actions.proposed")
                        .description("Number of actions proposed by the pass pipeline")
                        .tag("pass", String.valueOf(pass))
                        .tag("type", type)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementPersonsMerged(int count) {
        mergedCounter.increment(count);
    }

    @Override
    public void incrementPersonsDeleted(int count) {
        deletedCounter.increment(count);
    }

    @Override
    public void incrementPlanAction(String status) {
        String key = "plan:" + status;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("dedup.plan.actions")
                        .description("Outcomes of execute-plan actions")
                        .tag("status", status)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementFailure(String operation) {
        String key = "failure:" + operation;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("dedup.failures")
                        .description("Merges, deletes or actions that failed and were skipped")
                        .tag("operation", operation)
                        .register(registry));
        counter.increment();
    }
}
