package com.roster.dedup.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Auditable batch of proposed actions produced by a dry-run and consumed by execute-plan.
 * The action list is fixed; only action statuses change after creation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"createdAt", "personCountBefore", "summary", "actions"})
public final class DeduplicationPlan {

    private final String createdAt;
    private final long personCountBefore;
    private final PlanSummary summary;
    private final List<DeduplicationAction> actions;

    @JsonCreator
    public DeduplicationPlan(@JsonProperty("createdAt") String createdAt,
                             @JsonProperty("personCountBefore") long personCountBefore,
                             @JsonProperty("summary") PlanSummary summary,
                             @JsonProperty("actions") List<DeduplicationAction> actions) {
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt is required");
        this.personCountBefore = personCountBefore;
        this.actions = actions != null ? List.copyOf(actions) : List.of();
        this.summary = summary != null ? summary : PlanSummary.of(this.actions);
    }

    /**
     * Creates a plan stamped with the current time and a summary computed from the actions.
     */
    public static DeduplicationPlan create(long personCountBefore, List<DeduplicationAction> actions) {
        return new DeduplicationPlan(Instant.now().toString(), personCountBefore, PlanSummary.of(actions), actions);
    }

    public String getCreatedAt() {
        return createdAt;
    }

    public long getPersonCountBefore() {
        return personCountBefore;
    }

    public PlanSummary getSummary() {
        return summary;
    }

    public List<DeduplicationAction> getActions() {
        return actions;
    }

    /**
     * Pending actions in plan order.
     */
    @JsonIgnore
    public List<DeduplicationAction> getPendingActions() {
        return actions.stream()
                .filter(a -> a.getStatus() == ActionStatus.PENDING)
                .toList();
    }

    public long countByStatus(ActionStatus status) {
        return actions.stream().filter(a -> a.getStatus() == status).count();
    }
}
