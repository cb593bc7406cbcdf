package com.roster.dedup.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.roster.dedup.core.model.PersonRef;

import java.util.List;
import java.util.Objects;

/**
 * One proposed change in a deduplication plan.
 * A delete action carries {@code targets}; a merge action carries {@code canonical} and
 * {@code duplicates}. Everything except the status is fixed once the action is created.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"id", "pass", "type", "reason", "targets", "canonical", "duplicates", "evidence", "status"})
public final class DeduplicationAction {

    private final int id;
    private final int pass;
    private final ActionType type;
    private final String reason;
    private final List<PersonRef> targets;
    private final PersonRef canonical;
    private final List<PersonRef> duplicates;
    private final String evidence;
    private ActionStatus status;

    @JsonCreator
    public DeduplicationAction(@JsonProperty("id") int id,
                               @JsonProperty("pass") int pass,
                               @JsonProperty("type") ActionType type,
                               @JsonProperty("reason") String reason,
                               @JsonProperty("targets") List<PersonRef> targets,
                               @JsonProperty("canonical") PersonRef canonical,
                               @JsonProperty("duplicates") List<PersonRef> duplicates,
                               @JsonProperty("evidence") String evidence,
                               @JsonProperty("status") ActionStatus status) {
        this.id = id;
        this.pass = pass;
        this.type = Objects.requireNonNull(type, "type is required");
        this.reason = reason;
        this.targets = targets != null ? List.copyOf(targets) : null;
        this.canonical = canonical;
        this.duplicates = duplicates != null ? List.copyOf(duplicates) : null;
        this.evidence = evidence;
        this.status = status != null ? status : ActionStatus.PENDING;
    }

    public static DeduplicationAction delete(int id, int pass, String reason, List<PersonRef> targets) {
        return new DeduplicationAction(id, pass, ActionType.DELETE, reason, targets,
                null, null, null, ActionStatus.PENDING);
    }

    public static DeduplicationAction merge(int id, int pass, String reason, PersonRef canonical,
                                            List<PersonRef> duplicates, String evidence) {
        return new DeduplicationAction(id, pass, ActionType.MERGE, reason, null,
                canonical, duplicates, evidence, ActionStatus.PENDING);
    }

    public int getId() {
        return id;
    }

    public int getPass() {
        return pass;
    }

    public ActionType getType() {
        return type;
    }

    public String getReason() {
        return reason;
    }

    public List<PersonRef> getTargets() {
        return targets;
    }

    public PersonRef getCanonical() {
        return canonical;
    }

    public List<PersonRef> getDuplicates() {
        return duplicates;
    }

    public String getEvidence() {
        return evidence;
    }

    public ActionStatus getStatus() {
        return status;
    }

    void markExecuted() {
        transition(ActionStatus.EXECUTED);
    }

    void markSkipped() {
        transition(ActionStatus.SKIPPED);
    }

    private void transition(ActionStatus next) {
        if (status != ActionStatus.PENDING) {
            throw new IllegalStateException("Action " + id + " is " + status.value() + ", not pending");
        }
        this.status = next;
    }

    @Override
    public String toString() {
        return "DeduplicationAction{" +
                "id=" + id +
                ", pass=" + pass +
                ", type=" + type.value() +
                ", reason='" + reason + '\'' +
                ", status=" + status.value() +
                '}';
    }
}
