package com.roster.dedup.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a plan action.
 *
 * <p>Only {@link PlanExecutor} moves an action out of {@link #PENDING}, and only into
 * {@link #EXECUTED} or {@link #SKIPPED}. {@link #REJECTED} is set by a human reviewer
 * editing the plan file; the engine never sets or clears it.</p>
 */
public enum ActionStatus {
    PENDING,
    REJECTED,
    EXECUTED,
    SKIPPED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionStatus fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
