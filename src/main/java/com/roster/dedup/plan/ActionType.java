package com.roster.dedup.plan;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of change a plan action proposes.
 */
public enum ActionType {
    DELETE,
    MERGE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ActionType fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Action type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
