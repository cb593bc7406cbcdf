package com.roster.dedup.api;

import java.util.Arrays;

/**
 * Operating modes of the deduplication engine.
 */
public enum DeduplicationMode {
    /** Run every pass against a snapshot and persist the proposed actions as a plan. */
    DRY_RUN("dry-run"),
    /** Run every pass, mutating the store directly. */
    APPLY("apply"),
    /** Apply the pending actions of a persisted plan. */
    EXECUTE_PLAN("execute-plan");

    private final String command;

    DeduplicationMode(String command) {
        this.command = command;
    }

    public String command() {
        return command;
    }

    public static DeduplicationMode fromCommand(String command) {
        return Arrays.stream(values())
                .filter(m -> m.command.equals(command))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown mode: " + command));
    }
}
