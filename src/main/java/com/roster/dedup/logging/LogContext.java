package com.roster.dedup.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRun(runId, "dry-run")) {
 *     log.info("dedup.run.started personCount={}", count);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole deduplication run.
     */
    public static LogContext forRun(String runId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("mode", mode);
        return ctx;
    }

    /**
     * Creates a log context for one pass of the pipeline.
     */
    public static LogContext forPass(int pass) {
        LogContext ctx = new LogContext();
        ctx.put("pass", String.valueOf(pass));
        return ctx;
    }

    /**
     * Creates a log context for one plan action during execute-plan.
     */
    public static LogContext forAction(int actionId, String type) {
        LogContext ctx = new LogContext();
        ctx.put("actionId", String.valueOf(actionId));
        ctx.put("actionType", type);
        return ctx;
    }

    /**
     * Creates a log context for one merge into a canonical person.
     */
    public static LogContext forMerge(long canonicalId) {
        LogContext ctx = new LogContext();
        ctx.put("canonicalId", String.valueOf(canonicalId));
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
