package com.roster.dedup.plan;

/**
 * Per-pass entry of a plan summary.
 *
 * @param count number of actions the pass proposed
 * @param type  {@code delete}, {@code merge} or {@code mixed}
 * @param label human-readable pass name
 */
public record PassSummary(int count, String type, String label) {
}
