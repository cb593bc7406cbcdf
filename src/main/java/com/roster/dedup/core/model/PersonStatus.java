package com.roster.dedup.core.model;

import java.util.Locale;

/**
 * Status of a person as classified by upstream analysis.
 * Deduplication never changes it; the canonical keeps its own status on merge.
 */
public enum PersonStatus {
    NAMED,
    VICTIM,
    CONVICTED,
    WITNESS,
    CHARGED;

    /**
     * Lower-case value used by the store.
     */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored status, falling back to {@link #NAMED} for unknown or missing values.
     */
    public static PersonStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NAMED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NAMED;
        }
    }
}
