package com.roster.dedup.rules;

/**
 * Thrown when a protected-name roster or a variant rule file exists but cannot be parsed.
 */
public class RuleLoadException extends RuntimeException {

    public RuleLoadException(String message) {
        super(message);
    }

    public RuleLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
