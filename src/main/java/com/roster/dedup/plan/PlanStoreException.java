package com.roster.dedup.plan;

/**
 * Thrown when a plan file cannot be read, parsed or written.
 */
public class PlanStoreException extends RuntimeException {

    public PlanStoreException(String message) {
        super(message);
    }

    public PlanStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
