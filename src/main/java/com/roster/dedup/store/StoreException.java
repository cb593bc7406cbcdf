package com.roster.dedup.store;

/**
 * Thrown when the person store cannot complete an operation: the backend is unreachable,
 * a query fails, or a constraint is violated.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
