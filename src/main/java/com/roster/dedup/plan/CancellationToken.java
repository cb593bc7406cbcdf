package com.roster.dedup.plan;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag polled between plan actions.
 * An action that has started always runs to completion.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * Requests cancellation. Safe to call from any thread, including a shutdown hook.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
