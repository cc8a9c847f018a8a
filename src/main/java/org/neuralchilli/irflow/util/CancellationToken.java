package org.neuralchilli.irflow.util;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation flag checked between compilation steps and between optimization passes.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken();

    private volatile boolean cancelled = false;
    private volatile String reason;

    /**
     * A token that is never cancelled. Calling {@link #cancel(String)} on it is rejected.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    public void cancel(String reason) {
        if (this == NONE) {
            throw new UnsupportedOperationException("The shared no-op token cannot be cancelled");
        }
        this.reason = reason;
        this.cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException(reason != null ? reason : "Operation cancelled");
        }
    }
}
