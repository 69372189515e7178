package com.depgraph.engine.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation for a sync run. The builder checks it between files, never while a
 * file is being committed.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
