package com.knowledge.importer.importer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a running import. Work already handed to a worker completes;
 * nothing new is scheduled once the flag is set.
 */
public class ImportCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
