package com.fixfleet.orchestrator.dispatch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token for one cycle. The dispatcher checks it
 * between batches and while polling; work already handed to the agent
 * platform keeps running.
 */
public class CycleCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
