package com.fixfleet.orchestrator.dispatch;

import java.util.List;

/**
 * Output of planning: every considered issue in dispatch order, the waves to
 * execute (critical first, empty tiers omitted) and the batches held back by
 * the rate limiter or a repo's session cap.
 */
public record DispatchPlan(
        List<PlanEntry> entries,
        List<Wave> waves,
        List<Batch> deferred
) {
    public DispatchPlan {
        entries  = List.copyOf(entries);
        waves    = List.copyOf(waves);
        deferred = List.copyOf(deferred);
    }

    /** Issues that failed the skip predicate. */
    public long skippedCount() {
        return entries.stream().filter(e -> !e.eligible()).count();
    }

    public int batchCount() {
        return waves.stream().mapToInt(w -> w.batches().size()).sum();
    }
}
