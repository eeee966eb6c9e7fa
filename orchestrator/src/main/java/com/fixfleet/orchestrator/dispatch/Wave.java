package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.model.SeverityTier;

import java.util.List;

/** All batches of one severity tier, dispatched together. */
public record Wave(SeverityTier severity, List<Batch> batches) {

    public Wave {
        batches = List.copyOf(batches);
    }

    public boolean isEmpty() {
        return batches.isEmpty();
    }
}
