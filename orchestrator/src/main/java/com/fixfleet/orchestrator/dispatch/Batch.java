package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.model.SeverityTier;

import java.util.List;

/**
 * Findings of one repo and one CWE family sent to a single agent session.
 */
public record Batch(
        String batchId,
        String repoUrl,
        String cweFamily,
        SeverityTier severity,
        List<PlanEntry> entries
) {
    public Batch {
        entries = List.copyOf(entries);
    }

    public List<String> fingerprints() {
        return entries.stream().map(PlanEntry::fingerprint).toList();
    }
}
