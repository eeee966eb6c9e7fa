package com.fixfleet.orchestrator.service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One analyzer run to ingest.
 *
 * fingerprinted = false records a legacy summary: only issueCount is kept and
 * findings are ignored.
 */
public record ScanSubmission(
        String repoUrl,
        String runLabel,
        Instant scannedAt,
        boolean fingerprinted,
        Integer issueCount,
        List<Finding> findings
) {
    public ScanSubmission {
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    /**
     * One raw finding. Severity comes from severityTier, else cvssScore, else
     * the analyzer level ("error" → high, "warning" → medium). The CWE family
     * comes from cweFamily, else from the CWE tags.
     */
    public record Finding(
            String ruleId,
            String severityTier,
            Double cvssScore,
            String level,
            List<String> cweTags,
            String cweFamily,
            String file,
            Integer startLine,
            String message,
            Map<String, String> partialFingerprints,
            String snippet
    ) {}
}
