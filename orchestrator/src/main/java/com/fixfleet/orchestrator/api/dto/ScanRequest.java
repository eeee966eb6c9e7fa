package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.service.ScanSubmission;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request body for POST /scans.
 *
 * Required: repoUrl
 * Optional: scannedAt (defaults to now), fingerprinted (defaults to true),
 *   issueCount (legacy scans only), findings.
 */
public record ScanRequest(
        String              repoUrl,
        String              runLabel,
        Instant             scannedAt,
        Boolean             fingerprinted,
        Integer             issueCount,
        List<FindingRequest> findings
) {
    public ScanSubmission toSubmission() {
        return new ScanSubmission(
                repoUrl,
                runLabel,
                scannedAt,
                fingerprinted == null || fingerprinted,
                issueCount,
                findings == null ? List.of() : findings.stream().map(FindingRequest::toFinding).toList()
        );
    }

    public record FindingRequest(
            String              ruleId,
            String              severityTier,
            Double              cvssScore,
            String              level,
            List<String>        cweTags,
            String              cweFamily,
            String              file,
            Integer             startLine,
            String              message,
            Map<String, String> partialFingerprints,
            String              snippet
    ) {
        ScanSubmission.Finding toFinding() {
            return new ScanSubmission.Finding(ruleId, severityTier, cvssScore, level, cweTags, cweFamily,
                    file, startLine, message, partialFingerprints, snippet);
        }
    }
}
