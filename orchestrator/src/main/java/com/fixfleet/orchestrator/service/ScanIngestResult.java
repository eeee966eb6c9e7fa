package com.fixfleet.orchestrator.service;

import java.util.List;
import java.util.UUID;

public record ScanIngestResult(
        UUID scanId,
        String repoUrl,
        int issueCount,
        int duplicatesDropped,
        int rejected,
        List<String> warnings
) {}
