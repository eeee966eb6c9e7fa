package com.fixfleet.orchestrator.fingerprint;

import java.util.Map;

/**
 * Analyzer output for one finding, before it gets an identity.
 *
 * Any field may be null. partialFingerprints holds the analyzer's content
 * hashes (SARIF partialFingerprints), snippet the source line at the
 * location when the analyzer reports one.
 */
public record RawFinding(
        String ruleId,
        String file,
        Integer startLine,
        String message,
        Map<String, String> partialFingerprints,
        String snippet
) {}
