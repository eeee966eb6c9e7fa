package com.fixfleet.orchestrator.fingerprint;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Computes the stable identity of a finding across scans.
 *
 * Tier order, first applicable wins:
 *   1. CONTENT_HASH  rule_id | analyzer partial fingerprint
 *   2. MESSAGE       rule_id | file | message
 *   3. SNIPPET       rule_id | file | whitespace-normalized source line
 *   4. POSITION      rule_id | file | start_line
 *
 * The result is the first 20 hex chars (80 bits) of SHA-256 over the joined
 * parts. Pure and deterministic: same input, same output, no exceptions.
 */
@Component
public class FingerprintEngine {

    static final int HEX_LENGTH = 20;

    // Preferred partial fingerprint keys, most stable first.
    private static final List<String> PREFERRED_PARTIAL_KEYS = List.of(
            "primaryLocationLineHash",
            "primaryLocationStartColumnFingerprint"
    );

    public Fingerprint fingerprint(RawFinding raw) {
        return fingerprint(raw, raw.snippet());
    }

    /**
     * @param sourceSnippet source line at the finding location, overrides
     *                      raw.snippet() when non-blank
     */
    public Fingerprint fingerprint(RawFinding raw, String sourceSnippet) {
        String ruleId = nullToEmpty(raw.ruleId());
        String file   = nullToEmpty(raw.file());

        String partial = partialFingerprint(raw.partialFingerprints());
        if (partial != null) {
            return new Fingerprint(hash(ruleId, partial), FingerprintTier.CONTENT_HASH);
        }

        String message = raw.message();
        if (message != null && !message.isBlank()) {
            return new Fingerprint(hash(ruleId, file, message), FingerprintTier.MESSAGE);
        }

        String snippet = sourceSnippet != null && !sourceSnippet.isBlank() ? sourceSnippet : raw.snippet();
        String normalized = normalizeSnippet(snippet);
        if (!normalized.isEmpty()) {
            return new Fingerprint(hash(ruleId, file, normalized), FingerprintTier.SNIPPET);
        }

        String line = raw.startLine() == null ? "0" : String.valueOf(raw.startLine());
        return new Fingerprint(hash(ruleId, file, line), FingerprintTier.POSITION);
    }

    /** Collapse internal whitespace runs to one space and trim both ends. */
    static String normalizeSnippet(String snippet) {
        if (snippet == null) return "";
        return snippet.strip().replaceAll("\\s+", " ");
    }

    private static String partialFingerprint(Map<String, String> partials) {
        if (partials == null || partials.isEmpty()) return null;
        for (String key : PREFERRED_PARTIAL_KEYS) {
            String value = partials.get(key);
            if (value != null && !value.isBlank()) return value;
        }
        // Unknown analyzer key: take the lexically first non-blank one so the
        // choice does not depend on map iteration order.
        return partials.entrySet().stream()
                .filter(e -> e.getValue() != null && !e.getValue().isBlank())
                .sorted(Map.Entry.comparingByKey())
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private static String hash(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes).substring(0, HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256.
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
