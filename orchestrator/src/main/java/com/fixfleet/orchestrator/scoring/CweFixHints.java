package com.fixfleet.orchestrator.scoring;

import java.util.Map;
import java.util.Optional;

/** Remediation pattern per CWE family, appended to session prompts. */
public final class CweFixHints {

    private static final Map<String, String> HINTS = Map.ofEntries(
            Map.entry("injection",
                    "Replace string-built queries and commands with parameterized queries, prepared "
                    + "statements or argument-list process APIs."),
            Map.entry("xss",
                    "Encode user-controlled output for its context (HTML body, attribute, script, URL) "
                    + "and prefer the framework's auto-escaping."),
            Map.entry("path-traversal",
                    "Canonicalize paths and check the result stays under the intended base directory; "
                    + "reject '..' segments and absolute paths from input."),
            Map.entry("ssrf",
                    "Allowlist outbound hosts and block private, loopback and link-local address ranges."),
            Map.entry("deserialization",
                    "Do not deserialize untrusted data with native object serializers; use a data-only "
                    + "format with an explicit type allowlist."),
            Map.entry("auth",
                    "Enforce authentication and then authorization on every protected entry point using "
                    + "the framework's middleware rather than ad-hoc checks."),
            Map.entry("crypto",
                    "Replace weak primitives (MD5, SHA-1, DES, RC4) with vetted modern ones and use a "
                    + "cryptographically secure random source."),
            Map.entry("info-disclosure",
                    "Keep secrets, stack traces and internal details out of responses and logs."),
            Map.entry("redirect",
                    "Only redirect to relative paths or to an allowlist of known destinations."),
            Map.entry("xxe",
                    "Disable DTD processing and external entity resolution in every XML parser."),
            Map.entry("csrf",
                    "Require an anti-CSRF token or SameSite cookies for state-changing requests."),
            Map.entry("hardcoded-credentials",
                    "Move credentials to configuration or a secret store and read them at runtime."),
            Map.entry("regex-dos",
                    "Rewrite ambiguous regular expressions and bound the length of matched input."),
            Map.entry("logging",
                    "Neutralize CR/LF and other control characters in user data before logging it.")
    );

    private CweFixHints() {}

    public static Optional<String> hintFor(String family) {
        return Optional.ofNullable(HINTS.get(family));
    }
}
