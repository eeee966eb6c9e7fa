package com.fixfleet.orchestrator.fingerprint;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups CWE ids into remediation families.
 *
 * Findings in the same family share a fix pattern (parameterized queries for
 * every injection CWE, output encoding for every XSS CWE), so batches are
 * formed per family.
 */
public final class CweFamilies {

    public static final String OTHER = "other";

    private static final Pattern CWE_ID = Pattern.compile("cwe-0*(\\d+)");

    private static final Map<String, List<Integer>> FAMILIES = Map.ofEntries(
            Map.entry("injection",             List.of(77, 78, 89, 90, 94, 95, 96, 116, 564, 917, 943)),
            Map.entry("xss",                   List.of(79, 80, 83, 87)),
            Map.entry("path-traversal",        List.of(22, 23, 36, 73, 99)),
            Map.entry("ssrf",                  List.of(918)),
            Map.entry("deserialization",       List.of(502)),
            Map.entry("auth",                  List.of(287, 306, 862, 863, 284, 285, 269, 732)),
            Map.entry("crypto",                List.of(327, 328, 330, 338, 326, 261, 310, 295, 347, 916)),
            Map.entry("info-disclosure",       List.of(200, 209, 532, 497, 215, 538, 359, 312, 319)),
            Map.entry("redirect",              List.of(601)),
            Map.entry("xxe",                   List.of(611, 776)),
            Map.entry("csrf",                  List.of(352)),
            Map.entry("prototype-pollution",   List.of(1321)),
            Map.entry("regex-dos",             List.of(1333, 730, 400, 185)),
            Map.entry("type-confusion",        List.of(843, 704)),
            Map.entry("template-injection",    List.of(1336)),
            Map.entry("hardcoded-credentials", List.of(798, 259, 321, 547)),
            Map.entry("missing-rate-limiting", List.of(770, 799, 307)),
            Map.entry("logging",               List.of(117, 778, 223)),
            Map.entry("zip-slip",              List.of(59)),
            Map.entry("xml-injection",         List.of(91, 643)),
            Map.entry("nosql-injection",       List.of(1286)),
            Map.entry("session-management",    List.of(384, 613, 614, 1004)),
            Map.entry("file-upload",           List.of(434)),
            Map.entry("race-condition",        List.of(362, 367)),
            Map.entry("memory-safety",         List.of(119, 120, 125, 787, 416, 476, 190))
    );

    private static final Map<String, String> INDEX = new HashMap<>();
    static {
        FAMILIES.forEach((family, ids) -> ids.forEach(id -> INDEX.put("cwe-" + id, family)));
    }

    private CweFamilies() {}

    /**
     * Normalize one tag or id to "cwe-{number}".
     * Accepts "CWE-079", "cwe-79" and CodeQL's "external/cwe/cwe-79".
     * Returns null when the value carries no CWE id.
     */
    public static String normalize(String tag) {
        if (tag == null) return null;
        Matcher m = CWE_ID.matcher(tag.toLowerCase(Locale.ROOT));
        return m.find() ? "cwe-" + m.group(1) : null;
    }

    /** Family of the first recognised CWE in the tags, or "other". */
    public static String familyOf(Collection<String> tags) {
        if (tags == null) return OTHER;
        for (String tag : tags) {
            String family = INDEX.get(normalize(tag));
            if (family != null) return family;
        }
        return OTHER;
    }

    public static boolean isKnownFamily(String family) {
        return FAMILIES.containsKey(family);
    }
}
