package com.fixfleet.orchestrator.fingerprint;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FingerprintEngine.
 *
 * Each source tier is tried in order: partial fingerprints, message,
 * normalized snippet, then position.
 */
class FingerprintEngineTest {

    private final FingerprintEngine engine = new FingerprintEngine();

    // ------------------------------------------------------------------
    // Tier selection
    // ------------------------------------------------------------------

    @Test
    void partialFingerprint_winsOverEverythingElse() {
        Fingerprint fp = engine.fingerprint(new RawFinding("js/xss", "a.js", 3, "msg",
                Map.of("primaryLocationLineHash", "abc123:1"), "x = y"));

        assertThat(fp.tier()).isEqualTo(FingerprintTier.CONTENT_HASH);
        assertThat(fp.value()).hasSize(20).matches("[0-9a-f]{20}");
    }

    @Test
    void partialFingerprint_ignoresFileAndLine() {
        Map<String, String> partial = Map.of("primaryLocationLineHash", "abc123:1");
        Fingerprint a = engine.fingerprint(new RawFinding("js/xss", "a.js", 3, "msg", partial, null));
        Fingerprint b = engine.fingerprint(new RawFinding("js/xss", "moved/a.js", 90, "other msg", partial, null));

        assertThat(a.value()).isEqualTo(b.value());
    }

    @Test
    void partialFingerprint_prefersLineHashOverColumnFingerprint() {
        Fingerprint both = engine.fingerprint(new RawFinding("r", "f", 1, null,
                Map.of("primaryLocationStartColumnFingerprint", "col", "primaryLocationLineHash", "line"), null));
        Fingerprint lineOnly = engine.fingerprint(new RawFinding("r", "f", 1, null,
                Map.of("primaryLocationLineHash", "line"), null));

        assertThat(both.value()).isEqualTo(lineOnly.value());
    }

    @Test
    void unknownPartialKeys_pickLexicallyFirst() {
        Fingerprint a = engine.fingerprint(new RawFinding("r", "f", 1, null, Map.of("zeta", "z", "alpha", "a"), null));
        Fingerprint b = engine.fingerprint(new RawFinding("r", "f", 1, null, Map.of("alpha", "a"), null));

        assertThat(a.value()).isEqualTo(b.value());
    }

    @Test
    void message_usedWhenNoPartialFingerprint() {
        Fingerprint fp = engine.fingerprint(new RawFinding("js/xss", "a.js", 3, "Unsafe HTML", null, "x"));

        assertThat(fp.tier()).isEqualTo(FingerprintTier.MESSAGE);
    }

    @Test
    void snippet_usedWhenMessageBlank() {
        Fingerprint fp = engine.fingerprint(new RawFinding("js/xss", "a.js", 3, "  ", null, "el.innerHTML = v;"));

        assertThat(fp.tier()).isEqualTo(FingerprintTier.SNIPPET);
    }

    @Test
    void position_isLastResort() {
        Fingerprint fp = engine.fingerprint(new RawFinding("js/xss", "a.js", 3, null, null, null));

        assertThat(fp.tier()).isEqualTo(FingerprintTier.POSITION);
    }

    // ------------------------------------------------------------------
    // Stability
    // ------------------------------------------------------------------

    @Test
    void sameInput_sameFingerprint() {
        RawFinding raw = new RawFinding("py/sql", "db.py", 12, "SQL built from input", null, null);

        assertThat(engine.fingerprint(raw).value()).isEqualTo(engine.fingerprint(raw).value());
    }

    @Test
    void snippetTier_stableWhenBlankLinesInsertedAbove() {
        RawFinding before = new RawFinding("py/sql", "db.py", 12, null, null, "cur.execute(q  % user)");
        RawFinding after  = new RawFinding("py/sql", "db.py", 15, null, null, "   cur.execute(q % user)  ");

        assertThat(engine.fingerprint(after).value()).isEqualTo(engine.fingerprint(before).value());
    }

    @Test
    void positionTier_changesWhenLineMoves() {
        RawFinding before = new RawFinding("py/sql", "db.py", 12, null, null, null);
        RawFinding after  = new RawFinding("py/sql", "db.py", 15, null, null, null);

        assertThat(engine.fingerprint(after).value()).isNotEqualTo(engine.fingerprint(before).value());
    }

    @Test
    void explicitSourceSnippet_overridesRawSnippet() {
        RawFinding raw = new RawFinding("r", "f", 1, null, null, "old line");

        Fingerprint fromOverride = engine.fingerprint(raw, "new   line");
        Fingerprint fromRaw = engine.fingerprint(new RawFinding("r", "f", 1, null, null, "new line"));

        assertThat(fromOverride.value()).isEqualTo(fromRaw.value());
    }

    @Test
    void allFieldsNull_stillProducesFingerprint() {
        Fingerprint fp = engine.fingerprint(new RawFinding(null, null, null, null, null, null));

        assertThat(fp.value()).hasSize(20);
        assertThat(fp.tier()).isEqualTo(FingerprintTier.POSITION);
    }

    @Test
    void normalizeSnippet_collapsesWhitespace() {
        assertThat(FingerprintEngine.normalizeSnippet("\t a  =\n b ")).isEqualTo("a = b");
        assertThat(FingerprintEngine.normalizeSnippet(null)).isEmpty();
    }
}
