package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.agent.SessionSpec;
import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.scoring.FamilyStats;
import com.fixfleet.orchestrator.scoring.FixLearning;
import com.fixfleet.orchestrator.scoring.SlaStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.fixfleet.orchestrator.Fixtures.issue;
import static com.fixfleet.orchestrator.Fixtures.repo;
import static org.assertj.core.api.Assertions.assertThat;

/** Prompt, tags and budget of the session request built for a batch. */
class SessionPromptBuilderTest {

    private static final String API = "https://github.com/acme/api";

    private final SessionPromptBuilder builder = new SessionPromptBuilder();

    @Test
    void build_listsEveryFindingAndCycle() {
        Batch batch = batch("fp-a", "fp-b");

        SessionSpec spec = builder.build(batch, repo(API, 50, 5, 5),
                FixLearning.empty(new OrchestratorProperties.FixLearning()), "cycle-42");

        assertThat(spec.prompt())
                .contains("Dispatch cycle: cycle-42")
                .contains("### fp-a: rule/injection")
                .contains("### fp-b: rule/injection")
                .contains("- Location: src/fp-a.js:10")
                .contains("Fix pattern hint: Replace string-built queries")
                .contains("titled exactly: 'fix(fp-a,fp-b): resolve injection security issues'");
        assertThat(spec.title()).isEqualTo("Security fix (fp-a,fp-b): injection (HIGH)");
        assertThat(spec.tags()).containsExactly(
                "fixfleet", "severity-high", "cwe-injection", "batch-high-1", "fp-a", "fp-b");
        assertThat(spec.maxAcuLimit()).isEqualTo(10);
    }

    @Test
    void build_mentionsHistoricalFixRate() {
        FixLearning learning = new FixLearning(Map.of("injection", new FamilyStats("injection", 4, 3)),
                new OrchestratorProperties.FixLearning());

        SessionSpec spec = builder.build(batch("fp-a"), repo(API, 50, 5, 5), learning, "cycle-1");

        assertThat(spec.prompt()).contains("Historical fix rate for injection: 75% (3/4 sessions)");
        assertThat(spec.maxAcuLimit()).isEqualTo(6);
    }

    @Test
    void samePromptForSameCycle_differentForNextCycle() {
        FixLearning none = FixLearning.empty(new OrchestratorProperties.FixLearning());

        String first  = builder.build(batch("fp-a"), repo(API, 50, 5, 5), none, "cycle-1").prompt();
        String retry  = builder.build(batch("fp-a"), repo(API, 50, 5, 5), none, "cycle-1").prompt();
        String later  = builder.build(batch("fp-a"), repo(API, 50, 5, 5), none, "cycle-2").prompt();

        assertThat(retry).isEqualTo(first);
        assertThat(later).isNotEqualTo(first);
    }

    private static Batch batch(String... fingerprints) {
        List<PlanEntry> entries = java.util.Arrays.stream(fingerprints)
                .map(fp -> new PlanEntry(issue(fp, API, SeverityTier.HIGH, "injection"),
                        IssueState.NEW, 0.5, SlaStatus.ON_TRACK, true, null))
                .toList();
        return new Batch("high-1", API, "injection", SeverityTier.HIGH, entries);
    }
}
