package com.fixfleet.orchestrator.scoring;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.registry.Objective;
import com.fixfleet.orchestrator.tracking.TrackedIssue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static com.fixfleet.orchestrator.Fixtures.issue;
import static com.fixfleet.orchestrator.Fixtures.repo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/** Tests for the weighted priority score. */
class PriorityScorerTest {

    private static final String REPO = "https://github.com/acme/api";

    private final PriorityScorer scorer = new PriorityScorer();
    private final FixLearning noData = FixLearning.empty(new OrchestratorProperties.FixLearning());

    @Test
    void score_combinesWeightedTerms() {
        TrackedIssue issue = issue("fp1", REPO, SeverityTier.HIGH, "xss");

        double score = scorer.score(issue, repo(REPO, 80, 5, 5), SlaStatus.ON_TRACK, noData, List.of());

        // 0.35*0.8 + 0.30*0.75 + 0 + 0.10*0.5 + 0.10*0.05
        assertThat(score).isCloseTo(0.56, within(1e-9));
    }

    @Test
    void breachedSla_andRecurrence_raiseScore() {
        TrackedIssue fresh     = issue("fp1", REPO, SeverityTier.MEDIUM, "xss");
        TrackedIssue recurring = issue("fp2", REPO, SeverityTier.MEDIUM, "xss", NOW.minusSeconds(86_400), 10);

        double base     = scorer.score(fresh, repo(REPO, 50, 5, 5), SlaStatus.ON_TRACK, noData, List.of());
        double breached = scorer.score(fresh, repo(REPO, 50, 5, 5), SlaStatus.BREACHED, noData, List.of());
        double repeat   = scorer.score(recurring, repo(REPO, 50, 5, 5), SlaStatus.ON_TRACK, noData, List.of());

        assertThat(breached - base).isCloseTo(0.06, within(1e-9));
        // appearances term caps at 0.3
        assertThat(repeat - base).isCloseTo(0.025, within(1e-9));
    }

    @Test
    void unmetObjective_boostsMatchingSeverityOnly() {
        Objective noHighs = new Objective("no-high", "no open highs", SeverityTier.HIGH, 0, 1);
        Objective lesser  = new Objective("few-high", "few open highs", SeverityTier.HIGH, 5, 3);
        TrackedIssue high = issue("fp1", REPO, SeverityTier.HIGH, "xss");
        TrackedIssue low  = issue("fp2", REPO, SeverityTier.LOW, "xss");

        double highPlain   = scorer.score(high, repo(REPO, 80, 5, 5), SlaStatus.ON_TRACK, noData, List.of());
        double highBoosted = scorer.score(high, repo(REPO, 80, 5, 5), SlaStatus.ON_TRACK, noData,
                List.of(lesser, noHighs));
        double lowPlain    = scorer.score(low, repo(REPO, 80, 5, 5), SlaStatus.ON_TRACK, noData, List.of());
        double lowBoosted  = scorer.score(low, repo(REPO, 80, 5, 5), SlaStatus.ON_TRACK, noData, List.of(noHighs));

        assertThat(highBoosted - highPlain).isCloseTo(0.15, within(1e-9));
        assertThat(lowBoosted).isEqualTo(lowPlain);
    }

    @Test
    void score_withEveryTermMaxed_staysBelowOne() {
        Objective crit = new Objective("no-crit", "", SeverityTier.CRITICAL, 0, 1);
        FixLearning perfect = new FixLearning(Map.of("injection", new FamilyStats("injection", 10, 10)),
                new OrchestratorProperties.FixLearning());
        TrackedIssue issue = issue("fp1", REPO, SeverityTier.CRITICAL, "injection", NOW.minusSeconds(86_400), 20);

        double score = scorer.score(issue, repo(REPO, 100, 5, 5), SlaStatus.BREACHED, perfect, List.of(crit));

        assertThat(score).isCloseTo(0.99, within(1e-9));
    }

    @Test
    void score_neverDropsWhenImportanceSeverityOrAppearancesRise() {
        List<SeverityTier> ascending = new ArrayList<>(List.of(SeverityTier.values()));
        Collections.reverse(ascending);   // low → critical

        for (SeverityTier severity : ascending) {
            for (int appearances : new int[] {1, 3, 10}) {
                double previous = -1;
                for (int importance = 0; importance <= 100; importance += 10) {
                    double score = score(importance, severity, appearances);
                    assertThat(score).as("importance %d, %s, %d appearance(s)", importance, severity, appearances)
                            .isGreaterThanOrEqualTo(previous);
                    previous = score;
                }
            }
        }
        for (int importance : new int[] {0, 50, 100}) {
            for (int appearances : new int[] {1, 3, 10}) {
                double previous = -1;
                for (SeverityTier severity : ascending) {
                    double score = score(importance, severity, appearances);
                    assertThat(score).as("importance %d, %s, %d appearance(s)", importance, severity, appearances)
                            .isGreaterThanOrEqualTo(previous);
                    previous = score;
                }
            }
        }
        for (int importance : new int[] {0, 50, 100}) {
            for (SeverityTier severity : ascending) {
                double previous = -1;
                for (int appearances = 1; appearances <= 25; appearances++) {
                    double score = score(importance, severity, appearances);
                    assertThat(score).as("importance %d, %s, %d appearance(s)", importance, severity, appearances)
                            .isGreaterThanOrEqualTo(previous);
                    previous = score;
                }
            }
        }
    }

    private double score(int importance, SeverityTier severity, int appearances) {
        TrackedIssue issue = issue("fp1", REPO, severity, "xss", NOW.minusSeconds(86_400), appearances);
        return scorer.score(issue, repo(REPO, importance, 5, 5), SlaStatus.ON_TRACK, noData, List.of());
    }
}
