package com.fixfleet.orchestrator.scoring;

import com.fixfleet.orchestrator.registry.Objective;
import com.fixfleet.orchestrator.registry.RepoConfig;
import com.fixfleet.orchestrator.tracking.TrackedIssue;
import org.springframework.stereotype.Component;

import java.util.Collection;

/**
 * Composite priority score in [0, 1]; higher is dispatched first.
 *
 * <pre>
 *   0.35 · importance/100
 * + 0.30 · severity weight          (1.0 / 0.75 / 0.5 / 0.25)
 * + 0.15 · SLA urgency              (breached 0.4, at-risk 0.2, on-track 0)
 * + 0.10 · feasibility              (family fix rate, 0.5 without data)
 * + 0.10 · min(appearances·0.05, 0.3)
 * + objective boost                 (max 0.15/priority over unmet matching objectives)
 * </pre>
 * Rounded to 4 decimals. Pure: no clock, no I/O.
 */
@Component
public class PriorityScorer {

    public double score(TrackedIssue issue,
                        RepoConfig repo,
                        SlaStatus sla,
                        FixLearning fixLearning,
                        Collection<Objective> unmetObjectives) {
        double importance = repo.importanceScore() / 100.0;
        double severity   = issue.severityTier().weight();
        double urgency    = sla.urgency();
        double feasible   = fixLearning.feasibility(issue.cweFamily());
        double recurrence = Math.min(issue.appearances() * 0.05, 0.3);

        double score = 0.35 * importance
                     + 0.30 * severity
                     + 0.15 * urgency
                     + 0.10 * feasible
                     + 0.10 * recurrence;

        double boost = 0.0;
        for (Objective o : unmetObjectives) {
            if (o.targetSeverity() == issue.severityTier()) {
                boost = Math.max(boost, o.boost());
            }
        }
        score += boost;

        double rounded = Math.round(score * 10_000.0) / 10_000.0;
        return Math.max(0.0, Math.min(1.0, rounded));
    }
}
