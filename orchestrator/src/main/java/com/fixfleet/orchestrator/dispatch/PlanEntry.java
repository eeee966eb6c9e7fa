package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.scoring.SlaStatus;
import com.fixfleet.orchestrator.tracking.TrackedIssue;

import java.util.Comparator;

/**
 * One issue in a dispatch plan: its state, score and why it is (not) dispatched.
 *
 * eligible means the issue passed the skip predicate. An eligible issue can
 * still be held back by the rate limiter or its repo's session cap; skipReason
 * then names the limit.
 */
public record PlanEntry(
        TrackedIssue issue,
        IssueState state,
        double score,
        SlaStatus sla,
        boolean eligible,
        String skipReason
) {
    public static final String DEFERRED_RATE_LIMIT = "deferred_rate_limit";
    public static final String REPO_CYCLE_LIMIT    = "repo_cycle_limit";

    /** Score desc, then severity desc, then oldest first, then fingerprint. */
    public static final Comparator<PlanEntry> DISPATCH_ORDER =
            Comparator.comparingDouble(PlanEntry::score).reversed()
                    .thenComparing(e -> e.issue().severityTier())
                    .thenComparing(e -> e.issue().firstSeen())
                    .thenComparing(PlanEntry::fingerprint);

    public String       fingerprint() { return issue.fingerprint(); }
    public SeverityTier wave()        { return issue.severityTier(); }

    public boolean isDeferred() {
        return DEFERRED_RATE_LIMIT.equals(skipReason) || REPO_CYCLE_LIMIT.equals(skipReason);
    }

    public PlanEntry withSkipReason(String reason) {
        return new PlanEntry(issue, state, score, sla, eligible, reason);
    }
}
