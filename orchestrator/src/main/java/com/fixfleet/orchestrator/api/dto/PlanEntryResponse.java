package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.dispatch.PlanEntry;
import com.fixfleet.orchestrator.tracking.TrackedIssue;

import java.time.Instant;

/**
 * One row of GET /orchestrator/plan, in dispatch order.
 * skipReason is null for issues that would be dispatched.
 */
public record PlanEntryResponse(
        IssueSummary issue,
        String  state,
        double  score,
        String  wave,
        String  sla,
        boolean eligible,
        String  skipReason
) {
    public static PlanEntryResponse from(PlanEntry entry) {
        return new PlanEntryResponse(
                IssueSummary.from(entry.issue()),
                entry.state().label(),
                entry.score(),
                entry.wave().label(),
                entry.sla().label(),
                entry.eligible(),
                entry.skipReason()
        );
    }

    public record IssueSummary(
            String  fingerprint,
            String  repoUrl,
            String  ruleId,
            String  severity,
            String  cweFamily,
            String  file,
            int     startLine,
            int     appearances,
            Instant firstSeen,
            Instant lastSeen
    ) {
        public static IssueSummary from(TrackedIssue issue) {
            return new IssueSummary(
                    issue.fingerprint(),
                    issue.repoUrl(),
                    issue.ruleId(),
                    issue.severityTier().label(),
                    issue.cweFamily(),
                    issue.file(),
                    issue.startLine(),
                    issue.appearances(),
                    issue.firstSeen(),
                    issue.lastSeen()
            );
        }
    }
}
