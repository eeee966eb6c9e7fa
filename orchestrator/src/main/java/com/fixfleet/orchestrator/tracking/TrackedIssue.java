package com.fixfleet.orchestrator.tracking;

import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.SeverityTier;

import java.time.Instant;

/**
 * One fingerprint in one repo, aggregated over the repo's whole scan history.
 *
 * Metadata (rule, severity, location, message) comes from the most recent
 * scan the fingerprint appeared in. baseState is NEW, RECURRING or FIXED,
 * before any session / PR / verification signal is applied.
 */
public record TrackedIssue(
        String fingerprint,
        String repoUrl,
        String ruleId,
        SeverityTier severityTier,
        String cweFamily,
        String file,
        int startLine,
        String message,
        int appearances,
        Instant firstSeen,
        Instant lastSeen,
        boolean inLatestScan,
        IssueState baseState
) {}
