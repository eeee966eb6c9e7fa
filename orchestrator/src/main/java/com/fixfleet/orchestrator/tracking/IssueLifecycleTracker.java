package com.fixfleet.orchestrator.tracking;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.VerificationRecord;
import com.fixfleet.orchestrator.ratelimit.CooldownPolicy;
import com.fixfleet.orchestrator.registry.RepoConfig;
import com.fixfleet.orchestrator.registry.RepoRegistry;
import com.fixfleet.orchestrator.scoring.FixLearning;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * Derives the current lifecycle state of an issue and decides whether it may
 * be dispatched.
 *
 * State, first match wins:
 *   1. resolved verification, not seen in any scan since → VERIFIED_FIXED
 *   2. the fingerprint's last session is still the live attempt:
 *        PR merged → PR_MERGED, PR open → PR_OPEN, session running → SESSION_DISPATCHED
 *   3. absent from the latest scan → FIXED
 *   4. base NEW / RECURRING
 *
 * Only the last session of a fingerprint counts, so an old merged PR cannot
 * mask a newer failed attempt.
 */
@Component
public class IssueLifecycleTracker {

    private final CooldownPolicy cooldownPolicy;

    public IssueLifecycleTracker(CooldownPolicy cooldownPolicy) {
        this.cooldownPolicy = cooldownPolicy;
    }

    public IssueState classify(TrackedIssue issue, LifecycleSignals signals) {
        Optional<VerificationRecord> verification = signals.latestVerification(issue.fingerprint());
        if (verification.isPresent() && verification.get().isResolved()
                && !issue.lastSeen().isAfter(verification.get().getVerifiedAt())) {
            return IssueState.VERIFIED_FIXED;
        }

        Optional<DispatchHistoryEntry> history = signals.history(issue.fingerprint());
        if (history.isPresent() && history.get().isAttemptLive()) {
            Optional<AgentSession> session = signals.session(history.get().getLastSessionId());
            if (session.isEmpty()) {
                // History written but session row unknown: assume the attempt is in flight.
                return IssueState.SESSION_DISPATCHED;
            }
            AgentSession s = session.get();
            if (s.getPrState() == PullRequestState.MERGED) return IssueState.PR_MERGED;
            if (s.getPrState() == PullRequestState.OPEN)   return IssueState.PR_OPEN;
            if (s.isActive())                              return IssueState.SESSION_DISPATCHED;
        }

        if (!issue.inLatestScan()) return IssueState.FIXED;
        return issue.baseState();
    }

    /**
     * First reason the issue must not be dispatched now, or empty if it is eligible.
     *
     * @param repos       registry, used for cooldown schedule and dispatchability
     * @param fixLearning historical per-family fix rates
     */
    public Optional<SkipReason> skipReason(TrackedIssue issue,
                                           IssueState state,
                                           LifecycleSignals signals,
                                           RepoRegistry repos,
                                           FixLearning fixLearning,
                                           Instant now) {
        switch (state) {
            case FIXED, VERIFIED_FIXED -> { return Optional.of(SkipReason.ALREADY_RESOLVED); }
            case SESSION_DISPATCHED    -> { return Optional.of(SkipReason.SESSION_ACTIVE); }
            case PR_OPEN               -> { return Optional.of(SkipReason.PR_AWAITING_REVIEW); }
            case PR_MERGED             -> { return Optional.of(SkipReason.PR_MERGED_AWAITING_VERIFICATION); }
            default -> { }
        }

        DispatchHistoryEntry history = signals.history(issue.fingerprint()).orElse(null);
        if (cooldownPolicy.needsHumanReview(history)) {
            return Optional.of(SkipReason.NEEDS_HUMAN_REVIEW);
        }

        RepoConfig config = repos.configFor(issue.repoUrl());
        if (cooldownPolicy.isCoolingDown(history, config.cooldownHoursSchedule(), now)) {
            return Optional.of(SkipReason.COOLDOWN_ACTIVE);
        }
        if (repos.isInvalid(issue.repoUrl())) {
            return Optional.of(SkipReason.REPO_CONFIG_INVALID);
        }
        if (!config.isDispatchable()) {
            return Optional.of(SkipReason.AUTO_DISPATCH_DISABLED);
        }
        if (fixLearning.shouldSkipFamily(issue.cweFamily())) {
            return Optional.of(SkipReason.LOW_FIX_RATE_FAMILY);
        }
        return Optional.empty();
    }
}
