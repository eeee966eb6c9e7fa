package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.DispatchOutcome;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.VerificationRecord;
import com.fixfleet.orchestrator.repository.AgentSessionRepository;
import com.fixfleet.orchestrator.repository.DispatchHistoryRepository;
import com.fixfleet.orchestrator.repository.VerificationRepository;
import com.fixfleet.orchestrator.tracking.OutcomeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ingests resolution signals pushed from outside: verification results and
 * pull-request state changes.
 *
 * Signals update the affected rows directly, each call in one transaction.
 * They do not go through the cycle lease, so a verification can land while a
 * cycle runs; the cycle sees it on its next load.
 */
@Service
public class SignalService {

    private static final Logger log = LoggerFactory.getLogger(SignalService.class);

    private final VerificationRepository    verificationRepo;
    private final DispatchHistoryRepository historyRepo;
    private final AgentSessionRepository    sessionRepo;
    private final OutcomeRecorder           outcomeRecorder;
    private final Clock                     clock;

    public SignalService(VerificationRepository verificationRepo,
                         DispatchHistoryRepository historyRepo,
                         AgentSessionRepository sessionRepo,
                         OutcomeRecorder outcomeRecorder,
                         Clock clock) {
        this.verificationRepo = verificationRepo;
        this.historyRepo      = historyRepo;
        this.sessionRepo      = sessionRepo;
        this.outcomeRecorder  = outcomeRecorder;
        this.clock            = clock;
    }

    /**
     * Record one verification result.
     *
     * resolved = true closes the attempt as VERIFIED and resets the failure
     * streak; resolved = false counts as a failed attempt (PR_FAILED).
     * sessionId, when given, must match the fingerprint's last session or the
     * history is left alone.
     *
     * @throws IllegalArgumentException if fingerprint is missing
     */
    @Transactional
    public VerificationRecord recordVerification(String fingerprint, boolean resolved,
                                                 String prUrl, String sessionId, Instant verifiedAt) {
        if (fingerprint == null || fingerprint.isBlank()) {
            throw new IllegalArgumentException("fingerprint is required");
        }
        Instant now = clock.instant();
        VerificationRecord record = verificationRepo.save(new VerificationRecord(
                fingerprint, resolved, prUrl, sessionId, verifiedAt != null ? verifiedAt : now));

        historyRepo.findById(fingerprint).ifPresentOrElse(entry -> {
            DispatchOutcome outcome = resolved ? DispatchOutcome.VERIFIED : DispatchOutcome.PR_FAILED;
            if (entry.recordOutcome(sessionId, outcome, now)) {
                historyRepo.save(entry);
                log.info("Verification for {} → {} (consecutive failures {})",
                        fingerprint, outcome, entry.getConsecutiveFailures());
            } else {
                log.info("Verification for {} did not change its history (stale or already resolved)", fingerprint);
            }
        }, () -> log.info("Verification for {} has no dispatch history, recorded only", fingerprint));
        return record;
    }

    /**
     * Apply a pull-request state change to every session that opened the PR,
     * then record the resulting outcome for their fingerprints.
     *
     * @return sessions that changed
     * @throws IllegalArgumentException if prUrl or state is missing
     */
    @Transactional
    public List<AgentSession> recordPullRequest(String prUrl, PullRequestState state) {
        if (prUrl == null || prUrl.isBlank()) throw new IllegalArgumentException("pr_url is required");
        if (state == null || state == PullRequestState.NONE) {
            throw new IllegalArgumentException("state must be one of open, merged, closed");
        }
        Instant now = clock.instant();
        List<AgentSession> changed = new ArrayList<>();
        for (AgentSession session : sessionRepo.findByPrUrl(prUrl)) {
            if (!session.applyPullRequestState(state, now)) continue;
            changed.add(sessionRepo.save(session));

            Map<String, DispatchHistoryEntry> history = new HashMap<>();
            historyRepo.findAllById(session.getFingerprints()).forEach(h -> history.put(h.getFingerprint(), h));
            historyRepo.saveAll(outcomeRecorder.apply(session, history, now));
        }
        if (changed.isEmpty()) {
            log.info("Pull request {} ({}) matched no session needing an update", prUrl, state);
        }
        return changed;
    }
}
