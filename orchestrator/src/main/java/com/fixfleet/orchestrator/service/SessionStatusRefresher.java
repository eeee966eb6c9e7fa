package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.dispatch.SessionPoller;
import com.fixfleet.orchestrator.github.GitHubApiException;
import com.fixfleet.orchestrator.github.PullRequestClient;
import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.state.CycleLockService;
import com.fixfleet.orchestrator.state.OrchestratorState;
import com.fixfleet.orchestrator.state.OrchestratorStateStore;
import com.fixfleet.orchestrator.tracking.OutcomeRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Background refresher for work that outlives a cycle: sessions still running
 * after their wave timed out, and PRs waiting for review.
 *
 * Every tick: take the cycle lease (skip the tick if a cycle holds it) →
 * poll active sessions → poll open PRs → record outcomes → save.
 *
 * Disabled together with the cycle scheduler.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "fixfleet.orchestrator.scheduler", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class SessionStatusRefresher {

    private static final Logger log = LoggerFactory.getLogger(SessionStatusRefresher.class);

    private final CycleLockService       lockService;
    private final OrchestratorStateStore stateStore;
    private final SessionPoller          poller;
    private final PullRequestClient      pullRequests;
    private final OutcomeRecorder        outcomeRecorder;
    private final Clock                  clock;

    public SessionStatusRefresher(CycleLockService lockService,
                                  OrchestratorStateStore stateStore,
                                  SessionPoller poller,
                                  PullRequestClient pullRequests,
                                  OutcomeRecorder outcomeRecorder,
                                  Clock clock) {
        this.lockService     = lockService;
        this.stateStore      = stateStore;
        this.poller          = poller;
        this.pullRequests    = pullRequests;
        this.outcomeRecorder = outcomeRecorder;
        this.clock           = clock;
    }

    @Scheduled(fixedDelayString = "${fixfleet.orchestrator.scheduler.refresh-interval-ms:300000}",
               initialDelayString = "${fixfleet.orchestrator.scheduler.refresh-interval-ms:300000}")
    public void tick() {
        Optional<String> owner = lockService.tryAcquire();
        if (owner.isEmpty()) {
            log.debug("Cycle in progress, skipping refresh");
            return;
        }
        try {
            refresh();
        } catch (RuntimeException e) {
            log.error("Session refresh failed: {}", e.getMessage(), e);
        } finally {
            lockService.release(owner.get());
        }
    }

    /**
     * One refresh pass. Callers must hold the cycle lease.
     *
     * @return number of sessions whose status or PR state changed
     */
    public int refresh() {
        OrchestratorState state = stateStore.load();

        List<AgentSession> active = state.sessions().values().stream()
                .filter(AgentSession::isActive)
                .toList();
        List<AgentSession> polled = poller.refreshOnce(active);
        polled.forEach(state::touch);
        int changed = polled.size();

        Instant now = clock.instant();
        for (AgentSession session : state.sessions().values()) {
            if (session.getPrState() != PullRequestState.OPEN || session.getPrUrl() == null) continue;
            try {
                Optional<PullRequestState> prState = pullRequests.fetchState(session.getPrUrl());
                if (prState.isPresent() && session.applyPullRequestState(prState.get(), now)) {
                    log.info("PR {} of session {} is now {}", session.getPrUrl(), session.getSessionId(), prState.get());
                    state.touch(session);
                    changed++;
                }
            } catch (GitHubApiException e) {
                log.warn("PR lookup failed for {}: {}", session.getPrUrl(), e.getMessage());
            }
        }

        for (AgentSession session : state.sessions().values()) {
            outcomeRecorder.apply(session, state, now);
        }
        stateStore.save(state);
        if (changed > 0) {
            log.info("Refresh updated {} session(s) ({} still running)", changed,
                    state.sessions().values().stream().filter(AgentSession::isActive).count());
        }
        return changed;
    }
}
