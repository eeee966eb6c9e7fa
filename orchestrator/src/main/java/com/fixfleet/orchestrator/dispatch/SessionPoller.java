package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.agent.AgentPlatformClient;
import com.fixfleet.orchestrator.agent.AgentPlatformException;
import com.fixfleet.orchestrator.agent.SessionSnapshot;
import com.fixfleet.orchestrator.model.AgentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Bounded wait for a wave's sessions to reach a terminal status.
 *
 * Polls every interval until every session is terminal, the timeout elapses,
 * the cycle is cancelled or the thread is interrupted. A failed status call
 * is logged and retried on the next round; it never fails the wave.
 */
@Component
public class SessionPoller {

    private static final Logger log = LoggerFactory.getLogger(SessionPoller.class);

    public enum Result { ALL_TERMINAL, TIMED_OUT, CANCELLED }

    private final AgentPlatformClient agentPlatform;
    private final Clock               clock;

    public SessionPoller(AgentPlatformClient agentPlatform, Clock clock) {
        this.agentPlatform = agentPlatform;
        this.clock         = clock;
    }

    /**
     * Refresh each non-terminal session once.
     *
     * @return sessions whose status or PR changed
     */
    public List<AgentSession> refreshOnce(Collection<AgentSession> sessions) {
        return sessions.stream()
                .filter(AgentSession::isActive)
                .filter(this::refresh)
                .toList();
    }

    public Result awaitTerminal(Collection<AgentSession> sessions,
                                Duration interval,
                                Duration timeout,
                                CycleCancellation cancellation) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            if (cancellation.isCancelled()) return Result.CANCELLED;

            refreshOnce(sessions);
            long active = sessions.stream().filter(AgentSession::isActive).count();
            if (active == 0) return Result.ALL_TERMINAL;

            if (System.nanoTime() >= deadline) {
                log.warn("Wave timeout after {}: {} session(s) still running", timeout, active);
                return Result.TIMED_OUT;
            }
            log.debug("{} session(s) still running, next poll in {}", active, interval);
            try {
                TimeUnit.MILLISECONDS.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Polling interrupted, treating cycle as cancelled");
                return Result.CANCELLED;
            }
        }
    }

    private boolean refresh(AgentSession session) {
        try {
            SessionSnapshot snap = agentPlatform.getSession(session.getSessionId());
            boolean changed = session.applyStatus(snap.status(), snap.prUrl(), clock.instant());
            if (changed) {
                log.info("Session {} is now {}{}", session.getSessionId(), snap.status(),
                        snap.prUrl() != null ? " (PR " + snap.prUrl() + ")" : "");
            }
            return changed;
        } catch (AgentPlatformException e) {
            log.warn("Status poll failed for session {}: {}", session.getSessionId(), e.getMessage());
            return false;
        }
    }
}
