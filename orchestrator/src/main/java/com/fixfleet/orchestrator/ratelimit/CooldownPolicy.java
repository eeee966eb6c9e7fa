package com.fixfleet.orchestrator.ratelimit;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Escalating per-issue backoff after failed dispatch attempts.
 *
 * After the n-th consecutive failure the issue waits schedule[min(n-1, len-1)]
 * hours, counted from its last dispatch. At maxDispatchAttempts failures the
 * issue is handed to a human and never auto-dispatched again until a
 * verification resets the counter.
 */
@Component
public class CooldownPolicy {

    private final int maxDispatchAttempts;

    @Autowired
    public CooldownPolicy(OrchestratorProperties properties) {
        this(properties.getMaxDispatchAttempts());
    }

    public CooldownPolicy(int maxDispatchAttempts) {
        this.maxDispatchAttempts = maxDispatchAttempts;
    }

    public boolean needsHumanReview(DispatchHistoryEntry history) {
        return history != null && history.needsHumanReview(maxDispatchAttempts);
    }

    /** Time left before the issue may be dispatched again; zero when none. */
    public Duration remaining(DispatchHistoryEntry history, List<Integer> scheduleHours, Instant now) {
        if (history == null || history.getConsecutiveFailures() <= 0 || history.getLastDispatched() == null) {
            return Duration.ZERO;
        }
        if (scheduleHours == null || scheduleHours.isEmpty()) return Duration.ZERO;

        int idx = Math.min(history.getConsecutiveFailures() - 1, scheduleHours.size() - 1);
        Instant eligibleAt = history.getLastDispatched().plus(Duration.ofHours(scheduleHours.get(idx)));
        return now.isBefore(eligibleAt) ? Duration.between(now, eligibleAt) : Duration.ZERO;
    }

    public boolean isCoolingDown(DispatchHistoryEntry history, List<Integer> scheduleHours, Instant now) {
        return !remaining(history, scheduleHours, now).isZero();
    }

    public int maxDispatchAttempts() {
        return maxDispatchAttempts;
    }
}
