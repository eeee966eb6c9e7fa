package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.scoring.ObjectiveProgress;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the orchestrator for GET /orchestrator/status.
 */
public record OrchestratorStatus(
        RateLimitUsage rateLimit,
        CooldownSummary cooldown,
        List<ObjectiveProgress> objectives,
        Map<String, Long> issueStates,
        int activeSessions,
        boolean cycleRunning,
        LastCycle lastCycle,
        List<String> warnings
) {
    public record RateLimitUsage(int maxSessions, int periodHours, int used, int remaining) {}

    public record CooldownSummary(int coolingDown, int needsHumanReview, List<String> needsHumanReviewFingerprints) {}

    public record LastCycle(String cycleId, Instant at, String status, CycleReport report) {}
}
