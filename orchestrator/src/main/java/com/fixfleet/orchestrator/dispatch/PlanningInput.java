package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;
import com.fixfleet.orchestrator.registry.Objective;
import com.fixfleet.orchestrator.registry.RepoRegistry;
import com.fixfleet.orchestrator.scoring.FixLearning;
import com.fixfleet.orchestrator.tracking.LifecycleSignals;
import com.fixfleet.orchestrator.tracking.TrackedIssue;

import java.time.Instant;
import java.util.List;

/**
 * Inputs of {@link WaveDispatcher#plan}. The rate window is only read:
 * planning simulates reservations on a copy.
 *
 * @param unmetObjectives fleet objectives not yet met; they boost matching issues
 */
public record PlanningInput(
        List<TrackedIssue> issues,
        LifecycleSignals signals,
        RepoRegistry registry,
        FixLearning fixLearning,
        List<Objective> unmetObjectives,
        RateLimiterWindow rateWindow,
        Instant now
) {}
