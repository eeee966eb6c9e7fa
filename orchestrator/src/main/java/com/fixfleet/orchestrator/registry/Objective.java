package com.fixfleet.orchestrator.registry;

import com.fixfleet.orchestrator.model.SeverityTier;

/**
 * Fleet-wide goal such as "no more than 0 open critical issues".
 * An unmet objective boosts the score of issues at its target severity.
 */
public record Objective(
        String name,
        String description,
        SeverityTier targetSeverity,
        int targetCount,
        int priority
) {
    /** Boost granted while unmet: 0.15 for priority 1, 0.075 for priority 2, ... */
    public double boost() {
        return 0.15 / Math.max(priority, 1);
    }
}
