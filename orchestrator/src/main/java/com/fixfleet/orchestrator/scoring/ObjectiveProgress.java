package com.fixfleet.orchestrator.scoring;

import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.registry.Objective;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * How far the fleet is from one objective: open (new / recurring) issues at the
 * target severity, against the target count. Met when current ≤ target.
 */
public record ObjectiveProgress(
        String objective,
        String description,
        SeverityTier targetSeverity,
        int currentCount,
        int targetCount,
        boolean met
) {

    /**
     * @param openBySeverity count of NEW / RECURRING issues per severity, fleet-wide
     */
    public static ObjectiveProgress of(Objective objective, Map<SeverityTier, Integer> openBySeverity) {
        int current = openBySeverity.getOrDefault(objective.targetSeverity(), 0);
        return new ObjectiveProgress(objective.name(), objective.description(), objective.targetSeverity(),
                current, objective.targetCount(), current <= objective.targetCount());
    }

    public static List<ObjectiveProgress> of(Collection<Objective> objectives,
                                             Map<SeverityTier, Integer> openBySeverity) {
        return objectives.stream().map(o -> of(o, openBySeverity)).toList();
    }
}
