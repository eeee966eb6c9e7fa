package com.fixfleet.orchestrator.scoring;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.SeverityTier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-severity remediation deadlines, measured from an issue's first sighting.
 * At-risk once no more than atRiskFraction of the window remains.
 */
@Component
public class SlaPolicy {

    private final OrchestratorProperties.Sla sla;

    public SlaPolicy(OrchestratorProperties properties) {
        this.sla = properties.getSla();
    }

    public Duration limitFor(SeverityTier tier) {
        int hours = switch (tier) {
            case CRITICAL -> sla.getCriticalHours();
            case HIGH     -> sla.getHighHours();
            case MEDIUM   -> sla.getMediumHours();
            case LOW      -> sla.getLowHours();
        };
        return Duration.ofHours(hours);
    }

    public SlaStatus status(SeverityTier tier, Instant firstSeen, Instant now) {
        Duration limit   = limitFor(tier);
        Duration elapsed = Duration.between(firstSeen, now);
        if (elapsed.compareTo(limit) >= 0) return SlaStatus.BREACHED;

        Duration remaining = limit.minus(elapsed);
        long atRiskMillis = (long) (limit.toMillis() * sla.getAtRiskFraction());
        return remaining.toMillis() <= atRiskMillis ? SlaStatus.AT_RISK : SlaStatus.ON_TRACK;
    }
}
