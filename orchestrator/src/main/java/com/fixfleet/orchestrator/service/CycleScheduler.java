package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.state.CycleAlreadyRunningException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs an unattended fleet-wide cycle on the configured cron.
 *
 * A cycle already running (API trigger, another instance) is not an error:
 * the tick is skipped and the next one tries again.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "fixfleet.orchestrator.scheduler", name = "enabled",
        havingValue = "true", matchIfMissing = true)
public class CycleScheduler {

    private static final Logger log = LoggerFactory.getLogger(CycleScheduler.class);

    private final OrchestratorService orchestrator;

    public CycleScheduler(OrchestratorService orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Scheduled(cron = "${fixfleet.orchestrator.scheduler.cycle-cron:0 0 */6 * * *}")
    public void tick() {
        try {
            CycleReport report = orchestrator.cycle(null);
            if (report.status() == CycleStatus.FAILED) {
                log.error("Scheduled cycle {} failed: {}", report.cycleId(), report.error());
            }
        } catch (CycleAlreadyRunningException e) {
            log.info("Scheduled cycle skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled cycle crashed: {}", e.getMessage(), e);
        }
    }
}
