package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.registry.RepoRegistry;
import com.fixfleet.orchestrator.scoring.FixLearning;
import com.fixfleet.orchestrator.state.OrchestratorState;

import java.util.function.BooleanSupplier;

/**
 * Per-cycle collaborators of {@link WaveDispatcher#execute}.
 *
 * @param afterWave called after each executed wave to renew the cycle lease;
 *                  false means the lease is gone and no further wave may run
 */
public record ExecutionContext(
        String cycleId,
        OrchestratorState state,
        RepoRegistry registry,
        FixLearning fixLearning,
        CycleCancellation cancellation,
        BooleanSupplier afterWave
) {}
