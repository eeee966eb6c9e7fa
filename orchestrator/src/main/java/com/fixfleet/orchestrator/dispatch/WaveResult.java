package com.fixfleet.orchestrator.dispatch;

import com.fixfleet.orchestrator.model.SeverityTier;

import java.util.List;

/**
 * Outcome of one wave.
 *
 * fixRate is fixed / created, or null when the wave created nothing (no
 * evidence either way, so it never halts the cycle). notExecuted marks a wave
 * that was skipped because an earlier wave halted or the cycle was cancelled.
 */
public record WaveResult(
        SeverityTier severity,
        List<BatchResult> batches,
        int created,
        int fixed,
        int creationFailures,
        int deferred,
        Double fixRate,
        boolean timedOut,
        boolean notExecuted
) {
    public WaveResult {
        batches = List.copyOf(batches);
    }

    public static WaveResult notExecuted(Wave wave) {
        return new WaveResult(wave.severity(),
                wave.batches().stream().map(BatchResult::skipped).toList(),
                0, 0, 0, 0, null, false, true);
    }
}
