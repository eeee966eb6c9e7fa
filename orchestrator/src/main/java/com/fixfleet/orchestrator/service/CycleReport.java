package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.dispatch.BatchResult;
import com.fixfleet.orchestrator.dispatch.BatchStatus;
import com.fixfleet.orchestrator.dispatch.WaveResult;

import java.time.Instant;
import java.util.List;

/**
 * Structured result of one cycle. Every cycle produces one, including failed ones.
 *
 * dispatchedCount counts sessions created, deferredCount batches held back by
 * a limit, skippedCount issues that failed the skip predicate.
 */
public record CycleReport(
        String cycleId,
        CycleStatus status,
        String repoFilter,
        Instant startedAt,
        Instant finishedAt,
        List<WaveSummary> waves,
        int dispatchedCount,
        int skippedCount,
        int deferredCount,
        int creationFailures,
        boolean halted,
        String haltReason,
        List<String> warnings,
        String error
) {
    public CycleReport {
        waves    = waves == null ? List.of() : List.copyOf(waves);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /** Report for a cycle that stopped before (or while) dispatching. */
    public static CycleReport failed(String cycleId, String repoFilter, Instant startedAt, Instant finishedAt,
                                     List<WaveSummary> waves, List<String> warnings, String error) {
        int dispatched = waves == null ? 0 : waves.stream().mapToInt(WaveSummary::created).sum();
        return new CycleReport(cycleId, CycleStatus.FAILED, repoFilter, startedAt, finishedAt,
                waves, dispatched, 0, 0, 0, false, null, warnings, error);
    }

    /** Per-wave figures, without the batch payloads. */
    public record WaveSummary(
            String severity,
            int batches,
            int created,
            int fixed,
            int creationFailures,
            int deferred,
            Double fixRate,
            boolean timedOut,
            boolean notExecuted,
            List<String> sessionIds
    ) {
        public static WaveSummary from(WaveResult wave) {
            return new WaveSummary(
                    wave.severity().label(),
                    wave.batches().size(),
                    wave.created(),
                    wave.fixed(),
                    wave.creationFailures(),
                    wave.deferred(),
                    wave.fixRate(),
                    wave.timedOut(),
                    wave.notExecuted(),
                    wave.batches().stream()
                            .filter(b -> b.status() == BatchStatus.CREATED)
                            .map(BatchResult::sessionId)
                            .toList());
        }
    }
}
