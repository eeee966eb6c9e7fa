package com.fixfleet.orchestrator.dispatch;

import java.util.List;

/**
 * Everything {@link WaveDispatcher#execute} did in one cycle.
 */
public record ExecutionReport(
        List<WaveResult> waves,
        boolean halted,
        String haltReason,
        boolean cancelled,
        List<String> warnings
) {
    public ExecutionReport {
        waves    = List.copyOf(waves);
        warnings = List.copyOf(warnings);
    }

    public int created() {
        return waves.stream().mapToInt(WaveResult::created).sum();
    }

    public int creationFailures() {
        return waves.stream().mapToInt(WaveResult::creationFailures).sum();
    }

    public int deferred() {
        return waves.stream().mapToInt(WaveResult::deferred).sum();
    }

    /** Failed creations over attempted creations; 0 when nothing was attempted. */
    public double creationFailureRate() {
        int attempted = created() + creationFailures();
        return attempted == 0 ? 0.0 : (double) creationFailures() / attempted;
    }
}
