package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.model.DispatchHistoryEntry;

import java.time.Instant;

public record HistoryEntryResponse(
        String  fingerprint,
        int     dispatchCount,
        Instant lastDispatched,
        String  lastSessionId,
        String  lastOutcome,
        int     consecutiveFailures,
        Instant updatedAt
) {
    public static HistoryEntryResponse from(DispatchHistoryEntry e) {
        return new HistoryEntryResponse(
                e.getFingerprint(),
                e.getDispatchCount(),
                e.getLastDispatched(),
                e.getLastSessionId(),
                e.getLastOutcome().name(),
                e.getConsecutiveFailures(),
                e.getUpdatedAt()
        );
    }
}
