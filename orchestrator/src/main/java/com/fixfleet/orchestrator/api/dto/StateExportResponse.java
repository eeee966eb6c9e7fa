package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.service.StateExport;
import com.fixfleet.orchestrator.state.RateWindowSnapshot;

import java.time.Instant;
import java.util.List;

/** Response body for GET /orchestrator/state/export. */
public record StateExportResponse(
        Instant                    exportedAt,
        List<HistoryEntryResponse> history,
        List<SessionResponse>      sessions,
        RateWindowSnapshot         rateWindow,
        String                     lastCycleId,
        Instant                    lastCycleAt,
        String                     lastCycleStatus
) {
    public static StateExportResponse from(StateExport export) {
        return new StateExportResponse(
                export.exportedAt(),
                export.history().stream().map(HistoryEntryResponse::from).toList(),
                export.sessions().stream().map(SessionResponse::from).toList(),
                export.rateWindow(),
                export.lastCycleId(),
                export.lastCycleAt(),
                export.lastCycleStatus()
        );
    }
}
