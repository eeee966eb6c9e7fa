package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.state.RateWindowSnapshot;

import java.time.Instant;
import java.util.List;

/** Snapshot of the whole durable state, taken from one load. */
public record StateExport(
        Instant exportedAt,
        List<DispatchHistoryEntry> history,
        List<AgentSession> sessions,
        RateWindowSnapshot rateWindow,
        String lastCycleId,
        Instant lastCycleAt,
        String lastCycleStatus
) {}
