package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.model.AgentSession;

import java.time.Instant;
import java.util.List;

public record SessionResponse(
        String       sessionId,
        String       sessionUrl,
        String       repoUrl,
        String       cweFamily,
        String       severity,
        String       cycleId,
        String       status,
        String       prUrl,
        String       prState,
        List<String> fingerprints,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static SessionResponse from(AgentSession s) {
        return new SessionResponse(
                s.getSessionId(),
                s.getSessionUrl(),
                s.getRepoUrl(),
                s.getCweFamily(),
                s.getSeverityTier().label(),
                s.getCycleId(),
                s.getStatus().name(),
                s.getPrUrl(),
                s.getPrState().name(),
                List.copyOf(s.getFingerprints()),
                s.getCreatedAt(),
                s.getUpdatedAt()
        );
    }
}
