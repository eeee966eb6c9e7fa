package com.fixfleet.orchestrator.api.dto;

import com.fixfleet.orchestrator.model.VerificationRecord;

import java.time.Instant;
import java.util.UUID;

public record VerificationResponse(
        UUID    id,
        String  fingerprint,
        boolean resolved,
        String  prUrl,
        String  sessionId,
        Instant verifiedAt
) {
    public static VerificationResponse from(VerificationRecord v) {
        return new VerificationResponse(
                v.getId(), v.getFingerprint(), v.isResolved(), v.getPrUrl(), v.getSessionId(), v.getVerifiedAt());
    }
}
