package com.fixfleet.orchestrator.api.dto;

import java.time.Instant;

/**
 * Request body for POST /signals/verifications.
 * sessionId is optional; when present it must be the fingerprint's last session.
 */
public record VerificationRequest(
        String  fingerprint,
        boolean resolved,
        String  prUrl,
        String  sessionId,
        Instant verifiedAt
) {}
