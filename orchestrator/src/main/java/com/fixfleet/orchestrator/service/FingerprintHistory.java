package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.VerificationRecord;

import java.util.List;

/** Dispatch history of one fingerprint with the sessions and verifications behind it. */
public record FingerprintHistory(
        DispatchHistoryEntry entry,
        List<AgentSession> sessions,
        List<VerificationRecord> verifications
) {}
