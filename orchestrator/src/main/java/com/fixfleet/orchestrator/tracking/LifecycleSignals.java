package com.fixfleet.orchestrator.tracking;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.VerificationRecord;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything besides scans that moves an issue through its lifecycle:
 * dispatch history, agent sessions (with their PRs) and verification results.
 */
public class LifecycleSignals {

    private final Map<String, DispatchHistoryEntry> history;
    private final Map<String, AgentSession>         sessionsById;
    private final Map<String, VerificationRecord>   latestVerification;

    private LifecycleSignals(Map<String, DispatchHistoryEntry> history,
                             Map<String, AgentSession> sessionsById,
                             Map<String, VerificationRecord> latestVerification) {
        this.history            = history;
        this.sessionsById       = sessionsById;
        this.latestVerification = latestVerification;
    }

    public static LifecycleSignals of(Map<String, DispatchHistoryEntry> history,
                                      Collection<AgentSession> sessions,
                                      Collection<VerificationRecord> verifications) {
        Map<String, AgentSession> byId = new HashMap<>();
        sessions.forEach(s -> byId.put(s.getSessionId(), s));

        Map<String, VerificationRecord> latest = new HashMap<>();
        verifications.stream()
                .sorted(Comparator.comparing(VerificationRecord::getVerifiedAt))
                .forEach(v -> latest.put(v.getFingerprint(), v));

        return new LifecycleSignals(history, byId, latest);
    }

    public static LifecycleSignals none() {
        return new LifecycleSignals(Map.of(), Map.of(), Map.of());
    }

    public Optional<DispatchHistoryEntry> history(String fingerprint) {
        return Optional.ofNullable(history.get(fingerprint));
    }

    public Optional<AgentSession> session(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessionsById.get(sessionId));
    }

    public Optional<VerificationRecord> latestVerification(String fingerprint) {
        return Optional.ofNullable(latestVerification.get(fingerprint));
    }

    public Map<String, DispatchHistoryEntry> historyByFingerprint() {
        return history;
    }
}
