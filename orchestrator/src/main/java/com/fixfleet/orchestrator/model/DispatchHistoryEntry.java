package com.fixfleet.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Long-lived dispatch record for one fingerprint.
 *
 * Created on the first dispatch, updated after every dispatch attempt and
 * every resolution signal, never deleted (audit trail).
 *
 * consecutive_failures resets to 0 on VERIFIED and grows by one per failed
 * attempt. A signal that belongs to an older session than last_session_id is
 * ignored, and a session can only fail once.
 *
 * Signals write rows while a cycle holds an older copy, so the row is
 * versioned and the state store rebases a stale copy instead of overwriting.
 *
 * DB table: dispatch_history  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "dispatch_history")
public class DispatchHistoryEntry {

    @Id
    @Column(nullable = false, updatable = false)
    private String fingerprint;

    @Version
    @Column(nullable = false)
    private Long version;   // null until first insert

    @Column(name = "dispatch_count", nullable = false)
    private int dispatchCount = 0;

    @Column(name = "last_dispatched")
    private Instant lastDispatched;

    @Column(name = "last_session_id")
    private String lastSessionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_outcome", nullable = false)
    private DispatchOutcome lastOutcome = DispatchOutcome.UNKNOWN;

    @Column(name = "consecutive_failures", nullable = false)
    private int consecutiveFailures = 0;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected DispatchHistoryEntry() {}   // required by JPA

    public DispatchHistoryEntry(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** A session was created for this fingerprint. */
    public void recordDispatch(String sessionId, Instant now) {
        dispatchCount++;
        lastDispatched = now;
        lastSessionId  = sessionId;
        lastOutcome    = DispatchOutcome.PENDING;
        updatedAt      = now;
    }

    /**
     * Apply a resolution signal.
     *
     * @param sessionId session the signal belongs to, or null when the signal is
     *                  keyed by fingerprint only (verification feed)
     * @return true if the entry changed
     */
    public boolean recordOutcome(String sessionId, DispatchOutcome outcome, Instant now) {
        if (sessionId != null && lastSessionId != null && !sessionId.equals(lastSessionId)) {
            return false;   // stale: belongs to an earlier attempt
        }
        switch (outcome) {
            case VERIFIED -> {
                lastOutcome = DispatchOutcome.VERIFIED;
                consecutiveFailures = 0;
            }
            case PR_MERGED -> {
                if (lastOutcome != DispatchOutcome.PENDING) return false;
                lastOutcome = DispatchOutcome.PR_MERGED;
            }
            case PR_FAILED, UNKNOWN -> {
                if (lastOutcome != DispatchOutcome.PENDING && lastOutcome != DispatchOutcome.PR_MERGED) {
                    return false;
                }
                lastOutcome = outcome;
                consecutiveFailures++;
            }
            case PENDING -> {
                return false;
            }
        }
        updatedAt = now;
        return true;
    }

    /** True when the attempt recorded in last_session_id has not been resolved yet. */
    public boolean isAttemptLive() {
        return lastOutcome == DispatchOutcome.PENDING || lastOutcome == DispatchOutcome.PR_MERGED;
    }

    public boolean needsHumanReview(int maxDispatchAttempts) {
        return consecutiveFailures >= maxDispatchAttempts;
    }

    /** Overwrite this copy with the stored row, version included. */
    public void copyFrom(DispatchHistoryEntry stored) {
        this.version             = stored.version;
        this.dispatchCount       = stored.dispatchCount;
        this.lastDispatched      = stored.lastDispatched;
        this.lastSessionId       = stored.lastSessionId;
        this.lastOutcome         = stored.lastOutcome;
        this.consecutiveFailures = stored.consecutiveFailures;
        this.updatedAt           = stored.updatedAt;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String          getFingerprint()         { return fingerprint; }
    public Long            getVersion()             { return version; }
    public int             getDispatchCount()       { return dispatchCount; }
    public Instant         getLastDispatched()      { return lastDispatched; }
    public String          getLastSessionId()       { return lastSessionId; }
    public DispatchOutcome getLastOutcome()         { return lastOutcome; }
    public int             getConsecutiveFailures() { return consecutiveFailures; }
    public Instant         getUpdatedAt()           { return updatedAt; }
}
