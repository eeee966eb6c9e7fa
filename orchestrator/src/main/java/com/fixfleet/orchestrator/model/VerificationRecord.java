package com.fixfleet.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One verification result for one fingerprint: after a fix PR lands, the
 * verification pass rescans and reports whether the finding is gone.
 *
 * DB table: verifications  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "verifications")
public class VerificationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false)
    private String fingerprint;

    @Column(nullable = false)
    private boolean resolved;

    @Column(name = "pr_url")
    private String prUrl;

    @Column(name = "session_id")
    private String sessionId;

    @Column(name = "verified_at", nullable = false)
    private Instant verifiedAt;

    protected VerificationRecord() {}   // required by JPA

    public VerificationRecord(String fingerprint, boolean resolved, String prUrl,
                              String sessionId, Instant verifiedAt) {
        this.fingerprint = fingerprint;
        this.resolved    = resolved;
        this.prUrl       = prUrl;
        this.sessionId   = sessionId;
        this.verifiedAt  = verifiedAt;
    }

    public UUID    getId()          { return id; }
    public String  getFingerprint() { return fingerprint; }
    public boolean isResolved()     { return resolved; }
    public String  getPrUrl()       { return prUrl; }
    public String  getSessionId()   { return sessionId; }
    public Instant getVerifiedAt()  { return verifiedAt; }
}
