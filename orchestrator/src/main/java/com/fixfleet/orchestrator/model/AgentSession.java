package com.fixfleet.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One agent session created by the dispatcher for a batch of findings.
 *
 * Mirrors what the agent platform reports about the session (status, PR)
 * plus what we know about the batch (repo, CWE family, severity, fingerprints).
 * Sessions are the source of the session / PR signals consumed by the
 * lifecycle tracker and of the per-family fix rates used in scoring.
 *
 * Versioned: PR webhooks update rows while a cycle polls its own copy.
 *
 * DB tables: agent_sessions, session_fingerprints  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "agent_sessions")
public class AgentSession {

    @Id
    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    @Version
    @Column(nullable = false)
    private Long version;   // null until first insert

    @Column(name = "session_url")
    private String sessionUrl;

    @Column(name = "repo_url", nullable = false)
    private String repoUrl;

    @Column(name = "cwe_family", nullable = false)
    private String cweFamily;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity_tier", nullable = false)
    private SeverityTier severityTier;

    @Column(name = "cycle_id")
    private String cycleId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.CREATED;

    @Column(name = "pr_url")
    private String prUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "pr_state", nullable = false)
    private PullRequestState prState = PullRequestState.NONE;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "session_fingerprints", joinColumns = @JoinColumn(name = "session_id"))
    @Column(name = "fingerprint", nullable = false)
    private Set<String> fingerprints = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected AgentSession() {}   // required by JPA

    public AgentSession(String sessionId,
                        String sessionUrl,
                        String repoUrl,
                        String cweFamily,
                        SeverityTier severityTier,
                        String cycleId,
                        Set<String> fingerprints,
                        Instant createdAt) {
        this.sessionId    = sessionId;
        this.sessionUrl   = sessionUrl;
        this.repoUrl      = repoUrl;
        this.cweFamily    = cweFamily;
        this.severityTier = severityTier;
        this.cycleId      = cycleId;
        this.fingerprints = new LinkedHashSet<>(fingerprints);
        this.createdAt    = createdAt;
        this.updatedAt    = createdAt;
    }

    // ------------------------------------------------------------------
    // Signal application
    // ------------------------------------------------------------------

    /**
     * Apply a status poll result. A PR reference, once seen, moves the PR to OPEN
     * unless we already know a later state for it.
     *
     * @return true if anything changed
     */
    public boolean applyStatus(SessionStatus newStatus, String newPrUrl, Instant now) {
        boolean changed = false;
        if (newStatus != null && newStatus != status) {
            status  = newStatus;
            changed = true;
        }
        if (newPrUrl != null && !newPrUrl.isBlank() && !newPrUrl.equals(prUrl)) {
            prUrl = newPrUrl;
            if (prState == PullRequestState.NONE) prState = PullRequestState.OPEN;
            changed = true;
        }
        if (changed) updatedAt = now;
        return changed;
    }

    public boolean applyPullRequestState(PullRequestState newState, Instant now) {
        if (newState == null || newState == prState) return false;
        prState   = newState;
        updatedAt = now;
        return true;
    }

    /** Overwrite this copy with the stored row, version included. */
    public void copyFrom(AgentSession stored) {
        this.version   = stored.version;
        this.status    = stored.status;
        this.prUrl     = stored.prUrl;
        this.prState   = stored.prState;
        this.updatedAt = stored.updatedAt;
    }

    /**
     * Move this copy onto a newer stored row and keep what this copy learned
     * on top of it. Status only moves forward, so a terminal stored status
     * wins; a merged or closed PR state from a webhook wins over OPEN.
     */
    public void rebaseOnto(AgentSession stored) {
        SessionStatus    localStatus  = status;
        String           localPrUrl   = prUrl;
        PullRequestState localPrState = prState;
        Instant          localUpdated = updatedAt;

        copyFrom(stored);
        if (!status.isTerminal()) status = localStatus;
        if (prUrl == null) prUrl = localPrUrl;
        if (!isResolved(prState) && localPrState != PullRequestState.NONE) prState = localPrState;
        if (localUpdated != null && (updatedAt == null || localUpdated.isAfter(updatedAt))) updatedAt = localUpdated;
    }

    private static boolean isResolved(PullRequestState state) {
        return state == PullRequestState.MERGED || state == PullRequestState.CLOSED;
    }

    /** Still being worked on by the agent. */
    public boolean isActive() {
        return !status.isTerminal();
    }

    /**
     * The session produced a usable fix: it finished with a PR that was not
     * closed unmerged, or its PR was merged.
     */
    public boolean producedFix() {
        if (prState == PullRequestState.MERGED) return true;
        return status == SessionStatus.FINISHED
                && prUrl != null && !prUrl.isBlank()
                && prState != PullRequestState.CLOSED;
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public String           getSessionId()    { return sessionId; }
    public Long             getVersion()      { return version; }
    public String           getSessionUrl()   { return sessionUrl; }
    public String           getRepoUrl()      { return repoUrl; }
    public String           getCweFamily()    { return cweFamily; }
    public SeverityTier     getSeverityTier() { return severityTier; }
    public String           getCycleId()      { return cycleId; }
    public SessionStatus    getStatus()       { return status; }
    public String           getPrUrl()        { return prUrl; }
    public PullRequestState getPrState()      { return prState; }
    public Set<String>      getFingerprints() { return fingerprints; }
    public Instant          getCreatedAt()    { return createdAt; }
    public Instant          getUpdatedAt()    { return updatedAt; }
}
