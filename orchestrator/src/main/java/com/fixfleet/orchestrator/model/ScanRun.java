package com.fixfleet.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One analyzer scan of one repository.
 *
 * Scans are append-only: a later scan of the same repo supersedes this one
 * for lifecycle purposes but never replaces it.
 *
 * fingerprinted = false marks a legacy scan recorded before fingerprint
 * support existed. Such scans only carry an issue count, no issues.
 *
 * DB table: scan_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "scan_runs")
public class ScanRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "repo_url", nullable = false)
    private String repoUrl;

    @Column(name = "run_label")
    private String runLabel;

    @Column(name = "scanned_at", nullable = false)
    private Instant scannedAt;

    @Column(name = "issue_count", nullable = false)
    private int issueCount;

    @Column(nullable = false)
    private boolean fingerprinted = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @OneToMany(mappedBy = "scanRun", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    private List<Issue> issues = new ArrayList<>();

    protected ScanRun() {}   // required by JPA

    public ScanRun(String repoUrl, String runLabel, Instant scannedAt, boolean fingerprinted) {
        this.repoUrl       = repoUrl;
        this.runLabel      = runLabel;
        this.scannedAt     = scannedAt;
        this.fingerprinted = fingerprinted;
    }

    public UUID        getId()            { return id; }
    public String      getRepoUrl()       { return repoUrl; }
    public String      getRunLabel()      { return runLabel; }
    public Instant     getScannedAt()     { return scannedAt; }
    public int         getIssueCount()    { return issueCount; }
    public boolean     isFingerprinted()  { return fingerprinted; }
    public Instant     getCreatedAt()     { return createdAt; }
    public List<Issue> getIssues()        { return issues; }

    public void setIssueCount(int issueCount) { this.issueCount = issueCount; }

    /** Attach a finding to this scan and keep issue_count in step. */
    public void addIssue(Issue issue) {
        issues.add(issue);
        issueCount = issues.size();
    }
}
