package com.fixfleet.orchestrator.model;

import com.fixfleet.orchestrator.fingerprint.FingerprintTier;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One vulnerability finding in one scan.
 *
 * Immutable once ingested. repo_url and scan_timestamp are copied from the
 * owning ScanRun so history queries don't need the join.
 *
 * DB table: issues  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "issues")
public class Issue {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "scan_run_id", nullable = false)
    private ScanRun scanRun;

    @Column(nullable = false)
    private String fingerprint;

    @Enumerated(EnumType.STRING)
    @Column(name = "fingerprint_tier", nullable = false)
    private FingerprintTier fingerprintTier;

    @Column(name = "rule_id", nullable = false)
    private String ruleId;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity_tier", nullable = false)
    private SeverityTier severityTier;

    @Column(name = "cwe_family", nullable = false)
    private String cweFamily;

    @Column(name = "file_path")
    private String file;

    @Column(name = "start_line", nullable = false)
    private int startLine;

    @Column(columnDefinition = "TEXT")
    private String message;

    @Column(name = "repo_url", nullable = false)
    private String repoUrl;

    @Column(name = "scan_timestamp", nullable = false)
    private Instant scanTimestamp;

    protected Issue() {}   // required by JPA

    public Issue(ScanRun scanRun,
                 String fingerprint,
                 FingerprintTier fingerprintTier,
                 String ruleId,
                 SeverityTier severityTier,
                 String cweFamily,
                 String file,
                 int startLine,
                 String message) {
        this.scanRun         = scanRun;
        this.fingerprint     = fingerprint;
        this.fingerprintTier = fingerprintTier;
        this.ruleId          = ruleId;
        this.severityTier    = severityTier;
        this.cweFamily       = cweFamily;
        this.file            = file;
        this.startLine       = startLine;
        this.message         = message;
        this.repoUrl         = scanRun.getRepoUrl();
        this.scanTimestamp   = scanRun.getScannedAt();
    }

    public UUID            getId()              { return id; }
    public ScanRun         getScanRun()         { return scanRun; }
    public String          getFingerprint()     { return fingerprint; }
    public FingerprintTier getFingerprintTier() { return fingerprintTier; }
    public String          getRuleId()          { return ruleId; }
    public SeverityTier    getSeverityTier()    { return severityTier; }
    public String          getCweFamily()       { return cweFamily; }
    public String          getFile()            { return file; }
    public int             getStartLine()       { return startLine; }
    public String          getMessage()         { return message; }
    public String          getRepoUrl()         { return repoUrl; }
    public Instant         getScanTimestamp()   { return scanTimestamp; }
}
