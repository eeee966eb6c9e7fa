package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.fingerprint.CweFamilies;
import com.fixfleet.orchestrator.fingerprint.Fingerprint;
import com.fixfleet.orchestrator.fingerprint.FingerprintEngine;
import com.fixfleet.orchestrator.fingerprint.RawFinding;
import com.fixfleet.orchestrator.model.Issue;
import com.fixfleet.orchestrator.model.ScanRun;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.repository.ScanRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Persists analyzer runs as {@link ScanRun}s with fingerprinted {@link Issue}s.
 *
 * A fingerprint appears at most once per scan: later duplicates are dropped
 * with a warning. Findings without a usable severity are rejected the same way.
 */
@Service
public class ScanIngestService {

    private static final Logger log = LoggerFactory.getLogger(ScanIngestService.class);

    private final ScanRunRepository scanRepo;
    private final FingerprintEngine fingerprints;
    private final Clock             clock;

    public ScanIngestService(ScanRunRepository scanRepo, FingerprintEngine fingerprints, Clock clock) {
        this.scanRepo     = scanRepo;
        this.fingerprints = fingerprints;
        this.clock        = clock;
    }

    /**
     * @throws IllegalArgumentException if repoUrl is missing
     */
    @Transactional
    public ScanIngestResult ingest(ScanSubmission submission) {
        if (submission.repoUrl() == null || submission.repoUrl().isBlank()) {
            throw new IllegalArgumentException("repo_url is required");
        }
        Instant scannedAt = submission.scannedAt() != null ? submission.scannedAt() : clock.instant();
        ScanRun scan = new ScanRun(submission.repoUrl(), submission.runLabel(), scannedAt, submission.fingerprinted());
        List<String> warnings = new ArrayList<>();

        if (!submission.fingerprinted()) {
            int count = submission.issueCount() != null ? Math.max(submission.issueCount(), 0) : 0;
            scan.setIssueCount(count);
            if (!submission.findings().isEmpty()) {
                warnings.add("legacy scan: " + submission.findings().size() + " finding(s) ignored");
            }
            ScanRun saved = scanRepo.save(scan);
            log.info("Legacy scan recorded for {} ({} issue(s))", submission.repoUrl(), count);
            return new ScanIngestResult(saved.getId(), saved.getRepoUrl(), count, 0, 0, warnings);
        }

        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        int rejected   = 0;
        for (ScanSubmission.Finding f : submission.findings()) {
            SeverityTier severity = severityOf(f);
            if (severity == null) {
                rejected++;
                warnings.add("finding " + f.ruleId() + " at " + f.file() + ":" + f.startLine()
                        + " has no usable severity, rejected");
                continue;
            }

            Fingerprint fp = fingerprints.fingerprint(new RawFinding(
                    f.ruleId(), f.file(), f.startLine(), f.message(), f.partialFingerprints(), f.snippet()));
            if (!seen.add(fp.value())) {
                duplicates++;
                warnings.add("duplicate fingerprint " + fp.value() + " (" + f.ruleId() + ") dropped");
                continue;
            }

            scan.addIssue(new Issue(scan, fp.value(), fp.tier(),
                    f.ruleId() == null ? "" : f.ruleId(),
                    severity,
                    familyOf(f),
                    f.file(),
                    f.startLine() == null ? 0 : f.startLine(),
                    f.message()));
        }
        if (duplicates > 0) {
            log.warn("Dropped {} duplicate finding(s) in scan of {}", duplicates, submission.repoUrl());
        }

        ScanRun saved = scanRepo.save(scan);
        log.info("Scan recorded for {}: {} issue(s), {} duplicate(s), {} rejected",
                saved.getRepoUrl(), saved.getIssueCount(), duplicates, rejected);
        return new ScanIngestResult(saved.getId(), saved.getRepoUrl(), saved.getIssueCount(),
                duplicates, rejected, warnings);
    }

    static SeverityTier severityOf(ScanSubmission.Finding f) {
        SeverityTier tier = SeverityTier.parse(f.severityTier());
        if (tier != null) return tier;
        if (f.cvssScore() != null && f.cvssScore() > 0) {
            return SeverityTier.fromCvss(f.cvssScore());
        }
        String level = f.level() == null ? "" : f.level().toLowerCase(Locale.ROOT);
        return switch (level) {
            case "error"   -> SeverityTier.HIGH;
            case "warning" -> SeverityTier.MEDIUM;
            default        -> null;
        };
    }

    static String familyOf(ScanSubmission.Finding f) {
        if (f.cweFamily() != null && !f.cweFamily().isBlank()) {
            return f.cweFamily().trim().toLowerCase(Locale.ROOT);
        }
        return CweFamilies.familyOf(f.cweTags());
    }
}
