package com.fixfleet.orchestrator.tracking;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.Issue;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.ScanRun;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Folds the scan history of each repo into one {@link TrackedIssue} per fingerprint.
 *
 * Base status per fingerprint:
 *   present in the repo's latest scan and seen before      → RECURRING
 *   present, and the repo has older pre-fingerprint scans  → RECURRING  (legacy rule)
 *   present otherwise                                      → NEW
 *   absent from the latest scan                            → FIXED
 *
 * The legacy rule exists because findings from scans recorded before
 * fingerprinting cannot be matched, so a first fingerprinted sighting may
 * well be a repeat.
 */
@Component
public class IssueHistoryAggregator {

    private final boolean legacyScansImplyRecurring;

    @Autowired
    public IssueHistoryAggregator(OrchestratorProperties properties) {
        this(properties.isLegacyScansImplyRecurring());
    }

    public IssueHistoryAggregator(boolean legacyScansImplyRecurring) {
        this.legacyScansImplyRecurring = legacyScansImplyRecurring;
    }

    /**
     * @param scans  every scan of the repos of interest (any order)
     * @param issues every finding of those scans (any order)
     * @return tracked issues ordered by repo, then first sighting, then fingerprint
     */
    public List<TrackedIssue> aggregate(Collection<ScanRun> scans, Collection<Issue> issues) {
        Map<String, List<ScanRun>> scansByRepo = scans.stream()
                .collect(Collectors.groupingBy(ScanRun::getRepoUrl, LinkedHashMap::new, Collectors.toList()));
        Map<String, List<Issue>> issuesByRepo = issues.stream()
                .collect(Collectors.groupingBy(Issue::getRepoUrl, LinkedHashMap::new, Collectors.toList()));

        List<TrackedIssue> result = new ArrayList<>();
        for (Map.Entry<String, List<Issue>> e : issuesByRepo.entrySet()) {
            List<ScanRun> repoScans = scansByRepo.getOrDefault(e.getKey(), List.of());
            result.addAll(aggregateRepo(repoScans, e.getValue()));
        }
        result.sort(Comparator.comparing(TrackedIssue::repoUrl)
                .thenComparing(TrackedIssue::firstSeen)
                .thenComparing(TrackedIssue::fingerprint));
        return result;
    }

    private List<TrackedIssue> aggregateRepo(List<ScanRun> repoScans, List<Issue> repoIssues) {
        // Latest fingerprinted scan; a legacy summary carries no findings to compare against.
        Optional<Instant> latestFromScans = repoScans.stream()
                .filter(ScanRun::isFingerprinted)
                .map(ScanRun::getScannedAt)
                .max(Comparator.naturalOrder());
        Instant latestScan = latestFromScans.orElseGet(() -> repoIssues.stream()
                .map(Issue::getScanTimestamp)
                .max(Comparator.naturalOrder())
                .orElseThrow());

        List<Instant> legacyScanTimes = repoScans.stream()
                .filter(s -> !s.isFingerprinted() && s.getIssueCount() > 0)
                .map(ScanRun::getScannedAt)
                .toList();

        Map<String, List<Issue>> byFingerprint = repoIssues.stream()
                .sorted(Comparator.comparing(Issue::getScanTimestamp))
                .collect(Collectors.groupingBy(Issue::getFingerprint, LinkedHashMap::new, Collectors.toList()));

        List<TrackedIssue> tracked = new ArrayList<>(byFingerprint.size());
        for (Map.Entry<String, List<Issue>> e : byFingerprint.entrySet()) {
            List<Issue> sightings = e.getValue();
            Issue latest = sightings.get(sightings.size() - 1);

            Set<Instant> scanTimes = new HashSet<>();
            sightings.forEach(i -> scanTimes.add(i.getScanTimestamp()));
            int appearances = scanTimes.size();
            Instant firstSeen = sightings.get(0).getScanTimestamp();
            Instant lastSeen  = latest.getScanTimestamp();
            boolean inLatest  = lastSeen.equals(latestScan);

            boolean legacyBefore = legacyScansImplyRecurring
                    && legacyScanTimes.stream().anyMatch(t -> t.isBefore(firstSeen));

            IssueState base;
            if (!inLatest) {
                base = IssueState.FIXED;
            } else if (appearances > 1 || legacyBefore) {
                base = IssueState.RECURRING;
            } else {
                base = IssueState.NEW;
            }

            tracked.add(new TrackedIssue(
                    e.getKey(), latest.getRepoUrl(), latest.getRuleId(), latest.getSeverityTier(),
                    latest.getCweFamily(), latest.getFile(), latest.getStartLine(), latest.getMessage(),
                    appearances, firstSeen, lastSeen, inLatest, base));
        }
        return tracked;
    }
}
