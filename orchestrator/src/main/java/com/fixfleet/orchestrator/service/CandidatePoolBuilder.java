package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.model.Issue;
import com.fixfleet.orchestrator.model.ScanRun;
import com.fixfleet.orchestrator.repository.IssueRepository;
import com.fixfleet.orchestrator.repository.ScanRunRepository;
import com.fixfleet.orchestrator.repository.VerificationRepository;
import com.fixfleet.orchestrator.state.OrchestratorState;
import com.fixfleet.orchestrator.state.StateStoreException;
import com.fixfleet.orchestrator.tracking.IssueHistoryAggregator;
import com.fixfleet.orchestrator.tracking.LifecycleSignals;
import com.fixfleet.orchestrator.tracking.TrackedIssue;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Reads scan history and signals from the database and folds them into
 * the inputs of planning: tracked issues plus their lifecycle signals.
 * Database failures surface as {@link StateStoreException}.
 */
@Component
public class CandidatePoolBuilder {

    private final ScanRunRepository      scanRepo;
    private final IssueRepository        issueRepo;
    private final VerificationRepository verificationRepo;
    private final IssueHistoryAggregator aggregator;

    public CandidatePoolBuilder(ScanRunRepository scanRepo,
                                IssueRepository issueRepo,
                                VerificationRepository verificationRepo,
                                IssueHistoryAggregator aggregator) {
        this.scanRepo         = scanRepo;
        this.issueRepo        = issueRepo;
        this.verificationRepo = verificationRepo;
        this.aggregator       = aggregator;
    }

    /**
     * @param repoUrl restrict to one repo, or null for the whole fleet
     */
    @Transactional(readOnly = true)
    public List<TrackedIssue> trackedIssues(String repoUrl) {
        List<ScanRun> scans;
        List<Issue>   issues;
        try {
            if (repoUrl == null || repoUrl.isBlank()) {
                scans  = scanRepo.findAllByOrderByRepoUrlAscScannedAtAsc();
                issues = issueRepo.findAllByOrderByScanTimestampAsc();
            } else {
                scans  = scanRepo.findByRepoUrlOrderByScannedAtAsc(repoUrl);
                issues = issueRepo.findByRepoUrlOrderByScanTimestampAsc(repoUrl);
            }
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to read scan history", e);
        }
        return aggregator.aggregate(scans, issues);
    }

    @Transactional(readOnly = true)
    public LifecycleSignals signals(OrchestratorState state) {
        try {
            return LifecycleSignals.of(state.history(), state.sessions().values(),
                    verificationRepo.findAllByOrderByVerifiedAtAsc());
        } catch (DataAccessException e) {
            throw new StateStoreException("Failed to read verifications", e);
        }
    }
}
