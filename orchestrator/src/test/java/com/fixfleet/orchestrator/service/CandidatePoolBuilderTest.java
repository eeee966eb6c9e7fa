package com.fixfleet.orchestrator.service;

import com.fixfleet.orchestrator.model.OrchestratorMeta;
import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;
import com.fixfleet.orchestrator.repository.IssueRepository;
import com.fixfleet.orchestrator.repository.ScanRunRepository;
import com.fixfleet.orchestrator.repository.VerificationRepository;
import com.fixfleet.orchestrator.state.OrchestratorState;
import com.fixfleet.orchestrator.state.StateStoreException;
import com.fixfleet.orchestrator.tracking.IssueHistoryAggregator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

/** Database failures while building the candidate pool. */
@ExtendWith(MockitoExtension.class)
class CandidatePoolBuilderTest {

    private static final String API = "https://github.com/acme/api";

    @Mock ScanRunRepository      scanRepo;
    @Mock IssueRepository        issueRepo;
    @Mock VerificationRepository verificationRepo;

    private CandidatePoolBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new CandidatePoolBuilder(scanRepo, issueRepo, verificationRepo, new IssueHistoryAggregator(true));
    }

    @Test
    void trackedIssues_issueTableUnreachable_throwsStateStoreException() {
        when(scanRepo.findAllByOrderByRepoUrlAscScannedAtAsc()).thenReturn(List.of());
        when(issueRepo.findAllByOrderByScanTimestampAsc())
                .thenThrow(new DataAccessResourceFailureException("issues table unreachable"));

        assertThatThrownBy(() -> builder.trackedIssues(null))
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("scan history")
                .hasRootCauseMessage("issues table unreachable");
    }

    @Test
    void trackedIssues_oneRepo_readsOnlyThatRepo() {
        when(scanRepo.findByRepoUrlOrderByScannedAtAsc(API)).thenReturn(List.of());
        when(issueRepo.findByRepoUrlOrderByScanTimestampAsc(API)).thenReturn(List.of());

        assertThat(builder.trackedIssues(API)).isEmpty();
    }

    @Test
    void signals_verificationTableUnreachable_throwsStateStoreException() {
        OrchestratorState state = new OrchestratorState(List.of(), List.of(),
                RateLimiterWindow.empty(20, 24), new OrchestratorMeta());
        when(verificationRepo.findAllByOrderByVerifiedAtAsc())
                .thenThrow(new DataAccessResourceFailureException("connection reset"));

        assertThatThrownBy(() -> builder.signals(state))
                .isInstanceOf(StateStoreException.class)
                .hasMessageContaining("verifications");
    }
}
