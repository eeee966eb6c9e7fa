package com.fixfleet.orchestrator.api;

import com.fixfleet.orchestrator.dispatch.DispatchPlan;
import com.fixfleet.orchestrator.dispatch.PlanEntry;
import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.IssueState;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.SessionStatus;
import com.fixfleet.orchestrator.model.SeverityTier;
import com.fixfleet.orchestrator.scoring.SlaStatus;
import com.fixfleet.orchestrator.service.CycleReport;
import com.fixfleet.orchestrator.service.CycleStatus;
import com.fixfleet.orchestrator.service.FingerprintHistory;
import com.fixfleet.orchestrator.service.OrchestratorService;
import com.fixfleet.orchestrator.state.CycleAlreadyRunningException;
import com.fixfleet.orchestrator.state.StateStoreException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static com.fixfleet.orchestrator.Fixtures.issue;
import static com.fixfleet.orchestrator.Fixtures.session;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for OrchestratorController: web layer only, service mocked.
 */
@WebMvcTest(OrchestratorController.class)
class OrchestratorControllerTest {

    private static final String API = "https://github.com/acme/api";

    @Autowired   MockMvc             mockMvc;
    @MockitoBean OrchestratorService orchestrator;

    // ------------------------------------------------------------------
    // GET /orchestrator/plan
    // ------------------------------------------------------------------

    @Test
    void plan_returnsEntriesInDispatchOrder() throws Exception {
        PlanEntry dispatched = new PlanEntry(issue("fp-crit", API, SeverityTier.CRITICAL, "injection"),
                IssueState.NEW, 0.81, SlaStatus.AT_RISK, true, null);
        PlanEntry capped = new PlanEntry(issue("fp-low", API, SeverityTier.LOW, "xss"),
                IssueState.NEW, 0.4, SlaStatus.ON_TRACK, true, PlanEntry.REPO_CYCLE_LIMIT);
        when(orchestrator.plan(API)).thenReturn(new DispatchPlan(List.of(dispatched, capped), List.of(), List.of()));

        mockMvc.perform(get("/orchestrator/plan").param("repo", API))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].issue.fingerprint").value("fp-crit"))
                .andExpect(jsonPath("$[0].wave").value("critical"))
                .andExpect(jsonPath("$[0].sla").value("at-risk"))
                .andExpect(jsonPath("$[0].state").value("new"))
                .andExpect(jsonPath("$[1].skipReason").value("repo_cycle_limit"));
    }

    // ------------------------------------------------------------------
    // POST /orchestrator/cycle
    // ------------------------------------------------------------------

    @Test
    void cycle_returnsReport() throws Exception {
        CycleReport report = new CycleReport("cycle-1", CycleStatus.COMPLETED, null, NOW, NOW,
                List.of(), 3, 1, 0, 0, false, null, List.of(), null);
        when(orchestrator.cycle(null)).thenReturn(report);

        mockMvc.perform(post("/orchestrator/cycle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycleId").value("cycle-1"))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.dispatchedCount").value(3));
    }

    @Test
    void cycle_alreadyRunning_returns409() throws Exception {
        when(orchestrator.cycle(null)).thenThrow(new CycleAlreadyRunningException("cycle already running"));

        mockMvc.perform(post("/orchestrator/cycle"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("cycle already running"));
    }

    @Test
    void cancel_runningCycle_returns202() throws Exception {
        when(orchestrator.cancel()).thenReturn(true);

        mockMvc.perform(post("/orchestrator/cycle/cancel"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.cancelled").value(true));
    }

    @Test
    void cancel_noCycle_returns409() throws Exception {
        when(orchestrator.cancel()).thenReturn(false);

        mockMvc.perform(post("/orchestrator/cycle/cancel"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("no cycle running"));
    }

    // ------------------------------------------------------------------
    // GET /orchestrator/status, /dispatch-history
    // ------------------------------------------------------------------

    @Test
    void status_stateStoreDown_returns503() throws Exception {
        when(orchestrator.status()).thenThrow(new StateStoreException("Failed to load orchestrator state"));

        mockMvc.perform(get("/orchestrator/status"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Failed to load orchestrator state"));
    }

    @Test
    void dispatchHistory_known_returnsSessions() throws Exception {
        DispatchHistoryEntry entry = new DispatchHistoryEntry("fp1");
        entry.recordDispatch("s1", NOW);
        when(orchestrator.dispatchHistory("fp1")).thenReturn(Optional.of(new FingerprintHistory(entry,
                List.of(session("s1", "xss", SessionStatus.RUNNING, PullRequestState.NONE, "fp1")), List.of())));

        mockMvc.perform(get("/orchestrator/dispatch-history/{fp}", "fp1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.history.lastSessionId").value("s1"))
                .andExpect(jsonPath("$.history.lastOutcome").value("PENDING"))
                .andExpect(jsonPath("$.sessions[0].status").value("RUNNING"));
    }

    @Test
    void dispatchHistory_unknown_returns404() throws Exception {
        when(orchestrator.dispatchHistory("nope")).thenReturn(Optional.empty());

        mockMvc.perform(get("/orchestrator/dispatch-history/{fp}", "nope"))
                .andExpect(status().isNotFound());
    }
}
