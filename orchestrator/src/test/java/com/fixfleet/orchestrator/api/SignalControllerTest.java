package com.fixfleet.orchestrator.api;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.SessionStatus;
import com.fixfleet.orchestrator.model.VerificationRecord;
import com.fixfleet.orchestrator.service.SignalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static com.fixfleet.orchestrator.Fixtures.session;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/** Web-layer tests for SignalController with the signal service mocked. */
@WebMvcTest(SignalController.class)
class SignalControllerTest {

    private static final String PR = "https://github.com/acme/api/pull/7";

    @Autowired   MockMvc       mockMvc;
    @MockitoBean SignalService signals;

    @Test
    void verification_returns201() throws Exception {
        when(signals.recordVerification(eq("fp1"), eq(true), eq(PR), isNull(), any()))
                .thenReturn(new VerificationRecord("fp1", true, PR, null, NOW));

        mockMvc.perform(post("/signals/verifications")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"fingerprint":"fp1","resolved":true,"prUrl":"%s"}
                                """.formatted(PR)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.fingerprint").value("fp1"))
                .andExpect(jsonPath("$.resolved").value(true))
                .andExpect(jsonPath("$.verifiedAt").value("2026-03-01T12:00:00Z"));
    }

    @Test
    void pullRequest_merged_returnsUpdatedSessions() throws Exception {
        when(signals.recordPullRequest(PR, PullRequestState.MERGED))
                .thenReturn(List.of(session("s1", "xss", SessionStatus.FINISHED, PullRequestState.MERGED, "fp1")));

        mockMvc.perform(post("/signals/pull-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prUrl":"%s","state":"merged"}
                                """.formatted(PR)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated").value(1))
                .andExpect(jsonPath("$.sessionIds[0]").value("s1"));
    }

    @Test
    void pullRequest_rowWrittenByCycle_returns409() throws Exception {
        when(signals.recordPullRequest(PR, PullRequestState.CLOSED))
                .thenThrow(new ObjectOptimisticLockingFailureException(AgentSession.class, "s1"));

        mockMvc.perform(post("/signals/pull-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prUrl":"%s","state":"closed"}
                                """.formatted(PR)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("row changed concurrently, retry the request"));
    }

    @Test
    void pullRequest_unknownState_returns400() throws Exception {
        when(signals.recordPullRequest(PR, PullRequestState.NONE))
                .thenThrow(new IllegalArgumentException("state must be one of open, merged, closed"));

        mockMvc.perform(post("/signals/pull-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"prUrl":"%s","state":"reopened"}
                                """.formatted(PR)))
                .andExpect(status().isBadRequest());
    }
}
