package com.fixfleet.orchestrator.api;

import com.fixfleet.orchestrator.api.dto.PullRequestSignalRequest;
import com.fixfleet.orchestrator.api.dto.VerificationRequest;
import com.fixfleet.orchestrator.api.dto.VerificationResponse;
import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.service.SignalService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Resolution signals pushed by the verification pass and by PR webhooks.
 *
 * POST /signals/verifications  : one verification result for one fingerprint
 * POST /signals/pull-requests  : PR state change (open / merged / closed)
 */
@RestController
@RequestMapping("/signals")
public class SignalController {

    private final SignalService signals;

    public SignalController(SignalService signals) {
        this.signals = signals;
    }

    @PostMapping("/verifications")
    public ResponseEntity<VerificationResponse> verification(@RequestBody VerificationRequest req) {
        VerificationResponse body = VerificationResponse.from(signals.recordVerification(
                req.fingerprint(), req.resolved(), req.prUrl(), req.sessionId(), req.verifiedAt()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @PostMapping("/pull-requests")
    public Map<String, Object> pullRequest(@RequestBody PullRequestSignalRequest req) {
        List<AgentSession> updated = signals.recordPullRequest(req.prUrl(), PullRequestState.parse(req.state()));
        return Map.of(
                "updated",    updated.size(),
                "sessionIds", updated.stream().map(AgentSession::getSessionId).toList());
    }
}
