package com.fixfleet.orchestrator.api;

import com.fixfleet.orchestrator.api.dto.DispatchHistoryResponse;
import com.fixfleet.orchestrator.api.dto.PlanEntryResponse;
import com.fixfleet.orchestrator.api.dto.StateExportResponse;
import com.fixfleet.orchestrator.service.CycleReport;
import com.fixfleet.orchestrator.service.OrchestratorService;
import com.fixfleet.orchestrator.service.OrchestratorStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

/**
 * REST API for dispatch cycles.
 *
 * GET  /orchestrator/plan?repo=                 : what a cycle would do now, in dispatch order
 * POST /orchestrator/cycle?repo=                : run one cycle (409 if one is running)
 * POST /orchestrator/cycle/cancel               : stop the running cycle after its current step
 * GET  /orchestrator/status                     : rate limit, cooldowns, objectives, last cycle
 * GET  /orchestrator/dispatch-history/{fp}      : history of one fingerprint
 * GET  /orchestrator/state/export               : full state snapshot
 */
@RestController
@RequestMapping("/orchestrator")
public class OrchestratorController {

    private final OrchestratorService orchestrator;

    public OrchestratorController(OrchestratorService orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/plan")
    public List<PlanEntryResponse> plan(@RequestParam(name = "repo", required = false) String repo) {
        return orchestrator.plan(repo).entries().stream()
                .map(PlanEntryResponse::from)
                .toList();
    }

    /**
     * Run a cycle synchronously and return its report. A FAILED cycle still
     * answers 200: the report says what went wrong.
     *
     * Example:
     *   curl -X POST 'http://localhost:8080/orchestrator/cycle?repo=https://github.com/acme/api'
     */
    @PostMapping("/cycle")
    public CycleReport cycle(@RequestParam(name = "repo", required = false) String repo) {
        return orchestrator.cycle(repo);
    }

    @PostMapping("/cycle/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = orchestrator.cancel();
        if (!cancelled) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("cancelled", false, "error", "no cycle running"));
        }
        return ResponseEntity.accepted().body(Map.of("cancelled", true));
    }

    @GetMapping("/status")
    public OrchestratorStatus status() {
        return orchestrator.status();
    }

    /** Returns 404 if the fingerprint was never dispatched. */
    @GetMapping("/dispatch-history/{fingerprint}")
    public DispatchHistoryResponse dispatchHistory(@PathVariable String fingerprint) {
        return orchestrator.dispatchHistory(fingerprint)
                .map(DispatchHistoryResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "No dispatch history for " + fingerprint));
    }

    @GetMapping("/state/export")
    public StateExportResponse exportState() {
        return StateExportResponse.from(orchestrator.exportState());
    }
}
