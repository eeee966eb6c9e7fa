package com.fixfleet.orchestrator.api;

import com.fixfleet.orchestrator.api.dto.ScanRequest;
import com.fixfleet.orchestrator.service.ScanIngestResult;
import com.fixfleet.orchestrator.service.ScanIngestService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * POST /scans : record one analyzer run (fingerprinted findings or a legacy summary).
 *
 * Example:
 *   curl -X POST http://localhost:8080/scans \
 *     -H "Content-Type: application/json" \
 *     -d '{"repoUrl":"https://github.com/acme/api","findings":[{"ruleId":"js/sql-injection",
 *          "severityTier":"high","cweTags":["external/cwe/cwe-89"],"file":"src/db.js",
 *          "startLine":42,"message":"Query built from user input"}]}'
 */
@RestController
@RequestMapping("/scans")
public class ScanController {

    private final ScanIngestService ingestService;

    public ScanController(ScanIngestService ingestService) {
        this.ingestService = ingestService;
    }

    @PostMapping
    public ResponseEntity<ScanIngestResult> ingest(@RequestBody ScanRequest req) {
        ScanIngestResult result = ingestService.ingest(req.toSubmission());
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }
}
