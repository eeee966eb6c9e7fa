package com.fixfleet.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from GET /sessions/{id}. Only the fields the orchestrator reads.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionDetailsResponse(
        String session_id,
        String status_enum,
        PullRequestRef pull_request
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PullRequestRef(String url) {}

    public String prUrl() {
        return pull_request == null ? null : pull_request.url();
    }
}
