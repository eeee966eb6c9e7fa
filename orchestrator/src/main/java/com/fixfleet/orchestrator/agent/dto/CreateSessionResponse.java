package com.fixfleet.orchestrator.agent.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /sessions.
 * is_new_session is false when an idempotent request matched an existing session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CreateSessionResponse(
        String session_id,
        String url,
        Boolean is_new_session
) {}
