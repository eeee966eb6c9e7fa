package com.fixfleet.orchestrator.agent.dto;

import java.util.List;

/**
 * Body of POST /sessions on the agent platform.
 * Field names follow the platform's snake_case wire format.
 */
public record CreateSessionRequest(
        String prompt,
        boolean idempotent,
        List<String> tags,
        String title,
        int max_acu_limit
) {}
