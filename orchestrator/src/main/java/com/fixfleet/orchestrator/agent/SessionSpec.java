package com.fixfleet.orchestrator.agent;

import java.util.List;

/**
 * What to ask the agent platform for when creating a session.
 * Sessions are created idempotently: resending the same spec (same prompt)
 * returns the session the first request created.
 */
public record SessionSpec(
        String title,
        String prompt,
        List<String> tags,
        int maxAcuLimit
) {}
