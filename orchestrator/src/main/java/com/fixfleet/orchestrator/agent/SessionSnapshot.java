package com.fixfleet.orchestrator.agent;

import com.fixfleet.orchestrator.model.SessionStatus;

/** Point-in-time view of a session: its status and the PR it opened, if any. */
public record SessionSnapshot(String sessionId, SessionStatus status, String prUrl) {}
