package com.fixfleet.orchestrator.agent;

/** A session the agent platform accepted. */
public record CreatedSession(String sessionId, String url) {}
