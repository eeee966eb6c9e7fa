package com.fixfleet.orchestrator.agent;

/**
 * The AI coding agent platform, seen from the orchestrator.
 *
 * Implementations retry transient failures themselves and throw
 * {@link AgentPlatformException} once a call has definitively failed.
 */
public interface AgentPlatformClient {

    CreatedSession createSession(SessionSpec spec);

    SessionSnapshot getSession(String sessionId);
}
