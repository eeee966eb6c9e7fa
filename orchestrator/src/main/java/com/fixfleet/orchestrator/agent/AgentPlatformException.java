package com.fixfleet.orchestrator.agent;

/**
 * Thrown when the agent platform rejects a request or cannot be reached
 * after all retries.
 */
public class AgentPlatformException extends RuntimeException {

    private final int statusCode;

    public AgentPlatformException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public AgentPlatformException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int getStatusCode() {
        return statusCode;
    }
}
