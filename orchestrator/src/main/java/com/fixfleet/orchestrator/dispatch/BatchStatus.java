package com.fixfleet.orchestrator.dispatch;

/**
 * CREATED  : the agent platform accepted a session for the batch
 * FAILED   : session creation failed after retries
 * DEFERRED : the global rate limit was reached before this batch
 * SKIPPED  : the wave was halted or the cycle cancelled before this batch
 */
public enum BatchStatus {
    CREATED,
    FAILED,
    DEFERRED,
    SKIPPED
}
