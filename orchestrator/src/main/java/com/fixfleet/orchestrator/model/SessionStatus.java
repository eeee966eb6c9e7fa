package com.fixfleet.orchestrator.model;

import java.util.Locale;

/**
 * Status of an agent session as reported by the agent platform.
 *
 * Transitions:
 *   CREATED → RUNNING → FINISHED | BLOCKED | EXPIRED | FAILED | CANCELLED
 */
public enum SessionStatus {
    CREATED,
    RUNNING,
    BLOCKED,
    FINISHED,
    EXPIRED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != CREATED && this != RUNNING;
    }

    /**
     * Map a platform status string onto our enum.
     * The platform reports "working", "suspended" etc. for sessions still in flight;
     * anything we don't recognise is treated as RUNNING so we keep polling it.
     */
    public static SessionStatus fromPlatform(String raw) {
        if (raw == null || raw.isBlank()) return RUNNING;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "created", "new"        -> CREATED;
            case "finished", "stopped"   -> FINISHED;
            case "blocked"               -> BLOCKED;
            case "expired"               -> EXPIRED;
            case "failed", "error"       -> FAILED;
            case "canceled", "cancelled" -> CANCELLED;
            default                      -> RUNNING;
        };
    }
}
