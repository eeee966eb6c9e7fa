package com.fixfleet.orchestrator.model;

import java.util.Locale;

/**
 * Derived lifecycle state of one issue.
 *
 * Never stored: always recomputed from scan history, dispatch history and
 * the session / PR / verification signals.
 *
 * Transitions:
 *   NEW → RECURRING → SESSION_DISPATCHED → PR_OPEN → PR_MERGED → VERIFIED_FIXED
 *   PR_OPEN (closed or verification failed) → RECURRING
 *   any state → FIXED      (absent from the latest scan)
 *   FIXED → RECURRING      (reappears in a later scan)
 */
public enum IssueState {
    NEW,
    RECURRING,
    SESSION_DISPATCHED,
    PR_OPEN,
    PR_MERGED,
    VERIFIED_FIXED,
    FIXED;

    public String label() { return name().toLowerCase(Locale.ROOT); }

    /** True for the states the analyzer still reports and nobody is working on. */
    public boolean isOpen() {
        return this == NEW || this == RECURRING;
    }
}
