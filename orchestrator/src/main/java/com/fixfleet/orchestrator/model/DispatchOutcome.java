package com.fixfleet.orchestrator.model;

/**
 * Result of the most recent dispatch attempt for a fingerprint.
 *
 *   PENDING   : session created, no resolution yet
 *   PR_MERGED : the fix PR was merged, awaiting verification
 *   PR_FAILED : PR closed unmerged, or verification found the issue still present
 *   VERIFIED  : verification confirmed the issue is gone
 *   UNKNOWN   : session ended (failed, expired, no PR) without producing a fix
 */
public enum DispatchOutcome {
    PENDING,
    PR_MERGED,
    PR_FAILED,
    VERIFIED,
    UNKNOWN;

    /** Outcomes that count as a failed attempt for cooldown purposes. */
    public boolean isFailure() {
        return this == PR_FAILED || this == UNKNOWN;
    }
}
