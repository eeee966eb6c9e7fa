package com.fixfleet.orchestrator.tracking;

import java.util.Locale;

/**
 * Why an issue is not eligible for dispatch this cycle.
 * Declaration order is the order the checks run in; the first match wins.
 */
public enum SkipReason {
    ALREADY_RESOLVED,
    SESSION_ACTIVE,
    PR_AWAITING_REVIEW,
    PR_MERGED_AWAITING_VERIFICATION,
    NEEDS_HUMAN_REVIEW,
    COOLDOWN_ACTIVE,
    REPO_CONFIG_INVALID,
    AUTO_DISPATCH_DISABLED,
    LOW_FIX_RATE_FAMILY;

    public String label() { return name().toLowerCase(Locale.ROOT); }
}
