package com.fixfleet.orchestrator.model;

import java.util.Locale;

/** State of the pull request an agent session opened (NONE until one exists). */
public enum PullRequestState {
    NONE,
    OPEN,
    MERGED,
    CLOSED;

    public static PullRequestState parse(String value) {
        if (value == null || value.isBlank()) return NONE;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NONE;
        }
    }
}
