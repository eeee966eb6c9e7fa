package com.fixfleet.orchestrator.registry;

import java.util.List;

/**
 * Validated per-repo dispatch settings, registry defaults already merged in.
 *
 * @param importanceScore       0..100, weighs the repo in scoring and interleaving
 * @param maxSessionsPerCycle   session cap for this repo across one whole cycle
 * @param cooldownHoursSchedule hours to wait after the 1st, 2nd, ... failed attempt;
 *                              the last entry repeats
 * @param autoDispatch          false keeps the repo in plans but never dispatches it
 */
public record RepoConfig(
        String repoUrl,
        int importanceScore,
        int maxSessionsPerCycle,
        List<Integer> cooldownHoursSchedule,
        boolean autoDispatch,
        List<String> tags,
        int batchSize,
        String defaultBranch,
        boolean enabled
) {
    public static final int           DEFAULT_IMPORTANCE      = 50;
    public static final int           DEFAULT_MAX_SESSIONS    = 5;
    public static final int           DEFAULT_BATCH_SIZE      = 5;
    public static final List<Integer> DEFAULT_COOLDOWN_HOURS  = List.of(24, 72, 168);
    public static final String        DEFAULT_BRANCH          = "main";

    public RepoConfig {
        cooldownHoursSchedule = List.copyOf(cooldownHoursSchedule);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /** Config used for a repo that has scans but no registry entry. */
    public static RepoConfig defaultsFor(String repoUrl) {
        return new RepoConfig(repoUrl, DEFAULT_IMPORTANCE, DEFAULT_MAX_SESSIONS,
                DEFAULT_COOLDOWN_HOURS, true, List.of(), DEFAULT_BATCH_SIZE, DEFAULT_BRANCH, true);
    }

    public boolean isDispatchable() {
        return enabled && autoDispatch;
    }
}
