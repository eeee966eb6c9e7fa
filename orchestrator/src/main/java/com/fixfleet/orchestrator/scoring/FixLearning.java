package com.fixfleet.orchestrator.scoring;

import com.fixfleet.orchestrator.config.OrchestratorProperties;
import com.fixfleet.orchestrator.model.AgentSession;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-CWE-family fix rates learned from past agent sessions.
 *
 * Feeds three decisions: the feasibility term of the priority score, skipping
 * families the agent almost never fixes, and the compute budget (ACU) granted
 * to a new session. Immutable snapshot; rebuild it each cycle.
 */
public class FixLearning {

    static final double NO_DATA_FEASIBILITY = 0.5;
    static final double HIGH_FIX_RATE = 0.7;
    static final double LOW_FIX_RATE  = 0.3;

    private final Map<String, FamilyStats>          stats;
    private final OrchestratorProperties.FixLearning settings;

    public FixLearning(Map<String, FamilyStats> stats, OrchestratorProperties.FixLearning settings) {
        this.stats    = Map.copyOf(stats);
        this.settings = settings;
    }

    /** Build from sessions: only terminal sessions count, still-running ones have no outcome yet. */
    public static FixLearning fromSessions(Collection<AgentSession> sessions,
                                           OrchestratorProperties.FixLearning settings) {
        Map<String, int[]> counts = new HashMap<>();
        for (AgentSession s : sessions) {
            if (!s.getStatus().isTerminal()) continue;
            int[] c = counts.computeIfAbsent(s.getCweFamily(), k -> new int[2]);
            c[0]++;
            if (s.producedFix()) c[1]++;
        }
        Map<String, FamilyStats> stats = new HashMap<>();
        counts.forEach((family, c) -> stats.put(family, new FamilyStats(family, c[0], c[1])));
        return new FixLearning(stats, settings);
    }

    public static FixLearning empty(OrchestratorProperties.FixLearning settings) {
        return new FixLearning(Map.of(), settings);
    }

    public Optional<FamilyStats> stats(String family) {
        FamilyStats s = stats.get(family);
        return s == null || s.totalSessions() == 0 ? Optional.empty() : Optional.of(s);
    }

    /** Family fix rate, or 0.5 when there is no history to learn from. */
    public double feasibility(String family) {
        return stats(family).map(FamilyStats::fixRate).orElse(NO_DATA_FEASIBILITY);
    }

    /** Enough sessions to judge, and almost none of them produced a fix. */
    public boolean shouldSkipFamily(String family) {
        return stats(family)
                .filter(s -> s.totalSessions() >= settings.getLowFixRateMinSessions())
                .map(s -> s.fixRate() < settings.getLowFixRateThreshold())
                .orElse(false);
    }

    /**
     * Compute budget for a new session on this family. Families that fix easily
     * get less, families that struggle get more, clamped to [min, max].
     */
    public int acuBudget(String family) {
        int base = settings.getBaseAcuBudget();
        Optional<FamilyStats> s = stats(family);
        int budget;
        if (s.isEmpty()) {
            budget = base;
        } else {
            double rate = s.get().fixRate();
            if (rate >= HIGH_FIX_RATE) {
                budget = (int) (base * 0.6);
            } else if (rate <= LOW_FIX_RATE) {
                budget = (int) (base * 1.8);
            } else {
                budget = (int) (base * (1.0 + 0.8 * (0.5 - rate)));
            }
        }
        return Math.max(settings.getMinAcuBudget(), Math.min(budget, settings.getMaxAcuBudget()));
    }

    public List<FamilyStats> all() {
        return stats.values().stream()
                .sorted((a, b) -> a.family().compareTo(b.family()))
                .toList();
    }
}
