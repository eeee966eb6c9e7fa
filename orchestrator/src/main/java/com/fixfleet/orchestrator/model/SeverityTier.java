package com.fixfleet.orchestrator.model;

import java.util.Locale;

/**
 * Severity tiers reported by the analyzer, highest first.
 *
 * The declaration order is the wave order: CRITICAL is dispatched first.
 * Weights feed the priority score.
 */
public enum SeverityTier {
    CRITICAL(1.0, 9.0),
    HIGH(0.75, 7.0),
    MEDIUM(0.5, 4.0),
    LOW(0.25, 0.1);

    private final double weight;
    private final double minCvss;

    SeverityTier(double weight, double minCvss) {
        this.weight  = weight;
        this.minCvss = minCvss;
    }

    public double weight() { return weight; }

    /** Lower-case wire name, e.g. "critical". */
    public String label() { return name().toLowerCase(Locale.ROOT); }

    /**
     * Lenient parse of an analyzer severity string.
     * Returns null for blank or unknown values so callers can decide on a fallback.
     */
    public static SeverityTier parse(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /** Map a CVSS v3 score onto a tier (NVD ranges). Scores below 0.1 map to null. */
    public static SeverityTier fromCvss(double score) {
        for (SeverityTier tier : values()) {
            if (score >= tier.minCvss) return tier;
        }
        return null;
    }
}
