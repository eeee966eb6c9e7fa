package com.fixfleet.orchestrator.scoring;

/**
 * Outcome counts of finished agent sessions for one CWE family.
 *
 * @param totalSessions sessions that reached a terminal status
 * @param fixedSessions of those, sessions that produced a fix
 */
public record FamilyStats(String family, int totalSessions, int fixedSessions) {

    public double fixRate() {
        return totalSessions == 0 ? 0.0 : (double) fixedSessions / totalSessions;
    }
}
