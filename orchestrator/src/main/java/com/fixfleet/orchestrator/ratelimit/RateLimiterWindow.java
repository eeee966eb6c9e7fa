package com.fixfleet.orchestrator.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Global sliding-window limit on session creation.
 *
 * A session may be created iff fewer than maxSessions creations happened in
 * the last periodHours. Timestamps older than the window are pruned on every
 * check. Callers reserve a slot before creating a session and release it if
 * creation fails, so parallel creations can never overshoot the limit.
 *
 * Thread-safe: the wave dispatcher reserves from several worker threads.
 */
public class RateLimiterWindow {

    private final int maxSessions;
    private final int periodHours;
    private final List<Instant> createdTimestamps;

    public RateLimiterWindow(int maxSessions, int periodHours, List<Instant> createdTimestamps) {
        if (maxSessions < 0) throw new IllegalArgumentException("maxSessions must be >= 0");
        if (periodHours <= 0) throw new IllegalArgumentException("periodHours must be > 0");
        this.maxSessions       = maxSessions;
        this.periodHours       = periodHours;
        this.createdTimestamps = new ArrayList<>(createdTimestamps == null ? List.of() : createdTimestamps);
    }

    public static RateLimiterWindow empty(int maxSessions, int periodHours) {
        return new RateLimiterWindow(maxSessions, periodHours, List.of());
    }

    public synchronized boolean canDispatch(Instant now) {
        prune(now);
        return createdTimestamps.size() < maxSessions;
    }

    /**
     * Claim one slot at {@code now}.
     *
     * @return false when the window is full; nothing is recorded then
     */
    public synchronized boolean tryReserve(Instant now) {
        prune(now);
        if (createdTimestamps.size() >= maxSessions) return false;
        createdTimestamps.add(now);
        return true;
    }

    /** Give back a slot claimed by {@link #tryReserve} whose session was never created. */
    public synchronized void release(Instant reservedAt) {
        createdTimestamps.remove(reservedAt);
    }

    public synchronized int recentCount(Instant now) {
        prune(now);
        return createdTimestamps.size();
    }

    public synchronized int remaining(Instant now) {
        return Math.max(0, maxSessions - recentCount(now));
    }

    /** Independent copy, used by the planner to simulate reservations. */
    public synchronized RateLimiterWindow copy() {
        return new RateLimiterWindow(maxSessions, periodHours, createdTimestamps);
    }

    public synchronized List<Instant> createdTimestamps() {
        return List.copyOf(createdTimestamps);
    }

    public int maxSessions() { return maxSessions; }
    public int periodHours() { return periodHours; }

    private void prune(Instant now) {
        Instant cutoff = now.minus(Duration.ofHours(periodHours));
        Iterator<Instant> it = createdTimestamps.iterator();
        while (it.hasNext()) {
            if (!it.next().isAfter(cutoff)) it.remove();
        }
    }
}
