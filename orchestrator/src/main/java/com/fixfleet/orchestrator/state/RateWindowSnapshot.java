package com.fixfleet.orchestrator.state;

import com.fixfleet.orchestrator.ratelimit.RateLimiterWindow;

import java.time.Instant;
import java.util.List;

/**
 * JSON shape of the rate-limiter window in orchestrator_meta.rate_window_json.
 */
public record RateWindowSnapshot(int maxSessions, int periodHours, List<Instant> createdTimestamps) {

    public static RateWindowSnapshot of(RateLimiterWindow window) {
        return new RateWindowSnapshot(window.maxSessions(), window.periodHours(), window.createdTimestamps());
    }
}
