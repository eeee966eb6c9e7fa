package com.fixfleet.orchestrator.ratelimit;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Sliding-window session limit: reservation, release and expiry. */
class RateLimiterWindowTest {

    @Test
    void tryReserve_stopsAtMaxSessions() {
        RateLimiterWindow window = RateLimiterWindow.empty(2, 24);

        assertThat(window.tryReserve(NOW)).isTrue();
        assertThat(window.tryReserve(NOW.plusSeconds(1))).isTrue();
        assertThat(window.tryReserve(NOW.plusSeconds(2))).isFalse();
        assertThat(window.recentCount(NOW.plusSeconds(2))).isEqualTo(2);
    }

    @Test
    void oldTimestamps_slideOutOfWindow() {
        RateLimiterWindow window = new RateLimiterWindow(2, 24, List.of(
                NOW.minus(Duration.ofHours(25)),
                NOW.minus(Duration.ofHours(24)),
                NOW.minus(Duration.ofHours(1))));

        assertThat(window.remaining(NOW)).isEqualTo(1);
        assertThat(window.canDispatch(NOW)).isTrue();
        assertThat(window.createdTimestamps()).containsExactly(NOW.minus(Duration.ofHours(1)));
    }

    @Test
    void release_givesSlotBack() {
        RateLimiterWindow window = RateLimiterWindow.empty(1, 24);
        window.tryReserve(NOW);

        window.release(NOW);

        assertThat(window.canDispatch(NOW)).isTrue();
    }

    @Test
    void copy_isIndependent() {
        RateLimiterWindow window = RateLimiterWindow.empty(1, 24);
        RateLimiterWindow simulated = window.copy();

        simulated.tryReserve(NOW);

        assertThat(simulated.canDispatch(NOW)).isFalse();
        assertThat(window.canDispatch(NOW)).isTrue();
    }

    @Test
    void zeroMaxSessions_neverDispatches() {
        assertThat(RateLimiterWindow.empty(0, 24).tryReserve(NOW)).isFalse();
    }

    @Test
    void invalidPeriod_isRejected() {
        assertThatThrownBy(() -> RateLimiterWindow.empty(5, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
