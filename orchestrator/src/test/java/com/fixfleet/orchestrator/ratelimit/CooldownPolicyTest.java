package com.fixfleet.orchestrator.ratelimit;

import com.fixfleet.orchestrator.model.DispatchHistoryEntry;
import com.fixfleet.orchestrator.model.DispatchOutcome;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.fixfleet.orchestrator.Fixtures.NOW;
import static org.assertj.core.api.Assertions.assertThat;

/** Unit tests for CooldownPolicy. */
class CooldownPolicyTest {

    private static final List<Integer> SCHEDULE = List.of(24, 72, 168);

    private final CooldownPolicy policy = new CooldownPolicy(3);

    @Test
    void noHistory_noCooldown() {
        assertThat(policy.remaining(null, SCHEDULE, NOW)).isEqualTo(Duration.ZERO);
        assertThat(policy.needsHumanReview(null)).isFalse();
    }

    @Test
    void firstFailure_waitsFirstScheduleEntry() {
        DispatchHistoryEntry h = failures(1, NOW.minus(Duration.ofHours(10)));

        assertThat(policy.remaining(h, SCHEDULE, NOW)).isEqualTo(Duration.ofHours(14));
        assertThat(policy.isCoolingDown(h, SCHEDULE, NOW.plus(Duration.ofHours(14)))).isFalse();
    }

    @Test
    void secondFailure_escalates() {
        DispatchHistoryEntry h = failures(2, NOW.minus(Duration.ofHours(48)));

        assertThat(policy.isCoolingDown(h, SCHEDULE, NOW)).isTrue();
        assertThat(policy.remaining(h, SCHEDULE, NOW)).isEqualTo(Duration.ofHours(24));
    }

    @Test
    void lastEntryRepeats_andThresholdNeedsHuman() {
        DispatchHistoryEntry h = failures(5, NOW.minus(Duration.ofHours(100)));

        assertThat(policy.remaining(h, SCHEDULE, NOW)).isEqualTo(Duration.ofHours(68));
        assertThat(policy.needsHumanReview(h)).isTrue();
        assertThat(policy.needsHumanReview(failures(2, NOW))).isFalse();
    }

    @Test
    void verificationResetsCounter() {
        DispatchHistoryEntry h = failures(3, NOW.minus(Duration.ofHours(1)));

        h.recordOutcome(null, DispatchOutcome.VERIFIED, NOW);

        assertThat(policy.needsHumanReview(h)).isFalse();
        assertThat(policy.isCoolingDown(h, SCHEDULE, NOW)).isFalse();
    }

    private static DispatchHistoryEntry failures(int count, Instant lastDispatched) {
        DispatchHistoryEntry h = new DispatchHistoryEntry("fp");
        for (int i = 0; i < count; i++) {
            String id = "s" + i;
            h.recordDispatch(id, lastDispatched);
            h.recordOutcome(id, DispatchOutcome.PR_FAILED, lastDispatched);
        }
        return h;
    }
}
