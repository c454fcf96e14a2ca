package com.apex.decision.service.bookkeeping;

import com.apex.decision.config.DecisionEngineProperties.CooldownMode;
import com.apex.decision.model.TradeSide;
import com.apex.decision.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownTrackerTest {

    private static final Duration COOLDOWN = Duration.ofMinutes(5);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));

    @Test
    void inertModeRecordsButNeverGates() {
        CooldownTracker tracker = new CooldownTracker(CooldownMode.INERT, clock);

        tracker.record("EURUSD", TradeSide.BUY);
        tracker.record("EURUSD", TradeSide.BUY);

        assertThat(tracker.isInCooldown("EURUSD", TradeSide.BUY, COOLDOWN)).isFalse();
        assertThat(tracker.get("EURUSD")).hasValueSatisfying(record -> {
            assertThat(record.actionCount()).isEqualTo(2);
            assertThat(record.side()).isEqualTo(TradeSide.BUY);
        });
    }

    @Test
    void enforcedModeGatesTheRecordedSideUntilExpiry() {
        CooldownTracker tracker = new CooldownTracker(CooldownMode.ENFORCED, clock);
        tracker.record("EURUSD", TradeSide.BUY);

        clock.advance(Duration.ofMinutes(2));
        assertThat(tracker.isInCooldown("EURUSD", TradeSide.BUY, COOLDOWN)).isTrue();
        assertThat(tracker.isInCooldown("EURUSD", TradeSide.SELL, COOLDOWN)).isFalse();
        assertThat(tracker.isInCooldown("EURUSD", null, COOLDOWN)).isTrue();
        assertThat(tracker.remaining("EURUSD", TradeSide.BUY, COOLDOWN)).isEqualTo(Duration.ofMinutes(3));

        clock.advance(Duration.ofMinutes(3));
        assertThat(tracker.isInCooldown("EURUSD", TradeSide.BUY, COOLDOWN)).isFalse();
    }

    @Test
    void closeAllCoolsDownBothSides() {
        CooldownTracker tracker = new CooldownTracker(CooldownMode.ENFORCED, clock);
        tracker.record("EURUSD", TradeSide.BOTH);

        assertThat(tracker.isInCooldown("EURUSD", TradeSide.BUY, COOLDOWN)).isTrue();
        assertThat(tracker.isInCooldown("EURUSD", TradeSide.SELL, COOLDOWN)).isTrue();
    }

    @Test
    void purgeForgetsTheInstrument() {
        CooldownTracker tracker = new CooldownTracker(CooldownMode.ENFORCED, clock);
        tracker.record("EURUSD", TradeSide.SELL);

        tracker.purge("EURUSD");

        assertThat(tracker.get("EURUSD")).isEmpty();
        assertThat(tracker.isInCooldown("EURUSD", TradeSide.SELL, COOLDOWN)).isFalse();
    }
}
