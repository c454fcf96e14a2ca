package com.apex.decision.service.execution;

import com.apex.decision.config.DecisionEngineProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TradingWindowCalendarTest {

    @Test
    void blackoutWinsOverTradingWindow() {
        TradingWindowCalendar calendar = calendar(List.of("09:00-17:00"), List.of("12:00-12:30"));

        assertThat(calendar.isOpen(Instant.parse("2024-03-04T10:00:00Z"))).isTrue();
        assertThat(calendar.evaluate(Instant.parse("2024-03-04T12:15:00Z")).reason()).isEqualTo("Blackout window");
        assertThat(calendar.evaluate(Instant.parse("2024-03-04T18:00:00Z")).reason()).isEqualTo("Outside trading window");
    }

    @Test
    void windowsMayWrapPastMidnight() {
        TradingWindowCalendar calendar = calendar(List.of("22:00-02:00"), List.of());

        assertThat(calendar.isOpen(Instant.parse("2024-03-04T23:30:00Z"))).isTrue();
        assertThat(calendar.isOpen(Instant.parse("2024-03-05T01:59:00Z"))).isTrue();
        assertThat(calendar.isOpen(Instant.parse("2024-03-05T03:00:00Z"))).isFalse();
    }

    @Test
    void malformedRangesAreIgnored() {
        TradingWindowCalendar calendar = calendar(List.of("nine-five", "09:00-17:00"), List.of("garbage"));

        assertThat(calendar.isOpen(Instant.parse("2024-03-04T10:00:00Z"))).isTrue();
    }

    private static TradingWindowCalendar calendar(List<String> windows, List<String> blackout) {
        DecisionEngineProperties properties = new DecisionEngineProperties();
        properties.getTradingWindow().setEnabled(true);
        properties.getTradingWindow().setWindows(windows);
        properties.getTradingWindow().setBlackout(blackout);
        return new TradingWindowCalendar(properties);
    }
}
