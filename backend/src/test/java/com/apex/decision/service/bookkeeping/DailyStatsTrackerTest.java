package com.apex.decision.service.bookkeeping;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.apex.decision.model.DailyStats;
import com.apex.decision.model.TradeAction;
import com.apex.decision.support.MutableClock;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class DailyStatsTrackerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private final DailyStatsTracker tracker = new DailyStatsTracker(ZoneOffset.UTC, clock);

    @Test
    void accumulatesWithinTheSameDay() {
        tracker.recordTrade(TradeAction.OPEN_BUY, 0.0, Instant.parse("2024-03-04T10:00:00Z"));
        tracker.recordTrade(TradeAction.CLOSE_BUY, 12.5, Instant.parse("2024-03-04T11:00:00Z"));
        tracker.recordTrade(TradeAction.CLOSE_ALL, -4.0, Instant.parse("2024-03-04T12:00:00Z"));
        tracker.recordTrade(TradeAction.OPEN_SELL, 0.0, Instant.parse("2024-03-04T13:00:00Z"));

        DailyStats stats = tracker.current();
        assertThat(stats.trades()).isEqualTo(4);
        assertThat(stats.wins()).isEqualTo(1);
        assertThat(stats.losses()).isEqualTo(1);
        assertThat(stats.totalProfit()).isEqualTo(8.5);
        assertThat(stats.largestWin()).isEqualTo(12.5);
        assertThat(stats.largestLoss()).isEqualTo(-4.0);
        assertThat(stats.buyTrades()).isEqualTo(1);
        assertThat(stats.sellTrades()).isEqualTo(1);
        assertThat(stats.winRate()).isEqualTo(50.0);
    }

    @Test
    void tradeOnTheNextDayResetsCountersFirst() {
        tracker.recordTrade(TradeAction.CLOSE_BUY, 10.0, Instant.parse("2024-03-04T22:00:00Z"));
        tracker.recordTrade(TradeAction.CLOSE_SELL, -3.0, Instant.parse("2024-03-04T23:00:00Z"));

        DailyStats stats = tracker.recordTrade(TradeAction.CLOSE_BUY, 2.0, Instant.parse("2024-03-05T00:05:00Z"));

        assertThat(stats.day()).isEqualTo(LocalDate.of(2024, 3, 5));
        assertThat(stats.trades()).isEqualTo(1);
        assertThat(stats.wins()).isEqualTo(1);
        assertThat(stats.losses()).isZero();
        assertThat(stats.totalProfit()).isEqualTo(2.0);
        assertThat(stats.largestLoss()).isZero();
    }

    @Test
    void timerRolloverResetsWithoutATrade() {
        tracker.recordTrade(TradeAction.CLOSE_BUY, 10.0, Instant.parse("2024-03-04T22:00:00Z"));

        assertThat(tracker.checkRollover(Instant.parse("2024-03-04T23:59:59Z"))).isFalse();
        assertThat(tracker.checkRollover(Instant.parse("2024-03-05T00:00:00Z"))).isTrue();
        assertThat(tracker.current().trades()).isZero();
    }

    @Test
    void rolloverSummaryUsesAFixedNumberFormat() {
        Logger logger = (Logger) LoggerFactory.getLogger(DailyStatsTracker.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        Locale defaultLocale = Locale.getDefault();
        Locale.setDefault(Locale.FRANCE);
        try {
            tracker.recordTrade(TradeAction.CLOSE_BUY, 8.5, Instant.parse("2024-03-04T12:00:00Z"));
            tracker.checkRollover(Instant.parse("2024-03-05T00:00:01Z"));
        } finally {
            Locale.setDefault(defaultLocale);
            logger.detachAppender(appender);
        }

        assertThat(appender.list)
                .extracting(ILoggingEvent::getFormattedMessage)
                .anySatisfy(message -> assertThat(message).endsWith("1 trades, profit 8.50"));
    }
}
