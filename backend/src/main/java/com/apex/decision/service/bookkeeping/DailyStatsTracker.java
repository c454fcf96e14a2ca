package com.apex.decision.service.bookkeeping;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.DailyStats;
import com.apex.decision.model.TradeAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Per-day trade statistics. Counters reset as a whole when the date in the configured zone changes.
 */
@Component
@Slf4j
public class DailyStatsTracker {

    private final ZoneId zone;
    private DailyStats current;

    @Autowired
    public DailyStatsTracker(DecisionEngineProperties properties, Clock clock) {
        this(ZoneId.of(properties.getStats().getZone()), clock);
    }

    public DailyStatsTracker(ZoneId zone, Clock clock) {
        this.zone = zone;
        this.current = DailyStats.empty(LocalDate.ofInstant(clock.instant(), zone));
    }

    public synchronized DailyStats recordTrade(TradeAction action, double profit, Instant at) {
        rollIfNewDay(at);
        current = current.withTrade(action, profit);
        return current;
    }

    /**
     * Returns true when {@code at} started a new stat day.
     */
    public synchronized boolean checkRollover(Instant at) {
        return rollIfNewDay(at);
    }

    public synchronized DailyStats current() {
        return current;
    }

    public synchronized void reset(Instant at) {
        current = DailyStats.empty(LocalDate.ofInstant(at, zone));
    }

    private boolean rollIfNewDay(Instant at) {
        LocalDate day = LocalDate.ofInstant(at, zone);
        if (day.equals(current.day())) {
            return false;
        }
        DailyStats finished = current;
        current = DailyStats.empty(day);
        log.info("Stat day rolled over {} -> {}: {} trades, profit {}", finished.day(), day, finished.trades(),
                String.format(Locale.ROOT, "%.2f", finished.totalProfit()));
        return true;
    }
}
