package com.apex.decision.service.execution;

import com.apex.decision.config.DecisionEngineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Trading-hours calendar built from HH:mm-HH:mm windows and blackout ranges.
 * Ranges whose end precedes their start wrap past midnight.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "decision.trading-window.enabled", havingValue = "true")
public class TradingWindowCalendar implements TradingCalendar {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final ZoneId zone;
    private final List<LocalTime[]> windows;
    private final List<LocalTime[]> blackout;

    public TradingWindowCalendar(DecisionEngineProperties properties) {
        DecisionEngineProperties.TradingWindow config = properties.getTradingWindow();
        this.zone = ZoneId.of(config.getTimezone());
        this.windows = parse(config.getWindows());
        this.blackout = parse(config.getBlackout());
        log.info("Trading calendar active in {} with {} window(s) and {} blackout range(s)",
                zone, windows.size(), blackout.size());
    }

    @Override
    public WindowDecision evaluate(Instant at) {
        LocalTime time = at.atZone(zone).toLocalTime();
        if (isWithinAny(time, blackout)) {
            return new WindowDecision(false, "Blackout window");
        }
        if (windows.isEmpty()) {
            return new WindowDecision(true, "No trading windows configured");
        }
        if (!isWithinAny(time, windows)) {
            return new WindowDecision(false, "Outside trading window");
        }
        return new WindowDecision(true, "Within trading window");
    }

    private static List<LocalTime[]> parse(List<String> ranges) {
        List<LocalTime[]> parsed = new ArrayList<>();
        if (ranges == null) {
            return parsed;
        }
        for (String range : ranges) {
            if (range == null || range.isBlank()) {
                continue;
            }
            String[] parts = range.split("-");
            if (parts.length != 2) {
                log.warn("Ignoring malformed trading range '{}'", range);
                continue;
            }
            try {
                parsed.add(new LocalTime[]{
                        LocalTime.parse(parts[0].trim(), WINDOW_FORMAT),
                        LocalTime.parse(parts[1].trim(), WINDOW_FORMAT)
                });
            } catch (DateTimeParseException e) {
                log.warn("Ignoring malformed trading range '{}': {}", range, e.getMessage());
            }
        }
        return parsed;
    }

    private static boolean isWithinAny(LocalTime time, List<LocalTime[]> ranges) {
        for (LocalTime[] range : ranges) {
            if (isWithinRange(time, range[0], range[1])) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWithinRange(LocalTime time, LocalTime start, LocalTime end) {
        if (!end.isBefore(start)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }
}
