package com.apex.decision.service.bookkeeping;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.config.DecisionEngineProperties.CooldownMode;
import com.apex.decision.model.CooldownRecord;
import com.apex.decision.model.TradeSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last action per instrument. Records are always kept; gating only happens in
 * {@link CooldownMode#ENFORCED}.
 */
@Component
@Slf4j
public class CooldownTracker {

    private final Map<String, CooldownRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;
    private final CooldownMode mode;

    @Autowired
    public CooldownTracker(DecisionEngineProperties properties, Clock clock) {
        this(properties.getCooldownMode(), clock);
    }

    public CooldownTracker(CooldownMode mode, Clock clock) {
        this.mode = mode;
        this.clock = clock;
    }

    public CooldownRecord record(String symbol, TradeSide side) {
        Instant now = clock.instant();
        CooldownRecord updated = records.compute(symbol, (key, existing) -> existing == null
                ? new CooldownRecord(symbol, side, now, 1)
                : existing.next(side, now));
        log.debug("Cooldown recorded for {} {} (#{})", symbol, side, updated.actionCount());
        return updated;
    }

    /**
     * {@code side} null means any side.
     */
    public boolean isInCooldown(String symbol, TradeSide side, Duration cooldown) {
        if (mode != CooldownMode.ENFORCED) {
            return false;
        }
        return remaining(symbol, side, cooldown).compareTo(Duration.ZERO) > 0;
    }

    public Duration remaining(String symbol, TradeSide side, Duration cooldown) {
        CooldownRecord last = records.get(symbol);
        if (last == null || cooldown == null || !last.side().covers(side)) {
            return Duration.ZERO;
        }
        Duration elapsed = Duration.between(last.lastActionAt(), clock.instant());
        Duration left = cooldown.minus(elapsed);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public Optional<CooldownRecord> get(String symbol) {
        return Optional.ofNullable(records.get(symbol));
    }

    public void purge(String symbol) {
        records.remove(symbol);
    }

    public void clear() {
        records.clear();
    }
}
