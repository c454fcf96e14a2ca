package com.apex.decision.cache;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.IndicatorValues;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.PositionSnapshot;
import com.apex.decision.model.PriceSnapshot;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The five freshness caches the engine reads through, plus the global testing-mode switch.
 */
@Component
@Slf4j
@Getter
public class DecisionCaches {

    private final TtlCache<PriceSnapshot> prices;
    private final TtlCache<PositionSnapshot> positions;
    private final TtlCache<IndicatorValues> indicators;
    private final TtlCache<MarketAnalysis> analyses;
    private final TtlCache<CachedDecision> decisions;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean testingMode;

    public DecisionCaches(DecisionEngineProperties properties, Clock clock) {
        DecisionEngineProperties.Cache config = properties.getCache();
        this.testingMode = new AtomicBoolean(properties.isTestingMode());
        this.prices = new TtlCache<>("price", config.getPriceTtl(), clock, testingMode::get);
        this.positions = new TtlCache<>("position", config.getPositionTtl(), clock, testingMode::get);
        this.indicators = new TtlCache<>("indicator", config.getIndicatorTtl(), clock, testingMode::get);
        this.analyses = new TtlCache<>("analysis", config.getAnalysisTtl(), clock, testingMode::get);
        this.decisions = new TtlCache<>("decision", config.getDecisionTtl(), clock, testingMode::get);
    }

    public boolean isTestingMode() {
        return testingMode.get();
    }

    public void setTestingMode(boolean enabled) {
        boolean previous = testingMode.getAndSet(enabled);
        if (previous != enabled) {
            invalidateAll();
            log.info("Testing mode {}", enabled ? "ENABLED - caching disabled" : "disabled");
        }
    }

    /**
     * Entries that a state-changing execution on {@code symbol} makes stale.
     */
    public void invalidateAfterExecution(String symbol) {
        decisions.invalidate(symbol);
        positions.invalidate(symbol);
    }

    public void invalidateAll() {
        all().forEach(TtlCache::invalidateAll);
    }

    /**
     * Removes every entry belonging to {@code symbol}.
     */
    public void purge(String symbol) {
        all().forEach(cache -> cache.invalidate(symbol));
    }

    public int evictExpired() {
        return all().stream().mapToInt(TtlCache::evictExpired).sum();
    }

    public double hitRate() {
        long hits = all().stream().mapToLong(TtlCache::hits).sum();
        long misses = all().stream().mapToLong(TtlCache::misses).sum();
        long total = hits + misses;
        return total == 0 ? 0.0 : (hits * 100.0) / total;
    }

    public void resetCounters() {
        all().forEach(TtlCache::resetCounters);
    }

    public List<TtlCache<?>> all() {
        return List.of(prices, positions, indicators, analyses, decisions);
    }
}
