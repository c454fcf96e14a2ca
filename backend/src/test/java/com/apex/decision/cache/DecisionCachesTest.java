package com.apex.decision.cache;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.PositionSnapshot;
import com.apex.decision.model.PriceSnapshot;
import com.apex.decision.model.TradeAction;
import com.apex.decision.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class DecisionCachesTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private final DecisionCaches caches = new DecisionCaches(new DecisionEngineProperties(), clock);

    @Test
    void executionInvalidatesOnlyDecisionAndPositionOfThatSymbol() {
        caches.getDecisions().put("EURUSD", new CachedDecision(TradeAction.HOLD, 50, MarketDirection.BULLISH, "r"));
        caches.getPositions().put("EURUSD", PositionSnapshot.empty("EURUSD"));
        caches.getPrices().put("EURUSD", new PriceSnapshot("EURUSD", 1.1, 1.1002, clock.instant()));
        caches.getDecisions().put("GBPUSD", new CachedDecision(TradeAction.HOLD, 50, MarketDirection.BULLISH, "r"));

        caches.invalidateAfterExecution("EURUSD");

        assertThat(caches.getDecisions().get("EURUSD")).isEmpty();
        assertThat(caches.getPositions().get("EURUSD")).isEmpty();
        assertThat(caches.getPrices().get("EURUSD")).isPresent();
        assertThat(caches.getDecisions().get("GBPUSD")).isPresent();
    }

    @Test
    void enablingTestingModeClearsAndBypassesEverything() {
        caches.getPrices().put("EURUSD", new PriceSnapshot("EURUSD", 1.1, 1.1002, clock.instant()));

        caches.setTestingMode(true);

        assertThat(caches.getPrices().size()).isZero();
        caches.getPrices().put("EURUSD", new PriceSnapshot("EURUSD", 1.1, 1.1002, clock.instant()));
        assertThat(caches.getPrices().get("EURUSD")).isEmpty();
    }

    @Test
    void cachedDecisionMatchesWithinToleranceAndSameDirection() {
        CachedDecision cached = new CachedDecision(TradeAction.HOLD, 50.0, MarketDirection.BULLISH, "r");

        assertThat(cached.matches(50.9, MarketDirection.BULLISH, 1.0)).isTrue();
        assertThat(cached.matches(51.0, MarketDirection.BULLISH, 1.0)).isFalse();
        assertThat(cached.matches(50.0, MarketDirection.UNCLEAR, 1.0)).isFalse();
    }
}
