package com.apex.decision.service.market;

import com.apex.decision.cache.DecisionCaches;
import com.apex.decision.model.IndicatorValues;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.PriceSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Builds the cached per-instrument {@link MarketAnalysis}.
 * <p>
 * Trend strength and volatility always come from indicator values. Direction and
 * ranging come from the indicators too, unless a custom {@link SignalProvider} is
 * active, in which case they are delegated to it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketAnalyzer {

    private final MarketDataService marketDataService;
    private final TrendClassifier trendClassifier;
    private final DecisionCaches caches;
    private final Clock clock;

    public MarketAnalysis analyze(String symbol, SignalProvider provider, boolean delegate) {
        Optional<MarketAnalysis> cached = caches.getAnalyses().get(symbol);
        if (cached.isPresent()) {
            return cached.get();
        }
        MarketAnalysis analysis = compute(symbol, provider, delegate);
        caches.getAnalyses().put(symbol, analysis);
        return analysis;
    }

    private MarketAnalysis compute(String symbol, SignalProvider provider, boolean delegate) {
        Instant now = clock.instant();
        Optional<IndicatorValues> values = marketDataService.indicators(symbol);
        double price = marketDataService.currentPrice(symbol).map(PriceSnapshot::mid).orElse(0.0);
        MarketAnalysis derived = values
                .map(value -> trendClassifier.classify(symbol, value, price, now))
                .orElseGet(() -> MarketAnalysis.unavailable(symbol, now));
        if (!delegate || provider == null) {
            return derived;
        }
        try {
            MarketDirection direction = provider.getDirection(symbol);
            boolean ranging = provider.isRanging(symbol);
            MarketDirection effective = direction == null ? MarketDirection.UNCLEAR : direction;
            return new MarketAnalysis(symbol, effective, derived.trendStrength(), ranging, derived.volatility(),
                    TrendClassifier.describe(effective, derived.trendStrength(), derived.volatility()), now);
        } catch (RuntimeException e) {
            log.warn("Signal provider failed while analysing {}: {}", symbol, e.getMessage());
            return derived;
        }
    }
}
