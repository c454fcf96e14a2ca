package com.apex.decision.service.market;

import com.apex.decision.model.IndicatorValues;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.PriceSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;

/**
 * Confidence is the moving-average trend strength, direction its sign, ranging an ATR floor.
 */
@Component
@RequiredArgsConstructor
public class DefaultSignalProvider implements SignalProvider {

    private final MarketDataService marketDataService;
    private final TrendClassifier trendClassifier;
    private final Clock clock;

    @Override
    public double getConfidence(String symbol) {
        return classify(symbol).map(MarketAnalysis::trendStrength).orElse(0.0);
    }

    @Override
    public MarketDirection getDirection(String symbol) {
        return classify(symbol).map(MarketAnalysis::direction).orElse(MarketDirection.UNCLEAR);
    }

    @Override
    public boolean isRanging(String symbol) {
        return classify(symbol).map(MarketAnalysis::ranging).orElse(false);
    }

    private Optional<MarketAnalysis> classify(String symbol) {
        Optional<IndicatorValues> values = marketDataService.indicators(symbol);
        if (values.isEmpty()) {
            return Optional.empty();
        }
        double price = marketDataService.currentPrice(symbol).map(PriceSnapshot::mid).orElse(0.0);
        return Optional.of(trendClassifier.classify(symbol, values.get(), price, clock.instant()));
    }
}
