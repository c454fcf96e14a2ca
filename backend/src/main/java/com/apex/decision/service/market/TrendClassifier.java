package com.apex.decision.service.market;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.IndicatorValues;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.MarketDirection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

/**
 * Classifies a fast/slow moving-average spread and ATR volatility into a {@link MarketAnalysis}.
 */
@Component
@RequiredArgsConstructor
public class TrendClassifier {

    private final DecisionEngineProperties properties;

    public MarketAnalysis classify(String symbol, IndicatorValues values, double price, Instant at) {
        DecisionEngineProperties.Trend config = properties.getTrend();
        double reference = price > 0 ? price : values.lastClose();
        double volatility = reference > 0 ? (values.atr() / reference) * 100.0 : 0.0;
        double spreadPercent = values.slowMa() > 0
                ? ((values.fastMa() - values.slowMa()) / values.slowMa()) * 100.0
                : 0.0;
        double strength = Math.min(100.0, (Math.abs(spreadPercent) / config.getFullStrengthPercent()) * 100.0);
        boolean ranging = volatility < config.getRangingAtrPercent();

        MarketDirection direction;
        if (ranging) {
            direction = MarketDirection.RANGING;
        } else if (Math.abs(spreadPercent) < config.getNeutralBandPercent()) {
            direction = MarketDirection.UNCLEAR;
        } else {
            direction = spreadPercent > 0 ? MarketDirection.BULLISH : MarketDirection.BEARISH;
        }
        return new MarketAnalysis(symbol, direction, strength, ranging, volatility,
                describe(direction, strength, volatility), at);
    }

    static String describe(MarketDirection direction, double strength, double volatility) {
        return String.format(Locale.ROOT, "%s strength %.1f vol %.3f%%", direction, strength, volatility);
    }
}
