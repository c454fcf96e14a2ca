package com.apex.decision.service.market;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.IndicatorValues;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.MarketDirection;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TrendClassifierTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private final TrendClassifier classifier = new TrendClassifier(new DecisionEngineProperties());

    @Test
    void fastAboveSlowIsBullishWithScaledStrength() {
        MarketAnalysis analysis = classifier.classify("EURUSD", values(1.1011, 1.1000, 0.0020), 1.1000, NOW);

        assertThat(analysis.direction()).isEqualTo(MarketDirection.BULLISH);
        assertThat(analysis.ranging()).isFalse();
        assertThat(analysis.trendStrength()).isCloseTo(20.0, within(1e-6));
        assertThat(analysis.volatility()).isCloseTo(0.1818, within(1e-4));
    }

    @Test
    void wideSpreadSaturatesAtFullStrength() {
        MarketAnalysis analysis = classifier.classify("EURUSD", values(1.0900, 1.1000, 0.0020), 1.1000, NOW);

        assertThat(analysis.direction()).isEqualTo(MarketDirection.BEARISH);
        assertThat(analysis.trendStrength()).isEqualTo(100.0);
    }

    @Test
    void spreadInsideNeutralBandIsUnclear() {
        MarketAnalysis analysis = classifier.classify("EURUSD", values(1.10011, 1.1000, 0.0020), 1.1000, NOW);

        assertThat(analysis.direction()).isEqualTo(MarketDirection.UNCLEAR);
    }

    @Test
    void lowAtrIsRanging() {
        MarketAnalysis analysis = classifier.classify("EURUSD", values(1.1050, 1.1000, 0.0001), 1.1000, NOW);

        assertThat(analysis.ranging()).isTrue();
        assertThat(analysis.direction()).isEqualTo(MarketDirection.RANGING);
    }

    private static IndicatorValues values(double fast, double slow, double atr) {
        return new IndicatorValues("EURUSD", fast, slow, atr, slow, 40, NOW);
    }
}
