package com.apex.decision.model;

import java.time.Instant;

/**
 * Direction and strength summary for one instrument.
 *
 * @param trendStrength 0-100
 * @param volatility    ATR as a percentage of price
 */
public record MarketAnalysis(
        String symbol,
        MarketDirection direction,
        double trendStrength,
        boolean ranging,
        double volatility,
        String bias,
        Instant analyzedAt
) {

    public static MarketAnalysis unavailable(String symbol, Instant at) {
        return new MarketAnalysis(symbol, MarketDirection.UNCLEAR, 0.0, false, 0.0, "No indicator data", at);
    }
}
