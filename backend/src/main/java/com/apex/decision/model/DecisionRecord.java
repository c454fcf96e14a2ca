package com.apex.decision.model;

import java.time.Instant;

/**
 * Last decision taken for an instrument, kept for audit and replay.
 */
public record DecisionRecord(
        String symbol,
        TradeAction action,
        double confidence,
        MarketDirection direction,
        Instant decidedAt,
        String reason,
        TradeConditions conditions,
        PositionSnapshot positions,
        MarketAnalysis analysis
) {}
