package com.apex.decision.model;

import java.time.Instant;

public record TradeLogEntry(
        Instant timestamp,
        String symbol,
        TradeAction action,
        double confidence,
        boolean executed,
        double realizedProfit,
        int positionsBefore,
        int positionsAfter,
        String detail
) {}
