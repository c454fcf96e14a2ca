package com.apex.decision.model;

import java.time.Instant;

public record OpenPosition(
        long ticket,
        String symbol,
        TradeSide side,
        double volume,
        double openPrice,
        double profit,
        Instant openedAt
) {}
