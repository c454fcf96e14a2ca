package com.apex.decision.model;

import java.time.Instant;

public record IndicatorValues(
        String symbol,
        double fastMa,
        double slowMa,
        double atr,
        double lastClose,
        int bars,
        Instant computedAt
) {}
