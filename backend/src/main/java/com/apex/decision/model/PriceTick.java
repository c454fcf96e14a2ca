package com.apex.decision.model;

import java.time.Instant;

public record PriceTick(String symbol, double bid, double ask, Instant time) {

    public PriceSnapshot toSnapshot() {
        return new PriceSnapshot(symbol, bid, ask, time);
    }
}
