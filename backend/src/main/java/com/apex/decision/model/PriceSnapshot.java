package com.apex.decision.model;

import java.time.Instant;

public record PriceSnapshot(String symbol, double bid, double ask, Instant time) {

    public double mid() {
        return (bid + ask) / 2.0;
    }

    public double spread() {
        return ask - bid;
    }
}
