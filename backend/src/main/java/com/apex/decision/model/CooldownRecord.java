package com.apex.decision.model;

import java.time.Instant;

/**
 * Last action taken on an instrument. {@code side} is {@link TradeSide#BOTH} after a close-all.
 */
public record CooldownRecord(String symbol, TradeSide side, Instant lastActionAt, int actionCount) {

    public CooldownRecord next(TradeSide newSide, Instant at) {
        return new CooldownRecord(symbol, newSide, at, actionCount + 1);
    }
}
