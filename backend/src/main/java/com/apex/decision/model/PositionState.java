package com.apex.decision.model;

/**
 * Aggregate of the open positions an instrument holds.
 */
public enum PositionState {
    NO_POSITION,
    HAS_BUY,
    HAS_SELL,
    HAS_BOTH;

    public static PositionState of(int buyCount, int sellCount) {
        if (buyCount > 0 && sellCount > 0) {
            return HAS_BOTH;
        }
        if (buyCount > 0) {
            return HAS_BUY;
        }
        if (sellCount > 0) {
            return HAS_SELL;
        }
        return NO_POSITION;
    }

    public boolean holdsBuy() {
        return this == HAS_BUY || this == HAS_BOTH;
    }

    public boolean holdsSell() {
        return this == HAS_SELL || this == HAS_BOTH;
    }
}
