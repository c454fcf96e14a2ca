package com.apex.decision.model;

public enum TradeSide {
    BUY,
    SELL,
    BOTH;

    public boolean covers(TradeSide other) {
        if (other == null) {
            return true;
        }
        return this == BOTH || other == BOTH || this == other;
    }

    public static TradeSide of(boolean isBuy) {
        return isBuy ? BUY : SELL;
    }
}
