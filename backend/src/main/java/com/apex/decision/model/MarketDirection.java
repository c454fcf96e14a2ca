package com.apex.decision.model;

public enum MarketDirection {
    BULLISH,
    BEARISH,
    RANGING,
    UNCLEAR;

    /**
     * Side this direction points to, or {@code null} when it favours neither.
     */
    public TradeSide favouredSide() {
        return switch (this) {
            case BULLISH -> TradeSide.BUY;
            case BEARISH -> TradeSide.SELL;
            default -> null;
        };
    }
}
