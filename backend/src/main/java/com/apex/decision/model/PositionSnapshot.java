package com.apex.decision.model;

import java.time.Instant;
import java.util.List;

public record PositionSnapshot(
        String symbol,
        int buyCount,
        int sellCount,
        double buyVolume,
        double sellVolume,
        double averageBuyPrice,
        double averageSellPrice,
        double totalProfit,
        Instant oldestOpenedAt,
        Instant newestOpenedAt,
        PositionState state
) {

    public static PositionSnapshot empty(String symbol) {
        return new PositionSnapshot(symbol, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, null, null, PositionState.NO_POSITION);
    }

    public int totalCount() {
        return buyCount + sellCount;
    }

    /**
     * Aggregates a live position list; averages are volume-weighted.
     */
    public static PositionSnapshot from(String symbol, List<OpenPosition> positions) {
        if (positions == null || positions.isEmpty()) {
            return empty(symbol);
        }
        int buyCount = 0;
        int sellCount = 0;
        double buyVolume = 0.0;
        double sellVolume = 0.0;
        double buyNotional = 0.0;
        double sellNotional = 0.0;
        double profit = 0.0;
        Instant oldest = null;
        Instant newest = null;
        for (OpenPosition position : positions) {
            if (position.side() == TradeSide.BUY) {
                buyCount++;
                buyVolume += position.volume();
                buyNotional += position.volume() * position.openPrice();
            } else if (position.side() == TradeSide.SELL) {
                sellCount++;
                sellVolume += position.volume();
                sellNotional += position.volume() * position.openPrice();
            }
            profit += position.profit();
            Instant openedAt = position.openedAt();
            if (openedAt != null) {
                if (oldest == null || openedAt.isBefore(oldest)) {
                    oldest = openedAt;
                }
                if (newest == null || openedAt.isAfter(newest)) {
                    newest = openedAt;
                }
            }
        }
        return new PositionSnapshot(
                symbol,
                buyCount,
                sellCount,
                buyVolume,
                sellVolume,
                buyVolume > 0 ? buyNotional / buyVolume : 0.0,
                sellVolume > 0 ? sellNotional / sellVolume : 0.0,
                profit,
                oldest,
                newest,
                PositionState.of(buyCount, sellCount)
        );
    }
}
