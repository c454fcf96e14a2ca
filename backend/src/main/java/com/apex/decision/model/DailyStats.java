package com.apex.decision.model;

import java.time.LocalDate;

/**
 * Trading statistics for one calendar day. Values are replaced, never mutated.
 */
public record DailyStats(
        LocalDate day,
        int trades,
        int wins,
        int losses,
        double totalProfit,
        double largestWin,
        double largestLoss,
        int buyTrades,
        int sellTrades
) {

    public static DailyStats empty(LocalDate day) {
        return new DailyStats(day, 0, 0, 0, 0.0, 0.0, 0.0, 0, 0);
    }

    public DailyStats withTrade(TradeAction action, double profit) {
        int newWins = wins;
        int newLosses = losses;
        double newLargestWin = largestWin;
        double newLargestLoss = largestLoss;
        if (profit > 0) {
            newWins++;
            newLargestWin = Math.max(largestWin, profit);
        } else if (profit < 0) {
            newLosses++;
            newLargestLoss = Math.min(largestLoss, profit);
        }
        TradeSide side = action == null ? null : action.side();
        boolean entry = action != null && (action.isOpen() || action.isAdd());
        return new DailyStats(
                day,
                trades + 1,
                newWins,
                newLosses,
                totalProfit + profit,
                newLargestWin,
                newLargestLoss,
                buyTrades + (entry && side == TradeSide.BUY ? 1 : 0),
                sellTrades + (entry && side == TradeSide.SELL ? 1 : 0)
        );
    }

    public double winRate() {
        int closed = wins + losses;
        return closed == 0 ? 0.0 : (wins * 100.0) / closed;
    }
}
