package com.apex.decision.service.execution;

import com.apex.decision.model.ExecutionResult;
import com.apex.decision.model.OpenPosition;
import com.apex.decision.model.TradeSide;

import java.util.List;

/**
 * Order placement collaborator. Implementations talk to a broker or simulate one.
 */
public interface ExecutionPort {

    boolean canOpenNewPosition(String symbol, boolean isBuy);

    boolean canAddToPosition(String symbol, boolean isBuy);

    ExecutionResult openPosition(String symbol, boolean isBuy, double riskPercent, String comment);

    ExecutionResult addToPosition(String symbol, boolean isBuy, double riskPercent, String comment);

    ExecutionResult closePosition(long ticket, String reason);

    boolean closeAllPositions(String symbol, String reason);

    int getPositionCount(String symbol, TradeSide side);

    double getAveragePrice(String symbol, TradeSide side);

    double getTotalProfit(String symbol);

    boolean isTradingAllowed();

    /**
     * Current drawdown from peak equity, in percent.
     */
    double getCurrentDrawdown();

    List<OpenPosition> getOpenPositions(String symbol);
}
