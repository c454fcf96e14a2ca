package com.apex.decision.support;

import com.apex.decision.model.ExecutionResult;
import com.apex.decision.model.OpenPosition;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.execution.ExecutionPort;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable execution collaborator recording every call it receives.
 */
public class FakeExecutionPort implements ExecutionPort {

    private final List<OpenPosition> positions = new ArrayList<>();
    private long nextTicket = 1;
    private boolean canOpen = true;
    private boolean tradingAllowed = true;
    private boolean failExecutions;
    private double profitPerClose;

    private int openCalls;
    private int addCalls;
    private int closeCalls;
    private int closeAllCalls;

    public void hold(String symbol, TradeSide side) {
        positions.add(new OpenPosition(nextTicket++, symbol, side, 0.01, 1.1, 0.0, Instant.EPOCH));
    }

    public void setCanOpen(boolean canOpen) {
        this.canOpen = canOpen;
    }

    public void setTradingAllowed(boolean tradingAllowed) {
        this.tradingAllowed = tradingAllowed;
    }

    public void setFailExecutions(boolean failExecutions) {
        this.failExecutions = failExecutions;
    }

    public void setProfitPerClose(double profitPerClose) {
        this.profitPerClose = profitPerClose;
    }

    public int openCalls() {
        return openCalls;
    }

    public int addCalls() {
        return addCalls;
    }

    public int closeCalls() {
        return closeCalls;
    }

    public int closeAllCalls() {
        return closeAllCalls;
    }

    @Override
    public boolean canOpenNewPosition(String symbol, boolean isBuy) {
        return canOpen;
    }

    @Override
    public boolean canAddToPosition(String symbol, boolean isBuy) {
        return canOpen;
    }

    @Override
    public ExecutionResult openPosition(String symbol, boolean isBuy, double riskPercent, String comment) {
        openCalls++;
        return fill(symbol, isBuy);
    }

    @Override
    public ExecutionResult addToPosition(String symbol, boolean isBuy, double riskPercent, String comment) {
        addCalls++;
        return fill(symbol, isBuy);
    }

    @Override
    public ExecutionResult closePosition(long ticket, String reason) {
        closeCalls++;
        if (failExecutions) {
            return ExecutionResult.failed(10006, "Rejected");
        }
        boolean removed = positions.removeIf(position -> position.ticket() == ticket);
        return removed ? ExecutionResult.ok(ticket, profitPerClose) : ExecutionResult.failed(4108, "Invalid ticket");
    }

    @Override
    public boolean closeAllPositions(String symbol, String reason) {
        closeAllCalls++;
        if (failExecutions) {
            return false;
        }
        positions.removeIf(position -> position.symbol().equals(symbol));
        return true;
    }

    @Override
    public int getPositionCount(String symbol, TradeSide side) {
        return (int) positions.stream()
                .filter(position -> position.symbol().equals(symbol) && side.covers(position.side()))
                .count();
    }

    @Override
    public double getAveragePrice(String symbol, TradeSide side) {
        return 1.1;
    }

    @Override
    public double getTotalProfit(String symbol) {
        return positions.stream()
                .filter(position -> position.symbol().equals(symbol))
                .mapToDouble(OpenPosition::profit)
                .sum();
    }

    @Override
    public boolean isTradingAllowed() {
        return tradingAllowed;
    }

    @Override
    public double getCurrentDrawdown() {
        return 0.0;
    }

    @Override
    public List<OpenPosition> getOpenPositions(String symbol) {
        return positions.stream().filter(position -> position.symbol().equals(symbol)).toList();
    }

    private ExecutionResult fill(String symbol, boolean isBuy) {
        if (failExecutions) {
            return ExecutionResult.failed(10019, "Not enough money");
        }
        long ticket = nextTicket++;
        positions.add(new OpenPosition(ticket, symbol, TradeSide.of(isBuy), 0.01, 1.1, 0.0, Instant.EPOCH));
        return ExecutionResult.ok(ticket, 0.0);
    }
}
