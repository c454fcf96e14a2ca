package com.apex.decision.service.execution;

/**
 * Optional risk collaborator. Its presence alone satisfies the risk gate of a decision.
 */
public interface RiskAuthority {

    String name();

    /**
     * Veto on new exposure given the execution side's current drawdown.
     */
    boolean allowsTrading(double currentDrawdownPercent);
}
