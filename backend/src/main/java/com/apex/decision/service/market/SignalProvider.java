package com.apex.decision.service.market;

import com.apex.decision.model.MarketDirection;

/**
 * Supplies the confidence, direction and ranging signals the engine decides on.
 * Implementations can be swapped at runtime.
 */
public interface SignalProvider {

    /**
     * Signal strength in [0, 100].
     */
    double getConfidence(String symbol);

    MarketDirection getDirection(String symbol);

    boolean isRanging(String symbol);
}
