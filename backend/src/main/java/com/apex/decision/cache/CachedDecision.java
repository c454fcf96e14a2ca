package com.apex.decision.cache;

import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.TradeAction;

public record CachedDecision(TradeAction action, double confidence, MarketDirection direction, String reason) {

    /**
     * Reusable when the direction is identical and confidence moved less than {@code tolerance}.
     */
    public boolean matches(double otherConfidence, MarketDirection otherDirection, double tolerance) {
        return direction == otherDirection && Math.abs(confidence - otherConfidence) < tolerance;
    }
}
