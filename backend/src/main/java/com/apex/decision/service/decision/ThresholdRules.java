package com.apex.decision.service.decision;

import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.TradeAction;

/**
 * Confidence threshold each action polarity must satisfy.
 */
final class ThresholdRules {

    private ThresholdRules() {
    }

    static boolean confidenceMet(InstrumentConfig config, TradeAction action, double confidence) {
        return switch (action) {
            case OPEN_BUY -> confidence >= config.getBuyThreshold();
            case OPEN_SELL -> confidence >= config.getSellThreshold();
            case ADD_BUY, ADD_SELL -> confidence >= config.getAddPositionThreshold();
            case CLOSE_BUY, CLOSE_SELL -> confidence < config.getClosePositionThreshold();
            case CLOSE_ALL -> confidence < config.getCloseAllThreshold();
            default -> true;
        };
    }
}
