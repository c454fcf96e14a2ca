package com.apex.decision.service.decision;

import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.TradeAction;
import com.apex.decision.service.execution.ExecutionGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Last check before execution. Never throws; a {@code false} result means the caller holds.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DecisionValidator {

    private final ExecutionGateway executionGateway;

    public boolean validate(InstrumentConfig config, TradeAction action, double confidence) {
        if (action == null || !action.isActionable()) {
            return true;
        }
        if (!ThresholdRules.confidenceMet(config, action, confidence)) {
            log.debug("{} {} rejected: confidence {} no longer meets threshold", config.getSymbol(), action, confidence);
            return false;
        }
        if (!executionGateway.isTradingAllowed()) {
            log.debug("{} {} rejected: trading not allowed", config.getSymbol(), action);
            return false;
        }
        return true;
    }
}
