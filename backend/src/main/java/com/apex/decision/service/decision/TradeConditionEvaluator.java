package com.apex.decision.service.decision;

import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.TradeAction;
import com.apex.decision.model.TradeConditions;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.bookkeeping.CooldownTracker;
import com.apex.decision.service.execution.ExecutionGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Six-gate explanation of a candidate action. The report explains a decision; it does
 * not block execution, {@link DecisionValidator} does.
 */
@Component
@RequiredArgsConstructor
public class TradeConditionEvaluator {

    private final ExecutionGateway executionGateway;
    private final CooldownTracker cooldownTracker;

    public TradeConditions evaluate(InstrumentConfig config, double confidence, MarketDirection direction,
                                    TradeAction action, Instant at) {
        String symbol = config.getSymbol();
        boolean entry = action.isOpen() || action.isAdd();
        return new TradeConditions(
                ThresholdRules.confidenceMet(config, action, confidence),
                !entry || directionAligned(action, direction),
                !entry || executionGateway.positionCount(symbol, TradeSide.BOTH) < config.getMaxPositions(),
                !action.isActionable() || !cooldownTracker.isInCooldown(symbol, action.side(), config.getCooldown()),
                executionGateway.withinTradingHours(at),
                executionGateway.hasRiskAuthority()
        );
    }

    private static boolean directionAligned(TradeAction action, MarketDirection direction) {
        TradeSide side = action.side();
        if (action.isAdd()) {
            return side == direction.favouredSide();
        }
        return direction == MarketDirection.UNCLEAR || side == direction.favouredSide();
    }
}
