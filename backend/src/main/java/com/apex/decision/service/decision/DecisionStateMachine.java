package com.apex.decision.service.decision;

import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.PositionSnapshot;
import com.apex.decision.model.PositionState;
import com.apex.decision.model.TradeAction;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.execution.ExecutionGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Routes a confidence and direction through the open, add, hold, fold and close sub-deciders
 * according to the instrument's position state.
 * <p>
 * Opening accepts {@link MarketDirection#UNCLEAR}; adding requires the exact direction of
 * the held side. When both sides are held a fold closes the buy side only, a second
 * decision is needed for the sell side.
 */
@Component
@RequiredArgsConstructor
public class DecisionStateMachine {

    private final ExecutionGateway executionGateway;

    public record Verdict(TradeAction action, String reason) {}

    public Verdict decide(InstrumentConfig config, double confidence, MarketDirection direction,
                          PositionSnapshot positions, boolean ranging) {
        PositionState state = positions.state();
        if (state == PositionState.NO_POSITION) {
            return decideOpen(config, confidence, direction);
        }
        if (ranging) {
            return decideHold(config, confidence, direction, state, "ranging market");
        }
        if (confidence < config.getCloseAllThreshold()) {
            return new Verdict(TradeAction.CLOSE_ALL,
                    format("confidence %.1f below close-all %.1f", confidence, config.getCloseAllThreshold()));
        }
        if (confidence < config.getClosePositionThreshold()) {
            return decideFold(config, confidence, state);
        }
        if (confidence >= config.getAddPositionThreshold()) {
            return decideAdd(config, confidence, direction, positions);
        }
        return decideHold(config, confidence, direction, state, "between thresholds");
    }

    private Verdict decideOpen(InstrumentConfig config, double confidence, MarketDirection direction) {
        String symbol = config.getSymbol();
        boolean buyQualifies = confidence >= config.getBuyThreshold()
                && (direction == MarketDirection.BULLISH || direction == MarketDirection.UNCLEAR)
                && executionGateway.canOpen(symbol, TradeSide.BUY);
        if (buyQualifies) {
            return new Verdict(TradeAction.OPEN_BUY,
                    format("confidence %.1f >= buy %.1f, %s", confidence, config.getBuyThreshold(), direction));
        }
        boolean sellQualifies = confidence >= config.getSellThreshold()
                && (direction == MarketDirection.BEARISH || direction == MarketDirection.UNCLEAR)
                && executionGateway.canOpen(symbol, TradeSide.SELL);
        if (sellQualifies) {
            return new Verdict(TradeAction.OPEN_SELL,
                    format("confidence %.1f >= sell %.1f, %s", confidence, config.getSellThreshold(), direction));
        }
        return new Verdict(TradeAction.THINKING, format("no entry signal at %.1f, %s", confidence, direction));
    }

    private Verdict decideFold(InstrumentConfig config, double confidence, PositionState state) {
        TradeAction action = state.holdsBuy() ? TradeAction.CLOSE_BUY : TradeAction.CLOSE_SELL;
        return new Verdict(action,
                format("confidence %.1f below close %.1f", confidence, config.getClosePositionThreshold()));
    }

    private Verdict decideAdd(InstrumentConfig config, double confidence, MarketDirection direction,
                              PositionSnapshot positions) {
        TradeSide side;
        if (direction == MarketDirection.BULLISH && positions.state().holdsBuy()) {
            side = TradeSide.BUY;
        } else if (direction == MarketDirection.BEARISH && positions.state().holdsSell()) {
            side = TradeSide.SELL;
        } else {
            return decideHold(config, confidence, direction, positions.state(),
                    "add needs " + (positions.state().holdsBuy() ? "BULLISH" : "BEARISH") + " direction");
        }
        if (positions.totalCount() >= config.getMaxPositions()) {
            return new Verdict(TradeAction.HOLD,
                    format("max positions %d reached", config.getMaxPositions()));
        }
        if (!executionGateway.canAdd(config.getSymbol(), side)) {
            return new Verdict(TradeAction.HOLD, "execution refused add to " + side);
        }
        TradeAction action = side == TradeSide.BUY ? TradeAction.ADD_BUY : TradeAction.ADD_SELL;
        return new Verdict(action,
                format("confidence %.1f >= add %.1f, %s", confidence, config.getAddPositionThreshold(), direction));
    }

    private Verdict decideHold(InstrumentConfig config, double confidence, MarketDirection direction,
                               PositionState state, String context) {
        boolean belowClose = confidence < config.getClosePositionThreshold();
        if (belowClose && state.holdsBuy() && direction == MarketDirection.BEARISH) {
            return new Verdict(TradeAction.CLOSE_BUY, format("%s: direction reversed to BEARISH at %.1f", context, confidence));
        }
        if (belowClose && state.holdsSell() && direction == MarketDirection.BULLISH) {
            return new Verdict(TradeAction.CLOSE_SELL, format("%s: direction reversed to BULLISH at %.1f", context, confidence));
        }
        return new Verdict(TradeAction.HOLD, format("%s: holding %s at %.1f", context, state, confidence));
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
