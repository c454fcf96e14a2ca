package com.apex.decision.service.decision;

import com.apex.decision.config.DecisionEngineProperties.CooldownMode;
import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.TradeAction;
import com.apex.decision.model.TradeConditions;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.bookkeeping.CooldownTracker;
import com.apex.decision.service.execution.ExecutionGateway;
import com.apex.decision.service.execution.RiskAuthority;
import com.apex.decision.service.execution.TradingCalendar;
import com.apex.decision.support.EngineFixture;
import com.apex.decision.support.FakeExecutionPort;
import com.apex.decision.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TradeConditionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");

    private final InstrumentConfig config = EngineFixture.config("EURUSD");
    private final MutableClock clock = new MutableClock(NOW);
    private final FakeExecutionPort port = new FakeExecutionPort();

    @Test
    void allGatesPassForAnAlignedOpen() {
        TradeConditions conditions = evaluator(gateway(Optional.empty()), CooldownMode.ENFORCED)
                .evaluate(config, 70, MarketDirection.BULLISH, TradeAction.OPEN_BUY, NOW);

        assertThat(conditions.allMet()).isTrue();
        assertThat(conditions.failedGates()).isEmpty();
    }

    @Test
    void missingRiskAuthorityFailsOnlyTheRiskGate() {
        ExecutionGateway gateway = new ExecutionGateway(Optional.empty());
        gateway.attach(port, null);

        TradeConditions conditions = evaluator(gateway, CooldownMode.INERT)
                .evaluate(config, 70, MarketDirection.BULLISH, TradeAction.OPEN_BUY, NOW);

        assertThat(conditions.failedGates()).containsExactly("riskManager");
    }

    @Test
    void confidenceGateFollowsActionPolarity() {
        TradeConditionEvaluator evaluator = evaluator(gateway(Optional.empty()), CooldownMode.INERT);

        assertThat(evaluator.evaluate(config, 30, MarketDirection.BEARISH, TradeAction.CLOSE_BUY, NOW)
                .confidenceThresholdMet()).isTrue();
        assertThat(evaluator.evaluate(config, 30, MarketDirection.BEARISH, TradeAction.CLOSE_ALL, NOW)
                .confidenceThresholdMet()).isFalse();
        assertThat(evaluator.evaluate(config, 70, MarketDirection.BULLISH, TradeAction.ADD_BUY, NOW)
                .confidenceThresholdMet()).isFalse();
    }

    @Test
    void directionGateAppliesOnlyToEntries() {
        TradeConditionEvaluator evaluator = evaluator(gateway(Optional.empty()), CooldownMode.INERT);

        assertThat(evaluator.evaluate(config, 80, MarketDirection.UNCLEAR, TradeAction.OPEN_SELL, NOW)
                .directionAligned()).isTrue();
        assertThat(evaluator.evaluate(config, 80, MarketDirection.UNCLEAR, TradeAction.ADD_SELL, NOW)
                .directionAligned()).isFalse();
        assertThat(evaluator.evaluate(config, 10, MarketDirection.BULLISH, TradeAction.CLOSE_ALL, NOW)
                .directionAligned()).isTrue();
    }

    @Test
    void positionLimitUsesTheLiveCount() {
        port.hold("EURUSD", TradeSide.BUY);
        port.hold("EURUSD", TradeSide.BUY);
        port.hold("EURUSD", TradeSide.SELL);

        TradeConditions conditions = evaluator(gateway(Optional.empty()), CooldownMode.INERT)
                .evaluate(config, 80, MarketDirection.BULLISH, TradeAction.ADD_BUY, NOW);

        assertThat(conditions.positionLimitOk()).isFalse();
    }

    @Test
    void cooldownAndCalendarGates() {
        CooldownTracker cooldowns = new CooldownTracker(CooldownMode.ENFORCED, clock);
        cooldowns.record("EURUSD", TradeSide.BUY);
        ExecutionGateway gateway = gateway(Optional.of(at -> new TradingCalendar.WindowDecision(false, "closed")));

        TradeConditions conditions = new TradeConditionEvaluator(gateway, cooldowns)
                .evaluate(config, 70, MarketDirection.BULLISH, TradeAction.OPEN_BUY, NOW);

        assertThat(conditions.failedGates()).containsExactly("cooldown", "tradingHours");
    }

    private TradeConditionEvaluator evaluator(ExecutionGateway gateway, CooldownMode mode) {
        return new TradeConditionEvaluator(gateway, new CooldownTracker(mode, clock));
    }

    private ExecutionGateway gateway(Optional<TradingCalendar> calendar) {
        ExecutionGateway gateway = new ExecutionGateway(calendar);
        gateway.attach(port, new RiskAuthority() {
            @Override
            public String name() {
                return "test";
            }

            @Override
            public boolean allowsTrading(double currentDrawdownPercent) {
                return true;
            }
        });
        return gateway;
    }
}
