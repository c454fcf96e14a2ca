package com.apex.decision.service.execution;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.ExecutionResult;
import com.apex.decision.model.OpenPosition;
import com.apex.decision.model.PriceTick;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.market.InMemoryMarketDataProvider;
import com.apex.decision.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PaperExecutionPortTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
    private final DecisionEngineProperties properties = new DecisionEngineProperties();
    private final InMemoryMarketDataProvider marketData = new InMemoryMarketDataProvider(properties);

    @Test
    void opensAtAskAndMarksProfitAtBid() {
        PaperExecutionPort port = new PaperExecutionPort(marketData, properties, clock);
        quote(1.1000, 1.1002);

        ExecutionResult result = port.openPosition("EURUSD", true, 10.0, "test");
        quote(1.1102, 1.1104);

        assertThat(result.success()).isTrue();
        List<OpenPosition> positions = port.getOpenPositions("EURUSD");
        assertThat(positions).hasSize(1);
        assertThat(positions.get(0).openPrice()).isEqualTo(1.1002);
        assertThat(positions.get(0).volume()).isCloseTo(0.1, within(1e-9));
        assertThat(port.getTotalProfit("EURUSD")).isCloseTo(0.001, within(1e-9));
        assertThat(port.getPositionCount("EURUSD", TradeSide.BUY)).isEqualTo(1);
        assertThat(port.getPositionCount("EURUSD", TradeSide.SELL)).isZero();
    }

    @Test
    void closingRealizesProfitIntoBalance() {
        PaperExecutionPort port = new PaperExecutionPort(marketData, properties, clock);
        quote(1.1000, 1.1002);
        long ticket = port.openPosition("EURUSD", false, 100.0, "test").ticket();
        quote(1.0900, 1.0902);

        ExecutionResult closed = port.closePosition(ticket, "test");

        assertThat(closed.success()).isTrue();
        assertThat(closed.realizedProfit()).isCloseTo((1.1000 - 1.0902) * 1.0, within(1e-9));
        assertThat(port.getBalance()).isCloseTo(100_000.0 + closed.realizedProfit(), within(1e-9));
        assertThat(port.getPositionCount("EURUSD", TradeSide.BOTH)).isZero();
    }

    @Test
    void refusesWithoutPriceOrCapacity() {
        properties.getExecution().getPaper().setMaxTotalPositions(1);
        PaperExecutionPort port = new PaperExecutionPort(marketData, properties, clock);

        assertThat(port.openPosition("EURUSD", true, 1.0, "test").errorCode())
                .isEqualTo(PaperExecutionPort.ERR_NO_PRICE);

        quote(1.1000, 1.1002);
        assertThat(port.openPosition("EURUSD", true, 1.0, "test").success()).isTrue();
        assertThat(port.canOpenNewPosition("EURUSD", false)).isFalse();
        assertThat(port.openPosition("EURUSD", false, 1.0, "test").errorCode())
                .isEqualTo(PaperExecutionPort.ERR_LIMIT_REACHED);
    }

    @Test
    void addRequiresAnExistingSide() {
        PaperExecutionPort port = new PaperExecutionPort(marketData, properties, clock);
        quote(1.1000, 1.1002);

        assertThat(port.canAddToPosition("EURUSD", true)).isFalse();
        port.openPosition("EURUSD", true, 1.0, "test");
        assertThat(port.canAddToPosition("EURUSD", true)).isTrue();
        assertThat(port.addToPosition("EURUSD", false, 1.0, "test").success()).isFalse();
    }

    @Test
    void closeAllFlattensOnlyThatSymbol() {
        PaperExecutionPort port = new PaperExecutionPort(marketData, properties, clock);
        quote(1.1000, 1.1002);
        marketData.onTick(new PriceTick("GBPUSD", 1.2700, 1.2702, clock.instant()));
        port.openPosition("EURUSD", true, 1.0, "test");
        port.openPosition("EURUSD", false, 1.0, "test");
        port.openPosition("GBPUSD", true, 1.0, "test");

        assertThat(port.closeAllPositions("EURUSD", "test")).isTrue();

        assertThat(port.getPositionCount("EURUSD", TradeSide.BOTH)).isZero();
        assertThat(port.getPositionCount("GBPUSD", TradeSide.BOTH)).isEqualTo(1);
    }

    @Test
    void drawdownTracksEquityBelowPeak() {
        PaperExecutionPort port = new PaperExecutionPort(marketData, properties, clock);
        quote(100.0, 100.0);
        port.openPosition("EURUSD", true, 100.0, "test");
        quote(0.0001, 0.0001);

        assertThat(port.getCurrentDrawdown()).isGreaterThan(0.0);
    }

    private void quote(double bid, double ask) {
        marketData.onTick(new PriceTick("EURUSD", bid, ask, clock.instant()));
    }
}
