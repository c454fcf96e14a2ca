package com.apex.decision.service.execution;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.ExecutionResult;
import com.apex.decision.model.OpenPosition;
import com.apex.decision.model.PriceSnapshot;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.market.MarketDataProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory simulated broker. Fills at the latest bid/ask of the market data provider,
 * sizes positions from the risk percent and tracks balance, equity and drawdown.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "decision.execution.paper.enabled", havingValue = "true", matchIfMissing = true)
public class PaperExecutionPort implements ExecutionPort {

    public static final int ERR_NO_PRICE = 4001;
    public static final int ERR_LIMIT_REACHED = 4002;
    public static final int ERR_TRADING_DISABLED = 4003;
    public static final int ERR_UNKNOWN_TICKET = 4004;

    private final MarketDataProvider marketDataProvider;
    private final DecisionEngineProperties.Execution.Paper config;
    private final Clock clock;

    private final Map<Long, OpenPosition> positions = new LinkedHashMap<>();
    private final AtomicLong ticketSequence = new AtomicLong(1000);
    private volatile boolean tradingAllowed;
    private double balance;
    private double peakEquity;

    public PaperExecutionPort(MarketDataProvider marketDataProvider, DecisionEngineProperties properties, Clock clock) {
        this.marketDataProvider = marketDataProvider;
        this.config = properties.getExecution().getPaper();
        this.clock = clock;
        this.tradingAllowed = config.isTradingAllowed();
        this.balance = config.getStartingBalance();
        this.peakEquity = balance;
    }

    @Override
    public synchronized boolean canOpenNewPosition(String symbol, boolean isBuy) {
        return tradingAllowed && positions.size() < config.getMaxTotalPositions();
    }

    @Override
    public synchronized boolean canAddToPosition(String symbol, boolean isBuy) {
        return canOpenNewPosition(symbol, isBuy) && getPositionCount(symbol, TradeSide.of(isBuy)) > 0;
    }

    @Override
    public synchronized ExecutionResult openPosition(String symbol, boolean isBuy, double riskPercent, String comment) {
        return fill(symbol, isBuy, riskPercent, comment);
    }

    @Override
    public synchronized ExecutionResult addToPosition(String symbol, boolean isBuy, double riskPercent, String comment) {
        if (getPositionCount(symbol, TradeSide.of(isBuy)) == 0) {
            return ExecutionResult.failed(ERR_UNKNOWN_TICKET, "No " + TradeSide.of(isBuy) + " position to add to");
        }
        return fill(symbol, isBuy, riskPercent, comment);
    }

    @Override
    public synchronized ExecutionResult closePosition(long ticket, String reason) {
        OpenPosition position = positions.get(ticket);
        if (position == null) {
            return ExecutionResult.failed(ERR_UNKNOWN_TICKET, "Unknown ticket " + ticket);
        }
        Optional<PriceSnapshot> price = marketDataProvider.latestPrice(position.symbol());
        if (price.isEmpty()) {
            return ExecutionResult.failed(ERR_NO_PRICE, "No price for " + position.symbol());
        }
        double profit = profitOf(position, price.get());
        positions.remove(ticket);
        balance += profit;
        log.info("Paper close {} ticket {} {} profit {} ({})", position.symbol(), ticket, position.side(),
                String.format("%.2f", profit), reason);
        return ExecutionResult.ok(ticket, profit);
    }

    @Override
    public synchronized boolean closeAllPositions(String symbol, String reason) {
        boolean allClosed = true;
        for (OpenPosition position : openPositionsOf(symbol)) {
            if (!closePosition(position.ticket(), reason).success()) {
                allClosed = false;
            }
        }
        return allClosed;
    }

    @Override
    public synchronized int getPositionCount(String symbol, TradeSide side) {
        int count = 0;
        for (OpenPosition position : positions.values()) {
            if (position.symbol().equals(symbol) && side.covers(position.side())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public synchronized double getAveragePrice(String symbol, TradeSide side) {
        double volume = 0.0;
        double notional = 0.0;
        for (OpenPosition position : positions.values()) {
            if (position.symbol().equals(symbol) && side.covers(position.side())) {
                volume += position.volume();
                notional += position.volume() * position.openPrice();
            }
        }
        return volume > 0 ? notional / volume : 0.0;
    }

    @Override
    public synchronized double getTotalProfit(String symbol) {
        double total = 0.0;
        for (OpenPosition position : getOpenPositions(symbol)) {
            total += position.profit();
        }
        return total;
    }

    @Override
    public boolean isTradingAllowed() {
        return tradingAllowed;
    }

    public void setTradingAllowed(boolean tradingAllowed) {
        this.tradingAllowed = tradingAllowed;
        log.info("Paper trading {}", tradingAllowed ? "enabled" : "disabled");
    }

    @Override
    public synchronized double getCurrentDrawdown() {
        double equity = getEquity();
        peakEquity = Math.max(peakEquity, equity);
        if (peakEquity <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (peakEquity - equity) / peakEquity * 100.0);
    }

    @Override
    public synchronized List<OpenPosition> getOpenPositions(String symbol) {
        List<OpenPosition> marked = new ArrayList<>();
        for (OpenPosition position : openPositionsOf(symbol)) {
            double profit = marketDataProvider.latestPrice(symbol)
                    .map(price -> profitOf(position, price))
                    .orElse(0.0);
            marked.add(new OpenPosition(position.ticket(), position.symbol(), position.side(), position.volume(),
                    position.openPrice(), profit, position.openedAt()));
        }
        return marked;
    }

    public synchronized double getBalance() {
        return balance;
    }

    public synchronized double getEquity() {
        double floating = 0.0;
        for (OpenPosition position : positions.values()) {
            floating += marketDataProvider.latestPrice(position.symbol())
                    .map(price -> profitOf(position, price))
                    .orElse(0.0);
        }
        return balance + floating;
    }

    private ExecutionResult fill(String symbol, boolean isBuy, double riskPercent, String comment) {
        if (!tradingAllowed) {
            return ExecutionResult.failed(ERR_TRADING_DISABLED, "Trading disabled");
        }
        if (positions.size() >= config.getMaxTotalPositions()) {
            return ExecutionResult.failed(ERR_LIMIT_REACHED, "Max total positions reached");
        }
        Optional<PriceSnapshot> price = marketDataProvider.latestPrice(symbol);
        if (price.isEmpty()) {
            return ExecutionResult.failed(ERR_NO_PRICE, "No price for " + symbol);
        }
        TradeSide side = TradeSide.of(isBuy);
        double openPrice = isBuy ? price.get().ask() : price.get().bid();
        double volume = Math.max(0.01, riskPercent * config.getLotsPerRiskPercent());
        long ticket = ticketSequence.incrementAndGet();
        positions.put(ticket, new OpenPosition(ticket, symbol, side, volume, openPrice, 0.0, clock.instant()));
        log.info("Paper fill {} {} {} lots @ {} ticket {} ({})", symbol, side, volume, openPrice, ticket, comment);
        return ExecutionResult.ok(ticket, 0.0);
    }

    private List<OpenPosition> openPositionsOf(String symbol) {
        List<OpenPosition> matching = new ArrayList<>();
        for (OpenPosition position : positions.values()) {
            if (position.symbol().equals(symbol)) {
                matching.add(position);
            }
        }
        return matching;
    }

    private static double profitOf(OpenPosition position, PriceSnapshot price) {
        if (position.side() == TradeSide.BUY) {
            return (price.bid() - position.openPrice()) * position.volume();
        }
        return (position.openPrice() - price.ask()) * position.volume();
    }
}
