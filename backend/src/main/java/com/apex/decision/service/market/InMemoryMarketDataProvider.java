package com.apex.decision.service.market;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.Candle;
import com.apex.decision.model.PriceSnapshot;
import com.apex.decision.model.PriceTick;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Aggregates mid prices from ticks into fixed-length bars.
 */
@Component
@Slf4j
public class InMemoryMarketDataProvider implements MarketDataProvider {

    private final Duration barLength;
    private final int maxBars;
    private final Map<String, PriceSnapshot> latest = new ConcurrentHashMap<>();
    private final Map<String, Deque<Candle>> bars = new ConcurrentHashMap<>();

    public InMemoryMarketDataProvider(DecisionEngineProperties properties) {
        this.barLength = properties.getIndicators().getBarLength();
        this.maxBars = properties.getIndicators().getMaxBars();
    }

    @Override
    public void onTick(PriceTick tick) {
        if (tick == null || tick.symbol() == null || tick.time() == null) {
            return;
        }
        if (!(tick.bid() > 0) || !(tick.ask() > 0)) {
            log.debug("Ignoring non-positive tick for {}", tick.symbol());
            return;
        }
        latest.put(tick.symbol(), tick.toSnapshot());
        double price = tick.toSnapshot().mid();
        Instant barStart = alignToBar(tick.time());
        Deque<Candle> series = bars.computeIfAbsent(tick.symbol(), key -> new ArrayDeque<>());
        synchronized (series) {
            Candle current = series.peekLast();
            if (current != null && current.getOpenTime().equals(barStart)) {
                current.setHigh(Math.max(current.getHigh(), price));
                current.setLow(Math.min(current.getLow(), price));
                current.setClose(price);
                current.setTicks(current.getTicks() + 1);
                return;
            }
            if (current != null && barStart.isBefore(current.getOpenTime())) {
                log.debug("Out-of-order tick for {} at {}", tick.symbol(), tick.time());
                return;
            }
            series.addLast(Candle.builder()
                    .open(price)
                    .high(price)
                    .low(price)
                    .close(price)
                    .ticks(1)
                    .openTime(barStart)
                    .build());
            trim(series);
        }
    }

    /**
     * Seeds history, e.g. a warm-up series loaded from elsewhere.
     */
    public void appendCandle(String symbol, Candle candle) {
        if (symbol == null || candle == null) {
            return;
        }
        Deque<Candle> series = bars.computeIfAbsent(symbol, key -> new ArrayDeque<>());
        synchronized (series) {
            series.addLast(candle);
            trim(series);
        }
    }

    @Override
    public Optional<PriceSnapshot> latestPrice(String symbol) {
        return Optional.ofNullable(symbol == null ? null : latest.get(symbol));
    }

    @Override
    public List<Candle> getCandles(String symbol, int limit) {
        Deque<Candle> series = symbol == null ? null : bars.get(symbol);
        if (series == null || limit <= 0) {
            return List.of();
        }
        synchronized (series) {
            List<Candle> all = new ArrayList<>(series);
            int from = Math.max(0, all.size() - limit);
            List<Candle> copy = new ArrayList<>(all.size() - from);
            for (Candle candle : all.subList(from, all.size())) {
                copy.add(candle.toBuilder().build());
            }
            return copy;
        }
    }

    @Override
    public void release(String symbol) {
        if (symbol == null) {
            return;
        }
        latest.remove(symbol);
        bars.remove(symbol);
    }

    private Instant alignToBar(Instant time) {
        long lengthMs = Math.max(1, barLength.toMillis());
        long epochMs = time.toEpochMilli();
        return Instant.ofEpochMilli(epochMs - Math.floorMod(epochMs, lengthMs));
    }

    private void trim(Deque<Candle> series) {
        while (series.size() > maxBars) {
            series.removeFirst();
        }
    }
}
