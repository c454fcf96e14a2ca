package com.apex.decision.service.market;

import com.apex.decision.cache.DecisionCaches;
import com.apex.decision.model.IndicatorValues;
import com.apex.decision.model.PriceSnapshot;
import com.apex.decision.model.PriceTick;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-through access to prices and indicator values via the price and indicator caches.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MarketDataService {

    private final MarketDataProvider marketDataProvider;
    private final IndicatorService indicatorService;
    private final DecisionCaches caches;

    public void recordTick(PriceTick tick) {
        if (tick == null || tick.symbol() == null) {
            return;
        }
        marketDataProvider.onTick(tick);
        caches.getPrices().put(tick.symbol(), tick.toSnapshot());
    }

    public Optional<PriceSnapshot> currentPrice(String symbol) {
        Optional<PriceSnapshot> cached = caches.getPrices().get(symbol);
        if (cached.isPresent()) {
            return cached;
        }
        Optional<PriceSnapshot> live = marketDataProvider.latestPrice(symbol);
        live.ifPresent(price -> caches.getPrices().put(symbol, price));
        return live;
    }

    public Optional<IndicatorValues> indicators(String symbol) {
        Optional<IndicatorValues> cached = caches.getIndicators().get(symbol);
        if (cached.isPresent()) {
            return cached;
        }
        return computeIndicators(symbol);
    }

    /**
     * Recomputes indicators for every symbol whose cached values have expired.
     *
     * @return number of symbols refreshed
     */
    public int refreshIndicators(Collection<String> symbols) {
        int refreshed = 0;
        for (String symbol : symbols) {
            if (caches.getIndicators().isFresh(symbol)) {
                continue;
            }
            if (computeIndicators(symbol).isPresent()) {
                refreshed++;
            }
        }
        return refreshed;
    }

    public void release(String symbol) {
        try {
            indicatorService.release(symbol);
        } catch (RuntimeException e) {
            log.warn("Failed to release indicator resources for {}: {}", symbol, e.getMessage());
        }
        marketDataProvider.release(symbol);
    }

    private Optional<IndicatorValues> computeIndicators(String symbol) {
        try {
            Optional<IndicatorValues> values = indicatorService.compute(symbol);
            values.ifPresent(value -> caches.getIndicators().put(symbol, value));
            return values;
        } catch (RuntimeException e) {
            log.warn("Indicator computation failed for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }
}
