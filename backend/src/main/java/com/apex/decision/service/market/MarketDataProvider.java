package com.apex.decision.service.market;

import com.apex.decision.model.Candle;
import com.apex.decision.model.PriceSnapshot;
import com.apex.decision.model.PriceTick;

import java.util.List;
import java.util.Optional;

public interface MarketDataProvider {

    void onTick(PriceTick tick);

    Optional<PriceSnapshot> latestPrice(String symbol);

    /**
     * Most recent {@code limit} bars, oldest first.
     */
    List<Candle> getCandles(String symbol, int limit);

    /**
     * Drops everything held for {@code symbol}.
     */
    default void release(String symbol) {
    }
}
