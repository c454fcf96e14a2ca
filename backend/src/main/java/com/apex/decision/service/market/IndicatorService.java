package com.apex.decision.service.market;

import com.apex.decision.model.IndicatorValues;

import java.util.Optional;

/**
 * Source of raw indicator values. Results are cached by {@link MarketDataService}.
 */
public interface IndicatorService {

    Optional<IndicatorValues> compute(String symbol);

    /**
     * Releases any subscription held for {@code symbol}.
     */
    default void release(String symbol) {
    }
}
