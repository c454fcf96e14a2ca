package com.apex.decision.service.market;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.Candle;
import com.apex.decision.model.IndicatorValues;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Simple moving averages and Wilder ATR over the bars held by the market data provider.
 */
@Service
@RequiredArgsConstructor
public class CandleIndicatorService implements IndicatorService {

    private final MarketDataProvider marketDataProvider;
    private final DecisionEngineProperties properties;
    private final Clock clock;

    @Override
    public Optional<IndicatorValues> compute(String symbol) {
        DecisionEngineProperties.Indicators config = properties.getIndicators();
        int lookback = Math.max(config.getSlowPeriod(), config.getAtrPeriod() + 1);
        List<Candle> candles = marketDataProvider.getCandles(symbol, lookback * 3);
        if (candles.size() < lookback) {
            return Optional.empty();
        }
        double fast = sma(candles, config.getFastPeriod());
        double slow = sma(candles, config.getSlowPeriod());
        double atr = atrWilder(candles, config.getAtrPeriod());
        double lastClose = candles.get(candles.size() - 1).getClose();
        return Optional.of(new IndicatorValues(symbol, fast, slow, atr, lastClose, candles.size(), clock.instant()));
    }

    @Override
    public void release(String symbol) {
        marketDataProvider.release(symbol);
    }

    static double sma(List<Candle> candles, int period) {
        int from = Math.max(0, candles.size() - period);
        double sum = 0.0;
        for (int i = from; i < candles.size(); i++) {
            sum += candles.get(i).getClose();
        }
        int count = candles.size() - from;
        return count == 0 ? 0.0 : sum / count;
    }

    static double atrWilder(List<Candle> candles, int period) {
        if (candles.size() < period + 1) {
            return 0.0;
        }
        List<Double> tr = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            tr.add(Math.max(curr.getHigh() - curr.getLow(),
                    Math.max(Math.abs(curr.getHigh() - prev.getClose()), Math.abs(curr.getLow() - prev.getClose()))));
        }
        double atr = tr.subList(0, period).stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        for (int i = period; i < tr.size(); i++) {
            atr = ((atr * (period - 1)) + tr.get(i)) / period;
        }
        return atr;
    }
}
