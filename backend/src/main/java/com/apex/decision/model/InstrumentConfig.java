package com.apex.decision.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-instrument thresholds and limits. Immutable; updates replace the whole value.
 */
@Value
@Builder(toBuilder = true)
public class InstrumentConfig {

    String symbol;
    double buyThreshold;
    double sellThreshold;
    double addPositionThreshold;
    double closePositionThreshold;
    double closeAllThreshold;
    Duration cooldown;
    int maxPositions;
    double riskPercent;

    /**
     * Returns the list of problems with this config; empty when it can be registered.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (symbol == null || symbol.isBlank()) {
            errors.add("symbol is required");
        }
        checkPercent(errors, "buyThreshold", buyThreshold);
        checkPercent(errors, "sellThreshold", sellThreshold);
        checkPercent(errors, "addPositionThreshold", addPositionThreshold);
        checkPercent(errors, "closePositionThreshold", closePositionThreshold);
        checkPercent(errors, "closeAllThreshold", closeAllThreshold);
        if (closeAllThreshold > closePositionThreshold) {
            errors.add("closeAllThreshold must not exceed closePositionThreshold");
        }
        if (cooldown == null || cooldown.isNegative()) {
            errors.add("cooldown must be zero or positive");
        }
        if (maxPositions < 1) {
            errors.add("maxPositions must be at least 1");
        }
        if (riskPercent <= 0 || riskPercent > 100) {
            errors.add("riskPercent must be in (0, 100]");
        }
        return errors;
    }

    private static void checkPercent(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || value < 0 || value > 100) {
            errors.add(name + " must be in [0, 100]");
        }
    }
}
