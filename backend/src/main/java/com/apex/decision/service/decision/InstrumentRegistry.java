package com.apex.decision.service.decision;

import com.apex.decision.model.DecisionRecord;
import com.apex.decision.model.InstrumentConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registered instruments in registration order, each with its last decision.
 */
@Component
public class InstrumentRegistry {

    private final Map<String, Slot> slots = new LinkedHashMap<>();

    private static final class Slot {
        private InstrumentConfig config;
        private DecisionRecord lastDecision;

        private Slot(InstrumentConfig config) {
            this.config = config;
        }
    }

    public synchronized boolean register(InstrumentConfig config) {
        if (slots.containsKey(config.getSymbol())) {
            return false;
        }
        slots.put(config.getSymbol(), new Slot(config));
        return true;
    }

    /**
     * Replaces the config in place; registration order is unchanged.
     */
    public synchronized boolean update(InstrumentConfig config) {
        Slot slot = slots.get(config.getSymbol());
        if (slot == null) {
            return false;
        }
        slot.config = config;
        return true;
    }

    public synchronized boolean unregister(String symbol) {
        return slots.remove(symbol) != null;
    }

    public synchronized boolean contains(String symbol) {
        return symbol != null && slots.containsKey(symbol);
    }

    public synchronized Optional<InstrumentConfig> find(String symbol) {
        Slot slot = symbol == null ? null : slots.get(symbol);
        return slot == null ? Optional.empty() : Optional.of(slot.config);
    }

    public synchronized int size() {
        return slots.size();
    }

    public synchronized List<String> symbols() {
        return new ArrayList<>(slots.keySet());
    }

    public synchronized List<InstrumentConfig> configs() {
        List<InstrumentConfig> configs = new ArrayList<>(slots.size());
        slots.values().forEach(slot -> configs.add(slot.config));
        return configs;
    }

    public synchronized void recordDecision(String symbol, DecisionRecord decision) {
        Slot slot = slots.get(symbol);
        if (slot != null) {
            slot.lastDecision = decision;
        }
    }

    public synchronized Optional<DecisionRecord> lastDecision(String symbol) {
        Slot slot = symbol == null ? null : slots.get(symbol);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.lastDecision);
    }
}
