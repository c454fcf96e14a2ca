package com.apex.decision.service.bookkeeping;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.TradeLogEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fixed-capacity ring of trade log entries. The oldest entry is overwritten once full.
 */
@Component
public class TradeLogBuffer {

    private final TradeLogEntry[] entries;
    private int next;
    private int size;

    @Autowired
    public TradeLogBuffer(DecisionEngineProperties properties) {
        this(properties.getTradeLog().getCapacity());
    }

    public TradeLogBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.entries = new TradeLogEntry[capacity];
    }

    public synchronized void append(TradeLogEntry entry) {
        entries[next] = entry;
        next = (next + 1) % entries.length;
        if (size < entries.length) {
            size++;
        }
    }

    /**
     * Up to {@code count} most recent entries, newest first.
     */
    public synchronized List<TradeLogEntry> recent(int count) {
        int limit = Math.min(Math.max(count, 0), size);
        List<TradeLogEntry> result = new ArrayList<>(limit);
        for (int i = 1; i <= limit; i++) {
            int index = Math.floorMod(next - i, entries.length);
            result.add(entries[index]);
        }
        return result;
    }

    public synchronized int size() {
        return size;
    }

    public int capacity() {
        return entries.length;
    }

    public synchronized void clear() {
        Arrays.fill(entries, null);
        next = 0;
        size = 0;
    }
}
