package com.apex.decision.service.execution;

import java.time.Instant;

public interface TradingCalendar {

    record WindowDecision(boolean allowed, String reason) {}

    WindowDecision evaluate(Instant at);

    default boolean isOpen(Instant at) {
        return evaluate(at).allowed();
    }
}
