package com.apex.decision.service.bookkeeping;

import com.apex.decision.model.TradeAction;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decision counters published to Micrometer, mirrored in-process for the status report.
 */
@Service
@RequiredArgsConstructor
public class DecisionMetrics {

    private final MeterRegistry meterRegistry;

    private final AtomicLong decisions = new AtomicLong();
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();
    private final AtomicLong attemptedExecutions = new AtomicLong();
    private final AtomicLong successfulExecutions = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();
    private final AtomicLong maxLatencyNanos = new AtomicLong();

    private Counter cacheHitCounter;
    private Counter cacheMissCounter;
    private Timer latencyTimer;

    @PostConstruct
    void init() {
        cacheHitCounter = Counter.builder("decision_cache_hits_total").register(meterRegistry);
        cacheMissCounter = Counter.builder("decision_cache_misses_total").register(meterRegistry);
        latencyTimer = Timer.builder("decision_latency").register(meterRegistry);
    }

    public void recordDecision(TradeAction action, boolean cacheHit, long latencyNanos) {
        decisions.incrementAndGet();
        Counter.builder("decision_total")
                .tag("action", TradeAction.toLabel(action))
                .register(meterRegistry)
                .increment();
        if (cacheHit) {
            cacheHits.incrementAndGet();
            if (cacheHitCounter != null) {
                cacheHitCounter.increment();
            }
        } else {
            cacheMisses.incrementAndGet();
            if (cacheMissCounter != null) {
                cacheMissCounter.increment();
            }
        }
        totalLatencyNanos.addAndGet(latencyNanos);
        maxLatencyNanos.accumulateAndGet(latencyNanos, Math::max);
        if (latencyTimer != null) {
            latencyTimer.record(latencyNanos, TimeUnit.NANOSECONDS);
        }
    }

    public void recordExecution(boolean success) {
        attemptedExecutions.incrementAndGet();
        if (success) {
            successfulExecutions.incrementAndGet();
        }
        Counter.builder("decision_executions_total")
                .tag("result", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Successful executions as a percentage of attempted ones; 0 before any attempt.
     */
    public double accuracy() {
        long attempted = attemptedExecutions.get();
        return attempted == 0 ? 0.0 : (successfulExecutions.get() * 100.0) / attempted;
    }

    public long decisions() {
        return decisions.get();
    }

    public long cacheHits() {
        return cacheHits.get();
    }

    public long cacheMisses() {
        return cacheMisses.get();
    }

    public long attemptedExecutions() {
        return attemptedExecutions.get();
    }

    public long successfulExecutions() {
        return successfulExecutions.get();
    }

    public double averageLatencyMicros() {
        long count = decisions.get();
        return count == 0 ? 0.0 : totalLatencyNanos.get() / 1_000.0 / count;
    }

    public double maxLatencyMicros() {
        return maxLatencyNanos.get() / 1_000.0;
    }

    public void reset() {
        decisions.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        attemptedExecutions.set(0);
        successfulExecutions.set(0);
        totalLatencyNanos.set(0);
        maxLatencyNanos.set(0);
    }
}
