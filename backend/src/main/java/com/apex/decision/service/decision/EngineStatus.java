package com.apex.decision.service.decision;

import com.apex.decision.config.DecisionEngineProperties.CooldownMode;
import com.apex.decision.config.DecisionEngineProperties.RangingMode;
import com.apex.decision.model.DailyStats;
import lombok.Builder;

@Builder
public record EngineStatus(
        boolean initialized,
        boolean executionAttached,
        String riskAuthority,
        boolean tradingCalendar,
        boolean testingMode,
        boolean debug,
        CooldownMode cooldownMode,
        RangingMode rangingMode,
        String signalProvider,
        int instruments,
        long ticksProcessed,
        long decisions,
        long decisionCacheHits,
        long decisionCacheMisses,
        double cacheLayerHitRate,
        long executionsAttempted,
        long executionsSucceeded,
        double decisionAccuracy,
        double averageLatencyMicros,
        double maxLatencyMicros,
        int tradeLogSize,
        double currentDrawdown,
        DailyStats dailyStats
) {}
