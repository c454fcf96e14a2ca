package com.apex.decision.service.decision;

import com.apex.decision.cache.DecisionCaches;
import com.apex.decision.model.ExecutionResult;
import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.TradeAction;
import com.apex.decision.model.TradeLogEntry;
import com.apex.decision.model.TradeSide;
import com.apex.decision.service.audit.AuditSink;
import com.apex.decision.service.bookkeeping.CooldownTracker;
import com.apex.decision.service.bookkeeping.DailyStatsTracker;
import com.apex.decision.service.bookkeeping.DecisionMetrics;
import com.apex.decision.service.bookkeeping.TradeLogBuffer;
import com.apex.decision.service.execution.ExecutionGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Executes actionable decisions and keeps the bookkeeping in step.
 * <p>
 * The cooldown slot is consumed whether or not the execution succeeds, and failed
 * executions are never retried here.
 */
@Component
@Slf4j
public class DecisionDispatcher {

    private final ExecutionGateway executionGateway;
    private final CooldownTracker cooldownTracker;
    private final TradeLogBuffer tradeLog;
    private final DailyStatsTracker dailyStats;
    private final DecisionMetrics metrics;
    private final DecisionCaches caches;
    private final AuditSink auditSink;
    private final Clock clock;

    public DecisionDispatcher(ExecutionGateway executionGateway,
                              CooldownTracker cooldownTracker,
                              TradeLogBuffer tradeLog,
                              DailyStatsTracker dailyStats,
                              DecisionMetrics metrics,
                              DecisionCaches caches,
                              Optional<AuditSink> auditSink,
                              Clock clock) {
        this.executionGateway = executionGateway;
        this.cooldownTracker = cooldownTracker;
        this.tradeLog = tradeLog;
        this.dailyStats = dailyStats;
        this.metrics = metrics;
        this.caches = caches;
        this.auditSink = auditSink.orElse(AuditSink.noop());
        this.clock = clock;
    }

    public record DispatchOutcome(boolean attempted, ExecutionResult result, int positionsBefore, int positionsAfter) {
        static DispatchOutcome skipped() {
            return new DispatchOutcome(false, null, 0, 0);
        }

        public boolean executed() {
            return attempted && result != null && result.success();
        }
    }

    public DispatchOutcome dispatch(InstrumentConfig config, TradeAction action, double confidence, String reason) {
        if (action == null || !action.isActionable()) {
            return DispatchOutcome.skipped();
        }
        String symbol = config.getSymbol();
        int before = executionGateway.positionCount(symbol, TradeSide.BOTH);
        ExecutionResult result = execute(config, action, confidence);
        int after = executionGateway.positionCount(symbol, TradeSide.BOTH);
        Instant now = clock.instant();

        cooldownTracker.record(symbol, action.side());
        caches.invalidateAfterExecution(symbol);

        String detail = result.success()
                ? reason
                : String.format(Locale.ROOT, "[%d] %s", result.errorCode(), result.message());
        tradeLog.append(new TradeLogEntry(now, symbol, action, confidence, result.success(),
                result.realizedProfit(), before, after, detail));
        if (result.success()) {
            dailyStats.recordTrade(action, result.realizedProfit(), now);
            log.info("Executed {} {} at confidence {} positions {} -> {}",
                    action.label(), symbol, String.format(Locale.ROOT, "%.1f", confidence), before, after);
        } else {
            log.warn("Execution of {} {} failed: [{}] {}", action.label(), symbol, result.errorCode(), result.message());
        }
        metrics.recordExecution(result.success());
        audit(symbol, action, confidence, result, before, after);
        return new DispatchOutcome(true, result, before, after);
    }

    private ExecutionResult execute(InstrumentConfig config, TradeAction action, double confidence) {
        String symbol = config.getSymbol();
        String comment = String.format(Locale.ROOT, "%s conf %.1f", action.label(), confidence);
        return switch (action) {
            case OPEN_BUY, OPEN_SELL -> executionGateway.open(symbol, action.side(), config.getRiskPercent(), comment);
            case ADD_BUY, ADD_SELL -> executionGateway.add(symbol, action.side(), config.getRiskPercent(), comment);
            case CLOSE_BUY, CLOSE_SELL -> executionGateway.closeSide(symbol, action.side(), comment);
            case CLOSE_ALL -> executionGateway.closeAll(symbol, comment);
            default -> ExecutionResult.failed(ExecutionGateway.ERR_COLLABORATOR, "Not executable: " + action);
        };
    }

    private void audit(String symbol, TradeAction action, double confidence, ExecutionResult result,
                       int before, int after) {
        try {
            auditSink.start("execution");
            auditSink.append("symbol", symbol);
            auditSink.append("action", action.label());
            auditSink.append("confidence", confidence);
            auditSink.append("success", result.success());
            auditSink.append("ticket", result.ticket());
            auditSink.append("errorCode", result.errorCode());
            auditSink.append("message", result.message());
            auditSink.append("realizedProfit", result.realizedProfit());
            auditSink.append("positionsBefore", before);
            auditSink.append("positionsAfter", after);
            auditSink.flush();
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for {}: {}", symbol, e.getMessage());
        }
    }
}
