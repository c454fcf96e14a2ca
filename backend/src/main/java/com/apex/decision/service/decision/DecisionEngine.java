package com.apex.decision.service.decision;

import com.apex.decision.cache.CachedDecision;
import com.apex.decision.cache.DecisionCaches;
import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.config.DecisionEngineProperties.RangingMode;
import com.apex.decision.model.DailyStats;
import com.apex.decision.model.DecisionRecord;
import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.PositionSnapshot;
import com.apex.decision.model.PositionState;
import com.apex.decision.model.PriceTick;
import com.apex.decision.model.TradeAction;
import com.apex.decision.model.TradeConditions;
import com.apex.decision.model.TradeLogEntry;
import com.apex.decision.model.TradeSide;
import com.apex.decision.model.TradeTransaction;
import com.apex.decision.service.audit.AuditSink;
import com.apex.decision.service.bookkeeping.CooldownTracker;
import com.apex.decision.service.bookkeeping.DailyStatsTracker;
import com.apex.decision.service.bookkeeping.DecisionMetrics;
import com.apex.decision.service.bookkeeping.TradeLogBuffer;
import com.apex.decision.service.execution.ExecutionGateway;
import com.apex.decision.service.execution.ExecutionPort;
import com.apex.decision.service.execution.PositionSnapshotService;
import com.apex.decision.service.execution.RiskAuthority;
import com.apex.decision.service.market.DefaultSignalProvider;
import com.apex.decision.service.market.MarketAnalyzer;
import com.apex.decision.service.market.MarketDataService;
import com.apex.decision.service.market.SignalProvider;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the decision core.
 * <p>
 * Tick, timer and trade-transaction events as well as registry changes are serialized on
 * the engine monitor, so at most one event is processed at a time. Invalid input and
 * missing collaborators never raise: the engine returns {@link TradeAction#NONE} or
 * does nothing for that event.
 */
@Service
@Slf4j
public class DecisionEngine {

    private final DecisionEngineProperties properties;
    private final InstrumentRegistry registry;
    private final DecisionCaches caches;
    private final MarketDataService marketDataService;
    private final MarketAnalyzer marketAnalyzer;
    private final SignalProvider defaultSignalProvider;
    private final PositionSnapshotService positionSnapshots;
    private final DecisionStateMachine stateMachine;
    private final TradeConditionEvaluator conditionEvaluator;
    private final DecisionValidator validator;
    private final DecisionDispatcher dispatcher;
    private final ExecutionGateway executionGateway;
    private final CooldownTracker cooldownTracker;
    private final TradeLogBuffer tradeLog;
    private final DailyStatsTracker dailyStats;
    private final DecisionMetrics metrics;
    private final AuditSink auditSink;
    private final Clock clock;

    private final AtomicReference<SignalProvider> signalProvider = new AtomicReference<>();
    private final AtomicLong ticksProcessed = new AtomicLong();
    private volatile boolean initialized;
    private volatile boolean debug;
    private Instant lastStatusReport;

    public DecisionEngine(DecisionEngineProperties properties,
                          InstrumentRegistry registry,
                          DecisionCaches caches,
                          MarketDataService marketDataService,
                          MarketAnalyzer marketAnalyzer,
                          DefaultSignalProvider defaultSignalProvider,
                          PositionSnapshotService positionSnapshots,
                          DecisionStateMachine stateMachine,
                          TradeConditionEvaluator conditionEvaluator,
                          DecisionValidator validator,
                          DecisionDispatcher dispatcher,
                          ExecutionGateway executionGateway,
                          CooldownTracker cooldownTracker,
                          TradeLogBuffer tradeLog,
                          DailyStatsTracker dailyStats,
                          DecisionMetrics metrics,
                          Optional<AuditSink> auditSink,
                          Clock clock) {
        this.properties = properties;
        this.registry = registry;
        this.caches = caches;
        this.marketDataService = marketDataService;
        this.marketAnalyzer = marketAnalyzer;
        this.defaultSignalProvider = defaultSignalProvider;
        this.positionSnapshots = positionSnapshots;
        this.stateMachine = stateMachine;
        this.conditionEvaluator = conditionEvaluator;
        this.validator = validator;
        this.dispatcher = dispatcher;
        this.executionGateway = executionGateway;
        this.cooldownTracker = cooldownTracker;
        this.tradeLog = tradeLog;
        this.dailyStats = dailyStats;
        this.metrics = metrics;
        this.auditSink = auditSink.orElse(AuditSink.noop());
        this.clock = clock;
        this.debug = properties.isDebug();
        this.signalProvider.set(defaultSignalProvider);
    }

    // ----- lifecycle -----

    public synchronized void initialize(ExecutionPort executionPort, RiskAuthority riskAuthority) {
        executionGateway.attach(executionPort, riskAuthority);
        lastStatusReport = clock.instant();
        initialized = true;
        log.info("Decision engine initialized: cooldown {}, ranging {}, testing mode {}",
                properties.getCooldownMode(), properties.getRangingMode(), caches.isTestingMode());
        note("lifecycle", "initialized");
    }

    public synchronized void deinitialize() {
        if (!initialized) {
            return;
        }
        initialized = false;
        executionGateway.detach();
        caches.invalidateAll();
        log.info("Decision engine stopped after {} decisions", metrics.decisions());
        note("lifecycle", "deinitialized");
    }

    public boolean isInitialized() {
        return initialized;
    }

    // ----- registry -----

    public synchronized boolean addSymbol(InstrumentConfig config) {
        if (config == null) {
            return false;
        }
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            log.warn("Rejected instrument {}: {}", config.getSymbol(), errors);
            return false;
        }
        if (!registry.register(config)) {
            log.warn("Instrument {} already registered", config.getSymbol());
            return false;
        }
        purgeInstrumentState(config.getSymbol());
        log.info("Registered {} buy {} sell {} add {} close {} closeAll {} cooldown {} max {} risk {}%",
                config.getSymbol(), config.getBuyThreshold(), config.getSellThreshold(),
                config.getAddPositionThreshold(), config.getClosePositionThreshold(), config.getCloseAllThreshold(),
                config.getCooldown(), config.getMaxPositions(), config.getRiskPercent());
        return true;
    }

    /**
     * Registers {@code symbol} with the configured defaults for every field not given.
     */
    public boolean quickInitialize(String symbol, double buyThreshold, double sellThreshold, double riskPercent,
                                   long cooldownMinutes, int maxPositions) {
        InstrumentConfig config = properties.getDefaults().toConfig(symbol).toBuilder()
                .buyThreshold(buyThreshold)
                .sellThreshold(sellThreshold)
                .riskPercent(riskPercent)
                .cooldown(Duration.ofMinutes(cooldownMinutes))
                .maxPositions(maxPositions)
                .build();
        return addSymbol(config);
    }

    public synchronized boolean setSymbolParameters(InstrumentConfig config) {
        if (config == null || !config.validate().isEmpty()) {
            log.warn("Rejected update for {}", config == null ? null : config.getSymbol());
            return false;
        }
        if (!registry.update(config)) {
            return false;
        }
        caches.getDecisions().invalidate(config.getSymbol());
        log.info("Updated parameters of {}", config.getSymbol());
        return true;
    }

    public synchronized boolean removeSymbol(String symbol) {
        if (!registry.unregister(symbol)) {
            return false;
        }
        purgeInstrumentState(symbol);
        marketDataService.release(symbol);
        log.info("Removed instrument {}", symbol);
        return true;
    }

    public boolean hasSymbol(String symbol) {
        return registry.contains(symbol);
    }

    public int getSymbolCount() {
        return registry.size();
    }

    public Optional<InstrumentConfig> getSymbolParameters(String symbol) {
        return registry.find(symbol);
    }

    public List<InstrumentConfig> getSymbols() {
        return registry.configs();
    }

    // ----- decisions -----

    public synchronized TradeAction decide(String symbol, double confidence, MarketDirection direction) {
        return makeDecision(symbol, confidence, direction)
                .map(DecisionRecord::action)
                .orElse(TradeAction.NONE);
    }

    /**
     * Same as {@link #decide} but returns the full record; empty when a precondition failed.
     */
    public synchronized Optional<DecisionRecord> decideDetailed(String symbol, double confidence,
                                                                MarketDirection direction) {
        return makeDecision(symbol, confidence, direction);
    }

    // ----- events -----

    public synchronized void onTick(PriceTick tick) {
        if (!initialized) {
            return;
        }
        ticksProcessed.incrementAndGet();
        marketDataService.recordTick(tick);
        List<String> symbols = registry.symbols();
        if (properties.getIndicators().isBatchRefresh()) {
            marketDataService.refreshIndicators(symbols);
        }
        for (String symbol : symbols) {
            processInstrument(symbol);
        }
    }

    public synchronized void onTimer() {
        if (!initialized) {
            return;
        }
        Instant now = clock.instant();
        dailyStats.checkRollover(now);
        caches.evictExpired();
        Duration interval = properties.getTimer().getStatusInterval();
        if (lastStatusReport == null || !Duration.between(lastStatusReport, now).minus(interval).isNegative()) {
            lastStatusReport = now;
            logStatus();
        }
    }

    public synchronized void onTradeTransaction(TradeTransaction transaction) {
        if (!initialized) {
            return;
        }
        caches.invalidateAll();
        String detail = transaction == null
                ? "unknown transaction"
                : String.format(Locale.ROOT, "%s %s ticket %s profit %.2f",
                transaction.type(), transaction.symbol(), transaction.ticket(), transaction.profit());
        log.debug("Trade transaction received, caches invalidated: {}", detail);
        note("trade-transaction", detail);
    }

    /**
     * Fetches signals for one instrument, decides and dispatches.
     */
    synchronized TradeAction processInstrument(String symbol) {
        MDC.put("symbol", symbol);
        try {
            SignalProvider provider = signalProvider.get();
            double confidence;
            MarketDirection direction;
            try {
                confidence = provider.getConfidence(symbol);
                direction = provider.getDirection(symbol);
            } catch (RuntimeException e) {
                log.warn("Signal provider failed for {}: {}", symbol, e.getMessage());
                return TradeAction.NONE;
            }
            Optional<DecisionRecord> decision = makeDecision(symbol, confidence, direction);
            if (decision.isEmpty()) {
                return TradeAction.NONE;
            }
            DecisionRecord record = decision.get();
            if (record.action().isActionable()) {
                InstrumentConfig config = registry.find(symbol).orElseThrow();
                dispatcher.dispatch(config, record.action(), confidence, record.reason());
            }
            return record.action();
        } finally {
            MDC.remove("symbol");
        }
    }

    private Optional<DecisionRecord> makeDecision(String symbol, double confidence, MarketDirection direction) {
        long started = System.nanoTime();
        if (!initialized) {
            log.debug("Decision for {} ignored: engine not initialized", symbol);
            return Optional.empty();
        }
        Optional<InstrumentConfig> found = registry.find(symbol);
        if (found.isEmpty()) {
            log.warn("Decision requested for unregistered instrument {}", symbol);
            return Optional.empty();
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 100.0) {
            log.warn("Confidence {} for {} outside [0, 100], no decision", confidence, symbol);
            return Optional.empty();
        }
        InstrumentConfig config = found.get();
        MarketDirection effectiveDirection = direction == null ? MarketDirection.UNCLEAR : direction;
        Instant now = clock.instant();

        Optional<CachedDecision> cached = caches.getDecisions().get(symbol)
                .filter(hit -> hit.matches(confidence, effectiveDirection,
                        properties.getCache().getDecisionConfidenceTolerance()));
        if (cached.isPresent()) {
            return Optional.of(replay(config, cached.get(), confidence, effectiveDirection, now, started));
        }

        SignalProvider provider = signalProvider.get();
        PositionSnapshot positions = positionSnapshots.snapshot(symbol);
        MarketAnalysis analysis = marketAnalyzer.analyze(symbol, provider, provider != defaultSignalProvider);

        DecisionStateMachine.Verdict verdict;
        TradeSide relevantSide = effectiveDirection.favouredSide();
        if (cooldownTracker.isInCooldown(symbol, relevantSide, config.getCooldown())) {
            Duration left = cooldownTracker.remaining(symbol, relevantSide, config.getCooldown());
            verdict = new DecisionStateMachine.Verdict(TradeAction.THINKING,
                    "cooldown " + left.toSeconds() + "s remaining");
        } else {
            boolean ranging = positions.state() != PositionState.NO_POSITION && isRanging(provider, symbol);
            verdict = stateMachine.decide(config, confidence, effectiveDirection, positions, ranging);
        }

        TradeAction action = verdict.action();
        String reason = verdict.reason();
        TradeConditions conditions = conditionEvaluator.evaluate(config, confidence, effectiveDirection, action, now);
        if (action.isActionable() && !validator.validate(config, action, confidence)) {
            reason = action.label() + " failed validation (" + String.join(",", conditions.failedGates()) + "): " + reason;
            action = TradeAction.HOLD;
        }

        DecisionRecord record = new DecisionRecord(symbol, action, confidence, effectiveDirection, now, reason,
                conditions, positions, analysis);
        registry.recordDecision(symbol, record);
        caches.getDecisions().put(symbol, new CachedDecision(action, confidence, effectiveDirection, reason));
        metrics.recordDecision(action, false, System.nanoTime() - started);
        if (action.isLoggable()) {
            audit(record);
        }
        if (debug) {
            log.info("{} -> {} ({}) conf {} {} gates failed {}", symbol, action.label(), reason,
                    confidence, effectiveDirection, conditions.failedGates());
        }
        return Optional.of(record);
    }

    private DecisionRecord replay(InstrumentConfig config, CachedDecision cached, double confidence,
                                  MarketDirection direction, Instant now, long started) {
        String symbol = config.getSymbol();
        TradeAction action = cached.action();
        String reason = "cached: " + cached.reason();
        TradeConditions conditions = conditionEvaluator.evaluate(config, confidence, direction, action, now);
        if (action.isActionable() && !validator.validate(config, action, confidence)) {
            reason = "cached " + action.label() + " failed validation ("
                    + String.join(",", conditions.failedGates()) + ")";
            action = TradeAction.HOLD;
        }
        Optional<DecisionRecord> previous = registry.lastDecision(symbol);
        DecisionRecord record = new DecisionRecord(symbol, action, confidence, direction, now, reason, conditions,
                previous.map(DecisionRecord::positions).orElseGet(() -> positionSnapshots.snapshot(symbol)),
                previous.map(DecisionRecord::analysis).orElse(null));
        registry.recordDecision(symbol, record);
        metrics.recordDecision(action, true, System.nanoTime() - started);
        if (action.isLoggable()) {
            audit(record);
        }
        if (debug) {
            log.info("{} -> {} from decision cache", symbol, action.label());
        }
        return record;
    }

    private boolean isRanging(SignalProvider provider, String symbol) {
        if (properties.getRangingMode() != RangingMode.PROVIDER) {
            return false;
        }
        try {
            return provider.isRanging(symbol);
        } catch (RuntimeException e) {
            log.warn("Ranging check failed for {}: {}", symbol, e.getMessage());
            return false;
        }
    }

    // ----- queries -----

    public Optional<DecisionRecord> getCurrentDecision(String symbol) {
        return registry.lastDecision(symbol);
    }

    public Optional<PositionSnapshot> getPositionSnapshot(String symbol) {
        if (!registry.contains(symbol)) {
            return Optional.empty();
        }
        return Optional.of(positionSnapshots.snapshot(symbol));
    }

    public Optional<MarketAnalysis> getMarketAnalysis(String symbol) {
        if (!registry.contains(symbol)) {
            return Optional.empty();
        }
        SignalProvider provider = signalProvider.get();
        return Optional.of(marketAnalyzer.analyze(symbol, provider, provider != defaultSignalProvider));
    }

    public List<TradeLogEntry> getTradeHistory(int count) {
        return tradeLog.recent(count);
    }

    public DailyStats getDailyStats() {
        return dailyStats.current();
    }

    public double getDecisionAccuracy() {
        return metrics.accuracy();
    }

    public EngineStatus getStatus() {
        return EngineStatus.builder()
                .initialized(initialized)
                .executionAttached(executionGateway.isAttached())
                .riskAuthority(executionGateway.riskAuthorityName().orElse(null))
                .tradingCalendar(executionGateway.hasCalendar())
                .testingMode(caches.isTestingMode())
                .debug(debug)
                .cooldownMode(properties.getCooldownMode())
                .rangingMode(properties.getRangingMode())
                .signalProvider(signalProvider.get().getClass().getSimpleName())
                .instruments(registry.size())
                .ticksProcessed(ticksProcessed.get())
                .decisions(metrics.decisions())
                .decisionCacheHits(metrics.cacheHits())
                .decisionCacheMisses(metrics.cacheMisses())
                .cacheLayerHitRate(caches.hitRate())
                .executionsAttempted(metrics.attemptedExecutions())
                .executionsSucceeded(metrics.successfulExecutions())
                .decisionAccuracy(metrics.accuracy())
                .averageLatencyMicros(metrics.averageLatencyMicros())
                .maxLatencyMicros(metrics.maxLatencyMicros())
                .tradeLogSize(tradeLog.size())
                .currentDrawdown(executionGateway.currentDrawdown())
                .dailyStats(dailyStats.current())
                .build();
    }

    public synchronized void resetStatistics() {
        metrics.reset();
        caches.resetCounters();
        tradeLog.clear();
        dailyStats.reset(clock.instant());
        ticksProcessed.set(0);
        log.info("Statistics reset");
    }

    // ----- switches -----

    public void setDebugMode(boolean enabled) {
        debug = enabled;
        log.info("Debug mode {}", enabled ? "enabled" : "disabled");
    }

    public boolean isDebugMode() {
        return debug;
    }

    public synchronized void setTestingMode(boolean enabled) {
        caches.setTestingMode(enabled);
    }

    public boolean isTestingMode() {
        return caches.isTestingMode();
    }

    /**
     * Swaps the signal provider; {@code null} restores the built-in one. Cached analyses and
     * decisions were derived from the previous provider and are dropped.
     */
    public synchronized void setSignalProvider(SignalProvider provider) {
        SignalProvider next = provider == null ? defaultSignalProvider : provider;
        signalProvider.set(next);
        caches.getAnalyses().invalidateAll();
        caches.getDecisions().invalidateAll();
        log.info("Signal provider set to {}", next.getClass().getSimpleName());
    }

    public synchronized void invalidateCaches() {
        caches.invalidateAll();
    }

    private void purgeInstrumentState(String symbol) {
        caches.purge(symbol);
        cooldownTracker.purge(symbol);
    }

    private void logStatus() {
        DailyStats stats = dailyStats.current();
        log.info("Status: {} instruments, {} decisions, decision cache {}/{} hits, cache layer hit rate {}%, "
                        + "executions {}/{}, today {} trades profit {}",
                registry.size(), metrics.decisions(), metrics.cacheHits(), metrics.decisions(),
                String.format(Locale.ROOT, "%.1f", caches.hitRate()),
                metrics.successfulExecutions(), metrics.attemptedExecutions(),
                stats.trades(), String.format(Locale.ROOT, "%.2f", stats.totalProfit()));
    }

    private void audit(DecisionRecord record) {
        try {
            auditSink.start("decision");
            auditSink.append("symbol", record.symbol());
            auditSink.append("action", record.action().label());
            auditSink.append("confidence", record.confidence());
            auditSink.append("direction", record.direction().name());
            auditSink.append("reason", record.reason());
            auditSink.append("positionState", record.positions().state().name());
            auditSink.append("failedGates", record.conditions().failedGates());
            auditSink.flush();
        } catch (RuntimeException e) {
            log.warn("Audit sink failed for {}: {}", record.symbol(), e.getMessage());
        }
    }

    private void note(String module, String message) {
        try {
            auditSink.note(module, message);
        } catch (RuntimeException e) {
            log.warn("Audit note failed: {}", e.getMessage());
        }
    }
}
