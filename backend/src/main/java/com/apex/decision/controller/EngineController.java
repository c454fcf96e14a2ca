package com.apex.decision.controller;

import com.apex.decision.dto.TickRequest;
import com.apex.decision.dto.ToggleRequest;
import com.apex.decision.dto.TradeTransactionRequest;
import com.apex.decision.model.DailyStats;
import com.apex.decision.model.PriceTick;
import com.apex.decision.model.TradeLogEntry;
import com.apex.decision.model.TradeTransaction;
import com.apex.decision.service.decision.DecisionEngine;
import com.apex.decision.service.decision.EngineStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@Tag(name = "Engine")
public class EngineController {

    private final DecisionEngine engine;
    private final Clock clock;

    @GetMapping("/status")
    @Operation(summary = "Engine status and profiling counters")
    public ResponseEntity<EngineStatus> status() {
        return ResponseEntity.ok(engine.getStatus());
    }

    @PostMapping("/tick")
    @Operation(summary = "Deliver a price tick")
    public ResponseEntity<Void> tick(@Valid @RequestBody TickRequest request) {
        engine.onTick(new PriceTick(request.getSymbol(), request.getBid(), request.getAsk(),
                request.getTime() != null ? request.getTime() : clock.instant()));
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/trade-transaction")
    @Operation(summary = "Notify a position change made outside the engine")
    public ResponseEntity<Void> tradeTransaction(@RequestBody TradeTransactionRequest request) {
        engine.onTradeTransaction(new TradeTransaction(request.getSymbol(), request.getTicket(), request.getType(),
                request.getProfit(), clock.instant()));
        return ResponseEntity.accepted().build();
    }

    @GetMapping("/trades")
    @Operation(summary = "Most recent trade log entries, newest first")
    public ResponseEntity<List<TradeLogEntry>> trades(@RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(engine.getTradeHistory(limit));
    }

    @GetMapping("/stats/daily")
    @Operation(summary = "Statistics of the current stat day")
    public ResponseEntity<DailyStats> dailyStats() {
        return ResponseEntity.ok(engine.getDailyStats());
    }

    @PostMapping("/testing-mode")
    @Operation(summary = "Enable or disable testing mode (all caches bypassed)")
    public ResponseEntity<Map<String, Boolean>> testingMode(@Valid @RequestBody ToggleRequest request) {
        engine.setTestingMode(request.getEnabled());
        return ResponseEntity.ok(Map.of("testingMode", engine.isTestingMode()));
    }

    @PostMapping("/debug")
    @Operation(summary = "Enable or disable per-decision logging")
    public ResponseEntity<Map<String, Boolean>> debug(@Valid @RequestBody ToggleRequest request) {
        engine.setDebugMode(request.getEnabled());
        return ResponseEntity.ok(Map.of("debug", engine.isDebugMode()));
    }

    @PostMapping("/cache/invalidate")
    @Operation(summary = "Expire every cache")
    public ResponseEntity<Void> invalidateCaches() {
        engine.invalidateCaches();
        log.info("Caches invalidated via API");
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/statistics/reset")
    @Operation(summary = "Reset counters, trade log and daily statistics")
    public ResponseEntity<Void> resetStatistics() {
        engine.resetStatistics();
        return ResponseEntity.noContent().build();
    }
}
