package com.apex.decision.controller;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.dto.DecideRequest;
import com.apex.decision.dto.DecisionResponse;
import com.apex.decision.dto.InstrumentConfigRequest;
import com.apex.decision.dto.InstrumentResponse;
import com.apex.decision.exception.BadRequestException;
import com.apex.decision.exception.NotFoundException;
import com.apex.decision.model.InstrumentConfig;
import com.apex.decision.model.MarketAnalysis;
import com.apex.decision.model.MarketDirection;
import com.apex.decision.model.PositionSnapshot;
import com.apex.decision.service.decision.DecisionEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/instruments")
@RequiredArgsConstructor
@Tag(name = "Instruments")
public class InstrumentController {

    private final DecisionEngine engine;
    private final DecisionEngineProperties properties;

    @GetMapping
    @Operation(summary = "List registered instruments in registration order")
    public ResponseEntity<List<InstrumentResponse>> list() {
        return ResponseEntity.ok(engine.getSymbols().stream().map(InstrumentResponse::from).toList());
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "Get instrument parameters")
    public ResponseEntity<InstrumentResponse> get(@PathVariable String symbol) {
        return ResponseEntity.ok(InstrumentResponse.from(requireInstrument(symbol)));
    }

    @PostMapping
    @Operation(summary = "Register an instrument")
    public ResponseEntity<InstrumentResponse> register(@Valid @RequestBody InstrumentConfigRequest request) {
        if (request.getSymbol() == null || request.getSymbol().isBlank()) {
            throw new BadRequestException("symbol is required");
        }
        if (engine.hasSymbol(request.getSymbol())) {
            throw new BadRequestException("Instrument " + request.getSymbol() + " already registered");
        }
        InstrumentConfig config = checked(request.toConfig(properties.getDefaults()));
        if (!engine.addSymbol(config)) {
            throw new BadRequestException("Instrument " + config.getSymbol() + " could not be registered");
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(InstrumentResponse.from(config));
    }

    @PutMapping("/{symbol}")
    @Operation(summary = "Update instrument parameters")
    public ResponseEntity<InstrumentResponse> update(@PathVariable String symbol,
                                                     @Valid @RequestBody InstrumentConfigRequest request) {
        InstrumentConfig config = checked(request.applyTo(requireInstrument(symbol)));
        if (!engine.setSymbolParameters(config)) {
            throw new BadRequestException("Instrument " + symbol + " could not be updated");
        }
        return ResponseEntity.ok(InstrumentResponse.from(config));
    }

    @DeleteMapping("/{symbol}")
    @Operation(summary = "Remove an instrument and its cached state")
    public ResponseEntity<Void> remove(@PathVariable String symbol) {
        if (!engine.removeSymbol(symbol)) {
            throw new NotFoundException("Instrument " + symbol + " not registered");
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{symbol}/decision")
    @Operation(summary = "Last decision taken for the instrument")
    public ResponseEntity<DecisionResponse> decision(@PathVariable String symbol) {
        requireInstrument(symbol);
        return engine.getCurrentDecision(symbol)
                .map(DecisionResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException("No decision yet for " + symbol));
    }

    @GetMapping("/{symbol}/position")
    @Operation(summary = "Position snapshot")
    public ResponseEntity<PositionSnapshot> position(@PathVariable String symbol) {
        return engine.getPositionSnapshot(symbol)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> notRegistered(symbol));
    }

    @GetMapping("/{symbol}/analysis")
    @Operation(summary = "Market analysis")
    public ResponseEntity<MarketAnalysis> analysis(@PathVariable String symbol) {
        return engine.getMarketAnalysis(symbol)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> notRegistered(symbol));
    }

    @PostMapping("/{symbol}/decide")
    @Operation(summary = "Decide for an explicit confidence and direction without executing")
    public ResponseEntity<DecisionResponse> decide(@PathVariable String symbol,
                                                   @Valid @RequestBody DecideRequest request) {
        requireInstrument(symbol);
        MarketDirection direction = request.getDirection() == null ? MarketDirection.UNCLEAR : request.getDirection();
        DecisionResponse response = engine.decideDetailed(symbol, request.getConfidence(), direction)
                .map(DecisionResponse::from)
                .orElseGet(() -> DecisionResponse.none(symbol, request.getConfidence(),
                        engine.isInitialized() ? "confidence outside [0, 100]" : "engine not initialized"));
        return ResponseEntity.ok(response);
    }

    private InstrumentConfig requireInstrument(String symbol) {
        return engine.getSymbolParameters(symbol).orElseThrow(() -> notRegistered(symbol));
    }

    private static InstrumentConfig checked(InstrumentConfig config) {
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new BadRequestException(String.join("; ", errors));
        }
        return config;
    }

    private static NotFoundException notRegistered(String symbol) {
        return new NotFoundException("Instrument " + symbol + " not registered");
    }
}
