package com.apex.decision.dto;

import com.apex.decision.model.DecisionRecord;
import com.apex.decision.model.TradeAction;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

@Data
@Builder
public class DecisionResponse {

    private String symbol;
    private TradeAction action;
    private String label;
    private double confidence;
    private String direction;
    private String reason;
    private Instant decidedAt;
    private String positionState;
    private boolean allConditionsMet;
    private List<String> failedGates;

    public static DecisionResponse from(DecisionRecord record) {
        return DecisionResponse.builder()
                .symbol(record.symbol())
                .action(record.action())
                .label(record.action().label())
                .confidence(record.confidence())
                .direction(record.direction().name())
                .reason(record.reason())
                .decidedAt(record.decidedAt())
                .positionState(record.positions() == null ? null : record.positions().state().name())
                .allConditionsMet(record.conditions() != null && record.conditions().allMet())
                .failedGates(record.conditions() == null ? List.of() : record.conditions().failedGates())
                .build();
    }

    /**
     * Response for a request the engine refused: unregistered, not initialized or confidence out of range.
     */
    public static DecisionResponse none(String symbol, double confidence, String reason) {
        return DecisionResponse.builder()
                .symbol(symbol)
                .action(TradeAction.NONE)
                .label(TradeAction.NONE.label())
                .confidence(confidence)
                .reason(reason)
                .failedGates(List.of())
                .build();
    }
}
