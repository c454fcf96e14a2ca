package com.apex.decision.dto;

import com.apex.decision.model.InstrumentConfig;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class InstrumentResponse {

    private String symbol;
    private double buyThreshold;
    private double sellThreshold;
    private double addPositionThreshold;
    private double closePositionThreshold;
    private double closeAllThreshold;
    private long cooldownSeconds;
    private int maxPositions;
    private double riskPercent;

    public static InstrumentResponse from(InstrumentConfig config) {
        return InstrumentResponse.builder()
                .symbol(config.getSymbol())
                .buyThreshold(config.getBuyThreshold())
                .sellThreshold(config.getSellThreshold())
                .addPositionThreshold(config.getAddPositionThreshold())
                .closePositionThreshold(config.getClosePositionThreshold())
                .closeAllThreshold(config.getCloseAllThreshold())
                .cooldownSeconds(config.getCooldown().toSeconds())
                .maxPositions(config.getMaxPositions())
                .riskPercent(config.getRiskPercent())
                .build();
    }
}
