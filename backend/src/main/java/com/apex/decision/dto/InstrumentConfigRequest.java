package com.apex.decision.dto;

import com.apex.decision.config.DecisionEngineProperties;
import com.apex.decision.model.InstrumentConfig;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Register or update body. Omitted fields take the configured defaults on register and
 * keep their current value on update.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InstrumentConfigRequest {

    private String symbol;
    @DecimalMin("0.0") @DecimalMax("100.0")
    private Double buyThreshold;
    @DecimalMin("0.0") @DecimalMax("100.0")
    private Double sellThreshold;
    @DecimalMin("0.0") @DecimalMax("100.0")
    private Double addPositionThreshold;
    @DecimalMin("0.0") @DecimalMax("100.0")
    private Double closePositionThreshold;
    @DecimalMin("0.0") @DecimalMax("100.0")
    private Double closeAllThreshold;
    @Min(0)
    private Long cooldownSeconds;
    @Min(1)
    private Integer maxPositions;
    @DecimalMin(value = "0.0", inclusive = false) @DecimalMax("100.0")
    private Double riskPercent;

    public InstrumentConfig applyTo(InstrumentConfig base) {
        return base.toBuilder()
                .buyThreshold(buyThreshold != null ? buyThreshold : base.getBuyThreshold())
                .sellThreshold(sellThreshold != null ? sellThreshold : base.getSellThreshold())
                .addPositionThreshold(addPositionThreshold != null ? addPositionThreshold : base.getAddPositionThreshold())
                .closePositionThreshold(closePositionThreshold != null ? closePositionThreshold : base.getClosePositionThreshold())
                .closeAllThreshold(closeAllThreshold != null ? closeAllThreshold : base.getCloseAllThreshold())
                .cooldown(cooldownSeconds != null ? Duration.ofSeconds(cooldownSeconds) : base.getCooldown())
                .maxPositions(maxPositions != null ? maxPositions : base.getMaxPositions())
                .riskPercent(riskPercent != null ? riskPercent : base.getRiskPercent())
                .build();
    }

    public InstrumentConfig toConfig(DecisionEngineProperties.Defaults defaults) {
        return applyTo(defaults.toConfig(symbol));
    }
}
