package com.apex.decision.service.execution;

import com.apex.decision.config.DecisionEngineProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "decision.risk.enabled", havingValue = "true", matchIfMissing = true)
public class DrawdownRiskAuthority implements RiskAuthority {

    private final DecisionEngineProperties properties;

    @Override
    public String name() {
        return "drawdown";
    }

    @Override
    public boolean allowsTrading(double currentDrawdownPercent) {
        double limit = properties.getRisk().getMaxDrawdownPercent();
        if (currentDrawdownPercent >= limit) {
            log.warn("Drawdown {}% reached limit {}%, trading blocked",
                    String.format(Locale.ROOT, "%.2f", currentDrawdownPercent), limit);
            return false;
        }
        return true;
    }
}
