package com.apex.decision.service.execution;

import com.apex.decision.model.ExecutionResult;
import com.apex.decision.model.OpenPosition;
import com.apex.decision.model.TradeSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Null-safe front for the execution, risk and calendar collaborators.
 * <p>
 * A missing collaborator degrades to the safe answer and collaborator exceptions are
 * logged and converted, so callers never see one.
 */
@Component
@Slf4j
public class ExecutionGateway {

    public static final int ERR_NOT_ATTACHED = -1;
    public static final int ERR_COLLABORATOR = -2;

    private final TradingCalendar calendar;
    private volatile ExecutionPort port;
    private volatile RiskAuthority riskAuthority;

    public ExecutionGateway(Optional<TradingCalendar> calendar) {
        this.calendar = calendar.orElse(null);
    }

    public void attach(ExecutionPort port, RiskAuthority riskAuthority) {
        this.port = port;
        this.riskAuthority = riskAuthority;
        log.info("Execution collaborator {} attached, risk authority {}",
                port == null ? "none" : port.getClass().getSimpleName(),
                riskAuthority == null ? "none" : riskAuthority.name());
    }

    public void detach() {
        this.port = null;
        this.riskAuthority = null;
    }

    public boolean isAttached() {
        return port != null;
    }

    public boolean hasRiskAuthority() {
        return riskAuthority != null;
    }

    public Optional<String> riskAuthorityName() {
        RiskAuthority current = riskAuthority;
        return current == null ? Optional.empty() : Optional.of(current.name());
    }

    public boolean hasCalendar() {
        return calendar != null;
    }

    public boolean withinTradingHours(Instant at) {
        if (calendar == null) {
            return true;
        }
        try {
            return calendar.isOpen(at);
        } catch (RuntimeException e) {
            log.warn("Trading calendar failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean canOpen(String symbol, TradeSide side) {
        ExecutionPort current = port;
        if (current == null) {
            return false;
        }
        try {
            return current.canOpenNewPosition(symbol, side == TradeSide.BUY);
        } catch (RuntimeException e) {
            log.warn("canOpenNewPosition failed for {} {}: {}", symbol, side, e.getMessage());
            return false;
        }
    }

    public boolean canAdd(String symbol, TradeSide side) {
        ExecutionPort current = port;
        if (current == null) {
            return false;
        }
        try {
            return current.canAddToPosition(symbol, side == TradeSide.BUY);
        } catch (RuntimeException e) {
            log.warn("canAddToPosition failed for {} {}: {}", symbol, side, e.getMessage());
            return false;
        }
    }

    /**
     * Live check: the execution collaborator must allow trading and an attached risk
     * authority must not veto the current drawdown.
     */
    public boolean isTradingAllowed() {
        ExecutionPort current = port;
        if (current == null) {
            return false;
        }
        try {
            if (!current.isTradingAllowed()) {
                return false;
            }
            RiskAuthority risk = riskAuthority;
            return risk == null || risk.allowsTrading(current.getCurrentDrawdown());
        } catch (RuntimeException e) {
            log.warn("Trading-allowed check failed: {}", e.getMessage());
            return false;
        }
    }

    public double currentDrawdown() {
        ExecutionPort current = port;
        if (current == null) {
            return 0.0;
        }
        try {
            return current.getCurrentDrawdown();
        } catch (RuntimeException e) {
            log.warn("Drawdown query failed: {}", e.getMessage());
            return 0.0;
        }
    }

    public int positionCount(String symbol, TradeSide side) {
        ExecutionPort current = port;
        if (current == null) {
            return 0;
        }
        try {
            return current.getPositionCount(symbol, side);
        } catch (RuntimeException e) {
            log.warn("Position count failed for {}: {}", symbol, e.getMessage());
            return 0;
        }
    }

    public List<OpenPosition> openPositions(String symbol) {
        ExecutionPort current = port;
        if (current == null) {
            return List.of();
        }
        try {
            List<OpenPosition> positions = current.getOpenPositions(symbol);
            return positions == null ? List.of() : positions;
        } catch (RuntimeException e) {
            log.warn("Open positions query failed for {}: {}", symbol, e.getMessage());
            return List.of();
        }
    }

    public ExecutionResult open(String symbol, TradeSide side, double riskPercent, String comment) {
        ExecutionPort current = port;
        if (current == null) {
            return notAttached();
        }
        try {
            return orFailed(current.openPosition(symbol, side == TradeSide.BUY, riskPercent, comment));
        } catch (RuntimeException e) {
            return collaboratorFailure("openPosition", symbol, e);
        }
    }

    public ExecutionResult add(String symbol, TradeSide side, double riskPercent, String comment) {
        ExecutionPort current = port;
        if (current == null) {
            return notAttached();
        }
        try {
            return orFailed(current.addToPosition(symbol, side == TradeSide.BUY, riskPercent, comment));
        } catch (RuntimeException e) {
            return collaboratorFailure("addToPosition", symbol, e);
        }
    }

    /**
     * Closes every ticket on one side. Succeeds only when every close succeeds;
     * realized profit is summed over the closes that went through.
     */
    public ExecutionResult closeSide(String symbol, TradeSide side, String reason) {
        ExecutionPort current = port;
        if (current == null) {
            return notAttached();
        }
        List<OpenPosition> tickets = openPositions(symbol).stream()
                .filter(position -> position.side() == side)
                .toList();
        if (tickets.isEmpty()) {
            return ExecutionResult.failed(ERR_COLLABORATOR, "No " + side + " positions to close");
        }
        double realized = 0.0;
        ExecutionResult lastFailure = null;
        for (OpenPosition position : tickets) {
            try {
                ExecutionResult result = orFailed(current.closePosition(position.ticket(), reason));
                if (result.success()) {
                    realized += result.realizedProfit();
                } else {
                    lastFailure = result;
                    log.warn("Close of ticket {} failed: [{}] {}", position.ticket(), result.errorCode(), result.message());
                }
            } catch (RuntimeException e) {
                lastFailure = collaboratorFailure("closePosition", symbol, e);
            }
        }
        if (lastFailure != null) {
            return new ExecutionResult(false, null, lastFailure.errorCode(), lastFailure.message(), realized);
        }
        return ExecutionResult.ok(null, realized);
    }

    public ExecutionResult closeAll(String symbol, String reason) {
        ExecutionPort current = port;
        if (current == null) {
            return notAttached();
        }
        try {
            double floating = current.getTotalProfit(symbol);
            if (current.closeAllPositions(symbol, reason)) {
                return ExecutionResult.ok(null, floating);
            }
            return ExecutionResult.failed(ERR_COLLABORATOR, "closeAllPositions reported failure");
        } catch (RuntimeException e) {
            return collaboratorFailure("closeAllPositions", symbol, e);
        }
    }

    private static ExecutionResult orFailed(ExecutionResult result) {
        return result != null ? result : ExecutionResult.failed(ERR_COLLABORATOR, "No result from collaborator");
    }

    private static ExecutionResult notAttached() {
        return ExecutionResult.failed(ERR_NOT_ATTACHED, "No execution collaborator attached");
    }

    private ExecutionResult collaboratorFailure(String operation, String symbol, RuntimeException e) {
        log.error("{} failed for {}: {}", operation, symbol, e.getMessage(), e);
        return ExecutionResult.failed(ERR_COLLABORATOR, e.getMessage());
    }
}
