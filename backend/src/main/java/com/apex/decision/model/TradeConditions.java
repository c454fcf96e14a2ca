package com.apex.decision.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Six-gate report explaining a candidate action. Never cached.
 */
public record TradeConditions(
        boolean confidenceThresholdMet,
        boolean directionAligned,
        boolean positionLimitOk,
        boolean notInCooldown,
        boolean withinTradingHours,
        boolean riskManagerOk
) {

    public boolean allMet() {
        return confidenceThresholdMet
                && directionAligned
                && positionLimitOk
                && notInCooldown
                && withinTradingHours
                && riskManagerOk;
    }

    public List<String> failedGates() {
        List<String> failed = new ArrayList<>();
        if (!confidenceThresholdMet) {
            failed.add("confidence");
        }
        if (!directionAligned) {
            failed.add("direction");
        }
        if (!positionLimitOk) {
            failed.add("positionLimit");
        }
        if (!notInCooldown) {
            failed.add("cooldown");
        }
        if (!withinTradingHours) {
            failed.add("tradingHours");
        }
        if (!riskManagerOk) {
            failed.add("riskManager");
        }
        return failed;
    }
}
