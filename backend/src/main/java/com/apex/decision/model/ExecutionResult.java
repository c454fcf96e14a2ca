package com.apex.decision.model;

/**
 * Broker-style result of an execution request.
 */
public record ExecutionResult(boolean success, Long ticket, int errorCode, String message, double realizedProfit) {

    public static ExecutionResult ok(Long ticket, double realizedProfit) {
        return new ExecutionResult(true, ticket, 0, "OK", realizedProfit);
    }

    public static ExecutionResult failed(int errorCode, String message) {
        return new ExecutionResult(false, null, errorCode, message, 0.0);
    }
}
