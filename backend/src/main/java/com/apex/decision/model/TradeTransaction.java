package com.apex.decision.model;

import java.time.Instant;

/**
 * Notification that positions changed, possibly outside this engine.
 */
public record TradeTransaction(String symbol, Long ticket, String type, double profit, Instant time) {}
