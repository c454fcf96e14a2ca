package com.apex.decision.model;

import java.util.Locale;

/**
 * Outcome of a single decision for one instrument.
 * <p>
 * {@link #UNKNOWN} is not a decision: it is the sentinel returned when a label
 * or code cannot be parsed.
 */
public enum TradeAction {
    NONE("NONE"),
    THINKING("THINKING"),
    HOLD("HOLD"),
    OPEN_BUY("OPEN BUY"),
    OPEN_SELL("OPEN SELL"),
    ADD_BUY("ADD BUY"),
    ADD_SELL("ADD SELL"),
    CLOSE_BUY("CLOSE BUY"),
    CLOSE_SELL("CLOSE SELL"),
    CLOSE_ALL("CLOSE ALL"),
    UNKNOWN("UNKNOWN");

    private final String label;

    TradeAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isActionable() {
        return switch (this) {
            case OPEN_BUY, OPEN_SELL, ADD_BUY, ADD_SELL, CLOSE_BUY, CLOSE_SELL, CLOSE_ALL -> true;
            default -> false;
        };
    }

    public boolean isOpen() {
        return this == OPEN_BUY || this == OPEN_SELL;
    }

    public boolean isAdd() {
        return this == ADD_BUY || this == ADD_SELL;
    }

    /**
     * Actions that always produce an audit entry: opens, adds and close-all.
     */
    public boolean isLoggable() {
        return isOpen() || isAdd() || this == CLOSE_ALL;
    }

    /**
     * Side touched by this action, or {@code null} for non-actionable values.
     */
    public TradeSide side() {
        return switch (this) {
            case OPEN_BUY, ADD_BUY, CLOSE_BUY -> TradeSide.BUY;
            case OPEN_SELL, ADD_SELL, CLOSE_SELL -> TradeSide.SELL;
            case CLOSE_ALL -> TradeSide.BOTH;
            default -> null;
        };
    }

    public static String toLabel(TradeAction action) {
        return action == null ? UNKNOWN.label : action.label;
    }

    /**
     * Accepts either the display label ("OPEN BUY") or the constant name
     * ("OPEN_BUY"), case-insensitive. Anything else maps to {@link #UNKNOWN}.
     */
    public static TradeAction fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (TradeAction action : values()) {
            if (action.label.equals(normalized) || action.name().equals(normalized)) {
                return action;
            }
        }
        return UNKNOWN;
    }

    public static TradeAction fromCode(int code) {
        TradeAction[] all = values();
        if (code < 0 || code >= all.length) {
            return UNKNOWN;
        }
        return all[code];
    }
}
