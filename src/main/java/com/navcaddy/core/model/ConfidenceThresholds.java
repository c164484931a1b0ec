package com.navcaddy.core.model;

/**
 * Process-wide confidence cut-offs. Each tier includes its lower bound.
 */
public final class ConfidenceThresholds {

    public static final double ROUTE = 0.75;
    public static final double CONFIRM = 0.50;

    /** Parsed intents at or above this are front-loaded into clarification suggestions. */
    public static final double CLARIFY_SUGGESTION_FLOOR = 0.30;

    public enum Tier { ROUTE, CONFIRM, CLARIFY }

    private ConfidenceThresholds() {}

    public static Tier tierFor(double confidence) {
        if (confidence >= ROUTE) {
            return Tier.ROUTE;
        }
        if (confidence >= CONFIRM) {
            return Tier.CONFIRM;
        }
        return Tier.CLARIFY;
    }
}
