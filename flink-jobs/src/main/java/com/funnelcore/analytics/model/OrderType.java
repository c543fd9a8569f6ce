package com.funnelcore.analytics.model;

import java.util.Locale;

/**
 * Ordering discipline deciding which events may advance an in-progress attempt.
 */
public enum OrderType {
    /** Next step must match, and no earlier step may be matched in between. */
    STRICT,
    /** Next step must match; unrelated events in between are ignored. */
    SEQUENTIAL,
    /** Every step must match within the window, in any order. */
    UNORDERED;

    public static OrderType fromLabel(String label) {
        if (label == null || label.trim().isEmpty()) {
            return SEQUENTIAL;
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "strict":
                return STRICT;
            case "ordered":
            case "sequential":
                return SEQUENTIAL;
            case "unordered":
                return UNORDERED;
            default:
                throw new FunnelDefinitionException(
                        FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION, "Unknown funnel order type: " + label);
        }
    }
}
