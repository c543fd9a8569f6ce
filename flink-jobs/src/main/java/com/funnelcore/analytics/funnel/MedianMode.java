package com.funnelcore.analytics.funnel;

import java.util.Locale;

/**
 * Median convention for even-sized delta sets.
 */
public enum MedianMode {
    /** Mean of the two middle values (matches the reference outputs, e.g. [3600, 7200] gives 5400). */
    INTERPOLATED,
    /** Value at index ceil(n/2)-1 after ascending sort. */
    LOWER;

    public static MedianMode fromLabel(String label) {
        if (label == null || label.trim().isEmpty()) {
            return INTERPOLATED;
        }
        return MedianMode.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
