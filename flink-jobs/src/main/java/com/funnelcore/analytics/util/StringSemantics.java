package com.funnelcore.analytics.util;

/**
 * Shared string semantics for blank handling.
 */
public final class StringSemantics {
    private StringSemantics() {}

    public static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
