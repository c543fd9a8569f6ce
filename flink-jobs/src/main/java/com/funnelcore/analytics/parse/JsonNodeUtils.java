package com.funnelcore.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Shared JSON helpers for optional fields with safe defaults.
 */
public final class JsonNodeUtils {
    private JsonNodeUtils() {}

    /**
     * Epoch millis from a number, a digit string, or ISO-8601 text carrying an offset.
     * Returns null for anything else so callers can reject the event.
     */
    public static Long parseTimestampMillis(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        if (!node.isTextual()) {
            return null;
        }
        String raw = node.asText().trim();
        if (raw.isEmpty()) {
            return null;
        }
        if (raw.matches("\\d+")) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        try {
            return OffsetDateTime.parse(raw).toInstant().toEpochMilli();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    public static String asNullableText(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        String value = node.asText();
        return value == null || value.isEmpty() ? null : value;
    }

    public static String firstText(JsonNode root, String... fields) {
        for (String field : fields) {
            String value = asNullableText(root.path(field));
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    public static int asIntOrDefault(JsonNode node, int defaultValue) {
        if (isAbsent(node)) {
            return defaultValue;
        }
        if (node.isNumber()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException ex) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }
}
