package com.funnelcore.analytics.match;

import com.funnelcore.analytics.model.FunnelDefinitionException;
import com.funnelcore.analytics.model.FunnelEvent;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Property constraint evaluated against a single event's property map.
 *
 * <p>Semantics:
 * - A missing (or null) property only satisfies {@code IS_NOT_SET}.
 * - {@code EXACT} / {@code IS_NOT} accept several values and match any of them; numbers compare
 *   numerically, everything else by string form.
 * - Numeric comparisons never match non-numeric values.
 * - Regex patterns are compiled once, when the filter is built.
 * </p>
 */
public final class PropertyFilter implements StepPredicate {
    private static final long serialVersionUID = 1L;

    public enum Operator {
        EXACT,
        IS_NOT,
        ICONTAINS,
        NOT_ICONTAINS,
        REGEX,
        NOT_REGEX,
        GT,
        GTE,
        LT,
        LTE,
        IS_SET,
        IS_NOT_SET;

        public static Operator fromLabel(String label) {
            if (label == null || label.trim().isEmpty()) {
                return EXACT;
            }
            try {
                return Operator.valueOf(label.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new FunnelDefinitionException(
                        FunnelDefinitionException.Kind.INVALID_FILTER, "Unknown property operator: " + label, ex);
            }
        }
    }

    private final String key;
    private final Operator operator;
    private final List<Object> values;
    private final Pattern pattern;

    private PropertyFilter(String key, Operator operator, List<Object> values, Pattern pattern) {
        this.key = key;
        this.operator = operator;
        this.values = values;
        this.pattern = pattern;
    }

    public static PropertyFilter compile(String key, Operator operator, Object value) {
        if (key == null || key.trim().isEmpty()) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_FILTER, "Property filter requires a key");
        }
        Operator op = operator == null ? Operator.EXACT : operator;
        List<Object> normalized = normalizeValues(value);
        Pattern compiled = null;
        switch (op) {
            case REGEX:
            case NOT_REGEX:
                compiled = compilePattern(key, normalized);
                break;
            case GT:
            case GTE:
            case LT:
            case LTE:
                if (normalized.size() != 1 || toNumber(normalized.get(0)) == null) {
                    throw new FunnelDefinitionException(
                            FunnelDefinitionException.Kind.INVALID_FILTER,
                            "Numeric operator " + op + " on '" + key + "' requires one numeric value");
                }
                break;
            case IS_SET:
            case IS_NOT_SET:
                break;
            default:
                if (normalized.isEmpty()) {
                    throw new FunnelDefinitionException(
                            FunnelDefinitionException.Kind.INVALID_FILTER,
                            "Operator " + op + " on '" + key + "' requires a value");
                }
        }
        return new PropertyFilter(key, op, normalized, compiled);
    }

    public static PropertyFilter exact(String key, Object value) {
        return compile(key, Operator.EXACT, value);
    }

    public String key() {
        return key;
    }

    public Operator operator() {
        return operator;
    }

    @Override
    public boolean test(FunnelEvent event) {
        Object actual = event == null ? null : event.property(key);
        if (actual == null) {
            return operator == Operator.IS_NOT_SET;
        }
        switch (operator) {
            case IS_SET:
                return true;
            case IS_NOT_SET:
                return false;
            case EXACT:
                return anyEquals(actual);
            case IS_NOT:
                return !anyEquals(actual);
            case ICONTAINS:
                return containsIgnoreCase(actual);
            case NOT_ICONTAINS:
                return !containsIgnoreCase(actual);
            case REGEX:
                return pattern.matcher(String.valueOf(actual)).find();
            case NOT_REGEX:
                return !pattern.matcher(String.valueOf(actual)).find();
            default:
                return compareNumeric(actual);
        }
    }

    private boolean anyEquals(Object actual) {
        for (Object expected : values) {
            if (looseEquals(actual, expected)) {
                return true;
            }
        }
        return false;
    }

    private boolean containsIgnoreCase(Object actual) {
        String haystack = String.valueOf(actual).toLowerCase(Locale.ROOT);
        for (Object expected : values) {
            if (haystack.contains(String.valueOf(expected).toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private boolean compareNumeric(Object actual) {
        BigDecimal left = toNumber(actual);
        if (left == null) {
            return false;
        }
        int cmp = left.compareTo(toNumber(values.get(0)));
        switch (operator) {
            case GT:
                return cmp > 0;
            case GTE:
                return cmp >= 0;
            case LT:
                return cmp < 0;
            case LTE:
                return cmp <= 0;
            default:
                return false;
        }
    }

    static boolean looseEquals(Object actual, Object expected) {
        if (actual instanceof Number || expected instanceof Number) {
            BigDecimal a = toNumber(actual);
            BigDecimal b = toNumber(expected);
            if (a != null && b != null) {
                return a.compareTo(b) == 0;
            }
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    static BigDecimal toNumber(Object value) {
        if (value == null || value instanceof Boolean) {
            return null;
        }
        String raw = String.valueOf(value).trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(raw);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static List<Object> normalizeValues(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        List<Object> out = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    out.add(item);
                }
            }
        } else {
            out.add(value);
        }
        return Collections.unmodifiableList(out);
    }

    private static Pattern compilePattern(String key, List<Object> values) {
        if (values.size() != 1) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_FILTER, "Regex filter on '" + key + "' requires one pattern");
        }
        try {
            return Pattern.compile(String.valueOf(values.get(0)));
        } catch (PatternSyntaxException ex) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_FILTER, "Invalid regex for '" + key + "'", ex);
        }
    }

    @Override
    public String toString() {
        return "PropertyFilter{" + key + " " + operator + " " + values + "}";
    }
}
