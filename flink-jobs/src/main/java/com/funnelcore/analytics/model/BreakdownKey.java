package com.funnelcore.analytics.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Partition key for breakdown results. The empty key stands for "no breakdown".
 */
public final class BreakdownKey implements Serializable, Comparable<BreakdownKey> {
    private static final long serialVersionUID = 1L;

    private static final char SEPARATOR = '\u001f';
    private static final char ESCAPE = '\\';
    private static final BreakdownKey NONE = new BreakdownKey(new ArrayList<>());

    private final List<String> values;

    private BreakdownKey(List<String> values) {
        this.values = values;
    }

    public static BreakdownKey none() {
        return NONE;
    }

    public static BreakdownKey of(String... values) {
        return of(Arrays.asList(values));
    }

    public static BreakdownKey of(List<String> values) {
        if (values == null || values.isEmpty()) {
            return NONE;
        }
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            copy.add(value == null ? "" : value);
        }
        return new BreakdownKey(copy);
    }

    /** Inverse of {@link #encode()}. */
    public static BreakdownKey decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return NONE;
        }
        // Every value starts with a separator, which keeps a single empty-string value distinct from NONE.
        if (encoded.charAt(0) != SEPARATOR) {
            throw new IllegalArgumentException("Not an encoded breakdown key: " + encoded);
        }
        List<String> values = new ArrayList<>();
        StringBuilder current = null;
        for (int i = 0; i < encoded.length(); i++) {
            char c = encoded.charAt(i);
            if (c == ESCAPE && i + 1 < encoded.length()) {
                current.append(encoded.charAt(++i));
            } else if (c == SEPARATOR) {
                if (current != null) {
                    values.add(current.toString());
                }
                current = new StringBuilder();
            } else {
                current.append(c);
            }
        }
        values.add(current.toString());
        return of(values);
    }

    public boolean isNone() {
        return values.isEmpty();
    }

    public List<String> values() {
        return Collections.unmodifiableList(values);
    }

    /** Stable string form usable as a Flink key. */
    public String encode() {
        if (values.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (String value : values) {
            sb.append(SEPARATOR);
            for (int i = 0; i < value.length(); i++) {
                char c = value.charAt(i);
                if (c == SEPARATOR || c == ESCAPE) {
                    sb.append(ESCAPE);
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }

    @Override
    public int compareTo(BreakdownKey other) {
        int shared = Math.min(values.size(), other.values.size());
        for (int i = 0; i < shared; i++) {
            int cmp = values.get(i).compareTo(other.values.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(values.size(), other.values.size());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BreakdownKey)) {
            return false;
        }
        return values.equals(((BreakdownKey) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return isNone() ? "<none>" : values.toString();
    }
}
