package com.funnelcore.analytics.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Objects;

/**
 * Conversion window measured from the anchor (first matched step) of an attempt.
 *
 * <p>The window is a closed interval: a timestamp equal to {@link #deadline(long)} is still inside.
 * Month arithmetic is calendar based in UTC, every other unit is a fixed duration.</p>
 */
public final class ConversionWindow implements Serializable {
    private static final long serialVersionUID = 1L;

    public enum Unit {
        SECOND(1_000L),
        MINUTE(60_000L),
        HOUR(3_600_000L),
        DAY(86_400_000L),
        WEEK(7L * 86_400_000L),
        MONTH(30L * 86_400_000L);

        private final long nominalMillis;

        Unit(long nominalMillis) {
            this.nominalMillis = nominalMillis;
        }

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        public static Unit fromLabel(String label) {
            if (label == null || label.trim().isEmpty()) {
                throw new FunnelDefinitionException(
                        FunnelDefinitionException.Kind.INVALID_WINDOW, "Missing conversion window unit");
            }
            String normalized = label.trim().toUpperCase(Locale.ROOT);
            if (normalized.endsWith("S")) {
                normalized = normalized.substring(0, normalized.length() - 1);
            }
            try {
                return Unit.valueOf(normalized);
            } catch (IllegalArgumentException ex) {
                throw new FunnelDefinitionException(
                        FunnelDefinitionException.Kind.INVALID_WINDOW, "Unknown conversion window unit: " + label, ex);
            }
        }
    }

    public static final ConversionWindow DEFAULT = new ConversionWindow(14, Unit.DAY);

    public final int interval;
    public final Unit unit;

    private ConversionWindow(int interval, Unit unit) {
        this.interval = interval;
        this.unit = unit;
    }

    public static ConversionWindow of(int interval, Unit unit) {
        if (unit == null) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_WINDOW, "Missing conversion window unit");
        }
        if (interval <= 0) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_WINDOW,
                    "Conversion window must be positive, got " + interval + " " + unit.label());
        }
        return new ConversionWindow(interval, unit);
    }

    public static ConversionWindow of(int interval, String unitLabel) {
        return of(interval, Unit.fromLabel(unitLabel));
    }

    /**
     * Latest timestamp (inclusive) that still belongs to an attempt anchored at {@code startMillis}.
     */
    public long deadline(long startMillis) {
        if (unit == Unit.MONTH) {
            return Instant.ofEpochMilli(startMillis)
                    .atOffset(ZoneOffset.UTC)
                    .plusMonths(interval)
                    .toInstant()
                    .toEpochMilli();
        }
        long span = unit.nominalMillis * interval;
        long deadline = startMillis + span;
        // Saturate instead of wrapping for anchors near Long.MAX_VALUE.
        return deadline < startMillis ? Long.MAX_VALUE : deadline;
    }

    public boolean contains(long startMillis, long candidateMillis) {
        return candidateMillis >= startMillis && candidateMillis <= deadline(startMillis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConversionWindow)) {
            return false;
        }
        ConversionWindow that = (ConversionWindow) o;
        return interval == that.interval && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval, unit);
    }

    @Override
    public String toString() {
        return interval + " " + unit.label();
    }
}
