package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.StepResult;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns a merged {@link StepAccumulator} into ordered {@link StepResult} rows.
 *
 * <p>Semantics:
 * - count at position k = actors whose selected attempt reached k (non-increasing in k).
 * - Conversion deltas count whole-second boundaries crossed between consecutive positions.
 * - Mean and median are null when nobody converted into the step; position 0 is always null.
 * </p>
 */
public final class ConversionTimeAggregator {
    private ConversionTimeAggregator() {}

    public static long deltaSeconds(long fromMillis, long toMillis) {
        return Math.floorDiv(toMillis, 1000L) - Math.floorDiv(fromMillis, 1000L);
    }

    public static List<StepResult> aggregate(
            FunnelDefinition definition,
            StepAccumulator accumulator,
            BreakdownKey key,
            MedianMode medianMode) {
        List<StepResult> rows = new ArrayList<>(definition.stepCount());
        for (int position = 0; position < definition.stepCount(); position++) {
            StepResult row = new StepResult();
            row.order = position;
            row.name = definition.step(position).name;
            row.count = accumulator == null ? 0L : accumulator.count(position);
            if (accumulator != null && position > 0) {
                List<Long> deltas = accumulator.deltas(position);
                row.averageConversionTime = mean(accumulator.deltaSum(position), deltas.size());
                row.medianConversionTime = median(deltas, medianMode);
            }
            row.breakdownValue = key == null || key.isNone() ? null : new ArrayList<>(key.values());
            rows.add(row);
        }
        return rows;
    }

    static Double mean(long sum, int n) {
        if (n == 0) {
            return null;
        }
        return (double) sum / n;
    }

    static Double median(List<Long> deltas, MedianMode mode) {
        int n = deltas == null ? 0 : deltas.size();
        if (n == 0) {
            return null;
        }
        long[] sorted = new long[n];
        for (int i = 0; i < n; i++) {
            sorted[i] = deltas.get(i);
        }
        Arrays.sort(sorted);
        if (n % 2 == 1) {
            return (double) sorted[n / 2];
        }
        if (mode == MedianMode.LOWER) {
            return (double) sorted[(n + 1) / 2 - 1];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }
}
