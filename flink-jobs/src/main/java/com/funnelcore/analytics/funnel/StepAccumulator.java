package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.FunnelAttempt;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Mergeable per-partition accumulator: reached counts per position plus the exact conversion
 * deltas (seconds) for every transition into that position.
 *
 * <p>Deltas are buffered rather than sketched because the median must be exact. Merging only sums
 * counts and concatenates delta lists, so the reduction result is independent of worker order
 * once deltas are sorted at finalization.</p>
 */
public class StepAccumulator implements Serializable {
    private static final long serialVersionUID = 1L;

    private final long[] counts;
    private final long[] deltaSums;
    private final List<List<Long>> deltas;

    public StepAccumulator(int stepCount) {
        this.counts = new long[stepCount];
        this.deltaSums = new long[stepCount];
        this.deltas = new ArrayList<>(stepCount);
        for (int i = 0; i < stepCount; i++) {
            deltas.add(new ArrayList<>());
        }
    }

    public void add(FunnelAttempt attempt) {
        int depth = Math.min(attempt.depth(), counts.length);
        for (int position = 0; position < depth; position++) {
            counts[position]++;
            if (position > 0) {
                long delta = ConversionTimeAggregator.deltaSeconds(
                        attempt.timestampAt(position - 1), attempt.timestampAt(position));
                deltas.get(position).add(delta);
                deltaSums[position] += delta;
            }
        }
    }

    public StepAccumulator merge(StepAccumulator other) {
        if (other == null) {
            return this;
        }
        if (other.counts.length != counts.length) {
            throw new IllegalArgumentException(
                    "Cannot merge accumulators for " + counts.length + " and " + other.counts.length + " steps");
        }
        for (int i = 0; i < counts.length; i++) {
            counts[i] += other.counts[i];
            deltaSums[i] += other.deltaSums[i];
            deltas.get(i).addAll(other.deltas.get(i));
        }
        return this;
    }

    public int stepCount() {
        return counts.length;
    }

    public long count(int position) {
        return counts[position];
    }

    public long deltaSum(int position) {
        return deltaSums[position];
    }

    public List<Long> deltas(int position) {
        return deltas.get(position);
    }
}
