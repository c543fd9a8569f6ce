package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.StepResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Terminal output of one pass: step rows per breakdown partition plus the frozen attribution index.
 *
 * <p>Partitions are ordered by entry count (descending) then key. With zero matched actors the
 * result holds a single unbroken-down partition whose counts are all zero.</p>
 */
public final class FunnelComputation {
    private final Map<BreakdownKey, List<StepResult>> partitions;
    private final List<StepResult> totals;
    private final ActorAttributionIndex attribution;
    private final boolean complete;
    private final long actorsProcessed;
    private final long actorsWithoutMatch;
    private final long skippedEvents;

    private FunnelComputation(
            Map<BreakdownKey, List<StepResult>> partitions,
            List<StepResult> totals,
            ActorAttributionIndex attribution,
            boolean complete,
            long actorsProcessed,
            long actorsWithoutMatch,
            long skippedEvents) {
        this.partitions = partitions;
        this.totals = totals;
        this.attribution = attribution;
        this.complete = complete;
        this.actorsProcessed = actorsProcessed;
        this.actorsWithoutMatch = actorsWithoutMatch;
        this.skippedEvents = skippedEvents;
    }

    public static FunnelComputation from(
            FunnelDefinition definition,
            FunnelPartial partial,
            MedianMode medianMode,
            boolean complete) {
        List<Map.Entry<BreakdownKey, StepAccumulator>> ordered = new ArrayList<>(partial.accumulators().entrySet());
        ordered.sort(Comparator
                .comparingLong((Map.Entry<BreakdownKey, StepAccumulator> e) -> -e.getValue().count(0))
                .thenComparing(Map.Entry::getKey));

        Map<BreakdownKey, List<StepResult>> partitions = new LinkedHashMap<>();
        StepAccumulator global = new StepAccumulator(definition.stepCount());
        for (Map.Entry<BreakdownKey, StepAccumulator> entry : ordered) {
            partitions.put(entry.getKey(), Collections.unmodifiableList(
                    ConversionTimeAggregator.aggregate(definition, entry.getValue(), entry.getKey(), medianMode)));
            global.merge(entry.getValue());
        }
        List<StepResult> totals = Collections.unmodifiableList(
                ConversionTimeAggregator.aggregate(definition, global, BreakdownKey.none(), medianMode));
        if (partitions.isEmpty()) {
            partitions.put(BreakdownKey.none(), totals);
        }
        return new FunnelComputation(
                Collections.unmodifiableMap(partitions),
                totals,
                partial.attribution().freeze(),
                complete,
                partial.actorsProcessed(),
                partial.actorsWithoutMatch(),
                partial.skippedEvents());
    }

    /** Rows across all partitions, ignoring the breakdown. */
    public List<StepResult> totals() {
        return totals;
    }

    public Map<BreakdownKey, List<StepResult>> byBreakdown() {
        return partitions;
    }

    public List<StepResult> stepsFor(BreakdownKey key) {
        return partitions.get(key == null ? BreakdownKey.none() : key);
    }

    /** All partition rows, flattened in partition order. */
    public List<StepResult> rows() {
        List<StepResult> out = new ArrayList<>();
        for (List<StepResult> rows : partitions.values()) {
            out.addAll(rows);
        }
        return out;
    }

    public Set<String> actorsAt(int stepIndex, BreakdownKey key) {
        return attribution.actorsAt(stepIndex, key);
    }

    public Set<String> actorsDroppedAfter(int stepIndex, BreakdownKey key) {
        return attribution.actorsDroppedAfter(stepIndex, key);
    }

    public ActorAttributionIndex attribution() {
        return attribution;
    }

    /** False when the pass was cancelled; rows then cover exactly the processed actors. */
    public boolean isComplete() {
        return complete;
    }

    public long actorsProcessed() {
        return actorsProcessed;
    }

    public long actorsWithoutMatch() {
        return actorsWithoutMatch;
    }

    public long skippedEvents() {
        return skippedEvents;
    }
}
