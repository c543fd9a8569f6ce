package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.ActorResult;
import com.funnelcore.analytics.model.BreakdownKey;

import java.io.Serializable;
import java.util.Map;
import java.util.TreeMap;

/**
 * Isolated partial aggregate owned by one worker (or one Flink key) until the final reduction.
 *
 * <p>{@link #add(ActorResult)} applies a whole actor at once, so a partial is always valid for
 * exactly the actors it has seen.</p>
 */
public class FunnelPartial implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int stepCount;
    private final Map<BreakdownKey, StepAccumulator> accumulators = new TreeMap<>();
    private final ActorAttributionIndex attribution;
    private long actorsProcessed;
    private long actorsWithoutMatch;
    private long skippedEvents;

    public FunnelPartial(int stepCount) {
        this.stepCount = stepCount;
        this.attribution = new ActorAttributionIndex(stepCount);
    }

    public void add(ActorResult result, int skipped) {
        accumulators.computeIfAbsent(result.breakdownKey, ignored -> new StepAccumulator(stepCount))
                .add(result.attempt);
        attribution.record(result);
        actorsProcessed++;
        skippedEvents += skipped;
    }

    public void add(ActorResult result) {
        add(result, 0);
    }

    /** Records an actor that never matched an entry step. */
    public void addUnmatched(int skipped) {
        actorsProcessed++;
        actorsWithoutMatch++;
        skippedEvents += skipped;
    }

    public FunnelPartial merge(FunnelPartial other) {
        if (other == null) {
            return this;
        }
        if (other.stepCount != stepCount) {
            throw new IllegalArgumentException("Cannot merge partials of different funnels");
        }
        for (Map.Entry<BreakdownKey, StepAccumulator> entry : other.accumulators.entrySet()) {
            accumulators.computeIfAbsent(entry.getKey(), ignored -> new StepAccumulator(stepCount))
                    .merge(entry.getValue());
        }
        attribution.merge(other.attribution);
        actorsProcessed += other.actorsProcessed;
        actorsWithoutMatch += other.actorsWithoutMatch;
        skippedEvents += other.skippedEvents;
        return this;
    }

    /**
     * Key used to route a single-actor partial to its breakdown reducer.
     */
    public String routingKey() {
        if (accumulators.size() == 1) {
            return accumulators.keySet().iterator().next().encode();
        }
        return BreakdownKey.none().encode();
    }

    public int stepCount() {
        return stepCount;
    }

    public Map<BreakdownKey, StepAccumulator> accumulators() {
        return accumulators;
    }

    public ActorAttributionIndex attribution() {
        return attribution;
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
