package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.ActorResult;
import com.funnelcore.analytics.model.BreakdownKey;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Actor ids per (step, breakdown) reached by each actor's selected attempt.
 *
 * <p>Workers fill private instances, which are merged and then frozen; lookups on a frozen index
 * return unmodifiable sets. A null breakdown key in a lookup means "all partitions".</p>
 */
public final class ActorAttributionIndex implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int stepCount;
    private final Map<BreakdownKey, List<Set<String>>> byKey = new HashMap<>();
    private boolean frozen;

    public ActorAttributionIndex(int stepCount) {
        this.stepCount = stepCount;
    }

    public void record(ActorResult result) {
        checkMutable();
        List<Set<String>> steps = stepsFor(result.breakdownKey);
        int depth = Math.min(result.depth(), stepCount);
        for (int position = 0; position < depth; position++) {
            steps.get(position).add(result.actorId);
        }
    }

    public ActorAttributionIndex merge(ActorAttributionIndex other) {
        checkMutable();
        if (other == null) {
            return this;
        }
        for (Map.Entry<BreakdownKey, List<Set<String>>> entry : other.byKey.entrySet()) {
            List<Set<String>> steps = stepsFor(entry.getKey());
            for (int position = 0; position < stepCount; position++) {
                steps.get(position).addAll(entry.getValue().get(position));
            }
        }
        return this;
    }

    public ActorAttributionIndex freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Set<String> actorsAt(int stepIndex, BreakdownKey key) {
        checkStep(stepIndex);
        Set<String> out = new HashSet<>();
        for (Map.Entry<BreakdownKey, List<Set<String>>> entry : byKey.entrySet()) {
            if (key == null || key.equals(entry.getKey())) {
                out.addAll(entry.getValue().get(stepIndex));
            }
        }
        return Collections.unmodifiableSet(out);
    }

    /**
     * Actors who reached {@code stepIndex} but not the step after it.
     */
    public Set<String> actorsDroppedAfter(int stepIndex, BreakdownKey key) {
        Set<String> reached = new HashSet<>(actorsAt(stepIndex, key));
        if (stepIndex + 1 < stepCount) {
            reached.removeAll(actorsAt(stepIndex + 1, key));
        }
        return Collections.unmodifiableSet(reached);
    }

    public Set<BreakdownKey> breakdownKeys() {
        return Collections.unmodifiableSet(new TreeSet<>(byKey.keySet()));
    }

    private List<Set<String>> stepsFor(BreakdownKey key) {
        return byKey.computeIfAbsent(key == null ? BreakdownKey.none() : key, ignored -> {
            List<Set<String>> steps = new ArrayList<>(stepCount);
            for (int i = 0; i < stepCount; i++) {
                steps.add(new HashSet<>());
            }
            return steps;
        });
    }

    private void checkStep(int stepIndex) {
        if (stepIndex < 0 || stepIndex >= stepCount) {
            throw new IndexOutOfBoundsException("Step " + stepIndex + " outside funnel of " + stepCount + " steps");
        }
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("Attribution index is read-only after the pass completes");
        }
    }
}
