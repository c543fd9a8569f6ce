package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.ActorResult;
import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.FunnelEvent;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assigns each actor result to exactly one breakdown partition.
 */
public final class BreakdownPartitioner implements Serializable {
    private static final long serialVersionUID = 1L;

    private final BreakdownResolver resolver;

    public BreakdownPartitioner(BreakdownResolver resolver) {
        this.resolver = resolver == null ? BreakdownResolver.NONE : resolver;
    }

    public ActorResult assign(ActorResult result, List<FunnelEvent> events) {
        BreakdownKey key = resolver.resolve(result.actorId, events, result.attempt);
        return result.withBreakdown(key == null ? BreakdownKey.none() : key);
    }

    /**
     * Groups already-assigned results by key. Only non-empty partitions appear.
     */
    public static Map<BreakdownKey, List<ActorResult>> partition(Collection<ActorResult> results) {
        Map<BreakdownKey, List<ActorResult>> out = new TreeMap<>();
        for (ActorResult result : results) {
            out.computeIfAbsent(result.breakdownKey, ignored -> new ArrayList<>()).add(result);
        }
        return out;
    }
}
