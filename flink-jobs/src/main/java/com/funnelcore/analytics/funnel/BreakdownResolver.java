package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.FunnelAttempt;
import com.funnelcore.analytics.model.FunnelEvent;

import java.io.Serializable;
import java.util.List;

/**
 * Supplies the breakdown partition of one actor. Evaluated once per actor, after selection.
 */
@FunctionalInterface
public interface BreakdownResolver extends Serializable {
    BreakdownResolver NONE = (actorId, events, selected) -> BreakdownKey.none();

    /**
     * @param events the actor's sanitized events in timestamp order
     * @param selected the actor's selected attempt, never null
     */
    BreakdownKey resolve(String actorId, List<FunnelEvent> events, FunnelAttempt selected);
}
