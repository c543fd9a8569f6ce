package com.funnelcore.analytics.model;

import java.io.Serializable;

/**
 * The single attempt selected for one actor, with the breakdown partition it belongs to.
 */
public final class ActorResult implements Serializable {
    private static final long serialVersionUID = 1L;

    public final String actorId;
    public final FunnelAttempt attempt;
    public final BreakdownKey breakdownKey;

    public ActorResult(String actorId, FunnelAttempt attempt, BreakdownKey breakdownKey) {
        if (attempt == null || attempt.depth() == 0) {
            throw new IllegalArgumentException("Actor result requires an attempt with at least one step");
        }
        this.actorId = actorId;
        this.attempt = attempt;
        this.breakdownKey = breakdownKey == null ? BreakdownKey.none() : breakdownKey;
    }

    public ActorResult withBreakdown(BreakdownKey key) {
        return new ActorResult(actorId, attempt, key);
    }

    public int depth() {
        return attempt.depth();
    }
}
