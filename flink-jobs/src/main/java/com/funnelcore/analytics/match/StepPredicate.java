package com.funnelcore.analytics.match;

import com.funnelcore.analytics.model.FunnelEvent;

import java.io.Serializable;

/**
 * Compiled, opaque predicate over one event. Implementations must be pure and must treat
 * missing properties as non-matching instead of failing.
 */
@FunctionalInterface
public interface StepPredicate extends Serializable {
    boolean test(FunnelEvent event);
}
