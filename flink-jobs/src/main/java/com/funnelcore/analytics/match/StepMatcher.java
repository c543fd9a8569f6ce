package com.funnelcore.analytics.match;

import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.StepDefinition;

/**
 * Pure step predicate: event name first, then every compiled property predicate.
 */
public final class StepMatcher {
    private StepMatcher() {}

    public static boolean matches(FunnelEvent event, StepDefinition step) {
        if (event == null || step == null) {
            return false;
        }
        if (step.event != null && !step.event.equals(event.event)) {
            return false;
        }
        for (StepPredicate predicate : step.predicates) {
            if (!predicate.test(event)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluates every step of the funnel against one event; element i is true when step i matches.
     */
    public static boolean[] matchAll(FunnelEvent event, FunnelDefinition definition) {
        boolean[] out = new boolean[definition.stepCount()];
        for (int i = 0; i < out.length; i++) {
            out[i] = matches(event, definition.step(i));
        }
        return out;
    }
}
