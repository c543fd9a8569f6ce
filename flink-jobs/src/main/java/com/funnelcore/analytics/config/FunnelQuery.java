package com.funnelcore.analytics.config;

import com.funnelcore.analytics.funnel.BreakdownResolver;
import com.funnelcore.analytics.model.FunnelDefinition;

import java.io.Serializable;

/**
 * A loaded funnel definition together with its optional breakdown.
 */
public final class FunnelQuery implements Serializable {
    private static final long serialVersionUID = 1L;

    public final FunnelDefinition definition;
    public final BreakdownResolver breakdown;

    public FunnelQuery(FunnelDefinition definition, BreakdownResolver breakdown) {
        this.definition = definition;
        this.breakdown = breakdown == null ? BreakdownResolver.NONE : breakdown;
    }

    public boolean hasBreakdown() {
        return breakdown != BreakdownResolver.NONE;
    }
}
