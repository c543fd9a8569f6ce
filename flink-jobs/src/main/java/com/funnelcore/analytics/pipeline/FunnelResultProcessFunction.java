package com.funnelcore.analytics.pipeline;

import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.funnelcore.analytics.funnel.FunnelComputation;
import com.funnelcore.analytics.funnel.FunnelPartial;
import com.funnelcore.analytics.funnel.MedianMode;
import com.funnelcore.analytics.model.FunnelDefinition;

/**
 * Finalizes the globally merged partial: step rows on the main output, attribution rows on the
 * actors side output.
 */
public class FunnelResultProcessFunction extends ProcessFunction<FunnelPartial, String> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FunnelResultProcessFunction.class);

    private final FunnelDefinition definition;
    private final MedianMode medianMode;
    private final OutputTag<String> actorsTag;

    public FunnelResultProcessFunction(FunnelDefinition definition, MedianMode medianMode, OutputTag<String> actorsTag) {
        this.definition = definition;
        this.medianMode = medianMode;
        this.actorsTag = actorsTag;
    }

    @Override
    public void processElement(FunnelPartial partial, Context ctx, Collector<String> out) {
        FunnelComputation computation = FunnelComputation.from(definition, partial, medianMode, true);
        LOG.info("Funnel computed (actors={}, withoutMatch={}, skippedEvents={}, partitions={})",
                computation.actorsProcessed(), computation.actorsWithoutMatch(),
                computation.skippedEvents(), computation.byBreakdown().size());
        for (String row : FunnelResultRows.stepRows(computation)) {
            out.collect(row);
        }
        for (String row : FunnelResultRows.actorJsonRows(computation)) {
            ctx.output(actorsTag, row);
        }
    }
}
