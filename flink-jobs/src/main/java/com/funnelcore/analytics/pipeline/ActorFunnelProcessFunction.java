package com.funnelcore.analytics.pipeline;

import org.apache.flink.api.common.state.ListState;
import org.apache.flink.api.common.state.ListStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.funnelcore.analytics.config.FunnelQuery;
import com.funnelcore.analytics.funnel.ActorFunnelEvaluator;
import com.funnelcore.analytics.funnel.FunnelPartial;
import com.funnelcore.analytics.model.FunnelEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Buffers every event of one actor and evaluates the funnel once the input is exhausted.
 *
 * <p>The operator is keyed by actor id. A single event-time timer at {@link Long#MAX_VALUE}
 * fires on the final watermark of the bounded run; its output is a one-actor
 * {@link FunnelPartial} ready for the breakdown reduction.</p>
 */
public class ActorFunnelProcessFunction extends KeyedProcessFunction<String, FunnelEvent, FunnelPartial> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ActorFunnelProcessFunction.class);

    static final long END_OF_INPUT = Long.MAX_VALUE;

    private final ActorFunnelEvaluator evaluator;
    private transient ListState<FunnelEvent> eventsState;
    private transient Counter actorCounter;
    private transient Counter unmatchedCounter;
    private transient Counter skippedCounter;

    public ActorFunnelProcessFunction(FunnelQuery query) {
        this.evaluator = new ActorFunnelEvaluator(query.definition, query.breakdown);
    }

    @Override
    public void open(Configuration parameters) {
        eventsState = getRuntimeContext().getListState(
                new ListStateDescriptor<>("funnel-actor-events", FunnelEvent.class));

        MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("funnel").addGroup("actors");
        actorCounter = metrics.counter("actors");
        unmatchedCounter = metrics.counter("unmatched_actors");
        skippedCounter = metrics.counter("skipped_events");
        LOG.info("Actor funnel operator initialized (steps={}, order={}, window={})",
                evaluator.definition().stepCount(),
                evaluator.definition().orderType,
                evaluator.definition().conversionWindow);
    }

    @Override
    public void processElement(FunnelEvent event, Context ctx, Collector<FunnelPartial> out) throws Exception {
        if (event == null) {
            return;
        }
        eventsState.add(event);
        ctx.timerService().registerEventTimeTimer(END_OF_INPUT);
    }

    @Override
    public void onTimer(long timestamp, OnTimerContext ctx, Collector<FunnelPartial> out) throws Exception {
        List<FunnelEvent> events = new ArrayList<>();
        Iterable<FunnelEvent> stored = eventsState.get();
        if (stored != null) {
            for (FunnelEvent event : stored) {
                events.add(event);
            }
        }
        eventsState.clear();
        if (events.isEmpty()) {
            return;
        }

        FunnelPartial partial = new FunnelPartial(evaluator.definition().stepCount());
        ActorFunnelEvaluator.Evaluation evaluation = evaluator.evaluateInto(ctx.getCurrentKey(), events, partial);
        actorCounter.inc();
        skippedCounter.inc(evaluation.skippedEvents);
        if (evaluation.result == null) {
            unmatchedCounter.inc();
        }
        out.collect(partial);
    }
}
