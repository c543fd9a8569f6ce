package com.funnelcore.analytics.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.junit.jupiter.api.Test;

import com.funnelcore.analytics.funnel.ActorFunnelEvaluator;
import com.funnelcore.analytics.funnel.BreakdownResolver;
import com.funnelcore.analytics.funnel.FunnelPartial;
import com.funnelcore.analytics.funnel.MedianMode;
import com.funnelcore.analytics.model.ConversionWindow;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.OrderType;
import com.funnelcore.analytics.util.JsonSupport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunnelJobTest {
    private static final TypeInformation<FunnelPartial> PARTIAL_TYPE = TypeInformation.of(FunnelPartial.class);

    private final FunnelDefinition definition =
            FunnelDefinition.of(OrderType.SEQUENTIAL, ConversionWindow.DEFAULT, "sign up", "play", "buy");

    @Test
    void emptyInputStillEmitsOneZeroRowPerStep() throws Exception {
        StreamExecutionEnvironment env = batchEnvironment();
        DataStream<FunnelPartial> none = env.fromCollection(Collections.<FunnelPartial>emptyList(), PARTIAL_TYPE);

        List<String> rows = FunnelJob.aggregateResults(env, none, definition, MedianMode.INTERPOLATED)
                .executeAndCollect(10);

        assertEquals(3, rows.size());
        for (int step = 0; step < rows.size(); step++) {
            JsonNode row = JsonSupport.MAPPER.readTree(rows.get(step));
            assertEquals(step, row.get("order").asInt());
            assertEquals(0L, row.get("count").asLong());
            assertTrue(row.get("average_conversion_time").isNull());
            assertTrue(row.get("median_conversion_time").isNull());
        }
    }

    @Test
    void actorPartialsAreFoldedIntoOneResult() throws Exception {
        ActorFunnelEvaluator evaluator = new ActorFunnelEvaluator(definition, BreakdownResolver.NONE);
        List<FunnelPartial> partials = new ArrayList<>();
        partials.add(single(evaluator, "p1", Arrays.asList(
                new FunnelEvent("p1", "sign up", 1_000L),
                new FunnelEvent("p1", "play", 3_000L))));
        partials.add(single(evaluator, "p2", Collections.singletonList(
                new FunnelEvent("p2", "sign up", 2_000L))));

        StreamExecutionEnvironment env = batchEnvironment();
        List<String> rows = FunnelJob.aggregateResults(
                        env, env.fromCollection(partials, PARTIAL_TYPE), definition, MedianMode.INTERPOLATED)
                .executeAndCollect(10);

        assertEquals(3, rows.size());
        assertEquals(2L, JsonSupport.MAPPER.readTree(rows.get(0)).get("count").asLong());
        JsonNode played = JsonSupport.MAPPER.readTree(rows.get(1));
        assertEquals(1L, played.get("count").asLong());
        assertEquals(2.0, played.get("average_conversion_time").asDouble());
        assertEquals(0L, JsonSupport.MAPPER.readTree(rows.get(2)).get("count").asLong());
    }

    private static FunnelPartial single(ActorFunnelEvaluator evaluator, String actorId, List<FunnelEvent> events) {
        FunnelPartial partial = new FunnelPartial(3);
        evaluator.evaluateInto(actorId, events, partial);
        return partial;
    }

    private static StreamExecutionEnvironment batchEnvironment() {
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setRuntimeMode(RuntimeExecutionMode.BATCH);
        env.setParallelism(1);
        return env;
    }
}
