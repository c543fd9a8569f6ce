package com.funnelcore.analytics.pipeline;

import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.funnelcore.analytics.config.FunnelJobConfig;
import com.funnelcore.analytics.config.FunnelQuery;
import com.funnelcore.analytics.funnel.FunnelPartial;
import com.funnelcore.analytics.funnel.MedianMode;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.KafkaInboundRecord;
import com.funnelcore.analytics.model.RejectedFunnelEvent;
import com.funnelcore.analytics.quality.FunnelEventGateProcessFunction;
import com.funnelcore.analytics.util.BuildMetadata;
import com.funnelcore.analytics.util.JsonSupport;

import java.util.Collections;

/**
 * Bounded Flink job computing one funnel over an event topic.
 *
 * <p>Flow: Kafka (earliest to latest) -> gate (DLQ for malformed records) -> per-actor evaluation
 * keyed by actor id -> per-breakdown pre-aggregation -> single global reduction -> step rows and
 * attribution rows on their own topics.</p>
 */
public class FunnelJob {
    private static final Logger LOG = LoggerFactory.getLogger(FunnelJob.class);

    private static final OutputTag<RejectedFunnelEvent> DLQ_TAG = new OutputTag<RejectedFunnelEvent>("dlq"){};
    static final OutputTag<String> ACTORS_TAG = new OutputTag<String>("actors"){};
    private static final String GLOBAL_KEY = "funnel";

    public static void main(String[] args) throws Exception {
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        env.setRuntimeMode(RuntimeExecutionMode.BATCH);

        FunnelJobConfig config = FunnelJobConfig.fromEnv();
        FunnelQuery query = config.loadQuery();
        FunnelDefinition definition = query.definition;
        MedianMode medianMode = config.medianMode;
        LOG.info("Starting funnel job {} (inputTopic={}, resultsTopic={}, actorsTopic={}, steps={}, order={}, window={}, breakdown={})",
                BuildMetadata.current().identity(),
                config.inputTopic, config.resultsTopic, config.actorsTopic,
                definition.stepCount(), definition.orderType, definition.conversionWindow, query.hasBreakdown());

        KafkaSource<KafkaInboundRecord> kafkaSource = KafkaSource.<KafkaInboundRecord>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setTopics(config.inputTopic)
                .setGroupId(config.kafkaGroupId)
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setBounded(OffsetsInitializer.latest())
                .setDeserializer(new FunnelRecordDeserializationSchema())
                .build();

        SingleOutputStreamOperator<FunnelEvent> events = env
                .fromSource(kafkaSource, WatermarkStrategy.noWatermarks(), "Kafka Source")
                .process(new FunnelEventGateProcessFunction(config, DLQ_TAG))
                .returns(FunnelEvent.class)
                .name("Funnel Event Gate");

        DataStream<FunnelPartial> actorPartials = events
                .keyBy(event -> event.actorId)
                .process(new ActorFunnelProcessFunction(query))
                .returns(FunnelPartial.class)
                .name("Evaluate: Actor Funnel");

        SingleOutputStreamOperator<String> stepRows = aggregateResults(env, actorPartials, definition, medianMode);
        DataStream<String> actorRows = stepRows.getSideOutput(ACTORS_TAG);

        stepRows.sinkTo(stringSink(config, config.resultsTopic)).name("Kafka: Funnel Results");
        actorRows.sinkTo(stringSink(config, config.actorsTopic)).name("Kafka: Funnel Actors");
        events.getSideOutput(DLQ_TAG)
                .map(JsonSupport::toJson)
                .returns(String.class)
                .sinkTo(stringSink(config, config.dlqTopic))
                .name("Kafka: DLQ");

        env.execute("Funnel Analytics: " + definition.stepCount() + "-step " + definition.orderType);
    }

    /**
     * Reduces single-actor partials into the step rows (main output) and actor rows
     * ({@link #ACTORS_TAG} side output).
     *
     * <p>An empty partial is always fed into the global reduction so that an empty topic still
     * yields one zero-count row per step.</p>
     */
    static SingleOutputStreamOperator<String> aggregateResults(
            StreamExecutionEnvironment env,
            DataStream<FunnelPartial> actorPartials,
            FunnelDefinition definition,
            MedianMode medianMode) {
        TypeInformation<FunnelPartial> partialType = TypeInformation.of(FunnelPartial.class);
        DataStream<FunnelPartial> seed = env
                .fromCollection(Collections.singletonList(new FunnelPartial(definition.stepCount())), partialType)
                .name("Seed: Empty Funnel");

        // Pre-aggregate per breakdown partition, then fold everything into one partial so that
        // partition ordering and totals are computed over the full population.
        DataStream<FunnelPartial> merged = actorPartials
                .keyBy(FunnelPartial::routingKey)
                .reduce(FunnelPartial::merge)
                .name("Reduce: Breakdown Partitions")
                .union(seed)
                .keyBy(partial -> GLOBAL_KEY)
                .reduce(FunnelPartial::merge)
                .name("Reduce: Funnel");

        return merged
                .process(new FunnelResultProcessFunction(definition, medianMode, ACTORS_TAG))
                .returns(String.class)
                .name("Rows: Funnel Results");
    }

    private static KafkaSink<String> stringSink(FunnelJobConfig config, String topic) {
        return KafkaSink.<String>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .build();
    }
}
