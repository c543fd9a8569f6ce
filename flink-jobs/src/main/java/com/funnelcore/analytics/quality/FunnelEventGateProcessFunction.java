package com.funnelcore.analytics.quality;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Meter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.funnelcore.analytics.config.FunnelJobConfig;
import com.funnelcore.analytics.funnel.EventSequence;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.KafkaInboundRecord;
import com.funnelcore.analytics.model.RejectedFunnelEvent;
import com.funnelcore.analytics.parse.FunnelEventParser;
import com.funnelcore.analytics.util.JsonSupport;

import java.nio.charset.StandardCharsets;

/**
 * Entry gate of the funnel job: decodes raw Kafka records into {@link FunnelEvent}s and routes
 * anything unusable (bad JSON, missing actor, event name or timestamp) to the DLQ side output.
 *
 * <p>Malformed events are skipped rather than failing the job, so one corrupt record never
 * invalidates the rest of the population.</p>
 */
public class FunnelEventGateProcessFunction extends ProcessFunction<KafkaInboundRecord, FunnelEvent> {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(FunnelEventGateProcessFunction.class);

    private final FunnelJobConfig config;
    private final OutputTag<RejectedFunnelEvent> dlqTag;
    private transient Counter inputCounter;
    private transient Counter acceptedCounter;
    private transient Counter dlqCounter;
    private transient Meter dlqRate;
    private transient long lastDlqLogMs;
    private transient long dlqSinceLastLog;

    public FunnelEventGateProcessFunction(FunnelJobConfig config, OutputTag<RejectedFunnelEvent> dlqTag) {
        this.config = config;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(Configuration parameters) {
        MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("funnel_gate");
        this.inputCounter = metrics.counter("input");
        this.acceptedCounter = metrics.counter("accepted");
        this.dlqCounter = metrics.counter("dlq");
        this.dlqRate = metrics.meter("dlq_rate", new MeterView(dlqCounter, (int) config.metricsRateWindow.getSeconds()));
        this.lastDlqLogMs = System.currentTimeMillis();
        this.dlqSinceLastLog = 0;
        LOG.info("Funnel event gate initialized (metricsWindowSec={})", config.metricsRateWindow.getSeconds());
    }

    @Override
    public void processElement(KafkaInboundRecord record, Context ctx, Collector<FunnelEvent> out) {
        inputCounter.inc();

        if (record == null || record.value == null) {
            emitDlq(ctx, RejectedFunnelEventFactory.forRawRecord(record, "null_payload", "Record value is null", null));
            return;
        }

        String rawJson = new String(record.value, StandardCharsets.UTF_8);
        FunnelEvent event;
        try {
            JsonNode root = JsonSupport.MAPPER.readTree(rawJson);
            event = FunnelEventParser.parse(root);
        } catch (Exception ex) {
            LOG.warn("Event decode failed (topic={}, partition={}, offset={}): {}",
                    record.topic, record.partition, record.offset, ex.getMessage());
            emitDlq(ctx, RejectedFunnelEventFactory.forRawRecord(record, "json_parse_error", ex.getMessage(), rawJson));
            return;
        }

        String malformed = EventSequence.malformedReason(event);
        if (malformed != null) {
            LOG.debug("Malformed event skipped (reason={}, topic={}, offset={})", malformed, record.topic, record.offset);
            emitDlq(ctx, RejectedFunnelEventFactory.forMalformedEvent(record, event, malformed, rawJson));
            return;
        }

        acceptedCounter.inc();
        out.collect(event);
    }

    private void emitDlq(Context ctx, RejectedFunnelEvent rejected) {
        dlqCounter.inc();
        dlqSinceLastLog++;
        long now = System.currentTimeMillis();
        if (now - lastDlqLogMs >= 60000) {
            LOG.warn("DLQ rate summary: {} rejects in last 60s ({}/s)", dlqSinceLastLog, dlqRate.getRate());
            lastDlqLogMs = now;
            dlqSinceLastLog = 0;
        }
        ctx.output(dlqTag, rejected);
    }
}
