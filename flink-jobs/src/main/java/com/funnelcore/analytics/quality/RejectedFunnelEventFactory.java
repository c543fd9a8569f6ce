package com.funnelcore.analytics.quality;

import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.KafkaInboundRecord;
import com.funnelcore.analytics.model.RejectedFunnelEvent;

/**
 * Builds DLQ envelopes for the failure modes of the funnel event gate.
 */
public final class RejectedFunnelEventFactory {
    public static final String STAGE_DESERIALIZATION = "DESERIALIZATION";
    public static final String STAGE_VALIDATION = "EVENT_VALIDATION";

    private RejectedFunnelEventFactory() {}

    public static RejectedFunnelEvent forRawRecord(
            KafkaInboundRecord record,
            String reason,
            String details,
            String rawJson) {
        RejectedFunnelEvent rejected = base(record, rawJson);
        rejected.failure = failure(STAGE_DESERIALIZATION, "DESERIALIZATION_FAILED", reason, details);
        return rejected;
    }

    public static RejectedFunnelEvent forMalformedEvent(
            KafkaInboundRecord record,
            FunnelEvent event,
            String reason,
            String rawJson) {
        RejectedFunnelEvent rejected = base(record, rawJson);
        rejected.actorId = event == null ? null : event.actorId;
        rejected.eventTimestamp = event == null ? null : event.timestamp;
        rejected.failure = failure(STAGE_VALIDATION, "MALFORMED_EVENT", reason, "Event rejected before funnel scan");
        return rejected;
    }

    private static RejectedFunnelEvent base(KafkaInboundRecord record, String rawJson) {
        RejectedFunnelEvent rejected = new RejectedFunnelEvent();
        rejected.ingestionTimestamp = System.currentTimeMillis();
        rejected.rawJson = rawJson;
        if (record != null) {
            RejectedFunnelEvent.SourcePointer source = new RejectedFunnelEvent.SourcePointer();
            source.topic = record.topic;
            source.partition = record.partition;
            source.offset = record.offset;
            source.recordTimestamp = record.recordTimestamp;
            rejected.source = source;
        }
        return rejected;
    }

    private static RejectedFunnelEvent.FailureDetails failure(
            String stage,
            String failureClass,
            String reason,
            String details) {
        RejectedFunnelEvent.FailureDetails failure = new RejectedFunnelEvent.FailureDetails();
        failure.stage = stage;
        failure.failureClass = failureClass;
        failure.reason = reason;
        failure.details = details;
        return failure;
    }
}
