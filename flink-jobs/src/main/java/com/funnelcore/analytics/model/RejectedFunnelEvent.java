package com.funnelcore.analytics.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * DLQ envelope for an input record that could not become a usable {@link FunnelEvent}.
 */
public class RejectedFunnelEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("source")
    public SourcePointer source;

    @JsonProperty("failure")
    public FailureDetails failure;

    @JsonProperty("actor_id")
    public String actorId;

    @JsonProperty("event_timestamp")
    public Long eventTimestamp;

    @JsonProperty("ingestion_timestamp")
    public long ingestionTimestamp;

    @JsonProperty("raw_json")
    public String rawJson;

    public RejectedFunnelEvent() {}

    public static class SourcePointer implements Serializable {
        private static final long serialVersionUID = 1L;

        @JsonProperty("topic")
        public String topic;

        @JsonProperty("partition")
        public int partition;

        @JsonProperty("offset")
        public long offset;

        @JsonProperty("record_timestamp")
        public long recordTimestamp;

        public SourcePointer() {}
    }

    public static class FailureDetails implements Serializable {
        private static final long serialVersionUID = 1L;

        @JsonProperty("stage")
        public String stage;

        @JsonProperty("failure_class")
        public String failureClass;

        @JsonProperty("reason")
        public String reason;

        @JsonProperty("details")
        public String details;

        public FailureDetails() {}
    }
}
