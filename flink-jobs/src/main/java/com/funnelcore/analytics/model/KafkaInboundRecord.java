package com.funnelcore.analytics.model;

import java.io.Serializable;

/**
 * Raw Kafka record with the coordinates needed to point DLQ entries back at their source.
 */
public class KafkaInboundRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String topic;
    public int partition;
    public long offset;
    public long recordTimestamp;
    public String key;
    public byte[] value;

    public KafkaInboundRecord() {}
}
