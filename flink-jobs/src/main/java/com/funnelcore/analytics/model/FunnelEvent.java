package com.funnelcore.analytics.model;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * One actor event as consumed by the funnel engine. Timestamps are epoch millis in UTC.
 */
public class FunnelEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public String uuid;
    public String actorId;
    public String event;
    // Nullable so a missing timestamp can be told apart from the epoch.
    public Long timestamp;
    public Map<String, Object> properties = new HashMap<>();

    public FunnelEvent() {}

    public FunnelEvent(String actorId, String event, long timestamp) {
        this.actorId = actorId;
        this.event = event;
        this.timestamp = timestamp;
    }

    public Object property(String key) {
        return properties == null ? null : properties.get(key);
    }

    public FunnelEvent withProperty(String key, Object value) {
        if (properties == null) {
            properties = new HashMap<>();
        }
        properties.put(key, value);
        return this;
    }

    @Override
    public String toString() {
        return "FunnelEvent{actorId=" + actorId + ", event=" + event + ", timestamp=" + timestamp + "}";
    }
}
