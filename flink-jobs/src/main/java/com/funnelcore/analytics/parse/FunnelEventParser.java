package com.funnelcore.analytics.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.util.JsonSupport;

import java.util.HashMap;

/**
 * Parses one JSON event record into a {@link FunnelEvent}.
 *
 * <p>Accepted fields: {@code distinct_id} (or {@code actor_id}), {@code event}, {@code timestamp},
 * {@code properties} and optional {@code uuid}. Missing fields are left null for the caller's
 * malformed-event check instead of raising here.</p>
 */
public final class FunnelEventParser {
    private FunnelEventParser() {}

    public static FunnelEvent parse(JsonNode root) throws Exception {
        if (root == null || !root.isObject()) {
            throw new Exception("Event payload must be a JSON object");
        }
        FunnelEvent event = new FunnelEvent();
        event.uuid = JsonNodeUtils.asNullableText(root.path("uuid"));
        event.actorId = JsonNodeUtils.firstText(root, "distinct_id", "actor_id", "person_id");
        event.event = JsonNodeUtils.asNullableText(root.path("event"));
        event.timestamp = JsonNodeUtils.parseTimestampMillis(root.path("timestamp"));

        JsonNode properties = root.path("properties");
        if (properties.isObject()) {
            event.properties = new HashMap<>(JsonSupport.toMap(properties));
        } else if (!JsonNodeUtils.isAbsent(properties)) {
            throw new Exception("Event properties must be a JSON object");
        }
        return event;
    }

    public static FunnelEvent parse(String rawJson) throws Exception {
        return parse(JsonSupport.MAPPER.readTree(rawJson));
    }
}
