package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.util.StringSemantics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * One actor's events, with malformed entries dropped and the rest stably sorted by timestamp.
 */
public final class EventSequence {
    private static final Logger LOG = LoggerFactory.getLogger(EventSequence.class);

    public static final String MISSING_ACTOR_ID = "missing_actor_id";
    public static final String MISSING_EVENT = "missing_event";
    public static final String MISSING_TIMESTAMP = "missing_timestamp";

    private final List<FunnelEvent> events;
    private final int skipped;

    private EventSequence(List<FunnelEvent> events, int skipped) {
        this.events = events;
        this.skipped = skipped;
    }

    public static EventSequence prepare(String actorId, List<FunnelEvent> raw) {
        if (raw == null || raw.isEmpty()) {
            return new EventSequence(Collections.emptyList(), 0);
        }
        List<FunnelEvent> kept = new ArrayList<>(raw.size());
        int skipped = 0;
        for (FunnelEvent event : raw) {
            String reason = malformedReason(event);
            if (reason != null) {
                skipped++;
                LOG.warn("Skipping malformed event (actor={}, reason={}, event={})", actorId, reason, event);
                continue;
            }
            kept.add(event);
        }
        // List.sort is stable: equal timestamps keep their arrival order.
        kept.sort(Comparator.comparingLong(event -> event.timestamp));
        return new EventSequence(Collections.unmodifiableList(kept), skipped);
    }

    /**
     * Returns why an event cannot enter the engine, or null when it is usable.
     */
    public static String malformedReason(FunnelEvent event) {
        if (event == null || StringSemantics.isBlank(event.actorId)) {
            return MISSING_ACTOR_ID;
        }
        if (StringSemantics.isBlank(event.event)) {
            return MISSING_EVENT;
        }
        if (event.timestamp == null) {
            return MISSING_TIMESTAMP;
        }
        return null;
    }

    public List<FunnelEvent> events() {
        return events;
    }

    public int skipped() {
        return skipped;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
