package com.funnelcore.analytics.parse;

import org.junit.jupiter.api.Test;

import com.funnelcore.analytics.model.FunnelEvent;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunnelEventParserTest {

    @Test
    void parsesEventWithEpochMillisAndProperties() throws Exception {
        FunnelEvent event = FunnelEventParser.parse(
                "{\"uuid\":\"u-1\",\"distinct_id\":\"p1\",\"event\":\"$pageview\",\"timestamp\":1577880000000,"
                        + "\"properties\":{\"$browser\":\"Chrome\",\"duration\":42}}");

        assertEquals("u-1", event.uuid);
        assertEquals("p1", event.actorId);
        assertEquals("$pageview", event.event);
        assertEquals(1_577_880_000_000L, event.timestamp);
        assertEquals("Chrome", event.property("$browser"));
        assertEquals(42, event.property("duration"));
    }

    @Test
    void acceptsIsoAndDigitStringTimestamps() throws Exception {
        FunnelEvent iso = FunnelEventParser.parse(
                "{\"actor_id\":\"p1\",\"event\":\"a\",\"timestamp\":\"2020-01-02T14:00:00+02:00\"}");
        FunnelEvent digits = FunnelEventParser.parse(
                "{\"actor_id\":\"p1\",\"event\":\"a\",\"timestamp\":\"1577973600000\"}");

        assertEquals(Instant.parse("2020-01-02T12:00:00Z").toEpochMilli(), iso.timestamp);
        assertEquals(1_577_973_600_000L, digits.timestamp);
    }

    @Test
    void leavesUnusableFieldsNullForTheMalformedCheck() throws Exception {
        FunnelEvent event = FunnelEventParser.parse("{\"event\":\"a\",\"timestamp\":\"yesterday\"}");

        assertNull(event.actorId);
        assertNull(event.timestamp);
        assertTrue(event.properties.isEmpty());
    }

    @Test
    void rejectsNonObjectPayloadAndProperties() {
        assertThrows(Exception.class, () -> FunnelEventParser.parse("[1,2,3]"));
        assertThrows(Exception.class, () -> FunnelEventParser.parse(
                "{\"distinct_id\":\"p1\",\"event\":\"a\",\"timestamp\":1,\"properties\":\"oops\"}"));
    }
}
