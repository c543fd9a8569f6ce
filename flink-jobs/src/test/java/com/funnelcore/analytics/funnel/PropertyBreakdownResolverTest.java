package com.funnelcore.analytics.funnel;

import org.junit.jupiter.api.Test;

import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.ConversionWindow;
import com.funnelcore.analytics.model.FunnelAttempt;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.OrderType;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PropertyBreakdownResolverTest {
    private final List<FunnelEvent> events = Arrays.asList(
            new FunnelEvent("p1", "a", 1_000L).withProperty("$browser", "Chrome").withProperty("country", "US"),
            new FunnelEvent("p1", "b", 2_000L).withProperty("$browser", "Safari"),
            new FunnelEvent("p1", "c", 3_000L).withProperty("$browser", "Firefox"));

    private final FunnelAttempt selected = new AttemptBuilder(
            FunnelDefinition.of(OrderType.SEQUENTIAL, ConversionWindow.DEFAULT, "a", "b", "c")).build(events).get(0);

    @Test
    void firstTouchReadsTheAnchorEvent() {
        BreakdownKey key = PropertyBreakdownResolver.firstTouch("$browser", "country").resolve("p1", events, selected);
        assertEquals(BreakdownKey.of("Chrome", "US"), key);
    }

    @Test
    void lastTouchReadsTheDeepestEvent() {
        PropertyBreakdownResolver resolver = new PropertyBreakdownResolver(
                Collections.singletonList("$browser"), PropertyBreakdownResolver.Attribution.LAST_TOUCH, 0);
        assertEquals(BreakdownKey.of("Firefox"), resolver.resolve("p1", events, selected));
    }

    @Test
    void stepAttributionReadsTheConfiguredStep() {
        PropertyBreakdownResolver resolver = new PropertyBreakdownResolver(
                Collections.singletonList("$browser"), PropertyBreakdownResolver.Attribution.STEP, 1);
        assertEquals(BreakdownKey.of("Safari"), resolver.resolve("p1", events, selected));
    }

    @Test
    void stepAttributionFallsBackToAnchorWhenStepNotReached() {
        FunnelAttempt shallow = new AttemptBuilder(
                FunnelDefinition.of(OrderType.SEQUENTIAL, ConversionWindow.DEFAULT, "a", "x", "y"))
                .build(events).get(0);
        PropertyBreakdownResolver resolver = new PropertyBreakdownResolver(
                Collections.singletonList("$browser"), PropertyBreakdownResolver.Attribution.STEP, 2);
        assertEquals(BreakdownKey.of("Chrome"), resolver.resolve("p1", events, shallow));
    }

    @Test
    void missingPropertyBecomesEmptyString() {
        assertEquals(BreakdownKey.of(""),
                PropertyBreakdownResolver.firstTouch("utm_source").resolve("p1", events, selected));
    }

    @Test
    void attributionLabels() {
        assertEquals(PropertyBreakdownResolver.Attribution.FIRST_TOUCH, PropertyBreakdownResolver.Attribution.fromLabel(null));
        assertEquals(PropertyBreakdownResolver.Attribution.LAST_TOUCH, PropertyBreakdownResolver.Attribution.fromLabel("last_touch"));
        assertEquals(PropertyBreakdownResolver.Attribution.STEP, PropertyBreakdownResolver.Attribution.fromLabel("step"));
    }

    @Test
    void requiresAtLeastOneProperty() {
        assertThrows(IllegalArgumentException.class,
                () -> new PropertyBreakdownResolver(Collections.emptyList(), null, 0));
    }
}
