package com.funnelcore.analytics.match;

import org.junit.jupiter.api.Test;

import com.funnelcore.analytics.model.FunnelDefinitionException;
import com.funnelcore.analytics.model.FunnelEvent;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PropertyFilterTest {

    @Test
    void missingPropertyOnlyMatchesIsNotSet() {
        FunnelEvent event = event();

        assertFalse(PropertyFilter.exact("plan", "pro").test(event));
        assertFalse(PropertyFilter.compile("plan", PropertyFilter.Operator.IS_NOT, "pro").test(event));
        assertFalse(PropertyFilter.compile("plan", PropertyFilter.Operator.NOT_ICONTAINS, "pro").test(event));
        assertFalse(PropertyFilter.compile("plan", PropertyFilter.Operator.IS_SET, null).test(event));
        assertTrue(PropertyFilter.compile("plan", PropertyFilter.Operator.IS_NOT_SET, null).test(event));
    }

    @Test
    void exactComparesNumbersByValueAndAcceptsAnyOfAList() {
        FunnelEvent event = event().withProperty("amount", 10).withProperty("plan", "pro");

        assertTrue(PropertyFilter.exact("amount", "10.0").test(event));
        assertTrue(PropertyFilter.exact("plan", Arrays.asList("free", "pro")).test(event));
        assertFalse(PropertyFilter.exact("plan", "Pro").test(event));
        assertTrue(PropertyFilter.compile("plan", PropertyFilter.Operator.IS_NOT, "free").test(event));
    }

    @Test
    void icontainsIgnoresCase() {
        FunnelEvent event = event().withProperty("$current_url", "https://Example.com/Pricing");

        assertTrue(PropertyFilter.compile("$current_url", PropertyFilter.Operator.ICONTAINS, "pricing").test(event));
        assertFalse(PropertyFilter.compile("$current_url", PropertyFilter.Operator.NOT_ICONTAINS, "EXAMPLE").test(event));
    }

    @Test
    void regexFindsAnywhereInValue() {
        FunnelEvent event = event().withProperty("path", "/docs/funnels/strict");

        assertTrue(PropertyFilter.compile("path", PropertyFilter.Operator.REGEX, "funnels/\\w+").test(event));
        assertFalse(PropertyFilter.compile("path", PropertyFilter.Operator.NOT_REGEX, "^/docs").test(event));
    }

    @Test
    void numericComparisonsIgnoreNonNumericValues() {
        FunnelEvent event = event().withProperty("duration", "90").withProperty("label", "long");

        assertTrue(PropertyFilter.compile("duration", PropertyFilter.Operator.GT, 60).test(event));
        assertTrue(PropertyFilter.compile("duration", PropertyFilter.Operator.GTE, 90).test(event));
        assertFalse(PropertyFilter.compile("duration", PropertyFilter.Operator.LT, 90).test(event));
        assertTrue(PropertyFilter.compile("duration", PropertyFilter.Operator.LTE, 90.5).test(event));
        assertFalse(PropertyFilter.compile("label", PropertyFilter.Operator.GT, 0).test(event));
    }

    @Test
    void invalidFiltersFailAtCompileTime() {
        assertEquals(FunnelDefinitionException.Kind.INVALID_FILTER, assertThrows(FunnelDefinitionException.class,
                () -> PropertyFilter.compile("path", PropertyFilter.Operator.REGEX, "([")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_FILTER, assertThrows(FunnelDefinitionException.class,
                () -> PropertyFilter.compile("duration", PropertyFilter.Operator.GT, "abc")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_FILTER, assertThrows(FunnelDefinitionException.class,
                () -> PropertyFilter.compile(" ", PropertyFilter.Operator.EXACT, "x")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_FILTER, assertThrows(FunnelDefinitionException.class,
                () -> PropertyFilter.Operator.fromLabel("between")).kind());
    }

    private static FunnelEvent event() {
        return new FunnelEvent("p1", "pageview", 1_000L);
    }
}
