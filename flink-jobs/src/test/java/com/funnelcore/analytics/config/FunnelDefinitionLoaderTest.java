package com.funnelcore.analytics.config;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.funnelcore.analytics.funnel.PropertyBreakdownResolver;
import com.funnelcore.analytics.model.ConversionWindow;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelDefinitionException;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.OrderType;
import com.funnelcore.analytics.match.StepMatcher;
import com.funnelcore.analytics.util.JsonSupport;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FunnelDefinitionLoaderTest {

    @Test
    void loadsDefinitionFromClasspath() {
        FunnelQuery query = FunnelDefinitionLoader.loadDefault();
        FunnelDefinition definition = query.definition;

        assertEquals(OrderType.STRICT, definition.orderType);
        assertEquals(ConversionWindow.of(7, ConversionWindow.Unit.DAY), definition.conversionWindow);
        assertEquals(3, definition.stepCount());
        assertEquals("sign up", definition.step(0).name);
        assertEquals("Played a movie", definition.step(1).name);
        assertEquals(1, definition.step(1).predicates.size());
        assertEquals(ConversionWindow.of(2, ConversionWindow.Unit.HOUR), definition.windowFor(2));
        assertTrue(query.hasBreakdown());
        assertEquals(PropertyBreakdownResolver.Attribution.FIRST_TOUCH,
                ((PropertyBreakdownResolver) query.breakdown).attribution());

        assertTrue(StepMatcher.matches(
                new FunnelEvent("p1", "play movie", 1L).withProperty("duration", 90), definition.step(1)));
        assertFalse(StepMatcher.matches(
                new FunnelEvent("p1", "play movie", 1L).withProperty("duration", 30), definition.step(1)));
    }

    @Test
    void missingClasspathResourceYieldsNull() {
        assertNull(FunnelDefinitionLoader.loadFromClasspath("funnel/does-not-exist.json"));
    }

    @Test
    void loadsDefinitionFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("definition.json");
        Files.write(file, ("{\"funnel_order_type\":\"unordered\",\"funnel_window_days\":3,"
                + "\"steps\":[{\"id\":\"a\"},{\"id\":\"b\"}]}").getBytes(StandardCharsets.UTF_8));

        FunnelQuery query = FunnelDefinitionLoader.loadFromFile(file);

        assertEquals(OrderType.UNORDERED, query.definition.orderType);
        assertEquals(ConversionWindow.of(3, ConversionWindow.Unit.DAY), query.definition.conversionWindow);
        assertEquals("b", query.definition.step(1).event);
        assertFalse(query.hasBreakdown());
    }

    @Test
    void missingFileIsAnIllegalState(@TempDir Path dir) {
        assertThrows(IllegalStateException.class,
                () -> FunnelDefinitionLoader.loadFromFile(dir.resolve("missing.json")));
    }

    @Test
    void unreadableJsonIsAnIllegalState(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.write(file, "{\"steps\": [".getBytes(StandardCharsets.UTF_8));

        assertThrows(IllegalStateException.class, () -> FunnelDefinitionLoader.loadFromFile(file));
    }

    @Test
    void invalidDefinitionsKeepTheirKind() throws Exception {
        assertEquals(FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION,
                assertThrows(FunnelDefinitionException.class, () -> parse("{\"steps\":[]}")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_WINDOW,
                assertThrows(FunnelDefinitionException.class,
                        () -> parse("{\"funnel_window_interval\":0,\"steps\":[{\"event\":\"a\"}]}")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_WINDOW,
                assertThrows(FunnelDefinitionException.class,
                        () -> parse("{\"steps\":[{\"event\":\"a\",\"conversion_window\":{\"interval\":-1,\"unit\":\"hour\"}}]}")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_FILTER,
                assertThrows(FunnelDefinitionException.class,
                        () -> parse("{\"steps\":[{\"event\":\"a\",\"properties\":[{\"key\":\"p\",\"operator\":\"regex\",\"value\":\"([\"}]}]}")).kind());
        assertEquals(FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION,
                assertThrows(FunnelDefinitionException.class,
                        () -> parse("{\"steps\":[{\"order\":0,\"event\":\"a\"},{\"order\":5,\"event\":\"b\"}]}")).kind());
    }

    @Test
    void windowUnitDefaultsToDays() throws Exception {
        FunnelQuery query = parse("{\"funnel_window_interval\":2,\"steps\":[{\"event\":\"a\"}]}");
        assertEquals(ConversionWindow.of(2, ConversionWindow.Unit.DAY), query.definition.conversionWindow);
    }

    private static FunnelQuery parse(String json) throws Exception {
        JsonNode root = JsonSupport.MAPPER.readTree(json);
        return FunnelDefinitionLoader.parse(root);
    }
}
