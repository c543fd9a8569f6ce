package com.funnelcore.analytics.config;

import com.fasterxml.jackson.databind.JsonNode;

import com.funnelcore.analytics.funnel.PropertyBreakdownResolver;
import com.funnelcore.analytics.match.PropertyFilter;
import com.funnelcore.analytics.match.StepPredicate;
import com.funnelcore.analytics.model.ConversionWindow;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelDefinitionException;
import com.funnelcore.analytics.model.OrderType;
import com.funnelcore.analytics.model.StepDefinition;
import com.funnelcore.analytics.parse.JsonNodeUtils;
import com.funnelcore.analytics.util.JsonSupport;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the funnel definition JSON from a system property path, the classpath, or the repository.
 *
 * Lookup order:
 * 1) JVM property `funnel.definition.path`
 * 2) classpath resource `funnel/definition.json`
 * 3) repository fallback `configs/funnel/definition.json`
 *
 * Document shape (field names follow the funnel filter format):
 * {
 *   "funnel_order_type": "strict|ordered|unordered",
 *   "funnel_window_interval": 14, "funnel_window_interval_unit": "day",
 *   "steps": [{"order": 0, "event": "signup", "name": "Sign up",
 *              "properties": [{"key": "plan", "operator": "exact", "value": "pro"}],
 *              "conversion_window": {"interval": 1, "unit": "hour"}}],
 *   "breakdown": {"properties": ["$browser"], "attribution_type": "first_touch", "attribution_step": 0}
 * }
 */
public final class FunnelDefinitionLoader {
    public static final String DEFINITION_PROPERTY = "funnel.definition.path";
    public static final String DEFAULT_CLASSPATH_RESOURCE = "funnel/definition.json";
    public static final Path DEFAULT_REPO_PATH = Path.of("configs/funnel/definition.json");

    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(FunnelDefinitionLoader.class);

    private FunnelDefinitionLoader() {}

    public static FunnelQuery loadDefault() {
        String overridePath = System.getProperty(DEFINITION_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            return loadFromFile(Path.of(overridePath));
        }

        FunnelQuery fromClasspath = loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
        if (fromClasspath != null) {
            return fromClasspath;
        }

        return loadFromFile(DEFAULT_REPO_PATH);
    }

    static FunnelQuery loadFromClasspath(String resourcePath) {
        try (InputStream in = FunnelDefinitionLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (in == null) {
                return null;
            }
            FunnelQuery query = parse(JsonSupport.MAPPER.readTree(in));
            LOG.info("Loaded funnel definition from classpath (resource={}, steps={})",
                    resourcePath, query.definition.stepCount());
            return query;
        } catch (FunnelDefinitionException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to load funnel definition from classpath: " + resourcePath, ex);
        }
    }

    public static FunnelQuery loadFromFile(Path path) {
        if (!Files.exists(path)) {
            throw new IllegalStateException("Funnel definition file not found: " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            FunnelQuery query = parse(JsonSupport.MAPPER.readTree(in));
            LOG.info("Loaded funnel definition from file (path={}, steps={})", path, query.definition.stepCount());
            return query;
        } catch (FunnelDefinitionException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to load funnel definition from file: " + path, ex);
        }
    }

    public static FunnelQuery parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION, "Funnel definition must be a JSON object");
        }
        OrderType orderType = OrderType.fromLabel(JsonNodeUtils.asNullableText(root.path("funnel_order_type")));
        ConversionWindow window = parseFunnelWindow(root);

        List<StepDefinition> steps = new ArrayList<>();
        JsonNode stepsNode = root.path("steps");
        if (stepsNode.isArray()) {
            int position = 0;
            for (JsonNode stepNode : stepsNode) {
                steps.add(parseStep(stepNode, position++));
            }
        }
        FunnelDefinition definition = new FunnelDefinition(steps, window, orderType);

        JsonNode breakdown = root.path("breakdown");
        if (!breakdown.isObject()) {
            return new FunnelQuery(definition, null);
        }
        List<String> properties = new ArrayList<>();
        for (JsonNode property : breakdown.path("properties")) {
            properties.add(property.asText());
        }
        if (properties.isEmpty()) {
            return new FunnelQuery(definition, null);
        }
        PropertyBreakdownResolver resolver = new PropertyBreakdownResolver(
                properties,
                PropertyBreakdownResolver.Attribution.fromLabel(
                        JsonNodeUtils.asNullableText(breakdown.path("attribution_type"))),
                JsonNodeUtils.asIntOrDefault(breakdown.path("attribution_step"), 0));
        return new FunnelQuery(definition, resolver);
    }

    private static ConversionWindow parseFunnelWindow(JsonNode root) {
        JsonNode interval = root.path("funnel_window_interval");
        if (!interval.isMissingNode() && !interval.isNull()) {
            return ConversionWindow.of(
                    interval.asInt(),
                    textOrDefault(root.path("funnel_window_interval_unit"), "day"));
        }
        JsonNode days = root.path("funnel_window_days");
        if (!days.isMissingNode() && !days.isNull()) {
            return ConversionWindow.of(days.asInt(), ConversionWindow.Unit.DAY);
        }
        return ConversionWindow.DEFAULT;
    }

    private static StepDefinition parseStep(JsonNode node, int position) {
        int index = JsonNodeUtils.asIntOrDefault(node.path("order"), position);
        List<StepPredicate> predicates = new ArrayList<>();
        for (JsonNode filter : node.path("properties")) {
            Object value = filter.has("value") ? JsonSupport.MAPPER.convertValue(filter.get("value"), Object.class) : null;
            predicates.add(PropertyFilter.compile(
                    filter.path("key").asText(null),
                    PropertyFilter.Operator.fromLabel(JsonNodeUtils.asNullableText(filter.path("operator"))),
                    value));
        }
        ConversionWindow override = null;
        JsonNode windowNode = node.path("conversion_window");
        if (windowNode.isObject()) {
            override = ConversionWindow.of(
                    windowNode.path("interval").asInt(),
                    textOrDefault(windowNode.path("unit"), "day"));
        }
        String event = JsonNodeUtils.firstText(node, "event", "id");
        return new StepDefinition(index, JsonNodeUtils.asNullableText(node.path("name")), event, predicates, override);
    }

    private static String textOrDefault(JsonNode node, String fallback) {
        String value = JsonNodeUtils.asNullableText(node);
        return value == null ? fallback : value;
    }
}
