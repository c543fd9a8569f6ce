package com.funnelcore.analytics.config;

import com.funnelcore.analytics.funnel.MedianMode;

import java.time.Duration;

/**
 * Centralized configuration for the funnel batch job, sourced from environment variables.
 */
public class FunnelJobConfig implements java.io.Serializable {
    private static final long serialVersionUID = 1L;

    public final String kafkaBootstrap;
    public final String inputTopic;
    public final String resultsTopic;
    public final String actorsTopic;
    public final String dlqTopic;
    public final String kafkaGroupId;
    public final String definitionPath;

    public final MedianMode medianMode;

    public final Duration metricsRateWindow;

    private FunnelJobConfig(
            String kafkaBootstrap,
            String inputTopic,
            String resultsTopic,
            String actorsTopic,
            String dlqTopic,
            String kafkaGroupId,
            String definitionPath,
            MedianMode medianMode,
            Duration metricsRateWindow) {
        this.kafkaBootstrap = kafkaBootstrap;
        this.inputTopic = inputTopic;
        this.resultsTopic = resultsTopic;
        this.actorsTopic = actorsTopic;
        this.dlqTopic = dlqTopic;
        this.kafkaGroupId = kafkaGroupId;
        this.definitionPath = definitionPath;
        this.medianMode = medianMode;
        this.metricsRateWindow = metricsRateWindow;
    }

    public static FunnelJobConfig fromEnv() {
        String kafkaBootstrap = env("FUNNEL_KAFKA_BOOTSTRAP", "kafka:9092");
        String inputTopic = env("FUNNEL_INPUT_TOPIC", "funnel_events");
        String resultsTopic = env("FUNNEL_RESULTS_TOPIC", "funnel.results.v1");
        String actorsTopic = env("FUNNEL_ACTORS_TOPIC", "funnel.actors.v1");
        String dlqTopic = env("FUNNEL_DLQ_TOPIC", "events.dlq.funnel_events.v1");
        String kafkaGroupId = env("FUNNEL_GROUP_ID", "flink-funnel-batch-v1");
        String definitionPath = env("FUNNEL_DEFINITION_PATH", "");

        MedianMode medianMode = envMedianMode("FUNNEL_MEDIAN_MODE", MedianMode.INTERPOLATED);

        Duration metricsRateWindow = Duration.ofSeconds(envInt("FUNNEL_METRICS_RATE_WINDOW_SEC", 60));

        return new FunnelJobConfig(
                kafkaBootstrap,
                inputTopic,
                resultsTopic,
                actorsTopic,
                dlqTopic,
                kafkaGroupId,
                definitionPath,
                medianMode,
                metricsRateWindow);
    }

    /** Definition from {@code FUNNEL_DEFINITION_PATH} when set, otherwise the loader's default lookup. */
    public FunnelQuery loadQuery() {
        if (definitionPath == null || definitionPath.isEmpty()) {
            return FunnelDefinitionLoader.loadDefault();
        }
        return FunnelDefinitionLoader.loadFromFile(java.nio.file.Path.of(definitionPath));
    }

    private static String env(String key, String defaultValue) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static int envInt(String key, int defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return defaultValue;
        }
    }

    private static MedianMode envMedianMode(String key, MedianMode defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return MedianMode.fromLabel(value);
        } catch (IllegalArgumentException ex) {
            return defaultValue;
        }
    }
}
