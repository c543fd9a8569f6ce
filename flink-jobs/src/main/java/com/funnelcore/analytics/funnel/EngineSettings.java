package com.funnelcore.analytics.funnel;

import java.io.Serializable;

/**
 * Tuning for one in-process computation pass.
 */
public final class EngineSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    public final int parallelism;
    public final int batchSize;
    public final MedianMode medianMode;

    public EngineSettings(int parallelism, int batchSize, MedianMode medianMode) {
        this.parallelism = Math.max(1, parallelism);
        this.batchSize = Math.max(1, batchSize);
        this.medianMode = medianMode == null ? MedianMode.INTERPOLATED : medianMode;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(Runtime.getRuntime().availableProcessors(), 256, MedianMode.INTERPOLATED);
    }

    public EngineSettings withParallelism(int value) {
        return new EngineSettings(value, batchSize, medianMode);
    }

    public EngineSettings withBatchSize(int value) {
        return new EngineSettings(parallelism, value, medianMode);
    }

    public EngineSettings withMedianMode(MedianMode value) {
        return new EngineSettings(parallelism, batchSize, value);
    }
}
