package com.funnelcore.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Aggregated output row for one step of one breakdown partition.
 *
 * <p>Conversion times are in seconds and measured from the previous step. They stay null,
 * never zero, when no actor converted into the step; step 0 always has nulls.</p>
 */
public class StepResult implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("order")
    public int order;

    @JsonProperty("name")
    public String name;

    @JsonProperty("count")
    public long count;

    @JsonProperty("average_conversion_time")
    public Double averageConversionTime;

    @JsonProperty("median_conversion_time")
    public Double medianConversionTime;

    @JsonProperty("breakdown_value")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public List<String> breakdownValue;

    public StepResult() {}

    @Override
    public String toString() {
        return "StepResult{order=" + order + ", count=" + count
                + ", avg=" + averageConversionTime + ", median=" + medianConversionTime
                + ", breakdown=" + breakdownValue + "}";
    }
}
