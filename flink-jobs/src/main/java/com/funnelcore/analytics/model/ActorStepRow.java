package com.funnelcore.analytics.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Attribution output row: one actor that reached one step of one breakdown partition.
 */
public class ActorStepRow implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("actor_id")
    public String actorId;

    @JsonProperty("step")
    public int step;

    @JsonProperty("dropped_off")
    public boolean droppedOff;

    @JsonProperty("breakdown_value")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public List<String> breakdownValue;

    public ActorStepRow() {}
}
