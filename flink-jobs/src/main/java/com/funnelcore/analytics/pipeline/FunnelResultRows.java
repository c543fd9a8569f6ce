package com.funnelcore.analytics.pipeline;

import com.funnelcore.analytics.funnel.FunnelComputation;
import com.funnelcore.analytics.model.ActorStepRow;
import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.StepResult;
import com.funnelcore.analytics.util.JsonSupport;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Flattens a finished computation into the JSON rows written to the output topics.
 */
public final class FunnelResultRows {
    private FunnelResultRows() {}

    public static List<String> stepRows(FunnelComputation computation) {
        List<String> rows = new ArrayList<>();
        for (StepResult step : computation.rows()) {
            rows.add(JsonSupport.toJson(step));
        }
        return rows;
    }

    /**
     * One row per (actor, step, partition), actors sorted by id so reruns produce identical output.
     */
    public static List<ActorStepRow> actorRows(FunnelComputation computation) {
        List<ActorStepRow> rows = new ArrayList<>();
        int stepCount = computation.totals().size();
        for (BreakdownKey key : computation.attribution().breakdownKeys()) {
            for (int step = 0; step < stepCount; step++) {
                Set<String> dropped = computation.actorsDroppedAfter(step, key);
                for (String actorId : new TreeSet<>(computation.actorsAt(step, key))) {
                    ActorStepRow row = new ActorStepRow();
                    row.actorId = actorId;
                    row.step = step;
                    row.droppedOff = step + 1 < stepCount && dropped.contains(actorId);
                    row.breakdownValue = key.isNone() ? null : key.values();
                    rows.add(row);
                }
            }
        }
        return rows;
    }

    public static List<String> actorJsonRows(FunnelComputation computation) {
        List<String> rows = new ArrayList<>();
        for (ActorStepRow row : actorRows(computation)) {
            rows.add(JsonSupport.toJson(row));
        }
        return rows;
    }
}
