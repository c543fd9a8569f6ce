package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.ActorResult;
import com.funnelcore.analytics.model.FunnelAttempt;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.List;

/**
 * Per-actor pipeline shared by the in-process engine and the Flink operator:
 * sanitize and sort, build attempts, select one, assign its breakdown partition.
 */
public final class ActorFunnelEvaluator implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(ActorFunnelEvaluator.class);

    private final FunnelDefinition definition;
    private final AttemptBuilder builder;
    private final BreakdownPartitioner partitioner;

    public ActorFunnelEvaluator(FunnelDefinition definition, BreakdownResolver resolver) {
        this.definition = definition;
        this.builder = new AttemptBuilder(definition);
        this.partitioner = new BreakdownPartitioner(resolver);
    }

    public FunnelDefinition definition() {
        return definition;
    }

    public Evaluation evaluate(String actorId, List<FunnelEvent> rawEvents) {
        EventSequence sequence = EventSequence.prepare(actorId, rawEvents);
        List<FunnelAttempt> attempts = builder.build(sequence.events());
        FunnelAttempt selected = AttemptSelector.select(attempts);
        if (selected == null) {
            return new Evaluation(null, attempts, sequence.skipped());
        }
        ActorResult result = partitioner.assign(
                new ActorResult(actorId, selected, null), sequence.events());
        if (LOG.isDebugEnabled()) {
            LOG.debug("Actor evaluated (actor={}, attempts={}, depth={}, breakdown={})",
                    actorId, attempts.size(), selected.depth(), result.breakdownKey);
        }
        return new Evaluation(result, attempts, sequence.skipped());
    }

    /**
     * Evaluates one actor and folds it into {@code partial} in a single step.
     */
    public Evaluation evaluateInto(String actorId, List<FunnelEvent> rawEvents, FunnelPartial partial) {
        Evaluation evaluation = evaluate(actorId, rawEvents);
        if (evaluation.result == null) {
            partial.addUnmatched(evaluation.skippedEvents);
        } else {
            partial.add(evaluation.result, evaluation.skippedEvents);
        }
        return evaluation;
    }

    public static final class Evaluation {
        /** Null when the actor never matched an entry step. */
        public final ActorResult result;
        public final List<FunnelAttempt> attempts;
        public final int skippedEvents;

        Evaluation(ActorResult result, List<FunnelAttempt> attempts, int skippedEvents) {
            this.result = result;
            this.attempts = attempts;
            this.skippedEvents = skippedEvents;
        }
    }
}
