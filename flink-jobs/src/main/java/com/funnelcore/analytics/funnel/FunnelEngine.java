package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.ActorResult;
import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.util.BuildMetadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

/**
 * In-process funnel computation over an already materialized population.
 *
 * <p>Design notes:
 * - Actors are split into batches; each batch runs on a worker with its own {@link FunnelPartial}.
 * - Workers share no mutable state. Partials are reduced on the calling thread in submission
 *   order, so results do not depend on worker interleaving.
 * - Cancellation is checked between actors. An actor is folded into a partial only after it is
 *   fully evaluated, so a cancelled pass reports valid rows for the actors it finished.
 * </p>
 */
public final class FunnelEngine {
    private static final Logger LOG = LoggerFactory.getLogger(FunnelEngine.class);

    private final FunnelDefinition definition;
    private final EngineSettings settings;

    public FunnelEngine(FunnelDefinition definition) {
        this(definition, EngineSettings.defaults());
    }

    public FunnelEngine(FunnelDefinition definition, EngineSettings settings) {
        if (definition == null) {
            throw new IllegalArgumentException("Funnel definition is required");
        }
        this.definition = definition;
        this.settings = settings == null ? EngineSettings.defaults() : settings;
    }

    public FunnelComputation compute(Map<String, ? extends List<FunnelEvent>> population) {
        return compute(population, BreakdownResolver.NONE, () -> false);
    }

    public FunnelComputation compute(
            Map<String, ? extends List<FunnelEvent>> population,
            BreakdownResolver resolver) {
        return compute(population, resolver, () -> false);
    }

    public FunnelComputation compute(
            Map<String, ? extends List<FunnelEvent>> population,
            BreakdownResolver resolver,
            BooleanSupplier cancelled) {
        BooleanSupplier cancellation = cancelled == null ? () -> false : cancelled;
        ActorFunnelEvaluator evaluator = new ActorFunnelEvaluator(definition, resolver);
        int actorCount = population == null ? 0 : population.size();
        LOG.info("Funnel pass starting (actors={}, steps={}, order={}, window={}, parallelism={}, batch_size={}, build_version={})",
                actorCount,
                definition.stepCount(),
                definition.orderType,
                definition.conversionWindow,
                settings.parallelism,
                settings.batchSize,
                BuildMetadata.current().identity());

        if (actorCount == 0) {
            return FunnelComputation.from(definition, new FunnelPartial(definition.stepCount()), settings.medianMode, true);
        }

        List<List<Map.Entry<String, ? extends List<FunnelEvent>>>> batches = batches(population);
        AtomicBoolean stop = new AtomicBoolean(false);
        BooleanSupplier shouldStop = () -> stop.get() || cancellation.getAsBoolean();

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(settings.parallelism, batches.size()), new WorkerThreadFactory());
        FunnelPartial total = new FunnelPartial(definition.stepCount());
        boolean complete = true;
        boolean interrupted = false;
        try {
            List<Future<BatchOutcome>> futures = new ArrayList<>(batches.size());
            for (List<Map.Entry<String, ? extends List<FunnelEvent>>> batch : batches) {
                futures.add(executor.submit(() -> runBatch(evaluator, batch, shouldStop)));
            }
            for (Future<BatchOutcome> future : futures) {
                while (true) {
                    try {
                        BatchOutcome outcome = future.get();
                        total.merge(outcome.partial);
                        complete &= outcome.finished;
                        break;
                    } catch (InterruptedException ex) {
                        // Ask workers to stop, then keep collecting the partials they already own.
                        interrupted = true;
                        stop.set(true);
                    } catch (ExecutionException ex) {
                        stop.set(true);
                        throw new IllegalStateException("Funnel worker failed", ex.getCause());
                    }
                }
            }
        } finally {
            executor.shutdownNow();
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        if (!complete) {
            LOG.warn("Funnel pass cancelled (processed_actors={}, total_actors={})", total.actorsProcessed(), actorCount);
        }
        LOG.info("Funnel pass finished (processed_actors={}, unmatched_actors={}, skipped_events={}, complete={})",
                total.actorsProcessed(), total.actorsWithoutMatch(), total.skippedEvents(), complete);
        return FunnelComputation.from(definition, total, settings.medianMode, complete);
    }

    /**
     * Aggregates actor results that were selected elsewhere, partition by partition.
     */
    public FunnelComputation aggregate(Collection<ActorResult> results) {
        FunnelPartial total = new FunnelPartial(definition.stepCount());
        for (Map.Entry<BreakdownKey, List<ActorResult>> partition : BreakdownPartitioner.partition(results).entrySet()) {
            FunnelPartial partial = new FunnelPartial(definition.stepCount());
            for (ActorResult result : partition.getValue()) {
                partial.add(result);
            }
            total.merge(partial);
        }
        return FunnelComputation.from(definition, total, settings.medianMode, true);
    }

    private static BatchOutcome runBatch(
            ActorFunnelEvaluator evaluator,
            List<Map.Entry<String, ? extends List<FunnelEvent>>> batch,
            BooleanSupplier shouldStop) {
        FunnelPartial partial = new FunnelPartial(evaluator.definition().stepCount());
        for (Map.Entry<String, ? extends List<FunnelEvent>> actor : batch) {
            if (shouldStop.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                return new BatchOutcome(partial, false);
            }
            evaluator.evaluateInto(actor.getKey(), actor.getValue(), partial);
        }
        return new BatchOutcome(partial, true);
    }

    private List<List<Map.Entry<String, ? extends List<FunnelEvent>>>> batches(
            Map<String, ? extends List<FunnelEvent>> population) {
        List<List<Map.Entry<String, ? extends List<FunnelEvent>>>> out = new ArrayList<>();
        List<Map.Entry<String, ? extends List<FunnelEvent>>> current = new ArrayList<>(settings.batchSize);
        for (Map.Entry<String, ? extends List<FunnelEvent>> entry : population.entrySet()) {
            current.add(entry);
            if (current.size() == settings.batchSize) {
                out.add(current);
                current = new ArrayList<>(settings.batchSize);
            }
        }
        if (!current.isEmpty()) {
            out.add(current);
        }
        return out;
    }

    private static final class BatchOutcome {
        final FunnelPartial partial;
        final boolean finished;

        BatchOutcome(FunnelPartial partial, boolean finished) {
            this.partial = partial;
            this.finished = finished;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL = new AtomicInteger();
        private final int pool = POOL.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "funnel-engine-" + pool + "-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
