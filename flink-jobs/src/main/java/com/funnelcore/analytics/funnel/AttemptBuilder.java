package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.match.StepMatcher;
import com.funnelcore.analytics.model.FunnelAttempt;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.FunnelEvent;
import com.funnelcore.analytics.model.OrderType;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Single-pass scan of one actor's sorted events producing every funnel attempt.
 *
 * <p>Rules:
 * - Each distinct anchor timestamp seeds its own attempt (step 0, or any step when unordered).
 *   A strict event that blocks an attempt may seed again even when it ties the previous anchor.
 * - An event first advances existing attempts, then may seed a new one, so one event can do both
 *   but never fills two positions of the same attempt.
 * - Step k must match at or before the anchor plus that step's window (inclusive).
 * - Strict: an event that misses the next step but matches an already-passed one blocks the attempt.
 *   Blocked attempts keep their depth but never advance again.
 * - Attempts that are complete, blocked, or past every reachable deadline are retired, which
 *   bounds the in-flight set to attempts still inside their window.
 * </p>
 */
public final class AttemptBuilder implements Serializable {
    private static final long serialVersionUID = 1L;

    private final FunnelDefinition definition;

    public AttemptBuilder(FunnelDefinition definition) {
        this.definition = definition;
    }

    public List<FunnelAttempt> build(List<FunnelEvent> sortedEvents) {
        List<FunnelAttempt> attempts = new ArrayList<>();
        if (sortedEvents == null || sortedEvents.isEmpty()) {
            return attempts;
        }

        int stepCount = definition.stepCount();
        List<InFlight> active = new ArrayList<>();
        long lastAnchorTs = Long.MIN_VALUE;
        boolean anchored = false;
        int sequence = 0;

        for (int position = 0; position < sortedEvents.size(); position++) {
            FunnelEvent event = sortedEvents.get(position);
            long ts = event.timestamp;
            boolean[] matched = StepMatcher.matchAll(event, definition);

            retire(active, ts, attempts);
            boolean blockedAny = false;
            for (InFlight inFlight : active) {
                blockedAny |= advance(inFlight, matched, ts, position);
            }

            // A tied anchor is only a duplicate while the earlier attempt is still alive.
            int seedStep = seedStep(matched);
            if (seedStep >= 0 && (blockedAny || !(anchored && lastAnchorTs == ts))) {
                FunnelAttempt attempt = new FunnelAttempt(sequence++, stepCount);
                attempt.record(seedStep, ts, position);
                active.add(new InFlight(attempt, deadlines(ts)));
                lastAnchorTs = ts;
                anchored = true;
            }
        }

        for (InFlight inFlight : active) {
            attempts.add(inFlight.attempt);
        }
        attempts.sort((a, b) -> Integer.compare(a.sequence(), b.sequence()));
        return attempts;
    }

    /**
     * Applies one event to an in-flight attempt.
     *
     * @return true when the event blocked the attempt
     */
    private boolean advance(InFlight inFlight, boolean[] matched, long ts, int position) {
        FunnelAttempt attempt = inFlight.attempt;
        if (attempt.isComplete() || attempt.isBlocked()) {
            return false;
        }
        if (definition.orderType == OrderType.UNORDERED) {
            for (int step = 0; step < matched.length; step++) {
                if (matched[step] && !attempt.hasStep(step) && ts <= inFlight.deadlines[step]) {
                    attempt.record(step, ts, position);
                    return false;
                }
            }
            return false;
        }

        int next = attempt.depth();
        if (matched[next] && ts <= inFlight.deadlines[next]) {
            attempt.record(next, ts, position);
            return false;
        }
        if (definition.orderType == OrderType.STRICT && matchesAnyBefore(matched, next)) {
            attempt.block();
            return true;
        }
        return false;
    }

    private void retire(List<InFlight> active, long ts, List<FunnelAttempt> out) {
        Iterator<InFlight> it = active.iterator();
        while (it.hasNext()) {
            InFlight inFlight = it.next();
            if (!canStillAdvance(inFlight, ts)) {
                out.add(inFlight.attempt);
                it.remove();
            }
        }
    }

    private boolean canStillAdvance(InFlight inFlight, long ts) {
        FunnelAttempt attempt = inFlight.attempt;
        if (attempt.isComplete() || attempt.isBlocked()) {
            return false;
        }
        if (definition.orderType != OrderType.UNORDERED) {
            return ts <= inFlight.deadlines[attempt.depth()];
        }
        for (int step = 0; step < inFlight.deadlines.length; step++) {
            if (!attempt.hasStep(step) && ts <= inFlight.deadlines[step]) {
                return true;
            }
        }
        return false;
    }

    private int seedStep(boolean[] matched) {
        if (definition.orderType != OrderType.UNORDERED) {
            return matched[0] ? 0 : -1;
        }
        for (int step = 0; step < matched.length; step++) {
            if (matched[step]) {
                return step;
            }
        }
        return -1;
    }

    private long[] deadlines(long anchorTs) {
        long[] out = new long[definition.stepCount()];
        for (int step = 0; step < out.length; step++) {
            out[step] = definition.windowFor(step).deadline(anchorTs);
        }
        return out;
    }

    private static boolean matchesAnyBefore(boolean[] matched, int exclusiveEnd) {
        for (int step = 0; step < exclusiveEnd; step++) {
            if (matched[step]) {
                return true;
            }
        }
        return false;
    }

    private static final class InFlight {
        final FunnelAttempt attempt;
        final long[] deadlines;

        InFlight(FunnelAttempt attempt, long[] deadlines) {
            this.attempt = attempt;
            this.deadlines = deadlines;
        }
    }
}
