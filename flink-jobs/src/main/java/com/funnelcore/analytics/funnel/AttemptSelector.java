package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.FunnelAttempt;

import java.util.Collection;
import java.util.Comparator;

/**
 * Picks exactly one attempt per actor so restarts never inflate aggregates.
 *
 * <p>Preference order (do not change without updating the selection regression tests):
 * 1) greatest depth, 2) earliest anchor, 3) earliest timestamp at the deepest position,
 * 4) earliest creation. The result does not depend on the order attempts are supplied in.</p>
 */
public final class AttemptSelector {
    static final Comparator<FunnelAttempt> PREFERENCE = Comparator
            .comparingInt(FunnelAttempt::depth).reversed()
            .thenComparingLong(FunnelAttempt::anchorTimestamp)
            .thenComparingLong(FunnelAttempt::deepestTimestamp)
            .thenComparingInt(FunnelAttempt::sequence);

    private AttemptSelector() {}

    /**
     * Returns the preferred attempt, or null when the actor never matched an entry step.
     */
    public static FunnelAttempt select(Collection<FunnelAttempt> attempts) {
        if (attempts == null || attempts.isEmpty()) {
            return null;
        }
        FunnelAttempt best = null;
        for (FunnelAttempt candidate : attempts) {
            if (candidate == null || candidate.depth() == 0) {
                continue;
            }
            if (best == null || PREFERENCE.compare(candidate, best) < 0) {
                best = candidate;
            }
        }
        return best;
    }
}
