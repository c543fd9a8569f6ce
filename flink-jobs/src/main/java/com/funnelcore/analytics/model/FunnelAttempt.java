package com.funnelcore.analytics.model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One traversal of the funnel by one actor, anchored at its first matched event.
 *
 * <p>Positions are filled in time order. For ordered funnels the step index at position k is k;
 * for unordered funnels it is whichever step was matched k-th. Each position also remembers the
 * index of the matching event within the actor's sorted event list.</p>
 */
public final class FunnelAttempt implements Serializable {
    private static final long serialVersionUID = 1L;

    private final int sequence;
    private final int[] stepIndexes;
    private final long[] timestamps;
    private final int[] eventPositions;
    private int depth;
    private boolean blocked;

    public FunnelAttempt(int sequence, int stepCount) {
        this.sequence = sequence;
        this.stepIndexes = new int[stepCount];
        this.timestamps = new long[stepCount];
        this.eventPositions = new int[stepCount];
    }

    public void record(int stepIndex, long timestamp, int eventPosition) {
        if (depth >= stepIndexes.length) {
            throw new IllegalStateException("Attempt already complete");
        }
        if (depth > 0 && timestamp < timestamps[depth - 1]) {
            throw new IllegalStateException("Attempt timestamps must not decrease");
        }
        stepIndexes[depth] = stepIndex;
        timestamps[depth] = timestamp;
        eventPositions[depth] = eventPosition;
        depth++;
    }

    public void block() {
        blocked = true;
    }

    public boolean isBlocked() {
        return blocked;
    }

    /** Creation order within one actor, used as the final selection tie-break. */
    public int sequence() {
        return sequence;
    }

    /** Number of steps reached. */
    public int depth() {
        return depth;
    }

    public boolean isComplete() {
        return depth == stepIndexes.length;
    }

    public long anchorTimestamp() {
        return timestamps[0];
    }

    public long deepestTimestamp() {
        return timestamps[depth - 1];
    }

    public int stepAt(int position) {
        checkPosition(position);
        return stepIndexes[position];
    }

    public long timestampAt(int position) {
        checkPosition(position);
        return timestamps[position];
    }

    public int eventPositionAt(int position) {
        checkPosition(position);
        return eventPositions[position];
    }

    public boolean hasStep(int stepIndex) {
        for (int i = 0; i < depth; i++) {
            if (stepIndexes[i] == stepIndex) {
                return true;
            }
        }
        return false;
    }

    /** Position at which {@code stepIndex} was matched, or -1. */
    public int positionOfStep(int stepIndex) {
        for (int i = 0; i < depth; i++) {
            if (stepIndexes[i] == stepIndex) {
                return i;
            }
        }
        return -1;
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= depth) {
            throw new IndexOutOfBoundsException("Position " + position + " outside reached depth " + depth);
        }
    }

    @Override
    public String toString() {
        return "FunnelAttempt{sequence=" + sequence
                + ", steps=" + Arrays.toString(Arrays.copyOf(stepIndexes, depth))
                + ", timestamps=" + Arrays.toString(Arrays.copyOf(timestamps, depth))
                + ", blocked=" + blocked + "}";
    }
}
