package com.funnelcore.analytics.funnel;

import org.junit.jupiter.api.Test;

import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.ConversionWindow;
import com.funnelcore.analytics.model.FunnelAttempt;
import com.funnelcore.analytics.model.FunnelDefinition;
import com.funnelcore.analytics.model.OrderType;
import com.funnelcore.analytics.model.StepResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ConversionTimeAggregatorTest {

    @Test
    void interpolatedMedianAveragesTheMiddlePair() {
        assertEquals(5400.0, ConversionTimeAggregator.median(Arrays.asList(7200L, 3600L), MedianMode.INTERPOLATED));
        assertEquals(7200.0, ConversionTimeAggregator.median(Arrays.asList(3600L, 7200L, 7200L), MedianMode.INTERPOLATED));
    }

    @Test
    void lowerMedianTakesTheLowerMiddle() {
        assertEquals(3600.0, ConversionTimeAggregator.median(Arrays.asList(7200L, 3600L), MedianMode.LOWER));
        assertEquals(20.0, ConversionTimeAggregator.median(Arrays.asList(40L, 10L, 30L, 20L), MedianMode.LOWER));
    }

    @Test
    void emptyStatisticsAreNullNotZero() {
        assertNull(ConversionTimeAggregator.mean(0L, 0));
        assertNull(ConversionTimeAggregator.median(Collections.emptyList(), MedianMode.INTERPOLATED));
    }

    @Test
    void deltaCountsSecondBoundaries() {
        assertEquals(1L, ConversionTimeAggregator.deltaSeconds(999L, 1_000L));
        assertEquals(0L, ConversionTimeAggregator.deltaSeconds(1_000L, 1_999L));
        assertEquals(3600L, ConversionTimeAggregator.deltaSeconds(0L, 3_600_000L));
        assertEquals(1L, ConversionTimeAggregator.deltaSeconds(-1L, 0L));
    }

    @Test
    void aggregatesCountsAndStatisticsPerPosition() {
        FunnelDefinition definition = FunnelDefinition.of(
                OrderType.SEQUENTIAL, ConversionWindow.DEFAULT, "sign up", "play movie", "buy");
        StepAccumulator accumulator = new StepAccumulator(3);
        accumulator.add(attempt(0L, 3_600_000L, 10_800_000L));
        accumulator.add(attempt(0L, 7_200_000L));
        accumulator.add(attempt(0L));

        List<StepResult> rows = ConversionTimeAggregator.aggregate(
                definition, accumulator, BreakdownKey.none(), MedianMode.INTERPOLATED);

        assertEquals(3, rows.size());
        assertEquals(3L, rows.get(0).count);
        assertNull(rows.get(0).averageConversionTime);
        assertNull(rows.get(0).medianConversionTime);
        assertNull(rows.get(0).breakdownValue);

        assertEquals(2L, rows.get(1).count);
        assertEquals(5400.0, rows.get(1).averageConversionTime);
        assertEquals(5400.0, rows.get(1).medianConversionTime);

        assertEquals(1L, rows.get(2).count);
        assertEquals(7200.0, rows.get(2).averageConversionTime);
        assertEquals("buy", rows.get(2).name);
    }

    @Test
    void breakdownValueIsCopiedOntoEveryRow() {
        FunnelDefinition definition = FunnelDefinition.of(OrderType.SEQUENTIAL, ConversionWindow.DEFAULT, "a", "b");
        StepAccumulator accumulator = new StepAccumulator(2);
        accumulator.add(attempt(0L, 1_000L));

        List<StepResult> rows = ConversionTimeAggregator.aggregate(
                definition, accumulator, BreakdownKey.of("Chrome"), MedianMode.INTERPOLATED);

        assertEquals(Collections.singletonList("Chrome"), rows.get(0).breakdownValue);
        assertEquals(Collections.singletonList("Chrome"), rows.get(1).breakdownValue);
    }

    @Test
    void mergedAccumulatorsMatchASingleAccumulator() {
        StepAccumulator left = new StepAccumulator(2);
        left.add(attempt(0L, 10_000L));
        StepAccumulator right = new StepAccumulator(2);
        right.add(attempt(0L, 30_000L));
        right.add(attempt(0L));

        left.merge(right);

        assertEquals(3L, left.count(0));
        assertEquals(2L, left.count(1));
        assertEquals(40L, left.deltaSum(1));
        assertEquals(Arrays.asList(10L, 30L), left.deltas(1));
    }

    private static FunnelAttempt attempt(long... timestamps) {
        FunnelAttempt attempt = new FunnelAttempt(0, 3);
        for (int i = 0; i < timestamps.length; i++) {
            attempt.record(i, timestamps[i], i);
        }
        return attempt;
    }
}
