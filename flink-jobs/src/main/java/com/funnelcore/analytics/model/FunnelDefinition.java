package com.funnelcore.analytics.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable, validated funnel: ordered steps, the default conversion window and the order type.
 *
 * <p>Construction fails fast with {@link FunnelDefinitionException} when steps are empty,
 * indices are not contiguous from 0, or any window is not positive.</p>
 */
public final class FunnelDefinition implements Serializable {
    private static final long serialVersionUID = 1L;

    public final List<StepDefinition> steps;
    public final ConversionWindow conversionWindow;
    public final OrderType orderType;

    public FunnelDefinition(List<StepDefinition> steps, ConversionWindow conversionWindow, OrderType orderType) {
        this.steps = validateSteps(steps);
        this.conversionWindow = conversionWindow == null ? ConversionWindow.DEFAULT : conversionWindow;
        this.orderType = orderType == null ? OrderType.SEQUENTIAL : orderType;
    }

    public static FunnelDefinition of(OrderType orderType, ConversionWindow window, String... events) {
        List<StepDefinition> steps = new ArrayList<>(events.length);
        for (int i = 0; i < events.length; i++) {
            steps.add(StepDefinition.of(i, events[i]));
        }
        return new FunnelDefinition(steps, window, orderType);
    }

    public int stepCount() {
        return steps.size();
    }

    public StepDefinition step(int index) {
        return steps.get(index);
    }

    public ConversionWindow windowFor(int stepIndex) {
        ConversionWindow override = steps.get(stepIndex).conversionWindow;
        return override == null ? conversionWindow : override;
    }

    private static List<StepDefinition> validateSteps(List<StepDefinition> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new FunnelDefinitionException(
                    FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION, "Funnel requires at least one step");
        }
        List<StepDefinition> sorted = new ArrayList<>(steps.size());
        for (StepDefinition step : steps) {
            if (step == null) {
                throw new FunnelDefinitionException(
                        FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION, "Funnel step must not be null");
            }
            sorted.add(step);
        }
        sorted.sort(Comparator.comparingInt(step -> step.index));
        for (int i = 0; i < sorted.size(); i++) {
            if (sorted.get(i).index != i) {
                throw new FunnelDefinitionException(
                        FunnelDefinitionException.Kind.INVALID_STEP_DEFINITION,
                        "Step indices must be contiguous from 0, expected " + i + " but found " + sorted.get(i).index);
            }
        }
        return Collections.unmodifiableList(sorted);
    }
}
