package com.funnelcore.analytics.model;

import com.funnelcore.analytics.match.StepPredicate;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One funnel step: an event name plus compiled property predicates, all of which must hold.
 *
 * <p>A null {@code event} matches any event name. {@code conversionWindow} overrides the funnel
 * window for this step only and is measured from the attempt anchor.</p>
 */
public final class StepDefinition implements Serializable {
    private static final long serialVersionUID = 1L;

    public final int index;
    public final String name;
    public final String event;
    public final List<StepPredicate> predicates;
    public final ConversionWindow conversionWindow;

    public StepDefinition(
            int index,
            String name,
            String event,
            List<StepPredicate> predicates,
            ConversionWindow conversionWindow) {
        this.index = index;
        this.event = event;
        this.name = name == null || name.trim().isEmpty() ? (event == null ? "All events" : event) : name;
        this.predicates = predicates == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(predicates));
        this.conversionWindow = conversionWindow;
    }

    public static StepDefinition of(int index, String event) {
        return new StepDefinition(index, null, event, null, null);
    }

    public StepDefinition named(String newName) {
        return new StepDefinition(index, newName, event, predicates, conversionWindow);
    }

    public StepDefinition withPredicate(StepPredicate predicate) {
        List<StepPredicate> next = new ArrayList<>(predicates);
        next.add(predicate);
        return new StepDefinition(index, name, event, next, conversionWindow);
    }

    public StepDefinition withConversionWindow(ConversionWindow window) {
        return new StepDefinition(index, name, event, predicates, window);
    }

    @Override
    public String toString() {
        return "Step{" + index + ":" + name + "}";
    }
}
