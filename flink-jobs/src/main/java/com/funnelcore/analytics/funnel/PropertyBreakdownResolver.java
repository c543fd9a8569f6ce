package com.funnelcore.analytics.funnel;

import com.funnelcore.analytics.model.BreakdownKey;
import com.funnelcore.analytics.model.FunnelAttempt;
import com.funnelcore.analytics.model.FunnelEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Breakdown by one or more event properties, read from an event of the selected attempt.
 *
 * <p>Attribution:
 * - FIRST_TOUCH: the anchor event.
 * - LAST_TOUCH: the event at the deepest reached position.
 * - STEP: the event that matched {@code attributionStep}; falls back to the anchor when that step
 *   was not reached.
 * Missing values become the empty string.</p>
 */
public final class PropertyBreakdownResolver implements BreakdownResolver {
    private static final long serialVersionUID = 1L;

    public enum Attribution {
        FIRST_TOUCH,
        LAST_TOUCH,
        STEP;

        public static Attribution fromLabel(String label) {
            if (label == null || label.trim().isEmpty()) {
                return FIRST_TOUCH;
            }
            return Attribution.valueOf(label.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final List<String> properties;
    private final Attribution attribution;
    private final int attributionStep;

    public PropertyBreakdownResolver(List<String> properties, Attribution attribution, int attributionStep) {
        if (properties == null || properties.isEmpty()) {
            throw new IllegalArgumentException("Breakdown requires at least one property");
        }
        this.properties = Collections.unmodifiableList(new ArrayList<>(properties));
        this.attribution = attribution == null ? Attribution.FIRST_TOUCH : attribution;
        this.attributionStep = attributionStep;
    }

    public static PropertyBreakdownResolver firstTouch(String... properties) {
        List<String> names = new ArrayList<>();
        Collections.addAll(names, properties);
        return new PropertyBreakdownResolver(names, Attribution.FIRST_TOUCH, 0);
    }

    public List<String> properties() {
        return properties;
    }

    public Attribution attribution() {
        return attribution;
    }

    @Override
    public BreakdownKey resolve(String actorId, List<FunnelEvent> events, FunnelAttempt selected) {
        FunnelEvent source = events.get(selected.eventPositionAt(attributedPosition(selected)));
        List<String> values = new ArrayList<>(properties.size());
        for (String property : properties) {
            Object value = source.property(property);
            values.add(value == null ? "" : String.valueOf(value));
        }
        return BreakdownKey.of(values);
    }

    private int attributedPosition(FunnelAttempt selected) {
        switch (attribution) {
            case LAST_TOUCH:
                return selected.depth() - 1;
            case STEP:
                int position = selected.positionOfStep(attributionStep);
                return position < 0 ? 0 : position;
            default:
                return 0;
        }
    }
}
