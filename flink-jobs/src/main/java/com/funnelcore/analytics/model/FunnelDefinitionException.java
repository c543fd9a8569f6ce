package com.funnelcore.analytics.model;

/**
 * Raised before any scan when a funnel definition cannot be evaluated.
 */
public class FunnelDefinitionException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_STEP_DEFINITION,
        INVALID_WINDOW,
        INVALID_FILTER
    }

    private final Kind kind;

    public FunnelDefinitionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FunnelDefinitionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
