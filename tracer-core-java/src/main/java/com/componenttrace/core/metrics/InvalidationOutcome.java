package com.componenttrace.core.metrics;

/**
 * Result of a state-invalidation call on a component.
 */
public enum InvalidationOutcome {
    HONORED,
    SUPPRESSED_ALREADY_QUEUED,
    SUPPRESSED_BY_POLICY;

    /**
     * Classifies an invalidation from the two facts known at call time.
     * An already-queued render takes precedence over a declined render gate.
     */
    public static InvalidationOutcome classify(boolean renderAlreadyQueued, boolean renderDeclined) {
        if (renderAlreadyQueued) return SUPPRESSED_ALREADY_QUEUED;
        if (renderDeclined) return SUPPRESSED_BY_POLICY;
        return HONORED;
    }

    public boolean isSuppressed() {
        return this != HONORED;
    }

    /** Human-readable reason used for timeline trigger details. */
    public String reason() {
        return switch (this) {
            case HONORED -> "render queued";
            case SUPPRESSED_ALREADY_QUEUED -> "render already queued";
            case SUPPRESSED_BY_POLICY -> "render declined";
        };
    }
}
