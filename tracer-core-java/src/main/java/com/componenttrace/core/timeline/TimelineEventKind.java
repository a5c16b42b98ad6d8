package com.componenttrace.core.timeline;

/**
 * Closed vocabulary of timeline event kinds.
 */
public enum TimelineEventKind {
    INITIALIZE,
    PARAMETERS_SET,
    RENDER,
    POST_RENDER,
    DISPOSE,
    INVALIDATION,
    INVALIDATION_SUPPRESSED,
    CALLBACK_INVOKED,
    BATCH_STARTED,
    BATCH_COMPLETED,
    /** Render of a basic-mode component, detected from outside. */
    BASIC_RENDER,
    SESSION_OPENED,
    SESSION_CLOSED,
    NAVIGATION;

    /** Wire name used at the inspector boundary, e.g. {@code "parameters-set"}. */
    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}
