package com.componenttrace.core.timeline;

/**
 * Probable cause attributed to an event, mostly meaningful for renders.
 */
public enum TriggerReason {
    UNKNOWN,
    FIRST_RENDER,
    STATE_INVALIDATED,
    CALLBACK_INVOKED,
    PARAMETERS_CHANGED,
    PARENT_RERENDERED;

    public String wireName() {
        return name().toLowerCase().replace('_', '-');
    }
}
