package com.componenttrace.core.metrics;

/**
 * Timed lifecycle phases of a component.
 */
public enum LifecyclePhase {
    INITIALIZE,
    PARAMETERS_SET,
    RENDER,
    POST_RENDER,
    EVENT_CALLBACK
}
