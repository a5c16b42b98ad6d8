package com.componenttrace.core.model;

/**
 * How much of a component's lifecycle is visible.
 */
public enum ComponentMode {
    /** Lifecycle hooks are called directly; metrics are populated. */
    ENHANCED,
    /** Only discoverable through host tree introspection; no metrics. */
    BASIC
}
