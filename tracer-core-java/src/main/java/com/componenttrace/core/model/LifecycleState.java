package com.componenttrace.core.model;

/**
 * Tracking state of a component record. Disposed components are deleted, not kept.
 */
public enum LifecycleState {
    PENDING,
    RESOLVED
}
