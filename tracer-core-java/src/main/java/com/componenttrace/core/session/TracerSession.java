package com.componenttrace.core.session;

import com.componenttrace.core.hooks.LifecycleHooks;
import com.componenttrace.core.inspector.InspectorService;
import com.componenttrace.core.registry.ComponentRegistry;

import java.time.Instant;

/**
 * One isolated component tree: its registry, the hooks that feed it and the inspector view
 * over it. The timeline is shared with every other session of the process.
 */
public final class TracerSession {

    private final String id;
    private final Instant openedAt;
    private final ComponentRegistry registry;
    private final LifecycleHooks hooks;
    private final InspectorService inspector;

    TracerSession(String id, Instant openedAt, ComponentRegistry registry, LifecycleHooks hooks,
                  InspectorService inspector) {
        this.id = id;
        this.openedAt = openedAt;
        this.registry = registry;
        this.hooks = hooks;
        this.inspector = inspector;
    }

    public String id() { return id; }

    public Instant openedAt() { return openedAt; }

    public ComponentRegistry registry() { return registry; }

    public LifecycleHooks hooks() { return hooks; }

    public InspectorService inspector() { return inspector; }

    public boolean isClosed() { return registry.isClosed(); }

    @Override
    public String toString() {
        return "TracerSession[" + id + "]";
    }
}
