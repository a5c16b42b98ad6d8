package com.componenttrace.core.introspect;

import com.componenttrace.core.model.ComponentType;

/**
 * One live component as reported by the host.
 *
 * @param instance the component object, or null when the host could not hand it out
 * @param parentId the parent component id, or null for a root
 */
public record HostTreeEntry(int componentId, Object instance, Integer parentId, ComponentType type) {

    public HostTreeEntry {
        if (type == null) type = instance != null ? ComponentType.of(instance.getClass()) : ComponentType.UNKNOWN;
    }
}
