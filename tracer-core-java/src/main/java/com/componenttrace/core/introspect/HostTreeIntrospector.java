package com.componenttrace.core.introspect;

/**
 * Best-effort access to the host runtime's authoritative component tree.
 *
 * Implementations must not throw: when host internals are unreachable they return
 * {@link HostTreeSnapshot#unsupported()}.
 */
@FunctionalInterface
public interface HostTreeIntrospector {

    HostTreeSnapshot introspect();

    /** Whether the host tree behind this introspector is gone for good. */
    default boolean isDetached() {
        return false;
    }

    /** Introspector for hosts that expose no tree at all. */
    static HostTreeIntrospector unsupported() {
        return HostTreeSnapshot::unsupported;
    }
}
