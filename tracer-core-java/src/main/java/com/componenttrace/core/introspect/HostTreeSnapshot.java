package com.componenttrace.core.introspect;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the host's component tree, or the explicit unsupported variant.
 *
 * A snapshot is read by exactly one reconciliation pass and then dropped.
 */
public final class HostTreeSnapshot {

    private static final HostTreeSnapshot UNSUPPORTED = new HostTreeSnapshot(false, Map.of());

    private final boolean supported;
    private final Map<Integer, HostTreeEntry> entries;

    private HostTreeSnapshot(boolean supported, Map<Integer, HostTreeEntry> entries) {
        this.supported = supported;
        this.entries = entries;
    }

    public static HostTreeSnapshot unsupported() {
        return UNSUPPORTED;
    }

    public static HostTreeSnapshot of(Map<Integer, HostTreeEntry> entries) {
        return new HostTreeSnapshot(true, Collections.unmodifiableMap(new LinkedHashMap<>(entries)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isSupported() {
        return supported;
    }

    /** Entries keyed by component id, in the order the host reported them. Empty when unsupported. */
    public Map<Integer, HostTreeEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public static final class Builder {
        private final Map<Integer, HostTreeEntry> entries = new LinkedHashMap<>();

        public Builder add(int componentId, Object instance, Integer parentId) {
            entries.put(componentId, new HostTreeEntry(componentId, instance, parentId, null));
            return this;
        }

        public Builder add(HostTreeEntry entry) {
            entries.put(entry.componentId(), entry);
            return this;
        }

        public HostTreeSnapshot build() {
            return HostTreeSnapshot.of(entries);
        }
    }
}
