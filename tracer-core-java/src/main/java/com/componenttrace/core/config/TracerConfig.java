package com.componenttrace.core.config;

import com.componenttrace.core.model.ComponentType;
import com.componenttrace.core.timeline.RingBufferTimelineRecorder;
import com.componenttrace.core.timeline.TimelineEventKind;
import com.google.gson.annotations.SerializedName;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tracer settings, deserialized from {@code component-tracer.json}.
 * Every field is optional; getters supply the defaults.
 */
public class TracerConfig {

    /** Whether hooks measure phase durations (default: true). */
    @SerializedName("timing_enabled")
    private Boolean timingEnabled;

    /** Timed events shorter than this are counted in metrics but not put on the timeline (default: 0). */
    @SerializedName("min_duration_ms")
    private Double minDurationMs;

    /** Component types, by simple or fully-qualified name, that are never tracked. */
    @SerializedName("excluded_types")
    private List<String> excludedTypes;

    /** When set, only these event kinds (e.g. "render", "parameters-set") reach the timeline. */
    @SerializedName("event_kinds")
    private List<String> eventKinds;

    @SerializedName("max_events")
    private Integer maxEvents;

    @SerializedName("max_batches")
    private Integer maxBatches;

    /** Minimum interval between two host tree reconciliations of a session (default: 250). */
    @SerializedName("reconcile_interval_ms")
    private Long reconcileIntervalMs;

    /** Class name prefix of components whose lifecycle hooks are instrumented directly. */
    @SerializedName("enhanced_namespace")
    private String enhancedNamespace;

    /** Whether lifecycle notifications are pushed to a connected inspector (default: false). */
    @SerializedName("push_enabled")
    private Boolean pushEnabled;

    @SerializedName("max_buffered_events")
    private Integer maxBufferedEvents;

    /** Whether the timeline starts recording as soon as the tracer is installed (default: false). */
    @SerializedName("record_on_start")
    private Boolean recordOnStart;

    public static TracerConfig defaults() {
        return new TracerConfig();
    }

    public boolean isTimingEnabled()     { return timingEnabled == null || timingEnabled; }
    public double getMinDurationMs()     { return minDurationMs != null ? Math.max(0, minDurationMs) : 0; }
    public List<String> getExcludedTypes() { return excludedTypes != null ? excludedTypes : Collections.emptyList(); }
    public int getMaxEvents()            { return maxEvents != null && maxEvents > 0 ? maxEvents : RingBufferTimelineRecorder.DEFAULT_MAX_EVENTS; }
    public int getMaxBatches()           { return maxBatches != null && maxBatches > 0 ? maxBatches : RingBufferTimelineRecorder.DEFAULT_MAX_BATCHES; }
    public Duration getReconcileInterval() {
        return reconcileIntervalMs != null && reconcileIntervalMs >= 0 ? Duration.ofMillis(reconcileIntervalMs) : Duration.ofMillis(250);
    }
    public String getEnhancedNamespace() { return enhancedNamespace != null ? enhancedNamespace : ""; }
    public boolean isPushEnabled()       { return pushEnabled != null && pushEnabled; }
    public int getMaxBufferedEvents()    { return maxBufferedEvents != null && maxBufferedEvents > 0 ? maxBufferedEvents : 100; }
    public boolean isRecordOnStart()     { return recordOnStart != null && recordOnStart; }

    /**
     * Parsed event-kind filter for pushed notifications; null means every kind is pushed. Unknown names are ignored.
     */
    public Set<TimelineEventKind> getEventKindFilter() {
        if (eventKinds == null || eventKinds.isEmpty()) return null;
        Set<TimelineEventKind> kinds = EnumSet.noneOf(TimelineEventKind.class);
        for (String name : eventKinds) {
            if (name == null) continue;
            String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (TimelineEventKind kind : TimelineEventKind.values()) {
                if (kind.name().equals(normalized)) kinds.add(kind);
            }
        }
        return kinds;
    }

    /** Excluded types are tracked and recorded as usual but never pushed to the inspector. */
    public boolean isExcluded(ComponentType type) {
        if (excludedTypes == null || type == null) return false;
        return excludedTypes.contains(type.shortName())
            || (type.fullName() != null && excludedTypes.contains(type.fullName()));
    }

    /** Enhanced when the class name falls under {@link #getEnhancedNamespace()}; an empty namespace matches all. */
    public boolean isEnhanced(Class<?> type) {
        return type != null && type.getName().startsWith(getEnhancedNamespace());
    }

    // -----------------------------------------------------------------------
    // Programmatic overrides (agent args take precedence over the file)
    // -----------------------------------------------------------------------

    public TracerConfig withEnhancedNamespace(String namespace) {
        this.enhancedNamespace = namespace;
        return this;
    }

    public TracerConfig withRecordOnStart(boolean recordOnStart) {
        this.recordOnStart = recordOnStart;
        return this;
    }

    public TracerConfig withTimingEnabled(boolean timingEnabled) {
        this.timingEnabled = timingEnabled;
        return this;
    }

    public TracerConfig withMinDurationMs(double minDurationMs) {
        this.minDurationMs = minDurationMs;
        return this;
    }

    public TracerConfig withExcludedTypes(List<String> excludedTypes) {
        this.excludedTypes = excludedTypes;
        return this;
    }

    public TracerConfig withEventKinds(List<String> eventKinds) {
        this.eventKinds = eventKinds;
        return this;
    }

    public TracerConfig withReconcileIntervalMs(long reconcileIntervalMs) {
        this.reconcileIntervalMs = reconcileIntervalMs;
        return this;
    }

    public TracerConfig withPushEnabled(boolean pushEnabled) {
        this.pushEnabled = pushEnabled;
        return this;
    }

    public TracerConfig withMaxBufferedEvents(int maxBufferedEvents) {
        this.maxBufferedEvents = maxBufferedEvents;
        return this;
    }
}
