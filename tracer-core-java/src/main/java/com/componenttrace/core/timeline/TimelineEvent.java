package com.componenttrace.core.timeline;

import java.time.Instant;

/**
 * One entry of the timeline. Immutable once written, except that an open-duration event
 * may have its duration filled in exactly once.
 */
public final class TimelineEvent {

    private final long eventId;
    private final Instant timestamp;
    private final double relativeMs;
    private final int componentId;
    private final String componentName;
    private final TimelineEventKind kind;
    private final Long parentEventId;
    private final Long triggeringEventId;
    private final TriggerReason triggerReason;
    private final boolean async;
    private final boolean firstRender;
    private final boolean suppressed;
    private final boolean enhanced;
    private final Long batchId;

    private volatile Double durationMs;
    private volatile Double endRelativeMs;
    private volatile String details;

    TimelineEvent(long eventId, Instant timestamp, double relativeMs, int componentId, String componentName,
                  TimelineEventKind kind, EventOptions options, Long parentEventId, Long triggeringEventId,
                  TriggerReason triggerReason, Long batchId) {
        this.eventId = eventId;
        this.timestamp = timestamp;
        this.relativeMs = relativeMs;
        this.componentId = componentId;
        this.componentName = componentName != null ? componentName : "";
        this.kind = kind;
        this.parentEventId = parentEventId;
        this.triggeringEventId = triggeringEventId;
        this.triggerReason = triggerReason;
        this.async = options.async();
        this.firstRender = options.firstRender();
        this.suppressed = options.suppressed();
        this.enhanced = options.enhanced();
        this.batchId = batchId;
        this.details = options.details();
        this.durationMs = options.durationMs();
        this.endRelativeMs = options.durationMs() != null ? relativeMs + options.durationMs() : null;
    }

    /**
     * Sets the duration of an event recorded without one.
     *
     * @return false when the event already had a duration
     */
    boolean fillDuration(double durationMs, String details) {
        if (this.durationMs != null) return false;
        this.durationMs = durationMs;
        this.endRelativeMs = relativeMs + durationMs;
        if (details != null) this.details = details;
        return true;
    }

    public long eventId() { return eventId; }

    public Instant timestamp() { return timestamp; }

    /** Milliseconds since the recording origin. */
    public double relativeMs() { return relativeMs; }

    /** Subject component, or {@link TimelineRecorder#SESSION_COMPONENT_ID} for session-level events. */
    public int componentId() { return componentId; }

    public String componentName() { return componentName; }

    public TimelineEventKind kind() { return kind; }

    public Double durationMs() { return durationMs; }

    public Double endRelativeMs() { return endRelativeMs; }

    /** Enclosing event, typically the batch-started event of the render batch in progress. */
    public Long parentEventId() { return parentEventId; }

    /** Event whose side effect caused this one. */
    public Long triggeringEventId() { return triggeringEventId; }

    public TriggerReason triggerReason() { return triggerReason; }

    public String details() { return details; }

    public boolean isAsync() { return async; }

    public boolean isFirstRender() { return firstRender; }

    public boolean isSuppressed() { return suppressed; }

    public boolean isEnhanced() { return enhanced; }

    public Long batchId() { return batchId; }

    @Override
    public String toString() {
        return "#" + eventId + " " + kind + " " + componentName + "(" + componentId + ")";
    }
}
