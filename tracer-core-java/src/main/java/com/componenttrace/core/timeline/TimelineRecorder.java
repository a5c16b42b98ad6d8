package com.componenttrace.core.timeline;

import java.util.List;

/**
 * Process-wide, append-only log of causally linked lifecycle events.
 *
 * Implementations never throw from the record methods; they are called on the host's
 * rendering path.
 */
public interface TimelineRecorder {

    /** Returned by record methods while recording is stopped. */
    long NOT_RECORDING = -1L;

    /** Component id used for session-level and batch events. */
    int SESSION_COMPONENT_ID = -1;

    // Recording controls

    void startRecording();

    void stopRecording();

    void clear();

    boolean isRecording();

    RecordingState state();

    /**
     * Changes the event cap, clamped to the supported range, and evicts overflow at once.
     *
     * @return the cap in effect
     */
    int setMaxEvents(int maxEvents);

    int maxEvents();

    // Recording

    long recordEvent(int componentId, String componentName, TimelineEventKind kind, EventOptions options);

    default long recordEvent(int componentId, String componentName, TimelineEventKind kind) {
        return recordEvent(componentId, componentName, kind, EventOptions.NONE);
    }

    /** Records an event whose duration is only known later, see {@link #recordEventEnd}. */
    long recordEventStart(int componentId, String componentName, TimelineEventKind kind, EventOptions options);

    /** Fills in the duration of an open event. Unknown or evicted ids are ignored. */
    void recordEventEnd(long eventId, double durationMs, String details);

    long recordBatchStart(String triggerSource);

    void recordBatchEnd(long batchId, List<Integer> componentIds);

    // Queries

    List<TimelineEvent> events();

    List<TimelineEvent> eventsSince(long afterEventId);

    List<TimelineEvent> eventsInRange(double startMs, double endMs);

    List<TimelineEvent> eventsForComponent(int componentId);

    List<RenderBatch> batches();

    /** Components by total recorded render time, longest first; ties by ascending id. */
    List<ComponentRanking> rankedComponents();
}
