package com.componenttrace.core.inspector;

import com.componenttrace.core.inspector.InspectorViews.ComponentSummary;
import com.componenttrace.core.inspector.InspectorViews.RankingView;
import com.componenttrace.core.inspector.InspectorViews.RecordingStateView;
import com.componenttrace.core.inspector.InspectorViews.RenderBatchView;
import com.componenttrace.core.inspector.InspectorViews.TimelineEventView;
import com.componenttrace.core.registry.ComponentCounts;
import com.componenttrace.core.registry.ComponentRecord;
import com.componenttrace.core.registry.ComponentRegistry;
import com.componenttrace.core.timeline.TimelineRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Query surface the external inspector uses for one session.
 *
 * Everything here is read-only apart from the recording controls and the event cap, which
 * act on the shared timeline.
 */
public final class InspectorService {

    private static final Logger log = LoggerFactory.getLogger(InspectorService.class);

    private final ComponentRegistry registry;
    private final TimelineRecorder recorder;
    private final TrackedStateReader stateReader;
    private final ParameterReader parameterReader;

    public InspectorService(ComponentRegistry registry, TimelineRecorder recorder, TrackedStateReader stateReader,
                            ParameterReader parameterReader) {
        this.registry = registry;
        this.recorder = recorder;
        this.stateReader = stateReader != null ? stateReader : new TrackedStateReader();
        this.parameterReader = parameterReader != null ? parameterReader : ParameterReader.none();
    }

    // --- Recording controls ---

    public void startRecording() {
        recorder.startRecording();
        log.info("Timeline recording started from inspector (session {})", registry.sessionId());
    }

    public void stopRecording() {
        recorder.stopRecording();
        log.info("Timeline recording stopped from inspector (session {})", registry.sessionId());
    }

    public void clearEvents() {
        recorder.clear();
    }

    /** @return the cap in effect after clamping */
    public int setMaxEvents(int maxEvents) {
        return recorder.setMaxEvents(maxEvents);
    }

    public RecordingStateView getState() {
        return RecordingStateView.of(recorder.state());
    }

    // --- Components ---

    public List<ComponentSummary> getAllComponents() {
        return summarize(registry.allComponents());
    }

    /** Empty when no resolved component has the id. */
    public Optional<ComponentSummary> getComponent(int componentId) {
        return registry.findById(componentId).map(this::summarize);
    }

    public List<ComponentSummary> getSubtree(int rootId) {
        return summarize(registry.subtree(rootId));
    }

    public ComponentCounts getCounts() {
        return registry.counts();
    }

    // --- Timeline ---

    public List<TimelineEventView> getEvents() {
        return TimelineEventView.of(recorder.events());
    }

    public List<TimelineEventView> getEventsSince(long afterEventId) {
        return TimelineEventView.of(recorder.eventsSince(afterEventId));
    }

    public List<TimelineEventView> getEventsInRange(double startMs, double endMs) {
        return TimelineEventView.of(recorder.eventsInRange(startMs, endMs));
    }

    public List<TimelineEventView> getEventsForComponent(int componentId) {
        return TimelineEventView.of(recorder.eventsForComponent(componentId));
    }

    public List<RenderBatchView> getBatches() {
        return recorder.batches().stream().map(RenderBatchView::of).toList();
    }

    public List<RankingView> getRankedComponents() {
        return recorder.rankedComponents().stream().map(RankingView::of).toList();
    }

    private List<ComponentSummary> summarize(List<ComponentRecord> records) {
        return records.stream().map(this::summarize).toList();
    }

    private ComponentSummary summarize(ComponentRecord record) {
        Object instance = record.instance();
        return ComponentSummary.of(record, stateReader.read(instance), parameterReader.read(instance));
    }
}
