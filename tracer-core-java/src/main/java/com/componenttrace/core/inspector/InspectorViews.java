package com.componenttrace.core.inspector;

import com.componenttrace.core.inspector.ParameterReader.ParameterValue;
import com.componenttrace.core.metrics.LifecycleMetrics;
import com.componenttrace.core.metrics.LifecyclePhase;
import com.componenttrace.core.registry.ComponentRecord;
import com.componenttrace.core.timeline.ComponentRanking;
import com.componenttrace.core.timeline.RecordingState;
import com.componenttrace.core.timeline.RenderBatch;
import com.componenttrace.core.timeline.TimelineEvent;
import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Wire shapes returned to the inspector.
 * Values that are unavailable are left null and omitted from the JSON.
 */
public final class InspectorViews {

    private InspectorViews() {}

    public static class ComponentSummary {
        @SerializedName("component_id")     public int componentId;
        @SerializedName("type_name")        public String typeName;
        @SerializedName("full_type_name")   public String fullTypeName;
        @SerializedName("state")            public String state;
        @SerializedName("mode")             public String mode;
        @SerializedName("parent_id")        public Integer parentId;
        @SerializedName("synthesized")      public boolean synthesized;
        @SerializedName("created_at")       public String createdAt;
        @SerializedName("render_count")     public int renderCount;
        @SerializedName("last_rendered_at") public String lastRenderedAt;
        @SerializedName("metrics")          public MetricsView metrics;
        @SerializedName("tracked_state")    public Map<String, String> trackedState;
        @SerializedName("parameters")       public List<ParameterView> parameters;
        @SerializedName("internal_state")   public InternalStateView internalState;

        public static ComponentSummary of(ComponentRecord record, Map<String, String> trackedState,
                                          List<ParameterValue> parameters) {
            ComponentSummary view = new ComponentSummary();
            view.componentId = record.componentId();
            view.typeName = record.type().shortName();
            view.fullTypeName = record.type().fullName();
            view.state = lower(record.state());
            view.mode = lower(record.mode());
            view.parentId = record.parentId();
            view.synthesized = record.isSynthesized();
            view.createdAt = iso(record.createdAt());
            view.renderCount = record.renderCount();
            view.lastRenderedAt = iso(record.lastRenderedAt());
            view.metrics = record.hasMetrics() ? MetricsView.of(record.metrics()) : null;
            view.trackedState = trackedState == null || trackedState.isEmpty() ? null : trackedState;
            view.parameters = parameters == null || parameters.isEmpty() ? null
                : parameters.stream().map(ParameterView::of).toList();
            view.internalState = InternalStateView.of(record);
            return view;
        }
    }

    public static class ParameterView {
        @SerializedName("name")         public String name;
        @SerializedName("type_name")    public String typeName;
        @SerializedName("value")        public String value;
        @SerializedName("is_cascading") public boolean cascading;

        public static ParameterView of(ParameterValue parameter) {
            ParameterView view = new ParameterView();
            view.name = parameter.name();
            view.typeName = parameter.typeName();
            view.value = parameter.value();
            view.cascading = parameter.cascading();
            return view;
        }
    }

    /**
     * Where a component stands in its own lifecycle. Basic components only report what the
     * host tree shows; the phase flags stay null for them.
     */
    public static class InternalStateView {
        @SerializedName("has_never_rendered")        public boolean neverRendered;
        @SerializedName("has_pending_queued_render") public boolean pendingQueuedRender;
        @SerializedName("is_initialized")            public Boolean initialized;
        @SerializedName("has_called_after_render")   public Boolean calledAfterRender;

        public static InternalStateView of(ComponentRecord record) {
            InternalStateView view = new InternalStateView();
            view.neverRendered = record.renderCount() == 0;
            view.pendingQueuedRender = record.isRenderQueued();
            if (record.hasMetrics()) {
                LifecycleMetrics metrics = record.metrics();
                view.initialized = metrics.callCount(LifecyclePhase.INITIALIZE) > 0;
                view.calledAfterRender = metrics.callCount(LifecyclePhase.POST_RENDER) > 0;
            }
            return view;
        }
    }

    public static class MetricsView {
        @SerializedName("phases")                      public Map<String, PhaseView> phases;
        @SerializedName("max_render_ms")               public Double maxRenderMs;
        @SerializedName("min_render_ms")               public Double minRenderMs;
        @SerializedName("max_callback_ms")             public Double maxCallbackMs;
        @SerializedName("time_to_first_render_ms")     public Double timeToFirstRenderMs;
        @SerializedName("lifetime_ms")                 public Double lifetimeMs;
        @SerializedName("total_lifecycle_ms")          public double totalLifecycleMs;
        @SerializedName("invalidation_count")          public int invalidationCount;
        @SerializedName("invalidations_honored")       public int invalidationsHonored;
        @SerializedName("suppressed_already_queued")   public int suppressedAlreadyQueued;
        @SerializedName("suppressed_by_policy")        public int suppressedByPolicy;
        @SerializedName("invalidation_efficiency_pct") public Double invalidationEfficiencyPct;
        @SerializedName("suppression_ratio_pct")       public Double suppressionRatioPct;
        @SerializedName("render_gate_true")            public int renderGateTrue;
        @SerializedName("render_gate_false")           public int renderGateFalse;
        @SerializedName("last_render_gate_result")     public Boolean lastRenderGateResult;
        @SerializedName("render_gate_block_rate_pct")  public Double renderGateBlockRatePct;
        @SerializedName("renders_per_minute")          public Double rendersPerMinute;
        @SerializedName("disposed_at")                 public String disposedAt;

        public static MetricsView of(LifecycleMetrics metrics) {
            MetricsView view = new MetricsView();
            view.phases = new LinkedHashMap<>();
            for (LifecyclePhase phase : LifecyclePhase.values()) {
                PhaseView p = new PhaseView();
                p.callCount = metrics.callCount(phase);
                p.totalMs = metrics.totalDurationMs(phase);
                p.lastMs = box(metrics.lastDurationMs(phase));
                p.averageMs = box(metrics.averageDurationMs(phase));
                view.phases.put(lower(phase), p);
            }
            view.maxRenderMs = box(metrics.maxRenderMs());
            view.minRenderMs = box(metrics.minRenderMs());
            view.maxCallbackMs = box(metrics.maxCallbackMs());
            view.timeToFirstRenderMs = box(metrics.timeToFirstRenderMs());
            view.lifetimeMs = box(metrics.lifetimeMs());
            view.totalLifecycleMs = metrics.totalLifecycleTimeMs();
            view.invalidationCount = metrics.invalidationCount();
            view.invalidationsHonored = metrics.invalidationsHonored();
            view.suppressedAlreadyQueued = metrics.suppressedAlreadyQueued();
            view.suppressedByPolicy = metrics.suppressedByPolicy();
            view.invalidationEfficiencyPct = box(metrics.invalidationEfficiencyPercent());
            view.suppressionRatioPct = box(metrics.suppressionRatioPercent());
            view.renderGateTrue = metrics.renderGateTrueCount();
            view.renderGateFalse = metrics.renderGateFalseCount();
            view.lastRenderGateResult = metrics.lastRenderGateResult();
            view.renderGateBlockRatePct = box(metrics.renderGateBlockRatePercent());
            view.rendersPerMinute = box(metrics.rendersPerMinute());
            view.disposedAt = iso(metrics.disposedAt());
            return view;
        }
    }

    public static class PhaseView {
        @SerializedName("call_count") public int callCount;
        @SerializedName("total_ms")   public double totalMs;
        @SerializedName("last_ms")    public Double lastMs;
        @SerializedName("average_ms") public Double averageMs;
    }

    public static class TimelineEventView {
        @SerializedName("event_id")            public long eventId;
        @SerializedName("timestamp")           public String timestamp;
        @SerializedName("relative_ms")         public double relativeMs;
        @SerializedName("component_id")        public int componentId;
        @SerializedName("component_name")      public String componentName;
        @SerializedName("event_type")          public String eventType;
        @SerializedName("duration_ms")         public Double durationMs;
        @SerializedName("end_relative_ms")     public Double endRelativeMs;
        @SerializedName("parent_event_id")     public Long parentEventId;
        @SerializedName("triggering_event_id") public Long triggeringEventId;
        @SerializedName("trigger_reason")      public String triggerReason;
        @SerializedName("details")             public String details;
        @SerializedName("is_async")            public boolean async;
        @SerializedName("is_first_render")     public boolean firstRender;
        @SerializedName("is_suppressed")       public boolean suppressed;
        @SerializedName("is_enhanced")         public boolean enhanced;
        @SerializedName("batch_id")            public Long batchId;

        public static TimelineEventView of(TimelineEvent event) {
            TimelineEventView view = new TimelineEventView();
            view.eventId = event.eventId();
            view.timestamp = iso(event.timestamp());
            view.relativeMs = event.relativeMs();
            view.componentId = event.componentId();
            view.componentName = event.componentName();
            view.eventType = event.kind().wireName();
            view.durationMs = event.durationMs();
            view.endRelativeMs = event.endRelativeMs();
            view.parentEventId = event.parentEventId();
            view.triggeringEventId = event.triggeringEventId();
            view.triggerReason = event.triggerReason().wireName();
            view.details = event.details();
            view.async = event.isAsync();
            view.firstRender = event.isFirstRender();
            view.suppressed = event.isSuppressed();
            view.enhanced = event.isEnhanced();
            view.batchId = event.batchId();
            return view;
        }

        public static List<TimelineEventView> of(List<TimelineEvent> events) {
            return events.stream().map(TimelineEventView::of).toList();
        }
    }

    public static class RenderBatchView {
        @SerializedName("batch_id")          public long batchId;
        @SerializedName("start_event_id")    public long startEventId;
        @SerializedName("start_relative_ms") public double startRelativeMs;
        @SerializedName("end_relative_ms")   public Double endRelativeMs;
        @SerializedName("duration_ms")       public Double durationMs;
        @SerializedName("component_ids")     public List<Integer> componentIds;
        @SerializedName("component_count")   public int componentCount;
        @SerializedName("trigger_source")    public String triggerSource;

        public static RenderBatchView of(RenderBatch batch) {
            RenderBatchView view = new RenderBatchView();
            view.batchId = batch.batchId();
            view.startEventId = batch.startEventId();
            view.startRelativeMs = batch.startRelativeMs();
            view.endRelativeMs = batch.endRelativeMs();
            view.durationMs = batch.durationMs();
            view.componentIds = batch.componentIds();
            view.componentCount = batch.componentCount();
            view.triggerSource = batch.triggerSource();
            return view;
        }
    }

    public static class RecordingStateView {
        @SerializedName("is_recording") public boolean recording;
        @SerializedName("started_at")   public String startedAt;
        @SerializedName("elapsed_ms")   public double elapsedMs;
        @SerializedName("event_count")  public int eventCount;
        @SerializedName("batch_count")  public int batchCount;
        @SerializedName("max_events")   public int maxEvents;

        public static RecordingStateView of(RecordingState state) {
            RecordingStateView view = new RecordingStateView();
            view.recording = state.recording();
            view.startedAt = iso(state.startedAt());
            view.elapsedMs = state.elapsedMs();
            view.eventCount = state.eventCount();
            view.batchCount = state.batchCount();
            view.maxEvents = state.maxEvents();
            return view;
        }
    }

    public static class RankingView {
        @SerializedName("component_id")      public int componentId;
        @SerializedName("component_name")    public String componentName;
        @SerializedName("total_render_ms")   public double totalRenderMs;
        @SerializedName("render_count")      public int renderCount;
        @SerializedName("average_render_ms") public double averageRenderMs;
        @SerializedName("max_render_ms")     public double maxRenderMs;
        @SerializedName("min_render_ms")     public double minRenderMs;

        public static RankingView of(ComponentRanking ranking) {
            RankingView view = new RankingView();
            view.componentId = ranking.componentId();
            view.componentName = ranking.componentName();
            view.totalRenderMs = ranking.totalRenderMs();
            view.renderCount = ranking.renderCount();
            view.averageRenderMs = ranking.averageRenderMs();
            view.maxRenderMs = ranking.maxRenderMs();
            view.minRenderMs = ranking.minRenderMs();
            return view;
        }
    }

    private static Double box(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static String lower(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
