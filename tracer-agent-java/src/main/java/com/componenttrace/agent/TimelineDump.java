package com.componenttrace.agent;

import com.componenttrace.core.inspector.InspectorViews.ComponentSummary;
import com.componenttrace.core.inspector.InspectorViews.RankingView;
import com.componenttrace.core.inspector.InspectorViews.RecordingStateView;
import com.componenttrace.core.inspector.InspectorViews.RenderBatchView;
import com.componenttrace.core.inspector.InspectorViews.TimelineEventView;
import com.componenttrace.core.registry.ComponentCounts;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJO written to timeline.json by ShutdownHook.
 */
public class TimelineDump {

    @SerializedName("recording_state")
    public RecordingStateView recordingState;

    @SerializedName("sessions")
    public List<SessionDump> sessions;

    @SerializedName("events")
    public List<TimelineEventView> events;

    @SerializedName("batches")
    public List<RenderBatchView> batches;

    @SerializedName("ranking")
    public List<RankingView> ranking;

    public static class SessionDump {
        @SerializedName("session_id") public String sessionId;
        @SerializedName("opened_at")  public String openedAt;
        @SerializedName("counts")     public ComponentCounts counts;
        @SerializedName("components") public List<ComponentSummary> components;
    }
}
