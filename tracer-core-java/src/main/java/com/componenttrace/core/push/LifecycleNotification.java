package com.componenttrace.core.push;

import com.google.gson.annotations.SerializedName;

/**
 * Lifecycle event pushed to the inspector as it happens.
 */
public class LifecycleNotification {

    @SerializedName("session_id")     public String sessionId;
    @SerializedName("component_id")   public int componentId;
    @SerializedName("component_name") public String componentName;
    @SerializedName("event_type")     public String eventType;
    @SerializedName("duration_ms")    public Double durationMs;
    @SerializedName("timestamp")      public String timestamp;

    public LifecycleNotification() {}

    public LifecycleNotification(String sessionId, int componentId, String componentName, String eventType,
                                 Double durationMs, String timestamp) {
        this.sessionId = sessionId;
        this.componentId = componentId;
        this.componentName = componentName;
        this.eventType = eventType;
        this.durationMs = durationMs;
        this.timestamp = timestamp;
    }
}
