package com.componenttrace.core.inspector;

import com.componenttrace.core.FakeTicker;
import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.hooks.LifecycleHooks;
import com.componenttrace.core.introspect.HostTreeSnapshot;
import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.session.TracerSessions;
import com.componenttrace.core.timeline.RingBufferTimelineRecorder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InspectorEndpointTest {

    static class Counter {
        @TrackState private int count = 2;
    }

    private RingBufferTimelineRecorder recorder;
    private TracerSessions sessions;
    private InspectorEndpoint endpoint;
    private TracerSession session;

    @BeforeEach
    void setUp() {
        FakeTicker ticker = new FakeTicker();
        recorder = new RingBufferTimelineRecorder(1000, 50, ticker, Clock.systemUTC());
        sessions = new TracerSessions(recorder, TracerConfig.defaults(), null, ticker, Clock.systemUTC());
        session = sessions.open("s1", HostTreeSnapshot::unsupported);
        endpoint = new InspectorEndpoint(sessions);
    }

    private JsonObject call(String method, Map<String, ?> args) {
        return JsonParser.parseString(endpoint.handle(InspectorEndpoint.request("s1", method, args))).getAsJsonObject();
    }

    private JsonObject call(String method) {
        return call(method, Map.of());
    }

    @Test
    void recordingControlsReturnState() {
        JsonObject started = call("startRecording");
        assertTrue(started.get("ok").getAsBoolean());
        assertTrue(started.getAsJsonObject("result").get("is_recording").getAsBoolean());

        JsonObject stopped = call("stopRecording");
        assertFalse(stopped.getAsJsonObject("result").get("is_recording").getAsBoolean());
    }

    @Test
    void setMaxEventsReportsClampedCap() {
        assertEquals(100, call("setMaxEvents", Map.of("max_events", 50))
            .getAsJsonObject("result").get("max_events").getAsInt());
        assertEquals(50_000, call("setMaxEvents", Map.of("max_events", 999_999))
            .getAsJsonObject("result").get("max_events").getAsInt());
    }

    @Test
    void componentsAndEventsAreSerializedSnakeCase() {
        recorder.startRecording();
        LifecycleHooks hooks = session.hooks();
        Counter counter = new Counter();
        hooks.onCreate(counter);
        hooks.onAttach(counter, 7);
        hooks.onRender(counter, 2.5);

        JsonObject component = call("getComponent", Map.of("component_id", 7)).getAsJsonObject("result");
        assertEquals(7, component.get("component_id").getAsInt());
        assertEquals("Counter", component.get("type_name").getAsString());
        assertEquals("resolved", component.get("state").getAsString());
        assertEquals("enhanced", component.get("mode").getAsString());
        assertEquals("2", component.getAsJsonObject("tracked_state").get("count").getAsString());
        JsonObject metrics = component.getAsJsonObject("metrics");
        assertEquals(1, metrics.getAsJsonObject("phases").getAsJsonObject("render").get("call_count").getAsInt());
        assertFalse(metrics.has("invalidation_efficiency_pct"), "unavailable values are omitted");

        JsonArray events = call("getEvents").getAsJsonArray("result");
        assertEquals(1, events.size());
        JsonObject render = events.get(0).getAsJsonObject();
        assertEquals("render", render.get("event_type").getAsString());
        assertEquals("first-render", render.get("trigger_reason").getAsString());
        assertEquals(2.5, render.get("duration_ms").getAsDouble(), 1e-9);

        JsonObject counts = call("getCounts").getAsJsonObject("result");
        assertEquals(1, counts.get("resolved").getAsInt());
        assertEquals(1, counts.get("total").getAsInt());

        JsonArray ranking = call("getRankedComponents").getAsJsonArray("result");
        assertEquals(2.5, ranking.get(0).getAsJsonObject().get("total_render_ms").getAsDouble(), 1e-9);
    }

    @Test
    void eventsSinceUsesAfterId() {
        recorder.startRecording();
        session.hooks().onNavigation("/a");
        session.hooks().onNavigation("/b");

        JsonArray since = call("getEventsSince", Map.of("after_id", 0)).getAsJsonArray("result");
        assertEquals(1, since.size());
        assertEquals("/b", since.get(0).getAsJsonObject().get("component_name").getAsString());
    }

    @Test
    void missingComponentIsAnError() {
        JsonObject reply = call("getComponent", Map.of("component_id", 404));
        assertFalse(reply.get("ok").getAsBoolean());
        assertTrue(reply.get("error").getAsString().contains("404"));
    }

    @Test
    void subtreeFollowsHostTree() {
        session.registry().reconcileWith(HostTreeSnapshot.builder()
            .add(1, new Counter(), null)
            .add(2, new Counter(), 1)
            .build());
        JsonArray subtree = call("getSubtree", Map.of("component_id", 1)).getAsJsonArray("result");
        assertEquals(2, subtree.size());
        assertEquals(1, subtree.get(1).getAsJsonObject().get("parent_id").getAsInt());
    }

    @Test
    void badRequestsAreReportedNotThrown() {
        assertFalse(JsonParser.parseString(endpoint.handle("not json {")).getAsJsonObject().get("ok").getAsBoolean());
        assertFalse(JsonParser.parseString(endpoint.handle("[1,2]")).getAsJsonObject().get("ok").getAsBoolean());
        assertFalse(call("explode").get("ok").getAsBoolean());
        assertFalse(call("getComponent").get("ok").getAsBoolean(), "missing argument");

        JsonObject unknownSession = JsonParser.parseString(
            endpoint.handle(InspectorEndpoint.request("nope", "getState", null))).getAsJsonObject();
        assertTrue(unknownSession.get("error").getAsString().contains("nope"));
    }

    @Test
    void listSessionsNeedsNoSession() {
        sessions.open("s0", null);
        JsonArray ids = JsonParser.parseString(endpoint.handle(InspectorEndpoint.request(null, "listSessions", null)))
            .getAsJsonObject().getAsJsonArray("result");
        assertEquals(2, ids.size());
        assertEquals("s0", ids.get(0).getAsString());
    }
}
