package com.componenttrace.core.inspector;

import com.componenttrace.core.FakeTicker;
import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.hooks.LifecycleHooks;
import com.componenttrace.core.inspector.InspectorViews.ComponentSummary;
import com.componenttrace.core.inspector.InspectorViews.InternalStateView;
import com.componenttrace.core.inspector.InspectorViews.ParameterView;
import com.componenttrace.core.introspect.HostTreeSnapshot;
import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.session.TracerSessions;
import com.componenttrace.core.timeline.RingBufferTimelineRecorder;
import com.google.gson.Gson;
import com.google.gson.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class InspectorServiceTest {

    @Retention(RetentionPolicy.RUNTIME)
    @interface Param {}

    static class Greeting {
        @Param String name = "Ada";
        @Param int times;
    }

    static class Divider {}

    private AtomicReference<HostTreeSnapshot> hostTree;
    private TracerSession session;

    @BeforeEach
    void setUp() {
        FakeTicker ticker = new FakeTicker();
        RingBufferTimelineRecorder recorder = new RingBufferTimelineRecorder(1000, 50, ticker, Clock.systemUTC());
        recorder.startRecording();
        hostTree = new AtomicReference<>(HostTreeSnapshot.unsupported());
        TracerSessions sessions = new TracerSessions(recorder, TracerConfig.defaults().withReconcileIntervalMs(0),
            null, ticker, Clock.systemUTC(), new ParameterReader(List.of("Param"), List.of()));
        session = sessions.open("s1", () -> hostTree.get());
    }

    @Test
    void summaryCarriesParameters() {
        LifecycleHooks hooks = session.hooks();
        Greeting greeting = new Greeting();
        hooks.onCreate(greeting);
        hooks.onAttach(greeting, 1);
        greeting.times = 3;

        List<ParameterView> parameters = session.inspector().getComponent(1).orElseThrow().parameters;

        assertEquals(2, parameters.size());
        assertEquals("name", parameters.get(0).name);
        assertEquals("String", parameters.get(0).typeName);
        assertEquals("Ada", parameters.get(0).value);
        assertFalse(parameters.get(0).cascading);
        assertEquals("3", parameters.get(1).value);
    }

    @Test
    void internalStateFollowsLifecycle() {
        LifecycleHooks hooks = session.hooks();
        Greeting greeting = new Greeting();
        hooks.onCreate(greeting);
        hooks.onAttach(greeting, 1);

        InternalStateView fresh = session.inspector().getComponent(1).orElseThrow().internalState;
        assertTrue(fresh.neverRendered);
        assertFalse(fresh.pendingQueuedRender);
        assertFalse(fresh.initialized);
        assertFalse(fresh.calledAfterRender);

        hooks.onInitialized(greeting, 1.0, false);
        hooks.onRender(greeting, 1.0);
        hooks.onPostRender(greeting, 0.5, true);
        hooks.onInvalidate(greeting, false, false);

        InternalStateView rendered = session.inspector().getComponent(1).orElseThrow().internalState;
        assertFalse(rendered.neverRendered);
        assertTrue(rendered.pendingQueuedRender);
        assertTrue(rendered.initialized);
        assertTrue(rendered.calledAfterRender);
    }

    @Test
    void basicComponentsLeavePhaseFlagsUnknown() {
        Divider divider = new Divider();
        hostTree.set(HostTreeSnapshot.builder().add(5, divider, null).build());

        ComponentSummary summary = session.inspector().getComponent(5).orElseThrow();

        assertTrue(summary.internalState.neverRendered);
        assertNull(summary.internalState.initialized);
        assertNull(summary.internalState.calledAfterRender);
        assertNull(summary.parameters);

        JsonObject json = new Gson().toJsonTree(summary).getAsJsonObject();
        JsonObject internal = json.getAsJsonObject("internal_state");
        assertTrue(internal.get("has_never_rendered").getAsBoolean());
        assertFalse(internal.has("is_initialized"));
        assertFalse(json.has("parameters"));
    }
}
