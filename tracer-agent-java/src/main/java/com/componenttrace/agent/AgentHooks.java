package com.componenttrace.agent;

import com.componenttrace.core.hooks.LifecycleHooks;
import com.componenttrace.core.metrics.LifecyclePhase;
import com.componenttrace.core.model.ComponentMode;
import com.componenttrace.core.registry.ComponentRecord;
import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.session.TracerSessions;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentMap;

/**
 * Static entry points called from inlined advice.
 *
 * Maps host objects to tracer sessions: each renderer owns a session and each component joins
 * the session of the renderer that constructed or attached it. Nothing here may throw into the
 * host; failures are logged at debug level and dropped.
 */
public final class AgentHooks {

    private static final Logger log = LoggerFactory.getLogger(AgentHooks.class);
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private AgentHooks() {}

    private static volatile TracerSessions sessions;
    private static volatile HostBinding binding;

    static final ConcurrentMap<Object, TracerSession> rendererSessions = weakIdentityMap();
    static final ConcurrentMap<Object, TracerSession> componentSessions = weakIdentityMap();

    private static <V> ConcurrentMap<Object, V> weakIdentityMap() {
        return Caffeine.newBuilder().weakKeys().<Object, V>build().asMap();
    }

    public static void install(TracerSessions tracerSessions, HostBinding hostBinding) {
        sessions = tracerSessions;
        binding = hostBinding;
    }

    public static TracerSessions sessions() {
        return sessions;
    }

    // -----------------------------------------------------------------------
    // Renderer
    // -----------------------------------------------------------------------

    public static void rendererCreated(Object renderer) {
        TracerSessions s = sessions;
        if (s == null || renderer == null) return;
        try {
            if (rendererSessions.containsKey(renderer)) return;
            String id = renderer.getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(renderer));
            TracerSession session = s.open(id, new ReflectiveTreeIntrospector(renderer, binding));
            rendererSessions.put(renderer, session);
        } catch (RuntimeException e) {
            log.debug("Failed to open session for renderer {}", renderer.getClass().getName(), e);
        }
    }

    public static void rendererDisposed(Object renderer) {
        TracerSessions s = sessions;
        if (s == null || renderer == null) return;
        TracerSession session = rendererSessions.remove(renderer);
        if (session != null) s.close(session.id());
    }

    /** Pushes the renderer's session; a renderer without a session still pushes so exits stay balanced. */
    public static void enterRenderer(Object renderer) {
        SessionScope.enter(renderer != null ? rendererSessions.get(renderer) : null);
    }

    public static void exitRenderer() {
        SessionScope.exit();
    }

    public static void attached(Object renderer, Object[] args, Object returned) {
        try {
            TracerSession session = rendererSessions.get(renderer);
            if (session == null || args == null || args.length == 0 || !(returned instanceof Integer id)) return;
            Object component = args[0];
            if (component == null) return;
            Integer parentId = args.length > 1 && args[1] instanceof Integer p ? p : null;

            TracerSession owner = componentSessions.get(component);
            if (owner == null) {
                // constructed outside any renderer call
                componentSessions.put(component, session);
                session.hooks().onCreate(component);
                owner = session;
            }
            owner.hooks().onAttach(component, id, parentId);
        } catch (RuntimeException e) {
            log.debug("Attach hook failed", e);
        }
    }

    public static void batchStarted(Object renderer, String methodName) {
        SessionScope.Frame frame = SessionScope.enter(renderer != null ? rendererSessions.get(renderer) : null);
        if (frame.session() != null) {
            frame.batchId(frame.session().hooks().onBatchStart(methodName));
        }
    }

    public static void batchCompleted() {
        SessionScope.Frame frame = SessionScope.exit();
        if (frame == null || frame.session() == null) return;
        frame.session().hooks().onBatchEnd(frame.batchId(), List.copyOf(frame.rendered()));
    }

    // -----------------------------------------------------------------------
    // Components
    // -----------------------------------------------------------------------

    public static void componentCreated(Object component) {
        SessionScope.Frame frame = SessionScope.current();
        if (component == null || frame == null || frame.session() == null) return;
        try {
            if (componentSessions.putIfAbsent(component, frame.session()) == null) {
                frame.session().hooks().onCreate(component);
            }
        } catch (RuntimeException e) {
            log.debug("Create hook failed for {}", component.getClass().getName(), e);
        }
    }

    public static void phaseExited(Object component, String methodName, long startNanos, Object[] args,
                                   Object returned) {
        double elapsedMs = (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
        TracerSession session = component != null ? componentSessions.get(component) : null;
        HostBinding b = binding;
        if (session == null || b == null) return;
        try {
            LifecyclePhase phase = b.phaseOf(methodName);
            if (phase == null) return;
            LifecycleHooks hooks = session.hooks();
            ComponentRecord record = session.registry().findByInstance(component).orElse(null);
            if (record == null) return;

            if (record.mode() == ComponentMode.BASIC) {
                if (phase == LifecyclePhase.RENDER && record.isResolved()) {
                    hooks.onBasicRender(record.componentId());
                    noteRendered(session, record);
                }
                return;
            }

            if (returned instanceof CompletionStage<?> stage) {
                long eventId = hooks.onPhaseStart(component, phase);
                stage.whenComplete((value, error) ->
                    hooks.onPhaseEnd(component, phase, eventId, (System.nanoTime() - startNanos) / NANOS_PER_MILLI));
                return;
            }

            switch (phase) {
                case INITIALIZE -> hooks.onInitialized(component, elapsedMs, false);
                case PARAMETERS_SET -> hooks.onParametersApplied(component, elapsedMs, false);
                case RENDER -> {
                    hooks.onRender(component, elapsedMs);
                    noteRendered(session, record);
                }
                case POST_RENDER -> hooks.onPostRender(component, elapsedMs,
                    args != null && args.length > 0 && Boolean.TRUE.equals(args[0]));
                case EVENT_CALLBACK -> hooks.onCallback(component, elapsedMs, false);
            }
        } catch (RuntimeException e) {
            log.debug("Phase hook {} failed for {}", methodName, component.getClass().getName(), e);
        }
    }

    private static void noteRendered(TracerSession session, ComponentRecord record) {
        SessionScope.Frame batch = SessionScope.currentBatch(session);
        if (batch != null && record.isResolved()) batch.addRendered(record.componentId());
    }

    public static void invalidated(Object component, boolean accepted) {
        TracerSession session = component != null ? componentSessions.get(component) : null;
        if (session != null) session.hooks().onInvalidateObserved(component, accepted);
    }

    public static void renderGate(Object component, boolean result) {
        TracerSession session = component != null ? componentSessions.get(component) : null;
        if (session != null) session.hooks().onRenderGate(component, result);
    }

    public static void componentDisposed(Object component) {
        TracerSession session = component != null ? componentSessions.remove(component) : null;
        if (session != null) session.hooks().onDispose(component);
    }

    // -----------------------------------------------------------------------
    // Reset (for testing)
    // -----------------------------------------------------------------------

    public static void reset() {
        sessions = null;
        binding = null;
        rendererSessions.clear();
        componentSessions.clear();
        SessionScope.reset();
    }
}
