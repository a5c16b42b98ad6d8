package com.componenttrace.core.session;

import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.hooks.LifecycleHooks;
import com.componenttrace.core.inspector.InspectorService;
import com.componenttrace.core.inspector.ParameterReader;
import com.componenttrace.core.inspector.TrackedStateReader;
import com.componenttrace.core.introspect.HostTreeIntrospector;
import com.componenttrace.core.push.EventPublisher;
import com.componenttrace.core.push.InspectorChannel;
import com.componenttrace.core.registry.ComponentRegistry;
import com.componenttrace.core.timeline.EventOptions;
import com.componenttrace.core.timeline.TimelineEventKind;
import com.componenttrace.core.timeline.TimelineRecorder;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens and closes tracer sessions over one shared timeline.
 *
 * Opening and closing a session are themselves recorded as timeline events.
 */
public final class TracerSessions implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TracerSessions.class);

    private final TimelineRecorder recorder;
    private final TracerConfig config;
    private final InspectorChannel channel;
    private final Ticker ticker;
    private final Clock clock;
    private final TrackedStateReader stateReader = new TrackedStateReader();
    private final ParameterReader parameterReader;
    private final Map<String, TracerSession> sessions = new ConcurrentHashMap<>();

    public TracerSessions(TimelineRecorder recorder, TracerConfig config) {
        this(recorder, config, null, Ticker.systemTicker(), Clock.systemUTC());
    }

    /**
     * @param channel push target for lifecycle notifications; null disables pushing
     */
    public TracerSessions(TimelineRecorder recorder, TracerConfig config, InspectorChannel channel,
                          Ticker ticker, Clock clock) {
        this(recorder, config, channel, ticker, clock, ParameterReader.none());
    }

    /**
     * @param parameterReader reads component parameters for the inspector views
     */
    public TracerSessions(TimelineRecorder recorder, TracerConfig config, InspectorChannel channel,
                          Ticker ticker, Clock clock, ParameterReader parameterReader) {
        this.parameterReader = parameterReader != null ? parameterReader : ParameterReader.none();
        this.recorder = recorder;
        this.config = config != null ? config : TracerConfig.defaults();
        this.channel = channel;
        this.ticker = ticker;
        this.clock = clock;
    }

    public TimelineRecorder recorder() {
        return recorder;
    }

    public TracerConfig config() {
        return config;
    }

    public TracerSession openNew(HostTreeIntrospector introspector) {
        return open(UUID.randomUUID().toString(), introspector);
    }

    /**
     * Opens a session, or returns the live one already registered under the id. Sessions whose
     * host tree has been collected are closed first.
     */
    public TracerSession open(String sessionId, HostTreeIntrospector introspector) {
        closeDetached();
        TracerSession[] created = new TracerSession[1];
        TracerSession session = sessions.computeIfAbsent(sessionId, id -> {
            created[0] = create(id, introspector != null ? introspector : HostTreeIntrospector.unsupported());
            return created[0];
        });
        if (created[0] != null) {
            recorder.recordEvent(TimelineRecorder.SESSION_COMPONENT_ID, sessionId, TimelineEventKind.SESSION_OPENED,
                EventOptions.NONE);
            log.info("Opened tracer session {}", sessionId);
        }
        return session;
    }

    public Optional<TracerSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public List<TracerSession> sessions() {
        return new ArrayList<>(sessions.values());
    }

    /** @return false when no session was open under the id */
    public boolean close(String sessionId) {
        TracerSession session = sessions.remove(sessionId);
        if (session == null) return false;
        session.registry().close();
        recorder.recordEvent(TimelineRecorder.SESSION_COMPONENT_ID, sessionId, TimelineEventKind.SESSION_CLOSED,
            EventOptions.NONE);
        log.info("Closed tracer session {}", sessionId);
        return true;
    }

    /**
     * Closes every session whose host went away without a close call.
     *
     * @return the number of sessions closed
     */
    public int closeDetached() {
        int closed = 0;
        for (TracerSession session : new ArrayList<>(sessions.values())) {
            if (session.registry().isHostDetached() && close(session.id())) {
                log.info("Host of tracer session {} was collected", session.id());
                closed++;
            }
        }
        return closed;
    }

    @Override
    public void close() {
        for (String id : new ArrayList<>(sessions.keySet())) {
            close(id);
        }
    }

    private TracerSession create(String id, HostTreeIntrospector introspector) {
        ComponentRegistry registry = new ComponentRegistry(id, introspector, config.getReconcileInterval(), ticker, clock);
        EventPublisher publisher = channel != null && config.isPushEnabled()
            ? new EventPublisher(channel, config.getMaxBufferedEvents())
            : null;
        LifecycleHooks hooks = new LifecycleHooks(id, registry, recorder, config, publisher);
        InspectorService inspector = new InspectorService(registry, recorder, stateReader, parameterReader);
        return new TracerSession(id, clock.instant(), registry, hooks, inspector);
    }
}
