package com.componenttrace.core.hooks;

import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.metrics.InvalidationOutcome;
import com.componenttrace.core.metrics.LifecycleMetrics;
import com.componenttrace.core.metrics.LifecyclePhase;
import com.componenttrace.core.model.ComponentMode;
import com.componenttrace.core.model.ComponentType;
import com.componenttrace.core.push.EventPublisher;
import com.componenttrace.core.push.LifecycleNotification;
import com.componenttrace.core.registry.ComponentRecord;
import com.componenttrace.core.registry.ComponentRegistry;
import com.componenttrace.core.timeline.EventOptions;
import com.componenttrace.core.timeline.TimelineEventKind;
import com.componenttrace.core.timeline.TimelineRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Entry points the host runtime calls at component lifecycle boundaries, for one session.
 *
 * Each hook updates the registry, the component's metrics and the timeline. Hooks never
 * throw: a failure is logged and the calling render carries on with less data.
 *
 * The configured filters (excluded types, event kinds, minimum duration) only narrow what is
 * pushed to a connected inspector. The timeline sees every event of a resolved component so
 * that each render consumes its trigger.
 */
public final class LifecycleHooks {

    private static final Logger log = LoggerFactory.getLogger(LifecycleHooks.class);

    private final String sessionId;
    private final ComponentRegistry registry;
    private final TimelineRecorder recorder;
    private final TracerConfig config;
    private final EventPublisher publisher;
    private final Set<TimelineEventKind> kindFilter;

    public LifecycleHooks(String sessionId, ComponentRegistry registry, TimelineRecorder recorder,
                          TracerConfig config, EventPublisher publisher) {
        this.sessionId = sessionId;
        this.registry = registry;
        this.recorder = recorder;
        this.config = config != null ? config : TracerConfig.defaults();
        this.publisher = publisher;
        this.kindFilter = this.config.getEventKindFilter();
    }

    public boolean isTimingEnabled() {
        return config.isTimingEnabled();
    }

    // -----------------------------------------------------------------------
    // Identity
    // -----------------------------------------------------------------------

    /** Component constructed; its mode follows the configured enhanced namespace. */
    public void onCreate(Object instance) {
        if (instance == null) return;
        onCreate(instance, config.isEnhanced(instance.getClass()) ? ComponentMode.ENHANCED : ComponentMode.BASIC);
    }

    public void onCreate(Object instance, ComponentMode mode) {
        guard("create", () -> {
            if (instance == null) return;
            registry.registerPending(instance, ComponentType.of(instance.getClass()), mode);
        });
    }

    public void onAttach(Object instance, int componentId) {
        onAttach(instance, componentId, null);
    }

    /**
     * The host assigned an id. Only enhanced components resolve here; basic ones wait for
     * reconciliation against the host tree.
     */
    public void onAttach(Object instance, int componentId, Integer parentId) {
        guard("attach", () -> {
            Optional<ComponentRecord> record = registry.findByInstance(instance);
            if (record.isPresent() && record.get().mode() == ComponentMode.ENHANCED) {
                registry.resolveDirect(instance, componentId, parentId);
            }
        });
    }

    public void onDispose(Object instance) {
        guard("dispose", () -> {
            Optional<ComponentRecord> removed = registry.unregister(instance);
            if (removed.isEmpty()) return;
            ComponentRecord record = removed.get();
            if (record.hasMetrics()) record.metrics().markDisposed();
            emit(record, TimelineEventKind.DISPOSE, EventOptions.NONE);
        });
    }

    // -----------------------------------------------------------------------
    // Timed phases
    // -----------------------------------------------------------------------

    public void onInitialized(Object instance, Double durationMs, boolean async) {
        guard("initialized", () -> timedPhase(instance, LifecyclePhase.INITIALIZE, TimelineEventKind.INITIALIZE,
            durationMs, async, false));
    }

    public void onParametersApplied(Object instance, Double durationMs, boolean async) {
        guard("parameters", () -> timedPhase(instance, LifecyclePhase.PARAMETERS_SET, TimelineEventKind.PARAMETERS_SET,
            durationMs, async, false));
    }

    public void onRender(Object instance, Double durationMs) {
        guard("render", () -> {
            ComponentRecord record = enhancedRecord(instance);
            if (record == null) return;
            boolean firstRender = record.metrics().renderCount() == 0;
            record.setRenderQueued(false);
            timedPhase(record, LifecyclePhase.RENDER, TimelineEventKind.RENDER, durationMs, false, firstRender);
        });
    }

    public void onPostRender(Object instance, Double durationMs, boolean firstRender) {
        guard("post-render", () -> timedPhase(instance, LifecyclePhase.POST_RENDER, TimelineEventKind.POST_RENDER,
            durationMs, false, firstRender));
    }

    public void onCallback(Object instance, Double durationMs, boolean async) {
        guard("callback", () -> timedPhase(instance, LifecyclePhase.EVENT_CALLBACK, TimelineEventKind.CALLBACK_INVOKED,
            durationMs, async, false));
    }

    /**
     * Opens a timeline event for a phase whose duration spans an awaited operation.
     *
     * @return the event id to pass to {@link #onPhaseEnd}, or {@link TimelineRecorder#NOT_RECORDING}
     */
    public long onPhaseStart(Object instance, LifecyclePhase phase) {
        return guardLong("phase-start", () -> {
            ComponentRecord record = enhancedRecord(instance);
            if (record == null || !record.isResolved()) return TimelineRecorder.NOT_RECORDING;
            return recorder.recordEventStart(record.componentId(), record.type().shortName(), kindOf(phase),
                EventOptions.NONE.asAsync());
        }, TimelineRecorder.NOT_RECORDING);
    }

    public void onPhaseEnd(Object instance, LifecyclePhase phase, long eventId, double durationMs) {
        guard("phase-end", () -> {
            ComponentRecord record = enhancedRecord(instance);
            if (record == null) return;
            record.metrics().recordPhase(phase, durationMs);
            recorder.recordEventEnd(eventId, durationMs, null);
        });
    }

    private void timedPhase(Object instance, LifecyclePhase phase, TimelineEventKind kind,
                            Double durationMs, boolean async, boolean firstRender) {
        ComponentRecord record = enhancedRecord(instance);
        if (record != null) timedPhase(record, phase, kind, durationMs, async, firstRender);
    }

    private void timedPhase(ComponentRecord record, LifecyclePhase phase, TimelineEventKind kind,
                            Double durationMs, boolean async, boolean firstRender) {
        LifecycleMetrics metrics = record.metrics();
        Double measured = config.isTimingEnabled() ? durationMs : null;
        if (measured != null) {
            metrics.recordPhase(phase, measured);
        } else {
            metrics.recordCall(phase);
        }
        EventOptions options = EventOptions.NONE.withDuration(measured).asFirstRender(firstRender);
        emit(record, kind, async ? options.asAsync() : options);
    }

    // -----------------------------------------------------------------------
    // Invalidation
    // -----------------------------------------------------------------------

    /**
     * State-invalidation call with both facts known up front.
     */
    public InvalidationOutcome onInvalidate(Object instance, boolean renderAlreadyQueued, boolean renderDeclined) {
        return guardGet("invalidate", () -> {
            ComponentRecord record = enhancedRecord(instance);
            InvalidationOutcome outcome = InvalidationOutcome.classify(renderAlreadyQueued, renderDeclined);
            if (record == null) return outcome;

            record.metrics().recordInvalidation(renderAlreadyQueued, renderDeclined);
            if (outcome == InvalidationOutcome.HONORED) {
                record.setRenderQueued(true);
                emit(record, TimelineEventKind.INVALIDATION, EventOptions.NONE);
            } else {
                emit(record, TimelineEventKind.INVALIDATION_SUPPRESSED,
                    EventOptions.NONE.asSuppressed().withDetails(outcome.reason()));
            }
            return outcome;
        }, InvalidationOutcome.HONORED);
    }

    /**
     * State-invalidation observed from outside: the host only reports whether it accepted the
     * request. A render queued by an earlier honored invalidation and not yet performed makes
     * this one already-queued; otherwise a rejection means the render gate declined.
     */
    public InvalidationOutcome onInvalidateObserved(Object instance, boolean accepted) {
        Optional<ComponentRecord> record = registry.findByInstance(instance);
        boolean alreadyQueued = record.map(ComponentRecord::isRenderQueued).orElse(false);
        return onInvalidate(instance, alreadyQueued, !accepted && !alreadyQueued);
    }

    public void onRenderGate(Object instance, boolean result) {
        guard("render-gate", () -> {
            ComponentRecord record = enhancedRecord(instance);
            if (record != null) record.metrics().recordRenderGate(result);
        });
    }

    // -----------------------------------------------------------------------
    // Session-level events
    // -----------------------------------------------------------------------

    public long onBatchStart(String triggerSource) {
        return guardLong("batch-start", () -> recorder.recordBatchStart(triggerSource), TimelineRecorder.NOT_RECORDING);
    }

    public void onBatchEnd(long batchId, List<Integer> componentIds) {
        guard("batch-end", () -> {
            recorder.recordBatchEnd(batchId, componentIds != null ? componentIds : List.of());
            if (publisher != null && config.isPushEnabled()) publisher.flush();
        });
    }

    /** A basic-mode component rendered; seen from outside its own code. */
    public void onBasicRender(int componentId) {
        guard("basic-render", () -> {
            registry.recordBasicRender(componentId);
            String name = registry.peekById(componentId).map(r -> r.type().shortName()).orElse("Unknown");
            recorder.recordEvent(componentId, name, TimelineEventKind.BASIC_RENDER,
                EventOptions.NONE.asBasic().withDetails("Detected via host tree"));
        });
    }

    public void onNavigation(String location) {
        guard("navigation", () -> {
            recorder.recordEvent(TimelineRecorder.SESSION_COMPONENT_ID, location, TimelineEventKind.NAVIGATION,
                EventOptions.NONE.withDetails(sessionId));
        });
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private ComponentRecord enhancedRecord(Object instance) {
        if (instance == null) return null;
        ComponentRecord record = registry.findByInstance(instance).orElse(null);
        return record != null && record.hasMetrics() ? record : null;
    }

    /**
     * Records the event on the timeline and offers it to the push channel. A record still
     * pending has no id of its own, so it stays off the timeline until it resolves.
     */
    private void emit(ComponentRecord record, TimelineEventKind kind, EventOptions options) {
        if (record.isResolved()) {
            EventOptions effective = record.mode() == ComponentMode.BASIC ? options.asBasic() : options;
            recorder.recordEvent(record.componentId(), record.type().shortName(), kind, effective);
        }
        if (shouldPush(record, kind, options.durationMs())) {
            publisher.publish(new LifecycleNotification(sessionId, record.componentId(), record.type().shortName(),
                kind.wireName(), options.durationMs(), Instant.now().toString()));
        }
    }

    private boolean shouldPush(ComponentRecord record, TimelineEventKind kind, Double durationMs) {
        if (publisher == null || !config.isPushEnabled()) return false;
        if (durationMs != null && durationMs > 0 && durationMs < config.getMinDurationMs()) return false;
        if (kindFilter != null && !kindFilter.contains(kind)) return false;
        return !config.isExcluded(record.type());
    }

    private static TimelineEventKind kindOf(LifecyclePhase phase) {
        return switch (phase) {
            case INITIALIZE -> TimelineEventKind.INITIALIZE;
            case PARAMETERS_SET -> TimelineEventKind.PARAMETERS_SET;
            case RENDER -> TimelineEventKind.RENDER;
            case POST_RENDER -> TimelineEventKind.POST_RENDER;
            case EVENT_CALLBACK -> TimelineEventKind.CALLBACK_INVOKED;
        };
    }

    private void guard(String hook, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.debug("Lifecycle hook '{}' failed in session {}", hook, sessionId, e);
        }
    }

    private long guardLong(String hook, LongSupplier action, long fallback) {
        try {
            return action.getAsLong();
        } catch (RuntimeException e) {
            log.debug("Lifecycle hook '{}' failed in session {}", hook, sessionId, e);
            return fallback;
        }
    }

    private <T> T guardGet(String hook, Supplier<T> action, T fallback) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.debug("Lifecycle hook '{}' failed in session {}", hook, sessionId, e);
            return fallback;
        }
    }
}
