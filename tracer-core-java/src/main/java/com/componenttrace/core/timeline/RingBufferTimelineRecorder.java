package com.componenttrace.core.timeline;

import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Bounded in-memory {@link TimelineRecorder}. The oldest events are evicted once the cap is
 * exceeded; eviction never reorders or reuses sequence ids.
 *
 * Render events are attributed to a cause by checking, per component and in this order,
 * the last invalidation, the last callback invocation and the last parameter set seen since
 * the component's previous render. A render clears all three.
 *
 * Every operation runs under one lock.
 */
public final class RingBufferTimelineRecorder implements TimelineRecorder {

    private static final Logger log = LoggerFactory.getLogger(RingBufferTimelineRecorder.class);

    public static final int DEFAULT_MAX_EVENTS = 5000;
    public static final int MIN_MAX_EVENTS = 100;
    public static final int MAX_MAX_EVENTS = 50_000;
    public static final int DEFAULT_MAX_BATCHES = 500;

    static final String BATCH_COMPONENT_NAME = "[RenderBatch]";

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final Object lock = new Object();
    private final Ticker ticker;
    private final Clock clock;

    private final Deque<TimelineEvent> events = new ArrayDeque<>();
    private final List<RenderBatch> batches = new ArrayList<>();
    private int maxEvents;
    private final int maxBatches;

    private boolean recording;
    private Instant startedAt;
    private long originNanos;
    private long stoppedNanos = -1;
    private long nextEventId;
    private long nextBatchId;

    private final Map<Integer, Long> lastInvalidation = new HashMap<>();
    private final Map<Integer, Long> lastCallback = new HashMap<>();
    private final Map<Integer, Long> lastParametersSet = new HashMap<>();

    private RenderBatch currentBatch;

    public RingBufferTimelineRecorder() {
        this(DEFAULT_MAX_EVENTS, DEFAULT_MAX_BATCHES, Ticker.systemTicker(), Clock.systemUTC());
    }

    /**
     * @param maxEvents initial cap; unlike {@link #setMaxEvents(int)} only required to be positive
     */
    public RingBufferTimelineRecorder(int maxEvents, int maxBatches, Ticker ticker, Clock clock) {
        if (maxEvents < 1) throw new IllegalArgumentException("maxEvents must be positive: " + maxEvents);
        if (maxBatches < 1) throw new IllegalArgumentException("maxBatches must be positive: " + maxBatches);
        this.maxEvents = maxEvents;
        this.maxBatches = maxBatches;
        this.ticker = ticker;
        this.clock = clock;
        this.originNanos = ticker.read();
    }

    // -----------------------------------------------------------------------
    // Recording controls
    // -----------------------------------------------------------------------

    @Override
    public void startRecording() {
        synchronized (lock) {
            if (recording) return;
            recording = true;
            startedAt = clock.instant();
            originNanos = ticker.read();
            stoppedNanos = -1;
            resetBuffersLocked();
            log.info("Timeline recording started (max events {})", maxEvents);
        }
    }

    @Override
    public void stopRecording() {
        synchronized (lock) {
            if (!recording) return;
            recording = false;
            stoppedNanos = ticker.read();
            log.info("Timeline recording stopped ({} events, {} batches)", events.size(), batches.size());
        }
    }

    @Override
    public void clear() {
        synchronized (lock) {
            resetBuffersLocked();
            if (recording) {
                startedAt = clock.instant();
                originNanos = ticker.read();
            }
        }
    }

    private void resetBuffersLocked() {
        events.clear();
        batches.clear();
        nextEventId = 0;
        nextBatchId = 0;
        lastInvalidation.clear();
        lastCallback.clear();
        lastParametersSet.clear();
        currentBatch = null;
    }

    @Override
    public boolean isRecording() {
        synchronized (lock) {
            return recording;
        }
    }

    @Override
    public RecordingState state() {
        synchronized (lock) {
            double elapsed;
            if (startedAt == null) {
                elapsed = 0;
            } else {
                long end = recording ? ticker.read() : stoppedNanos;
                elapsed = (end - originNanos) / NANOS_PER_MILLI;
            }
            return new RecordingState(recording, startedAt, elapsed, events.size(), batches.size(), maxEvents);
        }
    }

    @Override
    public int setMaxEvents(int requested) {
        synchronized (lock) {
            maxEvents = Math.max(MIN_MAX_EVENTS, Math.min(requested, MAX_MAX_EVENTS));
            trimEventsLocked();
            return maxEvents;
        }
    }

    @Override
    public int maxEvents() {
        synchronized (lock) {
            return maxEvents;
        }
    }

    // -----------------------------------------------------------------------
    // Recording
    // -----------------------------------------------------------------------

    @Override
    public long recordEvent(int componentId, String componentName, TimelineEventKind kind, EventOptions options) {
        synchronized (lock) {
            if (!recording) return NOT_RECORDING;
            try {
                return appendLocked(componentId, componentName, kind, options != null ? options : EventOptions.NONE);
            } catch (RuntimeException e) {
                log.debug("Dropped {} event for component {}", kind, componentId, e);
                return NOT_RECORDING;
            }
        }
    }

    @Override
    public long recordEventStart(int componentId, String componentName, TimelineEventKind kind, EventOptions options) {
        EventOptions open = (options != null ? options : EventOptions.NONE).withDuration(null);
        return recordEvent(componentId, componentName, kind, open);
    }

    @Override
    public void recordEventEnd(long eventId, double durationMs, String details) {
        if (eventId < 0) return;
        synchronized (lock) {
            if (!recording) return;
            TimelineEvent event = findEventLocked(eventId);
            if (event != null) {
                event.fillDuration(durationMs, details);
            }
        }
    }

    @Override
    public long recordBatchStart(String triggerSource) {
        synchronized (lock) {
            if (!recording) return NOT_RECORDING;
            long batchId = nextBatchId++;
            double relativeMs = relativeMsLocked();
            // the batch-started event is not itself a member of the batch
            currentBatch = null;
            long startEventId = appendLocked(SESSION_COMPONENT_ID, BATCH_COMPONENT_NAME,
                TimelineEventKind.BATCH_STARTED, EventOptions.NONE.asBasic().withDetails(triggerSource), batchId, null);
            currentBatch = new RenderBatch(batchId, startEventId, relativeMs, null, List.of(), triggerSource);
            batches.add(currentBatch);
            while (batches.size() > maxBatches) {
                batches.remove(0);
            }
            return batchId;
        }
    }

    @Override
    public void recordBatchEnd(long batchId, List<Integer> componentIds) {
        if (batchId < 0) return;
        synchronized (lock) {
            if (!recording) return;
            Long startEventId = null;
            for (ListIterator<RenderBatch> it = batches.listIterator(batches.size()); it.hasPrevious(); ) {
                RenderBatch batch = it.previous();
                if (batch.batchId() == batchId) {
                    it.set(batch.complete(relativeMsLocked(), componentIds));
                    startEventId = batch.startEventId() >= 0 ? batch.startEventId() : null;
                    break;
                }
            }
            if (currentBatch != null && currentBatch.batchId() == batchId) {
                currentBatch = null;
            }
            int count = componentIds != null ? componentIds.size() : 0;
            appendLocked(SESSION_COMPONENT_ID, BATCH_COMPONENT_NAME, TimelineEventKind.BATCH_COMPLETED,
                EventOptions.NONE.asBasic().withDetails(count + " components"), batchId, startEventId);
        }
    }

    private long appendLocked(int componentId, String componentName, TimelineEventKind kind, EventOptions options) {
        Long batchId = currentBatch != null ? currentBatch.batchId() : null;
        Long parentEventId = currentBatch != null && currentBatch.startEventId() >= 0 ? currentBatch.startEventId() : null;
        return appendLocked(componentId, componentName, kind, options, batchId, parentEventId);
    }

    private long appendLocked(int componentId, String componentName, TimelineEventKind kind, EventOptions options,
                              Long batchId, Long parentEventId) {
        long eventId = nextEventId++;

        TriggerReason reason;
        Long triggeringEventId = null;
        if (options.firstRender()) {
            reason = TriggerReason.FIRST_RENDER;
        } else if (kind == TimelineEventKind.RENDER) {
            if ((triggeringEventId = lastInvalidation.get(componentId)) != null) {
                reason = TriggerReason.STATE_INVALIDATED;
            } else if ((triggeringEventId = lastCallback.get(componentId)) != null) {
                reason = TriggerReason.CALLBACK_INVOKED;
            } else if ((triggeringEventId = lastParametersSet.get(componentId)) != null) {
                reason = TriggerReason.PARAMETERS_CHANGED;
            } else {
                reason = TriggerReason.PARENT_RERENDERED;
            }
        } else {
            reason = TriggerReason.UNKNOWN;
        }

        TimelineEvent event = new TimelineEvent(eventId, clock.instant(), relativeMsLocked(), componentId,
            componentName, kind, options, parentEventId, triggeringEventId, reason, batchId);
        events.addLast(event);
        trackForCorrelationLocked(componentId, eventId, kind);
        trimEventsLocked();
        return eventId;
    }

    private void trackForCorrelationLocked(int componentId, long eventId, TimelineEventKind kind) {
        switch (kind) {
            case INVALIDATION -> lastInvalidation.put(componentId, eventId);
            case CALLBACK_INVOKED -> lastCallback.put(componentId, eventId);
            case PARAMETERS_SET -> lastParametersSet.put(componentId, eventId);
            case RENDER -> {
                lastInvalidation.remove(componentId);
                lastCallback.remove(componentId);
                lastParametersSet.remove(componentId);
            }
            default -> { }
        }
    }

    private void trimEventsLocked() {
        while (events.size() > maxEvents) {
            events.pollFirst();
        }
    }

    private TimelineEvent findEventLocked(long eventId) {
        // recent events are the likely targets
        for (Iterator<TimelineEvent> it = events.descendingIterator(); it.hasNext(); ) {
            TimelineEvent event = it.next();
            if (event.eventId() == eventId) return event;
            if (event.eventId() < eventId) return null;
        }
        return null;
    }

    private double relativeMsLocked() {
        return (ticker.read() - originNanos) / NANOS_PER_MILLI;
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    @Override
    public List<TimelineEvent> events() {
        return select(e -> true);
    }

    @Override
    public List<TimelineEvent> eventsSince(long afterEventId) {
        return select(e -> e.eventId() > afterEventId);
    }

    @Override
    public List<TimelineEvent> eventsInRange(double startMs, double endMs) {
        return select(e -> e.relativeMs() >= startMs && e.relativeMs() <= endMs);
    }

    @Override
    public List<TimelineEvent> eventsForComponent(int componentId) {
        return select(e -> e.componentId() == componentId);
    }

    private List<TimelineEvent> select(Predicate<TimelineEvent> filter) {
        synchronized (lock) {
            List<TimelineEvent> result = new ArrayList<>();
            for (TimelineEvent event : events) {
                if (filter.test(event)) result.add(event);
            }
            return result;
        }
    }

    @Override
    public List<RenderBatch> batches() {
        synchronized (lock) {
            return List.copyOf(batches);
        }
    }

    @Override
    public List<ComponentRanking> rankedComponents() {
        Map<RankKey, RankAccumulator> byComponent = new LinkedHashMap<>();
        synchronized (lock) {
            for (TimelineEvent event : events) {
                Double duration = event.durationMs();
                if (event.kind() != TimelineEventKind.RENDER || duration == null) continue;
                byComponent.computeIfAbsent(new RankKey(event.componentId(), event.componentName()),
                    k -> new RankAccumulator()).add(duration);
            }
        }
        List<ComponentRanking> ranking = new ArrayList<>(byComponent.size());
        byComponent.forEach((key, acc) -> ranking.add(new ComponentRanking(key.componentId(), key.componentName(),
            acc.total, acc.count, acc.total / acc.count, acc.max, acc.min)));
        ranking.sort(Comparator.comparingDouble(ComponentRanking::totalRenderMs).reversed()
            .thenComparingInt(ComponentRanking::componentId)
            .thenComparing(ComponentRanking::componentName));
        return ranking;
    }

    private record RankKey(int componentId, String componentName) {}

    private static final class RankAccumulator {
        double total;
        int count;
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;

        void add(double duration) {
            total += duration;
            count++;
            max = Math.max(max, duration);
            min = Math.min(min, duration);
        }
    }
}
