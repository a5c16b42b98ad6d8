package com.componenttrace.core.registry;

import com.componenttrace.core.introspect.HostTreeEntry;
import com.componenttrace.core.introspect.HostTreeIntrospector;
import com.componenttrace.core.introspect.HostTreeSnapshot;
import com.componenttrace.core.metrics.LifecycleMetrics;
import com.componenttrace.core.model.ComponentMode;
import com.componenttrace.core.model.ComponentType;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-session mapping from component identity to {@link ComponentRecord}, kept consistent
 * with the host's own component tree.
 *
 * Components enter as pending (created, id unknown) and become resolved either directly,
 * when the host hands out the id through an instrumented attach, or indirectly through
 * {@link #reconcile()}. Instance-keyed maps compare keys by identity and hold them weakly.
 *
 * All state is guarded by one lock; a reconciliation pass holds it from snapshot to the
 * last removal so readers never observe a half-applied pass.
 */
public final class ComponentRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ComponentRegistry.class);

    public static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofMillis(250);

    private final String sessionId;
    private final HostTreeIntrospector introspector;
    private final long minIntervalNanos;
    private final Ticker ticker;
    private final Clock clock;

    private final Object lock = new Object();
    private final AtomicLong sequence = new AtomicLong();

    private final ConcurrentMap<Object, ComponentRecord> pendingByInstance = weakIdentityMap();
    private final ConcurrentMap<Object, ComponentRecord> resolvedByInstance = weakIdentityMap();
    private final ConcurrentMap<Object, Boolean> disposedInstances = weakIdentityMap();
    private final Map<Integer, ComponentRecord> resolvedById = new TreeMap<>();

    private long lastReconcileNanos;
    private boolean reconciledOnce;
    private boolean closed;

    public ComponentRegistry(String sessionId, HostTreeIntrospector introspector) {
        this(sessionId, introspector, DEFAULT_RECONCILE_INTERVAL, Ticker.systemTicker(), Clock.systemUTC());
    }

    public ComponentRegistry(String sessionId, HostTreeIntrospector introspector, Duration minReconcileInterval,
                             Ticker ticker, Clock clock) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.introspector = introspector != null ? introspector : HostTreeIntrospector.unsupported();
        this.minIntervalNanos = minReconcileInterval.toNanos();
        this.ticker = ticker;
        this.clock = clock;
    }

    private static <V> ConcurrentMap<Object, V> weakIdentityMap() {
        return Caffeine.newBuilder().weakKeys().<Object, V>build().asMap();
    }

    public String sessionId() {
        return sessionId;
    }

    // -----------------------------------------------------------------------
    // Lifecycle transitions
    // -----------------------------------------------------------------------

    /**
     * Records a freshly created component as pending. Registering the same pending instance
     * again replaces its record; an already resolved instance keeps its record.
     */
    public ComponentRecord registerPending(Object instance, ComponentType type, ComponentMode mode) {
        Objects.requireNonNull(instance, "instance");
        ComponentType effectiveType = type != null ? type : ComponentType.of(instance.getClass());
        synchronized (lock) {
            ComponentRecord resolved = resolvedByInstance.get(instance);
            if (resolved != null) return resolved;

            LifecycleMetrics metrics = mode == ComponentMode.ENHANCED ? new LifecycleMetrics(ticker, clock) : null;
            ComponentRecord record = new ComponentRecord(instance, effectiveType, mode, clock.instant(),
                metrics, false, sequence.incrementAndGet());
            if (!closed) {
                pendingByInstance.put(instance, record);
                disposedInstances.remove(instance);
            }
            log.debug("Registered pending {} ({}, session {})", effectiveType.shortName(), mode, sessionId);
            return record;
        }
    }

    public Optional<ComponentRecord> resolveDirect(Object instance, int componentId) {
        return resolveDirect(instance, componentId, null);
    }

    /**
     * Promotes a pending instance to resolved with the id the host just assigned.
     * Does nothing when the instance was never pending.
     */
    public Optional<ComponentRecord> resolveDirect(Object instance, int componentId, Integer parentId) {
        if (instance == null) return Optional.empty();
        synchronized (lock) {
            ComponentRecord record = pendingByInstance.remove(instance);
            if (record == null) return Optional.empty();
            promote(instance, record, componentId, parentId);
            log.debug("Resolved {} -> id {} (session {})", record.type().shortName(), componentId, sessionId);
            return Optional.of(record);
        }
    }

    /**
     * Removes the record of a disposed component, pending or resolved. A host tree that still
     * reports the instance will not bring it back.
     */
    public Optional<ComponentRecord> unregister(Object instance) {
        if (instance == null) return Optional.empty();
        synchronized (lock) {
            disposedInstances.put(instance, Boolean.TRUE);
            ComponentRecord record = resolvedByInstance.remove(instance);
            if (record != null) {
                resolvedById.remove(record.componentId(), record);
                log.debug("Unregistered {} (session {})", record, sessionId);
                return Optional.of(record);
            }
            record = pendingByInstance.remove(instance);
            if (record != null) {
                log.debug("Unregistered pending {} (session {})", record.type().shortName(), sessionId);
            }
            return Optional.ofNullable(record);
        }
    }

    /** Counts a render observed for a basic-mode component. Unknown ids are ignored. */
    public void recordBasicRender(int componentId) {
        synchronized (lock) {
            ComponentRecord record = resolvedById.get(componentId);
            if (record != null && !record.hasMetrics()) {
                record.recordBasicRender(clock.instant());
            }
        }
    }

    // -----------------------------------------------------------------------
    // Reconciliation
    // -----------------------------------------------------------------------

    /**
     * Reconciles against a fresh host snapshot unless the previous pass ran less than the
     * minimum interval ago. Never throws.
     */
    public ReconcileResult reconcile() {
        long now = ticker.read();
        synchronized (lock) {
            if (closed) return ReconcileResult.throttled();
            if (reconciledOnce && now - lastReconcileNanos < minIntervalNanos) {
                return ReconcileResult.throttled();
            }
            lastReconcileNanos = now;
            reconciledOnce = true;

            HostTreeSnapshot snapshot;
            try {
                snapshot = introspector.introspect();
            } catch (RuntimeException e) {
                log.debug("Host tree introspection failed (session {}): {}", sessionId, e.toString());
                return ReconcileResult.failed();
            }
            return applyLocked(snapshot);
        }
    }

    /**
     * Runs the reconciliation algorithm against the given snapshot, bypassing the throttle.
     */
    public ReconcileResult reconcileWith(HostTreeSnapshot snapshot) {
        synchronized (lock) {
            if (closed) return ReconcileResult.throttled();
            return applyLocked(snapshot);
        }
    }

    private ReconcileResult applyLocked(HostTreeSnapshot snapshot) {
        if (snapshot == null || !snapshot.isSupported()) {
            return ReconcileResult.unsupported();
        }
        try {
            Map<Integer, HostTreeEntry> entries = snapshot.entries();
            IdentityHashMap<Object, HostTreeEntry> entriesByInstance = new IdentityHashMap<>();
            for (HostTreeEntry entry : entries.values()) {
                if (entry.instance() != null) entriesByInstance.put(entry.instance(), entry);
            }

            int promoted = promoteMatchingPending(entriesByInstance);
            promoted += promoteByTypeName(entries);
            int refreshed = refreshParents(entries);
            int synthesized = synthesizeMissing(entries);
            int removed = removeAbsent(entries);

            if (promoted + synthesized + removed > 0) {
                log.debug("Reconciled session {}: promoted={} refreshed={} synthesized={} removed={}",
                    sessionId, promoted, refreshed, synthesized, removed);
            }
            return new ReconcileResult(ReconcileResult.Status.APPLIED, promoted, refreshed, synthesized, removed);
        } catch (RuntimeException e) {
            log.warn("Reconciliation failed for session {}", sessionId, e);
            return ReconcileResult.failed();
        }
    }

    /** Pending records whose instance the host reports by reference. */
    private int promoteMatchingPending(IdentityHashMap<Object, HostTreeEntry> entriesByInstance) {
        List<Map.Entry<Object, ComponentRecord>> matches = new ArrayList<>();
        for (Map.Entry<Object, ComponentRecord> pending : pendingByInstance.entrySet()) {
            if (entriesByInstance.containsKey(pending.getKey())) matches.add(pending);
        }
        for (Map.Entry<Object, ComponentRecord> match : matches) {
            HostTreeEntry entry = entriesByInstance.get(match.getKey());
            if (pendingByInstance.remove(match.getKey(), match.getValue())) {
                promote(match.getKey(), match.getValue(), entry.componentId(), entry.parentId());
            }
        }
        return matches.size();
    }

    /**
     * Lower-confidence fallback for entries the host reported without an instance: adopt the
     * earliest registered basic-mode pending record of the same type.
     */
    private int promoteByTypeName(Map<Integer, HostTreeEntry> entries) {
        int promoted = 0;
        for (HostTreeEntry entry : entries.values()) {
            if (entry.instance() != null || resolvedById.containsKey(entry.componentId())) continue;

            Map.Entry<Object, ComponentRecord> candidate = null;
            for (Map.Entry<Object, ComponentRecord> pending : pendingByInstance.entrySet()) {
                ComponentRecord record = pending.getValue();
                if (record.mode() != ComponentMode.BASIC || !record.type().sameTypeAs(entry.type())) continue;
                if (candidate == null || record.sequence() < candidate.getValue().sequence()) {
                    candidate = pending;
                }
            }
            if (candidate != null && pendingByInstance.remove(candidate.getKey(), candidate.getValue())) {
                promote(candidate.getKey(), candidate.getValue(), entry.componentId(), entry.parentId());
                promoted++;
            }
        }
        return promoted;
    }

    private int refreshParents(Map<Integer, HostTreeEntry> entries) {
        int refreshed = 0;
        for (ComponentRecord record : resolvedById.values()) {
            HostTreeEntry entry = entries.get(record.componentId());
            if (entry != null && !Objects.equals(record.parentId(), entry.parentId())) {
                record.updateParent(entry.parentId());
                refreshed++;
            }
        }
        return refreshed;
    }

    /** Snapshot ids that bypassed the creation hook. */
    private int synthesizeMissing(Map<Integer, HostTreeEntry> entries) {
        int synthesized = 0;
        for (HostTreeEntry entry : entries.values()) {
            if (resolvedById.containsKey(entry.componentId())) continue;
            Object instance = entry.instance();
            if (instance != null && disposedInstances.containsKey(instance)) continue;

            ComponentRecord pending = instance != null ? pendingByInstance.remove(instance) : null;
            if (pending != null) {
                promote(instance, pending, entry.componentId(), entry.parentId());
                continue;
            }
            ComponentRecord record = new ComponentRecord(instance, entry.type(), ComponentMode.BASIC,
                clock.instant(), null, true, sequence.incrementAndGet());
            record.resolve(entry.componentId(), entry.parentId());
            resolvedById.put(entry.componentId(), record);
            if (instance != null) resolvedByInstance.put(instance, record);
            synthesized++;
        }
        return synthesized;
    }

    private int removeAbsent(Map<Integer, HostTreeEntry> entries) {
        List<ComponentRecord> absent = new ArrayList<>();
        for (ComponentRecord record : resolvedById.values()) {
            if (!entries.containsKey(record.componentId())) absent.add(record);
        }
        for (ComponentRecord record : absent) {
            dropResolved(record);
        }
        return absent.size();
    }

    /** Caller holds the lock and has already removed the record from the pending map. */
    private void promote(Object instance, ComponentRecord record, int componentId, Integer parentId) {
        ComponentRecord holder = resolvedById.get(componentId);
        if (holder != null && holder != record) {
            // host reused the id for a different instance
            dropResolved(holder);
        }
        record.resolve(componentId, parentId);
        resolvedById.put(componentId, record);
        resolvedByInstance.put(instance, record);
    }

    private void dropResolved(ComponentRecord record) {
        resolvedById.remove(record.componentId(), record);
        Object instance = record.instance();
        if (instance != null) resolvedByInstance.remove(instance, record);
    }

    // -----------------------------------------------------------------------
    // Queries
    // -----------------------------------------------------------------------

    /** True when the host tree this registry mirrors no longer exists. */
    public boolean isHostDetached() {
        return introspector.isDetached();
    }

    /**
     * Hot-path lookup used by lifecycle hooks; does not reconcile. A miss is retried under the
     * lock, since a promotion moves the record between the two maps.
     */
    public Optional<ComponentRecord> findByInstance(Object instance) {
        if (instance == null) return Optional.empty();
        ComponentRecord record = lookup(instance);
        if (record == null) {
            synchronized (lock) {
                record = lookup(instance);
            }
        }
        return Optional.ofNullable(record);
    }

    private ComponentRecord lookup(Object instance) {
        ComponentRecord record = resolvedByInstance.get(instance);
        return record != null ? record : pendingByInstance.get(instance);
    }

    /** Id lookup for hot paths; does not reconcile. */
    public Optional<ComponentRecord> peekById(int componentId) {
        synchronized (lock) {
            return Optional.ofNullable(resolvedById.get(componentId));
        }
    }

    public Optional<ComponentRecord> findById(int componentId) {
        reconcile();
        synchronized (lock) {
            return Optional.ofNullable(resolvedById.get(componentId));
        }
    }

    /** Resolved records in id order followed by pending records in registration order. */
    public List<ComponentRecord> allComponents() {
        reconcile();
        synchronized (lock) {
            List<ComponentRecord> result = new ArrayList<>(resolvedById.values());
            result.addAll(pendingSnapshot());
            return result;
        }
    }

    public List<ComponentRecord> resolvedComponents() {
        reconcile();
        synchronized (lock) {
            return new ArrayList<>(resolvedById.values());
        }
    }

    public List<ComponentRecord> pendingComponents() {
        synchronized (lock) {
            return pendingSnapshot();
        }
    }

    public List<ComponentRecord> childrenOf(int componentId) {
        reconcile();
        synchronized (lock) {
            List<ComponentRecord> children = new ArrayList<>();
            for (ComponentRecord record : resolvedById.values()) {
                if (Objects.equals(record.parentId(), componentId)) children.add(record);
            }
            return children;
        }
    }

    /**
     * The record with the given id and all its descendants, breadth first.
     * Empty when the id is unknown.
     */
    public List<ComponentRecord> subtree(int rootId) {
        reconcile();
        synchronized (lock) {
            ComponentRecord root = resolvedById.get(rootId);
            if (root == null) return List.of();

            Map<Integer, List<ComponentRecord>> childrenByParent = new TreeMap<>();
            for (ComponentRecord record : resolvedById.values()) {
                if (record.parentId() != null) {
                    childrenByParent.computeIfAbsent(record.parentId(), k -> new ArrayList<>()).add(record);
                }
            }

            List<ComponentRecord> result = new ArrayList<>();
            IdentityHashMap<ComponentRecord, Boolean> visited = new IdentityHashMap<>();
            Deque<ComponentRecord> queue = new ArrayDeque<>();
            queue.add(root);
            while (!queue.isEmpty()) {
                ComponentRecord next = queue.poll();
                if (visited.put(next, Boolean.TRUE) != null) continue;
                result.add(next);
                queue.addAll(childrenByParent.getOrDefault(next.componentId(), List.of()));
            }
            return result;
        }
    }

    public ComponentCounts counts() {
        reconcile();
        synchronized (lock) {
            return ComponentCounts.of(resolvedById.size(), pendingSnapshot().size());
        }
    }

    private List<ComponentRecord> pendingSnapshot() {
        List<ComponentRecord> pending = new ArrayList<>(pendingByInstance.values());
        pending.sort(Comparator.comparingLong(ComponentRecord::sequence));
        return pending;
    }

    // -----------------------------------------------------------------------
    // Teardown
    // -----------------------------------------------------------------------

    @Override
    public void close() {
        synchronized (lock) {
            if (closed) return;
            closed = true;
            log.debug("Closing registry for session {} ({} resolved components)", sessionId, resolvedById.size());
            resolvedById.clear();
            resolvedByInstance.clear();
            pendingByInstance.clear();
            disposedInstances.clear();
        }
    }

    public boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }
}
