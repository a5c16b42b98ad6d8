package com.componenttrace.core.registry;

import com.componenttrace.core.metrics.LifecycleMetrics;
import com.componenttrace.core.model.ComponentMode;
import com.componenttrace.core.model.ComponentType;
import com.componenttrace.core.model.LifecycleState;

import java.lang.ref.WeakReference;
import java.time.Instant;

/**
 * Tracking record for one live component instance.
 *
 * The instance is held weakly; a record never keeps its component alive. State, id and
 * parent are written only by {@link ComponentRegistry} under its session lock.
 */
public final class ComponentRecord {

    /** Component id reported for records that have not been resolved yet. */
    public static final int PENDING_ID = -1;

    private final WeakReference<Object> instance;
    private final ComponentType type;
    private final ComponentMode mode;
    private final Instant createdAt;
    private final LifecycleMetrics metrics;
    private final boolean synthesized;
    private final long sequence;

    private volatile LifecycleState state;
    private volatile int componentId = PENDING_ID;
    private volatile Integer parentId;

    // Basic-mode render bookkeeping; enhanced records read these from metrics
    private volatile int basicRenderCount;
    private volatile Instant basicLastRenderedAt;

    private volatile boolean renderQueued;

    ComponentRecord(Object instance, ComponentType type, ComponentMode mode, Instant createdAt,
                    LifecycleMetrics metrics, boolean synthesized, long sequence) {
        this.instance = new WeakReference<>(instance);
        this.type = type;
        this.mode = mode;
        this.createdAt = createdAt;
        this.metrics = metrics;
        this.synthesized = synthesized;
        this.sequence = sequence;
        this.state = LifecycleState.PENDING;
    }

    /** The component, or null once it has been collected. */
    public Object instance() { return instance.get(); }

    public ComponentType type() { return type; }

    public ComponentMode mode() { return mode; }

    public Instant createdAt() { return createdAt; }

    /** Metrics of an enhanced component; null in basic mode. */
    public LifecycleMetrics metrics() { return metrics; }

    public boolean hasMetrics() { return metrics != null; }

    /** True when the record was built from the host tree because no creation hook was seen. */
    public boolean isSynthesized() { return synthesized; }

    /** Registration order within the session. */
    public long sequence() { return sequence; }

    public LifecycleState state() { return state; }

    public boolean isResolved() { return state == LifecycleState.RESOLVED; }

    /** The host-assigned id, or {@link #PENDING_ID} while pending. */
    public int componentId() { return componentId; }

    public Integer parentId() { return parentId; }

    public int renderCount() {
        return metrics != null ? metrics.renderCount() : basicRenderCount;
    }

    public Instant lastRenderedAt() {
        return metrics != null && metrics.renderCount() > 0 ? metrics.lastRenderedAt() : basicLastRenderedAt;
    }

    /** Whether an honored invalidation is still waiting for its render. */
    public boolean isRenderQueued() { return renderQueued; }

    public void setRenderQueued(boolean renderQueued) { this.renderQueued = renderQueued; }

    void resolve(int componentId, Integer parentId) {
        this.componentId = componentId;
        this.parentId = parentId;
        this.state = LifecycleState.RESOLVED;
    }

    void updateParent(Integer parentId) {
        this.parentId = parentId;
    }

    void recordBasicRender(Instant at) {
        basicRenderCount++;
        basicLastRenderedAt = at;
    }

    @Override
    public String toString() {
        return type.shortName() + (state == LifecycleState.RESOLVED ? "#" + componentId : "(pending)");
    }
}
