package com.componenttrace.core.metrics;

import com.github.benmanes.caffeine.cache.Ticker;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;

/**
 * Per-component timers and counters, updated synchronously from lifecycle hooks.
 *
 * Only raw counters and durations are stored. Every ratio, average and rate is computed on
 * read and reported as {@link OptionalDouble#empty()} when its denominator is zero.
 */
public final class LifecycleMetrics {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final Ticker ticker;
    private final Clock clock;
    private final long createdNanos;
    private final Instant createdAt;

    private final Map<LifecyclePhase, PhaseTiming> phases = new EnumMap<>(LifecyclePhase.class);

    private double maxRenderMs = Double.NaN;
    private double minRenderMs = Double.NaN;
    private double maxCallbackMs = Double.NaN;
    private double timeToFirstRenderMs = Double.NaN;
    private Instant lastRenderedAt;

    private int invalidationCount;
    private int invalidationsHonored;
    private int suppressedAlreadyQueued;
    private int suppressedByPolicy;

    private int renderGateTrueCount;
    private int renderGateFalseCount;
    private Boolean lastRenderGateResult;

    private long disposedNanos = -1;
    private Instant disposedAt;

    public LifecycleMetrics(Ticker ticker, Clock clock) {
        this.ticker = ticker;
        this.clock = clock;
        this.createdNanos = ticker.read();
        this.createdAt = clock.instant();
        for (LifecyclePhase phase : LifecyclePhase.values()) {
            phases.put(phase, new PhaseTiming());
        }
    }

    public static LifecycleMetrics systemTime() {
        return new LifecycleMetrics(Ticker.systemTicker(), Clock.systemUTC());
    }

    // -----------------------------------------------------------------------
    // Recording
    // -----------------------------------------------------------------------

    /**
     * Records one completed call of a phase.
     * The first RENDER freezes time-to-first-render relative to creation.
     */
    public synchronized void recordPhase(LifecyclePhase phase, double durationMs) {
        PhaseTiming timing = phases.get(phase);
        timing.last = durationMs;
        timing.total += durationMs;

        if (phase == LifecyclePhase.RENDER) {
            if (Double.isNaN(maxRenderMs) || durationMs > maxRenderMs) maxRenderMs = durationMs;
            if (Double.isNaN(minRenderMs) || durationMs < minRenderMs) minRenderMs = durationMs;
        } else if (phase == LifecyclePhase.EVENT_CALLBACK) {
            if (Double.isNaN(maxCallbackMs) || durationMs > maxCallbackMs) maxCallbackMs = durationMs;
        }
        countCall(phase, timing);
    }

    /** Records a call of a phase whose duration was not measured. */
    public synchronized void recordCall(LifecyclePhase phase) {
        countCall(phase, phases.get(phase));
    }

    private void countCall(LifecyclePhase phase, PhaseTiming timing) {
        timing.count++;
        if (phase == LifecyclePhase.RENDER) {
            if (timing.count == 1) {
                timeToFirstRenderMs = (ticker.read() - createdNanos) / NANOS_PER_MILLI;
            }
            lastRenderedAt = clock.instant();
        }
    }

    public synchronized InvalidationOutcome recordInvalidation(boolean renderAlreadyQueued, boolean renderDeclined) {
        InvalidationOutcome outcome = InvalidationOutcome.classify(renderAlreadyQueued, renderDeclined);
        invalidationCount++;
        switch (outcome) {
            case HONORED -> invalidationsHonored++;
            case SUPPRESSED_ALREADY_QUEUED -> suppressedAlreadyQueued++;
            case SUPPRESSED_BY_POLICY -> suppressedByPolicy++;
        }
        return outcome;
    }

    public synchronized void recordRenderGate(boolean result) {
        if (result) {
            renderGateTrueCount++;
        } else {
            renderGateFalseCount++;
        }
        lastRenderGateResult = result;
    }

    public synchronized void markDisposed() {
        if (disposedNanos >= 0) return;
        disposedNanos = ticker.read();
        disposedAt = clock.instant();
    }

    // -----------------------------------------------------------------------
    // Stored values
    // -----------------------------------------------------------------------

    public Instant createdAt() { return createdAt; }

    public synchronized Instant disposedAt() { return disposedAt; }

    public synchronized Instant lastRenderedAt() { return lastRenderedAt; }

    public synchronized int callCount(LifecyclePhase phase) { return phases.get(phase).count; }

    public synchronized double totalDurationMs(LifecyclePhase phase) { return phases.get(phase).total; }

    public synchronized OptionalDouble lastDurationMs(LifecyclePhase phase) {
        return optional(phases.get(phase).last);
    }

    public synchronized int renderCount() { return phases.get(LifecyclePhase.RENDER).count; }

    public synchronized OptionalDouble maxRenderMs() { return optional(maxRenderMs); }

    public synchronized OptionalDouble minRenderMs() { return optional(minRenderMs); }

    public synchronized OptionalDouble maxCallbackMs() { return optional(maxCallbackMs); }

    public synchronized OptionalDouble timeToFirstRenderMs() { return optional(timeToFirstRenderMs); }

    public synchronized int invalidationCount() { return invalidationCount; }

    public synchronized int invalidationsHonored() { return invalidationsHonored; }

    public synchronized int suppressedAlreadyQueued() { return suppressedAlreadyQueued; }

    public synchronized int suppressedByPolicy() { return suppressedByPolicy; }

    public synchronized int suppressedTotal() { return suppressedAlreadyQueued + suppressedByPolicy; }

    public synchronized int renderGateTrueCount() { return renderGateTrueCount; }

    public synchronized int renderGateFalseCount() { return renderGateFalseCount; }

    public synchronized Boolean lastRenderGateResult() { return lastRenderGateResult; }

    // -----------------------------------------------------------------------
    // Derived values
    // -----------------------------------------------------------------------

    public synchronized OptionalDouble averageDurationMs(LifecyclePhase phase) {
        PhaseTiming timing = phases.get(phase);
        return ratio(timing.total, timing.count);
    }

    /** Time from creation until disposal, or until now for a live component. */
    public synchronized OptionalDouble lifetimeMs() {
        long end = disposedNanos >= 0 ? disposedNanos : ticker.read();
        return OptionalDouble.of((end - createdNanos) / NANOS_PER_MILLI);
    }

    /** Renders per honored-or-suppressed invalidation, as a percentage. */
    public synchronized OptionalDouble invalidationEfficiencyPercent() {
        return percent(phases.get(LifecyclePhase.RENDER).count, invalidationCount);
    }

    public synchronized OptionalDouble suppressionRatioPercent() {
        return percent(suppressedAlreadyQueued + suppressedByPolicy, invalidationCount);
    }

    public synchronized OptionalDouble renderGateBlockRatePercent() {
        return percent(renderGateFalseCount, renderGateTrueCount + renderGateFalseCount);
    }

    public synchronized OptionalDouble rendersPerMinute() {
        long end = disposedNanos >= 0 ? disposedNanos : ticker.read();
        double minutes = (end - createdNanos) / (double) TimeUnit.MINUTES.toNanos(1);
        return ratio(phases.get(LifecyclePhase.RENDER).count, minutes);
    }

    public synchronized double totalLifecycleTimeMs() {
        return phases.get(LifecyclePhase.INITIALIZE).total
            + phases.get(LifecyclePhase.PARAMETERS_SET).total
            + phases.get(LifecyclePhase.RENDER).total
            + phases.get(LifecyclePhase.POST_RENDER).total;
    }

    private static OptionalDouble optional(double value) {
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    private static OptionalDouble ratio(double numerator, double denominator) {
        return denominator > 0 ? OptionalDouble.of(numerator / denominator) : OptionalDouble.empty();
    }

    private static OptionalDouble percent(double numerator, double denominator) {
        return denominator > 0 ? OptionalDouble.of(numerator / denominator * 100) : OptionalDouble.empty();
    }

    private static final class PhaseTiming {
        double last = Double.NaN;
        double total;
        int count;
    }
}
