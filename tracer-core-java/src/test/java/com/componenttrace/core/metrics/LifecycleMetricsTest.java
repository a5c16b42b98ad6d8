package com.componenttrace.core.metrics;

import com.componenttrace.core.FakeTicker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleMetricsTest {

    private FakeTicker ticker;
    private LifecycleMetrics metrics;

    @BeforeEach
    void setUp() {
        ticker = new FakeTicker();
        metrics = new LifecycleMetrics(ticker, Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC));
    }

    // --- Unavailable derived values ---

    @Test
    void averageWithZeroCallsIsUnavailable() {
        assertTrue(metrics.averageDurationMs(LifecyclePhase.RENDER).isEmpty());
        assertTrue(metrics.averageDurationMs(LifecyclePhase.INITIALIZE).isEmpty());
    }

    @Test
    void ratiosWithoutDenominatorAreUnavailable() {
        assertTrue(metrics.invalidationEfficiencyPercent().isEmpty());
        assertTrue(metrics.suppressionRatioPercent().isEmpty());
        assertTrue(metrics.renderGateBlockRatePercent().isEmpty());
        assertTrue(metrics.timeToFirstRenderMs().isEmpty());
        assertTrue(metrics.maxRenderMs().isEmpty());
        assertTrue(metrics.lastDurationMs(LifecyclePhase.RENDER).isEmpty());
    }

    @Test
    void rendersPerMinuteUnavailableWhenNoTimeElapsed() {
        assertTrue(metrics.rendersPerMinute().isEmpty());
    }

    // --- Phase timings ---

    @Test
    void recordPhaseTracksLastTotalAndCount() {
        metrics.recordPhase(LifecyclePhase.PARAMETERS_SET, 2.0);
        metrics.recordPhase(LifecyclePhase.PARAMETERS_SET, 4.0);

        assertEquals(2, metrics.callCount(LifecyclePhase.PARAMETERS_SET));
        assertEquals(6.0, metrics.totalDurationMs(LifecyclePhase.PARAMETERS_SET), 1e-9);
        assertEquals(4.0, metrics.lastDurationMs(LifecyclePhase.PARAMETERS_SET).getAsDouble(), 1e-9);
        assertEquals(3.0, metrics.averageDurationMs(LifecyclePhase.PARAMETERS_SET).getAsDouble(), 1e-9);
    }

    @Test
    void renderTracksMinMaxAndTimeToFirstRender() {
        ticker.advanceMillis(40);
        metrics.recordPhase(LifecyclePhase.RENDER, 5.0);
        ticker.advanceMillis(100);
        metrics.recordPhase(LifecyclePhase.RENDER, 1.5);
        metrics.recordPhase(LifecyclePhase.RENDER, 9.0);

        assertEquals(3, metrics.renderCount());
        assertEquals(9.0, metrics.maxRenderMs().getAsDouble(), 1e-9);
        assertEquals(1.5, metrics.minRenderMs().getAsDouble(), 1e-9);
        assertEquals(40.0, metrics.timeToFirstRenderMs().getAsDouble(), 1e-9, "frozen at the first render");
        assertNotNull(metrics.lastRenderedAt());
    }

    @Test
    void recordCallCountsWithoutDuration() {
        ticker.advanceMillis(10);
        metrics.recordCall(LifecyclePhase.RENDER);

        assertEquals(1, metrics.renderCount());
        assertEquals(0.0, metrics.totalDurationMs(LifecyclePhase.RENDER), 1e-9);
        assertTrue(metrics.maxRenderMs().isEmpty());
        assertEquals(10.0, metrics.timeToFirstRenderMs().getAsDouble(), 1e-9);
    }

    @Test
    void callbackTracksMax() {
        metrics.recordPhase(LifecyclePhase.EVENT_CALLBACK, 3.0);
        metrics.recordPhase(LifecyclePhase.EVENT_CALLBACK, 7.0);
        metrics.recordPhase(LifecyclePhase.EVENT_CALLBACK, 2.0);
        assertEquals(7.0, metrics.maxCallbackMs().getAsDouble(), 1e-9);
    }

    @Test
    void totalLifecycleTimeSumsSynchronousPhases() {
        metrics.recordPhase(LifecyclePhase.INITIALIZE, 1.0);
        metrics.recordPhase(LifecyclePhase.PARAMETERS_SET, 2.0);
        metrics.recordPhase(LifecyclePhase.RENDER, 3.0);
        metrics.recordPhase(LifecyclePhase.POST_RENDER, 4.0);
        metrics.recordPhase(LifecyclePhase.EVENT_CALLBACK, 100.0);
        assertEquals(10.0, metrics.totalLifecycleTimeMs(), 1e-9);
    }

    // --- Invalidation ---

    @Test
    void alreadyQueuedWinsOverDeclined() {
        assertEquals(InvalidationOutcome.SUPPRESSED_ALREADY_QUEUED, InvalidationOutcome.classify(true, true));
        assertEquals(InvalidationOutcome.SUPPRESSED_BY_POLICY, InvalidationOutcome.classify(false, true));
        assertEquals(InvalidationOutcome.HONORED, InvalidationOutcome.classify(false, false));
    }

    @Test
    void invalidationCountersAndRatios() {
        metrics.recordInvalidation(false, false);
        metrics.recordInvalidation(true, false);
        metrics.recordInvalidation(false, true);
        metrics.recordInvalidation(false, false);
        metrics.recordPhase(LifecyclePhase.RENDER, 1.0);
        metrics.recordPhase(LifecyclePhase.RENDER, 1.0);

        assertEquals(4, metrics.invalidationCount());
        assertEquals(2, metrics.invalidationsHonored());
        assertEquals(1, metrics.suppressedAlreadyQueued());
        assertEquals(1, metrics.suppressedByPolicy());
        assertEquals(2, metrics.suppressedTotal());
        assertEquals(50.0, metrics.invalidationEfficiencyPercent().getAsDouble(), 1e-9);
        assertEquals(50.0, metrics.suppressionRatioPercent().getAsDouble(), 1e-9);
    }

    @Test
    void renderGateBlockRate() {
        metrics.recordRenderGate(true);
        metrics.recordRenderGate(false);
        metrics.recordRenderGate(true);
        metrics.recordRenderGate(false);

        assertEquals(2, metrics.renderGateTrueCount());
        assertEquals(2, metrics.renderGateFalseCount());
        assertEquals(Boolean.FALSE, metrics.lastRenderGateResult());
        assertEquals(50.0, metrics.renderGateBlockRatePercent().getAsDouble(), 1e-9);
    }

    // --- Lifetime ---

    @Test
    void lifetimeStopsAtFirstDisposal() {
        ticker.advanceMillis(30);
        metrics.markDisposed();
        ticker.advanceMillis(500);
        metrics.markDisposed();

        assertEquals(30.0, metrics.lifetimeMs().getAsDouble(), 1e-9);
        assertNotNull(metrics.disposedAt());
    }

    @Test
    void rendersPerMinuteUsesLifetime() {
        metrics.recordPhase(LifecyclePhase.RENDER, 1.0);
        metrics.recordPhase(LifecyclePhase.RENDER, 1.0);
        ticker.advanceMillis(30_000);
        assertEquals(4.0, metrics.rendersPerMinute().getAsDouble(), 1e-9);
    }
}
