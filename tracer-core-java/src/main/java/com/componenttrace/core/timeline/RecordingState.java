package com.componenttrace.core.timeline;

import java.time.Instant;

/**
 * Recording status reported to the inspector.
 *
 * @param startedAt null when recording has never started
 * @param elapsedMs time since the recording origin; frozen once recording stops
 */
public record RecordingState(
    boolean recording,
    Instant startedAt,
    double elapsedMs,
    int eventCount,
    int batchCount,
    int maxEvents
) {}
