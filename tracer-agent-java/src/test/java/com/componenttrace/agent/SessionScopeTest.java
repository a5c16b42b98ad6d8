package com.componenttrace.agent;

import com.componenttrace.core.config.TracerConfig;
import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.session.TracerSessions;
import com.componenttrace.core.timeline.RingBufferTimelineRecorder;
import com.componenttrace.core.timeline.TimelineRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionScopeTest {

    private TracerSession a;
    private TracerSession b;

    @BeforeEach
    void setUp() {
        SessionScope.reset();
        TracerSessions sessions = new TracerSessions(new RingBufferTimelineRecorder(), TracerConfig.defaults());
        a = sessions.open("a", null);
        b = sessions.open("b", null);
    }

    @Test
    void emptyStackHasNoCurrentFrame() {
        assertNull(SessionScope.current());
        assertNull(SessionScope.exit());
    }

    @Test
    void nestedFramesUnwindInOrder() {
        SessionScope.enter(a);
        SessionScope.enter(b);
        assertSame(b, SessionScope.current().session());

        assertSame(b, SessionScope.exit().session());
        assertSame(a, SessionScope.current().session());
        assertSame(a, SessionScope.exit().session());
        assertNull(SessionScope.current());
    }

    @Test
    void frameWithoutSessionStillBalances() {
        SessionScope.enter(a);
        SessionScope.enter(null);
        assertNull(SessionScope.current().session());
        SessionScope.exit();
        assertSame(a, SessionScope.current().session());
    }

    @Test
    void currentBatchFindsOuterBatchOfSameSession() {
        SessionScope.Frame batch = SessionScope.enter(a);
        batch.batchId(7);
        SessionScope.enter(a);
        SessionScope.enter(b);

        assertSame(batch, SessionScope.currentBatch(a));
        assertNull(SessionScope.currentBatch(b));
    }

    @Test
    void frameWithoutBatchIsNotABatch() {
        SessionScope.Frame frame = SessionScope.enter(a);
        assertEquals(TimelineRecorder.NOT_RECORDING, frame.batchId());
        assertNull(SessionScope.currentBatch(a));
    }

    @Test
    void renderedIdsAreDeduplicatedInFirstSeenOrder() {
        SessionScope.Frame frame = SessionScope.enter(a);
        frame.addRendered(3);
        frame.addRendered(1);
        frame.addRendered(3);
        assertEquals(List.of(3, 1), frame.rendered());
    }

    @Test
    void stacksAreThreadLocal() throws Exception {
        SessionScope.enter(a);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<SessionScope.Frame> other = executor.submit(SessionScope::current);
            assertNull(other.get(5, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
        assertSame(a, SessionScope.current().session());
    }
}
