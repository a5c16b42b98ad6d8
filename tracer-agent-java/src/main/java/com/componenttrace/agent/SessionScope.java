package com.componenttrace.agent;

import com.componenttrace.core.session.TracerSession;
import com.componenttrace.core.timeline.TimelineRecorder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Per-thread stack of the renderer sessions currently executing.
 *
 * A frame is pushed when a renderer method is entered and popped on exit, so nested renderer
 * calls unwind correctly. Batch frames also collect the ids of components rendered inside them.
 */
public final class SessionScope {

    private SessionScope() {}

    static final ThreadLocal<Deque<Frame>> stack = ThreadLocal.withInitial(ArrayDeque::new);

    public static Frame enter(TracerSession session) {
        Frame frame = new Frame(session);
        stack.get().push(frame);
        return frame;
    }

    public static Frame exit() {
        Deque<Frame> s = stack.get();
        return s.isEmpty() ? null : s.pop();
    }

    /** Innermost frame on this thread, or null outside any renderer call. */
    public static Frame current() {
        return stack.get().peek();
    }

    /** Innermost frame of the given session that is running a batch, or null. */
    public static Frame currentBatch(TracerSession session) {
        for (Frame frame : stack.get()) {
            if (frame.session == session && frame.batchId != TimelineRecorder.NOT_RECORDING) return frame;
        }
        return null;
    }

    public static void reset() {
        stack.get().clear();
    }

    public static final class Frame {
        private final TracerSession session;
        private long batchId = TimelineRecorder.NOT_RECORDING;
        private final List<Integer> rendered = new ArrayList<>();

        Frame(TracerSession session) {
            this.session = session;
        }

        public TracerSession session() { return session; }

        public long batchId() { return batchId; }

        void batchId(long batchId) { this.batchId = batchId; }

        /** Component ids rendered in this batch, in first-render order. */
        public List<Integer> rendered() { return rendered; }

        void addRendered(int componentId) {
            if (!rendered.contains(componentId)) rendered.add(componentId);
        }
    }
}
