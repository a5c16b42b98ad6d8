package com.componenttrace.core.push;

import com.google.gson.Gson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Buffers lifecycle notifications and flushes them to an {@link InspectorChannel}.
 *
 * The buffer keeps the most recent {@code maxBuffered} notifications. A flush that hits an
 * unavailable channel drops what it was sending and is not retried.
 */
public final class EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(EventPublisher.class);
    private static final Gson GSON = new Gson();

    private final InspectorChannel channel;
    private final int maxBuffered;
    private final Deque<LifecycleNotification> buffer = new ArrayDeque<>();
    private long dropped;

    public EventPublisher(InspectorChannel channel, int maxBuffered) {
        this.channel = channel;
        this.maxBuffered = Math.max(1, maxBuffered);
    }

    public void publish(LifecycleNotification notification) {
        synchronized (buffer) {
            buffer.addLast(notification);
            while (buffer.size() > maxBuffered) {
                buffer.pollFirst();
                dropped++;
            }
        }
    }

    /**
     * Sends everything buffered as one JSON array.
     *
     * @return the number of notifications delivered
     */
    public int flush() {
        if (!channel.isConnected()) return 0;
        List<LifecycleNotification> batch;
        synchronized (buffer) {
            if (buffer.isEmpty()) return 0;
            batch = new ArrayList<>(buffer);
            buffer.clear();
        }
        try {
            channel.send(GSON.toJson(batch));
            return batch.size();
        } catch (ChannelUnavailableException e) {
            synchronized (buffer) {
                dropped += batch.size();
            }
            log.debug("Inspector channel unavailable, dropped {} notifications: {}", batch.size(), e.getMessage());
            return 0;
        }
    }

    public int bufferedCount() {
        synchronized (buffer) {
            return buffer.size();
        }
    }

    /** Notifications discarded through overflow or an unavailable channel. */
    public long droppedCount() {
        synchronized (buffer) {
            return dropped;
        }
    }
}
