package com.componenttrace.core.push;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class EventPublisherTest {

    private static LifecycleNotification render(int componentId) {
        return new LifecycleNotification("s1", componentId, "Counter", "render", 1.0, "2026-01-01T00:00:00Z");
    }

    @Test
    void flushSendsOneJsonArray() {
        List<String> sent = new ArrayList<>();
        EventPublisher publisher = new EventPublisher(sent::add, 10);
        publisher.publish(render(1));
        publisher.publish(render(2));

        assertEquals(2, publisher.flush());
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).startsWith("["));
        assertTrue(sent.get(0).contains("\"component_id\":2"));
        assertEquals(0, publisher.bufferedCount());
        assertEquals(0, publisher.flush(), "nothing left to send");
    }

    @Test
    void overflowKeepsNewest() {
        List<String> sent = new ArrayList<>();
        EventPublisher publisher = new EventPublisher(sent::add, 2);
        publisher.publish(render(1));
        publisher.publish(render(2));
        publisher.publish(render(3));

        assertEquals(2, publisher.bufferedCount());
        assertEquals(1, publisher.droppedCount());
        publisher.flush();
        assertFalse(sent.get(0).contains("\"component_id\":1"));
        assertTrue(sent.get(0).contains("\"component_id\":3"));
    }

    @Test
    void unavailableChannelDropsWithoutRetry() {
        List<String> attempts = new ArrayList<>();
        EventPublisher publisher = new EventPublisher(json -> {
            attempts.add(json);
            throw new ChannelUnavailableException("inspector went away");
        }, 10);
        publisher.publish(render(1));

        assertDoesNotThrow(publisher::flush);
        assertEquals(0, publisher.bufferedCount());
        assertEquals(1, publisher.droppedCount());
        publisher.flush();
        assertEquals(1, attempts.size());
    }

    @Test
    void disconnectedChannelKeepsBuffer() {
        AtomicBoolean connected = new AtomicBoolean(false);
        List<String> sent = new ArrayList<>();
        InspectorChannel channel = new InspectorChannel() {
            @Override
            public void send(String json) {
                sent.add(json);
            }

            @Override
            public boolean isConnected() {
                return connected.get();
            }
        };
        EventPublisher publisher = new EventPublisher(channel, 10);
        publisher.publish(render(1));

        assertEquals(0, publisher.flush());
        assertEquals(1, publisher.bufferedCount());
        connected.set(true);
        assertEquals(1, publisher.flush());
        assertEquals(1, sent.size());
    }
}
