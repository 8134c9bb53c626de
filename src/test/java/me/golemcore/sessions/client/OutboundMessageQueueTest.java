package me.golemcore.sessions.client;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundMessageQueueTest {

    @Test
    void shouldDropOldestWhenFull() {
        OutboundMessageQueue queue = new OutboundMessageQueue(2, 10, Set.of("stop"));

        queue.offer(message("queue_message", "1"));
        queue.offer(message("queue_message", "2"));
        queue.offer(message("queue_message", "3"));

        assertEquals(List.of("2", "3"), payloads(queue.takeBatch()));
    }

    @Test
    void shouldTakeBatchesInFifoOrder() {
        OutboundMessageQueue queue = new OutboundMessageQueue(10, 2, Set.of());
        for (int i = 1; i <= 5; i++) {
            queue.offer(message("queue_message", String.valueOf(i)));
        }

        assertEquals(List.of("1", "2"), payloads(queue.takeBatch()));
        assertEquals(List.of("3", "4"), payloads(queue.takeBatch()));
        assertEquals(List.of("5"), payloads(queue.takeBatch()));
        assertTrue(queue.takeBatch().isEmpty());
    }

    @Test
    void shouldDiscardTimeSensitiveFrames() {
        OutboundMessageQueue queue = new OutboundMessageQueue(10, 10, Set.of("stop", "interrupt"));
        queue.offer(message("queue_message", "1"));
        queue.offer(message("interrupt", "2"));
        queue.offer(message("remove_queued_message", "3"));
        queue.offer(message("stop", "4"));

        int discarded = queue.discardTimeSensitive();

        assertEquals(2, discarded);
        assertEquals(List.of("1", "3"), payloads(queue.takeBatch()));
    }

    @Test
    void shouldClear() {
        OutboundMessageQueue queue = new OutboundMessageQueue(10, 10, Set.of());
        queue.offer(message("queue_message", "1"));

        queue.clear();

        assertTrue(queue.isEmpty());
        assertEquals(0, queue.size());
    }

    @Test
    void shouldRejectNonPositiveLimits() {
        assertThrows(IllegalArgumentException.class, () -> new OutboundMessageQueue(0, 1, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new OutboundMessageQueue(1, 0, Set.of()));
    }

    private static OutboundMessage message(String type, String payload) {
        return new OutboundMessage(type, payload);
    }

    private static List<String> payloads(List<OutboundMessage> batch) {
        return batch.stream().map(OutboundMessage::payload).toList();
    }
}
