package me.golemcore.sessions.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HydrationRequestGuardTest {

    private HydrationRequestGuard guard;

    @BeforeEach
    void setUp() {
        AtomicInteger sequence = new AtomicInteger();
        guard = new HydrationRequestGuard(() -> "load-" + sequence.incrementAndGet());
    }

    @Test
    void shouldDeliverEverythingWhenNothingOutstanding() {
        assertEquals(HydrationRequestGuard.Decision.DELIVER, guard.evaluate("session_snapshot", "load-9"));
        assertEquals(HydrationRequestGuard.Decision.DELIVER, guard.evaluate("session_snapshot", null));
    }

    @Test
    void shouldResolveOnMatchingSnapshot() {
        String id = guard.begin();

        assertTrue(guard.isAwaiting());
        assertEquals(HydrationRequestGuard.Decision.RESOLVED, guard.evaluate("session_snapshot", id));
        assertFalse(guard.isAwaiting());
        assertNull(guard.getPendingId());
    }

    @Test
    void shouldDropResponsesOfSupersededRequests() {
        String first = guard.begin();
        String second = guard.begin();

        assertEquals(HydrationRequestGuard.Decision.DROP, guard.evaluate("session_snapshot", first));
        assertEquals(HydrationRequestGuard.Decision.DROP, guard.evaluate("session_replay_batch", first));
        assertTrue(guard.isAwaiting());
        assertEquals(HydrationRequestGuard.Decision.RESOLVED, guard.evaluate("session_replay_batch", second));
    }

    @Test
    void shouldDeliverUncorrelatedTrafficWithoutResolving() {
        guard.begin();

        assertEquals(HydrationRequestGuard.Decision.DELIVER, guard.evaluate("session_snapshot", null));
        assertEquals(HydrationRequestGuard.Decision.DELIVER, guard.evaluate("session_runtime_updated", "load-0"));
        assertEquals(HydrationRequestGuard.Decision.DELIVER, guard.evaluate(null, null));
        assertTrue(guard.isAwaiting());
    }

    @Test
    void shouldForgetOutstandingRequestOnReset() {
        String id = guard.begin();

        guard.reset();

        assertFalse(guard.isAwaiting());
        assertEquals(HydrationRequestGuard.Decision.DELIVER, guard.evaluate("session_snapshot", id));
    }
}
