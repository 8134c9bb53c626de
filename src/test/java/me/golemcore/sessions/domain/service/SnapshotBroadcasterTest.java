package me.golemcore.sessions.domain.service;

import me.golemcore.sessions.domain.model.SessionMessage;
import me.golemcore.sessions.domain.model.SessionRuntimeUpdatedMessage;
import me.golemcore.sessions.domain.model.SessionSnapshotMessage;
import me.golemcore.sessions.port.outbound.SessionDeliveryPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class SnapshotBroadcasterTest {

    private static final String SESSION_ID = "session-1";

    private SessionDeliveryPort deliveryPort;
    private SnapshotBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        deliveryPort = mock(SessionDeliveryPort.class);
        broadcaster = new SnapshotBroadcaster(deliveryPort);
    }

    @Test
    void shouldNotForwardDeltasToUnprimedSubscribers() {
        broadcaster.attach(SESSION_ID, "conn-1");

        int delivered = broadcaster.forwardToSession(SESSION_ID, delta());

        assertEquals(0, delivered);
        verify(deliveryPort, never()).deliver(any(), any());
        assertEquals(1, broadcaster.getConnectionCount(SESSION_ID));
    }

    @Test
    void shouldPrimeSubscriberWithSubscribeSnapshot() {
        broadcaster.attach(SESSION_ID, "conn-1");
        SessionSnapshotMessage snapshot = snapshot("load-1");

        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot);
        SessionMessage delta = delta();
        broadcaster.emitDelta(SESSION_ID, delta);

        assertTrue(broadcaster.isPrimed(SESSION_ID, "conn-1"));
        verify(deliveryPort).deliver("conn-1", snapshot);
        verify(deliveryPort).deliver("conn-1", delta);
    }

    @Test
    void shouldForwardOnlyToPrimedSubscribers() {
        broadcaster.attach(SESSION_ID, "conn-1");
        broadcaster.attach(SESSION_ID, "conn-2");
        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot("load-1"));

        SessionSnapshotMessage broadcast = snapshot(null);
        int delivered = broadcaster.forwardToSession(SESSION_ID, broadcast);

        assertEquals(1, delivered);
        verify(deliveryPort).deliver("conn-1", broadcast);
        verify(deliveryPort, never()).deliver(eq("conn-2"), any());
    }

    @Test
    void shouldSkipSubscribeSnapshotForDetachedConnection() {
        broadcaster.attach(SESSION_ID, "conn-1");
        broadcaster.detach("conn-1");

        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot("load-1"));

        verify(deliveryPort, never()).deliver(any(), any());
        assertEquals(0, broadcaster.getConnectionCount(SESSION_ID));
    }

    @Test
    void shouldResetToUnprimedOnReattach() {
        broadcaster.attach(SESSION_ID, "conn-1");
        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot("load-1"));

        broadcaster.attach(SESSION_ID, "conn-1");

        assertFalse(broadcaster.isPrimed(SESSION_ID, "conn-1"));
        assertEquals(0, broadcaster.forwardToSession(SESSION_ID, delta()));
    }

    @Test
    void shouldKeepSubscriberUnprimedWhenSnapshotDeliveryFails() {
        broadcaster.attach(SESSION_ID, "conn-1");
        SessionSnapshotMessage snapshot = snapshot("load-1");
        doThrow(new IllegalStateException("closed")).when(deliveryPort).deliver("conn-1", snapshot);

        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot);

        assertFalse(broadcaster.isPrimed(SESSION_ID, "conn-1"));
    }

    @Test
    void shouldContinueFanOutWhenOneConnectionFails() {
        broadcaster.attach(SESSION_ID, "conn-1");
        broadcaster.attach(SESSION_ID, "conn-2");
        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot("load-1"));
        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-2", snapshot("load-2"));
        SessionMessage delta = delta();
        doThrow(new IllegalStateException("closed")).when(deliveryPort).deliver("conn-1", delta);

        int delivered = broadcaster.forwardToSession(SESSION_ID, delta);

        assertEquals(1, delivered);
        verify(deliveryPort).deliver("conn-2", delta);
    }

    @Test
    void shouldDetachConnectionFromAllSessions() {
        broadcaster.attach(SESSION_ID, "conn-1");
        broadcaster.attach("session-2", "conn-1");
        broadcaster.attach("session-2", "conn-2");

        broadcaster.detach("conn-1");

        assertEquals(0, broadcaster.getConnectionCount(SESSION_ID));
        assertEquals(1, broadcaster.getConnectionCount("session-2"));
    }

    @Test
    void shouldDetachEverySubscriberOfSession() {
        broadcaster.attach(SESSION_ID, "conn-1");
        broadcaster.attach(SESSION_ID, "conn-2");
        broadcaster.attach("session-2", "conn-1");
        broadcaster.deliverSubscribeSnapshot(SESSION_ID, "conn-1", snapshot("load-1"));

        int detached = broadcaster.detachSession(SESSION_ID);
        int delivered = broadcaster.forwardToSession(SESSION_ID, delta());

        assertEquals(2, detached);
        assertEquals(0, delivered);
        assertEquals(0, broadcaster.getConnectionCount(SESSION_ID));
        assertEquals(1, broadcaster.getConnectionCount("session-2"));
    }

    private static SessionSnapshotMessage snapshot(String loadRequestId) {
        return SessionSnapshotMessage.builder()
                .sessionId(SESSION_ID)
                .loadRequestId(loadRequestId)
                .messages(List.of())
                .queuedMessages(List.of())
                .build();
    }

    private static SessionMessage delta() {
        return new SessionRuntimeUpdatedMessage(SESSION_ID, null);
    }
}
