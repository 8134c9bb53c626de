package me.golemcore.sessions.client;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReconnectingTransportTest {

    private static final URI ENDPOINT = URI.create("ws://localhost:8080/ws/sessions");
    private static final URI OTHER_ENDPOINT = URI.create("ws://localhost:9090/ws/sessions");

    private FakeRealtimeConnector connector;
    private VirtualTimeScheduler scheduler;
    private List<TransportState> states;
    private List<String> received;
    private ReconnectingTransport transport;

    @BeforeEach
    void setUp() {
        connector = new FakeRealtimeConnector();
        scheduler = VirtualTimeScheduler.create();
        states = new ArrayList<>();
        received = new ArrayList<>();
        ReconnectPolicy policy = new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 0.25, 3,
                () -> 0.0);
        OutboundMessageQueue queue = new OutboundMessageQueue(100, 2, Set.of("stop", "interrupt"));
        transport = new ReconnectingTransport(connector, policy, queue, scheduler, new TransportListener() {
            @Override
            public void onStateChanged(TransportState state) {
                states.add(state);
            }

            @Override
            public void onMessage(String payload) {
                received.add(payload);
            }
        });
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void shouldOpenAndSendDirectly() {
        transport.connect(ENDPOINT);
        connector.last().open();

        boolean sentNow = transport.send(new OutboundMessage("queue_message", "q1"));

        assertTrue(sentNow);
        assertEquals(List.of("q1"), connector.last().sent());
        assertEquals(List.of(TransportState.CONNECTING, TransportState.OPEN), states);
        assertEquals(ENDPOINT, connector.last().uri());
    }

    @Test
    void shouldPassIncomingMessagesToListener() {
        transport.connect(ENDPOINT);
        connector.last().open();

        connector.last().receive("{\"type\":\"session_snapshot\"}");

        assertEquals(List.of("{\"type\":\"session_snapshot\"}"), received);
    }

    @Test
    void shouldQueueWhileConnectingAndFlushOnOpenWithoutTimeSensitiveFrames() {
        transport.connect(ENDPOINT);
        assertFalse(transport.send(new OutboundMessage("queue_message", "q1")));
        transport.send(new OutboundMessage("stop", "s1"));
        transport.send(new OutboundMessage("queue_message", "q2"));
        assertEquals(3, transport.getQueuedCount());

        connector.last().open();
        scheduler.advanceTime();

        assertEquals(List.of("q1", "q2"), connector.last().sent());
        assertEquals(0, transport.getQueuedCount());
    }

    @Test
    void shouldFlushRemainderInFollowUpBatches() {
        transport.connect(ENDPOINT);
        for (int i = 1; i <= 5; i++) {
            transport.send(new OutboundMessage("queue_message", "q" + i));
        }

        connector.last().open();
        scheduler.advanceTime();
        transport.send(new OutboundMessage("queue_message", "q6"));

        assertEquals(List.of("q1", "q2", "q3", "q4", "q5", "q6"), connector.last().sent());
    }

    @Test
    void shouldReconnectWithExponentialBackoff() {
        transport.connect(ENDPOINT);
        connector.last().open();

        connector.last().drop(new IOException("reset"));
        assertEquals(TransportState.RECONNECTING, transport.getState());
        assertEquals(1, transport.getReconnectAttempts());

        scheduler.advanceTimeBy(Duration.ofMillis(999));
        assertEquals(1, connector.connections().size());
        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(2, connector.connections().size());
        assertEquals(TransportState.CONNECTING, transport.getState());

        connector.last().drop(null);
        scheduler.advanceTimeBy(Duration.ofMillis(1999));
        assertEquals(2, connector.connections().size());
        scheduler.advanceTimeBy(Duration.ofMillis(1));
        assertEquals(3, connector.connections().size());

        connector.last().open();
        assertEquals(TransportState.OPEN, transport.getState());
        assertEquals(0, transport.getReconnectAttempts());
    }

    @Test
    void shouldFailAfterMaxAttemptsAndRecoverOnManualReconnect() {
        transport.connect(ENDPOINT);
        connector.last().drop(null);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        connector.last().drop(null);
        scheduler.advanceTimeBy(Duration.ofSeconds(2));
        connector.last().drop(null);
        scheduler.advanceTimeBy(Duration.ofSeconds(4));
        transport.send(new OutboundMessage("queue_message", "q1"));
        connector.last().drop(null);

        assertEquals(TransportState.FAILED, transport.getState());
        assertEquals(4, connector.connections().size());
        scheduler.advanceTimeBy(Duration.ofMinutes(5));
        assertEquals(4, connector.connections().size());

        transport.reconnect();

        assertEquals(TransportState.CONNECTING, transport.getState());
        assertEquals(0, transport.getReconnectAttempts());
        assertEquals(0, transport.getQueuedCount());
        assertEquals(5, connector.connections().size());
    }

    @Test
    void shouldIgnoreLateCloseOfSupersededConnection() {
        transport.connect(ENDPOINT);
        FakeRealtimeConnector.FakeConnection first = connector.last();
        first.open();

        transport.connect(OTHER_ENDPOINT);
        assertTrue(first.isClosed());
        first.drop(null);

        assertEquals(TransportState.CONNECTING, transport.getState());
        scheduler.advanceTimeBy(Duration.ofMinutes(1));
        assertEquals(2, connector.connections().size());
        assertEquals(OTHER_ENDPOINT, connector.last().uri());
    }

    @Test
    void shouldCloseConnectionThatOpensAfterBeingSuperseded() {
        transport.connect(ENDPOINT);
        FakeRealtimeConnector.FakeConnection stale = connector.last();
        transport.connect(OTHER_ENDPOINT);

        stale.open();

        assertTrue(stale.isClosed());
        assertEquals(TransportState.CONNECTING, transport.getState());
    }

    @Test
    void shouldNotReconnectAfterIntentionalDisconnect() {
        transport.connect(ENDPOINT);
        connector.last().open();
        transport.send(new OutboundMessage("queue_message", "q1"));

        transport.disconnect();
        transport.send(new OutboundMessage("queue_message", "q2"));
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertEquals(TransportState.DISCONNECTED, transport.getState());
        assertTrue(connector.last().isClosed());
        assertEquals(1, connector.connections().size());
        assertEquals(List.of("q1"), connector.last().sent());
    }

    @Test
    void shouldTreatNullTargetAsDisconnect() {
        transport.connect(ENDPOINT);
        connector.last().open();

        transport.connect(null);

        assertEquals(TransportState.DISCONNECTED, transport.getState());
        assertTrue(connector.last().isClosed());
    }

    @Test
    void shouldIgnoreRepeatedConnectToSameTarget() {
        transport.connect(ENDPOINT);
        transport.connect(ENDPOINT);

        assertEquals(1, connector.connections().size());
    }
}
