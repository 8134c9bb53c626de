package me.golemcore.sessions.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionViewerClientTest {

    private static final URI ENDPOINT = URI.create("ws://localhost:8080/ws/sessions");
    private static final SessionTarget TARGET = new SessionTarget("session-1", "/work/project", "ext-1");

    private final ObjectMapper objectMapper = new ObjectMapper();

    private FakeRealtimeConnector connector;
    private VirtualTimeScheduler scheduler;
    private RecordingViewListener viewListener;
    private SessionViewerClient client;

    @BeforeEach
    void setUp() {
        connector = new FakeRealtimeConnector();
        scheduler = VirtualTimeScheduler.create();
        viewListener = new RecordingViewListener();
        AtomicInteger sequence = new AtomicInteger();
        client = new SessionViewerClient(connector,
                new ReconnectPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 0, 10, () -> 0.0),
                new OutboundMessageQueue(100, 10, Set.of("stop", "interrupt")),
                scheduler,
                new HydrationRequestGuard(() -> "load-" + sequence.incrementAndGet()),
                objectMapper,
                viewListener);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void shouldLoadSessionOnOpen() throws Exception {
        client.open(ENDPOINT, TARGET);
        connector.last().open();

        JsonNode load = objectMapper.readTree(connector.last().sent().get(0));
        assertEquals("load_session", load.get("type").asText());
        assertEquals("session-1", load.get("sessionId").asText());
        assertEquals("/work/project", load.get("workingDir").asText());
        assertEquals("ext-1", load.get("externalSessionId").asText());
        assertEquals("load-1", load.get("loadRequestId").asText());
        assertTrue(client.isAwaitingHydration());
        assertEquals(List.of(TransportState.CONNECTING, TransportState.OPEN), viewListener.states);
    }

    @Test
    void shouldResolveHydrationWithMatchingSnapshot() {
        client.open(ENDPOINT, TARGET);
        connector.last().open();

        connector.last().receive("{\"type\":\"session_snapshot\",\"sessionId\":\"session-1\","
                + "\"loadRequestId\":\"load-1\",\"messages\":[]}");

        assertEquals(1, viewListener.messages.size());
        assertEquals(1, viewListener.hydrated.size());
        assertFalse(client.isAwaitingHydration());
    }

    @Test
    void shouldDropSnapshotOfSupersededLoadAfterReconnect() {
        client.open(ENDPOINT, TARGET);
        connector.last().open();
        connector.last().drop(null);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        connector.last().open();

        connector.last().receive("{\"type\":\"session_snapshot\",\"loadRequestId\":\"load-1\"}");
        assertTrue(viewListener.messages.isEmpty());

        connector.last().receive("{\"type\":\"session_snapshot\",\"loadRequestId\":\"load-2\"}");
        assertEquals(1, viewListener.hydrated.size());
        assertEquals("load-2", viewListener.hydrated.get(0).get("loadRequestId").asText());
    }

    @Test
    void shouldDeliverUncorrelatedMessagesWhileAwaiting() {
        client.open(ENDPOINT, TARGET);
        connector.last().open();

        connector.last().receive("{\"type\":\"session_snapshot\",\"sessionId\":\"session-1\"}");
        connector.last().receive("{\"type\":\"session_runtime_updated\",\"sessionId\":\"session-1\"}");

        assertEquals(2, viewListener.messages.size());
        assertTrue(viewListener.hydrated.isEmpty());
        assertTrue(client.isAwaitingHydration());
    }

    @Test
    void shouldIgnoreUnparseableFrames() {
        client.open(ENDPOINT, TARGET);
        connector.last().open();

        connector.last().receive("<html>");
        connector.last().receive("[1,2,3]");

        assertTrue(viewListener.messages.isEmpty());
    }

    @Test
    void shouldQueueCommandsUntilOpenAndDropStaleStop() throws Exception {
        client.open(ENDPOINT, TARGET);
        assertFalse(client.queueMessage("run the tests", Map.of("model", "opus")));
        client.stop();

        connector.last().open();
        scheduler.advanceTime();

        List<String> sent = connector.last().sent();
        assertEquals(2, sent.size());
        JsonNode queued = objectMapper.readTree(sent.get(0));
        assertEquals("queue_message", queued.get("type").asText());
        assertEquals("run the tests", queued.get("text").asText());
        assertEquals("opus", queued.get("settings").get("model").asText());
        assertEquals("load_session", objectMapper.readTree(sent.get(1)).get("type").asText());
    }

    @Test
    void shouldSendControlFramesWhenOpen() throws Exception {
        client.open(ENDPOINT, TARGET);
        connector.last().open();

        assertTrue(client.interrupt());
        assertTrue(client.removeQueuedMessage("m-1"));

        List<String> sent = connector.last().sent();
        assertEquals("interrupt", objectMapper.readTree(sent.get(1)).get("type").asText());
        JsonNode remove = objectMapper.readTree(sent.get(2));
        assertEquals("remove_queued_message", remove.get("type").asText());
        assertEquals("m-1", remove.get("messageId").asText());
        assertEquals("session-1", remove.get("sessionId").asText());
    }

    @Test
    void shouldForgetOutstandingLoadOnClose() {
        client.open(ENDPOINT, TARGET);
        connector.last().open();

        client.close();

        assertFalse(client.isAwaitingHydration());
        assertEquals(TransportState.DISCONNECTED, client.getState());
        assertTrue(connector.last().isClosed());
    }

    private static final class RecordingViewListener implements SessionViewListener {

        private final List<JsonNode> messages = new ArrayList<>();
        private final List<JsonNode> hydrated = new ArrayList<>();
        private final List<TransportState> states = new ArrayList<>();

        @Override
        public void onMessage(JsonNode message) {
            messages.add(message);
        }

        @Override
        public void onHydrated(JsonNode snapshot) {
            hydrated.add(snapshot);
        }

        @Override
        public void onStateChanged(TransportState state) {
            states.add(state);
        }
    }
}
