package me.golemcore.sessions.client;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.util.Map;
import java.util.UUID;

/**
 * Client side of a session view: keeps the connection to the sessions
 * endpoint alive, loads the session on every open and filters stale
 * hydration responses.
 */
@Slf4j
public class SessionViewerClient implements TransportListener {

    static final String TYPE_LOAD_SESSION = "load_session";
    static final String TYPE_QUEUE_MESSAGE = "queue_message";
    static final String TYPE_REMOVE_QUEUED_MESSAGE = "remove_queued_message";
    static final String TYPE_STOP = "stop";
    static final String TYPE_INTERRUPT = "interrupt";

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_SESSION_ID = "sessionId";
    private static final String FIELD_LOAD_REQUEST_ID = "loadRequestId";

    private final ReconnectingTransport transport;
    private final HydrationRequestGuard guard;
    private final ObjectMapper objectMapper;
    private final SessionViewListener viewListener;

    private volatile SessionTarget target;

    public SessionViewerClient(RealtimeConnector connector, ReconnectPolicy policy, OutboundMessageQueue queue,
            Scheduler scheduler, HydrationRequestGuard guard, ObjectMapper objectMapper,
            SessionViewListener viewListener) {
        this.guard = guard;
        this.objectMapper = objectMapper;
        this.viewListener = viewListener;
        this.transport = new ReconnectingTransport(connector, policy, queue, scheduler, this);
    }

    public void open(URI endpoint, SessionTarget sessionTarget) {
        this.target = sessionTarget;
        transport.connect(endpoint);
    }

    public void close() {
        guard.reset();
        transport.disconnect();
        target = null;
    }

    public void reconnect() {
        transport.reconnect();
    }

    public boolean queueMessage(String text, Map<String, Object> settings) {
        ObjectNode frame = frame(TYPE_QUEUE_MESSAGE);
        frame.put("id", UUID.randomUUID().toString());
        frame.put("text", text);
        if (settings != null) {
            frame.set("settings", objectMapper.valueToTree(settings));
        }
        return send(frame);
    }

    public boolean removeQueuedMessage(String messageId) {
        ObjectNode frame = frame(TYPE_REMOVE_QUEUED_MESSAGE);
        frame.put("messageId", messageId);
        return send(frame);
    }

    public boolean stop() {
        return send(frame(TYPE_STOP));
    }

    public boolean interrupt() {
        return send(frame(TYPE_INTERRUPT));
    }

    public TransportState getState() {
        return transport.getState();
    }

    public boolean isAwaitingHydration() {
        return guard.isAwaiting();
    }

    @Override
    public void onStateChanged(TransportState state) {
        if (state == TransportState.OPEN) {
            requestLoad();
        }
        viewListener.onStateChanged(state);
    }

    @Override
    public void onMessage(String payload) {
        JsonNode message;
        try {
            message = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("[Transport] ignoring unparseable frame: {}", e.getMessage());
            return;
        }
        if (message == null || !message.isObject()) {
            return;
        }

        String type = message.path(FIELD_TYPE).asText(null);
        String loadRequestId = message.path(FIELD_LOAD_REQUEST_ID).asText(null);
        HydrationRequestGuard.Decision decision = guard.evaluate(type, loadRequestId);
        if (decision == HydrationRequestGuard.Decision.DROP) {
            log.debug("[Transport] dropped stale {}: loadRequestId={}", type, loadRequestId);
            return;
        }
        viewListener.onMessage(message);
        if (decision == HydrationRequestGuard.Decision.RESOLVED) {
            viewListener.onHydrated(message);
        }
    }

    private void requestLoad() {
        SessionTarget current = target;
        if (current == null) {
            return;
        }
        ObjectNode frame = frame(TYPE_LOAD_SESSION);
        if (current.workingDir() != null) {
            frame.put("workingDir", current.workingDir());
        }
        if (current.externalSessionId() != null) {
            frame.put("externalSessionId", current.externalSessionId());
        }
        frame.put(FIELD_LOAD_REQUEST_ID, guard.begin());
        send(frame);
    }

    private ObjectNode frame(String type) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put(FIELD_TYPE, type);
        SessionTarget current = target;
        if (current != null) {
            frame.put(FIELD_SESSION_ID, current.sessionId());
        }
        return frame;
    }

    private boolean send(ObjectNode frame) {
        try {
            String payload = objectMapper.writeValueAsString(frame);
            return transport.send(new OutboundMessage(frame.path(FIELD_TYPE).asText(), payload));
        } catch (JsonProcessingException e) {
            log.warn("[Transport] Failed to serialize {} frame: {}", frame.path(FIELD_TYPE).asText(), e.getMessage());
            return false;
        }
    }
}
