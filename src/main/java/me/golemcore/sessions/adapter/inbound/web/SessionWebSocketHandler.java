package me.golemcore.sessions.adapter.inbound.web;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.adapter.inbound.web.dto.SessionCommandFrame;
import me.golemcore.sessions.domain.model.AgentInterruptRequestedEvent;
import me.golemcore.sessions.domain.model.EnqueueResult;
import me.golemcore.sessions.domain.model.QueuedMessage;
import me.golemcore.sessions.domain.model.SessionErrorMessage;
import me.golemcore.sessions.domain.model.SubscribeRequest;
import me.golemcore.sessions.domain.service.SnapshotBroadcaster;
import me.golemcore.sessions.domain.service.TranscriptStore;
import me.golemcore.sessions.port.outbound.SessionStatusPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Reactive WebSocket handler for session viewers. Handles JSON frames:
 * {@code load_session}, {@code queue_message}, {@code remove_queued_message},
 * {@code stop} and {@code interrupt}. Snapshots and deltas flow back through
 * {@link WebSocketDeliveryAdapter}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionWebSocketHandler implements WebSocketHandler {

    static final String TYPE_LOAD_SESSION = "load_session";
    static final String TYPE_QUEUE_MESSAGE = "queue_message";
    static final String TYPE_REMOVE_QUEUED_MESSAGE = "remove_queued_message";
    static final String TYPE_STOP = "stop";
    static final String TYPE_INTERRUPT = "interrupt";

    private final WebSocketDeliveryAdapter deliveryAdapter;
    private final TranscriptStore transcriptStore;
    private final SnapshotBroadcaster broadcaster;
    private final SessionStatusPort statusPort;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: connectionId={}", connectionId);

        Mono<Void> outbound = session.send(deliveryAdapter.register(connectionId).map(session::textMessage));
        Mono<Void> inbound = session.receive()
                .doOnNext(wsMessage -> handleIncoming(wsMessage, connectionId))
                .doFinally(signal -> deliveryAdapter.deregister(connectionId))
                .then();

        return outbound.and(inbound)
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    deliveryAdapter.deregister(connectionId);
                    broadcaster.detach(connectionId);
                });
    }

    private void handleIncoming(WebSocketMessage wsMessage, String connectionId) {
        SessionCommandFrame frame;
        try {
            frame = objectMapper.readValue(wsMessage.getPayloadAsText(), SessionCommandFrame.class);
        } catch (IOException e) {
            log.warn("[WebSocket] Failed to parse incoming frame: {}", e.getMessage());
            sendError(connectionId, null, null, "Malformed frame");
            return;
        }

        if (frame.getSessionId() == null || frame.getSessionId().isBlank()) {
            sendError(connectionId, null, frame.getLoadRequestId(), "sessionId is required");
            return;
        }

        try {
            String type = frame.getType() != null ? frame.getType() : "";
            switch (type) {
            case TYPE_LOAD_SESSION -> loadSession(frame, connectionId);
            case TYPE_QUEUE_MESSAGE -> queueMessage(frame, connectionId);
            case TYPE_REMOVE_QUEUED_MESSAGE -> transcriptStore.removeQueuedMessage(frame.getSessionId(),
                    frame.getMessageId());
            case TYPE_STOP -> eventPublisher.publishEvent(new AgentInterruptRequestedEvent(frame.getSessionId(), true));
            case TYPE_INTERRUPT -> eventPublisher.publishEvent(
                    new AgentInterruptRequestedEvent(frame.getSessionId(), false));
            default -> {
                log.warn("[WebSocket] Unknown frame type: {}", frame.getType());
                sendError(connectionId, frame.getSessionId(), null, "Unknown frame type: " + frame.getType());
            }
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[WebSocket] Failed to process {} frame: {}", frame.getType(), e.getMessage());
            sendError(connectionId, frame.getSessionId(), frame.getLoadRequestId(), "Failed to process frame");
        }
    }

    private void loadSession(SessionCommandFrame frame, String connectionId) {
        String sessionId = frame.getSessionId();
        SubscribeRequest request = SubscribeRequest.builder()
                .sessionId(sessionId)
                .connectionId(connectionId)
                .workingDir(frame.getWorkingDir())
                .externalSessionId(frame.getExternalSessionId())
                .running(statusPort.isRunning(sessionId))
                .working(statusPort.isWorking(sessionId))
                .loadRequestId(frame.getLoadRequestId())
                .build();

        transcriptStore.subscribe(request).whenComplete((snapshot, error) -> {
            if (error != null) {
                log.warn("[WebSocket] Failed to load session {}: {}", sessionId, error.getMessage());
                sendError(connectionId, sessionId, frame.getLoadRequestId(), "Failed to load session history");
            }
        });
    }

    private void queueMessage(SessionCommandFrame frame, String connectionId) {
        if (frame.getText() == null || frame.getText().isBlank()) {
            sendError(connectionId, frame.getSessionId(), null, "text is required");
            return;
        }
        QueuedMessage message = QueuedMessage.builder()
                .id(frame.getId() != null ? frame.getId() : UUID.randomUUID().toString())
                .text(frame.getText())
                .timestamp(Instant.now(clock))
                .settings(frame.getSettings())
                .build();
        EnqueueResult result = transcriptStore.enqueue(frame.getSessionId(), message);
        if (!result.isAccepted()) {
            sendError(connectionId, frame.getSessionId(), null, result.error());
        }
    }

    private void sendError(String connectionId, String sessionId, String loadRequestId, String message) {
        deliveryAdapter.deliver(connectionId, new SessionErrorMessage(sessionId, loadRequestId, message));
    }
}
