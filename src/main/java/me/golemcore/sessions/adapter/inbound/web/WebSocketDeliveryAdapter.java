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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.SessionMessage;
import me.golemcore.sessions.port.outbound.SessionDeliveryPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * SessionDeliveryPort backed by reactive WebSocket connections. Each
 * registered connection gets its own outbound stream of JSON frames, emitted
 * in delivery order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketDeliveryAdapter implements SessionDeliveryPort {

    private final ObjectMapper objectMapper;

    private final Map<String, Sinks.Many<String>> connections = new ConcurrentHashMap<>();

    /**
     * @return the outbound frames of the connection; completes when the
     *         connection is deregistered
     */
    public Flux<String> register(String connectionId) {
        Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
        connections.put(connectionId, sink);
        return sink.asFlux();
    }

    public void deregister(String connectionId) {
        Sinks.Many<String> sink = connections.remove(connectionId);
        if (sink != null) {
            synchronized (sink) {
                sink.tryEmitComplete();
            }
        }
    }

    public boolean isRegistered(String connectionId) {
        return connections.containsKey(connectionId);
    }

    @Override
    public void deliver(String connectionId, SessionMessage message) {
        Sinks.Many<String> sink = connections.get(connectionId);
        if (sink == null) {
            log.debug("[WebSocket] No active connection: {}", connectionId);
            return;
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.warn("[WebSocket] Failed to serialize {} for {}: {}", message.type(), connectionId, e.getMessage());
            return;
        }

        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(json);
        }
        if (result.isFailure()) {
            log.warn("[WebSocket] Failed to send {} to {}: {}", message.type(), connectionId, result);
        }
    }
}
