package me.golemcore.sessions.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.SessionMessage;
import me.golemcore.sessions.domain.model.SessionSnapshotMessage;
import me.golemcore.sessions.port.outbound.SessionDeliveryPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fans session messages out to the connections subscribed to a session.
 *
 * <p>
 * A connection becomes a subscriber when it is attached and stays
 * <em>unprimed</em> until it has received the snapshot answering its
 * subscription. Broadcast snapshots and deltas only reach primed subscribers,
 * so the first message a connection sees for a session is always a snapshot.
 * </p>
 *
 * <p>
 * Delivery is best effort: a failing connection is logged and skipped, never
 * retried.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SnapshotBroadcaster {

    private final SessionDeliveryPort deliveryPort;

    /** sessionId -> connectionId -> primed. */
    private final Map<String, Map<String, Boolean>> subscribers = new ConcurrentHashMap<>();

    /**
     * Registers {@code connectionId} as an unprimed subscriber of the session.
     * Re-attaching an existing subscriber resets it to unprimed.
     */
    public void attach(String sessionId, String connectionId) {
        subscribers.computeIfAbsent(sessionId, key -> new ConcurrentHashMap<>()).put(connectionId, Boolean.FALSE);
        log.debug("[Broadcast] attached: sessionId={}, connectionId={}", sessionId, connectionId);
    }

    public void detach(String sessionId, String connectionId) {
        subscribers.computeIfPresent(sessionId, (key, connections) -> {
            connections.remove(connectionId);
            return connections.isEmpty() ? null : connections;
        });
    }

    /**
     * Removes the connection from every session it subscribed to.
     */
    public void detach(String connectionId) {
        for (String sessionId : List.copyOf(subscribers.keySet())) {
            detach(sessionId, connectionId);
        }
        log.debug("[Broadcast] detached: connectionId={}", connectionId);
    }

    /**
     * Removes every subscriber of the session.
     *
     * @return number of connections detached
     */
    public int detachSession(String sessionId) {
        Map<String, Boolean> connections = subscribers.remove(sessionId);
        return connections != null ? connections.size() : 0;
    }

    public void detachAll() {
        subscribers.clear();
    }

    /**
     * Delivers the snapshot answering a subscription and primes the subscriber.
     */
    public void deliverSubscribeSnapshot(String sessionId, String connectionId, SessionSnapshotMessage snapshot) {
        Map<String, Boolean> connections = subscribers.get(sessionId);
        if (connections == null || !connections.containsKey(connectionId)) {
            log.debug("[Broadcast] subscriber gone before snapshot: sessionId={}, connectionId={}",
                    sessionId, connectionId);
            return;
        }
        if (deliver(connectionId, snapshot)) {
            connections.replace(connectionId, Boolean.TRUE);
        }
    }

    public void forwardSnapshot(String sessionId, SessionSnapshotMessage snapshot) {
        forwardToSession(sessionId, snapshot);
    }

    public void emitDelta(String sessionId, SessionMessage delta) {
        forwardToSession(sessionId, delta);
    }

    /**
     * Pushes a message to every primed subscriber of the session.
     *
     * @return number of connections the message was handed to
     */
    public int forwardToSession(String sessionId, SessionMessage message) {
        int delivered = 0;
        for (String connectionId : primedConnections(sessionId)) {
            if (deliver(connectionId, message)) {
                delivered++;
            }
        }
        if (delivered > 0) {
            log.debug("[Broadcast] {} forwarded: sessionId={}, connections={}", message.type(), sessionId, delivered);
        }
        return delivered;
    }

    public int getConnectionCount(String sessionId) {
        Map<String, Boolean> connections = subscribers.get(sessionId);
        return connections != null ? connections.size() : 0;
    }

    public boolean isPrimed(String sessionId, String connectionId) {
        Map<String, Boolean> connections = subscribers.get(sessionId);
        return connections != null && Boolean.TRUE.equals(connections.get(connectionId));
    }

    private List<String> primedConnections(String sessionId) {
        Map<String, Boolean> connections = subscribers.get(sessionId);
        if (connections == null) {
            return List.of();
        }
        List<String> primed = new ArrayList<>();
        connections.forEach((connectionId, isPrimed) -> {
            if (Boolean.TRUE.equals(isPrimed)) {
                primed.add(connectionId);
            }
        });
        return primed;
    }

    private boolean deliver(String connectionId, SessionMessage message) {
        try {
            deliveryPort.deliver(connectionId, message);
            return true;
        } catch (RuntimeException e) { // NOSONAR - delivery is best effort
            log.warn("[Broadcast] Failed to deliver {} to {}: {}", message.type(), connectionId, e.getMessage());
            return false;
        }
    }
}
