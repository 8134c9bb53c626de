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

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.net.URI;

/**
 * RealtimeConnector over Spring's reactive WebSocket client.
 */
@Slf4j
public class ReactorNettyRealtimeConnector implements RealtimeConnector {

    private final WebSocketClient client;

    public ReactorNettyRealtimeConnector() {
        this(new ReactorNettyWebSocketClient());
    }

    public ReactorNettyRealtimeConnector(WebSocketClient client) {
        this.client = client;
    }

    @Override
    public RealtimeConnection connect(URI uri, RealtimeListener listener) {
        WebSocketConnection connection = new WebSocketConnection();
        Disposable subscription = client.execute(uri, session -> {
            listener.onOpen(connection);
            Mono<Void> outbound = session.send(connection.outbound.asFlux().map(session::textMessage));
            Mono<Void> inbound = session.receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(listener::onMessage)
                    .doFinally(signal -> connection.completeOutbound())
                    .then();
            return outbound.and(inbound);
        }).subscribe(
                unused -> {
                },
                listener::onClose,
                () -> listener.onClose(null));
        connection.subscription = subscription;
        return connection;
    }

    private static final class WebSocketConnection implements RealtimeConnection {

        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private volatile Disposable subscription;

        @Override
        public boolean send(String payload) {
            synchronized (outbound) {
                return outbound.tryEmitNext(payload).isSuccess();
            }
        }

        @Override
        public void close() {
            completeOutbound();
            Disposable current = subscription;
            if (current != null) {
                current.dispose();
            }
        }

        private void completeOutbound() {
            synchronized (outbound) {
                outbound.tryEmitComplete();
            }
        }
    }
}
