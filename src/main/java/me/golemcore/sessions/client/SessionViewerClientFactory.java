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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

/**
 * Builds viewer clients configured from {@code sessions.client.*}.
 */
@Component
@RequiredArgsConstructor
public class SessionViewerClientFactory {

    private final SessionsProperties properties;
    private final ObjectMapper objectMapper;

    public SessionViewerClient newClient(SessionViewListener listener) {
        return newClient(new ReactorNettyRealtimeConnector(), listener);
    }

    public SessionViewerClient newClient(RealtimeConnector connector, SessionViewListener listener) {
        SessionsProperties.ClientProperties client = properties.getClient();
        return new SessionViewerClient(connector,
                ReconnectPolicy.from(client.getReconnect()),
                OutboundMessageQueue.from(client.getOutbound()),
                Schedulers.parallel(),
                new HydrationRequestGuard(),
                objectMapper,
                listener);
    }
}
