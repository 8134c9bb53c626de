package me.golemcore.sessions.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the session synchronization service, bound from
 * application.properties.
 *
 * <p>
 * All settings live under the {@code sessions.*} prefix:
 * <ul>
 * <li>{@link HistoryProperties} - location of the agent's persisted logs</li>
 * <li>{@link QueueProperties} - limits of the per-session outgoing queue</li>
 * <li>{@link TranscriptProperties} - transcript maintenance</li>
 * <li>{@link WebSocketProperties} - viewer endpoint</li>
 * <li>{@link ClientProperties} - reconnecting client transport</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "sessions")
@Data
public class SessionsProperties {

    private HistoryProperties history = new HistoryProperties();
    private QueueProperties queue = new QueueProperties();
    private TranscriptProperties transcript = new TranscriptProperties();
    private WebSocketProperties websocket = new WebSocketProperties();
    private ClientProperties client = new ClientProperties();

    @Data
    public static class HistoryProperties {
        private String projectsDir = System.getProperty("user.home") + "/.claude/projects";
    }

    @Data
    public static class QueueProperties {
        private int maxSize = 100;
    }

    @Data
    public static class TranscriptProperties {
        /**
         * Re-read the persisted log in the background after a process exit and
         * broadcast the result. Only applies when the log location is known.
         */
        private boolean rehydrateOnExit = true;
    }

    @Data
    public static class WebSocketProperties {
        private String path = "/ws/sessions";
    }

    @Data
    public static class ClientProperties {
        private ReconnectProperties reconnect = new ReconnectProperties();
        private OutboundProperties outbound = new OutboundProperties();
    }

    @Data
    public static class ReconnectProperties {
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double jitter = 0.25;
        private int maxAttempts = 10;
    }

    @Data
    public static class OutboundProperties {
        private int maxQueueSize = 100;
        private int flushBatchSize = 10;
        private List<String> timeSensitiveTypes = new ArrayList<>(List.of("stop", "interrupt"));
    }
}
