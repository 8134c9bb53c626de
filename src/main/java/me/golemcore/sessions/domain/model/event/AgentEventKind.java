package me.golemcore.sessions.domain.model.event;

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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of event kinds emitted by the agent CLI on its output stream.
 */
public enum AgentEventKind {

    USER("user"),
    ASSISTANT("assistant"),
    STREAM_EVENT("stream_event"),
    RESULT("result"),
    SYSTEM("system"),

    /**
     * Control channel traffic (handshake, permission negotiation). Never part of
     * the transcript.
     */
    CONTROL_REQUEST("control_request"),
    CONTROL_RESPONSE("control_response"),
    CONTROL_CANCEL_REQUEST("control_cancel_request"),
    KEEP_ALIVE("keep_alive");

    private final String wireName;

    AgentEventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isControlChannel() {
        return this == CONTROL_REQUEST || this == CONTROL_RESPONSE || this == CONTROL_CANCEL_REQUEST
                || this == KEEP_ALIVE;
    }

    /**
     * Resolves a wire name, returning {@code null} for names this service does not
     * know.
     */
    public static AgentEventKind fromWireName(String wireName) {
        for (AgentEventKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return null;
    }
}
