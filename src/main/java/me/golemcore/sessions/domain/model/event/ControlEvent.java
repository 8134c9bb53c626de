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

import java.time.Instant;
import java.util.Objects;

/**
 * Control channel traffic: handshake, keep-alive and cancellation.
 */
public record ControlEvent(AgentEventKind kind, String requestId, Instant timestamp) implements AgentEvent {

    public ControlEvent {
        Objects.requireNonNull(kind, "kind");
        if (!kind.isControlChannel()) {
            throw new IllegalArgumentException("Not a control channel kind: " + kind);
        }
    }
}
