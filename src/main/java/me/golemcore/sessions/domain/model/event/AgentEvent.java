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

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Raw event produced by the agent process. Implementations are the closed set
 * enumerated by {@link AgentEventKind}; consumers dispatch on {@link #kind()}.
 */
public interface AgentEvent {

    @JsonProperty("type")
    AgentEventKind kind();

    /**
     * Timestamp carried by the event, or {@code null} when the producer did not
     * stamp it.
     */
    Instant timestamp();
}
