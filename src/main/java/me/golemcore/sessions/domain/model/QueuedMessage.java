package me.golemcore.sessions.domain.model;

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

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User message accepted while the agent process is busy or not yet started.
 * {@code settings} is the chat settings snapshot taken when the message was
 * queued (model, thinking budget, plan mode).
 */
@Builder(toBuilder = true)
public record QueuedMessage(String id, String text, Instant timestamp, Map<String, Object> settings) {

    public QueuedMessage {
        settings = settings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(settings)) : null;
    }
}
