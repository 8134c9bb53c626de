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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * Complete baseline of a session: runtime, transcript, queue and the pending
 * interactive request. {@code loadRequestId} echoes the correlation id of the
 * load that produced it.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionSnapshotMessage(String sessionId, String loadRequestId, SessionRuntime sessionRuntime,
        List<TranscriptEntry> messages, List<QueuedMessage> queuedMessages,
        PendingInteractiveRequest pendingInteractiveRequest) implements SessionMessage {

    public static final String TYPE = "session_snapshot";

    @Override
    public String type() {
        return TYPE;
    }
}
