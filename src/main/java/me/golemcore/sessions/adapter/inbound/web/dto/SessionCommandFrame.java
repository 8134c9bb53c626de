package me.golemcore.sessions.adapter.inbound.web.dto;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Inbound frame sent by a viewer. Which fields are used depends on
 * {@code type}: {@code load_session}, {@code queue_message} or
 * {@code remove_queued_message}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionCommandFrame {
    private String type;
    private String sessionId;
    private String workingDir;
    private String externalSessionId;
    private String loadRequestId;
    private String id;
    private String text;
    private Map<String, Object> settings;
    private String messageId;
}
