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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ToolUseContent(String id, String name, Map<String, Object> input) implements ContentItem {

    public ToolUseContent {
        input = input != null ? Collections.unmodifiableMap(new LinkedHashMap<>(input)) : Map.of();
    }

    @Override
    public ContentItemKind kind() {
        return ContentItemKind.TOOL_USE;
    }
}
