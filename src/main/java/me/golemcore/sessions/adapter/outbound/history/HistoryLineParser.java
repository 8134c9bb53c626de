package me.golemcore.sessions.adapter.outbound.history;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.sessions.domain.model.HistoryRecord;
import me.golemcore.sessions.domain.model.event.ContentItem;
import me.golemcore.sessions.domain.model.event.ContentItemKind;
import me.golemcore.sessions.domain.model.event.ImageContent;
import me.golemcore.sessions.domain.model.event.MessageContent;
import me.golemcore.sessions.domain.model.event.TextContent;
import me.golemcore.sessions.domain.model.event.ThinkingContent;
import me.golemcore.sessions.domain.model.event.ToolResultContent;
import me.golemcore.sessions.domain.model.event.ToolUseContent;
import me.golemcore.sessions.domain.model.event.UnknownContent;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Parses one line of an agent's JSONL log into a {@link HistoryRecord}.
 */
@Component
@RequiredArgsConstructor
public class HistoryLineParser {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_CONTENT = "content";

    private final ObjectMapper objectMapper;

    /**
     * @return the parsed entry, or empty when the line is valid JSON but not a
     *         log entry (no string {@code type})
     * @throws JsonProcessingException
     *             when the line is not valid JSON
     */
    public Optional<HistoryRecord> parse(String line) throws JsonProcessingException {
        JsonNode root = objectMapper.readTree(line);
        if (root == null || !root.isObject() || !root.path(FIELD_TYPE).isTextual()) {
            return Optional.empty();
        }
        return Optional.of(HistoryRecord.builder()
                .type(root.get(FIELD_TYPE).asText())
                .uuid(textOrNull(root, "uuid"))
                .timestamp(parseTimestamp(textOrNull(root, "timestamp")))
                .meta(root.path("isMeta").asBoolean(false))
                .message(parseMessage(root.get("message")))
                .build());
    }

    private MessageContent parseMessage(JsonNode message) {
        if (message == null || !message.isObject()) {
            return null;
        }
        JsonNode content = message.get(FIELD_CONTENT);
        if (content == null) {
            return null;
        }
        if (content.isTextual()) {
            return MessageContent.ofText(content.asText());
        }
        if (content.isArray()) {
            List<ContentItem> items = new ArrayList<>();
            for (JsonNode item : content) {
                items.add(parseItem(item));
            }
            return MessageContent.ofItems(items);
        }
        return null;
    }

    private ContentItem parseItem(JsonNode item) {
        String rawType = item.path(FIELD_TYPE).asText("");
        return switch (ContentItemKind.fromWireName(rawType)) {
        case TEXT -> new TextContent(item.path("text").asText(""));
        case IMAGE -> new ImageContent(
                item.path("source").path("media_type").asText("application/octet-stream"),
                item.path("source").path("data").asText(""));
        case TOOL_USE -> new ToolUseContent(textOrNull(item, "id"), textOrNull(item, "name"), toMap(item.get("input")));
        case TOOL_RESULT -> new ToolResultContent(textOrNull(item, "tool_use_id"), toPlain(item.get(FIELD_CONTENT)),
                item.has("is_error") ? item.get("is_error").asBoolean() : null);
        case THINKING -> new ThinkingContent(item.path("thinking").asText(""));
        case UNKNOWN -> new UnknownContent(rawType);
        };
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, LinkedHashMap.class);
    }

    private Object toPlain(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
