package me.golemcore.sessions.domain.service;

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

import lombok.RequiredArgsConstructor;
import me.golemcore.sessions.domain.model.HistoryRecord;
import me.golemcore.sessions.domain.model.TranscriptEntry;
import me.golemcore.sessions.domain.model.TranscriptSource;
import me.golemcore.sessions.domain.model.event.AgentEvent;
import me.golemcore.sessions.domain.model.event.AssistantMessageEvent;
import me.golemcore.sessions.domain.model.event.ContentItem;
import me.golemcore.sessions.domain.model.event.ImageContent;
import me.golemcore.sessions.domain.model.event.MessageContent;
import me.golemcore.sessions.domain.model.event.StreamEvent;
import me.golemcore.sessions.domain.model.event.TextContent;
import me.golemcore.sessions.domain.model.event.ThinkingContent;
import me.golemcore.sessions.domain.model.event.ToolResultContent;
import me.golemcore.sessions.domain.model.event.ToolUseContent;
import me.golemcore.sessions.domain.model.event.UserMessageEvent;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Rebuilds a transcript from persisted log entries.
 *
 * <p>
 * User text and images become {@code user} entries; tool results, assistant
 * text, tool invocations and thinking blocks become {@code agent} entries, one
 * per block. Entries without a stable id in the log get an id derived from
 * their position and content, so re-reading an unchanged log yields the same
 * ids.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class HistoryTranscriptBuilder {

    private static final String TYPE_USER = "user";
    private static final String TYPE_ASSISTANT = "assistant";
    private static final String TEXT_SEPARATOR = "\n\n";

    private final Clock clock;

    public List<TranscriptEntry> build(List<HistoryRecord> records) {
        List<TranscriptEntry> transcript = new ArrayList<>();
        if (records == null) {
            return transcript;
        }

        int position = 0;
        for (HistoryRecord record : records) {
            if (!TranscriptInclusionPolicy.shouldIncludeHistoryRecord(record)) {
                continue;
            }
            List<ParsedEntry> parsed = parse(record);
            for (ParsedEntry entry : parsed) {
                Instant timestamp = record.timestamp() != null ? record.timestamp() : Instant.now(clock);
                String baseId = record.uuid() != null
                        ? record.uuid()
                        : deterministicId(position, record.timestamp(), entry);
                long order = transcript.size();
                transcript.add(TranscriptEntry.builder()
                        .id(baseId + "-" + order)
                        .source(entry.source())
                        .payload(entry.payload())
                        .timestamp(timestamp)
                        .order(order)
                        .build());
                position++;
            }
        }
        return transcript;
    }

    private List<ParsedEntry> parse(HistoryRecord record) {
        if (TYPE_USER.equals(record.type())) {
            return parseUser(record.message(), record.timestamp());
        }
        if (TYPE_ASSISTANT.equals(record.type())) {
            return parseAssistant(record.message(), record.timestamp());
        }
        return List.of();
    }

    private List<ParsedEntry> parseUser(MessageContent content, Instant timestamp) {
        if (content.isPlainText()) {
            if (content.text().isEmpty() || TranscriptInclusionPolicy.isSystemContent(content.text())) {
                return List.of();
            }
            return List.of(ParsedEntry.user(UserMessageEvent.ofText(content.text(), timestamp)));
        }

        List<ContentItem> normalized = new ArrayList<>();
        boolean hasToolResult = false;
        boolean hasOther = false;
        for (ContentItem item : content.items()) {
            if (!TranscriptInclusionPolicy.shouldIncludeUserContentItem(item)) {
                continue;
            }
            normalized.add(item);
            if (item instanceof ToolResultContent) {
                hasToolResult = true;
            } else {
                hasOther = true;
            }
        }

        if (hasToolResult && hasOther) {
            return List.of(ParsedEntry.agent(new UserMessageEvent(MessageContent.ofItems(normalized), timestamp)));
        }
        if (hasToolResult) {
            List<ParsedEntry> results = new ArrayList<>();
            for (ContentItem item : normalized) {
                results.add(ParsedEntry.agent(new UserMessageEvent(MessageContent.ofItems(item), timestamp)));
            }
            return results;
        }
        return parseUserTextAndImages(normalized, timestamp);
    }

    private List<ParsedEntry> parseUserTextAndImages(List<ContentItem> items, Instant timestamp) {
        List<String> textParts = new ArrayList<>();
        List<ContentItem> images = new ArrayList<>();
        for (ContentItem item : items) {
            if (item instanceof TextContent text) {
                textParts.add(text.text());
            } else if (item instanceof ImageContent) {
                images.add(item);
            }
        }
        if (textParts.isEmpty() && images.isEmpty()) {
            return List.of();
        }
        List<ContentItem> merged = new ArrayList<>();
        if (!textParts.isEmpty()) {
            merged.add(new TextContent(String.join(TEXT_SEPARATOR, textParts)));
        }
        merged.addAll(images);
        return List.of(ParsedEntry.user(new UserMessageEvent(MessageContent.ofItems(merged), timestamp)));
    }

    private List<ParsedEntry> parseAssistant(MessageContent content, Instant timestamp) {
        if (content.isPlainText()) {
            return List.of(ParsedEntry.agent(new AssistantMessageEvent(content, timestamp)));
        }
        List<ParsedEntry> entries = new ArrayList<>();
        for (ContentItem item : content.items()) {
            if (item instanceof TextContent text) {
                entries.add(ParsedEntry.agent(AssistantMessageEvent.ofText(text.text(), timestamp)));
            } else if (item instanceof ToolUseContent || item instanceof ThinkingContent) {
                entries.add(ParsedEntry.agent(StreamEvent.blockStart(item, timestamp)));
            }
        }
        return entries;
    }

    static String deterministicId(int position, Instant timestamp, ParsedEntry entry) {
        String fingerprint = position + "|" + timestamp + "|" + entry.source() + "|" + entry.payload();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest(fingerprint.getBytes(StandardCharsets.UTF_8));
            return "history-" + position + "-" + HexFormat.of().formatHex(hash).substring(0, 12);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    record ParsedEntry(TranscriptSource source, AgentEvent payload) {

        static ParsedEntry user(AgentEvent payload) {
            return new ParsedEntry(TranscriptSource.USER, payload);
        }

        static ParsedEntry agent(AgentEvent payload) {
            return new ParsedEntry(TranscriptSource.AGENT, payload);
        }
    }
}
