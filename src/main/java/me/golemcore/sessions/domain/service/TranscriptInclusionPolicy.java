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

import me.golemcore.sessions.domain.model.HistoryRecord;
import me.golemcore.sessions.domain.model.TranscriptEntry;
import me.golemcore.sessions.domain.model.event.AgentEvent;
import me.golemcore.sessions.domain.model.event.AssistantMessageEvent;
import me.golemcore.sessions.domain.model.event.ContentItem;
import me.golemcore.sessions.domain.model.event.MessageContent;
import me.golemcore.sessions.domain.model.event.ResultEvent;
import me.golemcore.sessions.domain.model.event.StreamEvent;
import me.golemcore.sessions.domain.model.event.StreamEventType;
import me.golemcore.sessions.domain.model.event.TextContent;
import me.golemcore.sessions.domain.model.event.UserMessageEvent;

import java.util.List;
import java.util.ListIterator;

/**
 * Stateless rules deciding which agent events belong in the visible
 * transcript.
 *
 * <p>
 * Filtering only removes events, it never reorders the survivors. Excluded
 * events are still part of the agent's own log; they are only kept out of
 * snapshots.
 * </p>
 */
public final class TranscriptInclusionPolicy {

    private static final String SYSTEM_INSTRUCTION_PREFIX = "<system_instruction>";
    private static final String LOCAL_COMMAND_PREFIX = "<local-command";

    private TranscriptInclusionPolicy() {
    }

    /**
     * Text injected by the host rather than typed by a person.
     */
    public static boolean isSystemContent(String text) {
        return text != null && (text.startsWith(SYSTEM_INSTRUCTION_PREFIX) || text.startsWith(LOCAL_COMMAND_PREFIX));
    }

    public static boolean shouldIncludeUserContentItem(ContentItem item) {
        if (item == null) {
            return false;
        }
        return switch (item.kind()) {
        case TEXT -> !isSystemContent(((TextContent) item).text());
        case TOOL_RESULT, IMAGE -> true;
        case TOOL_USE, THINKING, UNKNOWN -> false;
        };
    }

    public static boolean shouldIncludeAssistantContentItem(ContentItem item) {
        if (item == null) {
            return false;
        }
        return switch (item.kind()) {
        case TEXT, TOOL_USE, THINKING -> true;
        case TOOL_RESULT, IMAGE, UNKNOWN -> false;
        };
    }

    /**
     * A user message counts when it has at least one non-system content item.
     */
    public static boolean shouldIncludeUserMessage(MessageContent content) {
        if (content == null) {
            return false;
        }
        if (content.isPlainText()) {
            String text = content.text();
            return text != null && !text.isEmpty() && !isSystemContent(text);
        }
        return content.items().stream().anyMatch(TranscriptInclusionPolicy::shouldIncludeUserContentItem);
    }

    /**
     * An assistant message counts only when it carries narrative text. Messages
     * made only of tool invocations or thinking are captured through their own
     * stream events instead.
     */
    public static boolean shouldIncludeAssistantMessage(MessageContent content) {
        if (content == null) {
            return false;
        }
        if (content.isPlainText()) {
            return true;
        }
        return content.items().stream().anyMatch(item -> item instanceof TextContent);
    }

    /**
     * Only the start of a tool-use, tool-result or thinking block is content;
     * deltas and stop markers are rendering hints.
     */
    public static boolean shouldIncludeStreamEvent(StreamEvent event) {
        if (event == null || event.eventType() != StreamEventType.CONTENT_BLOCK_START
                || event.contentBlock() == null) {
            return false;
        }
        return switch (event.contentBlock().kind()) {
        case TOOL_USE, TOOL_RESULT, THINKING -> true;
        case TEXT, IMAGE, UNKNOWN -> false;
        };
    }

    /**
     * Structural inclusion of a live agent event, independent of what is already
     * in the transcript.
     */
    public static boolean shouldPersistAgentEvent(AgentEvent event) {
        if (event == null) {
            return false;
        }
        return switch (event.kind()) {
        case USER -> shouldIncludeUserMessage(((UserMessageEvent) event).message());
        case ASSISTANT -> shouldIncludeAssistantMessage(((AssistantMessageEvent) event).message());
        case STREAM_EVENT -> shouldIncludeStreamEvent((StreamEvent) event);
        case RESULT -> true;
        case SYSTEM, CONTROL_REQUEST, CONTROL_RESPONSE, CONTROL_CANCEL_REQUEST, KEEP_ALIVE -> false;
        };
    }

    /**
     * A result event duplicates the answer when its text equals the most recent
     * assistant narrative text of the current turn. Only exact equality counts.
     */
    public static boolean isDuplicateResult(List<TranscriptEntry> transcript, AgentEvent event) {
        if (!(event instanceof ResultEvent resultEvent) || resultEvent.result() == null || transcript == null) {
            return false;
        }
        ListIterator<TranscriptEntry> iterator = transcript.listIterator(transcript.size());
        while (iterator.hasPrevious()) {
            TranscriptEntry entry = iterator.previous();
            if (isTurnBoundary(entry)) {
                return false;
            }
            String narrative = narrativeText(entry.payload());
            if (narrative != null) {
                return narrative.equals(resultEvent.result());
            }
        }
        return false;
    }

    /**
     * Cold-start log entries marked as internal metadata, or without a message
     * payload, are not transcript material.
     */
    public static boolean shouldIncludeHistoryRecord(HistoryRecord record) {
        return record != null && !record.meta() && record.message() != null;
    }

    /**
     * A turn starts with a message typed by the user. Tool results travel as
     * user messages too but do not open a turn.
     */
    static boolean isTurnBoundary(TranscriptEntry entry) {
        if (entry.isUser()) {
            return true;
        }
        if (!(entry.payload() instanceof UserMessageEvent userEvent)) {
            return false;
        }
        MessageContent content = userEvent.message();
        if (content == null) {
            return false;
        }
        if (content.isPlainText()) {
            return !isSystemContent(content.text());
        }
        return content.items().stream()
                .anyMatch(item -> item instanceof TextContent text && !isSystemContent(text.text()));
    }

    private static String narrativeText(AgentEvent payload) {
        if (!(payload instanceof AssistantMessageEvent assistant) || assistant.message() == null) {
            return null;
        }
        MessageContent content = assistant.message();
        if (content.isPlainText()) {
            return content.text();
        }
        StringBuilder builder = new StringBuilder();
        boolean found = false;
        for (ContentItem item : content.items()) {
            if (item instanceof TextContent text) {
                builder.append(text.text());
                found = true;
            }
        }
        return found ? builder.toString() : null;
    }
}
