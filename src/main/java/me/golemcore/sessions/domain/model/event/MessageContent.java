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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Body of a user or assistant message: either a plain string or a list of
 * content blocks.
 */
public record MessageContent(String text, List<ContentItem> items) {

    public MessageContent {
        items = items != null ? List.copyOf(items) : null;
    }

    public static MessageContent ofText(String text) {
        return new MessageContent(text != null ? text : "", null);
    }

    public static MessageContent ofItems(List<ContentItem> items) {
        return new MessageContent(null, items != null ? items : List.of());
    }

    public static MessageContent ofItems(ContentItem... items) {
        return new MessageContent(null, List.of(items));
    }

    @JsonIgnore
    public boolean isPlainText() {
        return items == null;
    }

    @JsonValue
    public Object toWireValue() {
        return isPlainText() ? text : items;
    }
}
