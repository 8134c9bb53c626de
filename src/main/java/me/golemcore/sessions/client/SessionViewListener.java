package me.golemcore.sessions.client;

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

import com.fasterxml.jackson.databind.JsonNode;

public interface SessionViewListener {

    /**
     * Every accepted server message, snapshots included.
     */
    void onMessage(JsonNode message);

    /**
     * The snapshot answering the latest load request. Also passed to
     * {@link #onMessage(JsonNode)}.
     */
    default void onHydrated(JsonNode snapshot) {
    }

    default void onStateChanged(TransportState state) {
    }
}
