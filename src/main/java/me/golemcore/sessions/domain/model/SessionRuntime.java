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

import java.time.Instant;
import java.util.Objects;

/**
 * Derived runtime state of a session's agent process.
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionRuntime(SessionPhase phase, ProcessState processState, SessionActivity activity,
        LastExit lastExit, Instant updatedAt) {

    /**
     * Compares everything except {@code updatedAt}.
     */
    public boolean sameStateAs(SessionRuntime other) {
        return other != null
                && phase == other.phase
                && processState == other.processState
                && activity == other.activity
                && Objects.equals(lastExit, other.lastExit);
    }
}
