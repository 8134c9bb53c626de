package me.golemcore.sessions.port.outbound;

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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for reading the persisted log written by the agent CLI. Reads may be
 * slow; callers are expected to single-flight them per session.
 */
public interface SessionHistoryPort {

    /**
     * Loads the raw log entries of an agent session in file order.
     *
     * @param externalSessionId
     *            the agent CLI's own session id
     * @param workingDir
     *            the working directory the agent ran in
     * @return entries in log order; empty when no log exists. Completes
     *         exceptionally when the log exists but cannot be read.
     */
    CompletableFuture<List<HistoryRecord>> loadHistory(String externalSessionId, String workingDir);

    /**
     * The persisted log exists but could not be read.
     */
    class HistoryReadException extends RuntimeException {

        public HistoryReadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
