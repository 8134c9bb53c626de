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

import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Tracks the correlation id of the outstanding hydration request and decides
 * what to do with incoming hydration responses.
 *
 * <p>
 * Only a response echoing the outstanding id resolves the request. A response
 * without an id is unrelated traffic (for example a snapshot caused by a queue
 * change) and is delivered without touching the guard. A response carrying a
 * different id belongs to a superseded request and is dropped.
 * </p>
 */
public class HydrationRequestGuard {

    private static final Set<String> HYDRATION_TYPES = Set.of("session_snapshot", "session_replay_batch");

    private final Supplier<String> idGenerator;
    private String pendingId;

    public HydrationRequestGuard() {
        this(() -> UUID.randomUUID().toString());
    }

    public HydrationRequestGuard(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public enum Decision {
        /** Unrelated to the outstanding request; deliver as is. */
        DELIVER,
        /** Answers the outstanding request, which is now resolved. */
        RESOLVED,
        /** Stale answer to a superseded request. */
        DROP
    }

    /**
     * Starts a new hydration request, superseding any outstanding one.
     *
     * @return the correlation id to send with the request
     */
    public synchronized String begin() {
        pendingId = idGenerator.get();
        return pendingId;
    }

    public synchronized Decision evaluate(String type, String loadRequestId) {
        if (pendingId == null || type == null || !HYDRATION_TYPES.contains(type) || loadRequestId == null) {
            return Decision.DELIVER;
        }
        if (!pendingId.equals(loadRequestId)) {
            return Decision.DROP;
        }
        pendingId = null;
        return Decision.RESOLVED;
    }

    public synchronized boolean isAwaiting() {
        return pendingId != null;
    }

    public synchronized String getPendingId() {
        return pendingId;
    }

    public synchronized void reset() {
        pendingId = null;
    }
}
