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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.TranscriptEntry;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Loads a session's transcript from the persisted log at most once
 * concurrently.
 *
 * <p>
 * Concurrent callers for the same session share a single read. A load is
 * recorded together with the key of the log location it was read from; the
 * session counts as hydrated only for that key, so a caller naming a
 * different location triggers a fresh read. The session stays hydrated until
 * {@link #invalidate(String)} is called, typically after the agent process
 * exited: from then on the log is authoritative again and the next caller
 * re-reads it.
 * </p>
 *
 * <p>
 * Every invalidation or location change bumps the session's generation. A
 * load that started in an older generation is not installed; its callers
 * retry against the current generation. Loads of a forgotten session are
 * abandoned and fail their callers with a {@link CancellationException}.
 * </p>
 */
@Service
@Slf4j
public class HydrationCoordinator {

    private final ExclusiveOperationGuard<String, Boolean> guard = new ExclusiveOperationGuard<>("Hydration");
    private final Map<String, HydrationState> states = new ConcurrentHashMap<>();

    /**
     * Ensures the session's transcript is loaded from the location identified
     * by {@code locationKey}.
     *
     * @param sessionId
     *            session to hydrate
     * @param locationKey
     *            identifies the persisted log; {@code null} when no location is
     *            known, in which case nothing is loaded and the session is not
     *            marked hydrated
     * @param loader
     *            reads and converts the persisted log; invoked at most once
     *            concurrently per session
     * @param installer
     *            receives the loaded transcript; invoked at most once per
     *            successful load and never for a stale one
     * @return completes when the session is hydrated, exceptionally when the
     *         load failed or the session was forgotten meanwhile
     */
    public CompletableFuture<Void> ensureHydrated(String sessionId, String locationKey,
            Supplier<CompletableFuture<List<TranscriptEntry>>> loader,
            Consumer<List<TranscriptEntry>> installer) {
        if (locationKey == null) {
            return CompletableFuture.completedFuture(null);
        }
        HydrationState state = states.computeIfAbsent(sessionId, key -> new HydrationState());
        synchronized (state) {
            if (locationKey.equals(state.hydratedKey)) {
                return CompletableFuture.completedFuture(null);
            }
            if (state.hydratedKey != null) {
                log.debug("[Hydration] log location changed: sessionId={}", sessionId);
                state.generation++;
                state.hydratedKey = null;
            }
        }

        return guard.run(sessionId, () -> load(sessionId, locationKey, state, loader, installer))
                .thenCompose(installed -> {
                    synchronized (state) {
                        if (state.forgotten) {
                            return CompletableFuture.failedFuture(
                                    new CancellationException("Hydration abandoned: session " + sessionId + " cleared"));
                        }
                        if (Boolean.TRUE.equals(installed) && locationKey.equals(state.hydratedKey)) {
                            return CompletableFuture.completedFuture(null);
                        }
                    }
                    log.debug("[Hydration] stale load discarded, retrying: sessionId={}", sessionId);
                    return ensureHydrated(sessionId, locationKey, loader, installer);
                });
    }

    /**
     * Marks the session as needing a fresh read of its persisted log.
     */
    public void invalidate(String sessionId) {
        HydrationState state = states.get(sessionId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.generation++;
            state.hydratedKey = null;
        }
        log.debug("[Hydration] invalidated: sessionId={}", sessionId);
    }

    public boolean isHydrated(String sessionId) {
        HydrationState state = states.get(sessionId);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            return state.hydratedKey != null;
        }
    }

    public boolean isHydrating(String sessionId) {
        return guard.isInFlight(sessionId);
    }

    /**
     * Drops all hydration bookkeeping for a session. A load still in flight for
     * it is neither installed nor retried.
     */
    public void forget(String sessionId) {
        HydrationState state = states.remove(sessionId);
        if (state != null) {
            synchronized (state) {
                state.generation++;
                state.hydratedKey = null;
                state.forgotten = true;
            }
        }
    }

    public void forgetAll() {
        for (String sessionId : List.copyOf(states.keySet())) {
            forget(sessionId);
        }
    }

    private CompletableFuture<Boolean> load(String sessionId, String locationKey, HydrationState state,
            Supplier<CompletableFuture<List<TranscriptEntry>>> loader,
            Consumer<List<TranscriptEntry>> installer) {
        long generation;
        synchronized (state) {
            if (state.forgotten) {
                return CompletableFuture.completedFuture(false);
            }
            if (locationKey.equals(state.hydratedKey)) {
                return CompletableFuture.completedFuture(true);
            }
            generation = state.generation;
        }
        log.debug("[Hydration] loading persisted log: sessionId={}, generation={}", sessionId, generation);

        return loader.get().thenApply(entries -> {
            synchronized (state) {
                if (state.generation != generation) {
                    return false;
                }
                installer.accept(entries != null ? entries : List.of());
                state.hydratedKey = locationKey;
            }
            log.info("[Hydration] hydrated: sessionId={}, entries={}", sessionId, entries != null ? entries.size() : 0);
            return true;
        });
    }

    private static final class HydrationState {
        private long generation;
        private String hydratedKey;
        private boolean forgotten;
    }
}
