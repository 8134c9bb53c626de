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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.EnqueueResult;
import me.golemcore.sessions.domain.model.LastExit;
import me.golemcore.sessions.domain.model.PendingInteractiveRequest;
import me.golemcore.sessions.domain.model.ProcessState;
import me.golemcore.sessions.domain.model.QueuedMessage;
import me.golemcore.sessions.domain.model.SessionActivity;
import me.golemcore.sessions.domain.model.SessionPhase;
import me.golemcore.sessions.domain.model.SessionRuntime;
import me.golemcore.sessions.domain.model.SessionRuntimeUpdatedMessage;
import me.golemcore.sessions.domain.model.SessionSnapshotMessage;
import me.golemcore.sessions.domain.model.SubscribeRequest;
import me.golemcore.sessions.domain.model.TranscriptEntry;
import me.golemcore.sessions.domain.model.TranscriptSource;
import me.golemcore.sessions.domain.model.event.AgentEvent;
import me.golemcore.sessions.domain.model.event.StreamEvent;
import me.golemcore.sessions.domain.model.event.StreamEventType;
import me.golemcore.sessions.domain.model.event.ToolUseContent;
import me.golemcore.sessions.domain.model.event.UserMessageEvent;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.port.outbound.SessionHistoryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Owns the per-session transcript, outgoing queue, pending interactive request
 * and runtime state, and is the only way to mutate them.
 *
 * <p>
 * Each session's state is guarded by its own monitor. Snapshots are built and
 * handed to the {@link SnapshotBroadcaster} while that monitor is held, so two
 * emissions for the same session never interleave and a subscriber's baseline
 * snapshot is delivered before any later update. Hydration installs run inside
 * the {@link HydrationCoordinator}'s per-session lock and take the store
 * monitor second; store code never calls into the coordinator while holding
 * the monitor.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptStore {

    private final SessionHistoryPort historyPort;
    private final HydrationCoordinator hydrationCoordinator;
    private final SessionRuntimeTracker runtimeTracker;
    private final SnapshotBroadcaster broadcaster;
    private final HistoryTranscriptBuilder transcriptBuilder;
    private final SessionsProperties properties;
    private final Clock clock;

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();

    // ==================== Subscription ====================

    /**
     * Hydrates the session if needed, seeds its runtime from the supplied status
     * flags and delivers exactly one snapshot to the subscribing connection.
     *
     * @return the delivered snapshot; completes exceptionally when the persisted
     *         log could not be read
     */
    public CompletableFuture<SessionSnapshotMessage> subscribe(SubscribeRequest request) {
        String sessionId = request.sessionId();
        SessionState state = state(sessionId);
        synchronized (state) {
            if (request.workingDir() != null) {
                state.workingDir = request.workingDir();
            }
            if (request.externalSessionId() != null) {
                state.externalSessionId = request.externalSessionId();
            }
        }
        if (request.connectionId() != null) {
            broadcaster.attach(sessionId, request.connectionId());
        }

        return hydrate(sessionId, request.workingDir(), request.externalSessionId())
                .thenApply(ignored -> {
                    SessionState current = state(sessionId);
                    synchronized (current) {
                        LastExit lastExit = current.runtime.lastExit();
                        current.runtime = runtimeTracker.fromStatus(request.running(), request.working(), lastExit);
                        SessionSnapshotMessage snapshot = buildSnapshot(sessionId, current, request.loadRequestId());
                        if (request.connectionId() != null) {
                            broadcaster.deliverSubscribeSnapshot(sessionId, request.connectionId(), snapshot);
                        }
                        log.info("[TranscriptStore] subscribed: sessionId={}, connectionId={}, messages={}, queued={}",
                                sessionId, request.connectionId(), snapshot.messages().size(),
                                snapshot.queuedMessages().size());
                        return snapshot;
                    }
                });
    }

    // ==================== Queue ====================

    public EnqueueResult enqueue(String sessionId, QueuedMessage message) {
        SessionState state = state(sessionId);
        synchronized (state) {
            int maxSize = properties.getQueue().getMaxSize();
            if (state.queue.size() >= maxSize) {
                log.warn("[TranscriptStore] queue full, message rejected: sessionId={}, size={}",
                        sessionId, state.queue.size());
                return EnqueueResult.rejected("Queue is full (max " + maxSize + " messages)");
            }
            QueuedMessage accepted = message.toBuilder()
                    .id(message.id() != null ? message.id() : UUID.randomUUID().toString())
                    .timestamp(message.timestamp() != null ? message.timestamp() : now())
                    .build();
            state.queue.addLast(accepted);
            int position = state.queue.size() - 1;
            log.debug("[TranscriptStore] enqueued: sessionId={}, messageId={}, position={}",
                    sessionId, accepted.id(), position);
            emit(sessionId, state, null);
            return EnqueueResult.accepted(position);
        }
    }

    public QueuedMessage dequeueNext(String sessionId) {
        return dequeueNext(sessionId, true);
    }

    /**
     * Pops the head of the queue.
     *
     * @param emitSnapshot
     *            {@code false} when the caller dispatches the message right away
     *            and emits its own follow-up snapshot
     * @return the dequeued message, or {@code null} when the queue is empty
     */
    public QueuedMessage dequeueNext(String sessionId, boolean emitSnapshot) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return null;
        }
        synchronized (state) {
            QueuedMessage message = state.queue.pollFirst();
            if (message != null && emitSnapshot) {
                emit(sessionId, state, null);
            }
            return message;
        }
    }

    public int getQueueLength(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return 0;
        }
        synchronized (state) {
            return state.queue.size();
        }
    }

    public List<QueuedMessage> getQueueSnapshot(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return List.of();
        }
        synchronized (state) {
            return List.copyOf(state.queue);
        }
    }

    public boolean removeQueuedMessage(String sessionId, String messageId) {
        SessionState state = sessions.get(sessionId);
        if (state == null || messageId == null) {
            return false;
        }
        synchronized (state) {
            boolean removed = state.queue.removeIf(message -> messageId.equals(message.id()));
            if (removed) {
                log.debug("[TranscriptStore] queued message removed: sessionId={}, messageId={}", sessionId, messageId);
                emit(sessionId, state, null);
            }
            return removed;
        }
    }

    /**
     * Puts a message back at the head of the queue, typically after its dispatch
     * failed.
     */
    public void requeueFront(String sessionId, QueuedMessage message) {
        SessionState state = state(sessionId);
        synchronized (state) {
            state.queue.addFirst(message);
            emit(sessionId, state, null);
        }
    }

    /**
     * Drops queued messages and the pending interactive request.
     */
    public void clearQueuedWork(String sessionId, boolean emitSnapshot) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.queue.clear();
            state.pendingRequest = null;
            if (emitSnapshot) {
                emit(sessionId, state, null);
            }
        }
    }

    // ==================== Pending interactive request ====================

    public void setPendingInteractiveRequest(String sessionId, PendingInteractiveRequest request) {
        SessionState state = state(sessionId);
        synchronized (state) {
            state.pendingRequest = request;
        }
    }

    public PendingInteractiveRequest getPendingInteractiveRequest(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return null;
        }
        synchronized (state) {
            return state.pendingRequest;
        }
    }

    public boolean clearPendingInteractiveRequest(String sessionId) {
        return clearPendingIf(sessionId, null);
    }

    /**
     * Clears the pending request only if it is still the one identified by
     * {@code requestId}; a newer request is left untouched.
     */
    public boolean clearPendingInteractiveRequestIfMatches(String sessionId, String requestId) {
        if (requestId == null) {
            return false;
        }
        return clearPendingIf(sessionId, requestId);
    }

    public Map<String, PendingInteractiveRequest> getAllPendingRequests() {
        Map<String, PendingInteractiveRequest> pending = new LinkedHashMap<>();
        sessions.forEach((sessionId, state) -> {
            synchronized (state) {
                if (state.pendingRequest != null) {
                    pending.put(sessionId, state.pendingRequest);
                }
            }
        });
        return pending;
    }

    private boolean clearPendingIf(String sessionId, String requestId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return false;
        }
        synchronized (state) {
            PendingInteractiveRequest pending = state.pendingRequest;
            if (pending == null || (requestId != null && !requestId.equals(pending.requestId()))) {
                return false;
            }
            state.pendingRequest = null;
            emit(sessionId, state, null);
            return true;
        }
    }

    // ==================== Transcript ====================

    /**
     * Records a live agent event. A tool invocation whose id is already in the
     * transcript replaces that entry in place and keeps its order. Any other
     * event consumes an order slot and is appended only when the inclusion
     * rules accept it. Nothing is broadcast; callers batch appends and then call
     * {@link #emitSessionSnapshot(String)}.
     *
     * @return the order allocated to the event, or the order of the entry it
     *         replaced
     */
    public long appendClaudeEvent(String sessionId, AgentEvent event) {
        SessionState state = state(sessionId);
        synchronized (state) {
            String toolUseId = toolUseId(event);
            if (toolUseId != null) {
                int index = indexOfToolUse(state.transcript, toolUseId);
                if (index >= 0) {
                    TranscriptEntry existing = state.transcript.get(index);
                    state.transcript.set(index, existing.toBuilder().payload(event).build());
                    log.debug("[TranscriptStore] upserted tool use: sessionId={}, toolUseId={}, order={}",
                            sessionId, toolUseId, existing.order());
                    return existing.order();
                }
            }

            long order = state.nextOrder++;
            if (!TranscriptInclusionPolicy.shouldPersistAgentEvent(event)) {
                log.debug("[TranscriptStore] filtered: sessionId={}, kind={}, order={}",
                        sessionId, event != null ? event.kind() : null, order);
                return order;
            }
            if (TranscriptInclusionPolicy.isDuplicateResult(state.transcript, event)) {
                log.debug("[TranscriptStore] duplicate result filtered: sessionId={}, order={}", sessionId, order);
                return order;
            }

            state.transcript.add(TranscriptEntry.builder()
                    .id(UUID.randomUUID().toString())
                    .source(TranscriptSource.AGENT)
                    .payload(event)
                    .timestamp(event.timestamp() != null ? event.timestamp() : now())
                    .order(order)
                    .build());
            log.debug("[TranscriptStore] persisted: sessionId={}, kind={}, order={}", sessionId, event.kind(), order);
            return order;
        }
    }

    /**
     * Records a dispatched user message as a {@code user} entry. A message
     * committed twice keeps its first position.
     */
    public void commitSentUserMessage(String sessionId, QueuedMessage message, boolean emitSnapshot) {
        SessionState state = state(sessionId);
        synchronized (state) {
            Instant timestamp = message.timestamp() != null ? message.timestamp() : now();
            String id = message.id() != null ? message.id() : UUID.randomUUID().toString();
            UserMessageEvent payload = UserMessageEvent.ofText(message.text(), timestamp);
            upsertUserEntry(state, id, payload, timestamp);
            if (emitSnapshot) {
                emit(sessionId, state, null);
            }
        }
    }

    /**
     * Records a user message injected by the host rather than dequeued, and
     * broadcasts the result.
     */
    public void injectCommittedUserMessage(String sessionId, String text) {
        SessionState state = state(sessionId);
        synchronized (state) {
            Instant timestamp = now();
            upsertUserEntry(state, UUID.randomUUID().toString(), UserMessageEvent.ofText(text, timestamp), timestamp);
            emit(sessionId, state, null);
        }
    }

    public List<TranscriptEntry> getTranscript(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return List.of();
        }
        synchronized (state) {
            return List.copyOf(state.transcript);
        }
    }

    private void upsertUserEntry(SessionState state, String id, UserMessageEvent payload, Instant timestamp) {
        for (int i = 0; i < state.transcript.size(); i++) {
            TranscriptEntry existing = state.transcript.get(i);
            if (id.equals(existing.id())) {
                state.transcript.set(i, existing.toBuilder().payload(payload).build());
                return;
            }
        }
        state.transcript.add(TranscriptEntry.builder()
                .id(id)
                .source(TranscriptSource.USER)
                .payload(payload)
                .timestamp(timestamp)
                .order(state.nextOrder++)
                .build());
    }

    private static String toolUseId(AgentEvent event) {
        if (event instanceof StreamEvent streamEvent
                && streamEvent.eventType() == StreamEventType.CONTENT_BLOCK_START
                && streamEvent.contentBlock() instanceof ToolUseContent toolUse) {
            return toolUse.id();
        }
        return null;
    }

    private static int indexOfToolUse(List<TranscriptEntry> transcript, String toolUseId) {
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (toolUseId.equals(toolUseId(transcript.get(i).payload()))) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Snapshots ====================

    public void emitSessionSnapshot(String sessionId) {
        emitSessionSnapshot(sessionId, null);
    }

    public void emitSessionSnapshot(String sessionId, String loadRequestId) {
        SessionState state = state(sessionId);
        synchronized (state) {
            emit(sessionId, state, loadRequestId);
        }
    }

    private void emit(String sessionId, SessionState state, String loadRequestId) {
        broadcaster.forwardSnapshot(sessionId, buildSnapshot(sessionId, state, loadRequestId));
    }

    private SessionSnapshotMessage buildSnapshot(String sessionId, SessionState state, String loadRequestId) {
        return SessionSnapshotMessage.builder()
                .sessionId(sessionId)
                .loadRequestId(loadRequestId)
                .sessionRuntime(state.runtime)
                .messages(List.copyOf(state.transcript))
                .queuedMessages(List.copyOf(state.queue))
                .pendingInteractiveRequest(state.pendingRequest)
                .build();
    }

    // ==================== Runtime ====================

    public SessionRuntime getRuntimeSnapshot(String sessionId) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            return runtimeTracker.initial();
        }
        synchronized (state) {
            return state.runtime;
        }
    }

    public SessionRuntime markStarting(String sessionId) {
        return updateRuntime(sessionId, current -> runtimeTracker.transition(current,
                SessionPhase.STARTING, ProcessState.STOPPED, SessionActivity.IDLE));
    }

    public SessionRuntime markRunning(String sessionId, boolean working) {
        return updateRuntime(sessionId, current -> runtimeTracker.transition(current,
                SessionPhase.RUNNING, ProcessState.ALIVE, working ? SessionActivity.WORKING : SessionActivity.IDLE));
    }

    public SessionRuntime markIdle(String sessionId, ProcessState processState) {
        return updateRuntime(sessionId, current -> runtimeTracker.transition(current,
                SessionPhase.IDLE, processState, SessionActivity.IDLE));
    }

    public SessionRuntime markStopping(String sessionId) {
        return updateRuntime(sessionId, current -> runtimeTracker.transition(current,
                SessionPhase.STOPPING, ProcessState.ALIVE, current.activity()));
    }

    public SessionRuntime markError(String sessionId) {
        return updateRuntime(sessionId, current -> runtimeTracker.transition(current,
                SessionPhase.ERROR, ProcessState.STOPPED, SessionActivity.IDLE));
    }

    private SessionRuntime updateRuntime(String sessionId, UnaryOperator<SessionRuntime> transition) {
        SessionState state = state(sessionId);
        synchronized (state) {
            SessionRuntime next = transition.apply(state.runtime);
            if (next.sameStateAs(state.runtime)) {
                return state.runtime;
            }
            state.runtime = next;
            log.debug("[TranscriptStore] runtime: sessionId={}, phase={}, process={}, activity={}",
                    sessionId, next.phase(), next.processState(), next.activity());
            broadcaster.emitDelta(sessionId, new SessionRuntimeUpdatedMessage(sessionId, next));
            return next;
        }
    }

    // ==================== Process lifecycle ====================

    /**
     * Records a process termination: derives the runtime from the exit code,
     * drops queued work and the pending request, invalidates hydration so the
     * next subscriber re-reads the persisted log, and broadcasts a snapshot.
     */
    public void markProcessExit(String sessionId, Integer exitCode) {
        hydrationCoordinator.invalidate(sessionId);

        SessionState state = state(sessionId);
        String workingDir;
        String externalSessionId;
        synchronized (state) {
            int droppedMessages = state.queue.size();
            boolean droppedRequest = state.pendingRequest != null;
            state.queue.clear();
            state.pendingRequest = null;
            state.runtime = runtimeTracker.afterExit(exitCode);
            workingDir = state.workingDir;
            externalSessionId = state.externalSessionId;
            emit(sessionId, state, null);
            log.info("[TranscriptStore] process exit: sessionId={}, exitCode={}, unexpected={}, "
                    + "droppedMessages={}, droppedRequest={}",
                    sessionId, exitCode, state.runtime.lastExit().unexpected(), droppedMessages, droppedRequest);
        }

        if (properties.getTranscript().isRehydrateOnExit() && externalSessionId != null) {
            rehydrateInBackground(sessionId, workingDir, externalSessionId);
        }
    }

    private void rehydrateInBackground(String sessionId, String workingDir, String externalSessionId) {
        hydrate(sessionId, workingDir, externalSessionId)
                .thenRun(() -> emitSessionSnapshot(sessionId))
                .exceptionally(error -> {
                    log.warn("[TranscriptStore] rehydrate after exit failed: sessionId={}: {}",
                            sessionId, error.getMessage());
                    return null;
                });
    }

    // ==================== Teardown ====================

    /**
     * Drops all state of the session and detaches its subscribers. A hydration
     * still in flight is abandoned: it installs nothing and its subscribers
     * fail with a {@link java.util.concurrent.CancellationException}.
     */
    public void clearSession(String sessionId) {
        hydrationCoordinator.forget(sessionId);
        sessions.remove(sessionId);
        int detached = broadcaster.detachSession(sessionId);
        log.debug("[TranscriptStore] session cleared: sessionId={}, detached={}", sessionId, detached);
    }

    public void clearAllSessions() {
        hydrationCoordinator.forgetAll();
        int count = sessions.size();
        sessions.clear();
        broadcaster.detachAll();
        log.info("[TranscriptStore] all sessions cleared: count={}", count);
    }

    public int getConnectionCount(String sessionId) {
        return broadcaster.getConnectionCount(sessionId);
    }

    // ==================== Internal ====================

    private CompletableFuture<Void> hydrate(String sessionId, String workingDir, String externalSessionId) {
        String resolvedWorkingDir = workingDir;
        String resolvedExternalId = externalSessionId;
        if (resolvedExternalId == null) {
            SessionState state = state(sessionId);
            synchronized (state) {
                resolvedWorkingDir = state.workingDir;
                resolvedExternalId = state.externalSessionId;
            }
        }
        if (resolvedExternalId == null) {
            // Without a log location, live memory is all there is.
            return CompletableFuture.completedFuture(null);
        }
        String logWorkingDir = resolvedWorkingDir;
        String logSessionId = resolvedExternalId;

        return hydrationCoordinator.ensureHydrated(sessionId, logLocationKey(logSessionId, logWorkingDir),
                () -> historyPort.loadHistory(logSessionId, logWorkingDir).thenApply(transcriptBuilder::build),
                entries -> install(sessionId, entries));
    }

    private static String logLocationKey(String externalSessionId, String workingDir) {
        return externalSessionId + "|" + (workingDir != null ? workingDir : "");
    }

    private void install(String sessionId, List<TranscriptEntry> entries) {
        SessionState state = sessions.get(sessionId);
        if (state == null) {
            log.debug("[TranscriptStore] session cleared before install: sessionId={}", sessionId);
            return;
        }
        synchronized (state) {
            state.transcript.clear();
            state.transcript.addAll(entries);
            long maxOrder = -1;
            for (TranscriptEntry entry : entries) {
                maxOrder = Math.max(maxOrder, entry.order());
            }
            state.nextOrder = maxOrder + 1;
        }
    }

    private SessionState state(String sessionId) {
        return sessions.computeIfAbsent(sessionId, key -> new SessionState(runtimeTracker.initial()));
    }

    private Instant now() {
        return Instant.now(clock);
    }

    private static final class SessionState {
        private final List<TranscriptEntry> transcript = new ArrayList<>();
        private final LinkedList<QueuedMessage> queue = new LinkedList<>();
        private PendingInteractiveRequest pendingRequest;
        private SessionRuntime runtime;
        private long nextOrder;
        private String workingDir;
        private String externalSessionId;

        private SessionState(SessionRuntime runtime) {
            this.runtime = runtime;
        }
    }
}
