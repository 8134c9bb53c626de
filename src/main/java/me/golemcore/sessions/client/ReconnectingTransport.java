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

import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Keeps one real-time connection to a target open, reconnecting with bounded
 * backoff after unexpected closes.
 *
 * <p>
 * Every connection attempt gets a sequence number. Callbacks from an attempt
 * that has been superseded (by a reconnect, a new target or a teardown) are
 * ignored, so a late close of an old connection never schedules a reconnect
 * for the current one.
 * </p>
 *
 * <p>
 * Frames sent while not open are queued and flushed in batches on the next
 * open; the remainder of a flush is sent in follow-up batches on the
 * scheduler.
 * </p>
 */
@Slf4j
public class ReconnectingTransport {

    private final RealtimeConnector connector;
    private final ReconnectPolicy policy;
    private final OutboundMessageQueue queue;
    private final Scheduler scheduler;
    private final TransportListener listener;

    private TransportState state = TransportState.DISCONNECTED;
    private URI target;
    private long currentAttempt;
    private RealtimeConnection connection;
    private Disposable pendingReconnect;
    private int reconnectAttempts;

    public ReconnectingTransport(RealtimeConnector connector, ReconnectPolicy policy, OutboundMessageQueue queue,
            Scheduler scheduler, TransportListener listener) {
        this.connector = connector;
        this.policy = policy;
        this.queue = queue;
        this.scheduler = scheduler;
        this.listener = listener;
    }

    /**
     * Connects to {@code newTarget}. A {@code null} target is an intentional
     * teardown.
     */
    public synchronized void connect(URI newTarget) {
        if (newTarget == null) {
            disconnect();
            return;
        }
        if (newTarget.equals(target) && (state == TransportState.OPEN || state == TransportState.CONNECTING)) {
            return;
        }
        target = newTarget;
        reconnectAttempts = 0;
        openConnection();
    }

    /**
     * Intentional close: no reconnect is scheduled and queued frames are
     * discarded.
     */
    public synchronized void disconnect() {
        target = null;
        cancelPendingReconnect();
        queue.clear();
        closeCurrent();
        transitionTo(TransportState.DISCONNECTED);
    }

    /**
     * Manual reconnect, typically after {@link TransportState#FAILED}. Resets
     * the attempt counter and discards queued frames.
     */
    public synchronized void reconnect() {
        if (target == null) {
            log.debug("[Transport] reconnect ignored, no target");
            return;
        }
        reconnectAttempts = 0;
        queue.clear();
        openConnection();
    }

    /**
     * @return {@code true} when sent right away, {@code false} when queued
     */
    public synchronized boolean send(OutboundMessage message) {
        if (state == TransportState.OPEN && connection != null && queue.isEmpty()
                && connection.send(message.payload())) {
            return true;
        }
        queue.offer(message);
        return false;
    }

    public synchronized TransportState getState() {
        return state;
    }

    public synchronized int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public int getQueuedCount() {
        return queue.size();
    }

    private void openConnection() {
        cancelPendingReconnect();
        closeCurrent();
        long attempt = ++currentAttempt;
        transitionTo(TransportState.CONNECTING);
        log.debug("[Transport] connecting: target={}, attempt={}", target, attempt);
        RealtimeConnection opened = connector.connect(target, new AttemptListener(attempt));
        if (attempt == currentAttempt && connection == null && state == TransportState.CONNECTING) {
            connection = opened;
        }
    }

    private synchronized void handleOpen(long attempt, RealtimeConnection opened) {
        if (attempt != currentAttempt) {
            opened.close();
            return;
        }
        connection = opened;
        reconnectAttempts = 0;
        state = TransportState.OPEN;
        int discarded = queue.discardTimeSensitive();
        if (discarded > 0) {
            log.debug("[Transport] discarded {} time-sensitive frames", discarded);
        }
        flushBatch(attempt);
        log.info("[Transport] connected: target={}", target);
        listener.onStateChanged(TransportState.OPEN);
    }

    private synchronized void handleMessage(long attempt, String payload) {
        if (attempt != currentAttempt) {
            return;
        }
        listener.onMessage(payload);
    }

    private synchronized void handleClose(long attempt, Throwable error) {
        if (attempt != currentAttempt) {
            log.debug("[Transport] ignoring close of superseded attempt {}", attempt);
            return;
        }
        connection = null;
        if (target == null) {
            transitionTo(TransportState.DISCONNECTED);
            return;
        }
        if (!policy.allowsAttempt(reconnectAttempts)) {
            log.warn("[Transport] giving up after {} reconnect attempts: target={}", reconnectAttempts, target);
            transitionTo(TransportState.FAILED);
            return;
        }
        Duration delay = policy.delay(reconnectAttempts);
        reconnectAttempts++;
        log.info("[Transport] connection lost ({}), reconnecting in {} ms (attempt {}/{})",
                error != null ? error.getMessage() : "closed", delay.toMillis(), reconnectAttempts,
                policy.getMaxAttempts());
        transitionTo(TransportState.RECONNECTING);
        pendingReconnect = scheduler.schedule(() -> fireReconnect(attempt), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private synchronized void fireReconnect(long attempt) {
        if (attempt != currentAttempt || state != TransportState.RECONNECTING) {
            return;
        }
        pendingReconnect = null;
        openConnection();
    }

    private synchronized void flushBatch(long attempt) {
        if (attempt != currentAttempt || state != TransportState.OPEN || connection == null) {
            return;
        }
        List<OutboundMessage> batch = queue.takeBatch();
        for (OutboundMessage message : batch) {
            if (!connection.send(message.payload())) {
                log.warn("[Transport] failed to flush queued {} frame", message.type());
            }
        }
        if (!queue.isEmpty()) {
            scheduler.schedule(() -> flushBatch(attempt));
        }
    }

    private void closeCurrent() {
        RealtimeConnection current = connection;
        connection = null;
        // Invalidate callbacks of the attempt being closed.
        currentAttempt++;
        if (current != null) {
            current.close();
        }
    }

    private void cancelPendingReconnect() {
        if (pendingReconnect != null) {
            pendingReconnect.dispose();
            pendingReconnect = null;
        }
    }

    private void transitionTo(TransportState next) {
        if (state == next) {
            return;
        }
        state = next;
        listener.onStateChanged(next);
    }

    private final class AttemptListener implements RealtimeListener {

        private final long attempt;

        private AttemptListener(long attempt) {
            this.attempt = attempt;
        }

        @Override
        public void onOpen(RealtimeConnection opened) {
            handleOpen(attempt, opened);
        }

        @Override
        public void onMessage(String payload) {
            handleMessage(attempt, payload);
        }

        @Override
        public void onClose(Throwable error) {
            handleClose(attempt, error);
        }
    }
}
