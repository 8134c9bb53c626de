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
import me.golemcore.sessions.infrastructure.config.SessionsProperties;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Bounded FIFO of frames sent while disconnected. When full, the oldest frame
 * is dropped. Time-sensitive frames (stop, interrupt) are discarded before a
 * flush since they only meant something at the moment they were sent.
 */
@Slf4j
public class OutboundMessageQueue {

    private final int maxSize;
    private final int batchSize;
    private final Set<String> timeSensitiveTypes;
    private final Deque<OutboundMessage> queue = new ArrayDeque<>();

    public OutboundMessageQueue(int maxSize, int batchSize, Set<String> timeSensitiveTypes) {
        if (maxSize <= 0 || batchSize <= 0) {
            throw new IllegalArgumentException("maxSize and batchSize must be positive");
        }
        this.maxSize = maxSize;
        this.batchSize = batchSize;
        this.timeSensitiveTypes = Set.copyOf(timeSensitiveTypes);
    }

    public static OutboundMessageQueue from(SessionsProperties.OutboundProperties properties) {
        return new OutboundMessageQueue(properties.getMaxQueueSize(), properties.getFlushBatchSize(),
                Set.copyOf(properties.getTimeSensitiveTypes()));
    }

    public synchronized void offer(OutboundMessage message) {
        if (queue.size() >= maxSize) {
            OutboundMessage dropped = queue.pollFirst();
            log.debug("[Transport] outbound queue full, dropped oldest {}", dropped != null ? dropped.type() : null);
        }
        queue.addLast(message);
    }

    /**
     * @return number of discarded frames
     */
    public synchronized int discardTimeSensitive() {
        int before = queue.size();
        queue.removeIf(message -> message.type() != null && timeSensitiveTypes.contains(message.type()));
        return before - queue.size();
    }

    /**
     * Removes and returns up to one batch from the head of the queue.
     */
    public synchronized List<OutboundMessage> takeBatch() {
        List<OutboundMessage> batch = new ArrayList<>(Math.min(batchSize, queue.size()));
        while (batch.size() < batchSize && !queue.isEmpty()) {
            batch.add(queue.pollFirst());
        }
        return batch;
    }

    public synchronized int size() {
        return queue.size();
    }

    public synchronized boolean isEmpty() {
        return queue.isEmpty();
    }

    public synchronized void clear() {
        queue.clear();
    }
}
