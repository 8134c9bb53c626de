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

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Deduplicates concurrent asynchronous operations by key.
 *
 * <p>
 * While an operation for a key is in flight, every further caller for that key
 * receives the same pending outcome instead of starting a second operation.
 * The key is released as soon as the operation settles, successfully or not.
 * An operation that throws before returning its future is reported as a failed
 * outcome and releases the key the same way.
 * </p>
 *
 * @param <K>
 *            key type
 * @param <V>
 *            result type
 */
@Slf4j
public class ExclusiveOperationGuard<K, V> {

    private final String name;
    private final Map<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

    public ExclusiveOperationGuard(String name) {
        this.name = name;
    }

    /**
     * Runs {@code operation} for {@code key} unless one is already in flight, in
     * which case the in-flight outcome is shared.
     *
     * @return a future completing with the operation's outcome; callers cannot
     *         complete the shared outcome themselves
     */
    public CompletableFuture<V> run(K key, Supplier<? extends CompletableFuture<? extends V>> operation) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operation, "operation");

        CompletableFuture<V> shared = new CompletableFuture<>();
        CompletableFuture<V> existing = inFlight.putIfAbsent(key, shared);
        if (existing != null) {
            log.debug("[{}] joining in-flight operation: key={}", name, key);
            return existing.copy();
        }

        CompletableFuture<? extends V> started;
        try {
            started = operation.get();
            if (started == null) {
                throw new IllegalStateException("Operation returned no future for key " + key);
            }
        } catch (RuntimeException e) { // NOSONAR - synchronous failures become a failed outcome
            inFlight.remove(key, shared);
            shared.completeExceptionally(e);
            return shared.copy();
        }

        started.whenComplete((result, error) -> {
            inFlight.remove(key, shared);
            if (error != null) {
                shared.completeExceptionally(error);
            } else {
                shared.complete(result);
            }
        });
        return shared.copy();
    }

    public boolean isInFlight(K key) {
        return inFlight.containsKey(key);
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
