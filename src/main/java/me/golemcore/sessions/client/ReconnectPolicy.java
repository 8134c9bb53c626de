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

import me.golemcore.sessions.infrastructure.config.SessionsProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter:
 * {@code delay(n) = min(maxDelay, baseDelay * 2^n) * (1 + jitter * r)} where
 * {@code r} is uniform in {@code [0, 1)}.
 */
public class ReconnectPolicy {

    private static final int MAX_EXPONENT = 30;

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final int maxAttempts;
    private final DoubleSupplier random;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay, double jitter, int maxAttempts,
            DoubleSupplier random) {
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Invalid delays: base=" + baseDelay + ", max=" + maxDelay);
        }
        if (jitter < 0) {
            throw new IllegalArgumentException("jitter must not be negative: " + jitter);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.maxAttempts = maxAttempts;
        this.random = random;
    }

    public static ReconnectPolicy from(SessionsProperties.ReconnectProperties properties) {
        return new ReconnectPolicy(properties.getBaseDelay(), properties.getMaxDelay(), properties.getJitter(),
                properties.getMaxAttempts(), () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param attempt
     *            0-based number of reconnects already scheduled since the last
     *            successful open
     */
    public Duration delay(int attempt) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int exponent = Math.min(Math.max(attempt, 0), MAX_EXPONENT);
        long capped = (long) Math.min(cap, base * Math.pow(2, exponent));
        long withJitter = capped + Math.round(capped * jitter * random.getAsDouble());
        return Duration.ofMillis(withJitter);
    }

    public boolean allowsAttempt(int attempt) {
        return attempt < maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
