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
import me.golemcore.sessions.domain.model.LastExit;
import me.golemcore.sessions.domain.model.ProcessState;
import me.golemcore.sessions.domain.model.SessionActivity;
import me.golemcore.sessions.domain.model.SessionPhase;
import me.golemcore.sessions.domain.model.SessionRuntime;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Derives a session's runtime state from process lifecycle signals.
 */
@Component
@RequiredArgsConstructor
public class SessionRuntimeTracker {

    private final Clock clock;

    public SessionRuntime initial() {
        return SessionRuntime.builder()
                .phase(SessionPhase.IDLE)
                .processState(ProcessState.STOPPED)
                .activity(SessionActivity.IDLE)
                .updatedAt(now())
                .build();
    }

    /**
     * Runtime seeded from status queries. A live process is running; a stopped
     * one is idle unless its last exit was unexpected.
     */
    public SessionRuntime fromStatus(boolean alive, boolean working, LastExit lastExit) {
        SessionPhase phase;
        if (alive) {
            phase = SessionPhase.RUNNING;
        } else if (lastExit == null || !lastExit.unexpected()) {
            phase = SessionPhase.IDLE;
        } else {
            phase = SessionPhase.ERROR;
        }
        return SessionRuntime.builder()
                .phase(phase)
                .processState(alive ? ProcessState.ALIVE : ProcessState.STOPPED)
                .activity(working ? SessionActivity.WORKING : SessionActivity.IDLE)
                .lastExit(lastExit)
                .updatedAt(now())
                .build();
    }

    /**
     * Runtime after the process terminated. Exit code {@code 0} is a clean stop;
     * anything else, including an unknown code, is unexpected.
     */
    public SessionRuntime afterExit(Integer exitCode) {
        LastExit lastExit = LastExit.of(exitCode, now());
        return SessionRuntime.builder()
                .phase(lastExit.unexpected() ? SessionPhase.ERROR : SessionPhase.IDLE)
                .processState(ProcessState.STOPPED)
                .activity(SessionActivity.IDLE)
                .lastExit(lastExit)
                .updatedAt(now())
                .build();
    }

    /**
     * Applies a transition, keeping the previous {@code lastExit}.
     */
    public SessionRuntime transition(SessionRuntime current, SessionPhase phase, ProcessState processState,
            SessionActivity activity) {
        return SessionRuntime.builder()
                .phase(phase)
                .processState(processState)
                .activity(activity)
                .lastExit(current != null ? current.lastExit() : null)
                .updatedAt(now())
                .build();
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
