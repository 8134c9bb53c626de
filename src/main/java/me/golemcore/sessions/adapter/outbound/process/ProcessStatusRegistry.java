package me.golemcore.sessions.adapter.outbound.process;

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
import me.golemcore.sessions.domain.model.AgentActivityChangedEvent;
import me.golemcore.sessions.domain.model.AgentProcessExitedEvent;
import me.golemcore.sessions.domain.model.AgentProcessStartedEvent;
import me.golemcore.sessions.port.outbound.SessionStatusPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers process status queries from the lifecycle events published by
 * process supervision.
 */
@Component
@Slf4j
public class ProcessStatusRegistry implements SessionStatusPort {

    private final Map<String, Boolean> alive = new ConcurrentHashMap<>();

    @Override
    public boolean isRunning(String sessionId) {
        return sessionId != null && alive.containsKey(sessionId);
    }

    @Override
    public boolean isWorking(String sessionId) {
        return sessionId != null && Boolean.TRUE.equals(alive.get(sessionId));
    }

    @EventListener
    public void onProcessStarted(AgentProcessStartedEvent event) {
        alive.put(event.sessionId(), Boolean.FALSE);
    }

    @EventListener
    public void onActivityChanged(AgentActivityChangedEvent event) {
        alive.computeIfPresent(event.sessionId(), (key, working) -> event.working());
    }

    @EventListener
    public void onProcessExited(AgentProcessExitedEvent event) {
        if (alive.remove(event.sessionId()) != null) {
            log.debug("[ProcessStatus] process gone: sessionId={}, exitCode={}", event.sessionId(), event.exitCode());
        }
    }
}
