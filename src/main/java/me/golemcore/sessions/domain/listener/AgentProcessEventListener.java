package me.golemcore.sessions.domain.listener;

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
import me.golemcore.sessions.domain.model.AgentActivityChangedEvent;
import me.golemcore.sessions.domain.model.AgentInteractiveRequestEvent;
import me.golemcore.sessions.domain.model.AgentInteractiveRequestResolvedEvent;
import me.golemcore.sessions.domain.model.AgentMessageDispatchedEvent;
import me.golemcore.sessions.domain.model.AgentOutputEvent;
import me.golemcore.sessions.domain.model.AgentProcessExitedEvent;
import me.golemcore.sessions.domain.model.AgentProcessStartedEvent;
import me.golemcore.sessions.domain.model.AgentProcessStartingEvent;
import me.golemcore.sessions.domain.model.AgentProcessStoppingEvent;
import me.golemcore.sessions.domain.model.event.AgentEvent;
import me.golemcore.sessions.domain.service.TranscriptStore;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Applies agent process events published by process supervision to the
 * transcript store.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentProcessEventListener {

    private final TranscriptStore transcriptStore;

    @EventListener
    public void onAgentOutput(AgentOutputEvent event) {
        if (event.events() == null || event.events().isEmpty()) {
            return;
        }
        for (AgentEvent agentEvent : event.events()) {
            transcriptStore.appendClaudeEvent(event.sessionId(), agentEvent);
        }
        transcriptStore.emitSessionSnapshot(event.sessionId());
    }

    @EventListener
    public void onInteractiveRequest(AgentInteractiveRequestEvent event) {
        log.debug("[Agent] interactive request: sessionId={}, requestId={}, tool={}",
                event.sessionId(), event.request().requestId(), event.request().toolName());
        transcriptStore.setPendingInteractiveRequest(event.sessionId(), event.request());
        transcriptStore.emitSessionSnapshot(event.sessionId());
    }

    @EventListener
    public void onInteractiveRequestResolved(AgentInteractiveRequestResolvedEvent event) {
        transcriptStore.clearPendingInteractiveRequestIfMatches(event.sessionId(), event.requestId());
    }

    @EventListener
    public void onMessageDispatched(AgentMessageDispatchedEvent event) {
        transcriptStore.commitSentUserMessage(event.sessionId(), event.message(), true);
    }

    @EventListener
    public void onProcessStarting(AgentProcessStartingEvent event) {
        transcriptStore.markStarting(event.sessionId());
    }

    @EventListener
    public void onProcessStarted(AgentProcessStartedEvent event) {
        transcriptStore.markRunning(event.sessionId(), false);
    }

    @EventListener
    public void onActivityChanged(AgentActivityChangedEvent event) {
        transcriptStore.markRunning(event.sessionId(), event.working());
    }

    @EventListener
    public void onProcessStopping(AgentProcessStoppingEvent event) {
        transcriptStore.markStopping(event.sessionId());
    }

    @EventListener
    public void onProcessExited(AgentProcessExitedEvent event) {
        transcriptStore.markProcessExit(event.sessionId(), event.exitCode());
    }
}
