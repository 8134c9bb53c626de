package me.golemcore.sessions.adapter.outbound.history;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.sessions.domain.model.HistoryRecord;
import me.golemcore.sessions.infrastructure.config.SessionsProperties;
import me.golemcore.sessions.port.outbound.SessionHistoryPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Reads the JSONL log the agent CLI keeps for each of its sessions.
 *
 * <p>
 * Logs live under the configured projects directory, in a folder named after
 * the working directory with every non-alphanumeric character replaced by
 * {@code -}. A missing log is an empty history; blank and malformed lines are
 * skipped.
 * </p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlSessionHistoryAdapter implements SessionHistoryPort {

    private static final int LOGGED_LINE_PREFIX = 100;

    private final SessionsProperties properties;
    private final HistoryLineParser lineParser;

    @Override
    public CompletableFuture<List<HistoryRecord>> loadHistory(String externalSessionId, String workingDir) {
        return CompletableFuture.supplyAsync(() -> {
            Path logPath = resolveLogPath(externalSessionId, workingDir);
            List<String> lines;
            try {
                lines = Files.readAllLines(logPath, StandardCharsets.UTF_8);
            } catch (NoSuchFileException e) {
                log.debug("[History] no log for session {} at {}", externalSessionId, logPath);
                return List.of();
            } catch (IOException e) {
                throw new HistoryReadException("Failed to read session log: " + logPath, e);
            }
            List<HistoryRecord> records = parseLines(externalSessionId, lines);
            log.debug("[History] read {} entries for session {}", records.size(), externalSessionId);
            return records;
        });
    }

    Path resolveLogPath(String externalSessionId, String workingDir) {
        return Paths.get(properties.getHistory().getProjectsDir())
                .resolve(encodeWorkingDir(workingDir))
                .resolve(externalSessionId + ".jsonl");
    }

    static String encodeWorkingDir(String workingDir) {
        return workingDir != null ? workingDir.replaceAll("[^a-zA-Z0-9]", "-") : "";
    }

    private List<HistoryRecord> parseLines(String externalSessionId, List<String> lines) {
        List<HistoryRecord> records = new ArrayList<>();
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                Optional<HistoryRecord> record = lineParser.parse(line);
                if (record.isPresent()) {
                    records.add(record.get());
                } else {
                    log.warn("[History] Skipping invalid entry in session {}: {}", externalSessionId, abbreviate(line));
                }
            } catch (JsonProcessingException e) {
                log.warn("[History] Skipping malformed line in session {}: {}", externalSessionId, abbreviate(line));
            }
        }
        return records;
    }

    private static String abbreviate(String line) {
        return line.length() > LOGGED_LINE_PREFIX ? line.substring(0, LOGGED_LINE_PREFIX) : line;
    }
}
