package me.golemcore.sessions.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration shared by the session synchronization service.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} used for transcript and runtime
 * timestamps</li>
 * <li>Provides the {@link ObjectMapper} for wire frames and persisted logs,
 * writing timestamps as ISO-8601 strings and ignoring unknown fields</li>
 * <li>Logs startup information (version, projects directory, WebSocket path,
 * queue limit) via {@code @PostConstruct}</li>
 * </ul>
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class SessionsAutoConfiguration {

    private final SessionsProperties properties;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Sessions v{} starting...", version);
        log.info("Projects Dir: {}", properties.getHistory().getProjectsDir());
        log.info("WebSocket Path: {}", properties.getWebsocket().getPath());
        log.info("Queue Max Size: {}, Rehydrate On Exit: {}", properties.getQueue().getMaxSize(),
                properties.getTranscript().isRehydrateOnExit());
    }
}
