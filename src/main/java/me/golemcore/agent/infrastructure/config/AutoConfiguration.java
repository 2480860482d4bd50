package me.golemcore.agent.infrastructure.config;

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
import me.golemcore.agent.domain.loop.ChannelDispatcher;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans and startup sequence.
 *
 * <p>
 * On startup the configuration is validated, the workspace and model provider
 * are logged, and every channel enabled under
 * {@code bot.channels.<type>.enabled} is connected to the agent loop.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final LlmPort llmPort;
    private final ChannelDispatcher channelDispatcher;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
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
        properties.validate();
        log.info("GolemCore Agent starting...");
        log.info("LLM Provider: {} (available: {})", llmPort.getProviderId(), llmPort.isAvailable());
        log.info("Storage Path: {}", BotProperties.expandUserHome(properties.getStorage().getLocal().getBasePath()));
        log.info("Consolidation threshold: {}, keep recent: {}",
                properties.getMemory().getConsolidationThreshold(), properties.getMemory().getKeepRecent());

        channelDispatcher.startEnabledChannels();
        log.info("GolemCore Agent started successfully");
    }
}
