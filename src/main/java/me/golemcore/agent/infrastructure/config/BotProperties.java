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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.yml.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - base prompt, tool round ceiling, typing
 * keepalive</li>
 * <li>{@link StorageProperties} - workspace location and history tail-scan
 * block size</li>
 * <li>{@link MemoryProperties} - consolidation threshold, tail window, summary
 * budget, owner aliases</li>
 * <li>{@link SkillsProperties} - skill discovery directory</li>
 * <li>{@link ChannelProperties} - per-channel enablement</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private AgentProperties agent = new AgentProperties();
    private StorageProperties storage = new StorageProperties();
    private MemoryProperties memory = new MemoryProperties();
    private SkillsProperties skills = new SkillsProperties();
    private Map<String, ChannelProperties> channels = new HashMap<>();

    @Data
    public static class AgentProperties {
        private String systemPrompt = "You are a helpful personal assistant.";
        /** Max tool-call rounds for one inbound message. */
        private int maxToolRounds = 20;
        private long typingIntervalSeconds = 4;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        /** Block size used when scanning history logs backwards. */
        private int historyBlockSize = 8192;
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/agent";
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /**
         * Unconsolidated history length above which the oldest messages are
         * summarized.
         */
        private int consolidationThreshold = 100;

        /** Fraction of the threshold always kept verbatim (minimum one message). */
        private double keepRecentRatio = 0.2;

        /** Word budget of the session summary; oldest paragraphs are dropped first. */
        private int summaryMaxWords = 600;

        /** Max records summarized in one consolidation pass; larger backlogs drain over several turns. */
        private int maxConsolidationWindow = 1000;

        private long summaryTimeoutMs = 60_000;

        private List<OwnerAlias> ownerAliases = new ArrayList<>();

        /**
         * Number of history messages kept verbatim after consolidation.
         */
        public int getKeepRecent() {
            return Math.max(1, (int) (consolidationThreshold * keepRecentRatio));
        }
    }

    /**
     * Address identifying the owner, optionally scoped to one channel.
     */
    @Data
    public static class OwnerAlias {
        private String address;
        private String channel;
    }

    @Data
    public static class SkillsProperties {
        private String directory = "${user.home}/.golemcore/agent/skills";
    }

    @Data
    public static class ChannelProperties {
        private boolean enabled = false;
    }

    /**
     * Resolves a {@code ${user.home}} placeholder in configured paths.
     */
    public static String expandUserHome(String path) {
        return path.replace("${user.home}", System.getProperty("user.home"));
    }

    /**
     * Fails fast on settings that would break consolidation or loop termination.
     */
    public void validate() {
        if (agent.getMaxToolRounds() <= 0) {
            throw new IllegalStateException("bot.agent.max-tool-rounds must be > 0");
        }
        if (memory.getConsolidationThreshold() <= 0) {
            throw new IllegalStateException("bot.memory.consolidation-threshold must be > 0");
        }
        if (memory.getKeepRecentRatio() <= 0 || memory.getKeepRecentRatio() >= 1) {
            throw new IllegalStateException("bot.memory.keep-recent-ratio must be in (0, 1)");
        }
        if (memory.getSummaryMaxWords() <= 0) {
            throw new IllegalStateException("bot.memory.summary-max-words must be > 0");
        }
        if (memory.getMaxConsolidationWindow() <= memory.getKeepRecent()) {
            throw new IllegalStateException("bot.memory.max-consolidation-window must be greater than keepRecent ("
                    + memory.getKeepRecent() + ")");
        }
        if (storage.getHistoryBlockSize() <= 0) {
            throw new IllegalStateException("bot.storage.history-block-size must be > 0");
        }
    }
}
