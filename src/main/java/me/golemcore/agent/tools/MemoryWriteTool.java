package me.golemcore.agent.tools;

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
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Replaces the global memory document. The document is shown in every future
 * session under "## Your Memory", so the model is told to merge before it
 * writes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MemoryWriteTool implements ToolComponent {

    public static final String TOOL_NAME = "memory_write";

    private static final String PARAM_CONTENT = "content";

    private final ConversationStorePort store;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Update your global long-term memory document. "
                        + "This document is visible in every future session under '## Your Memory'. "
                        + "Use it for user preferences, ongoing projects and key facts. "
                        + "The content REPLACES the current document, so merge with the existing content first. "
                        + "Keep the document under ~300 words.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", Map.of(PARAM_CONTENT, Map.of(
                                "type", "string",
                                "description", "The full new content for the memory document (Markdown).")),
                        "required", List.of(PARAM_CONTENT)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Session session, Map<String, Object> arguments) {
        if (!(arguments.get(PARAM_CONTENT) instanceof String content)) {
            return CompletableFuture.completedFuture(ToolResult.failure("Error: content is required"));
        }
        return store.saveGlobalMemory(content)
                .thenApply(ignored -> {
                    log.info("[Memory] Global memory replaced ({} chars)", content.length());
                    return ToolResult.success("Memory updated successfully.");
                });
    }
}
