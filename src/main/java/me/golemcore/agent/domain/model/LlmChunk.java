package me.golemcore.agent.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One event of a model response stream: either a text fragment or the terminal
 * batch of tool calls (optionally with the reasoning text that produced them).
 */
@Data
@Builder
public class LlmChunk {

    private String text;
    private List<Message.ToolCall> toolCalls;
    private String reasoning;

    public static LlmChunk text(String text) {
        return LlmChunk.builder().text(text).build();
    }

    public static LlmChunk toolCalls(List<Message.ToolCall> toolCalls) {
        return LlmChunk.builder().toolCalls(toolCalls).build();
    }

    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
