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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A single conversation message. Persisted one-per-line in the session history
 * log and sent to the model as part of the turn context.
 *
 * <p>
 * Messages are treated as immutable once appended to history: consumers that
 * need a variant (e.g. a labelled copy for display to the model) build a new
 * instance with {@link #toBuilder()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private static final Set<String> KNOWN_ROLES = Set.of(ROLE_SYSTEM, ROLE_USER, ROLE_ASSISTANT, ROLE_TOOL);

    private String role;
    private String content;
    private List<ToolCall> toolCalls;
    private String toolCallId; // set when role == tool
    private Instant timestamp;
    private String channel;
    private String senderId;

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    @JsonIgnore
    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    @JsonIgnore
    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    @JsonIgnore
    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    @JsonIgnore
    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Structural validity check applied to decoded history records. A record with
     * an unknown role, or a tool message without the call id it answers, is
     * treated like a malformed line.
     */
    @JsonIgnore
    public boolean isWellFormed() {
        if (role == null || !KNOWN_ROLES.contains(role)) {
            return false;
        }
        return !isToolMessage() || (toolCallId != null && !toolCallId.isBlank());
    }

    /**
     * A tool invocation requested by the model. The id is unique per call within
     * a turn and is echoed back on the answering tool message.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
