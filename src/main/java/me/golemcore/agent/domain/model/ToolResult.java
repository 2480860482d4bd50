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

/**
 * Outcome of a tool execution. Tools produce the content and error flag; the
 * {@code toolCallId} is stamped by the tool registry on dispatch.
 */
@Data
@Builder(toBuilder = true)
public class ToolResult {

    private String toolCallId;
    private String content;
    private boolean error;

    public static ToolResult success(String content) {
        return ToolResult.builder()
                .content(content)
                .error(false)
                .build();
    }

    public static ToolResult failure(String content) {
        return ToolResult.builder()
                .content(content)
                .error(true)
                .build();
    }

    /**
     * Returns a copy bound to the given tool call.
     */
    public ToolResult withToolCallId(String callId) {
        return toBuilder().toolCallId(callId).build();
    }
}
