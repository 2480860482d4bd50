package me.golemcore.agent.domain.service;

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
import me.golemcore.agent.domain.component.ToolComponent;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Name-keyed registry of the tools offered to the model.
 *
 * <p>
 * Dispatch never throws: an unknown name, a tool that throws, and a tool whose
 * future fails or times out all come back as an error {@link ToolResult} that
 * the model sees as the tool's answer.
 */
@Service
@Slf4j
public class ToolRegistry {

    private static final long TOOL_TIMEOUT_SECONDS = 60;

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    /**
     * Registers every enabled tool bean. A duplicate name fails application
     * startup.
     */
    public ToolRegistry(List<ToolComponent> components) {
        for (ToolComponent component : components) {
            if (!component.isEnabled()) {
                log.debug("[ToolRegistry] Skipping disabled tool: {}", component.getToolName());
                continue;
            }
            register(component);
        }
        log.info("[ToolRegistry] Registered {} tool(s): {}", tools.size(), tools.keySet());
    }

    /**
     * @throws IllegalStateException
     *             if a tool with the same name is already registered; the
     *             existing registration is kept
     */
    public synchronized void register(ToolComponent tool) {
        String name = tool.getToolName();
        if (tools.containsKey(name)) {
            throw new IllegalStateException("Tool already registered: " + name);
        }
        tools.put(name, tool);
    }

    public synchronized ToolComponent get(String name) {
        return tools.get(name);
    }

    public synchronized List<ToolDefinition> definitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (ToolComponent tool : tools.values()) {
            ToolDefinition definition = tool.getDefinition();
            definitions.add(ToolDefinition.builder()
                    .name(definition.getName())
                    .description(definition.getDescription())
                    .parameters(definition.getParameters())
                    .build());
        }
        return definitions;
    }

    public ToolResult execute(String name, String callId, Map<String, Object> arguments) {
        return execute(null, name, callId, arguments);
    }

    /**
     * Executes a tool call on behalf of a session and stamps the call id on the
     * result.
     */
    public ToolResult execute(Session session, String name, String callId, Map<String, Object> arguments) {
        ToolComponent tool = get(name);
        if (tool == null) {
            log.warn("[ToolRegistry] Model requested unknown tool: {}", name);
            return ToolResult.failure("Error: unknown tool '" + name + "'").withToolCallId(callId);
        }

        Map<String, Object> args = arguments != null ? arguments : Map.of();
        try {
            ToolResult result = tool.execute(session, args).get(TOOL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (result == null) {
                return ToolResult.failure("Error: tool '" + name + "' returned no result").withToolCallId(callId);
            }
            return result.withToolCallId(callId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure("Error: tool '" + name + "' was interrupted").withToolCallId(callId);
        } catch (TimeoutException e) {
            log.warn("[ToolRegistry] Tool '{}' timed out after {}s", name, TOOL_TIMEOUT_SECONDS);
            return ToolResult.failure("Error: tool '" + name + "' timed out").withToolCallId(callId);
        } catch (ExecutionException e) {
            log.error("[ToolRegistry] Tool execution failed: {}", name, e.getCause());
            return ToolResult.failure("Error: " + safeCauseMessage(e)).withToolCallId(callId);
        } catch (RuntimeException e) {
            log.error("[ToolRegistry] Tool execution failed: {}", name, e);
            return ToolResult.failure("Error: " + safeCauseMessage(e)).withToolCallId(callId);
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
