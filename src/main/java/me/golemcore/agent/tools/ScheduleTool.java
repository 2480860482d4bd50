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
import me.golemcore.agent.domain.model.ScheduledJob;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.service.ScheduledJobService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lets the model manage scheduled jobs: add, list, remove, enable and
 * disable. New jobs deliver to the calling session unless another target
 * session is given.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScheduleTool implements ToolComponent {

    public static final String TOOL_NAME = "schedule";

    private static final String OP_ADD = "add";
    private static final String OP_LIST = "list";
    private static final String OP_REMOVE = "remove";
    private static final String OP_ENABLE = "enable";
    private static final String OP_DISABLE = "disable";

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_ID = "id";
    private static final String PARAM_NAME = "name";
    private static final String PARAM_MESSAGE = "message";
    private static final String PARAM_SCHEDULE = "schedule";
    private static final String PARAM_TIMEZONE = "timezone";
    private static final String PARAM_CHANNEL = "channel";

    private final ScheduledJobService jobService;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_OPERATION, Map.of(
                "type", "string",
                "enum", List.of(OP_ADD, OP_LIST, OP_REMOVE, OP_ENABLE, OP_DISABLE),
                "description", "Job operation to perform"));
        properties.put(PARAM_ID, Map.of("type", "string", "description", "Job id for remove/enable/disable"));
        properties.put(PARAM_NAME, Map.of("type", "string", "description", "Human-readable job name"));
        properties.put(PARAM_MESSAGE, Map.of("type", "string", "description", "Message text sent when the job fires"));
        properties.put(PARAM_SCHEDULE, Map.of(
                "type", "string",
                "description", "Cron expression (e.g. '0 9 * * *') or interval form ('every 3600', seconds)"));
        properties.put(PARAM_TIMEZONE, Map.of("type", "string", "description", "Timezone for cron schedules (default UTC)"));
        properties.put(PARAM_CHANNEL, Map.of(
                "type", "string",
                "description", "Target session id, e.g. 'matrix:@user:matrix.org'. Defaults to the current session."));

        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Manage scheduled jobs: add, list, remove, enable, disable.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.of(PARAM_OPERATION)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Session session, Map<String, Object> arguments) {
        String operation = stringArgument(arguments, PARAM_OPERATION);
        if (operation == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Error: operation is required"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return switch (operation) {
                case OP_ADD -> addJob(session, arguments);
                case OP_LIST -> ToolResult.success(ScheduledJobService.formatJobs(jobService.listJobs()));
                case OP_REMOVE -> removeJob(arguments);
                case OP_ENABLE -> setEnabled(arguments, true);
                case OP_DISABLE -> setEnabled(arguments, false);
                default -> ToolResult.failure("Error: unknown operation '" + operation + "'");
                };
            } catch (IllegalArgumentException e) {
                return ToolResult.failure("Error: " + e.getMessage());
            }
        });
    }

    private ToolResult addJob(Session session, Map<String, Object> arguments) {
        String channel = stringArgument(arguments, PARAM_CHANNEL);
        if (channel == null) {
            channel = session != null ? session.id() : ScheduledJob.DEFAULT_CHANNEL;
        }
        ScheduledJob job = jobService.addJob(
                stringArgument(arguments, PARAM_NAME),
                stringArgument(arguments, PARAM_MESSAGE),
                stringArgument(arguments, PARAM_SCHEDULE),
                stringArgument(arguments, PARAM_TIMEZONE),
                channel,
                true);
        return ToolResult.success("OK: created cron job id=" + job.getId());
    }

    private ToolResult removeJob(Map<String, Object> arguments) {
        String id = stringArgument(arguments, PARAM_ID);
        if (id == null) {
            return ToolResult.failure("Error: id is required");
        }
        if (!jobService.removeJob(id)) {
            return ToolResult.failure("Error: job '" + id + "' not found");
        }
        return ToolResult.success("OK: removed cron job id=" + id);
    }

    private ToolResult setEnabled(Map<String, Object> arguments, boolean enabled) {
        String id = stringArgument(arguments, PARAM_ID);
        if (id == null) {
            return ToolResult.failure("Error: id is required");
        }
        if (!jobService.setEnabled(id, enabled)) {
            return ToolResult.failure("Error: job '" + id + "' not found");
        }
        return ToolResult.success("OK: " + (enabled ? "enabled" : "disabled") + " cron job id=" + id);
    }

    private static String stringArgument(Map<String, Object> arguments, String key) {
        if (arguments.get(key) instanceof String value && !value.isBlank()) {
            return value.trim();
        }
        return null;
    }
}
