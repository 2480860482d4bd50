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
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Case-insensitive substring search over the history of every session.
 *
 * <p>
 * Only user and assistant records are searched. Each match is shown with the
 * neighbouring record on either side from the same session, and long texts are
 * cut to {@value #SNIPPET_LENGTH} characters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchHistoryTool implements ToolComponent {

    public static final String TOOL_NAME = "search_history";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_DAYS = "days";
    private static final String PARAM_MAX_RESULTS = "max_results";
    private static final int DEFAULT_MAX_RESULTS = 10;
    private static final int MAX_RESULTS_LIMIT = 50;
    static final int SNIPPET_LENGTH = 300;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneOffset.UTC);

    private final ConversationStorePort store;
    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_QUERY, Map.of(
                "type", "string",
                "description", "Text to search for (case-insensitive substring match)."));
        properties.put(PARAM_DAYS, Map.of(
                "type", "integer",
                "description", "Only search messages from the last N days. 0 or omitted = all time."));
        properties.put(PARAM_MAX_RESULTS, Map.of(
                "type", "integer",
                "minimum", 1,
                "maximum", MAX_RESULTS_LIMIT,
                "description", "Maximum number of matches to return (default 10, max 50)."));
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Search conversation history across all sessions for a text pattern. "
                        + "Returns matching messages with surrounding context. "
                        + "Use this to recall past conversations, decisions, or facts the user mentioned.")
                .parameters(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Session session, Map<String, Object> arguments) {
        if (!(arguments.get(PARAM_QUERY) instanceof String rawQuery) || rawQuery.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure("Error: query is required"));
        }
        String query = rawQuery.strip();
        int days = Math.max(0, intArgument(arguments.get(PARAM_DAYS), 0));
        int maxResults = Math.min(MAX_RESULTS_LIMIT,
                Math.max(1, intArgument(arguments.get(PARAM_MAX_RESULTS), DEFAULT_MAX_RESULTS)));
        Instant cutoff = days > 0 ? clock.instant().minus(Duration.ofDays(days)) : null;

        return store.listSessions().thenApply(sessionIds -> {
            List<String> blocks = new ArrayList<>();
            String needle = query.toLowerCase(Locale.ROOT);
            for (String sessionId : sessionIds) {
                if (blocks.size() >= maxResults) {
                    break;
                }
                List<Message> history = searchable(store.loadHistory(Session.parse(sessionId)).join(), cutoff);
                for (int i = 0; i < history.size() && blocks.size() < maxResults; i++) {
                    if (history.get(i).getContent().toLowerCase(Locale.ROOT).contains(needle)) {
                        blocks.add(formatMatch(blocks.size() + 1, sessionId, history, i));
                    }
                }
            }
            log.debug("[Memory] History search for '{}' found {} match(es)", query, blocks.size());
            if (blocks.isEmpty()) {
                return ToolResult.success("No matches found for '" + query + "'.");
            }
            return ToolResult.success(String.join("\n", blocks));
        });
    }

    private static List<Message> searchable(List<Message> history, Instant cutoff) {
        List<Message> result = new ArrayList<>(history.size());
        for (Message message : history) {
            if (!message.isUserMessage() && !message.isAssistantMessage()) {
                continue;
            }
            if (message.getContent() == null || message.getContent().isEmpty()) {
                continue;
            }
            if (cutoff != null && (message.getTimestamp() == null || message.getTimestamp().isBefore(cutoff))) {
                continue;
            }
            result.add(message);
        }
        return result;
    }

    private static String formatMatch(int number, String sessionId, List<Message> history, int index) {
        Message match = history.get(index);
        String time = match.getTimestamp() != null ? TIMESTAMP_FORMAT.format(match.getTimestamp()) : "unknown time";
        StringBuilder sb = new StringBuilder();
        sb.append("## Match ").append(number).append(" | Session: ").append(sessionId)
                .append(" | ").append(time).append("\n\n");
        for (int j = Math.max(0, index - 1); j <= Math.min(history.size() - 1, index + 1); j++) {
            Message message = history.get(j);
            String line = message.getRole().toUpperCase(Locale.ROOT) + ": " + snippet(message.getContent());
            sb.append(j == index ? "**" + line + "**" : line).append('\n');
        }
        sb.append("---");
        return sb.toString();
    }

    static String snippet(String content) {
        if (content.length() <= SNIPPET_LENGTH) {
            return content;
        }
        return content.substring(0, SNIPPET_LENGTH) + "...";
    }

    private static int intArgument(Object value, int defaultValue) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }
}
