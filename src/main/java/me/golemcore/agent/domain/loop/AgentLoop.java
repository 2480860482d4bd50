package me.golemcore.agent.domain.loop;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.InboundMessage;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import me.golemcore.agent.domain.model.TurnResult;
import me.golemcore.agent.domain.service.MemoryManager;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.inbound.ChannelPort;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives one inbound message through the model/tool cycle.
 *
 * <p>
 * Each round sends the in-flight context to the model. A reply without tool
 * calls ends the turn; otherwise the assistant's tool-call message and one
 * tool message per call are appended to the in-flight context (not to
 * history) and the next round starts. The turn ends after at most
 * {@code bot.agent.max-tool-rounds} tool rounds.
 *
 * <p>
 * Streaming channels receive every text fragment as it arrives; other channels
 * receive the final reply once. Only the user message and the final reply are
 * persisted. A failed model call ends the turn with an error line and persists
 * nothing.
 */
@Component
@Slf4j
public class AgentLoop {

    public static final String MAX_ROUNDS_MESSAGE = "Error: maximum tool call rounds exceeded.";

    private final MemoryManager memoryManager;
    private final ToolRegistry toolRegistry;
    private final LlmPort llmPort;
    private final BotProperties properties;
    private final ScheduledExecutorService typingExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "typing-indicator");
        t.setDaemon(true);
        return t;
    });

    public AgentLoop(MemoryManager memoryManager, ToolRegistry toolRegistry, LlmPort llmPort,
            BotProperties properties) {
        this.memoryManager = memoryManager;
        this.toolRegistry = toolRegistry;
        this.llmPort = llmPort;
        this.properties = properties;
    }

    @PreDestroy
    public void shutdown() {
        typingExecutor.shutdownNow();
        try {
            typingExecutor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public TurnResult processMessage(ChannelPort channel, InboundMessage inbound) {
        Session session = inbound.getSession();
        String userText = inbound.getText() != null ? inbound.getText() : "";
        Map<String, Object> metadata = inbound.getMetadata() != null ? inbound.getMetadata() : Map.of();
        log.info("[AgentLoop] Turn started for {}", session);

        ScheduledFuture<?> typingTask = startTyping(channel, session);
        try {
            return runTurn(channel, session, userText, metadata);
        } finally {
            typingTask.cancel(false);
            stopTyping(channel, session);
        }
    }

    private TurnResult runTurn(ChannelPort channel, Session session, String userText, Map<String, Object> metadata) {
        String systemPrompt = properties.getAgent().getSystemPrompt();
        List<Message> context;
        try {
            context = new ArrayList<>(memoryManager.buildContext(session, systemPrompt, userText));
        } catch (RuntimeException e) {
            log.warn("[AgentLoop] Context assembly failed for {}, continuing without memory: {}",
                    session, e.getMessage());
            context = new ArrayList<>(List.of(Message.system(systemPrompt), Message.user(userText)));
        }

        List<ToolDefinition> toolDefinitions = toolRegistry.definitions();
        int maxRounds = properties.getAgent().getMaxToolRounds();
        String finalText = "";
        boolean completed = false;
        int toolRounds = 0;

        while (toolRounds < maxRounds) {
            StringBuilder roundText = new StringBuilder();
            List<Message.ToolCall> toolCalls = new ArrayList<>();
            try {
                for (LlmChunk chunk : llmPort.chat(context, toolDefinitions, true).toIterable()) {
                    if (chunk.hasText()) {
                        roundText.append(chunk.getText());
                        if (channel.isStreaming()) {
                            deliver(channel, session, chunk.getText(), metadata);
                        }
                    }
                    if (chunk.hasToolCalls()) {
                        toolCalls.addAll(chunk.getToolCalls());
                    }
                }
            } catch (RuntimeException e) {
                String errorMessage = LlmErrorClassifier.toUserMessage(e);
                log.warn("[AgentLoop] Model call failed for {} ({}): {}", session,
                        LlmErrorClassifier.classify(e), e.getMessage());
                deliver(channel, session, errorMessage, metadata);
                return new TurnResult(errorMessage, toolRounds, TurnResult.Outcome.MODEL_FAILED);
            }

            if (!roundText.isEmpty()) {
                finalText = roundText.toString();
            }
            if (toolCalls.isEmpty()) {
                completed = true;
                break;
            }

            context.add(Message.builder()
                    .role(Message.ROLE_ASSISTANT)
                    .content(roundText.toString())
                    .toolCalls(toolCalls)
                    .build());
            for (Message.ToolCall call : toolCalls) {
                log.debug("[AgentLoop] Executing tool '{}' ({})", call.getName(), call.getId());
                ToolResult result = toolRegistry.execute(session, call.getName(), call.getId(), call.getArguments());
                context.add(Message.builder()
                        .role(Message.ROLE_TOOL)
                        .content(result.getContent())
                        .toolCallId(call.getId())
                        .build());
            }
            toolRounds++;
        }

        TurnResult.Outcome outcome = TurnResult.Outcome.COMPLETED;
        if (!completed) {
            log.warn("[AgentLoop] Tool round limit ({}) reached for {}", maxRounds, session);
            outcome = TurnResult.Outcome.ROUNDS_EXHAUSTED;
            // text from earlier rounds was already streamed
            if (finalText.isEmpty()) {
                finalText = MAX_ROUNDS_MESSAGE;
                if (channel.isStreaming()) {
                    deliver(channel, session, finalText, metadata);
                }
            }
        }

        if (!channel.isStreaming() && !finalText.isEmpty()) {
            deliver(channel, session, finalText, metadata);
        }

        try {
            memoryManager.persistExchange(session, userText, finalText);
        } catch (RuntimeException e) {
            log.warn("[AgentLoop] Failed to persist exchange for {}: {}", session, e.getMessage());
        }

        log.info("[AgentLoop] Turn finished for {}: {} after {} tool round(s)", session, outcome, toolRounds);
        return new TurnResult(finalText, toolRounds, outcome);
    }

    private void deliver(ChannelPort channel, Session session, String text, Map<String, Object> metadata) {
        try {
            channel.send(session, text, metadata).join();
        } catch (RuntimeException e) {
            log.warn("[AgentLoop] Failed to deliver message to {}: {}", session, e.getMessage());
        }
    }

    private ScheduledFuture<?> startTyping(ChannelPort channel, Session session) {
        long interval = Math.max(1, properties.getAgent().getTypingIntervalSeconds());
        return typingExecutor.scheduleAtFixedRate(() -> {
            try {
                channel.sendTyping(session, true);
            } catch (RuntimeException e) {
                log.debug("[AgentLoop] Typing indicator failed for {}: {}", session, e.getMessage());
            }
        }, 0, interval, TimeUnit.SECONDS);
    }

    private void stopTyping(ChannelPort channel, Session session) {
        try {
            channel.sendTyping(session, false);
        } catch (RuntimeException e) {
            log.debug("[AgentLoop] Typing indicator failed for {}: {}", session, e.getMessage());
        }
    }
}
