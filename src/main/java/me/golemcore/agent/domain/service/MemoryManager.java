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
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.Skill;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.outbound.ConversationStorePort;
import me.golemcore.agent.port.outbound.SkillsPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Assembles the per-turn model context and keeps session history bounded.
 *
 * <p>
 * Each session has a consolidation cursor: the number of history records
 * already folded into the session summary. Records after the cursor are
 * "unconsolidated" and sent to the model verbatim. When there are more of them
 * than {@code bot.memory.consolidation-threshold}, all but the most recent
 * {@code keepRecent} are summarized, oldest first and at most
 * {@code bot.memory.max-consolidation-window} per turn, and the cursor moves
 * forward past them.
 *
 * <p>
 * The system message is composed as:
 * <ol>
 * <li>base prompt</li>
 * <li>{@code ## Your Memory} - global memory document, if non-empty</li>
 * <li>{@code ## Conversation Summary} - session summary, if non-empty</li>
 * <li>skills index and always-on skill bodies</li>
 * <li>consolidation warning when the session is close to the threshold</li>
 * </ol>
 */
@Service
@Slf4j
public class MemoryManager {

    static final String MEMORY_HEADING = "## Your Memory";
    static final String SUMMARY_HEADING = "## Conversation Summary";
    static final String CONSOLIDATION_WARNING = """
            ## Memory Notice
            Older messages in this conversation will soon be summarized and removed from your context. \
            If anything in them must be remembered exactly, save it now with the memory_write tool.""";

    private static final String ASSISTANT_SENDER = "assistant";
    // two turns, each a user record plus an assistant record
    private static final int WARNING_MARGIN = 4;

    private final ConversationStorePort store;
    private final ConsolidationService consolidationService;
    private final SkillsPort skillsPort;
    private final BotProperties properties;
    private final Clock clock;

    private final Set<String> unscopedOwners = new HashSet<>();
    private final Set<String> scopedOwners = new HashSet<>();

    public MemoryManager(ConversationStorePort store, ConsolidationService consolidationService,
            SkillsPort skillsPort, BotProperties properties, Clock clock) {
        this.store = store;
        this.consolidationService = consolidationService;
        this.skillsPort = skillsPort;
        this.properties = properties;
        this.clock = clock;
        for (BotProperties.OwnerAlias alias : properties.getMemory().getOwnerAliases()) {
            if (alias.getAddress() == null || alias.getAddress().isBlank()) {
                continue;
            }
            if (alias.getChannel() == null || alias.getChannel().isBlank()) {
                unscopedOwners.add(alias.getAddress());
            } else {
                scopedOwners.add(scopedKey(alias.getAddress(), alias.getChannel()));
            }
        }
    }

    /**
     * Builds {@code [system] + history + [user]} for one turn, consolidating the
     * session first when its unconsolidated history exceeds the threshold.
     */
    public List<Message> buildContext(Session session, String systemPrompt, String userMessage) {
        CompletableFuture<String> memoryFuture = store.loadGlobalMemory();
        CompletableFuture<String> summaryFuture = store.loadSessionSummary(session);
        CompletableFuture<Integer> cursorFuture = store.loadConsolidatedCursor(session);
        CompletableFuture<Integer> countFuture = store.countMessages(session);
        CompletableFuture.allOf(memoryFuture, summaryFuture, cursorFuture, countFuture).join();

        String globalMemory = memoryFuture.join();
        String summary = summaryFuture.join();
        int total = countFuture.join();
        int cursor = Math.min(cursorFuture.join(), total);
        int unconsolidated = total - cursor;

        BotProperties.MemoryProperties memory = properties.getMemory();
        int threshold = memory.getConsolidationThreshold();

        List<Message> history;
        if (unconsolidated > threshold && consolidationService.isAvailable()) {
            ConsolidationOutcome outcome = consolidate(session, total, cursor, summary);
            history = outcome.history();
            cursor = outcome.cursor();
            summary = outcome.summary();
        } else {
            // Without a model the backlog stays unconsolidated; only a threshold-sized tail is shown
            history = store.loadHistory(session, Math.min(unconsolidated, threshold + 1)).join();
        }

        boolean warn = total - cursor >= threshold - WARNING_MARGIN;
        String system = composeSystemPrompt(systemPrompt, globalMemory, summary, warn);

        List<Message> messages = new ArrayList<>(history.size() + 2);
        messages.add(Message.system(system));
        for (Message message : history) {
            messages.add(label(message));
        }
        messages.add(Message.user(userMessage));
        log.debug("[Memory] Context for {}: {} history messages, cursor {}/{}",
                session, history.size(), cursor, total);
        return messages;
    }

    /**
     * Appends the user turn and then the assistant turn to session history. The
     * assistant turn is written even when the reply is empty.
     */
    public void persistExchange(Session session, String userMessage, String assistantReply) {
        Message user = Message.builder()
                .role(Message.ROLE_USER)
                .content(userMessage)
                .channel(session.channel())
                .senderId(session.senderId())
                .timestamp(clock.instant())
                .build();
        Message assistant = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(assistantReply != null ? assistantReply : "")
                .channel(session.channel())
                .senderId(ASSISTANT_SENDER)
                .timestamp(clock.instant())
                .build();
        store.appendMessage(session, user)
                .thenCompose(ignored -> store.appendMessage(session, assistant))
                .join();
    }

    /**
     * Summarizes the oldest unconsolidated records, from the cursor up to at most
     * {@code maxConsolidationWindow} records and never into the newest
     * {@code keepRecent}. The cursor advances only past what was summarized, so
     * a larger backlog drains over several turns.
     */
    private ConsolidationOutcome consolidate(Session session, int total, int cursor, String priorSummary) {
        BotProperties.MemoryProperties memory = properties.getMemory();
        int keepRecent = memory.getKeepRecent();
        int eligibleCount = Math.min(total - keepRecent - cursor, memory.getMaxConsolidationWindow());

        CompletableFuture<List<Message>> eligibleFuture = store.loadHistoryRange(session, cursor, eligibleCount);
        CompletableFuture<List<Message>> tailFuture = store.loadHistory(session, keepRecent);
        List<Message> eligible = eligibleFuture.join();
        List<Message> tail = List.copyOf(tailFuture.join());
        if (eligible.isEmpty()) {
            return new ConsolidationOutcome(tail, cursor, priorSummary);
        }

        String addition;
        try {
            addition = consolidationService.summarize(eligible);
        } catch (RuntimeException e) {
            log.warn("[Memory] Consolidation of {} failed: {}", session, e.getMessage());
            addition = null;
        }
        if (addition == null) {
            return new ConsolidationOutcome(tail, cursor, priorSummary);
        }

        String merged = consolidationService.merge(priorSummary, addition);
        int newCursor = cursor + eligible.size();
        try {
            store.saveSessionSummary(session, merged).join();
            store.saveConsolidatedCursor(session, newCursor).join();
        } catch (RuntimeException e) {
            // Cursor stays put, so the same range is summarized again next time
            log.warn("[Memory] Failed to save consolidation state for {}: {}", session, e.getMessage());
            return new ConsolidationOutcome(tail, cursor, priorSummary);
        }
        int remaining = total - keepRecent - newCursor;
        if (remaining > 0) {
            log.info("[Memory] Consolidated {} messages of {}, cursor {} -> {}, {} left for later turns",
                    eligible.size(), session, cursor, newCursor, remaining);
        } else {
            log.info("[Memory] Consolidated {} messages of {}, cursor {} -> {}",
                    eligible.size(), session, cursor, newCursor);
        }
        return new ConsolidationOutcome(tail, newCursor, store.loadSessionSummary(session).join());
    }

    private String composeSystemPrompt(String basePrompt, String globalMemory, String summary, boolean warn) {
        StringBuilder sb = new StringBuilder(basePrompt != null ? basePrompt : "");
        if (globalMemory != null && !globalMemory.isBlank()) {
            sb.append("\n\n").append(MEMORY_HEADING).append("\n\n").append(globalMemory.strip());
        }
        if (summary != null && !summary.isBlank()) {
            sb.append("\n\n").append(SUMMARY_HEADING).append("\n\n").append(summary.strip());
        }
        appendSkills(sb);
        if (warn) {
            sb.append("\n\n").append(CONSOLIDATION_WARNING);
        }
        return sb.toString();
    }

    private void appendSkills(StringBuilder sb) {
        if (skillsPort == null) {
            return;
        }
        List<Skill> skills = skillsPort.listSkills();
        if (skills.isEmpty()) {
            return;
        }
        sb.append("\n\n").append(SkillsXml.render(skills));
        for (Skill skill : skills) {
            if (skill.isAlways() && skill.isAvailable()) {
                String body = skillsPort.loadSkillBody(skill.getName());
                if (body != null && !body.isBlank()) {
                    sb.append("\n\n").append(body.strip());
                }
            }
        }
    }

    /**
     * Prefixes a history message with {@code [channel / label]} so the model can
     * tell senders apart. Messages without a channel are returned as is.
     */
    Message label(Message message) {
        if (message.getChannel() == null) {
            return message;
        }
        String sender = message.getSenderId();
        String label;
        if (ASSISTANT_SENDER.equals(sender)) {
            label = ASSISTANT_SENDER;
        } else if (isOwner(sender, message.getChannel())) {
            label = "owner";
        } else {
            label = sender != null ? sender : "unknown";
        }
        String content = message.getContent() != null ? message.getContent() : "";
        return message.toBuilder()
                .content("[" + message.getChannel() + " / " + label + "]\n" + content)
                .build();
    }

    private boolean isOwner(String senderId, String channel) {
        if (senderId == null) {
            return false;
        }
        return scopedOwners.contains(scopedKey(senderId, channel)) || unscopedOwners.contains(senderId);
    }

    private static String scopedKey(String address, String channel) {
        return channel + "\u0000" + address;
    }

    private record ConsolidationOutcome(List<Message> history, int cursor, String summary) {
    }
}
