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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * LLM-powered summarization of consolidated history ranges, plus the rules for
 * folding a new summary into the running session summary.
 *
 * <p>
 * Summaries are sized to their input: roughly one sentence per ten summarized
 * messages, never fewer than five. The running summary is kept under
 * {@code bot.memory.summary-max-words} by dropping its oldest paragraphs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConsolidationService {

    private static final int MIN_SUMMARY_SENTENCES = 5;
    private static final int MESSAGES_PER_SENTENCE = 10;
    private static final String PARAGRAPH_SEPARATOR = "\n\n";
    private static final Pattern PARAGRAPH_SPLIT = Pattern.compile("\\n\\s*\\n");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String SYSTEM_PROMPT = """
            You perform memory consolidation for a personal assistant.
            You receive an excerpt of an older conversation that is about to leave the assistant's context.
            Write a factual summary that lets the assistant continue the conversation without the excerpt.

            Keep, when present:
            - facts the user shared about themselves, people, places and projects
            - decisions, commitments and reminders that were agreed on
            - user preferences and constraints
            - open questions and unfinished tasks

            Write in the language the conversation uses.
            Do NOT include greetings or meta-commentary. Output only the summary.""";

    private final LlmPort llmPort;
    private final BotProperties properties;
    private final Clock clock;

    public boolean isAvailable() {
        return llmPort != null && llmPort.isAvailable();
    }

    /**
     * Summarizes a range of history.
     *
     * @return summary text, or {@code null} when the range has no user or
     *         assistant text, the model fails, or the model returns nothing
     */
    public String summarize(List<Message> messages) {
        String transcript = formatTranscript(messages);
        if (transcript.isBlank()) {
            log.debug("[Consolidation] Nothing to summarize in {} messages", messages.size());
            return null;
        }

        int sentences = Math.max(MIN_SUMMARY_SENTENCES, messages.size() / MESSAGES_PER_SENTENCE);
        List<Message> request = List.of(
                Message.system(SYSTEM_PROMPT),
                Message.user("Summarize the following conversation in at most " + sentences + " sentences.\n\n"
                        + transcript));

        long start = clock.millis();
        String summary;
        try {
            summary = llmPort.chat(request, List.of(), false)
                    .filter(LlmChunk::hasText)
                    .map(LlmChunk::getText)
                    .collect(Collectors.joining())
                    .block(Duration.ofMillis(properties.getMemory().getSummaryTimeoutMs()));
        } catch (RuntimeException e) {
            log.warn("[Consolidation] LLM summarization failed: {}", e.getMessage());
            return null;
        }

        if (summary == null || summary.isBlank()) {
            log.warn("[Consolidation] LLM returned empty summary");
            return null;
        }
        log.info("[Consolidation] Summarized {} messages in {}ms ({} chars)",
                messages.size(), clock.millis() - start, summary.length());
        return summary.strip();
    }

    /**
     * Appends a new summary to the prior one and trims the result to the word
     * budget, dropping the oldest paragraphs first. The newest paragraph is
     * always kept.
     */
    public String merge(String priorSummary, String addition) {
        String combined = priorSummary == null || priorSummary.isBlank()
                ? addition.strip()
                : priorSummary.strip() + PARAGRAPH_SEPARATOR + addition.strip();
        return trimToWordBudget(combined, properties.getMemory().getSummaryMaxWords());
    }

    static String trimToWordBudget(String summary, int maxWords) {
        String[] paragraphs = PARAGRAPH_SPLIT.split(summary.strip());
        Deque<String> kept = new ArrayDeque<>();
        int words = 0;
        for (int i = paragraphs.length - 1; i >= 0; i--) {
            String paragraph = paragraphs[i].strip();
            if (paragraph.isEmpty()) {
                continue;
            }
            int paragraphWords = countWords(paragraph);
            if (!kept.isEmpty() && words + paragraphWords > maxWords) {
                break;
            }
            kept.addFirst(paragraph);
            words += paragraphWords;
        }
        return String.join(PARAGRAPH_SEPARATOR, kept);
    }

    static String formatTranscript(List<Message> messages) {
        return messages.stream()
                .filter(m -> m.isUserMessage() || m.isAssistantMessage())
                .filter(m -> m.getContent() != null && !m.getContent().isBlank())
                .map(m -> (m.isUserMessage() ? "User: " : "Assistant: ") + m.getContent().strip())
                .collect(Collectors.joining("\n"));
    }

    private static int countWords(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? 0 : WHITESPACE.split(stripped).length;
    }
}
