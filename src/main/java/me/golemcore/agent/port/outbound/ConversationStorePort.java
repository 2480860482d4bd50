package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ScheduledJob;
import me.golemcore.agent.domain.model.Session;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for durable conversation state: per-session history logs, the global
 * long-term memory document, per-session consolidation summary and cursor, and
 * the scheduled-job list.
 *
 * <p>
 * All operations run off the caller's thread and are safe to call
 * concurrently, including from several OS processes sharing the same
 * workspace:
 * <ul>
 * <li>history logs are append-only; each append holds an exclusive lock for
 * the single write</li>
 * <li>reads take a shared lock when one is available and never block on
 * it</li>
 * <li>whole documents (memory, summary, cursor, jobs) are replaced by
 * temp-file + fsync + atomic rename, so readers see either the old or the new
 * content</li>
 * </ul>
 */
public interface ConversationStorePort {

    /**
     * Appends one record to the session history log. Never rewrites prior content.
     */
    CompletableFuture<Void> appendMessage(Session session, Message message);

    /**
     * Loads the full history of a session in chronological order, streaming the
     * log line by line. Malformed lines are skipped.
     */
    CompletableFuture<List<Message>> loadHistory(Session session);

    /**
     * Loads the last {@code lastN} well-formed records in chronological order,
     * reading the log backwards in fixed-size blocks so I/O is bounded by the
     * number of records requested rather than the size of the log. Returns an
     * empty list when {@code lastN <= 0}.
     */
    CompletableFuture<List<Message>> loadHistory(Session session, int lastN);

    /**
     * Loads up to {@code limit} well-formed records starting at record index
     * {@code offset} (0-based, malformed lines not counted), in chronological
     * order. Reads forward and stops once {@code limit} records are collected.
     */
    CompletableFuture<List<Message>> loadHistoryRange(Session session, int offset, int limit);

    /**
     * Counts well-formed records in the session history log.
     */
    CompletableFuture<Integer> countMessages(Session session);

    /**
     * Lists the ids of all sessions that have a history log.
     */
    CompletableFuture<List<String>> listSessions();

    CompletableFuture<String> loadGlobalMemory();

    CompletableFuture<Void> saveGlobalMemory(String content);

    CompletableFuture<String> loadSessionSummary(Session session);

    CompletableFuture<Void> saveSessionSummary(Session session, String summary);

    CompletableFuture<Integer> loadConsolidatedCursor(Session session);

    CompletableFuture<Void> saveConsolidatedCursor(Session session, int cursor);

    /**
     * Loads the scheduled-job list. An unreadable job file yields an empty list
     * and a warning rather than an error.
     */
    CompletableFuture<List<ScheduledJob>> loadJobs();

    CompletableFuture<Void> saveJobs(List<ScheduledJob> jobs);
}
