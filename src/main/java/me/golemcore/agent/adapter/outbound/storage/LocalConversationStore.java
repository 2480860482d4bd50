package me.golemcore.agent.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ScheduledJob;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.outbound.ConversationStorePort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Filesystem implementation of {@link ConversationStorePort}.
 *
 * <p>
 * Directory structure under the base path:
 *
 * <pre>
 * history/{storageKey}.jsonl          - append-only message log, one JSON record per line
 * memory/MEMORY.md                    - global long-term memory document
 * sessions/{storageKey}/summary.md    - consolidation summary
 * sessions/{storageKey}/cursor        - consolidated record count
 * cron/jobs.json                      - scheduled jobs
 * </pre>
 *
 * <p>
 * Base path configured via {@code bot.storage.local.base-path}, defaults to
 * {@code ${user.home}/.golemcore/agent}.
 */
@Component
@Slf4j
public class LocalConversationStore implements ConversationStorePort {

    private static final String HISTORY_DIR = "history";
    private static final String SESSIONS_DIR = "sessions";
    private static final String MEMORY_DIR = "memory";
    private static final String CRON_DIR = "cron";
    private static final String HISTORY_SUFFIX = ".jsonl";
    private static final String MEMORY_FILE = "MEMORY.md";
    private static final String SUMMARY_FILE = "summary.md";
    private static final String CURSOR_FILE = "cursor";
    private static final String JOBS_FILE = "jobs.json";
    private static final byte NEWLINE = '\n';

    private static final TypeReference<List<ScheduledJob>> JOB_LIST = new TypeReference<>() {
    };

    private final BotProperties properties;
    private final ObjectMapper objectMapper;
    private final HistoryFileLocks locks = new HistoryFileLocks();
    private final Map<Path, CountCheckpoint> countCheckpoints = new ConcurrentHashMap<>();

    private Path basePath;

    public LocalConversationStore(BotProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(BotProperties.expandUserHome(basePathStr)).toAbsolutePath().normalize();

        try {
            for (String dir : List.of(HISTORY_DIR, SESSIONS_DIR, MEMORY_DIR, CRON_DIR)) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Conversation store initialized at: {}", basePath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create storage directory: " + basePath, e);
        }
    }

    // ==================== HISTORY ====================

    @Override
    public CompletableFuture<Void> appendMessage(Session session, Message message) {
        return CompletableFuture.runAsync(() -> {
            Path file = historyFile(session);
            try {
                byte[] line = (objectMapper.writeValueAsString(message) + "\n").getBytes(StandardCharsets.UTF_8);
                Files.createDirectories(file.getParent());
                try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
                    locks.exclusive(file, channel, () -> {
                        ByteBuffer buffer = ByteBuffer.wrap(line);
                        while (buffer.hasRemaining()) {
                            channel.write(buffer);
                        }
                        return null;
                    });
                }
            } catch (IOException e) {
                throw new RuntimeException("Failed to append to history: " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<Message>> loadHistory(Session session) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = historyFile(session);
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                return locks.sharedIfAvailable(file, channel, () -> readRange(file, channel, 0, Integer.MAX_VALUE));
            } catch (NoSuchFileException e) {
                return new ArrayList<>();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read history: " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<Message>> loadHistory(Session session, int lastN) {
        if (lastN <= 0) {
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        return CompletableFuture.supplyAsync(() -> {
            Path file = historyFile(session);
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                JsonlTailReader.TailReadResult<Message> result = locks.sharedIfAvailable(file, channel,
                        () -> JsonlTailReader.readLast(channel, lastN, properties.getStorage().getHistoryBlockSize(),
                                this::decodeRecord));
                warnMalformed(file, result.stats());
                log.trace("[Storage] Tail read of {}: {} records, {} bytes", file, result.records().size(),
                        result.bytesRead());
                return new ArrayList<>(result.records());
            } catch (NoSuchFileException e) {
                return new ArrayList<>();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read history tail: " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<Message>> loadHistoryRange(Session session, int offset, int limit) {
        if (limit <= 0) {
            return CompletableFuture.completedFuture(new ArrayList<>());
        }
        int from = Math.max(0, offset);
        return CompletableFuture.supplyAsync(() -> {
            Path file = historyFile(session);
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                return locks.sharedIfAvailable(file, channel, () -> readRange(file, channel, from, limit));
            } catch (NoSuchFileException e) {
                return new ArrayList<>();
            } catch (IOException e) {
                throw new RuntimeException("Failed to read history range: " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<Integer> countMessages(Session session) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = historyFile(session);
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
                return locks.sharedIfAvailable(file, channel, () -> countRecords(file, channel));
            } catch (NoSuchFileException e) {
                return 0;
            } catch (IOException e) {
                throw new RuntimeException("Failed to count history: " + file, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listSessions() {
        return CompletableFuture.supplyAsync(() -> {
            Path dir = basePath.resolve(HISTORY_DIR);
            if (!Files.isDirectory(dir)) {
                return Collections.emptyList();
            }
            try (Stream<Path> files = Files.list(dir)) {
                return files
                        .map(p -> p.getFileName().toString())
                        .filter(name -> name.endsWith(HISTORY_SUFFIX))
                        .map(name -> Session.fromStorageKey(
                                name.substring(0, name.length() - HISTORY_SUFFIX.length())))
                        .filter(LocalConversationStore::isParsableSessionId)
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new RuntimeException("Failed to list sessions: " + dir, e);
            }
        });
    }

    // ==================== DOCUMENTS ====================

    @Override
    public CompletableFuture<String> loadGlobalMemory() {
        return CompletableFuture.supplyAsync(() -> readText(resolvePath(MEMORY_DIR, MEMORY_FILE)));
    }

    @Override
    public CompletableFuture<Void> saveGlobalMemory(String content) {
        return CompletableFuture.runAsync(() -> writeAtomic(resolvePath(MEMORY_DIR, MEMORY_FILE), content));
    }

    @Override
    public CompletableFuture<String> loadSessionSummary(Session session) {
        return CompletableFuture.supplyAsync(() -> readText(sessionFile(session, SUMMARY_FILE)));
    }

    @Override
    public CompletableFuture<Void> saveSessionSummary(Session session, String summary) {
        return CompletableFuture.runAsync(() -> writeAtomic(sessionFile(session, SUMMARY_FILE), summary));
    }

    @Override
    public CompletableFuture<Integer> loadConsolidatedCursor(Session session) {
        return CompletableFuture.supplyAsync(() -> {
            Path file = sessionFile(session, CURSOR_FILE);
            String text = readText(file).strip();
            if (text.isEmpty()) {
                return 0;
            }
            try {
                return Math.max(0, Integer.parseInt(text));
            } catch (NumberFormatException e) {
                log.warn("[Storage] Ignoring unreadable cursor in {}: '{}'", file, text);
                return 0;
            }
        });
    }

    @Override
    public CompletableFuture<Void> saveConsolidatedCursor(Session session, int cursor) {
        return CompletableFuture.runAsync(() -> writeAtomic(sessionFile(session, CURSOR_FILE),
                Integer.toString(cursor)));
    }

    @Override
    public CompletableFuture<List<ScheduledJob>> loadJobs() {
        return CompletableFuture.supplyAsync(() -> {
            Path file = resolvePath(CRON_DIR, JOBS_FILE);
            String json = readText(file);
            if (json.isBlank()) {
                return new ArrayList<>();
            }
            try {
                List<ScheduledJob> jobs = objectMapper.readValue(json, JOB_LIST);
                return jobs != null ? new ArrayList<>(jobs) : new ArrayList<>();
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Failed to parse {}, treating as no jobs: {}", file, e.getOriginalMessage());
                return new ArrayList<>();
            }
        });
    }

    @Override
    public CompletableFuture<Void> saveJobs(List<ScheduledJob> jobs) {
        return CompletableFuture.runAsync(() -> {
            Path file = resolvePath(CRON_DIR, JOBS_FILE);
            try {
                writeAtomic(file, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(jobs));
            } catch (JsonProcessingException e) {
                throw new RuntimeException("Failed to serialize jobs", e);
            }
        });
    }

    // ==================== INTERNALS ====================

    private List<Message> readRange(Path file, FileChannel channel, int offset, int limit) throws IOException {
        List<Message> messages = new ArrayList<>();
        int index = 0;
        DecodeStats stats = new DecodeStats();
        // InputStreamReader replaces undecodable bytes instead of failing the read
        BufferedReader reader = new BufferedReader(
                new InputStreamReader(Channels.newInputStream(channel), StandardCharsets.UTF_8));
        String line;
        while (messages.size() < limit && (line = reader.readLine()) != null) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            Message message = decodeRecord(trimmed);
            if (message == null) {
                stats.recordMalformed(trimmed);
            } else if (index++ >= offset) {
                messages.add(message);
            }
        }
        warnMalformed(file, stats);
        return messages;
    }

    /**
     * Counts well-formed records, scanning only the bytes appended since the
     * previous count of the same file.
     */
    private int countRecords(Path file, FileChannel channel) throws IOException {
        long size = channel.size();
        CountCheckpoint checkpoint = countCheckpoints.get(file);
        if (checkpoint == null || checkpoint.offset() > size) {
            checkpoint = new CountCheckpoint(0, 0);
        }

        DecodeStats stats = new DecodeStats();
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        ByteBuffer buffer = ByteBuffer.allocate(properties.getStorage().getHistoryBlockSize());
        long position = checkpoint.offset();
        long lineEnd = position;
        int count = checkpoint.count();

        while (position < size) {
            buffer.clear();
            int read = channel.read(buffer, position);
            if (read <= 0) {
                break;
            }
            byte[] bytes = buffer.array();
            for (int i = 0; i < read; i++) {
                if (bytes[i] == NEWLINE) {
                    count += countLine(pending, stats);
                    lineEnd = position + i + 1;
                } else {
                    pending.write(bytes[i]);
                }
            }
            position += read;
        }

        countCheckpoints.put(file, new CountCheckpoint(lineEnd, count));
        // Unterminated last line is counted but stays outside the checkpoint
        int unterminated = countLine(pending, stats);
        warnMalformed(file, stats);
        return count + unterminated;
    }

    private int countLine(ByteArrayOutputStream pending, DecodeStats stats) {
        String line = pending.toString(StandardCharsets.UTF_8).strip();
        pending.reset();
        if (line.isEmpty()) {
            return 0;
        }
        if (decodeRecord(line) == null) {
            stats.recordMalformed(line);
            return 0;
        }
        return 1;
    }

    private Message decodeRecord(String line) {
        try {
            Message message = objectMapper.readValue(line, Message.class);
            return message != null && message.isWellFormed() ? message : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void warnMalformed(Path file, DecodeStats stats) {
        if (stats.hasMalformed()) {
            log.warn("[Storage] Skipped {} malformed line(s) in {}, first: {}", stats.malformed(), file,
                    stats.firstPreview());
        }
    }

    private String readText(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return "";
        } catch (IOException e) {
            throw new RuntimeException("Failed to read file: " + file, e);
        }
    }

    private void writeAtomic(Path targetPath, String content) {
        Path tempPath = null;
        try {
            Files.createDirectories(targetPath.getParent());
            // Unique temp name so concurrent writers never share a temp file
            tempPath = Files.createTempFile(targetPath.getParent(), targetPath.getFileName() + ".", ".tmp");

            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Storage] Atomic write completed: {}", targetPath);
        } catch (IOException e) {
            if (tempPath != null) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
            }
            throw new RuntimeException("Atomic write failed: " + targetPath, e);
        }
    }

    private Path historyFile(Session session) {
        return resolvePath(HISTORY_DIR, session.storageKey() + HISTORY_SUFFIX);
    }

    private Path sessionFile(Session session, String name) {
        return resolvePath(SESSIONS_DIR, session.storageKey()).resolve(name);
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath.resolve(directory))) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }

    private static boolean isParsableSessionId(String id) {
        try {
            Session.parse(id);
            return true;
        } catch (IllegalArgumentException e) {
            log.debug("[Storage] Skipping history file with unrecognized key: {}", id);
            return false;
        }
    }

    private record CountCheckpoint(long offset, int count) {
    }
}
