package me.golemcore.agent.adapter.outbound.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ScheduledJob;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class LocalConversationStoreTest {

    private static final Session SESSION = new Session("cli", "local");

    @TempDir
    Path tempDir;

    private LocalConversationStore store;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getStorage().setHistoryBlockSize(256);

        store = new LocalConversationStore(properties, objectMapper());
        store.init();
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static Message user(String content) {
        return Message.builder()
                .role(Message.ROLE_USER)
                .content(content)
                .channel("cli")
                .senderId("local")
                .timestamp(Instant.parse("2026-01-01T10:00:00Z"))
                .build();
    }

    private static Message assistant(String content) {
        return Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .senderId("assistant")
                .timestamp(Instant.parse("2026-01-01T10:00:01Z"))
                .build();
    }

    private Path historyFile() {
        return tempDir.resolve("history").resolve(SESSION.storageKey() + ".jsonl");
    }

    @Test
    void shouldRoundTripUserAndAssistantMessages() throws ExecutionException, InterruptedException {
        store.appendMessage(SESSION, user("hello")).get();
        store.appendMessage(SESSION, assistant("hi there")).get();

        List<Message> history = store.loadHistory(SESSION).get();

        assertEquals(2, history.size());
        assertEquals(Message.ROLE_USER, history.get(0).getRole());
        assertEquals("hello", history.get(0).getContent());
        assertEquals("cli", history.get(0).getChannel());
        assertEquals(Message.ROLE_ASSISTANT, history.get(1).getRole());
        assertEquals("hi there", history.get(1).getContent());
        assertEquals(Instant.parse("2026-01-01T10:00:01Z"), history.get(1).getTimestamp());
    }

    @Test
    void shouldReturnEmptyHistoryForUnknownSession() throws ExecutionException, InterruptedException {
        Session unknown = new Session("matrix", "@nobody:example.org");

        assertTrue(store.loadHistory(unknown).get().isEmpty());
        assertTrue(store.loadHistory(unknown, 10).get().isEmpty());
        assertEquals(0, store.countMessages(unknown).get());
    }

    @Test
    void shouldReturnEmptyListWhenLastNIsNotPositive() throws ExecutionException, InterruptedException {
        store.appendMessage(SESSION, user("hello")).get();

        assertTrue(store.loadHistory(SESSION, 0).get().isEmpty());
        assertTrue(store.loadHistory(SESSION, -3).get().isEmpty());
    }

    @Test
    void shouldReturnLastRecordsInChronologicalOrder() throws ExecutionException, InterruptedException {
        for (int i = 0; i < 50; i++) {
            store.appendMessage(SESSION, user("message " + i)).get();
        }

        List<Message> tail = store.loadHistory(SESSION, 3).get();

        assertEquals(List.of("message 47", "message 48", "message 49"),
                tail.stream().map(Message::getContent).toList());
    }

    @Test
    void shouldReturnWholeHistoryWhenLastNExceedsCount() throws ExecutionException, InterruptedException {
        store.appendMessage(SESSION, user("one")).get();
        store.appendMessage(SESSION, user("two")).get();

        List<Message> tail = store.loadHistory(SESSION, 100).get();

        assertEquals(List.of("one", "two"), tail.stream().map(Message::getContent).toList());
    }

    @Test
    void shouldSkipMalformedLineBetweenValidRecords() throws Exception {
        ObjectMapper mapper = objectMapper();
        String content = mapper.writeValueAsString(user("first")) + "\n"
                + "{not json at all\n"
                + mapper.writeValueAsString(assistant("second")) + "\n";
        Files.createDirectories(historyFile().getParent());
        Files.writeString(historyFile(), content, StandardCharsets.UTF_8);

        List<Message> all = store.loadHistory(SESSION).get();
        List<Message> tail = store.loadHistory(SESSION, 10).get();

        assertEquals(List.of("first", "second"), all.stream().map(Message::getContent).toList());
        assertEquals(List.of("first", "second"), tail.stream().map(Message::getContent).toList());
        assertEquals(2, store.countMessages(SESSION).get());
    }

    @Test
    void shouldLoadRangeFromOffsetCountingOnlyWellFormedRecords() throws Exception {
        ObjectMapper mapper = objectMapper();
        StringBuilder content = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            content.append(mapper.writeValueAsString(user("m" + i))).append('\n');
            if (i == 1) {
                content.append("{not json at all\n");
            }
        }
        Files.createDirectories(historyFile().getParent());
        Files.writeString(historyFile(), content.toString(), StandardCharsets.UTF_8);

        List<Message> range = store.loadHistoryRange(SESSION, 2, 3).get();

        assertEquals(List.of("m2", "m3", "m4"), range.stream().map(Message::getContent).toList());
        assertEquals(List.of("m4", "m5"),
                store.loadHistoryRange(SESSION, 4, 10).get().stream().map(Message::getContent).toList());
    }

    @Test
    void shouldReturnEmptyRangeForNonPositiveLimitOrMissingLog() throws ExecutionException, InterruptedException {
        assertTrue(store.loadHistoryRange(SESSION, 0, 5).get().isEmpty());

        store.appendMessage(SESSION, user("hello")).get();

        assertTrue(store.loadHistoryRange(SESSION, 0, 0).get().isEmpty());
        assertTrue(store.loadHistoryRange(SESSION, 5, 5).get().isEmpty());
        assertEquals(List.of("hello"),
                store.loadHistoryRange(SESSION, -1, 5).get().stream().map(Message::getContent).toList());
    }

    @Test
    void shouldSkipRecordsWithUnknownRoleOrMissingToolCallId() throws Exception {
        String content = "{\"role\":\"wizard\",\"content\":\"x\"}\n"
                + "{\"role\":\"tool\",\"content\":\"orphan\"}\n"
                + "{\"role\":\"tool\",\"content\":\"ok\",\"tool_call_id\":\"call-1\"}\n";
        Files.createDirectories(historyFile().getParent());
        Files.writeString(historyFile(), content, StandardCharsets.UTF_8);

        List<Message> history = store.loadHistory(SESSION).get();

        assertEquals(1, history.size());
        assertEquals("call-1", history.get(0).getToolCallId());
    }

    @Test
    void shouldCountOnlyAppendedRecordsIncrementally() throws ExecutionException, InterruptedException {
        for (int i = 0; i < 5; i++) {
            store.appendMessage(SESSION, user("m" + i)).get();
        }
        assertEquals(5, store.countMessages(SESSION).get());

        for (int i = 0; i < 3; i++) {
            store.appendMessage(SESSION, assistant("r" + i)).get();
        }
        assertEquals(8, store.countMessages(SESSION).get());
    }

    @Test
    void shouldKeepEveryRecordIntactUnderConcurrentAppends() throws Exception {
        int writers = 8;
        int perWriter = 25;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    List<CompletableFuture<Void>> appends = new ArrayList<>();
                    for (int i = 0; i < perWriter; i++) {
                        appends.add(store.appendMessage(SESSION, user("w" + writer + "-" + i + " " + "x".repeat(300))));
                    }
                    CompletableFuture.allOf(appends.toArray(new CompletableFuture[0])).join();
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdown();
        }

        List<String> lines = Files.readAllLines(historyFile(), StandardCharsets.UTF_8);
        assertEquals(writers * perWriter, lines.size());
        assertEquals(writers * perWriter, store.loadHistory(SESSION).get().size());
        assertEquals(writers * perWriter, store.countMessages(SESSION).get());
    }

    @Test
    void shouldListSessionsWithHistory() throws ExecutionException, InterruptedException {
        store.appendMessage(new Session("matrix", "@alice:example.org"), user("a")).get();
        store.appendMessage(SESSION, user("b")).get();

        List<String> sessions = store.listSessions().get();

        assertEquals(List.of("cli:local", "matrix:@alice:example.org"), sessions);
    }

    @Test
    void shouldKeepSeparateHistoriesForIdsThatDifferOnlyInSeparators()
            throws ExecutionException, InterruptedException {
        Session first = new Session("a", "b__c");
        Session second = new Session("a__b", "c");
        store.appendMessage(first, user("first")).get();
        store.appendMessage(second, user("second")).get();

        assertEquals(List.of("first"), store.loadHistory(first).get().stream().map(Message::getContent).toList());
        assertEquals(List.of("second"), store.loadHistory(second).get().stream().map(Message::getContent).toList());
        assertEquals(List.of("a:b__c", "a__b:c"), store.listSessions().get());
    }

    @Test
    void shouldRoundTripGlobalMemoryIncludingEmptyContent() throws ExecutionException, InterruptedException {
        assertEquals("", store.loadGlobalMemory().get());

        store.saveGlobalMemory("User prefers short answers.").get();
        assertEquals("User prefers short answers.", store.loadGlobalMemory().get());

        store.saveGlobalMemory("").get();
        assertEquals("", store.loadGlobalMemory().get());
    }

    @Test
    void shouldNotLeaveTempFilesAfterAtomicWrite() throws Exception {
        store.saveGlobalMemory("notes").get();

        try (var files = Files.list(tempDir.resolve("memory"))) {
            assertEquals(List.of("MEMORY.md"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void shouldDefaultSummaryAndCursorForNewSession() throws ExecutionException, InterruptedException {
        assertEquals("", store.loadSessionSummary(SESSION).get());
        assertEquals(0, store.loadConsolidatedCursor(SESSION).get());
    }

    @Test
    void shouldRoundTripSummaryAndCursorPerSession() throws ExecutionException, InterruptedException {
        Session other = new Session("email", "bob@example.org");

        store.saveSessionSummary(SESSION, "They talked about travel.").get();
        store.saveConsolidatedCursor(SESSION, 81).get();

        assertEquals("They talked about travel.", store.loadSessionSummary(SESSION).get());
        assertEquals(81, store.loadConsolidatedCursor(SESSION).get());
        assertEquals("", store.loadSessionSummary(other).get());
        assertEquals(0, store.loadConsolidatedCursor(other).get());
    }

    @Test
    void shouldTreatUnreadableCursorAsZero() throws Exception {
        Path cursor = tempDir.resolve("sessions").resolve(SESSION.storageKey()).resolve("cursor");
        Files.createDirectories(cursor.getParent());
        Files.writeString(cursor, "not-a-number");

        assertEquals(0, store.loadConsolidatedCursor(SESSION).get());
    }

    @Test
    void shouldRoundTripJobs() throws ExecutionException, InterruptedException {
        ScheduledJob job = ScheduledJob.builder()
                .id("abc12345")
                .name("morning")
                .message("Good morning")
                .schedule("0 9 * * *")
                .build();

        store.saveJobs(List.of(job)).get();
        List<ScheduledJob> loaded = store.loadJobs().get();

        assertEquals(1, loaded.size());
        assertEquals("abc12345", loaded.get(0).getId());
        assertEquals("0 9 * * *", loaded.get(0).getSchedule());
        assertEquals(ScheduledJob.DEFAULT_CHANNEL, loaded.get(0).getChannel());
        assertTrue(loaded.get(0).isEnabled());
    }

    @Test
    void shouldReturnNoJobsWhenFileIsMissingOrCorrupt() throws Exception {
        assertTrue(store.loadJobs().get().isEmpty());

        Files.writeString(tempDir.resolve("cron").resolve("jobs.json"), "{broken");

        assertTrue(store.loadJobs().get().isEmpty());
    }
}
