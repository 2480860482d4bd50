package me.golemcore.agent.domain.service;

import me.golemcore.agent.adapter.outbound.storage.LocalConversationStore;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.Session;
import me.golemcore.agent.domain.model.Skill;
import me.golemcore.agent.infrastructure.config.BotProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.port.outbound.SkillsPort;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryManagerTest {

    private static final Instant FIXED_NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final Session SESSION = new Session("cli", "local");
    private static final String BASE_PROMPT = "You are a test assistant.";

    @TempDir
    Path tempDir;

    private BotProperties properties;
    private LocalConversationStore store;
    private LlmPort llmPort;
    private SkillsPort skillsPort;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getStorage().setHistoryBlockSize(512);

        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        store = new LocalConversationStore(properties, objectMapper);
        store.init();

        llmPort = mock(LlmPort.class);
        skillsPort = mock(SkillsPort.class);
        when(skillsPort.listSkills()).thenReturn(List.of());
        clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }

    private MemoryManager manager() {
        ConsolidationService consolidationService = new ConsolidationService(llmPort, properties, clock);
        return new MemoryManager(store, consolidationService, skillsPort, properties, clock);
    }

    private void appendMessages(int count) {
        for (int i = 0; i < count; i++) {
            Message message = Message.builder()
                    .role(i % 2 == 0 ? Message.ROLE_USER : Message.ROLE_ASSISTANT)
                    .content("message " + i)
                    .channel("cli")
                    .senderId(i % 2 == 0 ? "local" : "assistant")
                    .timestamp(FIXED_NOW)
                    .build();
            store.appendMessage(SESSION, message).join();
        }
    }

    @Test
    void shouldConsolidateWhenThresholdExceeded() {
        appendMessages(101);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.chat(anyList(), anyList(), anyBoolean()))
                .thenReturn(Flux.just(LlmChunk.text("The user counted messages.")));

        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "next");

        assertEquals(22, context.size());
        assertEquals(81, store.loadConsolidatedCursor(SESSION).join());
        assertEquals("The user counted messages.", store.loadSessionSummary(SESSION).join());

        String system = context.get(0).getContent();
        assertTrue(system.startsWith(BASE_PROMPT));
        assertTrue(system.contains(MemoryManager.SUMMARY_HEADING + "\n\nThe user counted messages."));
        assertFalse(system.contains(MemoryManager.CONSOLIDATION_WARNING));

        assertTrue(context.get(1).getContent().endsWith("message 81"));
        assertTrue(context.get(20).getContent().endsWith("message 100"));
        assertEquals("next", context.get(21).getContent());
        assertTrue(context.get(21).isUserMessage());
    }

    @Test
    void shouldKeepCursorAndSummaryWhenSummarizationFails() {
        appendMessages(101);
        store.saveSessionSummary(SESSION, "Earlier summary.").join();
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.chat(anyList(), anyList(), anyBoolean()))
                .thenReturn(Flux.error(new IllegalStateException("model down")));

        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "next");

        assertEquals(0, store.loadConsolidatedCursor(SESSION).join());
        assertEquals("Earlier summary.", store.loadSessionSummary(SESSION).join());
        assertEquals(22, context.size());
        String system = context.get(0).getContent();
        assertTrue(system.contains("Earlier summary."));
        assertTrue(system.contains(MemoryManager.CONSOLIDATION_WARNING));
    }

    @Test
    void shouldNotConsolidateWithoutAvailableModel() {
        appendMessages(105);
        when(llmPort.isAvailable()).thenReturn(false);

        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "next");

        verify(llmPort, never()).chat(anyList(), anyList(), anyBoolean());
        assertEquals(0, store.loadConsolidatedCursor(SESSION).join());
        assertEquals(103, context.size());
        assertTrue(context.get(1).getContent().endsWith("message 4"));
    }

    @Test
    void shouldWarnWhenWithinTwoTurnsOfThreshold() {
        appendMessages(96);

        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "hi");

        assertTrue(context.get(0).getContent().contains(MemoryManager.CONSOLIDATION_WARNING));
    }

    @Test
    void shouldNotWarnMoreThanTwoTurnsBeforeThreshold() {
        appendMessages(95);

        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "hi");

        assertFalse(context.get(0).getContent().contains(MemoryManager.CONSOLIDATION_WARNING));
        assertEquals(97, context.size());
    }

    @Test
    void shouldDrainBacklogLargerThanWindowOldestFirst() {
        properties.getMemory().setConsolidationThreshold(10);
        properties.getMemory().setKeepRecentRatio(0.2);
        properties.getMemory().setMaxConsolidationWindow(12);
        appendMessages(30);
        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.chat(anyList(), anyList(), anyBoolean()))
                .thenReturn(Flux.just(LlmChunk.text("Summary.")));
        MemoryManager manager = manager();

        List<Message> first = manager.buildContext(SESSION, BASE_PROMPT, "next");

        assertEquals(12, store.loadConsolidatedCursor(SESSION).join());
        assertEquals(4, first.size());
        assertTrue(first.get(1).getContent().endsWith("message 28"));
        assertTrue(first.get(0).getContent().contains(MemoryManager.CONSOLIDATION_WARNING));

        manager.buildContext(SESSION, BASE_PROMPT, "next");
        assertEquals(24, store.loadConsolidatedCursor(SESSION).join());

        List<Message> third = manager.buildContext(SESSION, BASE_PROMPT, "next");
        assertEquals(24, store.loadConsolidatedCursor(SESSION).join());
        assertEquals(8, third.size());
        assertTrue(third.get(1).getContent().endsWith("message 24"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> requests = ArgumentCaptor.forClass(List.class);
        verify(llmPort, times(2)).chat(requests.capture(), anyList(), anyBoolean());
        List<String> firstTranscript = transcriptLines(requests.getAllValues().get(0));
        List<String> secondTranscript = transcriptLines(requests.getAllValues().get(1));
        assertEquals(12, firstTranscript.size());
        assertEquals("User: message 0", firstTranscript.get(0));
        assertEquals("Assistant: message 11", firstTranscript.get(11));
        assertEquals("User: message 12", secondTranscript.get(0));
        assertEquals("Assistant: message 23", secondTranscript.get(11));
    }

    private static List<String> transcriptLines(List<Message> request) {
        String prompt = request.get(request.size() - 1).getContent();
        return prompt.substring(prompt.indexOf("\n\n") + 2).lines().toList();
    }

    @Test
    void shouldInjectGlobalMemory() {
        store.saveGlobalMemory("Prefers green tea.\n").join();

        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "hi");

        assertEquals(2, context.size());
        assertEquals(BASE_PROMPT + "\n\n" + MemoryManager.MEMORY_HEADING + "\n\nPrefers green tea.",
                context.get(0).getContent());
    }

    @Test
    void shouldReturnOnlySystemAndUserForEmptySession() {
        List<Message> context = manager().buildContext(SESSION, BASE_PROMPT, "hi");

        assertEquals(2, context.size());
        assertEquals(BASE_PROMPT, context.get(0).getContent());
        assertTrue(context.get(0).isSystemMessage());
        assertEquals("hi", context.get(1).getContent());
    }

    @Test
    void shouldInjectSkillsIndexAndAlwaysOnBodies() {
        when(skillsPort.listSkills()).thenReturn(List.of(
                Skill.builder().name("core").description("Core rules").always(true).build(),
                Skill.builder().name("weather").description("Forecasts & alerts").build(),
                Skill.builder().name("github").description("Issues").available(false).build()));
        when(skillsPort.loadSkillBody("core")).thenReturn("Always answer briefly.");

        String system = manager().buildContext(SESSION, BASE_PROMPT, "hi").get(0).getContent();

        assertTrue(system.contains("<available_skills>"));
        assertTrue(system.contains("<name>weather</name>"));
        assertTrue(system.contains("<description>Forecasts &amp; alerts</description>"));
        assertTrue(system.contains("<skill available=\"false\">"));
        assertFalse(system.contains("<name>core</name>"));
        assertTrue(system.contains("Always answer briefly."));
    }

    @Test
    void shouldLabelMessagesBySender() {
        BotProperties.OwnerAlias alias = new BotProperties.OwnerAlias();
        alias.setAddress("@alex:example.org");
        alias.setChannel("matrix");
        properties.getMemory().getOwnerAliases().add(alias);
        MemoryManager manager = manager();

        Message owner = Message.builder().role(Message.ROLE_USER).content("hi")
                .channel("matrix").senderId("@alex:example.org").build();
        Message sameAddressOtherChannel = Message.builder().role(Message.ROLE_USER).content("hi")
                .channel("email").senderId("@alex:example.org").build();
        Message assistant = Message.builder().role(Message.ROLE_ASSISTANT).content("hello")
                .channel("matrix").senderId("assistant").build();
        Message unlabelled = Message.builder().role(Message.ROLE_USER).content("plain").build();

        assertEquals("[matrix / owner]\nhi", manager.label(owner).getContent());
        assertEquals("[email / @alex:example.org]\nhi", manager.label(sameAddressOtherChannel).getContent());
        assertEquals("[matrix / assistant]\nhello", manager.label(assistant).getContent());
        assertSame(unlabelled, manager.label(unlabelled));
    }

    @Test
    void shouldPersistUserThenAssistant() {
        MemoryManager manager = manager();

        manager.persistExchange(SESSION, "what time is it?", "noon");
        manager.persistExchange(SESSION, "thanks", null);

        List<Message> history = store.loadHistory(SESSION).join();
        assertEquals(4, history.size());
        assertEquals("what time is it?", history.get(0).getContent());
        assertEquals("local", history.get(0).getSenderId());
        assertEquals(FIXED_NOW, history.get(0).getTimestamp());
        assertEquals("noon", history.get(1).getContent());
        assertEquals("assistant", history.get(1).getSenderId());
        assertEquals("cli", history.get(1).getChannel());
        assertEquals("", history.get(3).getContent());
        assertTrue(history.get(3).isAssistantMessage());
    }
}
