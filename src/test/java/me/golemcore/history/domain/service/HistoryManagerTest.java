package me.golemcore.history.domain.service;

import me.golemcore.history.adapter.outbound.storage.JsonlHistoryStorageAdapter;
import me.golemcore.history.domain.model.CleanupResult;
import me.golemcore.history.domain.model.CostRecord;
import me.golemcore.history.domain.model.HistoryQuery;
import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.HistoryResult;
import me.golemcore.history.domain.model.LlmRequestRecord;
import me.golemcore.history.domain.model.Message;
import me.golemcore.history.domain.model.MessageRecord;
import me.golemcore.history.domain.model.MessageType;
import me.golemcore.history.domain.model.RecordType;
import me.golemcore.history.domain.model.TokenSource;
import me.golemcore.history.domain.model.TokenUsageRecord;
import me.golemcore.history.domain.model.ToolCallRecord;
import me.golemcore.history.domain.session.SessionContext;
import me.golemcore.history.domain.session.SessionScope;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.HistoryStoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class HistoryManagerTest {

    private static final String SESSION = "session-1";
    private static final Instant NOW = Instant.parse("2026-03-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private JsonlHistoryStorageAdapter storage;
    private HistoryRecordCodec codec;
    private HistoryManager manager;

    @BeforeEach
    void setUp() {
        HistoryProperties properties = new HistoryProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        codec = new HistoryRecordCodec(objectMapper);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        storage = new JsonlHistoryStorageAdapter(properties, codec, clock);
        storage.init();
        manager = new HistoryManager(storage, codec, clock);
    }

    // ===== Writes =====

    @Test
    void recordsMessageUnderExplicitSession() {
        Optional<MessageRecord> record = manager.recordMessage(SESSION, MessageType.ASSISTANT, "hi",
                Map.of("channel", "cli"));

        assertTrue(record.isPresent());
        List<HistoryRecord> loaded = manager.loadRecords(SESSION);
        assertEquals(1, loaded.size());
        MessageRecord message = (MessageRecord) loaded.get(0);
        assertEquals(MessageType.ASSISTANT, message.getMessageType());
        assertEquals("cli", message.getMetadata().get("channel"));
        assertEquals(NOW, message.getTimestamp());
    }

    @Test
    void recordsUnderAmbientSession() {
        try (SessionScope scope = SessionContext.scope("ambient")) {
            manager.recordToolCall(null, "shell", Map.of("cmd", "ls"), null, null);
        }

        List<HistoryRecord> loaded = manager.loadRecords("ambient");
        assertEquals(1, loaded.size());
        ToolCallRecord toolCall = (ToolCallRecord) loaded.get(0);
        assertEquals("shell", toolCall.getToolName());
        assertNull(toolCall.getToolOutput());
    }

    @Test
    void dropsRecordWithoutSession() {
        assertTrue(manager.recordMessage(null, MessageType.USER, "lost", null).isEmpty());
        assertTrue(manager.listSessions().isEmpty());
    }

    @Test
    void recordsLlmRequestAndPreparedRecords() {
        Optional<LlmRequestRecord> request = manager.recordLlmRequest(SESSION, "gpt-4", "openai",
                List.of(Message.of("user", "hello")), Map.of("temperature", 0.2), 9);
        manager.recordLlmResponse(SESSION, request.orElseThrow().getRecordId(), "hey", "stop", null, 0.5,
                "gpt-4");
        manager.recordTokenUsage(TokenUsageRecord.builder().sessionId(SESSION).model("gpt-4")
                .promptTokens(1).completionTokens(2).totalTokens(3).source(TokenSource.API).confidence(1.0)
                .build());
        manager.recordCost(CostRecord.builder().sessionId(SESSION).model("gpt-4").totalCost(0.5).build());

        List<HistoryRecord> loaded = manager.loadRecords(SESSION);
        assertEquals(List.of(RecordType.LLM_REQUEST, RecordType.LLM_RESPONSE, RecordType.TOKEN_USAGE,
                RecordType.COST), loaded.stream().map(HistoryRecord::getRecordType).toList());
        assertTrue(loaded.stream().allMatch(r -> r.getRecordId() != null && !r.getRecordId().isBlank()));
    }

    @Test
    void returnsEmptyWhenStorageRejectsWrite() {
        HistoryStoragePort failing = mock(HistoryStoragePort.class);
        when(failing.store(any())).thenReturn(false);
        HistoryManager failingManager = new HistoryManager(failing, codec, Clock.fixed(NOW, ZoneOffset.UTC));

        assertTrue(failingManager.recordMessage(SESSION, MessageType.USER, "x", null).isEmpty());
    }

    // ===== Query =====

    @Test
    void queryWithoutFiltersReturnsEverything() {
        storeMessages(5);

        HistoryResult result = manager.query(HistoryQuery.forSession(SESSION));

        assertEquals(5, result.getTotal());
        assertEquals(5, result.getRecords().size());
    }

    @Test
    void queryFiltersByInclusiveTimeRange() {
        storeMessages(5);

        HistoryResult result = manager.query(HistoryQuery.builder()
                .sessionId(SESSION)
                .startTime(NOW.plusSeconds(1))
                .endTime(NOW.plusSeconds(3))
                .build());

        assertEquals(3, result.getTotal());
        assertEquals(List.of("m1", "m2", "m3"), ids(result.getRecords()));
    }

    @Test
    void queryFiltersByRecordType() {
        storeMessages(2);
        manager.recordToolCall(SESSION, "shell", Map.of(), Map.of("out", "ok"), null);

        HistoryResult result = manager.query(HistoryQuery.builder()
                .sessionId(SESSION)
                .recordTypes(Set.of(RecordType.TOOL_CALL))
                .build());

        assertEquals(1, result.getTotal());
        assertInstanceOf(ToolCallRecord.class, result.getRecords().get(0));
    }

    @Test
    void totalIsCountedBeforePagination() {
        storeMessages(7);

        HistoryResult page = manager.query(HistoryQuery.builder().sessionId(SESSION).offset(2).limit(3).build());

        assertEquals(7, page.getTotal());
        assertEquals(List.of("m2", "m3", "m4"), ids(page.getRecords()));
    }

    @ParameterizedTest
    @ValueSource(ints = { 1, 2, 3, 4, 7, 10 })
    void pagesConcatenateToFullResult(int limit) {
        storeMessages(7);
        List<HistoryRecord> full = manager.query(HistoryQuery.forSession(SESSION)).getRecords();

        List<HistoryRecord> paged = new ArrayList<>();
        for (int offset = 0; offset < full.size(); offset += limit) {
            paged.addAll(manager.query(HistoryQuery.builder().sessionId(SESSION).offset(offset).limit(limit)
                    .build()).getRecords());
        }

        assertEquals(ids(full), ids(paged));
    }

    @Test
    void offsetBeyondTotalYieldsEmptyPage() {
        storeMessages(3);

        HistoryResult result = manager.query(HistoryQuery.builder().sessionId(SESSION).offset(10).limit(5).build());

        assertEquals(3, result.getTotal());
        assertTrue(result.getRecords().isEmpty());
    }

    @Test
    void rejectsNegativePagination() {
        assertThrows(IllegalArgumentException.class,
                () -> manager.query(HistoryQuery.builder().sessionId(SESSION).offset(-1).build()));
        assertThrows(IllegalArgumentException.class,
                () -> manager.query(HistoryQuery.builder().sessionId(SESSION).limit(-1).build()));
    }

    @Test
    void queryOfUnknownSessionIsEmpty() {
        HistoryResult result = manager.query(HistoryQuery.forSession("nobody"));

        assertEquals(0, result.getTotal());
        assertTrue(result.getRecords().isEmpty());
    }

    @Test
    void queryIgnoresMalformedAndUnknownEntries() throws Exception {
        storeMessages(2);
        Path file = tempDir.resolve("sessions").resolve("202603").resolve(SESSION + ".jsonl");
        Files.writeString(file, "{\"record_type\":\"hologram\",\"record_id\":\"h\",\"session_id\":\"session-1\"}\n"
                + "{\"record_type\":\"message\",\"record_id\":", StandardOpenOption.APPEND);

        assertEquals(2, manager.query(HistoryQuery.forSession(SESSION)).getTotal());
    }

    // ===== Retention =====

    @Test
    void cleanupReportsRemovedCountAndCutoff() {
        storage.store(message("old", NOW.minus(Duration.ofDays(40))));
        storage.store(message("new", NOW));
        Instant cutoff = NOW.minus(Duration.ofDays(30));

        CleanupResult result = manager.cleanup(cutoff);

        assertEquals(1, result.getCleanedRecords());
        assertEquals(cutoff, result.getCutoffDate());
        assertFalse(result.isDryRun());
        assertEquals(1, manager.loadRecords(SESSION).size());
    }

    @Test
    void dryRunCountsWithoutRemoving() {
        storage.store(message("old", NOW.minus(Duration.ofDays(40))));
        storage.store(message("new", NOW));

        CleanupResult result = manager.cleanupOlderThan(30, true);

        assertEquals(1, result.getCleanedRecords());
        assertTrue(result.isDryRun());
        assertEquals(NOW.minus(Duration.ofDays(30)), result.getCutoffDate());
        assertEquals(2, manager.loadRecords(SESSION).size());
    }

    @Test
    void cleanupOlderThanRemoves() {
        storage.store(message("old", NOW.minus(Duration.ofDays(40))));

        assertEquals(1, manager.cleanupOlderThan(30, false).getCleanedRecords());
        assertTrue(manager.listSessions().isEmpty());
    }

    @Test
    void rejectsNonPositiveDays() {
        assertThrows(IllegalArgumentException.class, () -> manager.cleanupOlderThan(0, false));
    }

    @Test
    void exposesStorageInfo() {
        storeMessages(1);

        assertEquals(List.of(SESSION), manager.listSessions());
        assertEquals(1, manager.getStorageInfo().getSessionCount());
    }

    private void storeMessages(int count) {
        for (int i = 0; i < count; i++) {
            storage.store(message("m" + i, NOW.plusSeconds(i)));
        }
    }

    private static MessageRecord message(String id, Instant timestamp) {
        return MessageRecord.builder()
                .recordId(id)
                .sessionId(SESSION)
                .timestamp(timestamp)
                .messageType(MessageType.USER)
                .content("message " + id)
                .build();
    }

    private static List<String> ids(List<HistoryRecord> records) {
        return records.stream().map(HistoryRecord::getRecordId).toList();
    }
}
