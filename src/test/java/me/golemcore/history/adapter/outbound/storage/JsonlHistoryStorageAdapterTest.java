package me.golemcore.history.adapter.outbound.storage;

import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.MessageRecord;
import me.golemcore.history.domain.model.MessageType;
import me.golemcore.history.domain.model.StorageInfo;
import me.golemcore.history.domain.model.ToolCallRecord;
import me.golemcore.history.domain.service.HistoryRecordCodec;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonlHistoryStorageAdapterTest {

    private static final String SESSION = "session-1";
    private static final Instant MARCH = Instant.parse("2026-03-15T10:00:00Z");
    private static final Instant APRIL = Instant.parse("2026-04-02T08:00:00Z");

    @TempDir
    Path tempDir;

    private HistoryProperties properties;
    private HistoryRecordCodec codec;
    private MutableClock clock;
    private JsonlHistoryStorageAdapter storage;

    @BeforeEach
    void setUp() {
        properties = new HistoryProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        codec = new HistoryRecordCodec(objectMapper);
        clock = new MutableClock(MARCH);

        storage = new JsonlHistoryStorageAdapter(properties, codec, clock);
        storage.init();
    }

    // ===== Store / read =====

    @Test
    void storesOneLinePerRecordInMonthPartition() throws Exception {
        assertTrue(storage.store(message("m1", SESSION, MARCH, "hello")));
        assertTrue(storage.store(message("m2", SESSION, MARCH, "world")));

        Path file = tempDir.resolve("sessions").resolve("202603").resolve(SESSION + ".jsonl");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("\"record_id\":\"m1\""));
    }

    @Test
    void readAllReturnsEntriesInFileOrder() {
        storage.store(message("m1", SESSION, MARCH, "first"));
        storage.store(message("m2", SESSION, MARCH, "second"));

        List<Map<String, Object>> entries = storage.readAll(SESSION);

        assertEquals(2, entries.size());
        assertEquals("m1", entries.get(0).get("record_id"));
        assertEquals("second", entries.get(1).get("content"));
    }

    @Test
    void readAllMergesPartitionsAcrossMonths() {
        storage.store(message("m1", SESSION, MARCH, "march"));
        clock.set(APRIL);
        storage.store(message("m2", SESSION, APRIL, "april"));

        List<Map<String, Object>> entries = storage.readAll(SESSION);

        assertEquals(2, entries.size());
        assertEquals("m1", entries.get(0).get("record_id"));
        assertEquals("m2", entries.get(1).get("record_id"));
        assertTrue(Files.isDirectory(tempDir.resolve("sessions").resolve("202604")));
    }

    @Test
    void readAllOfMissingSessionIsEmpty() {
        assertTrue(storage.readAll("nobody").isEmpty());
        assertTrue(storage.readAll(" ").isEmpty());
    }

    @Test
    void readAllSkipsCorruptLines() throws Exception {
        storage.store(message("m1", SESSION, MARCH, "ok"));
        Path file = tempDir.resolve("sessions").resolve("202603").resolve(SESSION + ".jsonl");
        Files.writeString(file, "not json at all\n{\"record_type\":\"message\",\"trunc",
                StandardOpenOption.APPEND);

        List<Map<String, Object>> entries = storage.readAll(SESSION);

        assertEquals(1, entries.size());
        assertEquals("m1", entries.get(0).get("record_id"));
    }

    @Test
    void storeReturnsFalseForInvalidRecords() {
        assertFalse(storage.store(null));
        assertFalse(storage.store(message("m1", "", MARCH, "x")));
        assertFalse(storage.store(message("", SESSION, MARCH, "x")));
        assertFalse(storage.store(ToolCallRecord.builder().recordId("t1").sessionId(SESSION).timestamp(MARCH)
                .build()));
        assertTrue(storage.listSessions().isEmpty());
    }

    @Test
    void storeStampsMissingTimestampFromClock() {
        assertTrue(storage.store(message("m1", SESSION, null, "x")));

        List<Map<String, Object>> entries = storage.readAll(SESSION);
        assertEquals(1, entries.size());
        assertEquals(MARCH, Instant.parse((String) entries.get(0).get("timestamp")));
    }

    @Test
    void rejectsPathTraversalInSessionId() {
        assertFalse(storage.store(message("m1", "../escape", MARCH, "x")));
        assertFalse(storage.store(message("m2", "a/b", MARCH, "x")));
        assertTrue(storage.readAll("../escape").isEmpty());
        assertFalse(Files.exists(tempDir.resolve("escape.jsonl")));
    }

    @Test
    void concurrentStoresProduceOneParseableLineEach() throws Exception {
        int writers = 8;
        int perWriter = 50;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int w = 0; w < writers; w++) {
                int writer = w;
                futures.add(executor.submit(() -> {
                    start.await();
                    int ok = 0;
                    for (int i = 0; i < perWriter; i++) {
                        String content = "writer " + writer + " message " + i + " " + "x".repeat(200);
                        if (storage.store(message(writer + "-" + i, SESSION, MARCH, content))) {
                            ok++;
                        }
                    }
                    return ok;
                }));
            }
            start.countDown();
            int stored = 0;
            for (Future<Integer> future : futures) {
                stored += future.get(30, TimeUnit.SECONDS);
            }
            assertEquals(writers * perWriter, stored);
        } finally {
            executor.shutdownNow();
        }

        Path file = tempDir.resolve("sessions").resolve("202603").resolve(SESSION + ".jsonl");
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(writers * perWriter, lines.size());
        for (String line : lines) {
            assertTrue(codec.parseLine(line).flatMap(codec::fromMap).isPresent(), line);
        }
    }

    // ===== Cleanup =====

    @Test
    void cleanupRemovesOldLinesAndKeepsRecentOnes() throws Exception {
        Instant cutoff = MARCH.plus(Duration.ofDays(1));
        for (int i = 0; i < 5; i++) {
            storage.store(message("old-" + i, SESSION, MARCH.minus(Duration.ofHours(i + 1)), "old"));
        }
        for (int i = 0; i < 3; i++) {
            storage.store(message("new-" + i, SESSION, cutoff.plus(Duration.ofHours(i)), "new"));
        }

        int removed = storage.cleanup(cutoff);

        assertEquals(5, removed);
        List<Map<String, Object>> remaining = storage.readAll(SESSION);
        assertEquals(3, remaining.size());
        assertTrue(remaining.stream().allMatch(e -> ((String) e.get("record_id")).startsWith("new-")));
        Path dir = tempDir.resolve("sessions").resolve("202603");
        assertFalse(Files.exists(dir.resolve(SESSION + ".jsonl.tmp")));
    }

    @Test
    void cleanupIncludesRecordAtCutoff() {
        storage.store(message("edge", SESSION, MARCH, "edge"));

        assertEquals(0, storage.cleanup(MARCH));
        assertEquals(1, storage.readAll(SESSION).size());
    }

    @Test
    void cleanupDeletesFullyExpiredFile() {
        storage.store(message("old-1", "stale", MARCH.minus(Duration.ofDays(40)), "x"));
        storage.store(message("old-2", "stale", MARCH.minus(Duration.ofDays(35)), "y"));
        storage.store(message("keep", SESSION, MARCH, "z"));

        int removed = storage.cleanup(MARCH.minus(Duration.ofDays(1)));

        assertEquals(2, removed);
        assertFalse(Files.exists(tempDir.resolve("sessions").resolve("202603").resolve("stale.jsonl")));
        assertEquals(List.of(SESSION), storage.listSessions());
    }

    @Test
    void cleanupReleasesLockOfDeletedFile() {
        storage.store(message("old-1", "stale", MARCH.minus(Duration.ofDays(40)), "x"));
        storage.store(message("keep", SESSION, MARCH, "z"));
        assertEquals(2, storage.trackedLockCount());

        storage.cleanup(MARCH.minus(Duration.ofDays(1)));

        assertEquals(1, storage.trackedLockCount());
        assertTrue(storage.store(message("again", "stale", MARCH, "y")));
        assertEquals(1, storage.readAll("stale").size());
        assertEquals(2, storage.trackedLockCount());
    }

    @Test
    void cleanupKeepsUnparseableLines() throws Exception {
        storage.store(message("old", SESSION, MARCH.minus(Duration.ofDays(10)), "x"));
        Path file = tempDir.resolve("sessions").resolve("202603").resolve(SESSION + ".jsonl");
        Files.writeString(file, "garbage line\n", StandardOpenOption.APPEND);

        int removed = storage.cleanup(MARCH);

        assertEquals(1, removed);
        assertEquals(List.of("garbage line"), Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @Test
    void countOlderThanDoesNotModifyFiles() {
        storage.store(message("old", SESSION, MARCH.minus(Duration.ofDays(10)), "x"));
        storage.store(message("new", SESSION, MARCH, "y"));

        assertEquals(1, storage.countOlderThan(MARCH.minus(Duration.ofDays(1))));
        assertEquals(2, storage.readAll(SESSION).size());
    }

    // ===== Listing =====

    @Test
    void listsSessionsAndStorageInfo() {
        storage.store(message("m1", "b-session", MARCH, "x"));
        storage.store(message("m2", "a-session", MARCH, "y"));
        clock.set(APRIL);
        storage.store(message("m3", "a-session", APRIL, "z"));

        assertEquals(List.of("a-session", "b-session"), storage.listSessions());

        StorageInfo info = storage.getStorageInfo();
        assertEquals(2, info.getSessionCount());
        assertEquals(3, info.getFileCount());
        assertTrue(info.getTotalBytes() > 0);
        assertTrue(info.getBasePath().endsWith("sessions"));
    }

    private static HistoryRecord message(String id, String sessionId, Instant timestamp, String content) {
        return MessageRecord.builder()
                .recordId(id)
                .sessionId(sessionId)
                .timestamp(timestamp)
                .messageType(MessageType.USER)
                .content(content)
                .build();
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
