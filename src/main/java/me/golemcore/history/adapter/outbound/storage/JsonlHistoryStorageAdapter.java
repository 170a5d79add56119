package me.golemcore.history.adapter.outbound.storage;

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

import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.StorageInfo;
import me.golemcore.history.domain.service.HistoryRecordCodec;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.HistoryStoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only JSONL storage of history records on the local filesystem.
 *
 * <p>
 * Directory structure:
 *
 * <pre>
 * {basePath}/sessions/{yyyyMM}/{sessionId}.jsonl
 * </pre>
 *
 * The month partition is taken from the injected clock at write time, so a
 * session that spans a month boundary is split across two partitions. Reads
 * merge every partition in ascending order.
 *
 * <p>
 * Appends, reads and cleanup rewrites of the same file are serialized on a
 * per-file lock. Cleanup rewrites go through a temp file and an atomic rename,
 * so readers never observe a half-written file.
 *
 * @see HistoryStoragePort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlHistoryStorageAdapter implements HistoryStoragePort {

    private static final String LOG_PREFIX = "[HistoryStorage]";
    private static final String FILE_EXTENSION = ".jsonl";
    private static final String TIMESTAMP_FIELD = "timestamp";
    private static final DateTimeFormatter PARTITION_FORMAT = DateTimeFormatter.ofPattern("yyyyMM");

    private final HistoryProperties properties;
    private final HistoryRecordCodec codec;
    private final Clock clock;

    private final Map<Path, Object> fileLocks = new ConcurrentHashMap<>();
    private Path basePath;
    private Path sessionsPath;

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        this.sessionsPath = basePath.resolve(properties.getStorage().getSessionsDirectory()).normalize();
        try {
            Files.createDirectories(sessionsPath);
            log.info("{} Initialized at: {}", LOG_PREFIX, sessionsPath);
        } catch (IOException e) {
            log.error("{} Failed to create storage directory: {}", LOG_PREFIX, sessionsPath, e);
        }
    }

    @Override
    public boolean store(HistoryRecord record) {
        if (record == null) {
            return false;
        }
        try {
            record.validate();
            if (record.getTimestamp() == null) {
                record.setTimestamp(clock.instant());
            }
            String partition = PARTITION_FORMAT.format(clock.instant().atZone(ZoneOffset.UTC));
            Path file = resolveSessionFile(sessionsPath.resolve(partition), record.getSessionId());
            appendLine(file, codec.toJsonLine(record) + "\n");
            log.trace("{} Stored {} {} for session {}", LOG_PREFIX, record.getRecordType().getValue(),
                    record.getRecordId(), record.getSessionId());
            return true;
        } catch (IOException | RuntimeException e) { // NOSONAR - store never throws
            log.warn("{} Failed to store {} record {}: {}", LOG_PREFIX,
                    record.getRecordType() != null ? record.getRecordType().getValue() : "unknown",
                    record.getRecordId(), e.getMessage());
            return false;
        }
    }

    @Override
    public List<Map<String, Object>> readAll(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        try {
            for (Path partition : listPartitions()) {
                Path file = resolveSessionFile(partition, sessionId);
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                for (String line : readLines(file)) {
                    codec.parseLine(line).ifPresent(entries::add);
                }
            }
        } catch (IOException e) {
            log.warn("{} Failed to read session {}: {}", LOG_PREFIX, sessionId, e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("{} Rejected session id {}: {}", LOG_PREFIX, sessionId, e.getMessage());
        }
        return entries;
    }

    @Override
    public int cleanup(Instant cutoff) {
        int removed = 0;
        for (Path file : listSessionFiles()) {
            try {
                removed += cleanupFile(file, cutoff);
            } catch (IOException e) {
                log.warn("{} Failed to clean up {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        deleteEmptyPartitions();
        if (removed > 0) {
            log.info("{} Removed {} records older than {}", LOG_PREFIX, removed, cutoff);
        }
        return removed;
    }

    @Override
    public int countOlderThan(Instant cutoff) {
        int count = 0;
        for (Path file : listSessionFiles()) {
            try {
                for (String line : readLines(file)) {
                    if (isOlderThan(line, cutoff)) {
                        count++;
                    }
                }
            } catch (IOException e) {
                log.warn("{} Failed to scan {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return count;
    }

    @Override
    public List<String> listSessions() {
        Set<String> sessions = new TreeSet<>();
        for (Path file : listSessionFiles()) {
            sessions.add(sessionIdOf(file));
        }
        return new ArrayList<>(sessions);
    }

    @Override
    public StorageInfo getStorageInfo() {
        Set<String> sessions = new TreeSet<>();
        int fileCount = 0;
        long totalBytes = 0;
        for (Path file : listSessionFiles()) {
            sessions.add(sessionIdOf(file));
            fileCount++;
            try {
                totalBytes += Files.size(file);
            } catch (IOException e) {
                log.debug("{} Cannot stat {}: {}", LOG_PREFIX, file, e.getMessage());
            }
        }
        return StorageInfo.builder()
                .basePath(sessionsPath.toString())
                .sessionCount(sessions.size())
                .fileCount(fileCount)
                .totalBytes(totalBytes)
                .build();
    }

    private int cleanupFile(Path file, Instant cutoff) throws IOException {
        synchronized (lockFor(file)) {
            if (!Files.isRegularFile(file)) {
                return 0;
            }
            List<String> kept = new ArrayList<>();
            int removed = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                if (isOlderThan(line, cutoff)) {
                    removed++;
                } else {
                    kept.add(line);
                }
            }
            if (removed == 0) {
                return 0;
            }
            if (kept.isEmpty()) {
                Files.deleteIfExists(file);
                fileLocks.remove(file);
                log.debug("{} Deleted emptied file {}", LOG_PREFIX, file);
            } else {
                writeAtomic(file, String.join("\n", kept) + "\n");
            }
            return removed;
        }
    }

    /**
     * A line counts as older only when its timestamp can be read; lines that
     * cannot be parsed are always kept.
     */
    private boolean isOlderThan(String line, Instant cutoff) {
        return codec.parseLine(line)
                .flatMap(entry -> parseTimestamp(entry.get(TIMESTAMP_FIELD)))
                .map(timestamp -> timestamp.isBefore(cutoff))
                .orElse(false);
    }

    static Optional<Instant> parseTimestamp(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(text));
        } catch (DateTimeParseException ignored) {
            // try offset and local forms below
        }
        try {
            return Optional.of(OffsetDateTime.parse(text).toInstant());
        } catch (DateTimeParseException ignored) {
            // try local form below
        }
        try {
            return Optional.of(LocalDateTime.parse(text).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private void writeAtomic(Path targetPath, String content) throws IOException {
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        try {
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }
            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("{} Atomic move not supported, using regular move", LOG_PREFIX);
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("{} Failed to cleanup temp file: {}", LOG_PREFIX, tempPath);
            }
            throw e;
        }
    }

    private List<String> readLines(Path file) throws IOException {
        synchronized (lockFor(file)) {
            if (!Files.isRegularFile(file)) {
                return Collections.emptyList();
            }
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        }
    }

    private List<Path> listPartitions() throws IOException {
        if (sessionsPath == null || !Files.isDirectory(sessionsPath)) {
            return Collections.emptyList();
        }
        List<Path> partitions = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(sessionsPath, Files::isDirectory)) {
            for (Path partition : stream) {
                partitions.add(partition);
            }
        }
        partitions.sort((left, right) -> left.getFileName().toString()
                .compareTo(right.getFileName().toString()));
        return partitions;
    }

    private List<Path> listSessionFiles() {
        List<Path> files = new ArrayList<>();
        try {
            for (Path partition : listPartitions()) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(partition, "*" + FILE_EXTENSION)) {
                    for (Path file : stream) {
                        if (Files.isRegularFile(file)) {
                            files.add(file);
                        }
                    }
                }
            }
        } catch (IOException e) {
            log.warn("{} Failed to list session files: {}", LOG_PREFIX, e.getMessage());
        }
        return files;
    }

    private void deleteEmptyPartitions() {
        try {
            for (Path partition : listPartitions()) {
                try (DirectoryStream<Path> stream = Files.newDirectoryStream(partition)) {
                    if (stream.iterator().hasNext()) {
                        continue;
                    }
                }
                Files.deleteIfExists(partition);
            }
        } catch (IOException e) {
            log.debug("{} Failed to remove empty partitions: {}", LOG_PREFIX, e.getMessage());
        }
    }

    private Path resolveSessionFile(Path partition, String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("session_id must not be blank");
        }
        if (sessionId.contains("/") || sessionId.contains("\\") || sessionId.contains("..")) {
            throw new IllegalArgumentException("Path traversal blocked: " + sessionId);
        }
        Path resolved = partition.resolve(sessionId + FILE_EXTENSION).normalize();
        if (!resolved.startsWith(sessionsPath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + sessionId);
        }
        return resolved;
    }

    private static String sessionIdOf(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - FILE_EXTENSION.length());
    }

    private Object lockFor(Path file) {
        return fileLocks.computeIfAbsent(file, key -> new Object());
    }

    // Retries when cleanup released the lock while this writer was waiting on it.
    private void appendLine(Path file, String line) throws IOException {
        while (true) {
            Object lock = lockFor(file);
            synchronized (lock) {
                if (fileLocks.get(file) != lock) {
                    continue;
                }
                Files.createDirectories(file.getParent());
                Files.writeString(file, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                return;
            }
        }
    }

    int trackedLockCount() {
        return fileLocks.size();
    }
}
