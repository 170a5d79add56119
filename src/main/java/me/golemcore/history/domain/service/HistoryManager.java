package me.golemcore.history.domain.service;

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

import me.golemcore.history.domain.model.CleanupResult;
import me.golemcore.history.domain.model.CostRecord;
import me.golemcore.history.domain.model.HistoryQuery;
import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.HistoryResult;
import me.golemcore.history.domain.model.LlmRequestRecord;
import me.golemcore.history.domain.model.LlmResponseRecord;
import me.golemcore.history.domain.model.Message;
import me.golemcore.history.domain.model.MessageRecord;
import me.golemcore.history.domain.model.MessageType;
import me.golemcore.history.domain.model.RecordType;
import me.golemcore.history.domain.model.StorageInfo;
import me.golemcore.history.domain.model.TokenUsage;
import me.golemcore.history.domain.model.TokenUsageRecord;
import me.golemcore.history.domain.model.ToolCallRecord;
import me.golemcore.history.domain.session.SessionContext;
import me.golemcore.history.port.outbound.HistoryStoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point to session history: typed record writes, filtered and paginated
 * queries, retention cleanup and session listing.
 *
 * <p>
 * Everything is built on the raw reads of {@link HistoryStoragePort}. Entries
 * that cannot be decoded are dropped from results; no read path throws on
 * malformed persisted data.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HistoryManager {

    private static final String LOG_PREFIX = "[History]";

    private final HistoryStoragePort storage;
    private final HistoryRecordCodec codec;
    private final Clock clock;

    // ==================== Writes ====================

    public Optional<MessageRecord> recordMessage(String sessionId, MessageType messageType, String content,
            Map<String, Object> metadata) {
        return resolveSession(sessionId).flatMap(session -> persist(MessageRecord.builder()
                .recordId(newId())
                .sessionId(session)
                .timestamp(clock.instant())
                .messageType(messageType != null ? messageType : MessageType.USER)
                .content(content != null ? content : "")
                .metadata(copy(metadata))
                .build()));
    }

    public Optional<ToolCallRecord> recordToolCall(String sessionId, String toolName, Map<String, Object> toolInput,
            Map<String, Object> toolOutput, Map<String, Object> metadata) {
        return resolveSession(sessionId).flatMap(session -> persist(ToolCallRecord.builder()
                .recordId(newId())
                .sessionId(session)
                .timestamp(clock.instant())
                .toolName(toolName)
                .toolInput(copy(toolInput))
                .toolOutput(toolOutput != null ? new LinkedHashMap<>(toolOutput) : null)
                .metadata(copy(metadata))
                .build()));
    }

    public Optional<LlmRequestRecord> recordLlmRequest(String sessionId, String model, String provider,
            List<Message> messages, Map<String, Object> parameters, Integer estimatedTokens) {
        return resolveSession(sessionId).flatMap(session -> persist(LlmRequestRecord.builder()
                .recordId(newId())
                .sessionId(session)
                .timestamp(clock.instant())
                .model(model)
                .provider(provider != null ? provider : "")
                .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                .parameters(copy(parameters))
                .estimatedTokens(estimatedTokens)
                .build()));
    }

    public Optional<LlmResponseRecord> recordLlmResponse(String sessionId, String requestId, String content,
            String finishReason, TokenUsage tokenUsage, double responseTime, String model) {
        return resolveSession(sessionId).flatMap(session -> persist(LlmResponseRecord.builder()
                .recordId(newId())
                .sessionId(session)
                .timestamp(clock.instant())
                .requestId(requestId)
                .content(content != null ? content : "")
                .finishReason(finishReason != null ? finishReason : "")
                .tokenUsage(tokenUsage != null ? tokenUsage : TokenUsage.zero())
                .responseTime(responseTime)
                .model(model != null ? model : "")
                .build()));
    }

    /**
     * Persists an already built token usage record, filling in the session from
     * the current context when it has none.
     */
    public Optional<TokenUsageRecord> recordTokenUsage(TokenUsageRecord record) {
        return persistPrepared(record);
    }

    public Optional<CostRecord> recordCost(CostRecord record) {
        return persistPrepared(record);
    }

    // ==================== Reads ====================

    /**
     * Decodes every readable record of a session, in log order.
     */
    public List<HistoryRecord> loadRecords(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Collections.emptyList();
        }
        List<HistoryRecord> records = new ArrayList<>();
        for (Map<String, Object> raw : storage.readAll(sessionId)) {
            codec.fromMap(raw).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Decodes only the records of one type. Entries of other types are skipped
     * before binding.
     */
    public <T extends HistoryRecord> List<T> loadRecords(String sessionId, Class<T> type, RecordType recordType) {
        if (sessionId == null || sessionId.isBlank()) {
            return Collections.emptyList();
        }
        List<T> records = new ArrayList<>();
        for (Map<String, Object> raw : storage.readAll(sessionId)) {
            codec.fromMap(raw, type, recordType).ifPresent(records::add);
        }
        return records;
    }

    /**
     * Filters a session's records and returns one page of them. Time bounds are
     * inclusive; {@code total} is the filtered count before pagination.
     *
     * @throws IllegalArgumentException
     *             if offset or limit is negative
     */
    public HistoryResult query(HistoryQuery query) {
        if (query == null) {
            return HistoryResult.empty();
        }
        if (query.getOffset() != null && query.getOffset() < 0) {
            throw new IllegalArgumentException("offset must not be negative: " + query.getOffset());
        }
        if (query.getLimit() != null && query.getLimit() < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + query.getLimit());
        }

        List<HistoryRecord> filtered = new ArrayList<>();
        for (HistoryRecord record : loadRecords(query.getSessionId())) {
            if (matches(record, query)) {
                filtered.add(record);
            }
        }

        int total = filtered.size();
        int from = query.getOffset() != null ? Math.min(query.getOffset(), total) : 0;
        int to = query.getLimit() != null ? (int) Math.min((long) from + query.getLimit(), total) : total;
        return new HistoryResult(new ArrayList<>(filtered.subList(from, to)), total);
    }

    private boolean matches(HistoryRecord record, HistoryQuery query) {
        Instant timestamp = record.getTimestamp();
        if (query.getStartTime() != null && timestamp.isBefore(query.getStartTime())) {
            return false;
        }
        if (query.getEndTime() != null && timestamp.isAfter(query.getEndTime())) {
            return false;
        }
        return query.getRecordTypes() == null || query.getRecordTypes().isEmpty()
                || query.getRecordTypes().contains(record.getRecordType());
    }

    // ==================== Retention ====================

    /**
     * Removes every record older than the cutoff from all sessions.
     */
    public CleanupResult cleanup(Instant cutoff) {
        int removed = storage.cleanup(cutoff);
        log.info("{} Cleanup before {} removed {} records", LOG_PREFIX, cutoff, removed);
        return CleanupResult.builder()
                .cleanedRecords(removed)
                .cutoffDate(cutoff)
                .dryRun(false)
                .build();
    }

    /**
     * Removes records older than {@code days} days. A dry run only counts them.
     *
     * @throws IllegalArgumentException
     *             if days is not positive
     */
    public CleanupResult cleanupOlderThan(int days, boolean dryRun) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        if (!dryRun) {
            return cleanup(cutoff);
        }
        int wouldRemove = storage.countOlderThan(cutoff);
        log.info("{} Dry run: {} records older than {} would be removed", LOG_PREFIX, wouldRemove, cutoff);
        return CleanupResult.builder()
                .cleanedRecords(wouldRemove)
                .cutoffDate(cutoff)
                .dryRun(true)
                .build();
    }

    public List<String> listSessions() {
        return storage.listSessions();
    }

    public StorageInfo getStorageInfo() {
        return storage.getStorageInfo();
    }

    // ==================== Helpers ====================

    private <T extends HistoryRecord> Optional<T> persistPrepared(T record) {
        if (record == null) {
            return Optional.empty();
        }
        Optional<String> session = resolveSession(record.getSessionId());
        if (session.isEmpty()) {
            return Optional.empty();
        }
        record.setSessionId(session.get());
        if (record.getRecordId() == null || record.getRecordId().isBlank()) {
            record.setRecordId(newId());
        }
        if (record.getTimestamp() == null) {
            record.setTimestamp(clock.instant());
        }
        return persist(record);
    }

    private <T extends HistoryRecord> Optional<T> persist(T record) {
        if (storage.store(record)) {
            return Optional.of(record);
        }
        log.warn("{} Record {} ({}) was not persisted", LOG_PREFIX, record.getRecordId(),
                record.getRecordType().getValue());
        return Optional.empty();
    }

    private Optional<String> resolveSession(String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            return Optional.of(sessionId);
        }
        Optional<String> current = SessionContext.getCurrent();
        if (current.isEmpty()) {
            log.debug("{} No session bound, dropping record", LOG_PREFIX);
        }
        return current;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source != null ? new LinkedHashMap<>(source) : new LinkedHashMap<>();
    }

    private static String newId() {
        return UUID.randomUUID().toString();
    }
}
