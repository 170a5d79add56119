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

import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.MessageRecord;
import me.golemcore.history.domain.model.RecordType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Message search and session export.
 *
 * <p>
 * Supported export formats:
 * <ul>
 * <li>{@code json} - pretty-printed document with records grouped by type and
 * summary statistics</li>
 * <li>{@code csv} - {@code timestamp,role,content} rows over message
 * records</li>
 * </ul>
 */
@Service
@Slf4j
public class HistoryExportService {

    public static final String FORMAT_JSON = "json";
    public static final String FORMAT_CSV = "csv";

    private static final String LOG_PREFIX = "[History]";
    private static final String CSV_HEADER = "timestamp,role,content";

    private static final Map<RecordType, String> GROUP_NAMES = new EnumMap<>(RecordType.class);

    static {
        GROUP_NAMES.put(RecordType.MESSAGE, "messages");
        GROUP_NAMES.put(RecordType.TOOL_CALL, "tool_calls");
        GROUP_NAMES.put(RecordType.LLM_REQUEST, "llm_requests");
        GROUP_NAMES.put(RecordType.LLM_RESPONSE, "llm_responses");
        GROUP_NAMES.put(RecordType.TOKEN_USAGE, "token_usage");
        GROUP_NAMES.put(RecordType.COST, "costs");
    }

    private final HistoryManager historyManager;
    private final HistoryRecordCodec codec;
    private final ObjectMapper prettyMapper;
    private final Clock clock;

    public HistoryExportService(HistoryManager historyManager, HistoryRecordCodec codec, ObjectMapper objectMapper,
            Clock clock) {
        this.historyManager = historyManager;
        this.codec = codec;
        this.prettyMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Finds message records whose content contains {@code text}, ignoring case,
     * in log order.
     */
    public List<MessageRecord> searchMessages(String sessionId, String text, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        if (text == null || text.isEmpty() || limit == 0) {
            return List.of();
        }
        String needle = text.toLowerCase(Locale.ROOT);
        List<MessageRecord> matches = new ArrayList<>();
        for (MessageRecord message : historyManager.loadRecords(sessionId, MessageRecord.class,
                RecordType.MESSAGE)) {
            if (message.getContent().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(message);
                if (matches.size() >= limit) {
                    break;
                }
            }
        }
        return matches;
    }

    /**
     * Renders a session in the requested format.
     *
     * @throws IllegalArgumentException
     *             if the format is not {@code json} or {@code csv}
     */
    public String exportSession(String sessionId, String format) {
        String normalized = format != null ? format.trim().toLowerCase(Locale.ROOT) : "";
        List<HistoryRecord> records = historyManager.loadRecords(sessionId);
        log.debug("{} Exporting {} records of session {} as {}", LOG_PREFIX, records.size(), sessionId,
                normalized);
        return switch (normalized) {
        case FORMAT_JSON -> toJson(sessionId, records);
        case FORMAT_CSV -> toCsv(records);
        default -> throw new IllegalArgumentException("Unsupported export format: " + format);
        };
    }

    private String toJson(String sessionId, List<HistoryRecord> records) {
        Map<RecordType, List<Map<String, Object>>> groups = new EnumMap<>(RecordType.class);
        for (RecordType type : RecordType.values()) {
            groups.put(type, new ArrayList<>());
        }
        Instant first = null;
        Instant last = null;
        for (HistoryRecord record : records) {
            groups.get(record.getRecordType()).add(codec.toMap(record));
            Instant timestamp = record.getTimestamp();
            if (first == null || timestamp.isBefore(first)) {
                first = timestamp;
            }
            if (last == null || timestamp.isAfter(last)) {
                last = timestamp;
            }
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("session_id", sessionId);
        document.put("export_timestamp", clock.instant().toString());
        for (RecordType type : RecordType.values()) {
            document.put(GROUP_NAMES.get(type), groups.get(type));
        }

        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("total_messages", groups.get(RecordType.MESSAGE).size());
        statistics.put("total_tool_calls", groups.get(RecordType.TOOL_CALL).size());
        statistics.put("total_llm_calls", groups.get(RecordType.LLM_REQUEST).size());
        statistics.put("session_duration_seconds",
                first != null ? Duration.between(first, last).toMillis() / 1000.0 : 0.0);
        document.put("statistics", statistics);

        try {
            return prettyMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to export session " + sessionId, e);
        }
    }

    private String toCsv(List<HistoryRecord> records) {
        StringBuilder csv = new StringBuilder(CSV_HEADER).append("\r\n");
        for (HistoryRecord record : records) {
            if (record instanceof MessageRecord message) {
                csv.append(escapeCsv(message.getTimestamp().toString())).append(',')
                        .append(escapeCsv(message.getMessageType().getValue())).append(',')
                        .append(escapeCsv(message.getContent())).append("\r\n");
            }
        }
        return csv.toString();
    }

    static String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuoting = value.indexOf(',') >= 0 || value.indexOf('"') >= 0
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
        if (!needsQuoting) {
            return value;
        }
        return "\"" + value.replace("\"", "\"\"") + "\"";
    }
}
