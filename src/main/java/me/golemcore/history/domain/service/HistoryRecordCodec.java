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
import me.golemcore.history.domain.model.RecordType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Converts history records to and from their canonical form: a flat JSON
 * object with snake_case keys, the {@code record_type} discriminator, enum
 * values as strings and ISO-8601 timestamps.
 *
 * <p>
 * Decoding is driven by the discriminator only. Unknown discriminators and
 * entries that do not bind to their variant are reported as empty so readers
 * can skip them.
 */
@Component
@Slf4j
public class HistoryRecordCodec {

    private static final String LOG_PREFIX = "[HistoryCodec]";
    private static final String RECORD_TYPE_FIELD = "record_type";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public HistoryRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Serializes a record to a single JSON line (without the trailing newline).
     */
    public String toJsonLine(HistoryRecord record) throws JsonProcessingException {
        return objectMapper.writeValueAsString(record);
    }

    public Map<String, Object> toMap(HistoryRecord record) {
        return objectMapper.convertValue(record, MAP_TYPE);
    }

    /**
     * Parses one JSONL line into its raw map form.
     */
    public Optional<Map<String, Object>> parseLine(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(line, MAP_TYPE));
        } catch (JsonProcessingException e) {
            log.debug("{} Skipping malformed line: {}", LOG_PREFIX, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Rebuilds the typed record from its raw map form, filling in defaults for
     * missing optional fields. Entries without a timestamp are skipped.
     */
    public Optional<HistoryRecord> fromMap(Map<String, Object> raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Object discriminator = raw.get(RECORD_TYPE_FIELD);
        Optional<RecordType> recordType = RecordType.fromValue(discriminator instanceof String s ? s : null);
        if (recordType.isEmpty()) {
            log.debug("{} Skipping record with unknown type: {}", LOG_PREFIX, discriminator);
            return Optional.empty();
        }
        try {
            HistoryRecord record = objectMapper.convertValue(raw, HistoryRecord.class);
            if (record == null) {
                return Optional.empty();
            }
            if (record.getTimestamp() == null) {
                log.debug("{} Skipping {} record without timestamp: {}", LOG_PREFIX,
                        recordType.get().getValue(), record.getRecordId());
                return Optional.empty();
            }
            record.applyDefaults();
            return Optional.of(record);
        } catch (IllegalArgumentException e) {
            log.debug("{} Skipping {} record that failed to bind: {}", LOG_PREFIX,
                    recordType.get().getValue(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Decodes a raw map only if it carries the expected discriminator.
     */
    public <T extends HistoryRecord> Optional<T> fromMap(Map<String, Object> raw, Class<T> type,
            RecordType expected) {
        if (raw == null || !expected.getValue().equals(raw.get(RECORD_TYPE_FIELD))) {
            return Optional.empty();
        }
        return fromMap(raw).filter(type::isInstance).map(type::cast);
    }
}
