package me.golemcore.history.domain.model;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.SuperBuilder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every persisted history event.
 *
 * <p>
 * Records are immutable once written: storage only appends them, and only bulk
 * retention cleanup may remove lines. The concrete variant is selected by the
 * {@code record_type} discriminator on read; lines with an unknown discriminator
 * are skipped by the codec instead of failing the whole read.
 *
 * <p>
 * Canonical JSON form uses snake_case field names, enum fields rendered as
 * their string value and timestamps as ISO-8601.
 *
 * @see me.golemcore.history.domain.service.HistoryRecordCodec
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "record_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MessageRecord.class, name = "message"),
        @JsonSubTypes.Type(value = ToolCallRecord.class, name = "tool_call"),
        @JsonSubTypes.Type(value = LlmRequestRecord.class, name = "llm_request"),
        @JsonSubTypes.Type(value = LlmResponseRecord.class, name = "llm_response"),
        @JsonSubTypes.Type(value = TokenUsageRecord.class, name = "token_usage"),
        @JsonSubTypes.Type(value = CostRecord.class, name = "cost")
})
@Data
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public abstract class HistoryRecord {

    @JsonProperty("record_id")
    private String recordId;

    @JsonProperty("session_id")
    private String sessionId;

    private Instant timestamp;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @JsonProperty("record_type")
    public abstract RecordType getRecordType();

    /**
     * Checks the fields every persisted record must carry.
     *
     * @throws IllegalArgumentException
     *             if a required field is blank
     */
    public void validate() {
        requireNonBlank(recordId, "record_id");
        requireNonBlank(sessionId, "session_id");
    }

    /**
     * Replaces missing optional fields with their defaults. Called after
     * deserialization so that partially written lines still produce usable
     * records.
     */
    public void applyDefaults() {
        if (metadata == null) {
            metadata = new LinkedHashMap<>();
        }
    }

    protected static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
