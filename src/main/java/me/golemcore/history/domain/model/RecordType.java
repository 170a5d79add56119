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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Discriminator of persisted history records. The {@link #getValue() value} is
 * the literal written to the {@code record_type} field of every JSONL line.
 */
public enum RecordType {

    MESSAGE("message"),
    TOOL_CALL("tool_call"),
    LLM_REQUEST("llm_request"),
    LLM_RESPONSE("llm_response"),
    TOKEN_USAGE("token_usage"),
    COST("cost");

    private final String value;

    RecordType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolves a discriminator literal. Unknown or null values yield empty so that
     * readers can skip records written by newer versions.
     */
    public static Optional<RecordType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (RecordType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
