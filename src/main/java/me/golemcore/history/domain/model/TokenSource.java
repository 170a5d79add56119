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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of token counts in a {@link TokenUsageRecord}.
 *
 * <ul>
 * <li>{@code local} - estimated before the call (confidence 0.7)</li>
 * <li>{@code api} - reported by the provider (confidence 1.0)</li>
 * <li>{@code hybrid} - local estimate corrected by partial provider data</li>
 * </ul>
 */
public enum TokenSource {

    LOCAL("local"),
    API("api"),
    HYBRID("hybrid");

    private final String value;

    TokenSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TokenSource fromValue(String value) {
        if (value == null) {
            return LOCAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TokenSource source : values()) {
            if (source.value.equals(normalized)) {
                return source;
            }
        }
        return LOCAL;
    }
}
