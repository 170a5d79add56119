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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Token consumption of a session, summed over every persisted
 * {@link TokenUsageRecord} line.
 */
@Data
@Builder
public class TokenStatistics {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("total_tokens")
    private long totalTokens;

    @JsonProperty("prompt_tokens")
    private long promptTokens;

    @JsonProperty("completion_tokens")
    private long completionTokens;

    @JsonProperty("record_count")
    private int recordCount;

    @JsonProperty("avg_tokens_per_record")
    private double avgTokensPerRecord;

    @JsonProperty("models_used")
    private List<String> modelsUsed;

    @JsonProperty("model_breakdown")
    private Map<String, ModelTokens> modelBreakdown;

    public static TokenStatistics empty(String sessionId) {
        return TokenStatistics.builder()
                .sessionId(sessionId)
                .modelsUsed(List.of())
                .modelBreakdown(new LinkedHashMap<>())
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ModelTokens {

        @JsonProperty("total_tokens")
        private long totalTokens;

        @JsonProperty("prompt_tokens")
        private long promptTokens;

        @JsonProperty("completion_tokens")
        private long completionTokens;

        @JsonProperty("request_count")
        private int requestCount;
    }
}
