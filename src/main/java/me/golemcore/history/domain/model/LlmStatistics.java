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
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LLM call counts, latency and outcome distribution of a session.
 */
@Data
@Builder
public class LlmStatistics {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("total_requests")
    private int totalRequests;

    @JsonProperty("total_responses")
    private int totalResponses;

    @JsonProperty("error_count")
    private int errorCount;

    @JsonProperty("success_rate")
    private double successRate;

    @JsonProperty("avg_response_time")
    private double avgResponseTime;

    @JsonProperty("models_used")
    private List<String> modelsUsed;

    @JsonProperty("finish_reason_distribution")
    private Map<String, Integer> finishReasonDistribution;

    @JsonProperty("model_breakdown")
    private Map<String, ModelCalls> modelBreakdown;

    public static LlmStatistics empty(String sessionId) {
        return LlmStatistics.builder()
                .sessionId(sessionId)
                .successRate(1.0)
                .modelsUsed(List.of())
                .finishReasonDistribution(new LinkedHashMap<>())
                .modelBreakdown(new LinkedHashMap<>())
                .build();
    }

    @Data
    @NoArgsConstructor
    public static class ModelCalls {

        @JsonProperty("request_count")
        private int requestCount;

        @JsonProperty("response_count")
        private int responseCount;

        @JsonProperty("total_response_time")
        private double totalResponseTime;

        @JsonProperty("finish_reasons")
        private Map<String, Integer> finishReasons = new LinkedHashMap<>();

        @JsonProperty("avg_response_time")
        public double getAvgResponseTime() {
            return responseCount > 0 ? totalResponseTime / responseCount : 0.0;
        }
    }
}
