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
 * Monetary cost of a session aggregated from its {@link CostRecord}s.
 */
@Data
@Builder
public class CostStatistics {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("total_cost")
    private double totalCost;

    @JsonProperty("prompt_cost")
    private double promptCost;

    @JsonProperty("completion_cost")
    private double completionCost;

    private String currency;

    @JsonProperty("record_count")
    private int recordCount;

    @JsonProperty("avg_cost_per_request")
    private double avgCostPerRequest;

    @JsonProperty("models_used")
    private List<String> modelsUsed;

    @JsonProperty("model_breakdown")
    private Map<String, ModelCost> modelBreakdown;

    public static CostStatistics empty(String sessionId) {
        return CostStatistics.builder()
                .sessionId(sessionId)
                .currency(CostRecord.DEFAULT_CURRENCY)
                .modelsUsed(List.of())
                .modelBreakdown(new LinkedHashMap<>())
                .build();
    }

    @Data
    @NoArgsConstructor
    public static class ModelCost {

        @JsonProperty("total_cost")
        private double totalCost;

        @JsonProperty("total_tokens")
        private long totalTokens;

        @JsonProperty("request_count")
        private int requestCount;

        @JsonProperty("avg_cost_per_request")
        public double getAvgCostPerRequest() {
            return requestCount > 0 ? totalCost / requestCount : 0.0;
        }

        @JsonProperty("avg_cost_per_token")
        public double getAvgCostPerToken() {
            return totalTokens > 0 ? totalCost / totalTokens : 0.0;
        }
    }
}
