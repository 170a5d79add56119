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

import me.golemcore.history.domain.model.CostRecord;
import me.golemcore.history.domain.model.CostStatistics;
import me.golemcore.history.domain.model.LlmRequestRecord;
import me.golemcore.history.domain.model.LlmResponseRecord;
import me.golemcore.history.domain.model.LlmStatistics;
import me.golemcore.history.domain.model.RecordType;
import me.golemcore.history.domain.model.TokenStatistics;
import me.golemcore.history.domain.model.TokenUsageRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-session aggregates over token usage, cost and LLM call records.
 *
 * <p>
 * Token usage is summed over every persisted line, including the local estimate
 * and the reconciled line that share one record id. An empty session yields
 * zeroed statistics with a success rate of 1.0.
 */
@Service
@RequiredArgsConstructor
public class HistoryStatisticsService {

    private final HistoryManager historyManager;

    public TokenStatistics getTokenStatistics(String sessionId) {
        List<TokenUsageRecord> records = historyManager.loadRecords(sessionId, TokenUsageRecord.class,
                RecordType.TOKEN_USAGE);
        if (records.isEmpty()) {
            return TokenStatistics.empty(sessionId);
        }

        long prompt = 0;
        long completion = 0;
        long total = 0;
        Set<String> models = new LinkedHashSet<>();
        Map<String, TokenStatistics.ModelTokens> breakdown = new LinkedHashMap<>();
        for (TokenUsageRecord record : records) {
            prompt += record.getPromptTokens();
            completion += record.getCompletionTokens();
            total += record.getTotalTokens();
            models.add(record.getModel());
            TokenStatistics.ModelTokens modelTokens = breakdown.computeIfAbsent(record.getModel(),
                    key -> new TokenStatistics.ModelTokens());
            modelTokens.setPromptTokens(modelTokens.getPromptTokens() + record.getPromptTokens());
            modelTokens.setCompletionTokens(modelTokens.getCompletionTokens() + record.getCompletionTokens());
            modelTokens.setTotalTokens(modelTokens.getTotalTokens() + record.getTotalTokens());
            modelTokens.setRequestCount(modelTokens.getRequestCount() + 1);
        }

        return TokenStatistics.builder()
                .sessionId(sessionId)
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(total)
                .recordCount(records.size())
                .avgTokensPerRecord((double) total / records.size())
                .modelsUsed(new ArrayList<>(models))
                .modelBreakdown(breakdown)
                .build();
    }

    public CostStatistics getCostStatistics(String sessionId) {
        List<CostRecord> records = historyManager.loadRecords(sessionId, CostRecord.class, RecordType.COST);
        if (records.isEmpty()) {
            return CostStatistics.empty(sessionId);
        }

        double prompt = 0.0;
        double completion = 0.0;
        double total = 0.0;
        Set<String> models = new LinkedHashSet<>();
        Map<String, CostStatistics.ModelCost> breakdown = new LinkedHashMap<>();
        for (CostRecord record : records) {
            prompt += record.getPromptCost();
            completion += record.getCompletionCost();
            total += record.getTotalCost();
            models.add(record.getModel());
            CostStatistics.ModelCost modelCost = breakdown.computeIfAbsent(record.getModel(),
                    key -> new CostStatistics.ModelCost());
            modelCost.setTotalCost(modelCost.getTotalCost() + record.getTotalCost());
            modelCost.setTotalTokens(modelCost.getTotalTokens() + record.getTotalTokens());
            modelCost.setRequestCount(modelCost.getRequestCount() + 1);
        }

        return CostStatistics.builder()
                .sessionId(sessionId)
                .promptCost(prompt)
                .completionCost(completion)
                .totalCost(total)
                .currency(records.get(0).getCurrency())
                .recordCount(records.size())
                .avgCostPerRequest(total / records.size())
                .modelsUsed(new ArrayList<>(models))
                .modelBreakdown(breakdown)
                .build();
    }

    public LlmStatistics getLlmStatistics(String sessionId) {
        List<LlmRequestRecord> requests = historyManager.loadRecords(sessionId, LlmRequestRecord.class,
                RecordType.LLM_REQUEST);
        List<LlmResponseRecord> responses = historyManager.loadRecords(sessionId, LlmResponseRecord.class,
                RecordType.LLM_RESPONSE);
        if (requests.isEmpty() && responses.isEmpty()) {
            return LlmStatistics.empty(sessionId);
        }

        Set<String> models = new LinkedHashSet<>();
        Map<String, LlmStatistics.ModelCalls> breakdown = new LinkedHashMap<>();
        for (LlmRequestRecord request : requests) {
            models.add(request.getModel());
            LlmStatistics.ModelCalls calls = breakdown.computeIfAbsent(request.getModel(),
                    key -> new LlmStatistics.ModelCalls());
            calls.setRequestCount(calls.getRequestCount() + 1);
        }

        int errors = 0;
        double totalResponseTime = 0.0;
        Map<String, Integer> finishReasons = new LinkedHashMap<>();
        for (LlmResponseRecord response : responses) {
            if (response.isError()) {
                errors++;
            }
            totalResponseTime += response.getResponseTime();
            finishReasons.merge(response.getFinishReason(), 1, Integer::sum);
            LlmStatistics.ModelCalls calls = breakdown.computeIfAbsent(response.getModel(),
                    key -> new LlmStatistics.ModelCalls());
            calls.setResponseCount(calls.getResponseCount() + 1);
            calls.setTotalResponseTime(calls.getTotalResponseTime() + response.getResponseTime());
            calls.getFinishReasons().merge(response.getFinishReason(), 1, Integer::sum);
        }

        int responseCount = responses.size();
        return LlmStatistics.builder()
                .sessionId(sessionId)
                .totalRequests(requests.size())
                .totalResponses(responseCount)
                .errorCount(errors)
                .successRate(responseCount > 0 ? (double) (responseCount - errors) / responseCount : 1.0)
                .avgResponseTime(responseCount > 0 ? totalResponseTime / responseCount : 0.0)
                .modelsUsed(new ArrayList<>(models))
                .finishReasonDistribution(finishReasons)
                .modelBreakdown(breakdown)
                .build();
    }
}
