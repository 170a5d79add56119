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

import me.golemcore.history.domain.model.Message;
import me.golemcore.history.domain.model.TokenSource;
import me.golemcore.history.domain.model.TokenUsage;
import me.golemcore.history.domain.model.TokenUsageRecord;
import me.golemcore.history.domain.session.SessionContext;
import me.golemcore.history.port.outbound.HistoryStoragePort;
import me.golemcore.history.port.outbound.TokenCounterPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Estimates token usage before an LLM call and reconciles the estimate with the
 * provider's reported usage afterwards.
 *
 * <p>
 * Usage payloads are recognized in this order:
 * <ol>
 * <li>OpenAI: {@code usage.prompt_tokens / completion_tokens / total_tokens}</li>
 * <li>Gemini: {@code usageMetadata.promptTokenCount / candidatesTokenCount /
 * totalTokenCount}</li>
 * <li>Anthropic: {@code usage.input_tokens / output_tokens}</li>
 * </ol>
 * Anything else leaves the estimate untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TokenUsageTracker {

    private static final String LOG_PREFIX = "[TokenTracker]";

    private final TokenCounterPort tokenCounter;
    private final HistoryStoragePort storage;
    private final Clock clock;

    /**
     * Creates and persists a local estimate for an outbound request. The session
     * falls back to the one bound to the current thread; without any session the
     * record is returned but not persisted.
     */
    public TokenUsageRecord trackRequest(List<Message> messages, String model, String provider,
            String sessionId) {
        int estimate = estimateTokens(messages);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("estimation_method", "local");
        metadata.put("message_count", messages != null ? messages.size() : 0);

        TokenUsageRecord record = TokenUsageRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .sessionId(resolveSession(sessionId))
                .timestamp(clock.instant())
                .model(model)
                .provider(provider != null ? provider : "")
                .promptTokens(estimate)
                .completionTokens(0)
                .totalTokens(estimate)
                .source(TokenSource.LOCAL)
                .confidence(TokenUsageRecord.LOCAL_CONFIDENCE)
                .metadata(metadata)
                .build();
        persist(record);
        return record;
    }

    /**
     * Overwrites the record's counts with the provider's usage, if the payload
     * carries any, and persists it again under the same record id.
     */
    public TokenUsageRecord updateFromResponse(TokenUsageRecord record, Map<String, Object> payload) {
        if (record == null) {
            return null;
        }
        Optional<TokenUsage> usage = extractUsage(payload);
        if (usage.isEmpty()) {
            log.debug("{} No usage in response for {}, keeping estimate", LOG_PREFIX, record.getRecordId());
            return record;
        }
        TokenUsage actual = usage.get();
        record.setPromptTokens(actual.getPromptTokens());
        record.setCompletionTokens(actual.getCompletionTokens());
        record.setTotalTokens(actual.getTotalTokens());
        record.setSource(TokenSource.API);
        record.setConfidence(TokenUsageRecord.API_CONFIDENCE);
        if (record.getMetadata() == null) {
            record.setMetadata(new LinkedHashMap<>());
        }
        record.getMetadata().put("estimation_method", "api");
        persist(record);
        return record;
    }

    /**
     * Stateless estimate. Never throws: counter failures and missing counts
     * become 0.
     */
    public int estimateTokens(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        try {
            Integer count = tokenCounter.countMessagesTokens(messages);
            return count != null && count > 0 ? count : 0;
        } catch (RuntimeException e) { // NOSONAR - estimation is best effort
            log.debug("{} Token counter failed: {}", LOG_PREFIX, e.getMessage());
            return 0;
        }
    }

    /**
     * Reads provider usage from a raw response payload.
     */
    public Optional<TokenUsage> extractUsage(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return Optional.empty();
        }
        Map<?, ?> usage = asMap(payload.get("usage"));
        if (usage != null && (usage.containsKey("prompt_tokens") || usage.containsKey("completion_tokens"))) {
            return Optional.of(triple(usage.get("prompt_tokens"), usage.get("completion_tokens"),
                    usage.get("total_tokens")));
        }
        Map<?, ?> usageMetadata = asMap(payload.get("usageMetadata"));
        if (usageMetadata != null) {
            return Optional.of(triple(usageMetadata.get("promptTokenCount"),
                    usageMetadata.get("candidatesTokenCount"), usageMetadata.get("totalTokenCount")));
        }
        if (usage != null && (usage.containsKey("input_tokens") || usage.containsKey("output_tokens"))) {
            return Optional.of(triple(usage.get("input_tokens"), usage.get("output_tokens"), null));
        }
        return Optional.empty();
    }

    private TokenUsage triple(Object prompt, Object completion, Object total) {
        int promptTokens = toInt(prompt);
        int completionTokens = toInt(completion);
        int totalTokens = total != null ? toInt(total) : promptTokens + completionTokens;
        return new TokenUsage(promptTokens, completionTokens, totalTokens);
    }

    private static int toInt(Object value) {
        if (value instanceof Number number) {
            return Math.max(0, number.intValue());
        }
        if (value instanceof String text) {
            try {
                return Math.max(0, Integer.parseInt(text.trim()));
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    private static Map<?, ?> asMap(Object value) {
        return value instanceof Map<?, ?> map ? map : null;
    }

    private String resolveSession(String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            return sessionId;
        }
        return SessionContext.getCurrent().orElse(null);
    }

    private void persist(TokenUsageRecord record) {
        if (record.getSessionId() == null) {
            log.debug("{} No session bound, record {} not persisted", LOG_PREFIX, record.getRecordId());
            return;
        }
        if (!storage.store(record)) {
            log.warn("{} Failed to persist token usage {}", LOG_PREFIX, record.getRecordId());
        }
    }
}
