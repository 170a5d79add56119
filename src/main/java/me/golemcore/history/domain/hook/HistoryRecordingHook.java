package me.golemcore.history.domain.hook;

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
import me.golemcore.history.domain.model.HistoryRecord;
import me.golemcore.history.domain.model.LlmRequestRecord;
import me.golemcore.history.domain.model.LlmResponse;
import me.golemcore.history.domain.model.LlmResponseRecord;
import me.golemcore.history.domain.model.Message;
import me.golemcore.history.domain.model.TokenSource;
import me.golemcore.history.domain.model.TokenUsage;
import me.golemcore.history.domain.model.TokenUsageRecord;
import me.golemcore.history.domain.service.CostCalculator;
import me.golemcore.history.domain.service.HistoryWriteDispatcher;
import me.golemcore.history.domain.service.TokenUsageTracker;
import me.golemcore.history.domain.session.SessionContext;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.HistoryStoragePort;
import me.golemcore.history.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Records every LLM call as history: the request before it is sent, then either
 * the response with its token usage and cost, or an error response.
 *
 * <p>
 * Requests in flight are kept in a pending map keyed by request id until their
 * response or error arrives. Entries whose call never completes are evicted
 * after {@code history.hook.pending-ttl}; their request record stays on disk as
 * the only trace of the attempt.
 *
 * <p>
 * Writes go through {@link HistoryWriteDispatcher} and are never awaited.
 * Failures inside the hook are logged and never reach the caller.
 */
@Component
@Slf4j
public class HistoryRecordingHook implements LlmCallHook {

    private static final String LOG_PREFIX = "[HistoryHook]";
    static final String UNKNOWN_MODEL = "unknown";

    private final HistoryProperties properties;
    private final HistoryStoragePort storage;
    private final TokenUsageTracker tokenUsageTracker;
    private final CostCalculator costCalculator;
    private final HistoryWriteDispatcher writeDispatcher;
    private final Clock clock;

    private final Map<String, PendingCall> pending = new ConcurrentHashMap<>();
    private ScheduledExecutorService sweepExecutor;

    private record PendingCall(LlmRequestRecord request, Instant startedAt) {
    }

    public HistoryRecordingHook(HistoryProperties properties, HistoryStoragePort storage,
            TokenUsageTracker tokenUsageTracker, CostCalculator costCalculator,
            HistoryWriteDispatcher writeDispatcher, Clock clock) {
        this.properties = properties;
        this.storage = storage;
        this.tokenUsageTracker = tokenUsageTracker;
        this.costCalculator = costCalculator;
        this.writeDispatcher = writeDispatcher;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        Duration interval = properties.getHook().getSweepInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "history-pending-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(this::evictExpired, interval.toMillis(), interval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void destroy() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
            try {
                sweepExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!pending.isEmpty()) {
            log.debug("{} {} pending requests unresolved at shutdown", LOG_PREFIX, pending.size());
        }
    }

    /**
     * Wraps a provider so that every chat call is recorded by this hook.
     */
    public LlmPort instrument(LlmPort delegate) {
        return new HistoryRecordingLlmPortDecorator(delegate, this);
    }

    @Override
    public String beforeCall(List<Message> messages, Map<String, Object> parameters, String sessionId,
            String model, String provider, String requestId) {
        String id = requestId != null && !requestId.isBlank() ? requestId : UUID.randomUUID().toString();
        if (!properties.isEnabled()) {
            return id;
        }
        try {
            String session = sessionId != null && !sessionId.isBlank() ? sessionId
                    : SessionContext.getCurrent().orElse(null);
            if (session == null) {
                log.debug("{} No session for request {}, not recording", LOG_PREFIX, id);
                return id;
            }
            LlmRequestRecord request = LlmRequestRecord.builder()
                    .recordId(id)
                    .sessionId(session)
                    .timestamp(clock.instant())
                    .model(model != null && !model.isBlank() ? model : UNKNOWN_MODEL)
                    .provider(provider != null ? provider : "")
                    .messages(messages != null ? new ArrayList<>(messages) : new ArrayList<>())
                    .parameters(parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>())
                    .estimatedTokens(tokenUsageTracker.estimateTokens(messages))
                    .build();
            pending.put(id, new PendingCall(request, clock.instant()));
            write("llm_request " + id, List.of(request));
        } catch (RuntimeException e) { // NOSONAR - never affect the call
            log.warn("{} before_call failed for {}: {}", LOG_PREFIX, id, e.getMessage());
        }
        return id;
    }

    @Override
    public void afterCall(LlmResponse response, List<Message> messages, Map<String, Object> parameters,
            String requestId) {
        if (requestId == null) {
            return;
        }
        PendingCall call = pending.remove(requestId);
        if (call == null) {
            log.debug("{} No pending request {}, ignoring response", LOG_PREFIX, requestId);
            return;
        }
        try {
            LlmRequestRecord request = call.request();
            LlmResponse actual = response != null ? response : LlmResponse.builder().build();
            TokenUsage usage = tokenUsageTracker.extractUsage(actual.getRawPayload())
                    .orElse(actual.getUsage() != null ? actual.getUsage() : TokenUsage.zero());
            String model = actual.getModel() != null && !actual.getModel().isBlank() ? actual.getModel()
                    : request.getModel();
            Instant now = clock.instant();

            LlmResponseRecord responseRecord = LlmResponseRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .sessionId(request.getSessionId())
                    .timestamp(now)
                    .requestId(requestId)
                    .content(actual.getContent() != null ? actual.getContent() : "")
                    .finishReason(actual.getFinishReason() != null ? actual.getFinishReason() : "")
                    .tokenUsage(usage)
                    .responseTime(responseTime(actual, call, now))
                    .model(model)
                    .metadata(actual.getMetadata() != null ? new LinkedHashMap<>(actual.getMetadata())
                            : new LinkedHashMap<>())
                    .build();

            Map<String, Object> usageMetadata = new LinkedHashMap<>();
            usageMetadata.put("request_id", requestId);
            TokenUsageRecord usageRecord = TokenUsageRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .sessionId(request.getSessionId())
                    .timestamp(now)
                    .model(model)
                    .provider(request.getProvider())
                    .promptTokens(usage.getPromptTokens())
                    .completionTokens(usage.getCompletionTokens())
                    .totalTokens(usage.getTotalTokens())
                    .source(TokenSource.API)
                    .confidence(TokenUsageRecord.API_CONFIDENCE)
                    .metadata(usageMetadata)
                    .build();

            List<HistoryRecord> records = new ArrayList<>(List.of(responseRecord, usageRecord));
            try {
                CostRecord cost = costCalculator.calculateCost(usageRecord);
                records.add(cost);
            } catch (RuntimeException e) { // NOSONAR - cost is optional telemetry
                log.warn("{} Cost calculation failed for {}: {}", LOG_PREFIX, requestId, e.getMessage());
            }
            write("llm_response " + requestId, records);
        } catch (RuntimeException e) { // NOSONAR - never affect the call
            log.warn("{} after_call failed for {}: {}", LOG_PREFIX, requestId, e.getMessage());
        }
    }

    @Override
    public void onError(Throwable error, List<Message> messages, Map<String, Object> parameters,
            String requestId) {
        if (requestId == null) {
            return;
        }
        PendingCall call = pending.remove(requestId);
        if (call == null) {
            return;
        }
        try {
            LlmRequestRecord request = call.request();
            Instant now = clock.instant();
            String message = error != null && error.getMessage() != null ? error.getMessage()
                    : String.valueOf(error);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("error", message);
            metadata.put("error_type", error != null ? error.getClass().getName() : "unknown");

            LlmResponseRecord errorRecord = LlmResponseRecord.builder()
                    .recordId(UUID.randomUUID().toString())
                    .sessionId(request.getSessionId())
                    .timestamp(now)
                    .requestId(requestId)
                    .content("Error: " + message)
                    .finishReason(LlmResponseRecord.FINISH_REASON_ERROR)
                    .tokenUsage(TokenUsage.zero())
                    .responseTime(secondsBetween(call.startedAt(), now))
                    .model(request.getModel())
                    .metadata(metadata)
                    .build();
            write("llm_error " + requestId, List.of(errorRecord));
        } catch (RuntimeException e) { // NOSONAR - never affect the call
            log.warn("{} on_error failed for {}: {}", LOG_PREFIX, requestId, e.getMessage());
        }
    }

    /**
     * Drops pending requests older than the configured TTL.
     *
     * @return number of evicted entries
     */
    public int evictExpired() {
        Duration ttl = properties.getHook().getPendingTtl();
        if (ttl == null) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(ttl);
        int before = pending.size();
        pending.entrySet().removeIf(entry -> entry.getValue().startedAt().isBefore(cutoff));
        int evicted = before - pending.size();
        if (evicted > 0) {
            log.info("{} Evicted {} pending requests older than {}", LOG_PREFIX, evicted, ttl);
        }
        return Math.max(evicted, 0);
    }

    public int pendingCount() {
        return pending.size();
    }

    private void write(String description, List<? extends HistoryRecord> records) {
        writeDispatcher.submit(description, () -> {
            for (HistoryRecord record : records) {
                if (!storage.store(record)) {
                    log.warn("{} Failed to persist {} {}", LOG_PREFIX, record.getRecordType().getValue(),
                            record.getRecordId());
                }
            }
        });
    }

    private static double responseTime(LlmResponse response, PendingCall call, Instant now) {
        if (response.getResponseTime() > 0) {
            return response.getResponseTime();
        }
        return secondsBetween(call.startedAt(), now);
    }

    private static double secondsBetween(Instant start, Instant end) {
        return Math.max(0L, Duration.between(start, end).toMillis()) / 1000.0;
    }
}
