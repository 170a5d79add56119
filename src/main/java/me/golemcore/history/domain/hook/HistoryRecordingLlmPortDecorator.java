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

import me.golemcore.history.domain.model.LlmRequest;
import me.golemcore.history.domain.model.LlmResponse;
import me.golemcore.history.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Decorator that drives a {@link LlmCallHook} around each chat call. The
 * delegate's result or failure is passed through unchanged.
 */
class HistoryRecordingLlmPortDecorator implements LlmPort {

    private static final Logger log = LoggerFactory.getLogger(HistoryRecordingLlmPortDecorator.class);

    private final LlmPort delegate;
    private final LlmCallHook hook;

    HistoryRecordingLlmPortDecorator(LlmPort delegate, LlmCallHook hook) {
        this.delegate = delegate;
        this.hook = hook;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        String model = request.getModel() != null ? request.getModel() : delegate.getCurrentModel();
        String requestId = hook.beforeCall(request.getMessages(), request.getParameters(), request.getSessionId(),
                model, delegate.getProviderId(), request.getRequestId());
        if (request.getRequestId() == null) {
            request.setRequestId(requestId);
        }

        CompletableFuture<LlmResponse> future;
        try {
            future = delegate.chat(request);
        } catch (RuntimeException e) {
            notifyError(e, request, requestId);
            throw e;
        }
        return future.whenComplete((response, error) -> {
            if (error != null) {
                notifyError(unwrap(error), request, requestId);
            } else {
                try {
                    hook.afterCall(response, request.getMessages(), request.getParameters(), requestId);
                } catch (Exception e) { // NOSONAR
                    log.warn("[HistoryHook] after_call failed: {}", e.getMessage());
                }
            }
        });
    }

    @Override
    public String getCurrentModel() {
        return delegate.getCurrentModel();
    }

    private void notifyError(Throwable error, LlmRequest request, String requestId) {
        try {
            hook.onError(error, request.getMessages(), request.getParameters(), requestId);
        } catch (Exception e) { // NOSONAR
            log.warn("[HistoryHook] on_error failed: {}", e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException)
                && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
