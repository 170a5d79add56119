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

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Provider-neutral result of an LLM call.
 *
 * <p>
 * {@code rawPayload} keeps the provider's original response body (as a nested
 * map) so that usage can be reconciled from provider-specific fields: OpenAI
 * {@code usage.prompt_tokens}, Gemini {@code usageMetadata.promptTokenCount}
 * or Anthropic {@code usage.input_tokens}.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private String finishReason;
    private TokenUsage usage;
    private String model;

    /** Wall-clock duration of the call in seconds. */
    private double responseTime;

    private Map<String, Object> metadata;
    private Map<String, Object> rawPayload;
}
