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
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Token consumption of one LLM call.
 *
 * <p>
 * Usually written twice under the same record id: first as a local estimate
 * ({@link TokenSource#LOCAL}, confidence 0.7), then reconciled against the
 * provider's usage payload ({@link TokenSource#API}, confidence 1.0).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class TokenUsageRecord extends HistoryRecord {

    public static final double LOCAL_CONFIDENCE = 0.7;
    public static final double API_CONFIDENCE = 1.0;

    private String model;
    private String provider;

    @JsonProperty("prompt_tokens")
    private int promptTokens;

    @JsonProperty("completion_tokens")
    private int completionTokens;

    @JsonProperty("total_tokens")
    private int totalTokens;

    private TokenSource source;

    private Double confidence;

    @Override
    public RecordType getRecordType() {
        return RecordType.TOKEN_USAGE;
    }

    @Override
    public void validate() {
        super.validate();
        requireNonBlank(model, "model");
        if (confidence != null && (confidence < 0.0 || confidence > 1.0)) {
            throw new IllegalArgumentException("confidence must be within [0.0, 1.0]: " + confidence);
        }
    }

    @Override
    public void applyDefaults() {
        super.applyDefaults();
        if (model == null) {
            model = "";
        }
        if (provider == null) {
            provider = "";
        }
        if (source == null) {
            source = TokenSource.LOCAL;
        }
        if (confidence == null) {
            confidence = source == TokenSource.API ? API_CONFIDENCE : LOCAL_CONFIDENCE;
        }
    }
}
