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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

/**
 * Result of an LLM call. {@code requestId} references the
 * {@link LlmRequestRecord} of the same call; responses whose request is missing
 * (for example after a restart) are still valid.
 *
 * <p>
 * Failed calls are recorded with {@code finish_reason = "error"}, zero token
 * usage and the error message in both content and metadata.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class LlmResponseRecord extends HistoryRecord {

    public static final String FINISH_REASON_ERROR = "error";

    @JsonProperty("request_id")
    private String requestId;

    private String content;

    @JsonProperty("finish_reason")
    private String finishReason;

    @JsonProperty("token_usage")
    @Builder.Default
    private TokenUsage tokenUsage = TokenUsage.zero();

    @JsonProperty("response_time")
    private double responseTime; // seconds

    private String model;

    @Override
    public RecordType getRecordType() {
        return RecordType.LLM_RESPONSE;
    }

    @JsonIgnore
    public boolean isError() {
        return FINISH_REASON_ERROR.equals(finishReason);
    }

    @Override
    public void validate() {
        super.validate();
        requireNonBlank(requestId, "request_id");
    }

    @Override
    public void applyDefaults() {
        super.applyDefaults();
        if (requestId == null) {
            requestId = "";
        }
        if (content == null) {
            content = "";
        }
        if (finishReason == null) {
            finishReason = "";
        }
        if (tokenUsage == null) {
            tokenUsage = TokenUsage.zero();
        }
        if (model == null) {
            model = "";
        }
    }
}
