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
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An outbound LLM call as captured before it was sent. The record id doubles as
 * the request id that later {@link LlmResponseRecord}s point back to.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class LlmRequestRecord extends HistoryRecord {

    private String model;
    private String provider;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    @JsonProperty("estimated_tokens")
    private Integer estimatedTokens;

    @Override
    public RecordType getRecordType() {
        return RecordType.LLM_REQUEST;
    }

    @Override
    public void validate() {
        super.validate();
        requireNonBlank(model, "model");
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
        if (messages == null) {
            messages = new ArrayList<>();
        }
        if (parameters == null) {
            parameters = new LinkedHashMap<>();
        }
    }
}
