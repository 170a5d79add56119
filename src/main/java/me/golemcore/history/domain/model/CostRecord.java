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

/**
 * Monetary cost derived from a {@link TokenUsageRecord}. Carries the usage
 * record's timestamp, so cost is attributed to the moment usage was recorded.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
@SuperBuilder(toBuilder = true)
@NoArgsConstructor
public class CostRecord extends HistoryRecord {

    public static final String DEFAULT_CURRENCY = "USD";

    private String model;
    private String provider;

    @JsonProperty("prompt_tokens")
    private int promptTokens;

    @JsonProperty("completion_tokens")
    private int completionTokens;

    @JsonProperty("total_tokens")
    private int totalTokens;

    @JsonProperty("prompt_cost")
    private double promptCost;

    @JsonProperty("completion_cost")
    private double completionCost;

    @JsonProperty("total_cost")
    private double totalCost;

    @Builder.Default
    private String currency = DEFAULT_CURRENCY;

    @Override
    public RecordType getRecordType() {
        return RecordType.COST;
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
        if (currency == null || currency.isBlank()) {
            currency = DEFAULT_CURRENCY;
        }
    }
}
