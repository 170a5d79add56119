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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-1K-token prices of one {@code provider:model} pair. A null currency means
 * the configured default currency applies.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPricing {

    private double promptPricePer1k;
    private double completionPricePer1k;
    private String currency;

    public static ModelPricing of(double promptPricePer1k, double completionPricePer1k) {
        return new ModelPricing(promptPricePer1k, completionPricePer1k, null);
    }
}
