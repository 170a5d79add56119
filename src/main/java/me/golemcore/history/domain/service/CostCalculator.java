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
import me.golemcore.history.domain.model.ModelPricing;
import me.golemcore.history.domain.model.TokenUsageRecord;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Prices token usage from the per-1k-token table in {@code history.pricing},
 * keyed by {@code provider:model}. Unknown models fall back to the default
 * prices from {@code history.cost}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CostCalculator {

    private static final String LOG_PREFIX = "[Cost]";

    private final HistoryProperties properties;

    /**
     * Derives a cost record from token usage. The result shares the usage
     * record's session id and timestamp.
     */
    public CostRecord calculateCost(TokenUsageRecord usage) {
        if (usage == null) {
            throw new IllegalArgumentException("token usage must not be null");
        }
        String key = pricingKey(usage.getProvider(), usage.getModel());
        ModelPricing configured = properties.getPricing().get(key);
        ModelPricing pricing = configured != null ? configured : defaultPricing();
        if (configured == null) {
            log.debug("{} No pricing for {}, using defaults", LOG_PREFIX, key);
        }

        double promptCost = usage.getPromptTokens() / 1000.0 * pricing.getPromptPricePer1k();
        double completionCost = usage.getCompletionTokens() / 1000.0 * pricing.getCompletionPricePer1k();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("usage_record_id", usage.getRecordId());
        metadata.put("pricing_source", configured != null ? "table" : "default");
        metadata.put("prompt_price_per_1k", pricing.getPromptPricePer1k());
        metadata.put("completion_price_per_1k", pricing.getCompletionPricePer1k());

        return CostRecord.builder()
                .recordId(UUID.randomUUID().toString())
                .sessionId(usage.getSessionId())
                .timestamp(usage.getTimestamp())
                .model(usage.getModel())
                .provider(usage.getProvider())
                .promptTokens(usage.getPromptTokens())
                .completionTokens(usage.getCompletionTokens())
                .totalTokens(usage.getTotalTokens())
                .promptCost(promptCost)
                .completionCost(completionCost)
                .totalCost(promptCost + completionCost)
                .currency(currencyOf(pricing))
                .metadata(metadata)
                .build();
    }

    public boolean hasPricing(String provider, String model) {
        return properties.getPricing().containsKey(pricingKey(provider, model));
    }

    static String pricingKey(String provider, String model) {
        return (provider != null ? provider : "") + ":" + (model != null ? model : "");
    }

    private ModelPricing defaultPricing() {
        HistoryProperties.CostProperties cost = properties.getCost();
        return ModelPricing.of(cost.getDefaultPromptPricePer1k(), cost.getDefaultCompletionPricePer1k());
    }

    private String currencyOf(ModelPricing pricing) {
        if (pricing.getCurrency() != null && !pricing.getCurrency().isBlank()) {
            return pricing.getCurrency();
        }
        String currency = properties.getCost().getCurrency();
        return currency != null && !currency.isBlank() ? currency : CostRecord.DEFAULT_CURRENCY;
    }
}
