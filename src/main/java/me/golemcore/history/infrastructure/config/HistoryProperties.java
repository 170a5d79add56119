package me.golemcore.history.infrastructure.config;

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

import me.golemcore.history.domain.model.ModelPricing;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized configuration of the history subsystem, bound from
 * application.properties under the {@code history.*} prefix.
 *
 * <p>
 * Nested property classes:
 * <ul>
 * <li>{@link StorageProperties} - location of the JSONL session logs</li>
 * <li>{@link CostProperties} - fallback prices and currency</li>
 * <li>{@link WriterProperties} - background write queue</li>
 * <li>{@link HookProperties} - pending request correlation</li>
 * <li>{@link RetentionProperties} - periodic cleanup</li>
 * <li>{@link TokensProperties} - local token estimation</li>
 * </ul>
 *
 * <p>
 * The pricing table is keyed by {@code provider:model}, for example
 * {@code history.pricing[openai\:gpt-4].prompt-price-per1k=0.03} (the colon
 * must be escaped in a properties file).
 */
@Component
@ConfigurationProperties(prefix = "history")
@Data
public class HistoryProperties {

    private boolean enabled = true;
    private StorageProperties storage = new StorageProperties();
    private Map<String, ModelPricing> pricing = new LinkedHashMap<>();
    private CostProperties cost = new CostProperties();
    private WriterProperties writer = new WriterProperties();
    private HookProperties hook = new HookProperties();
    private RetentionProperties retention = new RetentionProperties();
    private TokensProperties tokens = new TokensProperties();

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/history";
        private String sessionsDirectory = "sessions";
    }

    @Data
    public static class CostProperties {
        private double defaultPromptPricePer1k = 0.01;
        private double defaultCompletionPricePer1k = 0.03;
        private String currency = "USD";
    }

    @Data
    public static class WriterProperties {
        private int queueCapacity = 1000;
        private Duration shutdownTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class HookProperties {
        private Duration pendingTtl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class RetentionProperties {
        private boolean enabled = false;
        private int days = 30;
        private Duration interval = Duration.ofHours(24);
    }

    @Data
    public static class TokensProperties {
        private double charsPerToken = 4.0;
        private int tokensPerMessage = 4;
        private int replyPrimingTokens = 3;
    }
}
