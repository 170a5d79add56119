package me.golemcore.history;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the session history service.
 *
 * <p>
 * Records the lifecycle of an LLM agent session as append-only JSONL history:
 * messages, tool calls, LLM requests and responses, token usage and cost.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>JSONL storage</b> - one file per session and month, crash-tolerant
 * reads</li>
 * <li><b>Token reconciliation</b> - local estimates replaced by OpenAI, Gemini
 * or Anthropic usage payloads</li>
 * <li><b>Cost tracking</b> - per-1k-token pricing table with defaults</li>
 * <li><b>Queries and statistics</b> - filtering, pagination, per-model
 * breakdowns, export</li>
 * <li><b>Call instrumentation</b> - LLM port decorator with background
 * writes</li>
 * </ul>
 *
 * @see me.golemcore.history.domain.service.HistoryManager
 * @see me.golemcore.history.domain.hook.HistoryRecordingHook
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class HistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(HistoryApplication.class, args);
    }

}
