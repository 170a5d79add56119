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

import me.golemcore.history.domain.model.LlmResponse;
import me.golemcore.history.domain.model.Message;

import java.util.List;
import java.util.Map;

/**
 * Lifecycle callbacks around one outbound LLM call. Implementations must not
 * throw: the call path relies on hooks being invisible when they fail.
 */
public interface LlmCallHook {

    /**
     * Called before the request is sent.
     *
     * @param requestId
     *            correlation id, generated when {@code null}
     * @return the correlation id to pass to {@link #afterCall} or
     *         {@link #onError}
     */
    String beforeCall(List<Message> messages, Map<String, Object> parameters, String sessionId, String model,
            String provider, String requestId);

    void afterCall(LlmResponse response, List<Message> messages, Map<String, Object> parameters,
            String requestId);

    void onError(Throwable error, List<Message> messages, Map<String, Object> parameters, String requestId);
}
