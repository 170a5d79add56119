package me.golemcore.history.adapter.outbound.tokens;

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

import me.golemcore.history.domain.model.Message;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import me.golemcore.history.port.outbound.TokenCounterPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Character-based token estimate for chat-style message lists.
 *
 * <p>
 * Each message costs its content length divided by
 * {@code history.tokens.chars-per-token}, rounded up, plus a fixed per-message
 * overhead for role and separators. The reply priming overhead is added once per list.
 */
@Component
@RequiredArgsConstructor
public class ApproximateTokenCounter implements TokenCounterPort {

    private final HistoryProperties properties;

    @Override
    public Integer countMessagesTokens(List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return 0;
        }
        HistoryProperties.TokensProperties tokens = properties.getTokens();
        double charsPerToken = tokens.getCharsPerToken() > 0 ? tokens.getCharsPerToken() : 4.0;
        int total = 0;
        for (Message message : messages) {
            if (message == null) {
                continue;
            }
            int chars = message.getContent() != null ? message.getContent().length() : 0;
            total += (int) Math.ceil(chars / charsPerToken) + tokens.getTokensPerMessage();
        }
        return total + tokens.getReplyPrimingTokens();
    }
}
