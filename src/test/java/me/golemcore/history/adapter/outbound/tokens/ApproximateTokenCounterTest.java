package me.golemcore.history.adapter.outbound.tokens;

import me.golemcore.history.domain.model.Message;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ApproximateTokenCounterTest {

    private HistoryProperties properties;
    private ApproximateTokenCounter counter;

    @BeforeEach
    void setUp() {
        properties = new HistoryProperties();
        counter = new ApproximateTokenCounter(properties);
    }

    @Test
    void emptyListCountsZero() {
        assertEquals(0, counter.countMessagesTokens(List.of()));
        assertEquals(0, counter.countMessagesTokens(null));
    }

    @Test
    void addsPerMessageAndReplyOverhead() {
        // 8 chars / 4 = 2 tokens + 4 per message, + 3 reply priming
        assertEquals(9, counter.countMessagesTokens(List.of(Message.of("user", "abcdefgh"))));
    }

    @Test
    void roundsPartialTokensUp() {
        // ceil(5 / 4) = 2
        assertEquals(9, counter.countMessagesTokens(List.of(Message.of("user", "abcde"))));
    }

    @Test
    void sumsMessagesAndSkipsNulls() {
        List<Message> messages = Arrays.asList(
                Message.of("system", "abcd"),
                null,
                Message.of("user", null),
                Message.of("assistant", "abcdabcd"));

        // (1 + 4) + (0 + 4) + (2 + 4) + 3
        assertEquals(18, counter.countMessagesTokens(messages));
    }

    @Test
    void honorsConfiguredCharsPerToken() {
        properties.getTokens().setCharsPerToken(2.0);

        assertEquals(11, counter.countMessagesTokens(List.of(Message.of("user", "abcdefgh"))));
    }
}
