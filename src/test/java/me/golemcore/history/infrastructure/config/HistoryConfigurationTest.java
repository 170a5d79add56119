package me.golemcore.history.infrastructure.config;

import me.golemcore.history.domain.model.MessageRecord;
import me.golemcore.history.domain.model.MessageType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class HistoryConfigurationTest {

    @Test
    void objectMapperWritesIsoDatesAndIgnoresUnknownFields() throws Exception {
        ObjectMapper mapper = HistoryConfiguration.objectMapper();
        MessageRecord record = MessageRecord.builder().recordId("m1").sessionId("s1")
                .timestamp(Instant.parse("2026-03-15T10:00:00Z")).messageType(MessageType.USER).content("x")
                .build();

        String json = mapper.writeValueAsString(record);
        MessageRecord back = mapper.readValue(json.replaceFirst("\\{", "{\"extra\":1,"), MessageRecord.class);

        assertTrue(json.contains("\"timestamp\":\"2026-03-15T10:00:00Z\""));
        assertEquals(record, back);
    }

    @Test
    void clockIsUtc() {
        Clock clock = HistoryConfiguration.clock();

        assertEquals(ZoneOffset.UTC, clock.getZone());
    }

    @Test
    void propertyDefaults() {
        HistoryProperties properties = new HistoryProperties();

        assertTrue(properties.isEnabled());
        assertEquals("sessions", properties.getStorage().getSessionsDirectory());
        assertEquals(0.01, properties.getCost().getDefaultPromptPricePer1k());
        assertEquals(0.03, properties.getCost().getDefaultCompletionPricePer1k());
        assertEquals("USD", properties.getCost().getCurrency());
        assertEquals(1000, properties.getWriter().getQueueCapacity());
        assertFalse(properties.getRetention().isEnabled());
        assertEquals(30, properties.getRetention().getDays());
        assertTrue(properties.getPricing().isEmpty());
    }
}
