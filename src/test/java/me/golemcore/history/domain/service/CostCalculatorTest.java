package me.golemcore.history.domain.service;

import me.golemcore.history.domain.model.CostRecord;
import me.golemcore.history.domain.model.ModelPricing;
import me.golemcore.history.domain.model.TokenSource;
import me.golemcore.history.domain.model.TokenUsageRecord;
import me.golemcore.history.infrastructure.config.HistoryProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CostCalculatorTest {

    private static final double DELTA = 1e-9;
    private static final Instant RECORDED_AT = Instant.parse("2026-03-15T10:00:00Z");

    private HistoryProperties properties;
    private CostCalculator calculator;

    @BeforeEach
    void setUp() {
        properties = new HistoryProperties();
        properties.getPricing().put("openai:gpt-4", ModelPricing.of(0.01, 0.03));
        calculator = new CostCalculator(properties);
    }

    @Test
    void pricesFromTable() {
        CostRecord cost = calculator.calculateCost(usage("openai", "gpt-4", 1000, 1000));

        assertEquals(0.01, cost.getPromptCost(), DELTA);
        assertEquals(0.03, cost.getCompletionCost(), DELTA);
        assertEquals(0.04, cost.getTotalCost(), DELTA);
        assertEquals("USD", cost.getCurrency());
        assertEquals("table", cost.getMetadata().get("pricing_source"));
    }

    @Test
    void inheritsSessionAndTimestampFromUsage() {
        TokenUsageRecord usage = usage("openai", "gpt-4", 10, 20);

        CostRecord cost = calculator.calculateCost(usage);

        assertEquals("s1", cost.getSessionId());
        assertEquals(RECORDED_AT, cost.getTimestamp());
        assertNotEquals(usage.getRecordId(), cost.getRecordId());
        assertEquals(usage.getRecordId(), cost.getMetadata().get("usage_record_id"));
        assertEquals(10, cost.getPromptTokens());
        assertEquals(20, cost.getCompletionTokens());
        assertEquals(30, cost.getTotalTokens());
    }

    @Test
    void fallsBackToDefaultPrices() {
        CostRecord cost = calculator.calculateCost(usage("acme", "mystery-1", 2000, 500));

        assertEquals(0.02, cost.getPromptCost(), DELTA);
        assertEquals(0.015, cost.getCompletionCost(), DELTA);
        assertEquals(0.035, cost.getTotalCost(), DELTA);
        assertEquals("default", cost.getMetadata().get("pricing_source"));
    }

    @Test
    void usesConfiguredDefaultPrices() {
        properties.getCost().setDefaultPromptPricePer1k(1.0);
        properties.getCost().setDefaultCompletionPricePer1k(2.0);

        CostRecord cost = calculator.calculateCost(usage("acme", "mystery-1", 1000, 1000));

        assertEquals(3.0, cost.getTotalCost(), DELTA);
    }

    @Test
    void pricingCurrencyOverridesConfiguredCurrency() {
        properties.getCost().setCurrency("GBP");
        properties.getPricing().put("mistral:large", new ModelPricing(0.002, 0.006, "EUR"));

        assertEquals("EUR", calculator.calculateCost(usage("mistral", "large", 1, 1)).getCurrency());
        assertEquals("GBP", calculator.calculateCost(usage("openai", "gpt-4", 1, 1)).getCurrency());
    }

    @Test
    void zeroTokensCostNothing() {
        CostRecord cost = calculator.calculateCost(usage("openai", "gpt-4", 0, 0));

        assertEquals(0.0, cost.getTotalCost(), DELTA);
    }

    @Test
    void rejectsNullUsage() {
        assertThrows(IllegalArgumentException.class, () -> calculator.calculateCost(null));
    }

    @Test
    void reportsWhetherPricingIsConfigured() {
        assertTrue(calculator.hasPricing("openai", "gpt-4"));
        assertFalse(calculator.hasPricing("openai", "gpt-3"));
    }

    private static TokenUsageRecord usage(String provider, String model, int prompt, int completion) {
        return TokenUsageRecord.builder()
                .recordId("u-" + model)
                .sessionId("s1")
                .timestamp(RECORDED_AT)
                .model(model)
                .provider(provider)
                .promptTokens(prompt)
                .completionTokens(completion)
                .totalTokens(prompt + completion)
                .source(TokenSource.API)
                .confidence(1.0)
                .build();
    }
}
