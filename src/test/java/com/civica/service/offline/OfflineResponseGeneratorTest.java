package com.civica.service.offline;

import com.civica.config.CivicaProperties;
import com.civica.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for OfflineResponseGenerator.
 */
class OfflineResponseGeneratorTest {

    private MutableClock clock;
    private CivicaProperties.OfflineConfig config;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
        config = new CivicaProperties.OfflineConfig();
    }

    private OfflineResponseGenerator generator() {
        return new OfflineResponseGenerator(config, clock, new Random(1));
    }

    @Test
    void testRepeatedSummaryIsServedFromCache() {
        OfflineResponseGenerator generator = generator();

        String first = generator.generate("Generate voter sentiment analysis", "general");
        String second = generator.generate("Generate voter sentiment analysis", "general");

        assertEquals(first, second);
        OfflineResponseGenerator.OfflineStatistics stats = generator.getStatistics();
        assertEquals(0.5, stats.getCacheHitRate(), 1e-9);
        assertEquals(1, stats.getCachedResponseCount());
        assertEquals(1, stats.getGeneratedResponseCount());
    }

    @Test
    void testEntriesExpireAfterSevenDays() {
        OfflineResponseGenerator generator = generator();
        generator.generate("prompt", "general");

        clock.advance(Duration.ofDays(7));
        generator.generate("prompt", "general");

        assertEquals(2, generator.getStatistics().getGeneratedResponseCount());
    }

    @Test
    void testOldestEntryIsEvicted() {
        config.setMaxCachedResponses(2);
        OfflineResponseGenerator generator = generator();
        generator.generate("a", "general");
        generator.generate("b", "general");
        generator.generate("c", "general");

        generator.generate("b", "general");
        generator.generate("a", "general");

        assertEquals(2, generator.getStatistics().getCachedResponseCount());
        assertEquals(4, generator.getStatistics().getGeneratedResponseCount());
    }

    @Test
    void testTemplateStrategyFillsEveryPlaceholder() {
        OfflineResponseGenerator generator = generator();

        for (int i = 0; i < 20; i++) {
            String text = generator.generate("news " + i, "political_news");
            assertFalse(text.contains("{"), text);
            assertTrue(text.startsWith("Breaking:") || text.contains("addresses concerns about"), text);
        }
    }

    @Test
    void testRuleBasedStrategyUsesStarterAndConclusion() {
        OfflineResponseGenerator generator = generator();

        String text = generator.generate("What do you think about the economy?", "analysis");

        assertTrue(List.of("In my view,", "It's clear that", "We must consider", "The evidence shows",
                        "Critics argue that", "Supporters believe", "Many experts suggest")
                .stream().anyMatch(text::startsWith), text);
        assertTrue(text.endsWith("."), text);
    }

    @Test
    void testGenericSentenceWhenStrategiesDisabled() {
        config.setTemplateSystem(false);
        config.setRuleBasedGeneration(false);

        assertEquals(OfflineResponseGenerator.GENERIC_RESPONSE, generator().generate("anything", "opinion"));
    }

    @Test
    void testClassification() {
        assertEquals("economy", OfflineResponseGenerator.classifyContext("financial outlook"));
        assertEquals("environment", OfflineResponseGenerator.classifyContext("climate policy"));
        assertEquals("society", OfflineResponseGenerator.classifyContext("healthcare access"));
        assertEquals("general", OfflineResponseGenerator.classifyContext("weather"));
        assertEquals("news", OfflineResponseGenerator.classifyTone("breaking headline"));
        assertEquals("analysis", OfflineResponseGenerator.classifyTone("a research study"));
    }

    @Test
    void testPreloadAndClear() {
        OfflineResponseGenerator generator = generator();

        generator.preloadSamples();
        assertEquals(OfflineResponseGenerator.SAMPLE_PROMPTS.size(), generator.getStatistics().getCachedResponseCount());

        String cached = generator.generate(OfflineResponseGenerator.SAMPLE_PROMPTS.get(0), "general");
        assertEquals(cached, generator.generate(OfflineResponseGenerator.SAMPLE_PROMPTS.get(0), "general"));
        assertEquals(1.0, generator.getStatistics().getCacheHitRate(), 1e-9);

        generator.clear();
        assertEquals(0, generator.getStatistics().getCachedResponseCount());
        assertEquals(0.0, generator.getStatistics().getCacheHitRate());
    }
}
