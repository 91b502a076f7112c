package de.bsommerfeld.traderelay.agent;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PromptLoaderTest {

    @Test
    void load_shouldReturnNonEmptyContent() {
        String content = PromptLoader.load("event");
        assertNotNull(content);
        assertFalse(content.isBlank());
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = PromptLoader.load("query");
        String second = PromptLoader.load("query");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForMissingTemplate() {
        assertThrows(RuntimeException.class, () -> PromptLoader.load("nonexistent-prompt-template"));
    }

    @Test
    void loadWithVariables_shouldSubstitutePlaceholders() {
        String result = PromptLoader.load("event", Map.of(
                "TYPE", "SELL",
                "SYMBOL", "BTCUSDT",
                "DATA", "{\"price\":65000}",
                "TIME", "2024-05-01T12:00:00Z"));

        assertFalse(result.contains("{{"), "All placeholders should be replaced");
        assertTrue(result.contains("Type: SELL"));
        assertTrue(result.contains("Symbol: BTCUSDT"));
        assertTrue(result.endsWith("Time: 2024-05-01T12:00:00Z"));
    }

    @Test
    void loadWithVariables_shouldNotExpandPlaceholdersInsideValues() {
        String result = PromptLoader.load("query", Map.of(
                "CONTEXT", "",
                "QUESTION", "what is {{CONTEXT}}?"));

        assertTrue(result.endsWith("User question: what is {{CONTEXT}}?"));
    }

    @Test
    void loadWithVariables_shouldPreserveUnmatchedPlaceholders() {
        String result = PromptLoader.load("query", Map.of("QUESTION", "pnl?"));

        assertTrue(result.contains("{{CONTEXT}}"));
    }
}
