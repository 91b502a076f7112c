package de.bsommerfeld.traderelay.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonFieldsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode json(String raw) throws Exception {
        return mapper.readTree(raw);
    }

    @Test
    void text_shouldUseFirstPresentAlias() throws Exception {
        JsonNode node = json("{\"openPositions\": 3}");
        assertEquals("3", JsonFields.text(node, "?", "open_count", "openPositions"));
    }

    @Test
    void text_shouldSkipNullValues() throws Exception {
        JsonNode node = json("{\"live_price\": null, \"currentPrice\": 12.5}");
        assertEquals("12.5", JsonFields.text(node, "?", "live_price", "currentPrice"));
    }

    @Test
    void text_shouldFallBackWhenAbsent() throws Exception {
        assertEquals("?", JsonFields.text(json("{}"), "?", "price"));
    }

    @Test
    void text_shouldFallBackForNonObject() throws Exception {
        assertEquals("?", JsonFields.text(json("\"not an object\""), "?", "price"));
        assertEquals("?", JsonFields.text(null, "?", "price"));
    }

    @Test
    void text_shouldWriteSmallAndLargeDecimalsPlainly() throws Exception {
        JsonNode node = json("{\"price\": 0.0005, \"capital\": 12500000.0, \"pnl\": -0.00015}");

        assertEquals("0.0005", JsonFields.text(node, "?", "price"));
        assertEquals("12500000.0", JsonFields.text(node, "?", "capital"));
        assertEquals("-0.00015", JsonFields.text(node, "?", "pnl"));
    }

    @Test
    void text_shouldKeepOrdinaryDecimalsAsSent() throws Exception {
        JsonNode node = json("{\"price\": 3100.25, \"capital\": 1000.0, \"symbols\": 4}");

        assertEquals("3100.25", JsonFields.text(node, "?", "price"));
        assertEquals("1000.0", JsonFields.text(node, "?", "capital"));
        assertEquals("4", JsonFields.text(node, "?", "symbols"));
    }

    @Test
    void number_shouldParseNumericStrings() throws Exception {
        assertEquals(42.5, JsonFields.number(json("{\"pnl\": \"42.5\"}"), 0, "pnl"), 0.0001);
    }

    @Test
    void number_shouldFallBackForGarbage() throws Exception {
        assertEquals(0.0, JsonFields.number(json("{\"pnl\": \"lots\"}"), 0, "pnl"), 0.0001);
        assertEquals(0.0, JsonFields.number(json("{\"pnl\": [1]}"), 0, "pnl"), 0.0001);
    }

    @Test
    void integer_shouldTruncateDecimals() throws Exception {
        assertEquals(4, JsonFields.integer(json("{\"n\": 4.9}"), 0, "n"));
    }
}
