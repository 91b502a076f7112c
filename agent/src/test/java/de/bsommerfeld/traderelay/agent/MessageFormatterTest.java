package de.bsommerfeld.traderelay.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import de.bsommerfeld.traderelay.core.util.TextBounds;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MessageFormatterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TemplateFormatter templates = new TemplateFormatter();

    @Mock
    private TextGenerator generator;

    private MessageFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new MessageFormatter(generator, templates, new QueryContextBuilder());
    }

    private TradeEvent sell() throws Exception {
        return new TradeEvent(7, "SELL", "BTC",
                mapper.readTree("{\"price\":65000,\"pnl\":120.5,\"pnl_percent\":1.8}"), "2024-05-01T12:00:00Z");
    }

    // -- Events --

    @Test
    void formatEvent_shouldPreferGeneratedText() throws Exception {
        when(generator.generate(anyString(), eq(MessageFormatter.EVENT_TOKENS)))
                .thenReturn(Optional.of("🔴 Sold BTC for a $120.50 profit"));

        assertEquals("🔴 Sold BTC for a $120.50 profit", formatter.formatEvent(sell()));
    }

    @Test
    void formatEvent_shouldEqualTemplateWhenGenerationFails() throws Exception {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.empty());

        assertEquals(templates.format(sell()), formatter.formatEvent(sell()));
    }

    @Test
    void formatEvent_shouldBoundGeneratedText() throws Exception {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.of("y".repeat(2000)));

        assertEquals(TextBounds.EVENT_MESSAGE_MAX, formatter.formatEvent(sell()).length());
    }

    @Test
    void formatEvent_shouldPromptWithEventFields() throws Exception {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.empty());
        TradeEvent noSymbol = new TradeEvent(8, "ENGINE_STOP", null, mapper.readTree("{\"cycle_count\":3}"), "t0");

        formatter.formatEvent(noSymbol);

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generator).generate(prompt.capture(), eq(MessageFormatter.EVENT_TOKENS));
        assertTrue(prompt.getValue().contains("Type: ENGINE_STOP"));
        assertTrue(prompt.getValue().contains("Symbol: N/A"));
        assertTrue(prompt.getValue().contains("Data: {\"cycle_count\":3}"));
        assertTrue(prompt.getValue().contains("Time: t0"));
    }

    // -- Queries --

    @Test
    void answerQuery_shouldPromptWithContextAndQuestion() {
        when(generator.generate(anyString(), eq(MessageFormatter.QUERY_TOKENS))).thenReturn(Optional.of("All good."));
        QueryContext context = new QueryContext(Optional.empty(),
                List.of(new PositionView("BTCUSDT", 1, 2, 100)), List.of());

        assertEquals("All good.", formatter.answerQuery("how are we doing?", context));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(generator).generate(prompt.capture(), eq(MessageFormatter.QUERY_TOKENS));
        assertTrue(prompt.getValue().contains("TRADING SYSTEM DATA:"));
        assertTrue(prompt.getValue().contains("BTCUSDT"));
        assertTrue(prompt.getValue().endsWith("User question: how are we doing?"));
    }

    @Test
    void answerQuery_shouldBoundGeneratedAnswer() {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.of("z".repeat(5000)));

        assertEquals(TextBounds.QUERY_ANSWER_MAX, formatter.answerQuery("q", QueryContext.empty()).length());
    }

    @Test
    void answerQuery_shouldFallBackToRawPortfolio() throws Exception {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.empty());
        PortfolioSnapshot portfolio = new PortfolioSnapshot(1, 5, 100, 900, 0, 0, 0, 0, 0,
                mapper.readTree("{\"openPositions\":1,\"maxPositions\":5}"));
        QueryContext context = new QueryContext(Optional.of(portfolio), List.of(),
                List.of(new DecisionView("ETH", "HOLD", "0.5", "flat")));

        String answer = formatter.answerQuery("q", context);

        assertTrue(answer.startsWith("**Portfolio:**\n```json\n{"));
        assertTrue(answer.contains("\"openPositions\" : 1"));
        assertTrue(answer.contains("Recent decisions:\n  ETH: HOLD conf:0.5 — flat"));
    }

    @Test
    void answerQuery_shouldFallBackToSectionsWithoutPortfolio() {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.empty());
        QueryContext context = new QueryContext(Optional.empty(),
                List.of(new PositionView("SOL", 150, 140, -6.67)), List.of());

        String answer = formatter.answerQuery("q", context);

        assertEquals("Open positions:\n  SOL: entry $150.00, now $140.00 (-6.7%)", answer);
    }

    @Test
    void answerQuery_shouldUseFinalFallbackWhenNothingIsAvailable() {
        when(generator.generate(anyString(), anyInt())).thenReturn(Optional.empty());

        assertEquals(MessageFormatter.FINAL_FALLBACK, formatter.answerQuery("q", QueryContext.empty()));
    }

    @Test
    void rawAnswer_shouldStayWithinAnswerBound() throws Exception {
        StringBuilder big = new StringBuilder("{");
        for (int i = 0; i < 400; i++) {
            big.append(i == 0 ? "" : ",").append("\"k").append(i).append("\":").append(i);
        }
        PortfolioSnapshot portfolio = new PortfolioSnapshot(0, 0, 0, 0, 0, 0, 0, 0, 0,
                mapper.readTree(big.append('}').toString()));
        List<PositionView> positions = List.of(
                new PositionView("P".repeat(300), 1, 1, 1),
                new PositionView("Q".repeat(300), 1, 1, 1));

        String answer = formatter.rawAnswer(new QueryContext(Optional.of(portfolio), positions, List.of()));

        assertTrue(answer.length() <= TextBounds.QUERY_ANSWER_MAX);
        assertFalse(answer.isBlank());
    }
}
