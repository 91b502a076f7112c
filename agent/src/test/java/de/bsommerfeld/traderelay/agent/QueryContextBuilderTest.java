package de.bsommerfeld.traderelay.agent;

import com.fasterxml.jackson.databind.node.MissingNode;
import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class QueryContextBuilderTest {

    private final QueryContextBuilder builder = new QueryContextBuilder();

    static PortfolioSnapshot portfolio() {
        return new PortfolioSnapshot(2, 5, 400, 600, 12.5, 3.125, -4, 55.56, 9, MissingNode.getInstance());
    }

    @Test
    void build_shouldRenderAllSections() {
        QueryContext context = new QueryContext(Optional.of(portfolio()),
                List.of(new PositionView("BTCUSDT", 64000, 65000, 1.5625)),
                List.of(new DecisionView("ETHUSDT", "HOLD", "0.62", "waiting for breakout")));

        String text = builder.build(context);

        assertEquals("TRADING SYSTEM DATA:\n\n"
                + "Portfolio: 2/5 positions | Invested: $400.00 | Available: $600.00 | "
                + "Unrealized: $12.50 (3.1%) | Realized: $-4.00 | Win rate: 55.6% (9 trades)\n\n"
                + "Open positions:\n"
                + "  BTCUSDT: entry $64000.00, now $65000.00 (+1.6%)\n\n"
                + "Recent decisions:\n"
                + "  ETHUSDT: HOLD conf:0.62 — waiting for breakout\n\n", text);
    }

    @Test
    void build_shouldOmitMissingSections() {
        QueryContext context = new QueryContext(Optional.empty(),
                List.of(new PositionView("SOL", 150, 140, -6.67)), List.of());

        String text = builder.build(context);

        assertFalse(text.contains("Portfolio:"));
        assertFalse(text.contains("Recent decisions"));
        assertTrue(text.contains("  SOL: entry $150.00, now $140.00 (-6.7%)"));
    }

    @Test
    void build_shouldShowAtMostThreeDecisionsWithShortReasoning() {
        List<DecisionView> decisions = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            decisions.add(new DecisionView("SYM" + i, "BUY", "0.9", "x".repeat(300)));
        }

        String text = builder.build(new QueryContext(Optional.empty(), List.of(), decisions));

        assertTrue(text.contains("SYM2"));
        assertFalse(text.contains("SYM3"));
        assertFalse(text.contains("x".repeat(121)));
    }

    @Test
    void build_shouldCapContextLength() {
        List<DecisionView> decisions = List.of(
                new DecisionView("A".repeat(3000), "BUY", "1", "r"),
                new DecisionView("B".repeat(3000), "BUY", "1", "r"));

        String text = builder.build(new QueryContext(Optional.empty(), List.of(), decisions));

        assertEquals(QueryContextBuilder.CONTEXT_MAX, text.length());
    }

    @Test
    void build_shouldRenderOnlyHeaderForEmptyContext() {
        assertEquals(QueryContextBuilder.HEADER, builder.build(QueryContext.empty()));
    }
}
