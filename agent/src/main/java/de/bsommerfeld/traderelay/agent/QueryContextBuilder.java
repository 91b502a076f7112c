package de.bsommerfeld.traderelay.agent;

import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;
import de.bsommerfeld.traderelay.core.util.TextBounds;

import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link QueryContext} into the plain-text data block that is
 * handed to the model ahead of the user's question.
 *
 * <pre>
 * TRADING SYSTEM DATA:
 *
 * Portfolio: 2/5 positions | Invested: $... | ...
 *
 * Open positions:
 *   BTCUSDT: entry $64000.00, now $65000.00 (+1.6%)
 *
 * Recent decisions:
 *   ETHUSDT: HOLD conf:0.62 — waiting for breakout
 * </pre>
 *
 * Sections without data are left out. The whole block is capped at
 * {@link #CONTEXT_MAX} characters so the prompt stays well inside the
 * model's context window.
 */
@Singleton
public class QueryContextBuilder {

    static final int CONTEXT_MAX = 4000;
    static final String HEADER = "TRADING SYSTEM DATA:\n\n";

    private static final int POSITIONS_SHOWN = 5;
    private static final int DECISIONS_SHOWN = 3;
    private static final int REASONING_MAX = 120;

    public String build(QueryContext context) {
        StringBuilder sb = new StringBuilder(HEADER);
        context.portfolio().ifPresent(p -> sb.append(portfolioLine(p)).append("\n\n"));
        appendPositions(sb, context.positions());
        appendDecisions(sb, context.decisions());
        return TextBounds.truncate(sb.toString(), CONTEXT_MAX);
    }

    static String portfolioLine(PortfolioSnapshot p) {
        return String.format(Locale.ROOT,
                "Portfolio: %d/%d positions | Invested: $%.2f | Available: $%.2f | "
                        + "Unrealized: $%.2f (%.1f%%) | Realized: $%.2f | Win rate: %.1f%% (%d trades)",
                p.openCount(), p.maxPositions(), p.totalInvested(), p.availableCapital(),
                p.unrealizedPnl(), p.unrealizedPnlPercent(), p.realizedPnl(), p.winRate(), p.totalTrades());
    }

    /** Appends the positions section followed by a blank line, if there are positions. */
    static void appendPositions(StringBuilder sb, List<PositionView> positions) {
        if (positions.isEmpty()) {
            return;
        }
        sb.append("Open positions:\n");
        for (PositionView pos : positions.subList(0, Math.min(POSITIONS_SHOWN, positions.size()))) {
            sb.append(String.format(Locale.ROOT, "  %s: entry $%.2f, now $%.2f (%+.1f%%)",
                    pos.symbol(), pos.entryPrice(), pos.livePrice(), pos.pnlPercent())).append('\n');
        }
        sb.append('\n');
    }

    /** Appends the decisions section followed by a blank line, if there are decisions. */
    static void appendDecisions(StringBuilder sb, List<DecisionView> decisions) {
        if (decisions.isEmpty()) {
            return;
        }
        sb.append("Recent decisions:\n");
        for (DecisionView d : decisions.subList(0, Math.min(DECISIONS_SHOWN, decisions.size()))) {
            sb.append("  ").append(d.symbol()).append(": ").append(d.action())
                    .append(" conf:").append(d.confidence())
                    .append(" — ").append(TextBounds.truncate(d.reasoning(), REASONING_MAX))
                    .append('\n');
        }
        sb.append('\n');
    }
}
