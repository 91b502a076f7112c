package de.bsommerfeld.traderelay.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static de.bsommerfeld.traderelay.core.util.JsonFields.first;
import static de.bsommerfeld.traderelay.core.util.JsonFields.integer;
import static de.bsommerfeld.traderelay.core.util.JsonFields.number;
import static de.bsommerfeld.traderelay.core.util.JsonFields.text;

/**
 * Maps the {@code data} member of dashboard responses onto domain records.
 *
 * <p>
 * Both spellings seen in the wild are accepted: the snake_case columns the
 * engine's tables use and the camelCase keys the dashboard handlers emit.
 * Missing numbers become {@code 0}, missing labels {@code "?"}.
 */
final class DashboardPayloads {

    private static final Logger LOG = LoggerFactory.getLogger(DashboardPayloads.class);

    private DashboardPayloads() {
    }

    /**
     * Parses pending events. {@code data} is either the event array itself or
     * an object wrapping it under {@code events}. Entries without a numeric id
     * cannot be acknowledged and are skipped.
     */
    static List<TradeEvent> events(JsonNode data, ObjectMapper mapper) {
        JsonNode array = data != null && data.isArray() ? data : data == null ? null : data.path("events");
        List<TradeEvent> events = new ArrayList<>();
        if (array == null || !array.isArray()) {
            return events;
        }
        for (JsonNode entry : array) {
            JsonNode id = first(entry, "id");
            if (id == null || !(id.canConvertToLong() || isNumericText(id))) {
                LOG.warn("Skipping event without usable id: {}", entry);
                continue;
            }
            events.add(new TradeEvent(
                    id.isTextual() ? Long.parseLong(id.asText().trim()) : id.asLong(),
                    text(entry, null, "event_type", "eventType"),
                    text(entry, null, "symbol"),
                    MetadataDecoder.decode(first(entry, "metadata", "data"), mapper),
                    text(entry, "", "created_at", "createdAt")));
        }
        return events;
    }

    static PortfolioSnapshot portfolio(JsonNode data) {
        return new PortfolioSnapshot(
                integer(data, 0, "open_count", "openPositions"),
                integer(data, 5, "max_positions", "maxPositions"),
                number(data, 0, "total_invested", "totalInvested"),
                number(data, 0, "available_capital", "availableCapital"),
                number(data, 0, "unrealized_pnl", "unrealizedPnl"),
                number(data, 0, "unrealized_pnl_percent", "unrealizedPnlPercent"),
                number(data, 0, "realized_pnl", "realizedPnl", "totalPnl"),
                number(data, 0, "win_rate", "winRate"),
                integer(data, 0, "total_trades", "totalTrades", "totalClosed"),
                data);
    }

    static List<PositionView> positions(JsonNode data) {
        List<PositionView> positions = new ArrayList<>();
        if (data == null || !data.isArray()) {
            return positions;
        }
        for (JsonNode pos : data) {
            positions.add(new PositionView(
                    text(pos, "?", "symbol"),
                    number(pos, 0, "avg_entry_price", "entryPrice"),
                    number(pos, 0, "live_price", "currentPrice", "current_price"),
                    number(pos, 0, "live_pnl_percent", "pnlPercent")));
        }
        return positions;
    }

    static List<DecisionView> decisions(JsonNode data) {
        List<DecisionView> decisions = new ArrayList<>();
        if (data == null || !data.isArray()) {
            return decisions;
        }
        for (JsonNode d : data) {
            decisions.add(new DecisionView(
                    text(d, "?", "symbol"),
                    text(d, "?", "action", "decision"),
                    text(d, "?", "confidence"),
                    text(d, "", "reasoning")));
        }
        return decisions;
    }

    private static boolean isNumericText(JsonNode node) {
        if (!node.isTextual()) {
            return false;
        }
        try {
            Long.parseLong(node.asText().trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
