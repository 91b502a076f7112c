package de.bsommerfeld.traderelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.domain.EventType;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import de.bsommerfeld.traderelay.core.util.JsonFields;
import de.bsommerfeld.traderelay.core.util.TextBounds;

import java.util.Locale;

/**
 * Renders a trade event from a fixed template per event type. This is the
 * formatter that cannot fail: every input, including missing or
 * undecodable metadata and unknown types, yields a non-empty message of at
 * most {@link TextBounds#EVENT_MESSAGE_MAX} characters.
 *
 * <p>
 * Metadata values are printed as sent ({@code 65000} stays {@code 65000},
 * {@code 120.5} stays {@code 120.5}). A missing key prints {@code ?}.
 */
@Singleton
public class TemplateFormatter {

    private static final String MISSING = "?";
    private static final int REASONING_MAX = 100;
    private static final int GENERIC_METADATA_MAX = 200;

    public String format(TradeEvent event) {
        JsonNode meta = event.metadata().isObject()
                ? event.metadata()
                : JsonNodeFactory.instance.objectNode();
        String sym = event.symbol() == null ? "" : event.symbol();

        String text = event.type()
                .map(type -> render(type, sym, meta))
                .orElseGet(() -> renderGeneric(event, sym, meta));
        return TextBounds.truncate(text, TextBounds.EVENT_MESSAGE_MAX);
    }

    private String render(EventType type, String sym, JsonNode meta) {
        switch (type) {
            case BUY:
                return "🟢 **BUY** " + sym + " @ $" + field(meta, "price")
                        + " | Conf: " + field(meta, "confidence")
                        + " | " + TextBounds.truncate(JsonFields.text(meta, "", "reasoning"), REASONING_MAX);
            case SELL:
                return "🔴 **SELL** " + sym + " @ $" + field(meta, "price")
                        + " | P&L: $" + field(meta, "pnl")
                        + " (" + field(meta, "pnl_percent") + "%)";
            case DCA:
                return "🔵 **DCA** " + sym + " @ $" + field(meta, "price")
                        + " | New avg: $" + field(meta, "new_avg_entry");
            case PARTIAL_EXIT:
                return "💰 **PARTIAL EXIT** " + sym + " " + JsonFields.text(meta, "", "exit_percent")
                        + "% @ $" + field(meta, "price")
                        + " | P&L: $" + field(meta, "pnl");
            case CIRCUIT_BREAKER:
                return "⚠️ **CIRCUIT BREAKER** | " + field(meta, "consecutive_losses")
                        + " losses | Pausing " + field(meta, "cooldown_hours") + "h";
            case HOURLY_SUMMARY:
                return "📊 **Hourly** | " + JsonFields.text(meta, "0", "open_positions")
                        + " positions | P&L: $" + money(meta, "unrealized_pnl")
                        + " unrealized, $" + money(meta, "realized_pnl") + " realized";
            case ENGINE_START:
                return "🚀 **Engine Started** | " + field(meta, "symbols")
                        + " symbols | $" + field(meta, "capital")
                        + " capital | Paper: " + field(meta, "paper_trading");
            case ENGINE_STOP:
                return "🛑 **Engine Stopped** | " + field(meta, "cycle_count") + " cycles completed";
            default:
                return renderGeneric(type.name(), sym, meta);
        }
    }

    /** Unknown types show the decoded metadata as it came, arrays included. */
    private String renderGeneric(TradeEvent event, String sym, JsonNode meta) {
        String type = event.eventType() == null || event.eventType().isBlank() ? "UNKNOWN" : event.eventType();
        return renderGeneric(type, sym, event.metadata().isContainerNode() ? event.metadata() : meta);
    }

    private String renderGeneric(String type, String sym, JsonNode meta) {
        return "📌 **" + type + "** " + sym + " | "
                + TextBounds.truncate(meta.toString(), GENERIC_METADATA_MAX);
    }

    private static String field(JsonNode meta, String key) {
        return JsonFields.text(meta, MISSING, key);
    }

    private static String money(JsonNode meta, String key) {
        return String.format(Locale.ROOT, "%.2f", JsonFields.number(meta, 0, key));
    }
}
