package de.bsommerfeld.traderelay.core.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.Optional;

/**
 * A trade-lifecycle fact fetched from the dashboard API. Read-only for the
 * relay; it leaves the pending state upstream only when its id is
 * acknowledged.
 *
 * @param id        upstream id, unique and increasing per engine
 * @param eventType raw type string as emitted, e.g. {@code SELL}
 * @param symbol    trading pair, {@code null} for engine-level events
 * @param metadata  type-dependent payload. An object when it could be
 *                  decoded, a text node holding the original string when it
 *                  could not, a missing node when absent
 * @param createdAt creation timestamp as sent by the engine, may be empty
 */
public record TradeEvent(
        long id,
        String eventType,
        String symbol,
        JsonNode metadata,
        String createdAt) {

    public TradeEvent {
        if (metadata == null) {
            metadata = MissingNode.getInstance();
        }
        if (createdAt == null) {
            createdAt = "";
        }
    }

    public Optional<EventType> type() {
        return EventType.parse(eventType);
    }
}
