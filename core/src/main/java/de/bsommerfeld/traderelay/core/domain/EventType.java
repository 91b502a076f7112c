package de.bsommerfeld.traderelay.core.domain;

import java.util.Optional;

/**
 * Event types the trading engine emits that have a dedicated message
 * template. The engine may emit others (e.g. {@code ALERT}); those have no
 * constant here and are rendered generically.
 */
public enum EventType {

    BUY,
    SELL,
    DCA,
    PARTIAL_EXIT,
    CIRCUIT_BREAKER,
    HOURLY_SUMMARY,
    ENGINE_START,
    ENGINE_STOP;

    /**
     * Looks up the constant for a raw upstream type string. The engine emits
     * upper-case names; any other spelling has no template.
     */
    public static Optional<EventType> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(raw));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
