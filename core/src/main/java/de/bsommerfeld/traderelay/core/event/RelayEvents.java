package de.bsommerfeld.traderelay.core.event;

import de.bsommerfeld.traderelay.core.domain.InboundMessage;

/**
 * Events crossing module boundaries. Only events that one module produces
 * and another consumes belong here.
 */
public class RelayEvents {

    /** A new message appeared in the query channel. */
    public record InboundMessageEvent(InboundMessage message) {
    }
}
