package de.bsommerfeld.traderelay.core.domain;

/**
 * A recent decision of the engine's analysis step.
 */
public record DecisionView(String symbol, String action, String confidence, String reasoning) {
}
