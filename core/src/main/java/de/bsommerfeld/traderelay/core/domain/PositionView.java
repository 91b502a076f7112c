package de.bsommerfeld.traderelay.core.domain;

/**
 * An open position as reported by the dashboard API.
 */
public record PositionView(String symbol, double entryPrice, double livePrice, double pnlPercent) {
}
