package de.bsommerfeld.traderelay.core.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Point-in-time portfolio summary. {@code raw} keeps the payload as received
 * so it can be shown verbatim when no answer can be generated.
 */
public record PortfolioSnapshot(
        int openCount,
        int maxPositions,
        double totalInvested,
        double availableCapital,
        double unrealizedPnl,
        double unrealizedPnlPercent,
        double realizedPnl,
        double winRate,
        int totalTrades,
        JsonNode raw) {
}
