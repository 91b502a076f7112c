package de.bsommerfeld.traderelay.agent;

import de.bsommerfeld.traderelay.core.domain.DecisionView;
import de.bsommerfeld.traderelay.core.domain.PortfolioSnapshot;
import de.bsommerfeld.traderelay.core.domain.PositionView;

import java.util.List;
import java.util.Optional;

/**
 * Data gathered to answer one question. Built fresh per question; a section
 * whose fetch failed is empty.
 */
public record QueryContext(
        Optional<PortfolioSnapshot> portfolio,
        List<PositionView> positions,
        List<DecisionView> decisions) {

    public QueryContext {
        portfolio = portfolio == null ? Optional.empty() : portfolio;
        positions = positions == null ? List.of() : List.copyOf(positions);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public static QueryContext empty() {
        return new QueryContext(Optional.empty(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return portfolio.isEmpty() && positions.isEmpty() && decisions.isEmpty();
    }
}
