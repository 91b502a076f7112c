package de.bsommerfeld.traderelay.dashboard;

import de.bsommerfeld.traderelay.core.config.ApiConfig;
import de.bsommerfeld.traderelay.core.domain.TradeEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TestDashboardClientTest {

    private TestDashboardClient client;

    @BeforeEach
    void setUp() {
        client = new TestDashboardClient(new ApiConfig());
    }

    @Test
    void fetchPendingEvents_shouldServeSeededEvents() {
        List<TradeEvent> events = client.fetchPendingEvents().orElseThrow();

        assertEquals(2, events.size());
        assertEquals("ENGINE_START", events.get(0).eventType());
        assertEquals("BUY", events.get(1).eventType());
    }

    @Test
    void markEventsPosted_shouldRemoveAcknowledgedEvents() {
        List<TradeEvent> events = client.fetchPendingEvents().orElseThrow();

        assertTrue(client.markEventsPosted(List.of(events.get(0).id())));

        List<TradeEvent> remaining = client.fetchPendingEvents().orElseThrow();
        assertEquals(1, remaining.size());
        assertTrue(client.acknowledgedIds().contains(events.get(0).id()));
    }

    @Test
    void fetchPendingEvents_shouldGenerateEventEveryThirdPoll() {
        client.fetchPendingEvents();
        client.fetchPendingEvents();
        List<TradeEvent> third = client.fetchPendingEvents().orElseThrow();

        assertEquals(3, third.size());
        assertEquals("HOURLY_SUMMARY", third.get(2).eventType());
    }

    @Test
    void portfolioQueries_shouldReturnData() {
        assertTrue(client.fetchPortfolioSummary().isPresent());
        assertFalse(client.fetchPositions().orElseThrow().isEmpty());
        assertFalse(client.fetchDecisions(3).orElseThrow().isEmpty());
        assertTrue(client.fetchEventStats().isPresent());
    }
}
