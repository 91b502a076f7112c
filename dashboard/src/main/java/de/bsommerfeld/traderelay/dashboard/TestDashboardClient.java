package de.bsommerfeld.traderelay.dashboard;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.inject.Singleton;
import de.bsommerfeld.traderelay.core.config.ApiConfig;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Offline stand-in for {@link DashboardClient}, bound in TEST mode.
 *
 * <p>
 * No HTTP requests are made. Responses are assembled in memory in the same
 * shape the real endpoint returns, so the typed operations of the parent
 * class parse them unchanged. The event queue starts with an engine start
 * and one buy; every {@value #GENERATION_INTERVAL}th poll appends a
 * synthetic event to simulate engine activity. Acknowledged ids leave the
 * queue exactly as they would upstream.
 */
@Singleton
public class TestDashboardClient extends DashboardClient {

    private static final Logger LOG = LoggerFactory.getLogger(TestDashboardClient.class);

    private static final int GENERATION_INTERVAL = 3;

    private final Map<Long, ObjectNode> pending = new LinkedHashMap<>();
    private final Set<Long> acknowledged = new LinkedHashSet<>();
    private final AtomicLong nextId = new AtomicLong(1);
    private int pollCount = 0;

    @Inject
    public TestDashboardClient(ApiConfig config) {
        super(config);
        LOG.warn("#######################################################");
        LOG.warn("#  TEST MODE ENABLED: Dashboard API is DISABLED       #");
        LOG.warn("#  Serving synthetic events and portfolio data        #");
        LOG.warn("#######################################################");

        enqueue("ENGINE_START", null, metadata()
                .put("symbols", 12).put("capital", 1000).put("paper_trading", true));
        enqueue("BUY", "BTCUSDT", metadata()
                .put("price", 65000).put("confidence", 0.82)
                .put("reasoning", "Breakout above the 4h range with rising volume"));
    }

    /**
     * Appends an event to the pending queue.
     *
     * @return the id assigned to the event
     */
    public synchronized long enqueue(String eventType, String symbol, JsonNode metadata) {
        long id = nextId.getAndIncrement();
        ObjectNode event = mapper.createObjectNode();
        event.put("id", id);
        event.put("event_type", eventType);
        if (symbol != null) {
            event.put("symbol", symbol);
        }
        event.set("metadata", metadata);
        event.put("created_at", Instant.now().toString());
        pending.put(id, event);
        return id;
    }

    public synchronized Set<Long> acknowledgedIds() {
        return Set.copyOf(acknowledged);
    }

    @Override
    public synchronized Optional<JsonNode> call(DashboardAction action, Map<String, ?> params) {
        LOG.debug("[TEST] Simulating {}", action);
        JsonNode data = switch (action) {
            case GET_EVENTS -> pendingEvents();
            case MARK_EVENTS_POSTED -> markPosted(params);
            case GET_PORTFOLIO_SUMMARY -> portfolio();
            case GET_POSITIONS -> positions();
            case GET_DECISIONS -> decisions();
            case GET_EVENT_STATS -> metadata().put("pending", pending.size()).put("today_posted", acknowledged.size());
        };
        ObjectNode root = mapper.createObjectNode();
        root.put("success", true);
        root.set("data", data);
        return acceptPayload(action, root);
    }

    private JsonNode pendingEvents() {
        pollCount++;
        if (pollCount % GENERATION_INTERVAL == 0) {
            enqueue("HOURLY_SUMMARY", null, metadata()
                    .put("open_positions", 1).put("unrealized_pnl", 12.4).put("realized_pnl", 0));
        }
        ArrayNode events = mapper.createArrayNode();
        pending.values().forEach(events::add);
        return events;
    }

    private JsonNode markPosted(Map<String, ?> params) {
        int marked = 0;
        Object ids = params == null ? null : params.get("eventIds");
        if (ids instanceof Iterable<?> iterable) {
            for (Object id : iterable) {
                if (id instanceof Number number && pending.remove(number.longValue()) != null) {
                    acknowledged.add(number.longValue());
                    marked++;
                }
            }
        }
        return metadata().put("marked", marked);
    }

    private JsonNode portfolio() {
        return metadata()
                .put("open_count", 1).put("max_positions", 5)
                .put("total_invested", 200.0).put("available_capital", 800.0)
                .put("unrealized_pnl", 12.4).put("unrealized_pnl_percent", 6.2)
                .put("realized_pnl", 35.1).put("win_rate", 66.7).put("total_trades", 6);
    }

    private JsonNode positions() {
        ArrayNode positions = mapper.createArrayNode();
        positions.add(metadata()
                .put("symbol", "BTCUSDT").put("avg_entry_price", 65000)
                .put("live_price", 69030).put("live_pnl_percent", 6.2));
        return positions;
    }

    private JsonNode decisions() {
        ArrayNode decisions = mapper.createArrayNode();
        decisions.add(metadata()
                .put("symbol", "BTCUSDT").put("action", "BUY").put("confidence", 0.82)
                .put("reasoning", "Breakout above the 4h range with rising volume"));
        return decisions;
    }

    private ObjectNode metadata() {
        return mapper.createObjectNode();
    }
}
